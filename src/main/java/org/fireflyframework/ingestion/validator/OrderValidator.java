/*
 * Copyright 2024-2026 Firefly Software Solutions Inc
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.fireflyframework.ingestion.validator;

import org.fireflyframework.ingestion.model.EntityType;
import org.fireflyframework.ingestion.model.ErpValues;
import org.fireflyframework.ingestion.model.PurchaseOrderRecord;
import org.fireflyframework.ingestion.model.PurchaseOrderRecord.OrderLine;
import org.fireflyframework.ingestion.schema.ErpModels;
import org.fireflyframework.ingestion.schema.RecordMapping;
import org.fireflyframework.ingestion.schema.SchemaValidator;
import org.fireflyframework.ingestion.validation.CorrectionSuggestion;
import org.fireflyframework.ingestion.validation.FieldConstraints;
import org.fireflyframework.ingestion.validation.IssueCategory;
import org.fireflyframework.ingestion.validation.RecordContext;
import org.fireflyframework.ingestion.validation.ValidationReport;
import org.fireflyframework.ingestion.validation.ValidationSeverity;
import org.fireflyframework.ingestion.validation.ValidationThresholds;
import org.fireflyframework.ingestion.validation.rule.BusinessRule;
import org.fireflyframework.ingestion.validation.rule.PredicateRule;
import org.fireflyframework.ingestion.validation.rule.RuleResult;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Validates purchase orders and their lines before they are loaded as {@code purchase.order}.
 */
public class OrderValidator extends AbstractEntityValidator<PurchaseOrderRecord> {

    public static final List<String> ORDER_STATES = List.of("draft", "sent", "to approve", "purchase", "done", "cancel");

    private static final RecordMapping MAPPING = RecordMapping.create()
            .computed("name", order -> orElse(order.get("name"), order.get("order_number")))
            .copy("partner_id")
            .copy("date_order")
            .copy("date_planned")
            .computed("state", order -> orElse(order.get("state"), "draft"))
            .copy("currency_id")
            .copy("company_id")
            .computed("order_line", order -> orElse(order.get("order_line"), List.of()))
            .copy("notes")
            .copy("amount_untaxed")
            .copy("amount_tax")
            .copy("amount_total");

    public OrderValidator() {
        this(List.of());
    }

    public OrderValidator(List<? extends BusinessRule<? super PurchaseOrderRecord>> customRules) {
        this(null, ValidationThresholds.defaults(), Clock.systemUTC(), customRules);
    }

    public OrderValidator(SchemaValidator schemaValidator, ValidationThresholds thresholds, Clock clock,
                          List<? extends BusinessRule<? super PurchaseOrderRecord>> customRules) {
        super(schemaValidator, thresholds, clock, customRules);
    }

    @Override
    public EntityType getEntityType() {
        return EntityType.ORDERS;
    }

    @Override
    public String getModelName() {
        return ErpModels.PURCHASE_ORDER;
    }

    @Override
    public List<String> getRequiredFields() {
        return List.of("partner_id", "date_order", "order_line");
    }

    @Override
    protected List<String> recordIdFields() {
        return List.of("id", "name", "order_number");
    }

    @Override
    protected RecordMapping targetMapping() {
        return MAPPING;
    }

    @Override
    protected List<BusinessRule<PurchaseOrderRecord>> initializeBusinessRules() {
        List<BusinessRule<PurchaseOrderRecord>> rules = new ArrayList<>();
        rules.add(PredicateRule.<PurchaseOrderRecord>builder()
                .name("order_total_validation")
                .description("Order total should match the sum of its lines")
                .evaluator(this::checkOrderTotal)
                .severity(ValidationSeverity.ERROR)
                .build());
        rules.add(PredicateRule.<PurchaseOrderRecord>builder()
                .name("planned_date_consistency")
                .description("Planned date should not precede the order date")
                .field("date_planned")
                .predicate(order -> {
                    Optional<Instant> ordered = order.getDateOrder();
                    Optional<Instant> planned = order.getDatePlanned();
                    return ordered.isEmpty() || planned.isEmpty() || !planned.get().isBefore(ordered.get());
                })
                .message("Planned date cannot be before order date")
                .severity(ValidationSeverity.WARNING)
                .build());
        rules.add(PredicateRule.<PurchaseOrderRecord>builder()
                .name("order_date_horizon")
                .description("Order date should not be far in the future")
                .field("date_order")
                .predicate(order -> order.getDateOrder()
                        .map(date -> !date.isAfter(horizon()))
                        .orElse(true))
                .message("Order date is suspiciously far in the future")
                .severity(ValidationSeverity.WARNING)
                .build());
        rules.add(PredicateRule.<PurchaseOrderRecord>builder()
                .name("order_line_validation")
                .description("Order lines need a product, a positive quantity and a non-negative price")
                .evaluator(OrderValidator::checkOrderLines)
                .severity(ValidationSeverity.ERROR)
                .build());
        rules.add(PredicateRule.<PurchaseOrderRecord>builder()
                .name("quantity_reasonableness")
                .description("Line quantities should be plausible")
                .evaluator(this::checkQuantities)
                .severity(ValidationSeverity.WARNING)
                .build());
        return rules;
    }

    private Instant horizon() {
        return clock.instant().atOffset(ZoneOffset.UTC).plus(thresholds.getOrderDateHorizon()).toInstant();
    }

    private RuleResult checkOrderTotal(PurchaseOrderRecord order) {
        List<OrderLine> lines = order.getOrderLines();
        if (lines.isEmpty()) {
            return RuleResult.pass("order_total_validation");
        }
        double calculated = lines.stream()
                .mapToDouble(line -> valueOrZero(line.getProductQty()) * valueOrZero(line.getPriceUnit()))
                .sum();
        String field = ErpValues.isTruthy(order.getAmountUntaxed()) ? "amount_untaxed" : "amount_total";
        Double declared = order.getNumber(field);
        if (!ErpValues.isTruthy(declared) || Math.abs(calculated - declared) <= thresholds.getEpsilon()) {
            return RuleResult.pass("order_total_validation");
        }
        return RuleResult.builder()
                .ruleName("order_total_validation")
                .valid(false)
                .field(field)
                .message(String.format(Locale.ROOT, "Order total mismatch. Calculated: %.2f, Declared: %.2f",
                        calculated, declared))
                .actualValue(declared)
                .build();
    }

    private static RuleResult checkOrderLines(PurchaseOrderRecord order) {
        for (OrderLine line : order.getOrderLines()) {
            int number = line.getIndex() + 1;
            if (!ErpValues.isTruthy(line.getProductId())) {
                return lineFailure("order_line_validation", line, "product_id",
                        "Order line " + number + " missing product_id");
            }
            Double quantity = line.getProductQty();
            if (quantity == null || quantity <= 0) {
                return lineFailure("order_line_validation", line, "product_qty",
                        "Order line " + number + " has invalid quantity");
            }
            Double price = line.getPriceUnit();
            if (price == null || price < 0) {
                return lineFailure("order_line_validation", line, "price_unit",
                        "Order line " + number + " has invalid price");
            }
        }
        return RuleResult.pass("order_line_validation");
    }

    private RuleResult checkQuantities(PurchaseOrderRecord order) {
        for (OrderLine line : order.getOrderLines()) {
            Double quantity = line.getProductQty();
            if (quantity == null) {
                continue;
            }
            int number = line.getIndex() + 1;
            if (quantity > thresholds.getHighLineQuantity()) {
                return lineFailure("quantity_reasonableness", line, "product_qty",
                        "Order line " + number + " has unusually high quantity: " + format(quantity));
            }
            if (quantity % 1 != 0 && quantity < 1) {
                return lineFailure("quantity_reasonableness", line, "product_qty",
                        "Order line " + number + " has suspicious fractional quantity: " + format(quantity));
            }
        }
        return RuleResult.pass("quantity_reasonableness");
    }

    private static RuleResult lineFailure(String rule, OrderLine line, String field, String message) {
        return RuleResult.builder()
                .ruleName(rule)
                .valid(false)
                .field(line.path(field))
                .message(message)
                .actualValue(line.get(field))
                .build();
    }

    @Override
    protected void validateBasicFields(PurchaseOrderRecord order, RecordContext context) {
        validateRequired(order.get("partner_id"), "partner_id", context);
        validateDate(order.get("date_order"), "date_order", context, false);
        validateDate(order.get("date_planned"), "date_planned", context, true);
        validateString(order.get("name"), "name", context,
                FieldConstraints.builder().optional(true).maxLength(100).build());
        validateString(order.get("notes"), "notes", context,
                FieldConstraints.builder().optional(true).maxLength(2000).build());
        validateEnum(order.get("state"), "state", context, ORDER_STATES, true);

        FieldConstraints amount = FieldConstraints.builder().optional(true).min(0.0).build();
        validateNumber(order.get("amount_untaxed"), "amount_untaxed", context, amount);
        validateNumber(order.get("amount_tax"), "amount_tax", context, amount);
        validateNumber(order.get("amount_total"), "amount_total", context, amount);

        if (validateArray(order.get("order_line"), "order_line", context,
                FieldConstraints.builder().minItems(1).maxItems(100).build())) {
            order.getOrderLines().forEach(line -> validateOrderLine(line, context));
        }
    }

    private void validateOrderLine(OrderLine line, RecordContext context) {
        validateString(line.get("name"), line.path("name"), context,
                FieldConstraints.builder().minLength(1).maxLength(200).build());
        validateNumber(line.get("product_qty"), line.path("product_qty"), context,
                FieldConstraints.builder().positive(true).max(100_000.0).build());
        validateNumber(line.get("price_unit"), line.path("price_unit"), context,
                FieldConstraints.builder().min(0.0).max(1_000_000.0).build());
        validateDate(line.get("date_planned"), line.path("date_planned"), context, true);

        Double quantity = line.getProductQty();
        Double price = line.getPriceUnit();
        Double subtotal = line.getPriceSubtotal();
        if (ErpValues.isTruthy(quantity) && ErpValues.isTruthy(price) && ErpValues.isTruthy(subtotal)) {
            double expected = quantity * price;
            if (Math.abs(subtotal - expected) > thresholds.getEpsilon()) {
                context.warning(IssueCategory.DATA_QUALITY, line.path("price_subtotal"),
                        String.format(Locale.ROOT, "Line subtotal mismatch. Expected: %.2f, Got: %s",
                                expected, format(subtotal)), subtotal);
            }
        }
    }

    @Override
    protected void validateDataQuality(PurchaseOrderRecord order, RecordContext context) {
        Double total = order.getAmountTotal();
        List<OrderLine> lines = order.getOrderLines();

        if (ErpValues.isTruthy(total) && total > 100 && total % 100 == 0) {
            context.warning(IssueCategory.DATA_QUALITY, "amount_total", "Suspiciously round total amount", total);
        }
        if (lines.size() == 1) {
            Double price = lines.get(0).getPriceUnit();
            if (price != null && price > thresholds.getExpensiveSingleLine()) {
                context.warning(IssueCategory.DATA_QUALITY, lines.get(0).path("price_unit"),
                        "Single very expensive item - please verify", price);
            }
        }
        if (lines.size() > 1) {
            Set<Object> productIds = new LinkedHashSet<>();
            for (OrderLine line : lines) {
                if (line.getProductId() instanceof List<?> && !productIds.add(ErpValues.relationId(line.getProductId()))) {
                    context.warning(IssueCategory.DATA_QUALITY, line.path("product_id"),
                            "Duplicate product in order lines", line.getProductId());
                }
            }
        }

        Double untaxed = order.getAmountUntaxed();
        Double tax = order.getAmountTax();
        if (ErpValues.isTruthy(total) && ErpValues.isTruthy(untaxed) && ErpValues.isTruthy(tax)
                && Math.abs(untaxed + tax - total) > thresholds.getEpsilon()) {
            context.error(IssueCategory.DATA_QUALITY, "amount_total",
                    "Amount total inconsistency. Untaxed: " + format(untaxed) + ", Tax: " + format(tax)
                            + ", Total: " + format(total), total);
        }
        if ("done".equals(order.getState())
                && order.getDatePlanned().map(planned -> planned.isAfter(clock.instant())).orElse(false)) {
            context.warning(IssueCategory.DATA_QUALITY, "state",
                    "Order marked as done but planned date is in the future", order.getState());
        }
        if (order.get("order_line") != null && ErpValues.isTruthy(total) && total < thresholds.getLowOrderTotal()) {
            context.warning(IssueCategory.DATA_QUALITY, "amount_total",
                    "Order total is very low - may not meet minimum requirements", total);
        }

        List<String> factors = suspiciousFactors(order);
        if (factors.size() > 1) {
            context.warning(IssueCategory.DATA_QUALITY, "order",
                    "Order shows multiple suspicious patterns: " + String.join(", ", factors), factors);
        }
    }

    /**
     * Returns the risk factors present on an order. More than one marks the order suspicious.
     */
    List<String> suspiciousFactors(PurchaseOrderRecord order) {
        List<String> factors = new ArrayList<>();
        Double total = order.getAmountTotal();
        if (total != null && total > thresholds.getHighValueOrder()) {
            factors.add("high_value");
        }
        Instant futureThreshold = clock.instant().plus(thresholds.getSuspiciousFutureOrder());
        if (order.getDateOrder().map(date -> date.isAfter(futureThreshold)).orElse(false)) {
            factors.add("future_date");
        }
        List<OrderLine> lines = order.getOrderLines();
        if (lines.size() > thresholds.getMaxOrderLines()) {
            factors.add("too_many_lines");
        }
        if (ErpValues.isTruthy(total) && total % 100 == 0 && !lines.isEmpty()
                && lines.stream().allMatch(line -> line.getPriceUnit() != null && line.getPriceUnit() % 10 == 0)) {
            factors.add("round_numbers");
        }
        return factors;
    }

    @Override
    protected void validateBatch(List<PurchaseOrderRecord> orders, ValidationReport report) {
        checkForDuplicates(orders, "name", order -> {
            String name = order.getName();
            return name == null || name.isBlank() ? null : name.trim().toLowerCase(Locale.ROOT);
        }, "Duplicate order reference found", report);
        super.validateBatch(orders, report);
        reportOrderPatterns(orders, report);
    }

    private void reportOrderPatterns(List<PurchaseOrderRecord> orders, ValidationReport report) {
        double totalValue = 0;
        int valuedOrders = 0;
        int totalLines = 0;
        int suspicious = 0;
        for (PurchaseOrderRecord order : orders) {
            if (order == null) {
                continue;
            }
            Double total = order.getAmountTotal();
            if (total != null && total > 0) {
                totalValue += total;
                valuedOrders++;
            }
            totalLines += order.getOrderLines().size();
            if (suspiciousFactors(order).size() > 1) {
                suspicious++;
            }
        }
        if (orders.isEmpty()) {
            return;
        }
        double averageValue = valuedOrders > 0 ? totalValue / valuedOrders : 0;
        report.addInfo(String.format(Locale.ROOT, "Average order value: %.2f", averageValue));
        report.addInfo(String.format(Locale.ROOT, "Average line items per order: %.1f",
                (double) totalLines / orders.size()));
        if (suspicious > 0) {
            report.addInfo("Suspicious orders detected: " + suspicious);
        }
    }

    @Override
    public CorrectionSuggestion suggestCorrection(String field, Object value, Map<String, Object> context) {
        List<String> suggestions = new ArrayList<>();
        switch (field) {
            case "date_order", "date_planned" -> {
                if (value instanceof String text) {
                    Set<String> candidates = new LinkedHashSet<>();
                    for (String attempt : List.of(text, text.replace('/', '-'), text.replace('.', '-'))) {
                        ErpValues.toInstant(attempt).ifPresent(instant -> candidates.add(instant.toString()));
                    }
                    suggestions.addAll(candidates);
                }
            }
            case "state" -> {
                if (value instanceof String state) {
                    String lower = state.toLowerCase(Locale.ROOT);
                    ORDER_STATES.stream()
                            .filter(candidate -> candidate.contains(lower) || lower.contains(candidate))
                            .forEach(suggestions::add);
                }
            }
            default -> {
                return super.suggestCorrection(field, value, context);
            }
        }
        return suggestion(field, value, suggestions, context);
    }

    private static double valueOrZero(Double value) {
        return value != null ? value : 0.0;
    }
}
