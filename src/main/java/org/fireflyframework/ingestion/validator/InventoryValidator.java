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

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.ingestion.model.EntityType;
import org.fireflyframework.ingestion.model.ErpValues;
import org.fireflyframework.ingestion.model.StockRecord;
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
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Validates stock quant records before they are loaded as {@code stock.quant}.
 */
@Slf4j
public class InventoryValidator extends AbstractEntityValidator<StockRecord> {

    private static final double QUANTITY_LIMIT = 999_999.0;

    private static final List<Pattern> FRACTIONAL_PRODUCTS = List.of(
            caseInsensitive("fabric"), caseInsensitive("textile"), caseInsensitive("material"),
            caseInsensitive("liquid"), caseInsensitive("chemical"), caseInsensitive("paint"),
            caseInsensitive("oil"), caseInsensitive("meter"), caseInsensitive("yard"),
            caseInsensitive("kg"), caseInsensitive("lb"));

    private static final RecordMapping MAPPING = RecordMapping.create()
            .copy("product_id")
            .copy("location_id")
            .computed("lot_id", stock -> orElse(stock.get("lot_id"), false))
            .computed("package_id", stock -> orElse(stock.get("package_id"), false))
            .computed("owner_id", stock -> orElse(stock.get("owner_id"), false))
            .computed("quantity", stock -> orElse(stock.get("quantity"), 0))
            .computed("reserved_quantity", stock -> orElse(stock.get("reserved_quantity"), 0))
            .copy("available_quantity")
            .copy("in_date");

    public InventoryValidator() {
        this(List.of());
    }

    public InventoryValidator(List<? extends BusinessRule<? super StockRecord>> customRules) {
        this(null, ValidationThresholds.defaults(), Clock.systemUTC(), customRules);
    }

    public InventoryValidator(SchemaValidator schemaValidator, ValidationThresholds thresholds, Clock clock,
                              List<? extends BusinessRule<? super StockRecord>> customRules) {
        super(schemaValidator, thresholds, clock, customRules);
    }

    @Override
    public EntityType getEntityType() {
        return EntityType.INVENTORY;
    }

    @Override
    public String getModelName() {
        return ErpModels.STOCK_QUANT;
    }

    @Override
    public List<String> getRequiredFields() {
        return List.of("product_id", "location_id", "quantity");
    }

    @Override
    protected List<String> recordIdFields() {
        return List.of("id");
    }

    @Override
    protected RecordMapping targetMapping() {
        return MAPPING;
    }

    @Override
    protected List<BusinessRule<StockRecord>> initializeBusinessRules() {
        List<BusinessRule<StockRecord>> rules = new ArrayList<>();
        rules.add(PredicateRule.<StockRecord>builder()
                .name("quantity_consistency")
                .description("Available quantity should equal total minus reserved")
                .evaluator(this::checkQuantityConsistency)
                .severity(ValidationSeverity.ERROR)
                .build());
        rules.add(PredicateRule.<StockRecord>builder()
                .name("negative_stock_check")
                .description("Quantities should not be negative unless specifically allowed")
                .evaluator(InventoryValidator::checkNegativeStock)
                .severity(ValidationSeverity.ERROR)
                .build());
        rules.add(PredicateRule.<StockRecord>builder()
                .name("reserved_quantity_logic")
                .description("Reserved quantity should not exceed total quantity")
                .evaluator(InventoryValidator::checkReservedQuantity)
                .severity(ValidationSeverity.ERROR)
                .build());
        rules.add(PredicateRule.<StockRecord>builder()
                .name("lot_consistency")
                .description("Lot-tracked stock should carry a quantity")
                .field("lot_id")
                .predicate(stock -> !ErpValues.isTruthy(stock.getLotId())
                        || stock.getQuantity() == null || stock.getQuantity() != 0)
                .message("Stock record has lot ID but zero quantity")
                .severity(ValidationSeverity.WARNING)
                .build());
        rules.add(PredicateRule.<StockRecord>builder()
                .name("aging_analysis")
                .description("Stock aging should be reasonable")
                .evaluator(this::checkAging)
                .severity(ValidationSeverity.WARNING)
                .build());
        return rules;
    }

    private RuleResult checkQuantityConsistency(StockRecord stock) {
        Double quantity = stock.getQuantity();
        Double reserved = stock.getReservedQuantity();
        Double available = stock.getAvailableQuantity();
        if (quantity == null || reserved == null || available == null) {
            return RuleResult.pass("quantity_consistency");
        }
        double expected = quantity - reserved;
        if (Math.abs(available - expected) <= thresholds.getEpsilon()) {
            return RuleResult.pass("quantity_consistency");
        }
        return RuleResult.fail("quantity_consistency", "available_quantity",
                "Quantity mismatch. Available: " + format(available) + ", Expected: " + format(expected));
    }

    private static RuleResult checkNegativeStock(StockRecord stock) {
        Double quantity = stock.getQuantity();
        if (quantity != null && quantity < 0 && !stock.isNegativeAllowed()) {
            return RuleResult.fail("negative_stock_check", "quantity", "Negative stock quantity detected");
        }
        Double reserved = stock.getReservedQuantity();
        if (reserved != null && reserved < 0) {
            return RuleResult.fail("negative_stock_check", "reserved_quantity",
                    "Reserved quantity cannot be negative");
        }
        return RuleResult.pass("negative_stock_check");
    }

    private static RuleResult checkReservedQuantity(StockRecord stock) {
        Double quantity = stock.getQuantity();
        Double reserved = stock.getReservedQuantity();
        if (quantity != null && reserved != null && reserved > quantity) {
            return RuleResult.fail("reserved_quantity_logic", "reserved_quantity",
                    "Reserved quantity (" + format(reserved) + ") exceeds total quantity (" + format(quantity) + ")");
        }
        return RuleResult.pass("reserved_quantity_logic");
    }

    private RuleResult checkAging(StockRecord stock) {
        Optional<Instant> inDate = stock.getInDate();
        if (inDate.isEmpty()) {
            return RuleResult.pass("aging_analysis");
        }
        Instant now = clock.instant();
        Duration age = Duration.between(inDate.get(), now);
        if (age.compareTo(thresholds.getVeryOldStockAge()) > 0) {
            return RuleResult.fail("aging_analysis", "in_date", "Very old stock (" + age.toDays() + " days old)");
        }
        if (inDate.get().isAfter(now)) {
            return RuleResult.fail("aging_analysis", "in_date", "Stock in-date is in the future");
        }
        return RuleResult.pass("aging_analysis");
    }

    @Override
    protected void validateBasicFields(StockRecord stock, RecordContext context) {
        validateRequired(stock.get("product_id"), "product_id", context);
        validateRequired(stock.get("location_id"), "location_id", context);
        validateNumber(stock.get("quantity"), "quantity", context,
                FieldConstraints.builder().min(-QUANTITY_LIMIT).max(QUANTITY_LIMIT).build());
        validateNumber(stock.get("reserved_quantity"), "reserved_quantity", context,
                FieldConstraints.builder().optional(true).min(0.0).max(QUANTITY_LIMIT).build());
        validateNumber(stock.get("available_quantity"), "available_quantity", context,
                FieldConstraints.builder().optional(true).min(-QUANTITY_LIMIT).max(QUANTITY_LIMIT).build());
        validateDate(stock.get("in_date"), "in_date", context, true);
    }

    @Override
    protected void validateDataQuality(StockRecord stock, RecordContext context) {
        Double quantity = stock.getQuantity();
        Double reserved = stock.getReservedQuantity();
        Double available = stock.getAvailableQuantity();

        if (quantity != null) {
            if (quantity > thresholds.getVeryHighStockQuantity()) {
                context.warning(IssueCategory.DATA_QUALITY, "quantity",
                        "Very high stock quantity detected: " + format(quantity), quantity);
            }
            if (quantity % 1 != 0 && quantity < 10 && !isFractionalProduct(stock.getProductId())) {
                context.warning(IssueCategory.DATA_QUALITY, "quantity",
                        "Fractional quantity for product that may not support it: " + format(quantity), quantity);
            }
            if (quantity == 0 && reserved != null && reserved > 0) {
                context.warning(IssueCategory.DATA_QUALITY, "reserved_quantity",
                        "Reserved quantity exists but no stock available", reserved);
            }
            if (quantity > 0 && ErpValues.isEmpty(stock.get("in_date"))) {
                context.warning(IssueCategory.DATA_QUALITY, "in_date", "Stock exists but no in-date recorded", null);
            }
            if (quantity == 0 && available != null && available > 0) {
                context.error(IssueCategory.DATA_QUALITY, "available_quantity",
                        "Available quantity cannot be positive when total quantity is zero", available);
            }
            if (ErpValues.isTruthy(stock.getPackageId()) && quantity <= 0) {
                context.warning(IssueCategory.DATA_QUALITY, "package_id",
                        "Package assigned but no stock quantity", stock.getPackageId());
            }
        }

        if (stock.getLocationId() instanceof List<?> && isBlankLabel(stock.getLocationId())) {
            context.warning(IssueCategory.DATA_QUALITY, "location_id", "Location name is empty", stock.getLocationId());
        }
        if (stock.getProductId() instanceof List<?> && isBlankLabel(stock.getProductId())) {
            context.warning(IssueCategory.DATA_QUALITY, "product_id", "Product name is empty", stock.getProductId());
        }
    }

    private static boolean isFractionalProduct(Object productId) {
        String name = productId instanceof List<?> ? ErpValues.relationLabel(productId) : null;
        return name != null && FRACTIONAL_PRODUCTS.stream().anyMatch(pattern -> pattern.matcher(name).find());
    }

    private static boolean isBlankLabel(Object relation) {
        String label = ErpValues.relationLabel(relation);
        return label == null || label.isBlank();
    }

    @Override
    protected void validateBatch(List<StockRecord> stock, ValidationReport report) {
        checkForDuplicates(stock, "product_id", InventoryValidator::stockKey,
                "Duplicate stock record (same product, location, and lot)", report);
        super.validateBatch(stock, report);
        reportInventoryPatterns(stock, report);
        checkInventoryBalance(stock, report);
    }

    private static String stockKey(StockRecord stock) {
        if (!(stock.getProductId() instanceof List<?>) || !(stock.getLocationId() instanceof List<?>)) {
            return null;
        }
        Object lot = ErpValues.isTruthy(stock.getLotId()) ? ErpValues.relationId(stock.getLotId()) : "no-lot";
        return ErpValues.relationId(stock.getProductId()) + "-" + ErpValues.relationId(stock.getLocationId())
                + "-" + lot;
    }

    private void reportInventoryPatterns(List<StockRecord> stock, ValidationReport report) {
        Set<Object> products = new HashSet<>();
        Set<Object> locations = new HashSet<>();
        double totalQuantity = 0;
        int negative = 0;
        int zero = 0;
        for (StockRecord record : stock) {
            if (record == null) {
                continue;
            }
            if (record.getProductId() instanceof List<?>) {
                products.add(ErpValues.relationId(record.getProductId()));
            }
            if (record.getLocationId() instanceof List<?>) {
                locations.add(ErpValues.relationId(record.getLocationId()));
            }
            Double quantity = record.getQuantity();
            if (quantity != null) {
                totalQuantity += quantity;
                if (quantity < 0) {
                    negative++;
                } else if (quantity == 0) {
                    zero++;
                }
            }
        }
        report.addInfo("Total unique products: " + products.size());
        report.addInfo("Total locations: " + locations.size());
        report.addInfo(String.format(Locale.ROOT, "Total quantity across all products: %.2f", totalQuantity));
        report.addInfo("Records with negative stock: " + negative);
        report.addInfo("Records with zero stock: " + zero);
    }

    /**
     * Sums quantities per product across locations. A negative total is an error unless every
     * negative record allows negative stock, in which case it is a warning. Spread over many
     * locations or only non-positive records are warnings. Findings carry no record id.
     */
    private void checkInventoryBalance(List<StockRecord> stock, ValidationReport report) {
        Map<Object, ProductBalance> balances = new LinkedHashMap<>();
        for (StockRecord record : stock) {
            if (record == null || !(record.getProductId() instanceof List<?>) || record.getQuantity() == null) {
                continue;
            }
            ProductBalance balance = balances.computeIfAbsent(ErpValues.relationId(record.getProductId()),
                    id -> new ProductBalance(ErpValues.relationLabel(record.getProductId())));
            balance.total += record.getQuantity();
            balance.records++;
            if (record.getQuantity() > 0) {
                balance.allNonPositive = false;
            }
            if (record.getQuantity() < 0 && !record.isNegativeAllowed()) {
                balance.negativeAllowed = false;
            }
            if (record.getLocationId() instanceof List<?>) {
                balance.locations.add(ErpValues.relationLabel(record.getLocationId()));
            }
        }

        int negativeProducts = 0;
        for (ProductBalance balance : balances.values()) {
            if (balance.total < 0 && balance.negativeAllowed) {
                report.addWarning(IssueCategory.DATA_QUALITY, "inventory_balance",
                        "Product '" + balance.name + "' has negative total stock across all locations"
                                + " (negative stock allowed)", balance.total, null);
            } else if (balance.total < 0) {
                negativeProducts++;
                report.addError(IssueCategory.DATA_QUALITY, "inventory_balance",
                        "Product '" + balance.name + "' has negative total stock across all locations",
                        balance.total, null);
            }
            if (balance.locations.size() > 10) {
                report.addWarning(IssueCategory.DATA_QUALITY, "inventory_balance",
                        "Product '" + balance.name + "' exists in unusually many locations",
                        balance.locations.size(), null);
            }
            if (balance.allNonPositive && balance.records > 1) {
                report.addWarning(IssueCategory.DATA_QUALITY, "inventory_balance",
                        "All stock records for product '" + balance.name + "' are zero or negative", null, null);
            }
        }
        if (negativeProducts > 0) {
            log.debug("{} products with negative total stock", negativeProducts);
        }
    }

    private static final class ProductBalance {
        private final String name;
        private final Set<String> locations = new LinkedHashSet<>();
        private double total;
        private int records;
        private boolean allNonPositive = true;
        private boolean negativeAllowed = true;

        private ProductBalance(String name) {
            this.name = name;
        }
    }

    @Override
    public CorrectionSuggestion suggestCorrection(String field, Object value, Map<String, Object> context) {
        List<String> suggestions = new ArrayList<>();
        switch (field) {
            case "quantity" -> {
                if (value instanceof String text && text.matches(".*[\\d.,]+.*")) {
                    String digits = text.replaceAll("[^0-9.-]", "");
                    try {
                        suggestions.add("Convert to number: " + format(Double.parseDouble(digits)));
                    } catch (NumberFormatException e) {
                        log.debug("No numeric suggestion for quantity: {}", text);
                    }
                }
                boolean allowNegative = context != null && Boolean.TRUE.equals(context.get("allowNegative"));
                if (value instanceof Number number && number.doubleValue() < 0 && !allowNegative) {
                    suggestions.add("Set to zero: 0");
                    suggestions.add("Use absolute value: " + format(Math.abs(number.doubleValue())));
                }
            }
            case "in_date" -> {
                if (value instanceof String text && !text.isEmpty()) {
                    suggestions.add("Use today's date: " + LocalDate.ofInstant(clock.instant(), ZoneOffset.UTC));
                    Set<String> candidates = new LinkedHashSet<>();
                    for (String attempt : List.of(text.replace('/', '-'), text.replace('.', '-'))) {
                        ErpValues.toInstant(attempt)
                                .ifPresent(instant -> candidates.add(LocalDate.ofInstant(instant, ZoneOffset.UTC)
                                        .toString()));
                    }
                    suggestions.addAll(candidates);
                }
            }
            default -> {
                return super.suggestCorrection(field, value, context);
            }
        }
        return suggestion(field, value, suggestions, context);
    }
}
