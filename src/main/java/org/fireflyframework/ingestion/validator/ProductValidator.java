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
import org.fireflyframework.ingestion.model.ProductRecord;
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
import org.fireflyframework.ingestion.validation.rule.PatternRule;
import org.fireflyframework.ingestion.validation.rule.PredicateRule;
import org.fireflyframework.ingestion.validation.rule.RuleResult;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Validates apparel product records before they are loaded as {@code product.template}.
 */
@Slf4j
public class ProductValidator extends AbstractEntityValidator<ProductRecord> {

    public static final List<String> VALID_CATEGORIES = List.of(
            "sports-bras", "joggers", "t-shirts", "accessories", "shorts",
            "hoodies", "jackets", "tops", "beanies", "leggings");

    private static final List<String> SIZELESS_CATEGORIES = List.of("accessories", "beanies");
    private static final List<String> STATUSES = List.of("active", "inactive", "discontinued");

    private static final Pattern SKU_CHARACTERS = Pattern.compile("^[A-Z0-9-]+$");
    private static final Pattern SKU_FORMAT = Pattern.compile("^[A-Z0-9]{2,}-[A-Z0-9-]+$");
    private static final Pattern NUMERIC_TEXT = Pattern.compile("[\\d.,]+");

    private static final List<Pattern> PLACEHOLDERS = List.of(
            caseInsensitive("^(test|sample|placeholder|dummy|temp)"),
            caseInsensitive("^(lorem|ipsum)"),
            caseInsensitive("^(product|item)\\s*\\d*$"));

    private static final RecordMapping MAPPING = RecordMapping.create()
            .copy("name")
            .copy("sku", "default_code")
            .constant("type", "product")
            .computed("list_price", product -> orElse(product.get("list_price"), 0))
            .copy("standard_cost", "standard_price")
            .copy("description")
            .computed("active", product -> !"inactive".equals(product.get("status")))
            .constant("sale_ok", true)
            .constant("purchase_ok", true)
            .constant("tracking", "none")
            .computed("categ_id", product -> Arrays.asList(1, orElse(product.get("category"), "Uncategorized")));

    public ProductValidator() {
        this(List.of());
    }

    public ProductValidator(List<? extends BusinessRule<? super ProductRecord>> customRules) {
        this(null, ValidationThresholds.defaults(), Clock.systemUTC(), customRules);
    }

    public ProductValidator(SchemaValidator schemaValidator, ValidationThresholds thresholds, Clock clock,
                            List<? extends BusinessRule<? super ProductRecord>> customRules) {
        super(schemaValidator, thresholds, clock, customRules);
    }

    @Override
    public EntityType getEntityType() {
        return EntityType.PRODUCTS;
    }

    @Override
    public String getModelName() {
        return ErpModels.PRODUCT_TEMPLATE;
    }

    @Override
    public List<String> getRequiredFields() {
        return List.of("name", "sku", "category", "list_price", "standard_cost");
    }

    @Override
    protected List<String> recordIdFields() {
        return List.of("id", "sku", "name");
    }

    @Override
    protected RecordMapping targetMapping() {
        return MAPPING;
    }

    @Override
    protected List<BusinessRule<ProductRecord>> initializeBusinessRules() {
        List<BusinessRule<ProductRecord>> rules = new ArrayList<>();
        rules.add(PredicateRule.<ProductRecord>builder()
                .name("price_validation")
                .description("List price should be greater than standard cost")
                .field("list_price")
                .predicate(product -> !ErpValues.isTruthy(product.getListPrice())
                        || !ErpValues.isTruthy(product.getStandardCost())
                        || product.getListPrice() >= product.getStandardCost())
                .message("List price should be greater than or equal to standard cost")
                .severity(ValidationSeverity.WARNING)
                .build());
        rules.add(new PatternRule<>("sku_format", "sku", SKU_FORMAT, ProductRecord::getSku, ValidationSeverity.ERROR,
                "SKU should follow format: PREFIX-IDENTIFIER (e.g., GC10000-BLA-XS)"));
        rules.add(PredicateRule.<ProductRecord>builder()
                .name("inventory_consistency")
                .description("Inventory levels should be consistent")
                .field("inventory_on_hand")
                .predicate(product -> !ErpValues.isTruthy(product.getInventoryOnHand())
                        || !ErpValues.isTruthy(product.getReorderPoint())
                        || (product.getInventoryOnHand() >= 0 && product.getReorderPoint() >= 0))
                .message("Inventory levels must be non-negative")
                .severity(ValidationSeverity.ERROR)
                .build());
        rules.add(PredicateRule.<ProductRecord>builder()
                .name("category_validation")
                .description("Product category should be from approved list")
                .field("category")
                .predicate(product -> !ErpValues.isTruthy(product.get("category"))
                        || VALID_CATEGORIES.contains(product.get("category")))
                .message("Category must be one of: " + String.join(", ", VALID_CATEGORIES))
                .severity(ValidationSeverity.ERROR)
                .build());
        rules.add(PredicateRule.<ProductRecord>builder()
                .name("description_length")
                .description("Product description should be meaningful")
                .field("description")
                .evaluator(this::checkDescriptionLength)
                .severity(ValidationSeverity.WARNING)
                .build());
        return rules;
    }

    private RuleResult checkDescriptionLength(ProductRecord product) {
        String description = product.getDescription();
        if (description == null || description.isEmpty()) {
            return RuleResult.pass("description_length");
        }
        int length = description.length();
        if (length < thresholds.getDescriptionMinLength()) {
            return RuleResult.fail("description_length", "description", "Description too short (" + length
                    + " chars). Minimum: " + thresholds.getDescriptionMinLength() + " chars");
        }
        if (length > thresholds.getDescriptionMaxLength()) {
            return RuleResult.fail("description_length", "description", "Description too long (" + length
                    + " chars). Maximum: " + thresholds.getDescriptionMaxLength() + " chars");
        }
        return RuleResult.pass("description_length");
    }

    @Override
    protected void validateBasicFields(ProductRecord product, RecordContext context) {
        validateString(product.get("name"), "name", context,
                FieldConstraints.builder().minLength(2).maxLength(100).build());
        validateString(product.get("sku"), "sku", context,
                FieldConstraints.builder().minLength(3).maxLength(50).pattern(SKU_CHARACTERS).build());
        validateString(product.get("category"), "category", context,
                FieldConstraints.builder().minLength(2).build());
        validateString(product.get("subcategory"), "subcategory", context, FieldConstraints.OPTIONAL);
        validateString(product.get("color"), "color", context,
                FieldConstraints.builder().optional(true).minLength(2).maxLength(30).build());
        validateString(product.get("size"), "size", context,
                FieldConstraints.builder().optional(true).maxLength(10).build());
        validateString(product.get("description"), "description", context, FieldConstraints.OPTIONAL);

        validateNumber(product.get("list_price"), "list_price", context,
                FieldConstraints.builder().min(0.0).positive(true).build());
        validateNumber(product.get("standard_cost"), "standard_cost", context,
                FieldConstraints.builder().min(0.0).positive(true).build());
        validateNumber(product.get("inventory_on_hand"), "inventory_on_hand", context,
                FieldConstraints.builder().optional(true).min(0.0).build());
        validateNumber(product.get("reorder_point"), "reorder_point", context,
                FieldConstraints.builder().optional(true).min(0.0).build());
        validateNumber(product.get("lead_time_days"), "lead_time_days", context,
                FieldConstraints.builder().optional(true).min(0.0).max(365.0).build());

        validateEnum(product.get("status"), "status", context, STATUSES, true);
        validateArray(product.get("features"), "features", context,
                FieldConstraints.builder().optional(true).maxItems(20).build());
        validateDate(product.get("created_date"), "created_date", context, true);
        validateDate(product.get("last_modified"), "last_modified", context, true);
    }

    @Override
    protected void validateDataQuality(ProductRecord product, RecordContext context) {
        flagPlaceholders(product, List.of("name", "description"), PLACEHOLDERS, context);

        Double listPrice = product.getListPrice();
        Double standardCost = product.getStandardCost();
        if (listPrice != null) {
            if (listPrice == 0) {
                context.warning(IssueCategory.DATA_QUALITY, "list_price",
                        "Zero price may indicate missing data", listPrice);
            } else if (listPrice > thresholds.getHighPrice()) {
                context.warning(IssueCategory.DATA_QUALITY, "list_price",
                        "Unusually high price detected", listPrice);
            }
        }

        if (ErpValues.isTruthy(listPrice) && ErpValues.isTruthy(standardCost)) {
            double margin = (listPrice - standardCost) / listPrice * 100;
            if (margin < thresholds.getLowMarginPercent()) {
                context.warning(IssueCategory.DATA_QUALITY, "list_price",
                        String.format(Locale.ROOT, "Low margin detected: %.1f%%", margin), listPrice);
            } else if (margin > thresholds.getHighMarginPercent()) {
                context.warning(IssueCategory.DATA_QUALITY, "list_price",
                        String.format(Locale.ROOT, "Unusually high margin: %.1f%%", margin), listPrice);
            }
        }

        if (SIZELESS_CATEGORIES.contains(product.getCategory()) && ErpValues.isTruthy(product.get("size"))) {
            context.warning(IssueCategory.DATA_QUALITY, "size",
                    "Size specified for category that typically doesn't have sizes", product.get("size"));
        }

        Double onHand = product.getInventoryOnHand();
        Double reorderPoint = product.getReorderPoint();
        if (ErpValues.isTruthy(onHand) && ErpValues.isTruthy(reorderPoint) && onHand > 0 && onHand < reorderPoint) {
            context.warning(IssueCategory.DATA_QUALITY, "inventory_on_hand",
                    "Inventory below reorder point", onHand);
        }
    }

    @Override
    protected void validateBatch(List<ProductRecord> products, ValidationReport report) {
        checkForDuplicates(products, "sku", report);
        checkForDuplicates(products, "name", report);
        super.validateBatch(products, report);
        checkVariationNaming(products, report);
    }

    /**
     * Warns when variants sharing a base SKU are not named after the first variant.
     */
    private void checkVariationNaming(List<ProductRecord> products, ValidationReport report) {
        Map<String, List<Integer>> groups = new LinkedHashMap<>();
        for (int i = 0; i < products.size(); i++) {
            ProductRecord product = products.get(i);
            if (product == null || product.getSku() == null || product.getSku().isEmpty()) {
                continue;
            }
            String baseSku = product.getSku().replaceFirst("-[A-Z0-9]+$", "");
            groups.computeIfAbsent(baseSku, key -> new ArrayList<>()).add(i);
        }

        groups.values().stream()
                .filter(indexes -> indexes.size() > 1)
                .forEach(indexes -> {
                    String firstName = products.get(indexes.get(0)).getName();
                    if (firstName == null) {
                        return;
                    }
                    String baseName = firstName.replaceFirst(" - [A-Za-z]+$", "");
                    for (int index : indexes) {
                        ProductRecord variant = products.get(index);
                        String name = variant.getName();
                        if (name == null || !name.startsWith(baseName)) {
                            report.addWarning(IssueCategory.DATA_QUALITY, "name",
                                    "Product variation has inconsistent naming with base product",
                                    variant.get("name"), recordId(variant, index));
                        }
                    }
                });
    }

    @Override
    public CorrectionSuggestion suggestCorrection(String field, Object value, Map<String, Object> context) {
        List<String> suggestions = new ArrayList<>();
        switch (field) {
            case "sku" -> {
                if (value instanceof String sku && !sku.isEmpty() && !SKU_CHARACTERS.matcher(sku).matches()) {
                    String upper = sku.toUpperCase(Locale.ROOT);
                    suggestions.add("Convert to uppercase: " + upper);
                    suggestions.add("Remove special characters: " + upper.replaceAll("[^A-Z0-9-]", "-"));
                }
            }
            case "category" -> {
                if (value instanceof String category && !category.isEmpty()) {
                    String lower = category.toLowerCase(Locale.ROOT);
                    VALID_CATEGORIES.stream()
                            .filter(candidate -> candidate.contains(lower)
                                    || lower.contains(candidate.replace("-", "")))
                            .forEach(suggestions::add);
                }
            }
            case "list_price", "standard_cost" -> {
                if (value instanceof String text && NUMERIC_TEXT.matcher(text).find()) {
                    String digits = text.replaceAll("[^0-9.]", "");
                    try {
                        suggestions.add("Convert to number: " + format(Double.parseDouble(digits)));
                    } catch (NumberFormatException e) {
                        log.debug("No numeric suggestion for {}: {}", field, text);
                    }
                }
            }
            default -> {
                return super.suggestCorrection(field, value, context);
            }
        }
        return suggestion(field, value, suggestions, context);
    }
}
