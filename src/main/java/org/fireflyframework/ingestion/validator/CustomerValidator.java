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
import org.fireflyframework.ingestion.model.PartnerRecord;
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
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Validates customer and supplier records before they are loaded as {@code res.partner}.
 */
public class CustomerValidator extends AbstractEntityValidator<PartnerRecord> {

    private static final Pattern EMAIL_FORMAT = Pattern.compile("^[a-zA-Z0-9._%+-]+@[a-zA-Z0-9.-]+\\.[a-zA-Z]{2,}$");
    private static final Pattern PHONE_FORMAT = Pattern.compile("^[+]?[\\d\\s\\-()]{10,15}$");
    private static final Pattern VAT_FORMAT = Pattern.compile("^[A-Z]{2}[0-9A-Z]{2,15}$");
    private static final Pattern WHITESPACE = Pattern.compile("\\s");
    private static final Pattern TOP_LEVEL_DOMAIN = Pattern.compile("\\.[a-z]{2,}$");

    private static final List<Pattern> PLACEHOLDERS = List.of(
            caseInsensitive("^(test|sample|placeholder|dummy|temp)"),
            caseInsensitive("^(lorem|ipsum)"),
            caseInsensitive("^(customer|partner|company)\\s*\\d*$"),
            caseInsensitive("^(john|jane)\\s+(doe|smith)$"));

    private static final List<Pattern> SUSPICIOUS_EMAILS = List.of(
            caseInsensitive("test@"),
            caseInsensitive("example\\."),
            caseInsensitive("sample@"),
            caseInsensitive("noreply@"),
            caseInsensitive("@test\\."));

    private static final Pattern UK_POSTCODE = caseInsensitive("^[A-Z]{1,2}\\d[A-Z\\d]?\\s?\\d[A-Z]{2}$");

    private static final Map<String, Pattern> ZIP_PATTERNS = Map.of(
            "US", Pattern.compile("^\\d{5}(-\\d{4})?$"),
            "UK", UK_POSTCODE,
            "GB", UK_POSTCODE,
            "DE", Pattern.compile("^\\d{5}$"),
            "FR", Pattern.compile("^\\d{5}$"),
            "IE", caseInsensitive("^[A-Z]\\d{2}\\s?[A-Z\\d]{4}$"));

    private static final List<String> COMPLETENESS_FIELDS =
            List.of("name", "email", "phone", "street", "city", "country_id", "vat");

    private static final List<String> COMMON_EMAIL_DOMAINS =
            List.of("gmail.com", "yahoo.com", "outlook.com", "hotmail.com");

    private static final RecordMapping MAPPING = RecordMapping.create()
            .copy("name")
            .computed("is_company", partner -> orElse(partner.get("is_company"), false))
            .copy("email")
            .copy("phone")
            .copy("mobile")
            .copy("street")
            .copy("street2")
            .copy("city")
            .copy("zip")
            .copy("state_id")
            .copy("country_id")
            .copy("website")
            .copy("vat")
            .computed("customer_rank", partner -> orElse(partner.get("customer_rank"), 0))
            .computed("supplier_rank", partner -> orElse(partner.get("supplier_rank"), 0))
            .computed("category_id", partner -> orElse(partner.get("category_id"), List.of()))
            .computed("active", partner -> !Boolean.FALSE.equals(partner.get("active")));

    public CustomerValidator() {
        this(List.of());
    }

    public CustomerValidator(List<? extends BusinessRule<? super PartnerRecord>> customRules) {
        this(null, ValidationThresholds.defaults(), Clock.systemUTC(), customRules);
    }

    public CustomerValidator(SchemaValidator schemaValidator, ValidationThresholds thresholds, Clock clock,
                             List<? extends BusinessRule<? super PartnerRecord>> customRules) {
        super(schemaValidator, thresholds, clock, customRules);
    }

    @Override
    public EntityType getEntityType() {
        return EntityType.CUSTOMERS;
    }

    @Override
    public String getModelName() {
        return ErpModels.RES_PARTNER;
    }

    @Override
    public List<String> getRequiredFields() {
        return List.of("name", "email");
    }

    @Override
    protected List<String> recordIdFields() {
        return List.of("id", "email", "name");
    }

    @Override
    protected RecordMapping targetMapping() {
        return MAPPING;
    }

    @Override
    protected List<BusinessRule<PartnerRecord>> initializeBusinessRules() {
        List<BusinessRule<PartnerRecord>> rules = new ArrayList<>();
        rules.add(new PatternRule<>("email_format", "email", EMAIL_FORMAT, PartnerRecord::getEmail,
                ValidationSeverity.ERROR, "Invalid email format"));
        rules.add(new PatternRule<>("phone_format", "phone", PHONE_FORMAT,
                partner -> stripWhitespace(partner.getPhone()),
                ValidationSeverity.WARNING, "Invalid phone number format"));
        rules.add(new PatternRule<>("vat_validation", "vat", VAT_FORMAT,
                partner -> stripWhitespace(partner.getVat()),
                ValidationSeverity.WARNING, "Invalid VAT number format (expected: country code + identifier)"));
        rules.add(PredicateRule.<PartnerRecord>builder()
                .name("company_consistency")
                .description("Company partners should carry a VAT number")
                .field("vat")
                .predicate(partner -> !partner.isCompany()
                        || ErpValues.isTruthy(partner.get("vat"))
                        || partner.getCustomerRank() <= 0)
                .message("Company customers should typically have VAT numbers")
                .severity(ValidationSeverity.WARNING)
                .build());
        rules.add(PredicateRule.<PartnerRecord>builder()
                .name("address_completeness")
                .description("Address fields should be complete")
                .evaluator(CustomerValidator::checkAddressCompleteness)
                .severity(ValidationSeverity.WARNING)
                .build());
        rules.add(PredicateRule.<PartnerRecord>builder()
                .name("rank_validation")
                .description("Partner must be a customer, a supplier or both")
                .evaluator(CustomerValidator::checkRanks)
                .severity(ValidationSeverity.ERROR)
                .build());
        return rules;
    }

    private static RuleResult checkAddressCompleteness(PartnerRecord partner) {
        boolean hasStreet = ErpValues.isTruthy(partner.get("street"));
        boolean hasCity = ErpValues.isTruthy(partner.get("city"));
        if (hasStreet && !hasCity) {
            return RuleResult.fail("address_completeness", "city", "Street provided but city is missing");
        }
        if ((hasStreet || hasCity) && !ErpValues.isTruthy(partner.get("country_id"))) {
            return RuleResult.fail("address_completeness", "country_id", "Address provided but country is missing");
        }
        return RuleResult.pass("address_completeness");
    }

    private static RuleResult checkRanks(PartnerRecord partner) {
        double customerRank = partner.getCustomerRank();
        double supplierRank = partner.getSupplierRank();
        if (customerRank < 0 || supplierRank < 0) {
            return RuleResult.fail("rank_validation", customerRank < 0 ? "customer_rank" : "supplier_rank",
                    "Customer and supplier ranks must be non-negative");
        }
        if (customerRank == 0 && supplierRank == 0) {
            return RuleResult.fail("rank_validation", "customer_rank",
                    "Partner must be either a customer or supplier (or both)");
        }
        return RuleResult.pass("rank_validation");
    }

    @Override
    protected void validateBasicFields(PartnerRecord partner, RecordContext context) {
        validateString(partner.get("name"), "name", context,
                FieldConstraints.builder().minLength(2).maxLength(200).build());
        validateEmail(partner.get("email"), "email", context, FieldConstraints.REQUIRED);

        validateString(partner.get("street"), "street", context, optionalText(200));
        validateString(partner.get("street2"), "street2", context, optionalText(200));
        validateString(partner.get("city"), "city", context, optionalText(100));
        validateString(partner.get("zip"), "zip", context, optionalText(20));
        validateString(partner.get("phone"), "phone", context, optionalText(30));
        validateString(partner.get("mobile"), "mobile", context, optionalText(30));
        validateString(partner.get("website"), "website", context, optionalText(200));
        validateString(partner.get("vat"), "vat", context, optionalText(20));

        FieldConstraints rank = FieldConstraints.builder().optional(true).min(0.0).build();
        validateNumber(partner.get("customer_rank"), "customer_rank", context, rank);
        validateNumber(partner.get("supplier_rank"), "supplier_rank", context, rank);

        validateBoolean(partner.get("is_company"), "is_company", context, true);
        validateBoolean(partner.get("active"), "active", context, true);
        validateArray(partner.get("category_id"), "category_id", context, FieldConstraints.OPTIONAL);
        validateUrl(partner.get("website"), "website", context, true);
    }

    private static FieldConstraints optionalText(int maxLength) {
        return FieldConstraints.builder().optional(true).maxLength(maxLength).build();
    }

    @Override
    protected void validateDataQuality(PartnerRecord partner, RecordContext context) {
        flagPlaceholders(partner, List.of("name", "street", "city"), PLACEHOLDERS, context);

        String email = partner.getEmail();
        if (email != null && SUSPICIOUS_EMAILS.stream().anyMatch(pattern -> pattern.matcher(email).find())) {
            context.warning(IssueCategory.DATA_QUALITY, "email", "Suspicious test-like email address", email);
        }

        boolean hasAddress = ErpValues.isTruthy(partner.get("street")) || ErpValues.isTruthy(partner.get("city"));
        if (!ErpValues.isTruthy(partner.get("email")) && !ErpValues.isTruthy(partner.get("phone"))
                && !ErpValues.isTruthy(partner.get("mobile")) && !hasAddress) {
            context.warning(IssueCategory.DATA_QUALITY, "contact_info",
                    "No contact information provided (email, phone, or address)", null);
        }
        if (partner.getPhone() != null && !partner.getPhone().isEmpty()
                && partner.getPhone().equals(partner.getMobile())) {
            context.warning(IssueCategory.DATA_QUALITY, "mobile",
                    "Mobile number is same as phone number", partner.getMobile());
        }

        checkCompleteness(partner, context);

        if (partner.isCompany() && !ErpValues.isTruthy(partner.get("website")) && partner.getSupplierRank() > 0) {
            context.info("Website URL would be helpful for supplier companies");
        }

        checkZipCode(partner, context);
    }

    private void checkCompleteness(PartnerRecord partner, RecordContext context) {
        long completed = COMPLETENESS_FIELDS.stream()
                .map(partner::get)
                .filter(ErpValues::isTruthy)
                .filter(value -> !String.valueOf(value).trim().isEmpty())
                .count();
        double score = (double) completed / COMPLETENESS_FIELDS.size() * 100;
        if (score < thresholds.getCompletenessThreshold() * 100) {
            context.warning(IssueCategory.DATA_QUALITY, "completeness",
                    String.format(Locale.ROOT, "Low data completeness: %.1f%%", score), score);
        }
    }

    private static void checkZipCode(PartnerRecord partner, RecordContext context) {
        String zip = partner.getZip();
        String countryCode = partner.getCountryCode();
        if (zip == null || zip.isEmpty() || !ErpValues.isTruthy(partner.get("country_id")) || countryCode == null) {
            return;
        }
        Pattern pattern = ZIP_PATTERNS.get(countryCode.toUpperCase(Locale.ROOT));
        if (pattern != null && !pattern.matcher(zip).matches()) {
            context.warning(IssueCategory.DATA_QUALITY, "zip",
                    "ZIP code format may not match country: " + countryCode, zip);
        }
    }

    @Override
    protected void validateBatch(List<PartnerRecord> partners, ValidationReport report) {
        checkForDuplicates(partners, "email", partner -> {
            String email = partner.getEmail();
            return email == null || email.isEmpty() ? null : email.trim().toLowerCase(Locale.ROOT);
        }, "Duplicate email address found", report);
        checkForDuplicates(partners, "phone", partner -> {
            String phone = partner.getPhone();
            String digits = phone == null ? "" : phone.replaceAll("\\D", "");
            return digits.length() >= 10 ? digits : null;
        }, "Duplicate phone number found", report);
        checkForDuplicates(partners, "vat", partner -> {
            String vat = stripWhitespace(partner.getVat());
            return vat == null || vat.isEmpty() ? null : vat.toUpperCase(Locale.ROOT);
        }, "Duplicate VAT number found", report);
        checkParentReferences(partners, report);
        super.validateBatch(partners, report);
    }

    /**
     * Warns about partners whose {@code parent_id} matches no other partner's id or name.
     */
    private void checkParentReferences(List<PartnerRecord> partners, ValidationReport report) {
        Set<String> knownKeys = new HashSet<>();
        for (PartnerRecord partner : partners) {
            if (partner == null) {
                continue;
            }
            if (ErpValues.isTruthy(partner.get("id"))) {
                knownKeys.add(String.valueOf(partner.get("id")));
            }
            if (partner.getName() != null) {
                knownKeys.add(partner.getName());
            }
        }

        for (int i = 0; i < partners.size(); i++) {
            PartnerRecord partner = partners.get(i);
            if (partner == null || !ErpValues.isTruthy(partner.get("parent_id"))) {
                continue;
            }
            Object parent = partner.get("parent_id");
            List<String> candidates = new ArrayList<>();
            if (ErpValues.isRelationTuple(parent)) {
                candidates.add(String.valueOf(ErpValues.relationId(parent)));
                candidates.add(ErpValues.relationLabel(parent));
            } else {
                candidates.add(String.valueOf(parent));
            }
            if (candidates.stream().filter(Objects::nonNull).noneMatch(knownKeys::contains)) {
                report.addWarning(IssueCategory.DATA_QUALITY, "parent_id",
                        "Parent customer not found in dataset", parent, recordId(partner, i));
            }
        }
    }

    @Override
    public CorrectionSuggestion suggestCorrection(String field, Object value, Map<String, Object> context) {
        List<String> suggestions = new ArrayList<>();
        switch (field) {
            case "email" -> {
                if (value instanceof String email) {
                    String corrected = email.trim().toLowerCase(Locale.ROOT);
                    if (corrected.contains("@") && !TOP_LEVEL_DOMAIN.matcher(corrected).find()) {
                        String local = corrected.substring(0, corrected.indexOf('@'));
                        COMMON_EMAIL_DOMAINS.forEach(domain -> suggestions.add(local + "@" + domain));
                    }
                }
            }
            case "phone" -> {
                if (value instanceof String phone) {
                    String digits = phone.replaceAll("\\D", "");
                    if (digits.length() == 10) {
                        suggestions.add("+1" + digits);
                        suggestions.add("(" + digits.substring(0, 3) + ") " + digits.substring(3, 6) + "-"
                                + digits.substring(6));
                    }
                }
            }
            case "zip" -> {
                if (value instanceof String zip && context != null && "US".equals(context.get("country_code"))) {
                    String digits = zip.replaceAll("\\D", "");
                    if (digits.length() == 5) {
                        suggestions.add(digits);
                    } else if (digits.length() == 9) {
                        suggestions.add(digits.substring(0, 5) + "-" + digits.substring(5));
                    }
                }
            }
            default -> {
                return super.suggestCorrection(field, value, context);
            }
        }
        return suggestion(field, value, suggestions, context);
    }

    private static String stripWhitespace(String value) {
        return value == null ? null : WHITESPACE.matcher(value).replaceAll("");
    }
}
