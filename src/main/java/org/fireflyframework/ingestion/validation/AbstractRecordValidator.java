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

package org.fireflyframework.ingestion.validation;

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.ingestion.model.EntityType;
import org.fireflyframework.ingestion.model.ErpRecord;
import org.fireflyframework.ingestion.model.ErpValues;
import org.fireflyframework.ingestion.validation.rule.BusinessRule;
import org.fireflyframework.ingestion.validation.rule.RuleResult;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Schedulers;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Base class for entity validators.
 *
 * <p>{@link #validate(List)} runs {@link #validateRecord(ErpRecord, RecordContext)} once for
 * every record, then the batch pass ({@link #validateBatch(List, ValidationReport)}) once all
 * records are done. Findings for a record are buffered in its {@link RecordContext} and merged
 * into the report in input order, so the report is the same whether records were validated
 * sequentially or in parallel.</p>
 *
 * <p>Nothing thrown by a record check or a rule escapes {@code validate}: a failing record
 * becomes a {@code record} error, a failing rule becomes a {@code business_rule} error.</p>
 *
 * <p>Subclasses also get a set of field validators. Each one appends at most one entry and
 * returns whether the value passed.</p>
 *
 * @param <T> the record type this validator accepts
 */
@Slf4j
public abstract class AbstractRecordValidator<T extends ErpRecord> {

    public static final Pattern EMAIL_PATTERN = Pattern.compile("^[^\\s@]+@[^\\s@]+\\.[^\\s@]+$");

    protected final ValidationThresholds thresholds;
    protected final Clock clock;
    private final List<BusinessRule<? super T>> customRules;
    private int recordParallelism = 1;

    protected AbstractRecordValidator(ValidationThresholds thresholds, Clock clock,
                                      List<? extends BusinessRule<? super T>> customRules) {
        this.thresholds = thresholds != null ? thresholds : ValidationThresholds.defaults();
        this.clock = clock != null ? clock : Clock.systemUTC();
        this.customRules = customRules != null ? List.copyOf(customRules) : List.of();
    }

    /**
     * Returns the entity type this validator handles.
     */
    public abstract EntityType getEntityType();

    /**
     * Returns the fields every record of this entity must carry.
     */
    public abstract List<String> getRequiredFields();

    /**
     * Validates a single record, writing findings to the given context.
     *
     * @param record  the record, possibly {@code null}
     * @param context the record's finding buffer
     */
    protected abstract void validateRecord(T record, RecordContext context);

    /**
     * Sets how many records may be validated concurrently. Values above one validate records on
     * the bounded elastic scheduler. Configure before the first call to {@link #validate(List)}.
     *
     * @param recordParallelism the number of concurrent record validations
     */
    public void setRecordParallelism(int recordParallelism) {
        this.recordParallelism = Math.max(1, recordParallelism);
    }

    public int getRecordParallelism() {
        return recordParallelism;
    }

    public List<BusinessRule<? super T>> getCustomRules() {
        return customRules;
    }

    public ValidationThresholds getThresholds() {
        return thresholds;
    }

    /**
     * Validates a batch of records.
     *
     * @param records the records to validate
     * @return a completed report
     */
    public ValidationReport validate(List<T> records) {
        ValidationReport report = new ValidationReport(clock);
        if (records == null) {
            report.addError("data", "Data is required", null, null);
            return report.complete();
        }

        report.setTotalRecords(records.size());
        report.addInfo("Starting batch validation of " + records.size() + " records");
        log.debug("Validating {} {} records", records.size(), getEntityType().getKey());

        List<RecordContext> contexts = recordParallelism > 1 && records.size() > 1
                ? validateInParallel(records)
                : validateSequentially(records);
        contexts.forEach(report::mergeRecord);

        try {
            validateBatch(records, report);
        } catch (RuntimeException e) {
            log.warn("Batch checks for {} failed: {}", getEntityType().getKey(), e.getMessage());
            report.addError(IssueCategory.RULE_EXECUTION_FAILURE, "batch",
                    "Batch validation failed: " + e.getMessage(), null, null);
        }

        report.complete();
        log.debug("Validated {} records: {}", getEntityType().getKey(), report.getStats());
        return report;
    }

    /**
     * Cross-record checks run after every record has been validated. The default checks
     * completeness of the required fields.
     *
     * @param records the validated records
     * @param report  the report being built
     */
    protected void validateBatch(List<T> records, ValidationReport report) {
        checkFieldCompleteness(records, getRequiredFields(), report);
    }

    /**
     * Returns the fields tried, in order, to derive a record identifier.
     */
    protected List<String> recordIdFields() {
        return List.of("id", "sku", "code", "name");
    }

    /**
     * Derives the identifier used to correlate findings for one record.
     *
     * @param record the record
     * @param index  the record's position in the batch
     * @return the first present natural key, or {@code record_<index>}
     */
    public String recordId(T record, int index) {
        if (record != null) {
            for (String field : recordIdFields()) {
                Object value = record.get(field);
                if (ErpValues.isTruthy(value)) {
                    return String.valueOf(value);
                }
            }
        }
        return "record_" + index;
    }

    /**
     * Returns advisory corrections for a field value. Subclasses add entity-specific hints.
     *
     * @param field   the field name
     * @param value   the offending value
     * @param context extra hints, e.g. a country code
     * @return the suggestion, possibly without entries
     */
    public CorrectionSuggestion suggestCorrection(String field, Object value, Map<String, Object> context) {
        return CorrectionSuggestion.builder()
                .field(field)
                .originalValue(value)
                .context(context != null ? context : Map.of())
                .build();
    }

    private List<RecordContext> validateSequentially(List<T> records) {
        List<RecordContext> contexts = new ArrayList<>(records.size());
        for (int i = 0; i < records.size(); i++) {
            contexts.add(validateOne(records.get(i), i));
        }
        return contexts;
    }

    private List<RecordContext> validateInParallel(List<T> records) {
        return Flux.range(0, records.size())
                .parallel(recordParallelism)
                .runOn(Schedulers.boundedElastic())
                .map(index -> validateOne(records.get(index), index))
                .sequential()
                .collectSortedList(Comparator.comparingInt(RecordContext::getIndex))
                .block();
    }

    private RecordContext validateOne(T record, int index) {
        RecordContext context = new RecordContext(recordId(record, index), index, clock);
        try {
            validateRecord(record, context);
        } catch (RuntimeException e) {
            log.warn("Validation of {} record {} failed: {}", getEntityType().getKey(), context.getRecordId(),
                    e.toString());
            context.error(IssueCategory.RULE_EXECUTION_FAILURE, "record", "Validation failed: " + e.getMessage(),
                    record != null ? record.asMap() : null);
        }
        return context;
    }

    // ---------------------------------------------------------------------
    // Rules
    // ---------------------------------------------------------------------

    /**
     * Runs the caller-supplied rules against a record.
     */
    protected void applyCustomRules(T record, RecordContext context) {
        evaluateRules(customRules, record, context);
    }

    /**
     * Evaluates rules in order. Failures are attributed to the field named by the result, then
     * the rule, then {@code custom}. A rule that throws becomes a {@code business_rule} error
     * and the remaining rules still run.
     */
    protected void evaluateRules(List<? extends BusinessRule<? super T>> rules, T record, RecordContext context) {
        for (BusinessRule<? super T> rule : rules) {
            try {
                RuleResult result = rule.evaluate(record);
                if (result == null || result.isValid()) {
                    continue;
                }
                String field = result.getField() != null ? result.getField()
                        : rule.getField() != null ? rule.getField() : "custom";
                Object value = result.getActualValue() != null ? result.getActualValue() : record.get(field);
                String message = result.getMessage() != null ? result.getMessage()
                        : "Rule '" + rule.getName() + "' not satisfied";
                switch (rule.getSeverity()) {
                    case ERROR -> context.error(IssueCategory.BUSINESS_RULE_VIOLATION, field, message, value,
                            rule.getName());
                    case WARNING -> context.warning(IssueCategory.BUSINESS_RULE_VIOLATION, field, message, value,
                            rule.getName());
                    case INFO -> context.info(message);
                }
            } catch (RuntimeException e) {
                log.warn("Rule '{}' failed for record {}: {}", rule.getName(), context.getRecordId(), e.toString());
                context.error(IssueCategory.RULE_EXECUTION_FAILURE, "business_rule",
                        "Rule '" + rule.getName() + "' failed: " + e.getMessage(), null, rule.getName());
            }
        }
    }

    // ---------------------------------------------------------------------
    // Batch checks
    // ---------------------------------------------------------------------

    /**
     * Warns about records repeating the value of {@code keyField}, compared trimmed and
     * case-insensitively. The warning is attributed to the repeat and names the first occurrence.
     *
     * @return {@code true} when no duplicates were found
     */
    protected boolean checkForDuplicates(List<T> records, String keyField, ValidationReport report) {
        return checkForDuplicates(records, keyField, record -> {
            Object value = record.get(keyField);
            return ErpValues.isBlank(value) ? null : String.valueOf(value).trim().toLowerCase(Locale.ROOT);
        }, "Duplicate value found", report);
    }

    /**
     * Warns about records sharing a normalized key. Records whose key is {@code null} are skipped.
     *
     * @param records      the batch
     * @param field        the field the warning is attributed to
     * @param keyExtractor derives the normalized key
     * @param message      the warning message
     * @param report       the report being built
     * @return {@code true} when no duplicates were found
     */
    protected boolean checkForDuplicates(List<T> records, String field, Function<T, String> keyExtractor,
                                         String message, ValidationReport report) {
        Map<String, String> firstSeen = new HashMap<>();
        boolean unique = true;
        for (int i = 0; i < records.size(); i++) {
            T record = records.get(i);
            if (record == null) {
                continue;
            }
            String key = keyExtractor.apply(record);
            if (key == null) {
                continue;
            }
            String recordId = recordId(record, i);
            String first = firstSeen.putIfAbsent(key, recordId);
            if (first != null) {
                unique = false;
                Object value = record.get(field) != null ? record.get(field) : key;
                report.addWarning(IssueCategory.DUPLICATE_RECORD, field,
                        message + " (first seen in record " + first + ")", value, recordId);
            }
        }
        return unique;
    }

    /**
     * Warns about records carrying less than the configured fraction of {@code requiredFields}.
     */
    protected void checkFieldCompleteness(List<T> records, List<String> requiredFields, ValidationReport report) {
        if (requiredFields.isEmpty()) {
            return;
        }
        for (int i = 0; i < records.size(); i++) {
            T record = records.get(i);
            if (record == null) {
                continue;
            }
            long present = requiredFields.stream()
                    .filter(field -> !ErpValues.isBlank(record.get(field)))
                    .count();
            double completeness = (double) present / requiredFields.size();
            if (completeness < thresholds.getCompletenessThreshold()) {
                List<String> missing = requiredFields.stream()
                        .filter(field -> ErpValues.isBlank(record.get(field)))
                        .collect(Collectors.toList());
                report.addWarning(IssueCategory.DATA_QUALITY, "completeness",
                        String.format(Locale.ROOT, "Low field completeness: %.1f%% (missing %s)",
                                completeness * 100, String.join(", ", missing)),
                        completeness * 100, recordId(record, i));
            }
        }
    }

    // ---------------------------------------------------------------------
    // Field validators
    // ---------------------------------------------------------------------

    protected boolean validateRequired(Object value, String field, RecordContext context) {
        if (ErpValues.isEmpty(value)) {
            context.error(IssueCategory.FIELD_VALIDATION, field, "Field is required", value);
            return false;
        }
        return true;
    }

    protected boolean validateString(Object value, String field, RecordContext context, FieldConstraints options) {
        if (ErpValues.isEmpty(value)) {
            return options.isOptional() || validateRequired(value, field, context);
        }
        if (!(value instanceof String text)) {
            context.error(IssueCategory.FIELD_VALIDATION, field, "Field must be a string", value);
            return false;
        }
        if (options.getMinLength() != null && text.length() < options.getMinLength()) {
            context.error(IssueCategory.FIELD_VALIDATION, field,
                    "Field must be at least " + options.getMinLength() + " characters", value);
            return false;
        }
        if (options.getMaxLength() != null && text.length() > options.getMaxLength()) {
            context.error(IssueCategory.FIELD_VALIDATION, field,
                    "Field must be no more than " + options.getMaxLength() + " characters", value);
            return false;
        }
        if (options.getPattern() != null && !options.getPattern().matcher(text).find()) {
            context.error(IssueCategory.FIELD_VALIDATION, field, "Field does not match required pattern", value);
            return false;
        }
        return true;
    }

    protected boolean validateNumber(Object value, String field, RecordContext context, FieldConstraints options) {
        if (ErpValues.isEmpty(value)) {
            return options.isOptional() || validateRequired(value, field, context);
        }
        Double number = ErpValues.asDouble(value);
        if (number == null || number.isNaN()) {
            context.error(IssueCategory.FIELD_VALIDATION, field, "Field must be a number", value);
            return false;
        }
        if (options.getMin() != null && number < options.getMin()) {
            context.error(IssueCategory.FIELD_VALIDATION, field,
                    "Field must be at least " + format(options.getMin()), value);
            return false;
        }
        if (options.getMax() != null && number > options.getMax()) {
            context.error(IssueCategory.FIELD_VALIDATION, field,
                    "Field must be no more than " + format(options.getMax()), value);
            return false;
        }
        if (options.isPositive() && number <= 0) {
            context.error(IssueCategory.FIELD_VALIDATION, field, "Field must be positive", value);
            return false;
        }
        return true;
    }

    protected boolean validateEmail(Object value, String field, RecordContext context, FieldConstraints options) {
        if (ErpValues.isEmpty(value)) {
            return options.isOptional() || validateRequired(value, field, context);
        }
        if (!(value instanceof String text) || !EMAIL_PATTERN.matcher(text).matches()) {
            context.error(IssueCategory.FIELD_VALIDATION, field, "Invalid email format", value);
            return false;
        }
        return true;
    }

    protected boolean validateEnum(Object value, String field, RecordContext context,
                                   Collection<?> allowedValues, boolean optional) {
        if (ErpValues.isEmpty(value)) {
            return optional || validateRequired(value, field, context);
        }
        if (!allowedValues.contains(value)) {
            context.error(IssueCategory.FIELD_VALIDATION, field, "Field must be one of: "
                    + allowedValues.stream().map(String::valueOf).collect(Collectors.joining(", ")), value);
            return false;
        }
        return true;
    }

    protected boolean validateDate(Object value, String field, RecordContext context, boolean optional) {
        if (ErpValues.isEmpty(value)) {
            return optional || validateRequired(value, field, context);
        }
        if (!ErpValues.isDate(value)) {
            context.error(IssueCategory.FIELD_VALIDATION, field, "Invalid date format", value);
            return false;
        }
        return true;
    }

    protected boolean validateArray(Object value, String field, RecordContext context, FieldConstraints options) {
        if (ErpValues.isEmpty(value)) {
            return options.isOptional() || validateRequired(value, field, context);
        }
        if (!(value instanceof List<?> list)) {
            context.error(IssueCategory.FIELD_VALIDATION, field, "Field must be an array", value);
            return false;
        }
        if (options.getMinItems() != null && list.size() < options.getMinItems()) {
            context.error(IssueCategory.FIELD_VALIDATION, field,
                    "Array must have at least " + options.getMinItems() + " items", value);
            return false;
        }
        if (options.getMaxItems() != null && list.size() > options.getMaxItems()) {
            context.error(IssueCategory.FIELD_VALIDATION, field,
                    "Array must have no more than " + options.getMaxItems() + " items", value);
            return false;
        }
        return true;
    }

    protected boolean validateBoolean(Object value, String field, RecordContext context, boolean optional) {
        if (value == null) {
            return optional || validateRequired(null, field, context);
        }
        if (!(value instanceof Boolean)) {
            context.error(IssueCategory.FIELD_VALIDATION, field, "Field must be boolean", value);
            return false;
        }
        return true;
    }

    protected boolean validateUrl(Object value, String field, RecordContext context, boolean optional) {
        if (ErpValues.isEmpty(value)) {
            return optional || validateRequired(value, field, context);
        }
        if (!(value instanceof String text) || !isAbsoluteUrl(text)) {
            context.error(IssueCategory.FIELD_VALIDATION, field, "Invalid URL format", value);
            return false;
        }
        return true;
    }

    private static boolean isAbsoluteUrl(String text) {
        try {
            URI uri = new URI(text.trim());
            return uri.isAbsolute() && (uri.getHost() != null || uri.isOpaque());
        } catch (URISyntaxException e) {
            return false;
        }
    }

    protected static String format(double value) {
        return value == Math.rint(value) && !Double.isInfinite(value)
                ? String.valueOf((long) value)
                : String.valueOf(value);
    }
}
