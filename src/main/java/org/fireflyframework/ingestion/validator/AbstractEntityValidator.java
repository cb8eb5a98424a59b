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

import org.fireflyframework.ingestion.model.ErpRecord;
import org.fireflyframework.ingestion.model.ErpValues;
import org.fireflyframework.ingestion.schema.RecordMapping;
import org.fireflyframework.ingestion.schema.SchemaIssue;
import org.fireflyframework.ingestion.schema.SchemaValidationResult;
import org.fireflyframework.ingestion.schema.SchemaValidator;
import org.fireflyframework.ingestion.validation.AbstractRecordValidator;
import org.fireflyframework.ingestion.validation.CorrectionSuggestion;
import org.fireflyframework.ingestion.validation.IssueCategory;
import org.fireflyframework.ingestion.validation.RecordContext;
import org.fireflyframework.ingestion.validation.ValidationThresholds;
import org.fireflyframework.ingestion.validation.rule.BusinessRule;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Entity validator that checks each record in five steps: basic fields, schema compliance of
 * the record mapped onto its target model, built-in business rules, data-quality heuristics and
 * finally the caller-supplied rules.
 *
 * @param <T> the record type
 */
public abstract class AbstractEntityValidator<T extends ErpRecord> extends AbstractRecordValidator<T> {

    protected final SchemaValidator schemaValidator;
    private final List<BusinessRule<T>> businessRules;

    protected AbstractEntityValidator(SchemaValidator schemaValidator, ValidationThresholds thresholds, Clock clock,
                                      List<? extends BusinessRule<? super T>> customRules) {
        super(thresholds, clock, customRules);
        this.schemaValidator = schemaValidator != null ? schemaValidator : new SchemaValidator();
        this.businessRules = List.copyOf(initializeBusinessRules());
    }

    /**
     * Returns the target model records are mapped onto.
     */
    public abstract String getModelName();

    /**
     * Returns the mapping from source fields to target model fields.
     */
    protected abstract RecordMapping targetMapping();

    /**
     * Builds the built-in rule list. Called once from the constructor; implementations must
     * not depend on subclass state.
     */
    protected abstract List<BusinessRule<T>> initializeBusinessRules();

    protected abstract void validateBasicFields(T record, RecordContext context);

    protected abstract void validateDataQuality(T record, RecordContext context);

    public List<BusinessRule<T>> getBusinessRules() {
        return businessRules;
    }

    /**
     * Maps a source record onto its target model.
     */
    public Map<String, Object> toTargetModel(T record) {
        return targetMapping().apply(record);
    }

    @Override
    protected void validateRecord(T record, RecordContext context) {
        if (record == null) {
            context.error(IssueCategory.FIELD_VALIDATION, "record", "Record is required", null);
            return;
        }
        validateBasicFields(record, context);
        validateAgainstTargetSchema(record, context);
        evaluateRules(businessRules, record, context);
        validateDataQuality(record, context);
        applyCustomRules(record, context);
    }

    protected void validateAgainstTargetSchema(T record, RecordContext context) {
        SchemaValidationResult result = schemaValidator.validateAgainstSchema(toTargetModel(record), getModelName());
        for (SchemaIssue error : result.getErrors()) {
            context.error(IssueCategory.SCHEMA_VIOLATION, error.getField(), error.getMessage(), error.getValue());
        }
        for (SchemaIssue warning : result.getWarnings()) {
            context.warning(IssueCategory.DATA_QUALITY, warning.getField(), warning.getMessage(), warning.getValue());
        }
    }

    /**
     * Warns when a text field looks like placeholder content.
     */
    protected void flagPlaceholders(T record, List<String> fields, List<Pattern> patterns, RecordContext context) {
        for (String field : fields) {
            String value = record.getString(field);
            if (value == null || value.isEmpty()) {
                continue;
            }
            String trimmed = value.trim();
            if (patterns.stream().anyMatch(pattern -> pattern.matcher(trimmed).find())) {
                context.warning(IssueCategory.DATA_QUALITY, field, "Suspicious placeholder-like value detected", value);
            }
        }
    }

    protected static CorrectionSuggestion suggestion(String field, Object value, List<String> suggestions,
                                                     Map<String, Object> context) {
        return CorrectionSuggestion.builder()
                .field(field)
                .originalValue(value)
                .suggestions(suggestions)
                .context(context != null ? context : Map.of())
                .build();
    }

    /**
     * Returns the value when truthy, otherwise {@code fallback}.
     */
    protected static Object orElse(Object value, Object fallback) {
        return ErpValues.isTruthy(value) ? value : fallback;
    }

    protected static Pattern caseInsensitive(String regex) {
        return Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
    }
}
