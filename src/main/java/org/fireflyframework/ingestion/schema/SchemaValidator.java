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

package org.fireflyframework.ingestion.schema;

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.ingestion.model.ErpValues;
import org.fireflyframework.ingestion.validation.AbstractRecordValidator;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Checks records against the target model schemas of a {@link SchemaRegistry}.
 *
 * <p>{@link #validateAgainstSchema(Map, String)} runs three passes:</p>
 * <ol>
 *   <li>structural: required fields, runtime types, selections, numeric bounds,
 *       minimum lengths and formats</li>
 *   <li>relationships: single references must be unset ({@code null} or {@code false})
 *       or exactly {@code [integer, string]}, multi references arrays of integers.
 *       Relationship values are never coerced.</li>
 *   <li>model combinations: a small table of cross-field checks per model</li>
 * </ol>
 * <p>Nested order lines go through the first two passes with paths such as
 * {@code order_line[0].product_id}.</p>
 */
@Slf4j
public class SchemaValidator {

    private final SchemaRegistry registry;

    public SchemaValidator() {
        this(SchemaRegistry.defaults());
    }

    public SchemaValidator(SchemaRegistry registry) {
        this.registry = registry;
    }

    /**
     * Validates a record in target-model form against the named model.
     *
     * @param record    the record, keyed by target model field names
     * @param modelName the model, e.g. {@code product.template}
     * @return the result; a single {@code schema} error when the model is unknown
     */
    public SchemaValidationResult validateAgainstSchema(Map<String, ?> record, String modelName) {
        List<SchemaIssue> errors = new ArrayList<>();
        List<SchemaIssue> warnings = new ArrayList<>();

        Optional<ModelSchema> schema = registry.find(modelName);
        if (schema.isEmpty()) {
            errors.add(SchemaIssue.of("schema", "No schema found for model: " + modelName, modelName));
            return new SchemaValidationResult(modelName, errors, warnings);
        }

        Map<String, ?> data = record != null ? record : Map.of();
        validateStructure(data, schema.get(), "", errors);
        validateRelationships(data, schema.get(), "", errors);
        validateFieldCombinations(data, modelName, errors, warnings);

        return new SchemaValidationResult(modelName, errors, warnings);
    }

    /**
     * Audits each field of a record on its own: type, bounds and relationship shape. Fields
     * the schema does not declare are reported as warnings when the model forbids additional
     * properties.
     *
     * @param record    the record
     * @param modelName the model
     * @return the result; a single {@code schema} error when the model is unknown
     */
    public SchemaValidationResult validateFieldTypes(Map<String, ?> record, String modelName) {
        List<SchemaIssue> errors = new ArrayList<>();
        List<SchemaIssue> warnings = new ArrayList<>();

        Optional<ModelSchema> found = registry.find(modelName);
        if (found.isEmpty()) {
            errors.add(SchemaIssue.of("schema", "Unknown model: " + modelName, modelName));
            return new SchemaValidationResult(modelName, errors, warnings);
        }

        ModelSchema schema = found.get();
        if (record != null) {
            record.forEach((field, value) -> {
                FieldSchema fieldSchema = schema.field(field);
                if (fieldSchema == null) {
                    if (!schema.isAdditionalProperties()) {
                        warnings.add(SchemaIssue.of(field, "Field not defined in schema", value));
                    }
                    return;
                }
                if (value == null) {
                    return;
                }
                if (fieldSchema.getType().isRelationship()) {
                    checkRelationship(value, fieldSchema, field, errors);
                } else {
                    checkField(value, fieldSchema, field, errors);
                }
            });
        }
        return new SchemaValidationResult(modelName, errors, warnings);
    }

    public List<String> getAvailableModels() {
        return registry.modelNames();
    }

    public Optional<ModelSchema> getModelSchema(String modelName) {
        return registry.find(modelName);
    }

    // ---------------------------------------------------------------------

    private void validateStructure(Map<String, ?> data, ModelSchema schema, String prefix, List<SchemaIssue> errors) {
        schema.getFields().forEach((field, fieldSchema) -> {
            String path = prefix + field;
            Object value = data.get(field);
            if (value == null) {
                if (fieldSchema.isRequired()) {
                    errors.add(SchemaIssue.of(path, "Missing required field", null));
                }
                return;
            }
            if (fieldSchema.getType().isRelationship()) {
                return;
            }
            if (checkField(value, fieldSchema, path, errors) && fieldSchema.getType() == FieldType.OBJECT_ARRAY
                    && fieldSchema.getItemSchema() != null) {
                List<?> items = (List<?>) value;
                for (int i = 0; i < items.size(); i++) {
                    validateStructure(ErpValues.asMap(items.get(i)), fieldSchema.getItemSchema(),
                            path + "[" + i + "].", errors);
                }
            }
        });
    }

    private void validateRelationships(Map<String, ?> data, ModelSchema schema, String prefix,
                                       List<SchemaIssue> errors) {
        schema.getFields().forEach((field, fieldSchema) -> {
            Object value = data.get(field);
            if (value == null) {
                return;
            }
            String path = prefix + field;
            if (fieldSchema.getType().isRelationship()) {
                checkRelationship(value, fieldSchema, path, errors);
            } else if (fieldSchema.getType() == FieldType.OBJECT_ARRAY && fieldSchema.getItemSchema() != null
                    && value instanceof List<?> items) {
                for (int i = 0; i < items.size(); i++) {
                    validateRelationships(ErpValues.asMap(items.get(i)), fieldSchema.getItemSchema(),
                            path + "[" + i + "].", errors);
                }
            }
        });
    }

    private void checkRelationship(Object value, FieldSchema fieldSchema, String path, List<SchemaIssue> errors) {
        if (fieldSchema.getType() == FieldType.MANY2ONE) {
            if (!ErpValues.isUnsetRelation(value) && !ErpValues.isRelationTuple(value)) {
                errors.add(SchemaIssue.of(path, "Many2one field must be [integer, string] tuple", value));
            }
            return;
        }
        if (!(value instanceof List<?> ids)) {
            errors.add(SchemaIssue.of(path, "Relationship field must be an array of integer IDs", value));
            return;
        }
        List<Object> invalid = ids.stream().filter(id -> !ErpValues.isIntegral(id)).map(Object.class::cast).toList();
        if (!invalid.isEmpty()) {
            errors.add(SchemaIssue.of(path, "Relationship field must contain only integer IDs", invalid));
        }
    }

    /**
     * Checks type, selection, bounds, length and format of a non-relationship value.
     *
     * @return {@code true} when the value has the declared type
     */
    private boolean checkField(Object value, FieldSchema fieldSchema, String path, List<SchemaIssue> errors) {
        FieldType type = fieldSchema.getType();
        if (!hasType(value, type)) {
            errors.add(SchemaIssue.of(path, "Expected " + describe(type) + ", got " + jsonType(value), value));
            return false;
        }

        if (fieldSchema.getAllowedValues() != null && !fieldSchema.getAllowedValues().contains(value)) {
            errors.add(SchemaIssue.of(path,
                    "Invalid selection value. Allowed: " + String.join(", ", fieldSchema.getAllowedValues()), value));
        }
        if (value instanceof Number number) {
            double d = number.doubleValue();
            if (fieldSchema.getMinimum() != null && d < fieldSchema.getMinimum()) {
                errors.add(SchemaIssue.of(path, "Value must be at least " + bound(fieldSchema.getMinimum()), value));
            }
            if (fieldSchema.getMaximum() != null && d > fieldSchema.getMaximum()) {
                errors.add(SchemaIssue.of(path, "Value must be no more than " + bound(fieldSchema.getMaximum()), value));
            }
        }
        if (value instanceof String text) {
            if (fieldSchema.getMinLength() != null && text.length() < fieldSchema.getMinLength()) {
                errors.add(SchemaIssue.of(path,
                        "String must be at least " + fieldSchema.getMinLength() + " characters", value));
            }
            if (fieldSchema.getFormat() == FieldSchema.Format.EMAIL
                    && !AbstractRecordValidator.EMAIL_PATTERN.matcher(text).matches()) {
                errors.add(SchemaIssue.of(path, "Must be a valid email address", value));
            }
            if (fieldSchema.getFormat() == FieldSchema.Format.URI && !isAbsoluteUri(text)) {
                errors.add(SchemaIssue.of(path, "Must be a valid URI", value));
            }
        }
        return true;
    }

    private void validateFieldCombinations(Map<String, ?> data, String modelName,
                                           List<SchemaIssue> errors, List<SchemaIssue> warnings) {
        switch (modelName) {
            case ErpModels.PRODUCT_TEMPLATE -> {
                Object tracking = data.get("tracking");
                if ("product".equals(data.get("type")) && tracking != null
                        && !List.of("none", "lot", "serial").contains(tracking)) {
                    warnings.add(SchemaIssue.of("tracking", "Invalid tracking value for stockable product", tracking));
                }
            }
            case ErpModels.RES_PARTNER -> {
                Double supplierRank = ErpValues.asDouble(data.get("supplier_rank"));
                if (supplierRank != null && supplierRank > 0 && !Boolean.TRUE.equals(data.get("is_company"))) {
                    warnings.add(SchemaIssue.of("supplier_rank", "Supplier should typically be marked as company",
                            data.get("supplier_rank")));
                }
            }
            case ErpModels.PURCHASE_ORDER -> {
                Object lines = data.get("order_line");
                if (!(lines instanceof List<?> list) || list.isEmpty()) {
                    errors.add(SchemaIssue.of("order_line", "Purchase order must have at least one order line", lines));
                }
            }
            default -> {
            }
        }
    }

    private static boolean hasType(Object value, FieldType type) {
        return switch (type) {
            case STRING, SELECTION -> value instanceof String;
            case INTEGER -> ErpValues.isIntegral(value);
            case NUMBER -> value instanceof Number number && !Double.isNaN(number.doubleValue());
            case BOOLEAN -> value instanceof Boolean;
            case DATE, DATETIME -> !(value instanceof Number) && !(value instanceof Boolean) && ErpValues.isDate(value);
            case OBJECT_ARRAY -> value instanceof List<?> list && list.stream().allMatch(item -> item instanceof Map);
            case MANY2ONE, X2MANY -> value instanceof List;
        };
    }

    private static String describe(FieldType type) {
        return switch (type) {
            case STRING, SELECTION -> "string";
            case INTEGER -> "integer";
            case NUMBER -> "number";
            case BOOLEAN -> "boolean";
            case DATE -> "date";
            case DATETIME -> "date-time";
            case OBJECT_ARRAY -> "array of objects";
            case MANY2ONE, X2MANY -> "array";
        };
    }

    static String jsonType(Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof Boolean) {
            return "boolean";
        }
        if (value instanceof Number) {
            return ErpValues.isIntegral(value) ? "integer" : "number";
        }
        if (value instanceof CharSequence) {
            return "string";
        }
        if (value instanceof List) {
            return "array";
        }
        return "object";
    }

    private static boolean isAbsoluteUri(String text) {
        try {
            return new URI(text).isAbsolute();
        } catch (URISyntaxException e) {
            return false;
        }
    }

    private static String bound(double value) {
        return value == Math.rint(value) ? String.valueOf((long) value) : String.valueOf(value);
    }
}
