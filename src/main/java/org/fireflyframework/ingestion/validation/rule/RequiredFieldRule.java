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

package org.fireflyframework.ingestion.validation.rule;

import org.fireflyframework.ingestion.model.ErpValues;
import org.fireflyframework.ingestion.validation.ValidationSeverity;

import java.util.function.Function;

/**
 * Built-in rule that validates a field is present and not blank.
 *
 * @param <T> the type of record being validated
 */
public class RequiredFieldRule<T> implements BusinessRule<T> {

    private final String fieldName;
    private final Function<T, Object> extractor;
    private final ValidationSeverity severity;

    public RequiredFieldRule(String fieldName, Function<T, Object> extractor) {
        this(fieldName, extractor, ValidationSeverity.WARNING);
    }

    public RequiredFieldRule(String fieldName, Function<T, Object> extractor, ValidationSeverity severity) {
        this.fieldName = fieldName;
        this.extractor = extractor;
        this.severity = severity;
    }

    @Override
    public RuleResult evaluate(T record) {
        Object value = extractor.apply(record);
        if (!ErpValues.isEmpty(value)) {
            return RuleResult.pass(getName());
        }
        return RuleResult.builder()
                .ruleName(getName())
                .valid(false)
                .message(fieldName + " must not be empty")
                .field(fieldName)
                .actualValue(value)
                .build();
    }

    @Override
    public String getName() {
        return "required:" + fieldName;
    }

    @Override
    public String getField() {
        return fieldName;
    }

    @Override
    public ValidationSeverity getSeverity() {
        return severity;
    }
}
