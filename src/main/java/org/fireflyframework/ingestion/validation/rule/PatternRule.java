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

import org.fireflyframework.ingestion.validation.ValidationSeverity;

import java.util.function.Function;
import java.util.regex.Pattern;

/**
 * Built-in rule that validates a string field matches a regular expression pattern.
 *
 * <p>Absent values pass; presence is the job of the required-field checks.</p>
 *
 * @param <T> the type of record being validated
 */
public class PatternRule<T> implements BusinessRule<T> {

    private final String name;
    private final String fieldName;
    private final Pattern pattern;
    private final Function<T, String> extractor;
    private final ValidationSeverity severity;
    private final String message;

    public PatternRule(String fieldName, Pattern pattern, Function<T, String> extractor) {
        this("pattern:" + fieldName, fieldName, pattern, extractor, ValidationSeverity.WARNING,
                fieldName + " does not match pattern: " + pattern.pattern());
    }

    public PatternRule(String name, String fieldName, Pattern pattern, Function<T, String> extractor,
                       ValidationSeverity severity, String message) {
        this.name = name;
        this.fieldName = fieldName;
        this.pattern = pattern;
        this.extractor = extractor;
        this.severity = severity;
        this.message = message;
    }

    @Override
    public RuleResult evaluate(T record) {
        String value = extractor.apply(record);
        if (value == null || value.isEmpty() || pattern.matcher(value).matches()) {
            return RuleResult.pass(getName());
        }
        return RuleResult.builder()
                .ruleName(getName())
                .valid(false)
                .message(message)
                .field(fieldName)
                .actualValue(value)
                .build();
    }

    @Override
    public String getName() {
        return name;
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
