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

/**
 * Built-in rule that validates a numeric field falls within an inclusive range.
 *
 * <p>Absent values pass. Either bound may be {@code null} for an open range.</p>
 *
 * @param <T> the type of record being validated
 */
public class RangeRule<T> implements BusinessRule<T> {

    private final String name;
    private final String fieldName;
    private final Double min;
    private final Double max;
    private final Function<T, Double> extractor;
    private final ValidationSeverity severity;

    public RangeRule(String fieldName, Double min, Double max, Function<T, Double> extractor) {
        this("range:" + fieldName, fieldName, min, max, extractor, ValidationSeverity.WARNING);
    }

    public RangeRule(String name, String fieldName, Double min, Double max,
                     Function<T, Double> extractor, ValidationSeverity severity) {
        this.name = name;
        this.fieldName = fieldName;
        this.min = min;
        this.max = max;
        this.extractor = extractor;
        this.severity = severity;
    }

    @Override
    public RuleResult evaluate(T record) {
        Double value = extractor.apply(record);
        if (value == null) {
            return RuleResult.pass(getName());
        }

        boolean belowMin = min != null && value < min;
        boolean aboveMax = max != null && value > max;

        if (!belowMin && !aboveMax) {
            return RuleResult.pass(getName());
        }

        return RuleResult.builder()
                .ruleName(getName())
                .valid(false)
                .message(fieldName + " value " + value + " is outside range [" + min + ", " + max + "]")
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
