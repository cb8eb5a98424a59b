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

import lombok.Builder;
import org.fireflyframework.ingestion.validation.ValidationSeverity;

import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Rule backed by a closure, for hosts that register rules programmatically.
 *
 * <p>Either a {@code predicate} (with a fixed {@code message}) or a full
 * {@code evaluator} returning a {@link RuleResult} must be supplied.</p>
 *
 * <pre>{@code
 * BusinessRule<ProductRecord> rule = PredicateRule.<ProductRecord>builder()
 *         .name("no_invalid_marker")
 *         .field("sku")
 *         .predicate(product -> !product.getSku().contains("INVALID"))
 *         .message("SKU contains INVALID keyword")
 *         .severity(ValidationSeverity.WARNING)
 *         .build();
 * }</pre>
 *
 * @param <T> the type of record being validated
 */
@Builder
public class PredicateRule<T> implements BusinessRule<T> {

    private final String name;
    private final String description;
    private final String field;
    private final Predicate<T> predicate;
    private final Function<T, RuleResult> evaluator;
    private final String message;
    @Builder.Default
    private final ValidationSeverity severity = ValidationSeverity.WARNING;

    @Override
    public RuleResult evaluate(T record) {
        if (evaluator != null) {
            return evaluator.apply(record);
        }
        if (predicate == null) {
            throw new IllegalStateException("Rule '" + name + "' has neither a predicate nor an evaluator");
        }
        return predicate.test(record) ? RuleResult.pass(name) : RuleResult.fail(name, field, message);
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public String getDescription() {
        return description != null ? description : "";
    }

    @Override
    public String getField() {
        return field;
    }

    @Override
    public ValidationSeverity getSeverity() {
        return severity;
    }
}
