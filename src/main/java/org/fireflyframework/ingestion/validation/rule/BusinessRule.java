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

/**
 * Port interface for named business rules evaluated against a single record.
 *
 * <p>Rules are pure and stateless. Entity validators own a built-in list of rules
 * and may be supplemented with caller-supplied rules of the same shape. Rules are
 * registered programmatically as typed objects; rule bodies are never loaded from
 * serialized code.</p>
 *
 * <p><b>Example:</b></p>
 * <pre>{@code
 * public class BannedDomainRule implements BusinessRule<PartnerRecord> {
 *
 *     @Override
 *     public RuleResult evaluate(PartnerRecord partner) {
 *         String email = partner.getEmail();
 *         if (email != null && email.endsWith("@banned-domain.com")) {
 *             return RuleResult.fail(getName(), "email", "Email from banned domain");
 *         }
 *         return RuleResult.pass(getName());
 *     }
 *
 *     @Override
 *     public String getName() {
 *         return "banned_domain";
 *     }
 *
 *     @Override
 *     public String getField() {
 *         return "email";
 *     }
 *
 *     @Override
 *     public ValidationSeverity getSeverity() {
 *         return ValidationSeverity.ERROR;
 *     }
 * }
 * }</pre>
 *
 * @param <T> the type of record this rule validates
 */
public interface BusinessRule<T> {

    /**
     * Evaluates this rule against the given record.
     *
     * @param record the record to validate
     * @return the result of the evaluation
     */
    RuleResult evaluate(T record);

    /**
     * Returns the unique name of this rule.
     *
     * @return the rule name
     */
    String getName();

    /**
     * Returns a human-readable description of what the rule checks.
     *
     * @return the description, empty by default
     */
    default String getDescription() {
        return "";
    }

    /**
     * Returns the field a failure is attributed to when the result names none.
     *
     * @return the default field, or {@code null}
     */
    default String getField() {
        return null;
    }

    /**
     * Returns the severity level for violations of this rule.
     * Defaults to {@link ValidationSeverity#WARNING}.
     *
     * @return the severity level
     */
    default ValidationSeverity getSeverity() {
        return ValidationSeverity.WARNING;
    }
}
