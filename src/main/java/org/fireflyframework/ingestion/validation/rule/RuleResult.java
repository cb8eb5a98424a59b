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
import lombok.Data;

/**
 * Result of evaluating a single {@link BusinessRule}.
 */
@Data
@Builder
public class RuleResult {

    private final String ruleName;
    private final boolean valid;
    private final String message;
    private final String field;
    private final Object actualValue;

    /**
     * Creates a passing result for the given rule.
     *
     * @param ruleName the name of the rule that passed
     * @return a passing {@link RuleResult}
     */
    public static RuleResult pass(String ruleName) {
        return RuleResult.builder()
                .ruleName(ruleName)
                .valid(true)
                .build();
    }

    /**
     * Creates a failing result attributed to the given field.
     *
     * @param ruleName the name of the rule that failed
     * @param field    the offending field
     * @param message  a human-readable description of the failure
     * @return a failing {@link RuleResult}
     */
    public static RuleResult fail(String ruleName, String field, String message) {
        return RuleResult.builder()
                .ruleName(ruleName)
                .valid(false)
                .field(field)
                .message(message)
                .build();
    }
}
