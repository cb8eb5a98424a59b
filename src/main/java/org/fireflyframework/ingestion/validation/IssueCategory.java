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

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Classification of a validation entry by the check that produced it.
 *
 * <ul>
 *   <li>{@link #FIELD_VALIDATION} - generic field-level primitive (required, type, bounds)</li>
 *   <li>{@link #SCHEMA_VIOLATION} - structural mismatch against the target model, always an error</li>
 *   <li>{@link #BUSINESS_RULE_VIOLATION} - a named business rule failed</li>
 *   <li>{@link #DATA_QUALITY} - heuristic quality finding</li>
 *   <li>{@link #DUPLICATE_RECORD} - repeated natural key within the batch, always a warning</li>
 *   <li>{@link #RULE_EXECUTION_FAILURE} - a rule threw during evaluation</li>
 * </ul>
 */
public enum IssueCategory {

    FIELD_VALIDATION,
    SCHEMA_VIOLATION,
    BUSINESS_RULE_VIOLATION,
    DATA_QUALITY,
    DUPLICATE_RECORD,
    RULE_EXECUTION_FAILURE;

    @JsonValue
    public String jsonValue() {
        return name().toLowerCase();
    }
}
