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
 * Severity levels for validation entries.
 *
 * <ul>
 *   <li>{@link #ERROR} - Blocks the record from being imported; gates readiness</li>
 *   <li>{@link #WARNING} - Import with review; never blocks</li>
 *   <li>{@link #INFO} - Informational, batch-level notes</li>
 * </ul>
 */
public enum ValidationSeverity {

    ERROR,
    WARNING,
    INFO;

    @JsonValue
    public String jsonValue() {
        return name().toLowerCase();
    }
}
