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

import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Serializable view of a {@link ValidationReport}.
 *
 * <p><b>Example:</b></p>
 * <pre>{@code
 * {
 *   "stats": {"totalRecords": 15, "validRecords": 2, "invalidRecords": 13, ...},
 *   "errors": [{"type": "error", "category": "business_rule_violation", "field": "sku", ...}],
 *   "warnings": [...],
 *   "infos": ["Starting batch validation of 15 records"]
 * }
 * }</pre>
 */
@Data
@Builder
public class ValidationReportDocument {

    private final ValidationStats stats;
    private final List<ValidationEntry> errors;
    private final List<ValidationEntry> warnings;
    private final List<String> infos;
}
