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

import lombok.Value;

import java.util.List;

/**
 * Outcome of checking one record against a model schema. {@code valid} is {@code true}
 * exactly when there are no errors; warnings never invalidate a record.
 */
@Value
public class SchemaValidationResult {

    String model;
    List<SchemaIssue> errors;
    List<SchemaIssue> warnings;

    public SchemaValidationResult(String model, List<SchemaIssue> errors, List<SchemaIssue> warnings) {
        this.model = model;
        this.errors = List.copyOf(errors);
        this.warnings = List.copyOf(warnings);
    }

    public boolean isValid() {
        return errors.isEmpty();
    }
}
