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

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Declarative field table of one target model.
 */
@Value
@Builder
public class ModelSchema {

    String name;

    @Singular
    Map<String, FieldSchema> fields;

    /** Whether fields outside {@link #getFields()} are tolerated by {@code validateFieldTypes}. */
    @Builder.Default
    boolean additionalProperties = true;

    public FieldSchema field(String fieldName) {
        return fields.get(fieldName);
    }

    public List<String> requiredFields() {
        return fields.entrySet().stream()
                .filter(entry -> entry.getValue().isRequired())
                .map(Map.Entry::getKey)
                .collect(Collectors.toList());
    }
}
