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
import lombok.Value;

import java.util.List;

/**
 * Declaration of one field of a {@link ModelSchema}.
 */
@Value
@Builder
public class FieldSchema {

    public enum Format {
        EMAIL,
        URI
    }

    FieldType type;
    boolean required;
    Double minimum;
    Double maximum;
    Integer minLength;
    List<String> allowedValues;
    Format format;
    /** Schema of the elements of an {@link FieldType#OBJECT_ARRAY} field. */
    ModelSchema itemSchema;

    public static FieldSchema of(FieldType type) {
        return FieldSchema.builder().type(type).build();
    }

    public static FieldSchema required(FieldType type) {
        return FieldSchema.builder().type(type).required(true).build();
    }

    public static FieldSchema selection(String... allowedValues) {
        return FieldSchema.builder().type(FieldType.SELECTION).allowedValues(List.of(allowedValues)).build();
    }

    public static FieldSchema nonNegative(FieldType type) {
        return FieldSchema.builder().type(type).minimum(0.0).build();
    }
}
