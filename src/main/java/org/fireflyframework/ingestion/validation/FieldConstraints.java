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
import lombok.Value;

import java.util.regex.Pattern;

/**
 * Options accepted by the field validators of {@link AbstractRecordValidator}.
 *
 * <p>Unset bounds are not checked. An {@code optional} field that is missing produces no entry.</p>
 */
@Value
@Builder
public class FieldConstraints {

    public static final FieldConstraints REQUIRED = FieldConstraints.builder().build();
    public static final FieldConstraints OPTIONAL = FieldConstraints.builder().optional(true).build();

    boolean optional;
    Integer minLength;
    Integer maxLength;
    Pattern pattern;
    Double min;
    Double max;
    boolean positive;
    Integer minItems;
    Integer maxItems;
}
