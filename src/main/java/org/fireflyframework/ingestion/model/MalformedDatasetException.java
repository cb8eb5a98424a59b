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

package org.fireflyframework.ingestion.model;

import lombok.Getter;

import java.util.List;

/**
 * Thrown when input cannot be read as a collection of records.
 *
 * <p>This is the only failure that aborts a validation run; every problem found inside
 * well-formed records is reported as a validation entry instead.</p>
 */
@Getter
public class MalformedDatasetException extends RuntimeException {

    private final List<String> errors;

    public MalformedDatasetException(String message, List<String> errors) {
        super(message);
        this.errors = errors;
    }

    public MalformedDatasetException(String message, Throwable cause) {
        super(message, cause);
        this.errors = List.of(cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName());
    }
}
