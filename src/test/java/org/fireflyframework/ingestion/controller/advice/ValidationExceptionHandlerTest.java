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

package org.fireflyframework.ingestion.controller.advice;

import org.fireflyframework.ingestion.model.MalformedDatasetException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.ResponseEntity;

import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ValidationExceptionHandler}.
 */
class ValidationExceptionHandlerTest {

    private ValidationExceptionHandler handler;

    @BeforeEach
    void setUp() {
        handler = new ValidationExceptionHandler();
    }

    @Test
    void handleMalformedDataset_shouldReturn400WithErrorsList() {
        // Given
        List<String> errors = List.of("products must be an array", "orders[0] is not an object");
        MalformedDatasetException ex = new MalformedDatasetException(
                "Malformed dataset: " + String.join("; ", errors), errors);

        // When
        ResponseEntity<Map<String, Object>> response = handler.handleMalformedDataset(ex);

        // Then
        assertThat(response.getStatusCode().value()).isEqualTo(400);
        assertThat(response.getBody()).isNotNull();
        assertThat(response.getBody().get("status")).isEqualTo(400);
        assertThat(response.getBody().get("error")).isEqualTo("Validation Failed");
        assertThat(response.getBody().get("message")).isEqualTo(ex.getMessage());

        @SuppressWarnings("unchecked")
        List<String> returnedErrors = (List<String>) response.getBody().get("errors");
        assertThat(returnedErrors).containsExactlyElementsOf(errors);
    }

    @Test
    void handleMalformedDataset_shouldIncludeTimestamp() {
        // Given
        MalformedDatasetException ex = new MalformedDatasetException("Input is not valid JSON",
                new IllegalStateException("Unexpected character"));

        // When
        ResponseEntity<Map<String, Object>> response = handler.handleMalformedDataset(ex);

        // Then
        assertThat(response.getBody()).isNotNull();
        assertThat(response.getBody()).containsKey("timestamp");
        assertThat(response.getBody().get("timestamp").toString()).isNotEmpty();
        assertThat(response.getBody().get("errors")).isEqualTo(List.of("Unexpected character"));
    }

    @Test
    void handleTimeout_shouldReturn504() {
        // When
        ResponseEntity<Map<String, Object>> response = handler.handleTimeout(new TimeoutException("Did not observe"));

        // Then
        assertThat(response.getStatusCode().value()).isEqualTo(504);
        assertThat(response.getBody()).isNotNull();
        assertThat(response.getBody().get("error")).isEqualTo("Validation Timed Out");
        assertThat(response.getBody().get("errors")).isEqualTo(List.of());
    }
}
