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

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.ingestion.model.MalformedDatasetException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * Global exception handler for the validation controllers.
 *
 * <p>Translates dataset and pipeline failures into HTTP responses with a consistent body.</p>
 */
@Slf4j
@RestControllerAdvice(basePackages = "org.fireflyframework.ingestion.controller")
public class ValidationExceptionHandler {

    @ExceptionHandler(MalformedDatasetException.class)
    public ResponseEntity<Map<String, Object>> handleMalformedDataset(MalformedDatasetException ex) {
        log.warn("Rejected dataset: {}", ex.getMessage());
        return body(HttpStatus.BAD_REQUEST, "Validation Failed", ex.getMessage(), ex.getErrors());
    }

    @ExceptionHandler(TimeoutException.class)
    public ResponseEntity<Map<String, Object>> handleTimeout(TimeoutException ex) {
        log.warn("Validation pipeline timed out: {}", ex.getMessage());
        return body(HttpStatus.GATEWAY_TIMEOUT, "Validation Timed Out",
                "Validation did not complete within the configured deadline", List.of());
    }

    private static ResponseEntity<Map<String, Object>> body(HttpStatus status, String error, String message,
                                                            List<String> errors) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", status.value());
        body.put("error", error);
        body.put("message", message);
        body.put("errors", errors);
        body.put("timestamp", Instant.now().toString());

        return ResponseEntity.status(status).body(body);
    }
}
