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

package org.fireflyframework.ingestion.controller;

import com.fasterxml.jackson.databind.JsonNode;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.ingestion.model.DatasetReader;
import org.fireflyframework.ingestion.model.EntityType;
import org.fireflyframework.ingestion.model.MalformedDatasetException;
import org.fireflyframework.ingestion.pipeline.PipelineSummary;
import org.fireflyframework.ingestion.pipeline.ValidationPipeline;
import org.fireflyframework.ingestion.validation.ValidationReport;
import org.fireflyframework.ingestion.validation.ValidationReportDocument;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.Arrays;
import java.util.List;

/**
 * REST controller exposing the validation pipeline.
 *
 * <p><b>Example:</b></p>
 * <pre>
 * POST /api/v1/ingestion/validation
 * {"products": [...], "customers": [...], "orders": [...], "inventory": [...]}
 *
 * POST /api/v1/ingestion/validation/products
 * [{"sku": "GC10000-BLA-XS", ...}]
 * </pre>
 *
 * <p>Payloads that are not a valid dataset are rejected with HTTP 400 by
 * {@link org.fireflyframework.ingestion.controller.advice.ValidationExceptionHandler}.</p>
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/ingestion/validation")
@Tag(name = "Ingestion Validation", description = "Pre-import validation of ERP datasets")
@ConditionalOnBean(ValidationPipeline.class)
public class ValidationController {

    private final ValidationPipeline pipeline;
    private final DatasetReader datasetReader;

    public ValidationController(ValidationPipeline pipeline, DatasetReader datasetReader) {
        this.pipeline = pipeline;
        this.datasetReader = datasetReader;
    }

    /**
     * Validates a full dataset bundle.
     *
     * @param body the bundle
     * @return the pipeline summary
     */
    @PostMapping
    @Operation(
        summary = "Validate a dataset bundle",
        description = "Runs the product, customer, order and inventory validators and returns the " +
                     "readiness summary with critical issues and recommendations."
    )
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "Validation completed"),
        @ApiResponse(responseCode = "400", description = "Malformed dataset"),
        @ApiResponse(responseCode = "504", description = "Validation exceeded the configured deadline")
    })
    public Mono<PipelineSummary> validateBundle(@RequestBody JsonNode body) {
        return Mono.fromCallable(() -> datasetReader.readBundle(body))
                .doOnNext(bundle -> log.debug("Received dataset bundle with {} records", bundle.totalRecords()))
                .flatMap(pipeline::run);
    }

    /**
     * Validates the records of a single entity type.
     *
     * @param entity the entity key
     * @param body   the records
     * @return the validation report
     */
    @PostMapping("/{entity}")
    @Operation(
        summary = "Validate records of one entity type",
        description = "Accepts an array of records, an object holding the entity's collection, " +
                     "or a single record, and returns the validation report."
    )
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "Validation completed"),
        @ApiResponse(responseCode = "400", description = "Unknown entity type or malformed records")
    })
    public Mono<ValidationReportDocument> validateEntity(
            @Parameter(description = "products, customers, orders or inventory") @PathVariable String entity,
            @RequestBody JsonNode body) {
        return Mono.fromCallable(() -> resolve(entity))
                .flatMap(type -> Mono.fromCallable(() -> datasetReader.readEntityBundle(body, type))
                        .flatMap(bundle -> pipeline.validate(type, bundle)))
                .map(ValidationReport::toJson);
    }

    private static EntityType resolve(String entity) {
        return EntityType.fromKey(entity).orElseThrow(() -> new MalformedDatasetException(
                "Unknown entity type: " + entity,
                List.of("Supported entity types: " + String.join(", ",
                        Arrays.stream(EntityType.values()).map(EntityType::getKey).toList()))));
    }
}
