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

package org.fireflyframework.ingestion.integration;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.fireflyframework.ingestion.ErpFixtures;
import org.fireflyframework.ingestion.model.DatasetBundle;
import org.fireflyframework.ingestion.model.DatasetReader;
import org.fireflyframework.ingestion.model.EntityType;
import org.fireflyframework.ingestion.pipeline.PipelineHealth;
import org.fireflyframework.ingestion.pipeline.ValidationPipeline;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.io.IOException;
import java.io.InputStream;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * End-to-end run over a mixed-quality dataset read from JSON: reader, four validators,
 * aggregation and recommendations.
 */
class DatasetValidationIntegrationTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void fullFlow_readBundle_validate_summarize() throws IOException {
        // Given
        DatasetBundle bundle = new DatasetReader(objectMapper).readBundle(load("/datasets/erp-bundle.json"));
        ValidationPipeline pipeline = new ValidationPipeline(ErpFixtures.productValidator(),
                ErpFixtures.customerValidator(), ErpFixtures.orderValidator(), ErpFixtures.inventoryValidator());

        // When & Then
        StepVerifier.create(pipeline.run(bundle))
                .assertNext(summary -> {
                    assertThat(summary.getOverallResults().getTotalRecordsProcessed()).isEqualTo(8);
                    assertThat(summary.getOverallResults().getSuccessRate()).isEqualTo(75.0);
                    assertThat(summary.getOverallResults().getTotalErrors()).isEqualTo(5);
                    assertThat(summary.getBlockingIssues()).isEqualTo(5);
                    assertThat(summary.getPipelineHealth()).isEqualTo(PipelineHealth.FAIR);
                    assertThat(summary.isReady()).isFalse();

                    assertThat(summary.getValidatorResults().get("products").getInvalidRecords()).isEqualTo(1);
                    assertThat(summary.getValidatorResults().get("customers").getInvalidRecords()).isZero();
                    assertThat(summary.getValidatorResults().get("orders").getInvalidRecords()).isZero();
                    assertThat(summary.getValidatorResults().get("inventory").getInvalidRecords()).isEqualTo(1);

                    assertThat(summary.getCriticalIssues())
                            .filteredOn(issue -> issue.getValidator().equals("inventory"))
                            .singleElement()
                            .satisfies(issue -> assertThat(issue.getMessage())
                                    .isEqualTo("Quantity mismatch. Available: 4, Expected: 5"));

                    assertThat(summary.getRecommendations())
                            .extracting(recommendation -> recommendation.getPriority() + "/"
                                    + recommendation.getCategory())
                            .containsExactly("HIGH/products", "HIGH/inventory", "MEDIUM/products",
                                    "MEDIUM/inventory");

                    assertThat(summary.getReport(EntityType.CUSTOMERS).hasWarnings()).isFalse();
                })
                .verifyComplete();
    }

    private JsonNode load(String resource) throws IOException {
        try (InputStream in = getClass().getResourceAsStream(resource)) {
            assertThat(in).as("test resource %s", resource).isNotNull();
            return objectMapper.readTree(in);
        }
    }
}
