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

package org.fireflyframework.ingestion.pipeline;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.fireflyframework.ingestion.ErpFixtures;
import org.fireflyframework.ingestion.model.EntityType;
import org.fireflyframework.ingestion.model.PartnerRecord;
import org.fireflyframework.ingestion.model.ProductRecord;
import org.fireflyframework.ingestion.model.PurchaseOrderRecord;
import org.fireflyframework.ingestion.model.StockRecord;
import org.fireflyframework.ingestion.validation.ValidationReport;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Tests for {@link PipelineSummaryAggregator}.
 */
class PipelineSummaryAggregatorTest {

    private final PipelineSummaryAggregator aggregator = new PipelineSummaryAggregator();

    @Test
    void aggregate_shouldScoreCleanRunAsExcellent() {
        // Given
        Map<EntityType, ValidationReport> reports = cleanReports();

        // When
        PipelineSummary summary = aggregator.aggregate(reports, 12);

        // Then
        assertThat(summary.getReadinessScore()).isCloseTo(100.0, within(1e-9));
        assertThat(summary.getDataQualityScore()).isEqualTo(100.0);
        assertThat(summary.getPipelineHealth()).isEqualTo(PipelineHealth.EXCELLENT);
        assertThat(summary.getBlockingIssues()).isZero();
        assertThat(summary.isReady()).isTrue();
        assertThat(summary.getRecommendations()).isEmpty();
        assertThat(summary.getOverallResults().getTotalRecordsProcessed()).isEqualTo(4);
        assertThat(summary.getValidatorResults()).containsOnlyKeys("products", "customers", "orders", "inventory");
        assertThat(summary.getRecommendationsSummary())
                .containsEntry("high_priority", 0)
                .containsEntry("medium_priority", 0)
                .containsEntry("low_priority", 0);
        assertThat(summary.getPerformanceMetrics().getWallClockTimeMs()).isEqualTo(12);
        assertThat(summary.getReport(EntityType.ORDERS)).isSameAs(reports.get(EntityType.ORDERS));
    }

    @Test
    void aggregate_shouldScoreEmptyRunAsPoorWithoutBlockingIssues() {
        // Given
        Map<EntityType, ValidationReport> reports = new EnumMap<>(EntityType.class);
        reports.put(EntityType.PRODUCTS, ErpFixtures.productValidator().validate(List.of()));
        reports.put(EntityType.CUSTOMERS, ErpFixtures.customerValidator().validate(List.of()));
        reports.put(EntityType.ORDERS, ErpFixtures.orderValidator().validate(List.of()));
        reports.put(EntityType.INVENTORY, ErpFixtures.inventoryValidator().validate(List.of()));

        // When
        PipelineSummary summary = aggregator.aggregate(reports, 0);

        // Then
        assertThat(summary.getOverallResults().getSuccessRate()).isZero();
        assertThat(summary.getReadinessScore()).isCloseTo(30.0, within(1e-9));
        assertThat(summary.getPipelineHealth()).isEqualTo(PipelineHealth.POOR);
        assertThat(summary.getBlockingIssues()).isZero();
        assertThat(summary.getRecommendations()).singleElement()
                .satisfies(recommendation -> {
                    assertThat(recommendation.getPriority()).isEqualTo(Priority.HIGH);
                    assertThat(recommendation.getCategory()).isEqualTo("data_quality");
                });
    }

    @Test
    void aggregate_shouldRecommendFixesForBrokenProducts() {
        // Given
        List<ProductRecord> products = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            products.add(ProductRecord.of(ErpFixtures.with(ErpFixtures.product(),
                    "sku", "GC1000" + i + "-BLA", "name", "Trail Sock " + i, "category", "socks")));
        }
        Map<EntityType, ValidationReport> reports = new EnumMap<>(EntityType.class);
        reports.put(EntityType.PRODUCTS, ErpFixtures.productValidator().validate(products));
        reports.put(EntityType.CUSTOMERS, ErpFixtures.customerValidator().validate(List.of()));

        // When
        PipelineSummary summary = aggregator.aggregate(reports, 5);

        // Then
        assertThat(summary.getOverallResults().getErrorRate()).isEqualTo(100.0);
        assertThat(summary.getReadinessScore()).isZero();
        assertThat(summary.getDataQualityScore()).isZero();
        assertThat(summary.getPipelineHealth()).isEqualTo(PipelineHealth.POOR);
        assertThat(summary.getBlockingIssues()).isEqualTo(10);
        assertThat(summary.getCriticalIssues())
                .allSatisfy(issue -> {
                    assertThat(issue.getValidator()).isEqualTo("products");
                    assertThat(issue.getField()).isEqualTo("category");
                });
        assertThat(summary.getRecommendations())
                .extracting(recommendation -> recommendation.getPriority() + "/" + recommendation.getCategory())
                .containsExactly("HIGH/data_quality", "HIGH/products", "HIGH/data_correction", "MEDIUM/products");
        assertThat(summary.getRecommendations().get(3).getMessage())
                .isEqualTo("products validation success rate is 0.0%");
        assertThat(summary.getRecommendationsSummary())
                .containsEntry("high_priority", 3)
                .containsEntry("medium_priority", 1);
    }

    @Test
    void pipelineHealth_shouldFollowScoreBands() {
        assertThat(PipelineHealth.fromScore(90)).isEqualTo(PipelineHealth.EXCELLENT);
        assertThat(PipelineHealth.fromScore(89.9)).isEqualTo(PipelineHealth.GOOD);
        assertThat(PipelineHealth.fromScore(75)).isEqualTo(PipelineHealth.GOOD);
        assertThat(PipelineHealth.fromScore(60)).isEqualTo(PipelineHealth.FAIR);
        assertThat(PipelineHealth.fromScore(59.9)).isEqualTo(PipelineHealth.POOR);
    }

    @Test
    void summary_shouldSerializeWithSnakeCaseKeys() {
        // Given
        PipelineSummary summary = aggregator.aggregate(cleanReports(), 3);

        // When
        JsonNode json = new ObjectMapper().valueToTree(summary);

        // Then
        assertThat(json.has("overall_results")).isTrue();
        assertThat(json.get("pipeline_health").asText()).isEqualTo("excellent");
        assertThat(json.get("validator_results").get("products").get("success_rate").asDouble()).isEqualTo(100.0);
        assertThat(json.get("recommendations_summary").has("high_priority")).isTrue();
        assertThat(json.has("reports")).isFalse();
        assertThat(json.has("ready")).isFalse();
    }

    private static Map<EntityType, ValidationReport> cleanReports() {
        Map<EntityType, ValidationReport> reports = new EnumMap<>(EntityType.class);
        reports.put(EntityType.PRODUCTS,
                ErpFixtures.productValidator().validate(List.of(ProductRecord.of(ErpFixtures.product()))));
        reports.put(EntityType.CUSTOMERS,
                ErpFixtures.customerValidator().validate(List.of(PartnerRecord.of(ErpFixtures.customer()))));
        reports.put(EntityType.ORDERS,
                ErpFixtures.orderValidator().validate(List.of(PurchaseOrderRecord.of(ErpFixtures.order()))));
        reports.put(EntityType.INVENTORY,
                ErpFixtures.inventoryValidator().validate(List.of(StockRecord.of(ErpFixtures.stock()))));
        return reports;
    }
}
