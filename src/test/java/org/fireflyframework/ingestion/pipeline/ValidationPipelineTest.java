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

import org.fireflyframework.ingestion.ErpFixtures;
import org.fireflyframework.ingestion.event.ValidationCompletedEvent;
import org.fireflyframework.ingestion.model.DatasetBundle;
import org.fireflyframework.ingestion.model.EntityType;
import org.fireflyframework.ingestion.model.ProductRecord;
import org.fireflyframework.ingestion.schema.SchemaValidator;
import org.fireflyframework.ingestion.validation.ValidationThresholds;
import org.fireflyframework.ingestion.validation.rule.PredicateRule;
import org.fireflyframework.ingestion.validator.ProductValidator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeoutException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

/**
 * Unit tests for {@link ValidationPipeline}.
 */
@ExtendWith(MockitoExtension.class)
class ValidationPipelineTest {

    @Mock
    private ApplicationEventPublisher eventPublisher;

    private ValidationPipeline pipeline;

    @BeforeEach
    void setUp() {
        pipeline = new ValidationPipeline(ErpFixtures.productValidator(), ErpFixtures.customerValidator(),
                ErpFixtures.orderValidator(), ErpFixtures.inventoryValidator(), eventPublisher, null);
    }

    @Test
    void run_shouldReportCleanBundleAsReady() {
        // When & Then
        StepVerifier.create(pipeline.run(ErpFixtures.validBundle()))
                .assertNext(summary -> {
                    assertThat(summary.isReady()).isTrue();
                    assertThat(summary.getPipelineHealth()).isEqualTo(PipelineHealth.EXCELLENT);
                    assertThat(summary.getOverallResults().getTotalRecordsProcessed()).isEqualTo(4);
                    assertThat(summary.getValidatorResults().get("inventory").getValidRecords()).isEqualTo(1);
                    assertThat(summary.getReport(EntityType.PRODUCTS).isCompleted()).isTrue();
                })
                .verifyComplete();
    }

    @Test
    void run_shouldPublishCompletionEvent() {
        // Given
        DatasetBundle bundle = DatasetBundle.builder()
                .products(List.of(ProductRecord.of(ErpFixtures.with(ErpFixtures.product(), "category", "socks"))))
                .build();

        // When
        StepVerifier.create(pipeline.run(bundle))
                .assertNext(summary -> assertThat(summary.getBlockingIssues()).isEqualTo(1))
                .verifyComplete();

        // Then
        ArgumentCaptor<ValidationCompletedEvent> captor = ArgumentCaptor.forClass(ValidationCompletedEvent.class);
        verify(eventPublisher).publishEvent(captor.capture());
        ValidationCompletedEvent event = captor.getValue();
        assertThat(event.getSummary().isReady()).isFalse();
        assertThat(event.getSummary().getCriticalIssues()).singleElement()
                .satisfies(issue -> assertThat(issue.getField()).isEqualTo("category"));
        assertThat(event.getTimestamp()).isNotNull();
    }

    @Test
    void run_shouldRejectMissingBundle() {
        // When & Then
        StepVerifier.create(pipeline.run(null))
                .expectError(IllegalArgumentException.class)
                .verify();
        verify(eventPublisher, never()).publishEvent(any(Object.class));
    }

    @Test
    void run_shouldTimeOutSlowValidation() {
        // Given
        ProductValidator slow = new ProductValidator(new SchemaValidator(), ValidationThresholds.defaults(),
                ErpFixtures.CLOCK, List.of(PredicateRule.<ProductRecord>builder()
                .name("slow_lookup")
                .predicate(product -> {
                    try {
                        Thread.sleep(2_000);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                    return true;
                })
                .build()));
        ValidationPipeline slowPipeline = new ValidationPipeline(slow, ErpFixtures.customerValidator(),
                ErpFixtures.orderValidator(), ErpFixtures.inventoryValidator(), eventPublisher,
                Duration.ofMillis(100));

        // When & Then
        StepVerifier.create(slowPipeline.run(ErpFixtures.validBundle()))
                .expectError(TimeoutException.class)
                .verify(Duration.ofSeconds(5));
        verify(eventPublisher, never()).publishEvent(any(Object.class));
    }

    @Test
    void validate_shouldRunSingleEntity() {
        // When & Then
        StepVerifier.create(pipeline.validate(EntityType.ORDERS, ErpFixtures.validBundle()))
                .assertNext(report -> {
                    assertThat(report.getStats().getTotalRecords()).isEqualTo(1);
                    assertThat(report.hasErrors()).isFalse();
                })
                .verifyComplete();
    }

    @Test
    void run_shouldWorkWithoutEventPublisher() {
        // Given
        ValidationPipeline quiet = new ValidationPipeline(ErpFixtures.productValidator(),
                ErpFixtures.customerValidator(), ErpFixtures.orderValidator(), ErpFixtures.inventoryValidator());

        // When & Then
        StepVerifier.create(quiet.run(DatasetBundle.builder().build()))
                .assertNext(summary -> assertThat(summary.getOverallResults().getTotalRecordsProcessed()).isZero())
                .verifyComplete();
    }
}
