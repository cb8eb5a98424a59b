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

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.ingestion.event.ValidationCompletedEvent;
import org.fireflyframework.ingestion.model.DatasetBundle;
import org.fireflyframework.ingestion.model.EntityType;
import org.fireflyframework.ingestion.model.ErpRecord;
import org.fireflyframework.ingestion.validation.AbstractRecordValidator;
import org.fireflyframework.ingestion.validation.ValidationReport;
import org.fireflyframework.ingestion.validator.CustomerValidator;
import org.fireflyframework.ingestion.validator.InventoryValidator;
import org.fireflyframework.ingestion.validator.OrderValidator;
import org.fireflyframework.ingestion.validator.ProductValidator;
import org.springframework.context.ApplicationEventPublisher;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Runs the four entity validators over a {@link DatasetBundle} and folds their reports into a
 * {@link PipelineSummary}.
 *
 * <p>Each validator runs as an independent task on {@link Schedulers#boundedElastic()}; the
 * summary is computed once all four have completed. When an {@link ApplicationEventPublisher}
 * is provided, a {@link ValidationCompletedEvent} is published after each run.</p>
 *
 * <pre>{@code
 * ValidationPipeline pipeline = new ValidationPipeline(
 *         new ProductValidator(), new CustomerValidator(), new OrderValidator(), new InventoryValidator());
 *
 * pipeline.run(bundle)
 *         .filter(PipelineSummary::isReady)
 *         .subscribe(summary -> importer.load(bundle));
 * }</pre>
 */
@Slf4j
public class ValidationPipeline {

    private final ProductValidator productValidator;
    private final CustomerValidator customerValidator;
    private final OrderValidator orderValidator;
    private final InventoryValidator inventoryValidator;
    private final ApplicationEventPublisher eventPublisher;
    private final Duration runTimeout;
    private final PipelineSummaryAggregator aggregator = new PipelineSummaryAggregator();

    public ValidationPipeline(ProductValidator productValidator, CustomerValidator customerValidator,
                              OrderValidator orderValidator, InventoryValidator inventoryValidator) {
        this(productValidator, customerValidator, orderValidator, inventoryValidator, null, null);
    }

    /**
     * Creates a pipeline.
     *
     * @param eventPublisher the event publisher, or {@code null} to disable event publishing
     * @param runTimeout     deadline for a whole run, or {@code null} for none
     */
    public ValidationPipeline(ProductValidator productValidator, CustomerValidator customerValidator,
                              OrderValidator orderValidator, InventoryValidator inventoryValidator,
                              ApplicationEventPublisher eventPublisher, Duration runTimeout) {
        this.productValidator = productValidator;
        this.customerValidator = customerValidator;
        this.orderValidator = orderValidator;
        this.inventoryValidator = inventoryValidator;
        this.eventPublisher = eventPublisher;
        this.runTimeout = runTimeout;
    }

    /**
     * Validates every collection of the bundle.
     *
     * @param bundle the datasets
     * @return a {@link Mono} emitting the summary; errors with {@link java.util.concurrent.TimeoutException}
     *         when the run exceeds the configured deadline
     */
    public Mono<PipelineSummary> run(DatasetBundle bundle) {
        if (bundle == null) {
            return Mono.error(new IllegalArgumentException("Dataset bundle is required"));
        }
        Mono<PipelineSummary> summary = Mono.defer(() -> {
            long start = System.currentTimeMillis();
            log.info("Starting validation pipeline for {} records", bundle.totalRecords());
            return Mono.zip(
                            validateAsync(productValidator, bundle.getProducts()),
                            validateAsync(customerValidator, bundle.getCustomers()),
                            validateAsync(orderValidator, bundle.getOrders()),
                            validateAsync(inventoryValidator, bundle.getInventory()))
                    .map(reports -> {
                        Map<EntityType, ValidationReport> byEntity = new EnumMap<>(EntityType.class);
                        byEntity.put(EntityType.PRODUCTS, reports.getT1());
                        byEntity.put(EntityType.CUSTOMERS, reports.getT2());
                        byEntity.put(EntityType.ORDERS, reports.getT3());
                        byEntity.put(EntityType.INVENTORY, reports.getT4());
                        return aggregator.aggregate(byEntity, System.currentTimeMillis() - start);
                    });
        });
        if (runTimeout != null) {
            summary = summary.timeout(runTimeout);
        }
        return summary
                .doOnNext(result -> log.info("Validation pipeline finished: health={}, readiness={}, blocking={}",
                        result.getPipelineHealth().getKey(), String.format(Locale.ROOT, "%.1f", result.getReadinessScore()),
                        result.getBlockingIssues()))
                .doOnNext(this::publishEvent);
    }

    /**
     * Validates the collection of a single entity type from the bundle.
     *
     * @param type   the entity type
     * @param bundle the datasets
     * @return a {@link Mono} emitting the completed report
     */
    public Mono<ValidationReport> validate(EntityType type, DatasetBundle bundle) {
        return switch (type) {
            case PRODUCTS -> validateAsync(productValidator, bundle.getProducts());
            case CUSTOMERS -> validateAsync(customerValidator, bundle.getCustomers());
            case ORDERS -> validateAsync(orderValidator, bundle.getOrders());
            case INVENTORY -> validateAsync(inventoryValidator, bundle.getInventory());
        };
    }

    private static <T extends ErpRecord> Mono<ValidationReport> validateAsync(AbstractRecordValidator<T> validator,
                                                                               List<T> records) {
        return Mono.fromCallable(() -> validator.validate(records))
                .subscribeOn(Schedulers.boundedElastic());
    }

    private void publishEvent(PipelineSummary summary) {
        if (eventPublisher != null) {
            eventPublisher.publishEvent(new ValidationCompletedEvent(summary));
        }
    }
}
