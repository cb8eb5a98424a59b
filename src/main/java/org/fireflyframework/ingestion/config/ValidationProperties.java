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

package org.fireflyframework.ingestion.config;

import lombok.Data;
import org.fireflyframework.ingestion.validation.ValidationThresholds;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.time.Period;

/**
 * Binding for the validation engine configuration.
 *
 * <pre>
 * firefly:
 *   ingestion:
 *     validation:
 *       enabled: true
 *       record-parallelism: 4
 *       run-timeout: 30s
 *       thresholds:
 *         epsilon: 0.01
 *         completeness-threshold: 0.5
 *         very-old-stock-age: 1095d
 *         order-date-horizon: 6m
 * </pre>
 */
@Data
@ConfigurationProperties(prefix = "firefly.ingestion.validation")
public class ValidationProperties {

    private boolean enabled = true;

    /** Records validated concurrently within one validator. 1 = sequential. */
    private int recordParallelism = 1;

    /** Deadline for a whole pipeline run. Null = no deadline. */
    private Duration runTimeout;

    private Thresholds thresholds = new Thresholds();

    public ValidationThresholds toThresholds() {
        return ValidationThresholds.builder()
                .epsilon(thresholds.epsilon)
                .completenessThreshold(thresholds.completenessThreshold)
                .lowMarginPercent(thresholds.lowMarginPercent)
                .highMarginPercent(thresholds.highMarginPercent)
                .descriptionMinLength(thresholds.descriptionMinLength)
                .descriptionMaxLength(thresholds.descriptionMaxLength)
                .highPrice(thresholds.highPrice)
                .veryOldStockAge(thresholds.veryOldStockAge)
                .highValueOrder(thresholds.highValueOrder)
                .orderDateHorizon(thresholds.orderDateHorizon)
                .suspiciousFutureOrder(thresholds.suspiciousFutureOrder)
                .maxOrderLines(thresholds.maxOrderLines)
                .highLineQuantity(thresholds.highLineQuantity)
                .veryHighStockQuantity(thresholds.veryHighStockQuantity)
                .expensiveSingleLine(thresholds.expensiveSingleLine)
                .lowOrderTotal(thresholds.lowOrderTotal)
                .build();
    }

    /**
     * Mutable mirror of {@link ValidationThresholds}, seeded with its defaults.
     */
    @Data
    public static class Thresholds {

        private static final ValidationThresholds DEFAULTS = ValidationThresholds.defaults();

        private double epsilon = DEFAULTS.getEpsilon();
        private double completenessThreshold = DEFAULTS.getCompletenessThreshold();
        private double lowMarginPercent = DEFAULTS.getLowMarginPercent();
        private double highMarginPercent = DEFAULTS.getHighMarginPercent();
        private int descriptionMinLength = DEFAULTS.getDescriptionMinLength();
        private int descriptionMaxLength = DEFAULTS.getDescriptionMaxLength();
        private double highPrice = DEFAULTS.getHighPrice();
        private Duration veryOldStockAge = DEFAULTS.getVeryOldStockAge();
        private double highValueOrder = DEFAULTS.getHighValueOrder();
        private Period orderDateHorizon = DEFAULTS.getOrderDateHorizon();
        private Duration suspiciousFutureOrder = DEFAULTS.getSuspiciousFutureOrder();
        private int maxOrderLines = DEFAULTS.getMaxOrderLines();
        private double highLineQuantity = DEFAULTS.getHighLineQuantity();
        private double veryHighStockQuantity = DEFAULTS.getVeryHighStockQuantity();
        private double expensiveSingleLine = DEFAULTS.getExpensiveSingleLine();
        private double lowOrderTotal = DEFAULTS.getLowOrderTotal();
    }
}
