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
import lombok.Data;

import java.time.Duration;
import java.time.Period;

/**
 * Numeric thresholds used by the entity validators.
 *
 * <p>The defaults reproduce the heuristics the validators were calibrated with. Money and
 * quantity comparisons use {@link #getEpsilon()} as tolerance.</p>
 */
@Data
@Builder(toBuilder = true)
public class ValidationThresholds {

    @Builder.Default
    private final double epsilon = 0.01;

    /** Fraction of required fields a record must carry before a completeness warning. */
    @Builder.Default
    private final double completenessThreshold = 0.5;

    @Builder.Default
    private final double lowMarginPercent = 10.0;

    @Builder.Default
    private final double highMarginPercent = 300.0;

    @Builder.Default
    private final int descriptionMinLength = 10;

    @Builder.Default
    private final int descriptionMaxLength = 1000;

    @Builder.Default
    private final double highPrice = 10_000.0;

    @Builder.Default
    private final Duration veryOldStockAge = Duration.ofDays(365L * 3);

    @Builder.Default
    private final double highValueOrder = 100_000.0;

    @Builder.Default
    private final Period orderDateHorizon = Period.ofMonths(6);

    @Builder.Default
    private final Duration suspiciousFutureOrder = Duration.ofDays(30);

    @Builder.Default
    private final int maxOrderLines = 50;

    @Builder.Default
    private final double highLineQuantity = 10_000.0;

    @Builder.Default
    private final double veryHighStockQuantity = 100_000.0;

    @Builder.Default
    private final double expensiveSingleLine = 50_000.0;

    @Builder.Default
    private final double lowOrderTotal = 1.0;

    public static ValidationThresholds defaults() {
        return ValidationThresholds.builder().build();
    }
}
