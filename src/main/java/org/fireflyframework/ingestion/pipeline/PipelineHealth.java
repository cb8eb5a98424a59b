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

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Health label derived from the readiness score.
 */
public enum PipelineHealth {

    EXCELLENT(90),
    GOOD(75),
    FAIR(60),
    POOR(0);

    private final double minimumScore;

    PipelineHealth(double minimumScore) {
        this.minimumScore = minimumScore;
    }

    public double getMinimumScore() {
        return minimumScore;
    }

    @JsonValue
    public String getKey() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static PipelineHealth fromScore(double readinessScore) {
        for (PipelineHealth health : values()) {
            if (readinessScore >= health.minimumScore) {
                return health;
            }
        }
        return POOR;
    }
}
