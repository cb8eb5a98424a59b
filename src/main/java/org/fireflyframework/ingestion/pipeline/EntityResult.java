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

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Data;
import org.fireflyframework.ingestion.validation.ValidationStats;

/**
 * Statistics of one entity validator within a pipeline run.
 */
@Data
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class EntityResult {

    private final int totalRecords;
    private final int validRecords;
    private final int invalidRecords;
    private final int errorCount;
    private final int warningCount;
    private final double successRate;
    private final long durationMs;

    public static EntityResult from(ValidationStats stats) {
        return EntityResult.builder()
                .totalRecords(stats.getTotalRecords())
                .validRecords(stats.getValidRecords())
                .invalidRecords(stats.getInvalidRecords())
                .errorCount(stats.getErrorCount())
                .warningCount(stats.getWarningCount())
                .successRate(stats.getSuccessRate())
                .durationMs(stats.getDuration())
                .build();
    }
}
