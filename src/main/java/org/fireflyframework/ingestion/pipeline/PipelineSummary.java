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

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Data;
import org.fireflyframework.ingestion.model.EntityType;
import org.fireflyframework.ingestion.validation.ValidationReport;

import java.util.List;
import java.util.Map;

/**
 * Aggregate readiness assessment of one pipeline run. Read-only once built.
 *
 * <p>Serializes with snake_case keys, e.g. {@code overall_results}, {@code validator_results},
 * {@code critical_issues} and {@code readiness_score}.</p>
 */
@Data
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class PipelineSummary {

    private final OverallResults overallResults;

    /** Keyed by entity key ({@code products}, {@code customers}, ...). */
    private final Map<String, EntityResult> validatorResults;

    private final List<CriticalIssue> criticalIssues;
    private final List<Recommendation> recommendations;
    private final double readinessScore;
    private final double dataQualityScore;
    private final PipelineHealth pipelineHealth;
    private final int blockingIssues;
    private final PerformanceMetrics performanceMetrics;

    /** Counts per priority: {@code high_priority}, {@code medium_priority}, {@code low_priority}. */
    private final Map<String, Integer> recommendationsSummary;

    @JsonIgnore
    private final Map<EntityType, ValidationReport> reports;

    /**
     * Returns {@code true} when no validator reported an error.
     */
    @JsonIgnore
    public boolean isReady() {
        return blockingIssues == 0;
    }

    public ValidationReport getReport(EntityType type) {
        return reports.get(type);
    }
}
