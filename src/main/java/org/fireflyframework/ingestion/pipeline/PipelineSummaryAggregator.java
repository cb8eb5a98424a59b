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

import org.fireflyframework.ingestion.model.EntityType;
import org.fireflyframework.ingestion.validation.ValidationEntry;
import org.fireflyframework.ingestion.validation.ValidationReport;
import org.fireflyframework.ingestion.validation.ValidationStats;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Folds the four entity reports of a run into a {@link PipelineSummary}.
 *
 * <ul>
 *   <li>readiness = clamp(successRate &times; 0.7 + max(0, 100 - errorRate) &times; 0.3, 0, 100)</li>
 *   <li>data quality = max(0, 100 - 2 &times; errorRate)</li>
 *   <li>errorRate = errors / max(totalRecords, 1) &times; 100</li>
 * </ul>
 */
public class PipelineSummaryAggregator {

    static final double OVERALL_SUCCESS_THRESHOLD = 70.0;
    static final double ENTITY_SUCCESS_THRESHOLD = 80.0;
    static final double ENTITY_ERROR_SHARE = 0.1;
    static final int FIELD_ISSUE_THRESHOLD = 5;

    /**
     * Builds the summary.
     *
     * @param reports       completed reports keyed by entity type
     * @param wallClockTime elapsed time of the whole run, in milliseconds
     * @return the summary
     */
    public PipelineSummary aggregate(Map<EntityType, ValidationReport> reports, long wallClockTime) {
        Map<EntityType, ValidationReport> ordered = new EnumMap<>(EntityType.class);
        ordered.putAll(reports);

        Map<String, EntityResult> validatorResults = new LinkedHashMap<>();
        List<CriticalIssue> criticalIssues = new ArrayList<>();
        int totalRecords = 0;
        int validRecords = 0;
        int totalErrors = 0;
        int totalWarnings = 0;
        long processingTime = 0;

        for (Map.Entry<EntityType, ValidationReport> entry : ordered.entrySet()) {
            String validator = entry.getKey().getKey();
            ValidationStats stats = entry.getValue().getStats();
            validatorResults.put(validator, EntityResult.from(stats));
            totalRecords += stats.getTotalRecords();
            validRecords += stats.getValidRecords();
            totalErrors += stats.getErrorCount();
            totalWarnings += stats.getWarningCount();
            processingTime += stats.getDuration();

            for (ValidationEntry error : entry.getValue().getErrors()) {
                criticalIssues.add(CriticalIssue.builder()
                        .validator(validator)
                        .field(error.getField())
                        .message(error.getMessage())
                        .recordId(error.getRecordId())
                        .build());
            }
        }

        double successRate = totalRecords > 0 ? (double) validRecords / totalRecords * 100 : 0.0;
        double errorRate = (double) totalErrors / Math.max(totalRecords, 1) * 100;
        double readiness = clamp(successRate * 0.7 + Math.max(0, 100 - errorRate) * 0.3);
        double dataQuality = Math.max(0, 100 - errorRate * 2);

        OverallResults overall = OverallResults.builder()
                .totalRecordsProcessed(totalRecords)
                .totalErrors(totalErrors)
                .totalWarnings(totalWarnings)
                .successRate(successRate)
                .errorRate(errorRate)
                .build();

        List<Recommendation> recommendations = recommend(overall, validatorResults, criticalIssues);

        return PipelineSummary.builder()
                .overallResults(overall)
                .validatorResults(validatorResults)
                .criticalIssues(List.copyOf(criticalIssues))
                .recommendations(recommendations)
                .readinessScore(readiness)
                .dataQualityScore(dataQuality)
                .pipelineHealth(PipelineHealth.fromScore(readiness))
                .blockingIssues(criticalIssues.size())
                .performanceMetrics(PerformanceMetrics.builder()
                        .totalProcessingTimeMs(processingTime)
                        .wallClockTimeMs(wallClockTime)
                        .recordsPerSecond(totalRecords / (processingTime > 0 ? processingTime / 1000.0 : 1.0))
                        .averageValidationTimeMs(ordered.isEmpty() ? 0 : (double) processingTime / ordered.size())
                        .build())
                .recommendationsSummary(countByPriority(recommendations))
                .reports(Collections.unmodifiableMap(ordered))
                .build();
    }

    List<Recommendation> recommend(OverallResults overall, Map<String, EntityResult> validatorResults,
                                   List<CriticalIssue> criticalIssues) {
        List<Recommendation> recommendations = new ArrayList<>();

        if (overall.getSuccessRate() < OVERALL_SUCCESS_THRESHOLD) {
            recommendations.add(Recommendation.builder()
                    .priority(Priority.HIGH)
                    .category("data_quality")
                    .message("Overall success rate is below 70%. Consider improving data quality before import.")
                    .action("Review and clean source data")
                    .build());
        }

        validatorResults.forEach((type, result) -> {
            if (result.getTotalRecords() == 0) {
                return;
            }
            if (result.getSuccessRate() < ENTITY_SUCCESS_THRESHOLD) {
                recommendations.add(Recommendation.builder()
                        .priority(Priority.MEDIUM)
                        .category(type)
                        .message(String.format(Locale.ROOT, "%s validation success rate is %.1f%%",
                                type, result.getSuccessRate()))
                        .action("Review " + type + " data quality and validation rules")
                        .build());
            }
            if (result.getErrorCount() > result.getTotalRecords() * ENTITY_ERROR_SHARE) {
                recommendations.add(Recommendation.builder()
                        .priority(Priority.HIGH)
                        .category(type)
                        .message("High error rate in " + type + " validation (" + result.getErrorCount()
                                + " errors)")
                        .action("Address critical " + type + " data issues before proceeding")
                        .build());
            }
        });

        Map<String, Integer> issuesByField = new LinkedHashMap<>();
        for (CriticalIssue issue : criticalIssues) {
            if (issue.getField() != null) {
                issuesByField.merge(issue.getField(), 1, Integer::sum);
            }
        }
        issuesByField.forEach((field, count) -> {
            if (count > FIELD_ISSUE_THRESHOLD) {
                recommendations.add(Recommendation.builder()
                        .priority(Priority.HIGH)
                        .category("data_correction")
                        .message("Multiple issues with field '" + field + "' (" + count + " occurrences)")
                        .action("Review and fix " + field + " data patterns")
                        .build());
            }
        });

        recommendations.sort(Comparator.comparing(Recommendation::getPriority));
        return List.copyOf(recommendations);
    }

    private static Map<String, Integer> countByPriority(List<Recommendation> recommendations) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (Priority priority : Priority.values()) {
            counts.put(priority.getKey() + "_priority", 0);
        }
        recommendations.forEach(recommendation ->
                counts.merge(recommendation.getPriority().getKey() + "_priority", 1, Integer::sum));
        return counts;
    }

    private static double clamp(double score) {
        return Math.max(0, Math.min(100, score));
    }
}
