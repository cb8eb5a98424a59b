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

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Ordered accumulator of {@link ValidationEntry} findings for one validation run.
 *
 * <p>The report keeps running counters so that {@link #getStats()} and
 * {@link #hasErrors()} are constant time. Appends are synchronized, which makes a
 * single report safe to share between record workers. Once {@link #complete()} has
 * been called the report is frozen and any further append fails.</p>
 *
 * <p><b>Readiness gate:</b> {@code report.hasErrors() == false} means the batch is safe
 * to import; warnings alone never block.</p>
 */
public class ValidationReport {

    private final Clock clock;
    private final Instant startTime;

    private final List<ValidationEntry> entries = new ArrayList<>();
    private final List<String> infos = new ArrayList<>();

    private int totalRecords;
    private int validRecords;
    private int invalidRecords;
    private int errorCount;
    private int warningCount;
    private Instant endTime;
    private boolean completed;

    public ValidationReport() {
        this(Clock.systemUTC());
    }

    public ValidationReport(Clock clock) {
        this.clock = clock;
        this.startTime = clock.instant();
    }

    public void addError(String field, String message, Object value, String recordId) {
        addError(IssueCategory.FIELD_VALIDATION, field, message, value, recordId);
    }

    public void addError(IssueCategory category, String field, String message, Object value, String recordId) {
        add(entry(ValidationSeverity.ERROR, category, field, message, value, recordId));
    }

    public void addWarning(String field, String message, Object value, String recordId) {
        addWarning(IssueCategory.DATA_QUALITY, field, message, value, recordId);
    }

    public void addWarning(IssueCategory category, String field, String message, Object value, String recordId) {
        add(entry(ValidationSeverity.WARNING, category, field, message, value, recordId));
    }

    public synchronized void addInfo(String message) {
        ensureOpen();
        infos.add(message);
    }

    /**
     * Appends a pre-built entry, updating the running counters.
     *
     * @param entry the entry to append
     */
    public synchronized void add(ValidationEntry entry) {
        ensureOpen();
        entries.add(entry);
        if (entry.isError()) {
            errorCount++;
        } else if (entry.isWarning()) {
            warningCount++;
        }
    }

    /**
     * Merges the findings collected for one record and counts the record as valid
     * when none of them is an error.
     *
     * @param context the record context to merge
     */
    public synchronized void mergeRecord(RecordContext context) {
        ensureOpen();
        for (ValidationEntry entry : context.getEntries()) {
            add(entry);
        }
        infos.addAll(context.getInfos());
        if (context.hasErrors()) {
            invalidRecords++;
        } else {
            validRecords++;
        }
    }

    synchronized void setTotalRecords(int totalRecords) {
        ensureOpen();
        this.totalRecords = totalRecords;
    }

    /**
     * Freezes the report and records its end time. Idempotent.
     *
     * @return this report
     */
    public synchronized ValidationReport complete() {
        if (!completed) {
            endTime = clock.instant();
            completed = true;
        }
        return this;
    }

    public synchronized boolean isCompleted() {
        return completed;
    }

    public synchronized boolean hasErrors() {
        return errorCount > 0;
    }

    public synchronized boolean hasWarnings() {
        return warningCount > 0;
    }

    public synchronized ValidationStats getStats() {
        Instant end = endTime != null ? endTime : clock.instant();
        return ValidationStats.builder()
                .totalRecords(totalRecords)
                .validRecords(validRecords)
                .invalidRecords(invalidRecords)
                .errorCount(errorCount)
                .warningCount(warningCount)
                .successRate(totalRecords > 0 ? (validRecords * 100.0) / totalRecords : 0.0)
                .duration(Duration.between(startTime, end).toMillis())
                .build();
    }

    public synchronized List<ValidationEntry> getEntries() {
        return List.copyOf(entries);
    }

    public List<ValidationEntry> getErrors() {
        return getBySeverity(ValidationSeverity.ERROR);
    }

    public List<ValidationEntry> getWarnings() {
        return getBySeverity(ValidationSeverity.WARNING);
    }

    public synchronized List<String> getInfos() {
        return List.copyOf(infos);
    }

    /**
     * Returns entries filtered by the given severity, in insertion order.
     *
     * @param severity the severity to filter by
     * @return matching entries
     */
    public synchronized List<ValidationEntry> getBySeverity(ValidationSeverity severity) {
        return entries.stream()
                .filter(entry -> entry.getSeverity() == severity)
                .toList();
    }

    /**
     * Returns entries filtered by the given category, in insertion order.
     *
     * @param category the category to filter by
     * @return matching entries
     */
    public synchronized List<ValidationEntry> getByCategory(IssueCategory category) {
        return entries.stream()
                .filter(entry -> entry.getCategory() == category)
                .toList();
    }

    public Instant getStartTime() {
        return startTime;
    }

    Clock getClock() {
        return clock;
    }

    /**
     * Returns the serializable form of this report:
     * {@code {stats, errors, warnings, infos}}.
     *
     * @return the report document
     */
    public ValidationReportDocument toJson() {
        return ValidationReportDocument.builder()
                .stats(getStats())
                .errors(getErrors())
                .warnings(getWarnings())
                .infos(getInfos())
                .build();
    }

    private ValidationEntry entry(ValidationSeverity severity, IssueCategory category, String field,
                                  String message, Object value, String recordId) {
        return ValidationEntry.builder()
                .severity(severity)
                .category(category)
                .field(field)
                .message(message)
                .value(value)
                .recordId(recordId)
                .timestamp(clock.instant())
                .build();
    }

    private void ensureOpen() {
        if (completed) {
            throw new IllegalStateException("Validation report is complete and can no longer be modified");
        }
    }
}
