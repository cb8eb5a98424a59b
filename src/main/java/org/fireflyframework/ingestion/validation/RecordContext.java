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
import java.util.ArrayList;
import java.util.List;

/**
 * Per-record scratch buffer used while one record is validated.
 *
 * <p>Entries are buffered here and merged into the owning {@link ValidationReport}
 * in input order once the record is done, so record workers never interleave their
 * output. Confined to a single thread.</p>
 */
public class RecordContext {

    private final String recordId;
    private final int index;
    private final Clock clock;
    private final List<ValidationEntry> entries = new ArrayList<>();
    private final List<String> infos = new ArrayList<>();
    private int errorCount;

    public RecordContext(String recordId, int index, Clock clock) {
        this.recordId = recordId;
        this.index = index;
        this.clock = clock;
    }

    public void error(IssueCategory category, String field, String message, Object value) {
        error(category, field, message, value, null);
    }

    public void error(IssueCategory category, String field, String message, Object value, String rule) {
        append(ValidationSeverity.ERROR, category, field, message, value, rule);
        errorCount++;
    }

    public void warning(IssueCategory category, String field, String message, Object value) {
        warning(category, field, message, value, null);
    }

    public void warning(IssueCategory category, String field, String message, Object value, String rule) {
        append(ValidationSeverity.WARNING, category, field, message, value, rule);
    }

    public void info(String message) {
        infos.add(message);
    }

    public boolean hasErrors() {
        return errorCount > 0;
    }

    public String getRecordId() {
        return recordId;
    }

    public int getIndex() {
        return index;
    }

    public List<ValidationEntry> getEntries() {
        return entries;
    }

    public List<String> getInfos() {
        return infos;
    }

    private void append(ValidationSeverity severity, IssueCategory category, String field,
                        String message, Object value, String rule) {
        entries.add(ValidationEntry.builder()
                .severity(severity)
                .category(category)
                .field(field)
                .message(message)
                .value(value)
                .recordId(recordId)
                .rule(rule)
                .timestamp(clock.instant())
                .build());
    }
}
