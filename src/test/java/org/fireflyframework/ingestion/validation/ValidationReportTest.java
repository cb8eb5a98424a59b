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

import org.fireflyframework.ingestion.ErpFixtures;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link ValidationReport}.
 */
class ValidationReportTest {

    @Test
    void addError_shouldCountErrorsAndDefaultToFieldValidation() {
        // Given
        ValidationReport report = new ValidationReport(ErpFixtures.CLOCK);

        // When
        report.addError("sku", "Field is required", null, "record_0");
        report.addWarning("name", "Duplicate value found", "Tee", "record_1");

        // Then
        assertThat(report.hasErrors()).isTrue();
        assertThat(report.hasWarnings()).isTrue();
        assertThat(report.getErrors()).singleElement()
                .satisfies(entry -> {
                    assertThat(entry.getCategory()).isEqualTo(IssueCategory.FIELD_VALIDATION);
                    assertThat(entry.getRecordId()).isEqualTo("record_0");
                    assertThat(entry.getTimestamp()).isEqualTo(ErpFixtures.CLOCK.instant());
                });
        assertThat(report.getWarnings()).singleElement()
                .satisfies(entry -> assertThat(entry.getCategory()).isEqualTo(IssueCategory.DATA_QUALITY));
    }

    @Test
    void mergeRecord_shouldCountRecordInvalidOnlyWhenItHasErrors() {
        // Given
        ValidationReport report = new ValidationReport(ErpFixtures.CLOCK);
        report.setTotalRecords(2);
        RecordContext clean = new RecordContext("a", 0, ErpFixtures.CLOCK);
        clean.warning(IssueCategory.DATA_QUALITY, "name", "Suspicious placeholder-like value detected", "test");
        RecordContext broken = new RecordContext("b", 1, ErpFixtures.CLOCK);
        broken.error(IssueCategory.SCHEMA_VIOLATION, "partner_id", "Missing required field", null);

        // When
        report.mergeRecord(clean);
        report.mergeRecord(broken);
        ValidationStats stats = report.complete().getStats();

        // Then
        assertThat(stats.getValidRecords()).isEqualTo(1);
        assertThat(stats.getInvalidRecords()).isEqualTo(1);
        assertThat(stats.getErrorCount()).isEqualTo(1);
        assertThat(stats.getWarningCount()).isEqualTo(1);
        assertThat(stats.getSuccessRate()).isEqualTo(50.0);
    }

    @Test
    void getStats_shouldReportZeroSuccessRateForEmptyBatch() {
        // Given
        ValidationReport report = new ValidationReport(ErpFixtures.CLOCK);

        // When
        ValidationStats stats = report.complete().getStats();

        // Then
        assertThat(stats.getTotalRecords()).isZero();
        assertThat(stats.getSuccessRate()).isZero();
    }

    @Test
    void complete_shouldFreezeReport() {
        // Given
        ValidationReport report = new ValidationReport(ErpFixtures.CLOCK);
        report.complete();

        // When & Then
        assertThat(report.isCompleted()).isTrue();
        assertThatThrownBy(() -> report.addError("sku", "late", null, null))
                .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> report.addInfo("late"))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void complete_shouldKeepFirstEndTime() {
        // Given
        MutableClock clock = new MutableClock(Instant.parse("2026-10-17T12:00:00Z"));
        ValidationReport report = new ValidationReport(clock);

        // When
        clock.now = Instant.parse("2026-10-17T12:00:02Z");
        report.complete();
        clock.now = Instant.parse("2026-10-17T12:00:09Z");
        report.complete();

        // Then
        assertThat(report.getStats().getDuration()).isEqualTo(2000L);
    }

    @Test
    void getByCategory_shouldFilterEntries() {
        // Given
        ValidationReport report = new ValidationReport(ErpFixtures.CLOCK);
        report.addWarning(IssueCategory.DUPLICATE_RECORD, "email", "Duplicate email address found", "a@b.com", "2");
        report.addWarning("zip", "ZIP code format may not match country: US", "ABC", "3");

        // When & Then
        assertThat(report.getByCategory(IssueCategory.DUPLICATE_RECORD)).hasSize(1);
        assertThat(report.getBySeverity(ValidationSeverity.WARNING)).hasSize(2);
        assertThat(report.getBySeverity(ValidationSeverity.ERROR)).isEmpty();
    }

    @Test
    void toJson_shouldExposeStatsAndEntries() {
        // Given
        ValidationReport report = new ValidationReport(ErpFixtures.CLOCK);
        report.addInfo("Starting batch validation of 0 records");
        report.addError("data", "Data is required", null, null);

        // When
        ValidationReportDocument document = report.complete().toJson();

        // Then
        assertThat(document.getStats().getErrorCount()).isEqualTo(1);
        assertThat(document.getErrors()).hasSize(1);
        assertThat(document.getWarnings()).isEmpty();
        assertThat(document.getInfos()).containsExactly("Starting batch validation of 0 records");
    }

    private static final class MutableClock extends Clock {

        private Instant now;

        private MutableClock(Instant now) {
            this.now = now;
        }

        @Override
        public ZoneOffset getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(java.time.ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
