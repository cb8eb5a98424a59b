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

package org.fireflyframework.ingestion.validator;

import org.fireflyframework.ingestion.ErpFixtures;
import org.fireflyframework.ingestion.model.PurchaseOrderRecord;
import org.fireflyframework.ingestion.validation.IssueCategory;
import org.fireflyframework.ingestion.validation.ValidationReport;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link OrderValidator}.
 */
class OrderValidatorTest {

    private final OrderValidator validator = ErpFixtures.orderValidator();

    @Test
    void validate_shouldAcceptCleanOrder() {
        // When
        ValidationReport report = validator.validate(List.of(PurchaseOrderRecord.of(ErpFixtures.order())));

        // Then
        assertThat(report.getEntries()).isEmpty();
        assertThat(report.getInfos()).contains("Average order value: 30.75", "Average line items per order: 2.0");
    }

    @Test
    void validate_shouldRejectTotalThatDoesNotMatchLines() {
        // Given
        PurchaseOrderRecord order = PurchaseOrderRecord.of(ErpFixtures.with(ErpFixtures.order(),
                "amount_untaxed", 30, "amount_total", 35.75));

        // When
        ValidationReport report = validator.validate(List.of(order));

        // Then
        assertThat(report.getErrors()).singleElement()
                .satisfies(entry -> {
                    assertThat(entry.getRule()).isEqualTo("order_total_validation");
                    assertThat(entry.getField()).isEqualTo("amount_untaxed");
                    assertThat(entry.getMessage()).isEqualTo("Order total mismatch. Calculated: 25.00, Declared: 30.00");
                });
    }

    @Test
    void validate_shouldFallBackToAmountTotalWithoutUntaxed() {
        // Given
        PurchaseOrderRecord order = PurchaseOrderRecord.of(ErpFixtures.with(ErpFixtures.order(),
                "amount_untaxed", null, "amount_tax", null, "amount_total", 25.004));

        // When
        ValidationReport report = validator.validate(List.of(order));

        // Then
        assertThat(report.hasErrors()).isFalse();
    }

    @Test
    void validate_shouldFlagInconsistentTaxedTotal() {
        // Given
        PurchaseOrderRecord order = PurchaseOrderRecord.of(ErpFixtures.with(ErpFixtures.order(),
                "amount_total", 40.0));

        // When
        ValidationReport report = validator.validate(List.of(order));

        // Then
        assertThat(report.getErrors()).singleElement()
                .satisfies(entry -> {
                    assertThat(entry.getCategory()).isEqualTo(IssueCategory.DATA_QUALITY);
                    assertThat(entry.getMessage())
                            .isEqualTo("Amount total inconsistency. Untaxed: 25, Tax: 5.75, Total: 40");
                });
    }

    @Test
    void validate_shouldReportLineProblemsWithIndexedPaths() {
        // Given
        PurchaseOrderRecord order = PurchaseOrderRecord.of(ErpFixtures.with(ErpFixtures.order(),
                "order_line", List.of(
                        ErpFixtures.orderLine(List.of(42, "Acralube"), "Acralube 5L", 2, 10),
                        ErpFixtures.orderLine(List.of(43, "Degreaser"), "Degreaser 1L", 0, 5)),
                "amount_untaxed", 20, "amount_tax", 4.6, "amount_total", 24.6));

        // When
        ValidationReport report = validator.validate(List.of(order));

        // Then
        assertThat(report.getErrors())
                .extracting(entry -> entry.getField() + ":" + entry.getMessage())
                .containsExactlyInAnyOrder(
                        "order_line[1].product_qty:Field must be positive",
                        "order_line[1].product_qty:Order line 2 has invalid quantity");
    }

    @Test
    void validate_shouldRequireOrderLinesAndPartner() {
        // Given
        PurchaseOrderRecord order = PurchaseOrderRecord.of(ErpFixtures.with(ErpFixtures.order(),
                "order_line", List.of(), "partner_id", null));

        // When
        ValidationReport report = validator.validate(List.of(order));

        // Then
        assertThat(report.getErrors())
                .extracting(entry -> entry.getField() + ":" + entry.getMessage())
                .contains(
                        "partner_id:Field is required",
                        "order_line:Array must have at least 1 items",
                        "partner_id:Missing required field",
                        "order_line:Purchase order must have at least one order line");
    }

    @Test
    void validate_shouldWarnWhenPlannedDatePrecedesOrderDate() {
        // Given
        PurchaseOrderRecord order = PurchaseOrderRecord.of(ErpFixtures.with(ErpFixtures.order(),
                "date_planned", "2026-08-01 10:00:00"));

        // When
        ValidationReport report = validator.validate(List.of(order));

        // Then
        assertThat(report.getWarnings()).singleElement()
                .satisfies(entry -> {
                    assertThat(entry.getRule()).isEqualTo("planned_date_consistency");
                    assertThat(entry.getMessage()).isEqualTo("Planned date cannot be before order date");
                });
    }

    @Test
    void validate_shouldWarnAboutDuplicateReference() {
        // Given
        List<PurchaseOrderRecord> orders = List.of(
                PurchaseOrderRecord.of(ErpFixtures.order()),
                PurchaseOrderRecord.of(ErpFixtures.with(ErpFixtures.order(), "name", "po00001")));

        // When
        ValidationReport report = validator.validate(orders);

        // Then
        assertThat(report.getByCategory(IssueCategory.DUPLICATE_RECORD)).singleElement()
                .satisfies(entry -> assertThat(entry.getMessage()).startsWith("Duplicate order reference found"));
    }

    @Test
    void suspiciousFactors_shouldCombineValueDateAndRoundness() {
        // Given
        PurchaseOrderRecord order = PurchaseOrderRecord.of(ErpFixtures.with(ErpFixtures.order(),
                "date_order", "2027-01-10 10:00:00",
                "date_planned", "2027-01-20 10:00:00",
                "order_line", List.of(ErpFixtures.orderLine(List.of(42, "Acralube"), "Acralube 5L", 2000, 100)),
                "amount_untaxed", 200000, "amount_tax", null, "amount_total", 200000));

        // When
        List<String> factors = validator.suspiciousFactors(order);
        ValidationReport report = validator.validate(List.of(order));

        // Then
        assertThat(factors).containsExactly("high_value", "future_date", "round_numbers");
        assertThat(report.getWarnings())
                .extracting(entry -> entry.getField())
                .contains("amount_total", "order");
        assertThat(report.getInfos()).contains("Suspicious orders detected: 1");
    }
}
