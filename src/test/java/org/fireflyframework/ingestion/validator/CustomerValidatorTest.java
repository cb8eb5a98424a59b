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
import org.fireflyframework.ingestion.model.PartnerRecord;
import org.fireflyframework.ingestion.validation.CorrectionSuggestion;
import org.fireflyframework.ingestion.validation.IssueCategory;
import org.fireflyframework.ingestion.validation.ValidationReport;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link CustomerValidator}.
 */
class CustomerValidatorTest {

    private final CustomerValidator validator = ErpFixtures.customerValidator();

    @Test
    void validate_shouldAcceptCleanCustomer() {
        // When
        ValidationReport report = validator.validate(List.of(PartnerRecord.of(ErpFixtures.customer())));

        // Then
        assertThat(report.getEntries()).isEmpty();
        assertThat(report.getStats().getValidRecords()).isEqualTo(1);
    }

    @Test
    void validate_shouldWarnOnceAboutEmailSharedAcrossCase() {
        // Given
        List<PartnerRecord> partners = List.of(
                PartnerRecord.of(ErpFixtures.customer()),
                PartnerRecord.of(ErpFixtures.with(ErpFixtures.customer(),
                        "name", "Harbour Outfitters Retail",
                        "email", "Orders@Harbour-Outfitters.ie",
                        "phone", "+353 1 555 0999",
                        "vat", "IE6388048W")));

        // When
        ValidationReport report = validator.validate(partners);

        // Then
        assertThat(report.getByCategory(IssueCategory.DUPLICATE_RECORD)).singleElement()
                .satisfies(entry -> {
                    assertThat(entry.getField()).isEqualTo("email");
                    assertThat(entry.getMessage()).startsWith("Duplicate email address found");
                    assertThat(entry.getRecordId()).isEqualTo("Orders@Harbour-Outfitters.ie");
                });
        assertThat(report.hasErrors()).isFalse();
    }

    @Test
    void validate_shouldRejectMissingAndMalformedEmail() {
        // Given
        List<PartnerRecord> partners = List.of(
                PartnerRecord.of(ErpFixtures.with(ErpFixtures.customer(), "email", null)),
                PartnerRecord.of(ErpFixtures.with(ErpFixtures.customer(), "email", "orders.harbour.ie")));

        // When
        ValidationReport report = validator.validate(partners);

        // Then
        assertThat(report.getErrors())
                .extracting(entry -> entry.getField() + ":" + entry.getMessage())
                .contains("email:Field is required", "email:Invalid email format", "email:Must be a valid email address");
        assertThat(report.getStats().getInvalidRecords()).isEqualTo(2);
    }

    @Test
    void validate_shouldRequireCustomerOrSupplierRank() {
        // Given
        PartnerRecord partner = PartnerRecord.of(ErpFixtures.with(ErpFixtures.customer(), "customer_rank", 0));

        // When
        ValidationReport report = validator.validate(List.of(partner));

        // Then
        assertThat(report.getErrors()).singleElement()
                .satisfies(entry -> {
                    assertThat(entry.getRule()).isEqualTo("rank_validation");
                    assertThat(entry.getMessage()).isEqualTo("Partner must be either a customer or supplier (or both)");
                });
    }

    @Test
    void validate_shouldWarnAboutIncompleteAddressAndSuspiciousEmail() {
        // Given
        PartnerRecord partner = PartnerRecord.of(ErpFixtures.with(ErpFixtures.customer(),
                "city", null, "email", "test@harbour-outfitters.ie"));

        // When
        ValidationReport report = validator.validate(List.of(partner));

        // Then
        assertThat(report.hasErrors()).isFalse();
        assertThat(report.getWarnings())
                .extracting(entry -> entry.getField() + ":" + entry.getMessage())
                .containsExactly(
                        "city:Street provided but city is missing",
                        "email:Suspicious test-like email address");
    }

    @Test
    void validate_shouldCheckZipAgainstCountryCode() {
        // Given
        PartnerRecord partner = PartnerRecord.of(ErpFixtures.with(ErpFixtures.customer(),
                "country_code", "US", "zip", "ABC12"));

        // When
        ValidationReport report = validator.validate(List.of(partner));

        // Then
        assertThat(report.getWarnings()).singleElement()
                .satisfies(entry -> assertThat(entry.getMessage())
                        .isEqualTo("ZIP code format may not match country: US"));
    }

    @Test
    void validate_shouldWarnAboutUnknownParent() {
        // Given
        PartnerRecord contact = PartnerRecord.of(ErpFixtures.with(ErpFixtures.customer(),
                "name", "Aoife Byrne", "email", "aoife@harbour-outfitters.ie", "phone", null, "vat", null,
                "is_company", false, "parent_id", List.of(99, "Missing Holdings")));

        // When
        ValidationReport report = validator.validate(List.of(contact));

        // Then
        assertThat(report.getWarnings())
                .extracting(entry -> entry.getMessage())
                .containsExactly("Parent customer not found in dataset");
    }

    @Test
    void suggestCorrection_shouldProposeCommonDomains() {
        // When
        CorrectionSuggestion suggestion = validator.suggestCorrection("email", " Jane@Gmail ", Map.of());

        // Then
        assertThat(suggestion.getSuggestions()).containsExactly(
                "jane@gmail.com", "jane@yahoo.com", "jane@outlook.com", "jane@hotmail.com");
    }

    @Test
    void suggestCorrection_shouldFormatUsZip() {
        // When
        CorrectionSuggestion suggestion = validator.suggestCorrection("zip", "12345 6789",
                Map.of("country_code", "US"));

        // Then
        assertThat(suggestion.getSuggestions()).containsExactly("12345-6789");
    }
}
