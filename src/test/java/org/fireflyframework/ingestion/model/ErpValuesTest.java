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

package org.fireflyframework.ingestion.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ErpValuesTest {

    @Test
    void isTruthy_shouldFollowLooseTruthiness() {
        assertThat(ErpValues.isTruthy(null)).isFalse();
        assertThat(ErpValues.isTruthy(false)).isFalse();
        assertThat(ErpValues.isTruthy(0)).isFalse();
        assertThat(ErpValues.isTruthy(0.0)).isFalse();
        assertThat(ErpValues.isTruthy("")).isFalse();
        assertThat(ErpValues.isTruthy("0")).isTrue();
        assertThat(ErpValues.isTruthy(List.of())).isTrue();
    }

    @Test
    void isRelationTuple_shouldRequireIntegerAndLabel() {
        assertThat(ErpValues.isRelationTuple(List.of(7, "Harbour"))).isTrue();
        assertThat(ErpValues.isRelationTuple(List.of(7.0, "Harbour"))).isTrue();
        assertThat(ErpValues.isRelationTuple(List.of("7", "Harbour"))).isFalse();
        assertThat(ErpValues.isRelationTuple(List.of(7))).isFalse();
        assertThat(ErpValues.isUnsetRelation(false)).isTrue();
        assertThat(ErpValues.relationLabel(List.of(8, "WH/Stock"))).isEqualTo("WH/Stock");
    }

    @Test
    void toInstant_shouldReadErpAndIsoDates() {
        assertThat(ErpValues.toInstant("2026-03-01 09:00:00"))
                .contains(Instant.parse("2026-03-01T09:00:00Z"));
        assertThat(ErpValues.toInstant("2026-03-01"))
                .contains(Instant.parse("2026-03-01T00:00:00Z"));
        assertThat(ErpValues.toInstant("2026-03-01T09:00:00+02:00"))
                .contains(Instant.parse("2026-03-01T07:00:00Z"));
        assertThat(ErpValues.toInstant("next tuesday")).isEmpty();
        assertThat(ErpValues.isDate("")).isFalse();
    }
}
