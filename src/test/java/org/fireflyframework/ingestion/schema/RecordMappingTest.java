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

package org.fireflyframework.ingestion.schema;

import org.fireflyframework.ingestion.model.ErpRecord;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class RecordMappingTest {

    @Test
    void apply_shouldWriteOnlyMappedNonNullFieldsInOrder() {
        // Given
        RecordMapping mapping = RecordMapping.create()
                .copy("name")
                .copy("sku", "default_code")
                .copy("description")
                .constant("sale_ok", true)
                .computed("active", record -> !"inactive".equals(record.get("status")));
        ErpRecord product = new ErpRecord(Map.of("name", "Tee", "sku", "TEE-1", "status", "inactive"));

        // When
        Map<String, Object> target = mapping.apply(product);

        // Then
        assertThat(target).containsExactly(
                Map.entry("name", "Tee"),
                Map.entry("default_code", "TEE-1"),
                Map.entry("sale_ok", true),
                Map.entry("active", false));
        assertThat(mapping.size()).isEqualTo(5);
    }
}
