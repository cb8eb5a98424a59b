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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Projects a source record onto the field names of a target model.
 *
 * <p>Steps run in order and each one writes a single target field. Only mapped fields appear
 * in the result; a step whose value is {@code null} leaves its target field absent.</p>
 *
 * <pre>{@code
 * RecordMapping mapping = RecordMapping.create()
 *         .copy("name")
 *         .copy("sku", "default_code")
 *         .constant("sale_ok", true)
 *         .computed("active", record -> !"inactive".equals(record.get("status")));
 *
 * Map<String, Object> target = mapping.apply(product);
 * }</pre>
 */
public class RecordMapping {

    private final List<Step> steps = new ArrayList<>();

    private RecordMapping() {
    }

    public static RecordMapping create() {
        return new RecordMapping();
    }

    /**
     * Copies a field under the same name.
     */
    public RecordMapping copy(String field) {
        return copy(field, field);
    }

    /**
     * Copies {@code sourceField} to {@code targetField}.
     */
    public RecordMapping copy(String sourceField, String targetField) {
        steps.add(new Step(targetField, record -> record.get(sourceField)));
        return this;
    }

    /**
     * Writes a fixed value.
     */
    public RecordMapping constant(String targetField, Object value) {
        steps.add(new Step(targetField, record -> value));
        return this;
    }

    /**
     * Writes a value computed from the whole source record.
     */
    public RecordMapping computed(String targetField, Function<ErpRecord, Object> computation) {
        steps.add(new Step(targetField, computation));
        return this;
    }

    /**
     * Applies the mapping.
     *
     * @param source the source record
     * @return a new ordered map keyed by target field names
     */
    public Map<String, Object> apply(ErpRecord source) {
        Map<String, Object> target = new LinkedHashMap<>();
        for (Step step : steps) {
            Object value = step.computation.apply(source);
            if (value != null) {
                target.put(step.targetField, value);
            }
        }
        return target;
    }

    public int size() {
        return steps.size();
    }

    private static final class Step {

        private final String targetField;
        private final Function<ErpRecord, Object> computation;

        private Step(String targetField, Function<ErpRecord, Object> computation) {
            this.targetField = targetField;
            this.computation = computation;
        }
    }
}
