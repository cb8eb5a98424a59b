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

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.EqualsAndHashCode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A source record: an ordered mapping of field name to raw value.
 *
 * <p>Entity-specific subclasses add typed accessors over the same map. Accessors never
 * coerce: a field holding a value of the wrong type reads as {@code null} through the
 * typed accessor while {@link #get(String)} still returns the raw value.</p>
 */
@EqualsAndHashCode
public class ErpRecord {

    private final Map<String, Object> fields;

    public ErpRecord(Map<String, ?> fields) {
        this.fields = fields != null ? new LinkedHashMap<>(fields) : new LinkedHashMap<>();
    }

    public Object get(String field) {
        return fields.get(field);
    }

    public boolean has(String field) {
        return fields.get(field) != null;
    }

    public String getString(String field) {
        return fields.get(field) instanceof String value ? value : null;
    }

    public Double getNumber(String field) {
        return ErpValues.asDouble(fields.get(field));
    }

    public List<?> getList(String field) {
        return fields.get(field) instanceof List<?> list ? list : null;
    }

    public Boolean getBoolean(String field) {
        return fields.get(field) instanceof Boolean value ? value : null;
    }

    @JsonValue
    public Map<String, Object> asMap() {
        return Collections.unmodifiableMap(fields);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + fields;
    }
}
