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

import java.util.Arrays;
import java.util.Optional;

/**
 * The four record collections a dataset bundle carries.
 */
public enum EntityType {

    PRODUCTS("products"),
    CUSTOMERS("customers"),
    ORDERS("orders"),
    INVENTORY("inventory");

    private final String key;

    EntityType(String key) {
        this.key = key;
    }

    @JsonValue
    public String getKey() {
        return key;
    }

    /**
     * Resolves an entity type from its key, case-insensitively.
     *
     * @param key the key, e.g. {@code "products"}
     * @return the entity type, or empty when the key is unknown
     */
    public static Optional<EntityType> fromKey(String key) {
        if (key == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(type -> type.key.equalsIgnoreCase(key.trim()))
                .findFirst();
    }
}
