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

import lombok.EqualsAndHashCode;

import java.util.Map;

/**
 * Source product record, mapped onto {@code product.template}.
 */
@EqualsAndHashCode(callSuper = true)
public class ProductRecord extends ErpRecord {

    public ProductRecord(Map<String, ?> fields) {
        super(fields);
    }

    public static ProductRecord of(Map<String, ?> fields) {
        return new ProductRecord(fields);
    }

    public String getName() {
        return getString("name");
    }

    public String getSku() {
        return getString("sku");
    }

    public String getCategory() {
        return getString("category");
    }

    public String getDescription() {
        return getString("description");
    }

    public String getSize() {
        return getString("size");
    }

    public String getStatus() {
        return getString("status");
    }

    public Double getListPrice() {
        return getNumber("list_price");
    }

    public Double getStandardCost() {
        return getNumber("standard_cost");
    }

    public Double getInventoryOnHand() {
        return getNumber("inventory_on_hand");
    }

    public Double getReorderPoint() {
        return getNumber("reorder_point");
    }
}
