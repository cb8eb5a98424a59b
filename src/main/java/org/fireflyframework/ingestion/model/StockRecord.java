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

import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * Source stock record, mapped onto {@code stock.quant}.
 */
@EqualsAndHashCode(callSuper = true)
public class StockRecord extends ErpRecord {

    public StockRecord(Map<String, ?> fields) {
        super(fields);
    }

    public static StockRecord of(Map<String, ?> fields) {
        return new StockRecord(fields);
    }

    public Object getProductId() {
        return get("product_id");
    }

    public Object getLocationId() {
        return get("location_id");
    }

    public Object getLotId() {
        return get("lot_id");
    }

    public Object getPackageId() {
        return get("package_id");
    }

    public Double getQuantity() {
        return getNumber("quantity");
    }

    public Double getReservedQuantity() {
        return getNumber("reserved_quantity");
    }

    public Double getAvailableQuantity() {
        return getNumber("available_quantity");
    }

    public boolean isNegativeAllowed() {
        return ErpValues.isTruthy(get("allow_negative"));
    }

    public Optional<Instant> getInDate() {
        return ErpValues.toInstant(get("in_date"));
    }
}
