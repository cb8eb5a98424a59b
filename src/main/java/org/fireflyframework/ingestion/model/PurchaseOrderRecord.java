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
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Source purchase order record, mapped onto {@code purchase.order}.
 */
@EqualsAndHashCode(callSuper = true)
public class PurchaseOrderRecord extends ErpRecord {

    public PurchaseOrderRecord(Map<String, ?> fields) {
        super(fields);
    }

    public static PurchaseOrderRecord of(Map<String, ?> fields) {
        return new PurchaseOrderRecord(fields);
    }

    /**
     * Returns the order reference, falling back to {@code order_number}.
     */
    public String getName() {
        String name = getString("name");
        return name != null ? name : getString("order_number");
    }

    public String getState() {
        return getString("state");
    }

    public Object getPartnerId() {
        return get("partner_id");
    }

    public Optional<Instant> getDateOrder() {
        return ErpValues.toInstant(get("date_order"));
    }

    public Optional<Instant> getDatePlanned() {
        return ErpValues.toInstant(get("date_planned"));
    }

    public Double getAmountTotal() {
        return getNumber("amount_total");
    }

    public Double getAmountUntaxed() {
        return getNumber("amount_untaxed");
    }

    public Double getAmountTax() {
        return getNumber("amount_tax");
    }

    public boolean hasOrderLines() {
        return !getOrderLines().isEmpty();
    }

    /**
     * Returns the order lines in source order. Non-object entries are viewed as empty lines.
     */
    public List<OrderLine> getOrderLines() {
        List<?> raw = getList("order_line");
        if (raw == null) {
            return Collections.emptyList();
        }
        List<OrderLine> lines = new ArrayList<>(raw.size());
        for (int i = 0; i < raw.size(); i++) {
            lines.add(new OrderLine(i, ErpValues.asMap(raw.get(i))));
        }
        return lines;
    }

    /**
     * View over one entry of {@code order_line}.
     */
    @EqualsAndHashCode(callSuper = true)
    public static class OrderLine extends ErpRecord {

        private final int index;

        public OrderLine(int index, Map<String, ?> fields) {
            super(fields);
            this.index = index;
        }

        public int getIndex() {
            return index;
        }

        /**
         * Returns the report path of a field on this line, e.g. {@code order_line[0].product_qty}.
         */
        public String path(String field) {
            return "order_line[" + index + "]." + field;
        }

        public Object getProductId() {
            return get("product_id");
        }

        public Double getProductQty() {
            return getNumber("product_qty");
        }

        public Double getPriceUnit() {
            return getNumber("price_unit");
        }

        public Double getPriceSubtotal() {
            return getNumber("price_subtotal");
        }
    }
}
