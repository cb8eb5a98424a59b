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

package org.fireflyframework.ingestion;

import org.fireflyframework.ingestion.model.DatasetBundle;
import org.fireflyframework.ingestion.model.PartnerRecord;
import org.fireflyframework.ingestion.model.ProductRecord;
import org.fireflyframework.ingestion.model.PurchaseOrderRecord;
import org.fireflyframework.ingestion.model.StockRecord;
import org.fireflyframework.ingestion.schema.SchemaValidator;
import org.fireflyframework.ingestion.validation.ValidationThresholds;
import org.fireflyframework.ingestion.validator.CustomerValidator;
import org.fireflyframework.ingestion.validator.InventoryValidator;
import org.fireflyframework.ingestion.validator.OrderValidator;
import org.fireflyframework.ingestion.validator.ProductValidator;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Error-free sample records and validators pinned to a fixed clock.
 */
public final class ErpFixtures {

    public static final Clock CLOCK = Clock.fixed(Instant.parse("2026-10-17T12:00:00Z"), ZoneOffset.UTC);

    private ErpFixtures() {
    }

    public static Map<String, Object> product() {
        Map<String, Object> product = new LinkedHashMap<>();
        product.put("sku", "GC10000-BLA-XS");
        product.put("name", "Aurora Seamless Sports Bra");
        product.put("category", "sports-bras");
        product.put("list_price", 49.99);
        product.put("standard_cost", 18.5);
        product.put("description", "Medium support seamless sports bra in black.");
        return product;
    }

    public static Map<String, Object> customer() {
        Map<String, Object> customer = new LinkedHashMap<>();
        customer.put("name", "Harbour Outfitters Ltd");
        customer.put("email", "orders@harbour-outfitters.ie");
        customer.put("phone", "+353 1 555 0123");
        customer.put("vat", "IE6388047V");
        customer.put("is_company", true);
        customer.put("customer_rank", 1);
        customer.put("supplier_rank", 0);
        customer.put("street", "12 Quay Street");
        customer.put("city", "Dublin");
        customer.put("zip", "D02 X285");
        customer.put("country_id", List.of(103, "Ireland"));
        return customer;
    }

    public static Map<String, Object> order() {
        Map<String, Object> order = new LinkedHashMap<>();
        order.put("name", "PO00001");
        order.put("partner_id", List.of(7, "Harbour Outfitters Ltd"));
        order.put("date_order", "2026-09-01 10:00:00");
        order.put("date_planned", "2026-09-15 10:00:00");
        order.put("state", "purchase");
        order.put("currency_id", List.of(1, "EUR"));
        order.put("order_line", List.of(
                orderLine(List.of(42, "Acralube"), "Acralube 5L", 2, 10),
                orderLine(List.of(43, "Degreaser"), "Degreaser 1L", 1, 5)));
        order.put("amount_untaxed", 25);
        order.put("amount_tax", 5.75);
        order.put("amount_total", 30.75);
        return order;
    }

    public static Map<String, Object> orderLine(List<Object> productId, String name, Number quantity, Number price) {
        Map<String, Object> line = new LinkedHashMap<>();
        line.put("product_id", productId);
        line.put("name", name);
        line.put("product_qty", quantity);
        line.put("price_unit", price);
        line.put("product_uom", List.of(1, "Units"));
        return line;
    }

    public static Map<String, Object> stock() {
        Map<String, Object> stock = new LinkedHashMap<>();
        stock.put("product_id", List.of(42, "Acralube 5L"));
        stock.put("location_id", List.of(8, "WH/Stock"));
        stock.put("quantity", 10);
        stock.put("reserved_quantity", 3);
        stock.put("available_quantity", 7);
        stock.put("in_date", "2026-03-01 09:00:00");
        return stock;
    }

    /**
     * Returns a copy of {@code base} with the given key/value pairs applied. A {@code null} value
     * removes the key.
     */
    public static Map<String, Object> with(Map<String, Object> base, Object... keyValues) {
        Map<String, Object> copy = new LinkedHashMap<>(base);
        for (int i = 0; i < keyValues.length; i += 2) {
            String key = (String) keyValues[i];
            Object value = keyValues[i + 1];
            if (value == null) {
                copy.remove(key);
            } else {
                copy.put(key, value);
            }
        }
        return copy;
    }

    public static DatasetBundle validBundle() {
        return DatasetBundle.builder()
                .products(List.of(ProductRecord.of(product())))
                .customers(List.of(PartnerRecord.of(customer())))
                .orders(List.of(PurchaseOrderRecord.of(order())))
                .inventory(List.of(StockRecord.of(stock())))
                .build();
    }

    public static ProductValidator productValidator() {
        return new ProductValidator(new SchemaValidator(), ValidationThresholds.defaults(), CLOCK, List.of());
    }

    public static CustomerValidator customerValidator() {
        return new CustomerValidator(new SchemaValidator(), ValidationThresholds.defaults(), CLOCK, List.of());
    }

    public static OrderValidator orderValidator() {
        return new OrderValidator(new SchemaValidator(), ValidationThresholds.defaults(), CLOCK, List.of());
    }

    public static InventoryValidator inventoryValidator() {
        return new InventoryValidator(new SchemaValidator(), ValidationThresholds.defaults(), CLOCK, List.of());
    }
}
