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

import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.fireflyframework.ingestion.schema.FieldSchema.nonNegative;
import static org.fireflyframework.ingestion.schema.FieldSchema.of;
import static org.fireflyframework.ingestion.schema.FieldSchema.required;
import static org.fireflyframework.ingestion.schema.FieldSchema.selection;
import static org.fireflyframework.ingestion.schema.FieldType.BOOLEAN;
import static org.fireflyframework.ingestion.schema.FieldType.DATETIME;
import static org.fireflyframework.ingestion.schema.FieldType.INTEGER;
import static org.fireflyframework.ingestion.schema.FieldType.MANY2ONE;
import static org.fireflyframework.ingestion.schema.FieldType.NUMBER;
import static org.fireflyframework.ingestion.schema.FieldType.STRING;
import static org.fireflyframework.ingestion.schema.FieldType.X2MANY;

/**
 * Registry of target model schemas, built once and shared by the validators.
 *
 * <p>{@link #defaults()} holds {@code product.template}, {@code res.partner},
 * {@code purchase.order} and {@code stock.quant}. Further models can be registered at
 * startup; registration replaces any schema of the same name.</p>
 */
@Slf4j
public class SchemaRegistry {

    private volatile Map<String, ModelSchema> schemas = Map.of();

    public SchemaRegistry() {
    }

    public SchemaRegistry(List<ModelSchema> initialSchemas) {
        initialSchemas.forEach(this::register);
    }

    /**
     * Creates a registry holding the four standard ERP models.
     */
    public static SchemaRegistry defaults() {
        return new SchemaRegistry(List.of(productTemplate(), resPartner(), purchaseOrder(), stockQuant()));
    }

    public synchronized SchemaRegistry register(ModelSchema schema) {
        Map<String, ModelSchema> updated = new LinkedHashMap<>(schemas);
        updated.put(schema.getName(), schema);
        schemas = updated;
        log.debug("Registered schema for model {} with {} fields", schema.getName(), schema.getFields().size());
        return this;
    }

    public Optional<ModelSchema> find(String modelName) {
        return Optional.ofNullable(modelName != null ? schemas.get(modelName) : null);
    }

    public List<String> modelNames() {
        return List.copyOf(schemas.keySet());
    }

    static ModelSchema productTemplate() {
        return ModelSchema.builder()
                .name(ErpModels.PRODUCT_TEMPLATE)
                .field("name", FieldSchema.builder().type(STRING).required(true).minLength(1).build())
                .field("default_code", of(STRING))
                .field("categ_id", of(MANY2ONE))
                .field("type", selection("product", "consu", "service"))
                .field("list_price", nonNegative(NUMBER))
                .field("standard_price", nonNegative(NUMBER))
                .field("uom_id", of(MANY2ONE))
                .field("uom_po_id", of(MANY2ONE))
                .field("description", of(STRING))
                .field("description_purchase", of(STRING))
                .field("description_sale", of(STRING))
                .field("active", of(BOOLEAN))
                .field("sale_ok", of(BOOLEAN))
                .field("purchase_ok", of(BOOLEAN))
                .field("tracking", selection("none", "lot", "serial"))
                .build();
    }

    static ModelSchema resPartner() {
        return ModelSchema.builder()
                .name(ErpModels.RES_PARTNER)
                .field("name", FieldSchema.builder().type(STRING).required(true).minLength(1).build())
                .field("is_company", of(BOOLEAN))
                .field("parent_id", of(MANY2ONE))
                .field("street", of(STRING))
                .field("street2", of(STRING))
                .field("city", of(STRING))
                .field("state_id", of(MANY2ONE))
                .field("zip", of(STRING))
                .field("country_id", of(MANY2ONE))
                .field("phone", of(STRING))
                .field("mobile", of(STRING))
                .field("email", FieldSchema.builder().type(STRING).format(FieldSchema.Format.EMAIL).build())
                .field("website", FieldSchema.builder().type(STRING).format(FieldSchema.Format.URI).build())
                .field("vat", of(STRING))
                .field("supplier_rank", nonNegative(INTEGER))
                .field("customer_rank", nonNegative(INTEGER))
                .field("category_id", of(X2MANY))
                .field("active", of(BOOLEAN))
                .build();
    }

    static ModelSchema purchaseOrder() {
        ModelSchema orderLine = ModelSchema.builder()
                .name("purchase.order.line")
                .field("product_id", required(MANY2ONE))
                .field("name", required(STRING))
                .field("product_qty", FieldSchema.builder().type(NUMBER).required(true).minimum(0.0).build())
                .field("product_uom", of(MANY2ONE))
                .field("price_unit", FieldSchema.builder().type(NUMBER).required(true).minimum(0.0).build())
                .field("date_planned", of(DATETIME))
                .build();

        return ModelSchema.builder()
                .name(ErpModels.PURCHASE_ORDER)
                .field("name", of(STRING))
                .field("partner_id", required(MANY2ONE))
                .field("date_order", required(DATETIME))
                .field("date_planned", of(DATETIME))
                .field("state", selection("draft", "sent", "to approve", "purchase", "done", "cancel"))
                .field("currency_id", of(MANY2ONE))
                .field("company_id", of(MANY2ONE))
                .field("order_line", FieldSchema.builder().type(FieldType.OBJECT_ARRAY).itemSchema(orderLine).build())
                .field("notes", of(STRING))
                .field("amount_untaxed", of(NUMBER))
                .field("amount_tax", of(NUMBER))
                .field("amount_total", of(NUMBER))
                .build();
    }

    static ModelSchema stockQuant() {
        return ModelSchema.builder()
                .name(ErpModels.STOCK_QUANT)
                .field("product_id", required(MANY2ONE))
                .field("location_id", required(MANY2ONE))
                .field("lot_id", of(MANY2ONE))
                .field("package_id", of(MANY2ONE))
                .field("owner_id", of(MANY2ONE))
                .field("quantity", required(NUMBER))
                .field("reserved_quantity", nonNegative(NUMBER))
                .field("available_quantity", of(NUMBER))
                .field("in_date", of(DATETIME))
                .build();
    }
}
