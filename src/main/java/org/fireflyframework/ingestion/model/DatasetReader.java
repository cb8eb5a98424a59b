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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;

/**
 * Reads dataset bundles and single-entity record collections from JSON.
 *
 * <p>A bundle is an object with {@code products}, {@code customers} (or {@code partners}),
 * {@code orders} and {@code inventory} (or {@code stock}, {@code quants},
 * {@code stock_records}) arrays; missing collections are empty. A single-entity payload
 * is an array of records, an object holding one of the entity's collection keys, or a
 * single record object.</p>
 *
 * <p>Input that is not parseable JSON, or whose collections are not arrays of objects,
 * raises {@link MalformedDatasetException} listing every problem found.</p>
 */
@Slf4j
public class DatasetReader {

    private static final TypeReference<Map<String, Object>> RECORD_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public DatasetReader() {
        this(new ObjectMapper());
    }

    public DatasetReader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public DatasetBundle readBundle(String json) {
        return readBundle(parse(json));
    }

    public DatasetBundle readBundle(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new MalformedDatasetException("Dataset bundle must be a JSON object",
                    List.of("Expected an object with products, customers, orders and inventory arrays"));
        }
        List<String> errors = new ArrayList<>();
        DatasetBundle bundle = DatasetBundle.builder()
                .products(collection(root, EntityType.PRODUCTS, ProductRecord::new, errors))
                .customers(collection(root, EntityType.CUSTOMERS, PartnerRecord::new, errors))
                .orders(collection(root, EntityType.ORDERS, PurchaseOrderRecord::new, errors))
                .inventory(collection(root, EntityType.INVENTORY, StockRecord::new, errors))
                .build();
        failOnErrors(errors);
        log.debug("Read dataset bundle with {} records", bundle.totalRecords());
        return bundle;
    }

    public List<? extends ErpRecord> readRecords(String json, EntityType type) {
        return readRecords(parse(json), type);
    }

    /**
     * Reads the records of one entity type.
     *
     * @param root the parsed payload
     * @param type the entity type the records belong to
     * @return the records, typed by entity
     */
    public List<? extends ErpRecord> readRecords(JsonNode root, EntityType type) {
        return switch (type) {
            case PRODUCTS -> readRecords(root, type, ProductRecord::new);
            case CUSTOMERS -> readRecords(root, type, PartnerRecord::new);
            case ORDERS -> readRecords(root, type, PurchaseOrderRecord::new);
            case INVENTORY -> readRecords(root, type, StockRecord::new);
        };
    }

    /**
     * Reads the records of one entity type into a bundle whose other collections are empty.
     */
    public DatasetBundle readEntityBundle(JsonNode root, EntityType type) {
        DatasetBundle.DatasetBundleBuilder builder = DatasetBundle.builder();
        switch (type) {
            case PRODUCTS -> builder.products(readRecords(root, type, ProductRecord::new));
            case CUSTOMERS -> builder.customers(readRecords(root, type, PartnerRecord::new));
            case ORDERS -> builder.orders(readRecords(root, type, PurchaseOrderRecord::new));
            case INVENTORY -> builder.inventory(readRecords(root, type, StockRecord::new));
        }
        return builder.build();
    }

    private <T extends ErpRecord> List<T> readRecords(JsonNode root, EntityType type,
                                                      Function<Map<String, Object>, T> factory) {
        if (root == null || root.isNull() || root.isMissingNode()) {
            throw new MalformedDatasetException("No records supplied", List.of("Request body is empty"));
        }
        List<String> errors = new ArrayList<>();
        List<T> records;
        if (root.isArray()) {
            records = toRecords(root, type.getKey(), factory, errors);
        } else if (root.isObject() && collectionNode(root, type) != null) {
            records = collection(root, type, factory, errors);
        } else if (root.isObject()) {
            records = List.of(factory.apply(objectMapper.convertValue(root, RECORD_TYPE)));
        } else {
            throw new MalformedDatasetException("Records must be a JSON array or object",
                    List.of("Unexpected " + root.getNodeType().name().toLowerCase(Locale.ROOT) + " payload"));
        }
        failOnErrors(errors);
        return records;
    }

    private <T extends ErpRecord> List<T> collection(JsonNode root, EntityType type,
                                                     Function<Map<String, Object>, T> factory,
                                                     List<String> errors) {
        JsonNode node = collectionNode(root, type);
        if (node == null || node.isNull()) {
            return List.of();
        }
        if (!node.isArray()) {
            errors.add(type.getKey() + " must be an array");
            return List.of();
        }
        return toRecords(node, type.getKey(), factory, errors);
    }

    private <T extends ErpRecord> List<T> toRecords(JsonNode array, String path,
                                                    Function<Map<String, Object>, T> factory,
                                                    List<String> errors) {
        List<T> records = new ArrayList<>(array.size());
        for (int i = 0; i < array.size(); i++) {
            JsonNode element = array.get(i);
            if (!element.isObject()) {
                errors.add(path + "[" + i + "] is not an object");
                continue;
            }
            records.add(factory.apply(objectMapper.convertValue(element, RECORD_TYPE)));
        }
        return records;
    }

    private JsonNode collectionNode(JsonNode root, EntityType type) {
        for (String key : aliases(type)) {
            if (root.has(key)) {
                return root.get(key);
            }
        }
        return null;
    }

    private static List<String> aliases(EntityType type) {
        return switch (type) {
            case PRODUCTS -> List.of("products");
            case CUSTOMERS -> List.of("customers", "partners");
            case ORDERS -> List.of("orders");
            case INVENTORY -> List.of("inventory", "stock", "quants", "stock_records");
        };
    }

    private JsonNode parse(String json) {
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new MalformedDatasetException("Input is not valid JSON", e);
        }
    }

    private static void failOnErrors(List<String> errors) {
        if (!errors.isEmpty()) {
            throw new MalformedDatasetException("Malformed dataset: " + String.join("; ", errors), errors);
        }
    }
}
