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

package org.fireflyframework.ingestion.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.ingestion.model.DatasetReader;
import org.fireflyframework.ingestion.model.PartnerRecord;
import org.fireflyframework.ingestion.model.ProductRecord;
import org.fireflyframework.ingestion.model.PurchaseOrderRecord;
import org.fireflyframework.ingestion.model.StockRecord;
import org.fireflyframework.ingestion.pipeline.ValidationPipeline;
import org.fireflyframework.ingestion.schema.ModelSchema;
import org.fireflyframework.ingestion.schema.SchemaRegistry;
import org.fireflyframework.ingestion.schema.SchemaValidator;
import org.fireflyframework.ingestion.validation.AbstractRecordValidator;
import org.fireflyframework.ingestion.validation.rule.BusinessRule;
import org.fireflyframework.ingestion.validator.CustomerValidator;
import org.fireflyframework.ingestion.validator.InventoryValidator;
import org.fireflyframework.ingestion.validator.OrderValidator;
import org.fireflyframework.ingestion.validator.ProductValidator;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;

import java.time.Clock;
import java.util.List;

/**
 * Auto-configuration for the ingestion validation engine.
 *
 * <p>This configuration automatically sets up:</p>
 * <ul>
 *   <li>{@link SchemaRegistry} with the built-in ERP models plus any {@link ModelSchema} beans</li>
 *   <li>The four entity validators, each with the {@link BusinessRule} beans typed to its record</li>
 *   <li>{@link ValidationPipeline} publishing completion events when an
 *       {@link ApplicationEventPublisher} is available</li>
 * </ul>
 *
 * <p>The configuration is activated when the property
 * {@code firefly.ingestion.validation.enabled} is true or not set.</p>
 */
@Slf4j
@AutoConfiguration
@EnableConfigurationProperties(ValidationProperties.class)
@ConditionalOnProperty(
    prefix = "firefly.ingestion.validation",
    name = "enabled",
    havingValue = "true",
    matchIfMissing = true
)
public class IngestionValidationAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public SchemaRegistry schemaRegistry(@Autowired(required = false) List<ModelSchema> schemas) {
        SchemaRegistry registry = SchemaRegistry.defaults();
        if (schemas != null) {
            schemas.forEach(registry::register);
        }
        log.info("Configuring schema registry with models {}", registry.modelNames());
        return registry;
    }

    @Bean
    @ConditionalOnMissingBean
    public SchemaValidator schemaValidator(SchemaRegistry schemaRegistry) {
        return new SchemaValidator(schemaRegistry);
    }

    @Bean
    @ConditionalOnMissingBean
    public ProductValidator productValidator(SchemaValidator schemaValidator, ValidationProperties properties,
                                             @Autowired(required = false) List<BusinessRule<ProductRecord>> rules) {
        return configure(new ProductValidator(schemaValidator, properties.toThresholds(), Clock.systemUTC(),
                rulesOrEmpty(rules)), properties);
    }

    @Bean
    @ConditionalOnMissingBean
    public CustomerValidator customerValidator(SchemaValidator schemaValidator, ValidationProperties properties,
                                               @Autowired(required = false) List<BusinessRule<PartnerRecord>> rules) {
        return configure(new CustomerValidator(schemaValidator, properties.toThresholds(), Clock.systemUTC(),
                rulesOrEmpty(rules)), properties);
    }

    @Bean
    @ConditionalOnMissingBean
    public OrderValidator orderValidator(SchemaValidator schemaValidator, ValidationProperties properties,
                                         @Autowired(required = false)
                                         List<BusinessRule<PurchaseOrderRecord>> rules) {
        return configure(new OrderValidator(schemaValidator, properties.toThresholds(), Clock.systemUTC(),
                rulesOrEmpty(rules)), properties);
    }

    @Bean
    @ConditionalOnMissingBean
    public InventoryValidator inventoryValidator(SchemaValidator schemaValidator, ValidationProperties properties,
                                                 @Autowired(required = false) List<BusinessRule<StockRecord>> rules) {
        return configure(new InventoryValidator(schemaValidator, properties.toThresholds(), Clock.systemUTC(),
                rulesOrEmpty(rules)), properties);
    }

    @Bean
    @ConditionalOnMissingBean
    public DatasetReader datasetReader(@Autowired(required = false) ObjectMapper objectMapper) {
        return objectMapper != null ? new DatasetReader(objectMapper) : new DatasetReader();
    }

    /**
     * Creates the pipeline bean.
     *
     * @param eventPublisher the event publisher, or {@code null} if unavailable
     */
    @Bean
    @ConditionalOnMissingBean
    public ValidationPipeline validationPipeline(ProductValidator productValidator,
                                                 CustomerValidator customerValidator,
                                                 OrderValidator orderValidator,
                                                 InventoryValidator inventoryValidator,
                                                 ValidationProperties properties,
                                                 @Autowired(required = false)
                                                 ApplicationEventPublisher eventPublisher) {
        log.info("Configuring validation pipeline (record parallelism {}, run timeout {})",
                properties.getRecordParallelism(), properties.getRunTimeout());
        return new ValidationPipeline(productValidator, customerValidator, orderValidator, inventoryValidator,
                eventPublisher, properties.getRunTimeout());
    }

    private static <V extends AbstractRecordValidator<?>> V configure(V validator, ValidationProperties properties) {
        validator.setRecordParallelism(properties.getRecordParallelism());
        log.debug("Configured {} validator with {} custom rules", validator.getEntityType().getKey(),
                validator.getCustomRules().size());
        return validator;
    }

    private static <T> List<BusinessRule<T>> rulesOrEmpty(List<BusinessRule<T>> rules) {
        return rules != null ? rules : List.of();
    }
}
