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

import org.fireflyframework.ingestion.model.DatasetReader;
import org.fireflyframework.ingestion.model.ProductRecord;
import org.fireflyframework.ingestion.pipeline.ValidationPipeline;
import org.fireflyframework.ingestion.schema.FieldSchema;
import org.fireflyframework.ingestion.schema.FieldType;
import org.fireflyframework.ingestion.schema.ModelSchema;
import org.fireflyframework.ingestion.schema.SchemaValidator;
import org.fireflyframework.ingestion.validation.ValidationSeverity;
import org.fireflyframework.ingestion.validation.rule.BusinessRule;
import org.fireflyframework.ingestion.validation.rule.PredicateRule;
import org.fireflyframework.ingestion.validator.CustomerValidator;
import org.fireflyframework.ingestion.validator.ProductValidator;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.time.Period;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link IngestionValidationAutoConfiguration}.
 */
class IngestionValidationAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(IngestionValidationAutoConfiguration.class));

    @Test
    void autoConfiguration_shouldRegisterPipelineAndValidators() {
        contextRunner.run(context -> {
            assertThat(context).hasSingleBean(ValidationPipeline.class);
            assertThat(context).hasSingleBean(ProductValidator.class);
            assertThat(context).hasSingleBean(CustomerValidator.class);
            assertThat(context).hasSingleBean(DatasetReader.class);
            assertThat(context).hasSingleBean(SchemaValidator.class);
            assertThat(context.getBean(ProductValidator.class).getCustomRules()).isEmpty();
        });
    }

    @Test
    void autoConfiguration_shouldBackOffWhenDisabled() {
        contextRunner
                .withPropertyValues("firefly.ingestion.validation.enabled=false")
                .run(context -> {
                    assertThat(context).doesNotHaveBean(ValidationPipeline.class);
                    assertThat(context).doesNotHaveBean(ProductValidator.class);
                });
    }

    @Test
    void autoConfiguration_shouldBindThresholdsAndParallelism() {
        contextRunner
                .withPropertyValues(
                        "firefly.ingestion.validation.record-parallelism=4",
                        "firefly.ingestion.validation.run-timeout=30s",
                        "firefly.ingestion.validation.thresholds.epsilon=0.5",
                        "firefly.ingestion.validation.thresholds.order-date-horizon=P3M")
                .run(context -> {
                    ValidationProperties properties = context.getBean(ValidationProperties.class);
                    assertThat(properties.getRunTimeout()).isEqualTo(Duration.ofSeconds(30));

                    ProductValidator validator = context.getBean(ProductValidator.class);
                    assertThat(validator.getRecordParallelism()).isEqualTo(4);
                    assertThat(validator.getThresholds().getEpsilon()).isEqualTo(0.5);
                    assertThat(validator.getThresholds().getOrderDateHorizon()).isEqualTo(Period.ofMonths(3));
                    assertThat(validator.getThresholds().getCompletenessThreshold()).isEqualTo(0.5);
                });
    }

    @Test
    void autoConfiguration_shouldRouteTypedRulesAndSchemas() {
        contextRunner
                .withUserConfiguration(CustomRulesConfiguration.class)
                .run(context -> {
                    assertThat(context.getBean(ProductValidator.class).getCustomRules())
                            .extracting(BusinessRule::getName)
                            .containsExactly("no_invalid_marker");
                    assertThat(context.getBean(CustomerValidator.class).getCustomRules()).isEmpty();
                    assertThat(context.getBean(SchemaValidator.class).getAvailableModels()).contains("x.tag");
                });
    }

    @Configuration(proxyBeanMethods = false)
    static class CustomRulesConfiguration {

        @Bean
        BusinessRule<ProductRecord> noInvalidMarker() {
            return PredicateRule.<ProductRecord>builder()
                    .name("no_invalid_marker")
                    .field("sku")
                    .predicate(product -> product.getSku() == null || !product.getSku().contains("INVALID"))
                    .message("SKU contains INVALID keyword")
                    .severity(ValidationSeverity.ERROR)
                    .build();
        }

        @Bean
        ModelSchema tagSchema() {
            return ModelSchema.builder()
                    .name("x.tag")
                    .field("name", FieldSchema.required(FieldType.STRING))
                    .build();
        }
    }
}
