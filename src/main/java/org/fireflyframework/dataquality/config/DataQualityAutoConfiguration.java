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

package org.fireflyframework.dataquality.config;

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.dataquality.engine.DataQualityEngine;
import org.fireflyframework.dataquality.engine.OutcomeAggregator;
import org.fireflyframework.dataquality.engine.PartitionEvaluator;
import org.fireflyframework.dataquality.engine.ReportBuilder;
import org.fireflyframework.dataquality.reference.InMemoryReferenceResolver;
import org.fireflyframework.dataquality.reference.ReferenceResolver;
import org.fireflyframework.dataquality.rule.RecordPredicate;
import org.fireflyframework.dataquality.ruleset.RuleSetFactory;
import org.fireflyframework.dataquality.ruleset.RuleSetRegistry;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import reactor.core.scheduler.Schedulers;

import java.util.Map;

/**
 * Auto-configuration for the data quality framework.
 *
 * <p>This configuration automatically sets up:</p>
 * <ul>
 *   <li>{@link DataQualityEngine} with the configured sample capacity and parallelism</li>
 *   <li>an {@link InMemoryReferenceResolver} unless another {@link ReferenceResolver} is defined</li>
 *   <li>{@link RuleSetRegistry} with every rule set declared under {@code firefly.data.quality.rule-sets},
 *       custom rules resolving their predicates from {@link RecordPredicate} beans by bean name</li>
 *   <li>Event publishing for validation reports (when an {@link ApplicationEventPublisher} is available)</li>
 * </ul>
 *
 * <p>The configuration is activated when:</p>
 * <ul>
 *   <li>The property {@code firefly.data.quality.enabled} is true (default)</li>
 *   <li>Or the property is not set (enabled by default)</li>
 * </ul>
 */
@Slf4j
@AutoConfiguration
@EnableConfigurationProperties(DataQualityProperties.class)
@ConditionalOnProperty(
    prefix = "firefly.data.quality",
    name = "enabled",
    havingValue = "true",
    matchIfMissing = true
)
public class DataQualityAutoConfiguration {

    /**
     * Creates an in-memory reference resolver. Register reference key sets on it before
     * validating with referential integrity rules, or define a substrate-backed
     * {@link ReferenceResolver} bean instead.
     *
     * @return the in-memory reference resolver
     */
    @Bean
    @ConditionalOnMissingBean(ReferenceResolver.class)
    public InMemoryReferenceResolver referenceResolver() {
        log.info("Configuring in-memory reference resolver (production: implement ReferenceResolver on the substrate)");
        return new InMemoryReferenceResolver();
    }

    @Bean
    @ConditionalOnMissingBean
    public RuleSetFactory ruleSetFactory(@Autowired(required = false) Map<String, RecordPredicate> predicates) {
        Map<String, RecordPredicate> available = predicates != null ? predicates : Map.of();
        log.debug("Configuring rule set factory with {} custom predicates", available.size());
        return new RuleSetFactory(available);
    }

    /**
     * Creates the rule set registry. Configured rule sets are parsed here, so an invalid
     * rule set fails application startup.
     *
     * @param properties the data quality properties
     * @param factory    the rule set factory
     * @return the registry
     */
    @Bean
    @ConditionalOnMissingBean
    public RuleSetRegistry ruleSetRegistry(DataQualityProperties properties, RuleSetFactory factory) {
        return new RuleSetRegistry(properties.getRuleSets(), factory);
    }

    /**
     * Creates the data quality engine bean.
     *
     * @param properties        the data quality properties
     * @param referenceResolver the reference resolver
     * @param eventPublisher    the event publisher, or {@code null} if unavailable
     * @return the configured data quality engine
     */
    @Bean
    @ConditionalOnMissingBean
    public DataQualityEngine dataQualityEngine(
            DataQualityProperties properties,
            ReferenceResolver referenceResolver,
            @Autowired(required = false) ApplicationEventPublisher eventPublisher) {
        log.info("Configuring Data Quality Engine: sampleCapacity={}, parallelism={}, publishEvents={}",
                properties.getSampleCapacity(), properties.getParallelism(), properties.isPublishEvents());
        return new DataQualityEngine(
                referenceResolver,
                new PartitionEvaluator(properties.getSampleCapacity()),
                new OutcomeAggregator(),
                new ReportBuilder(),
                properties.getParallelism(),
                Schedulers.parallel(),
                properties.isPublishEvents() ? eventPublisher : null);
    }
}
