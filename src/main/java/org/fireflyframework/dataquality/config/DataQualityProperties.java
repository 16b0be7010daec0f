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

import lombok.Data;
import org.fireflyframework.dataquality.engine.DataQualityEngine;
import org.fireflyframework.dataquality.ruleset.RuleDefinition;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Configuration properties for the data quality engine.
 *
 * <p><b>Example Configuration:</b></p>
 * <pre>{@code
 * firefly:
 *   data:
 *     quality:
 *       enabled: true
 *       sample-capacity: 100
 *       parallelism: 8
 *       publish-events: true
 *       rule-sets:
 *         customers:
 *           customer-id-unique:
 *             kind: unique
 *             columns: [customer_id]
 *             severity: ERROR
 *           email-format:
 *             kind: regex
 *             columns: [email]
 *             pattern: "^[\\w.-]+@[\\w.-]+\\.[a-zA-Z]{2,}$"
 * }</pre>
 */
@Data
@ConfigurationProperties(prefix = "firefly.data.quality")
public class DataQualityProperties {

    private boolean enabled = true;

    /**
     * Maximum number of sampled failing outcomes kept per rule.
     */
    private int sampleCapacity = DataQualityEngine.DEFAULT_SAMPLE_CAPACITY;

    /**
     * Number of partitions evaluated concurrently.
     */
    private int parallelism = Runtime.getRuntime().availableProcessors();

    private boolean publishEvents = true;

    /**
     * Rule sets by name, each mapping rule names to their definitions.
     */
    private Map<String, Map<String, RuleDefinition>> ruleSets = new LinkedHashMap<>();
}
