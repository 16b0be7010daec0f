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

package org.fireflyframework.dataquality.ruleset;

import org.fireflyframework.dataquality.exception.ConfigurationException;
import org.fireflyframework.dataquality.rule.builtin.NotNullRule;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RuleSetRegistryTest {

    @Test
    void shouldCreateRuleSetsFromDefinitions() {
        Map<String, Map<String, RuleDefinition>> definitions = Map.of(
                "customers", Map.of("id-present",
                        RuleDefinition.builder().kind("not-null").columns(List.of("id")).build()),
                "orders", Map.of("order-unique",
                        RuleDefinition.builder().kind("unique").columns(List.of("order_id")).build()));

        RuleSetRegistry registry = new RuleSetRegistry(definitions, new RuleSetFactory());

        assertThat(registry.names()).containsExactlyInAnyOrder("customers", "orders");
        assertThat(registry.get("orders").getRule("order-unique")).isPresent();
    }

    @Test
    void shouldReplaceRuleSetWithSameName() {
        RuleSetRegistry registry = new RuleSetRegistry();
        registry.register(RuleSet.of("customers", List.of(new NotNullRule("id"))));
        registry.register(RuleSet.of("customers", List.of(new NotNullRule("id"), new NotNullRule("email"))));

        assertThat(registry.names()).containsExactly("customers");
        assertThat(registry.get("customers").size()).isEqualTo(2);
    }

    @Test
    void shouldFailForUnknownRuleSet() {
        RuleSetRegistry registry = new RuleSetRegistry();

        assertThat(registry.find("missing")).isEmpty();
        assertThatThrownBy(() -> registry.get("missing"))
                .isInstanceOf(ConfigurationException.class)
                .hasMessage("Unknown rule set 'missing'");
    }

    @Test
    void shouldPropagateInvalidDefinitions() {
        Map<String, Map<String, RuleDefinition>> definitions = Map.of(
                "broken", Map.of("bad", RuleDefinition.builder().kind("nope").columns(List.of("id")).build()));

        assertThatThrownBy(() -> new RuleSetRegistry(definitions, new RuleSetFactory()))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("unknown rule kind 'nope'");
    }
}
