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

import lombok.Getter;
import org.fireflyframework.dataquality.exception.ConfigurationException;
import org.fireflyframework.dataquality.rule.DataQualityRule;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * An ordered, immutable collection of {@link DataQualityRule}s with unique names.
 *
 * <p>Usage example:</p>
 * <pre>{@code
 * RuleSet ruleSet = RuleSet.builder("customers")
 *     .rule(new NotNullRule("email", QualitySeverity.ERROR))
 *     .rule(new UniqueRule("customer_id", QualitySeverity.ERROR))
 *     .build();
 * }</pre>
 *
 * <p>Construction fails with a {@link ConfigurationException} when two rules share a name,
 * so a rule set that exists is always valid.</p>
 */
@Getter
public final class RuleSet {

    private final String name;
    private final List<DataQualityRule> rules;

    private RuleSet(String name, List<DataQualityRule> rules) {
        this.name = name;
        this.rules = Collections.unmodifiableList(new ArrayList<>(rules));
        validate();
    }

    private void validate() {
        List<String> errors = new ArrayList<>();
        Set<String> seen = new LinkedHashSet<>();
        for (DataQualityRule rule : rules) {
            if (rule == null) {
                errors.add("rule set '" + name + "' contains a null rule");
                continue;
            }
            String ruleName = rule.getRuleName();
            if (ruleName == null || ruleName.isBlank()) {
                errors.add("rule of kind " + rule.getKind() + " has no name");
            } else if (!seen.add(ruleName)) {
                errors.add("duplicate rule name '" + ruleName + "'");
            }
        }
        if (!errors.isEmpty()) {
            throw new ConfigurationException(errors);
        }
    }

    public static RuleSet of(String name, List<? extends DataQualityRule> rules) {
        return new RuleSet(name, new ArrayList<>(rules));
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public Optional<DataQualityRule> getRule(String ruleName) {
        return rules.stream()
                .filter(rule -> rule.getRuleName().equals(ruleName))
                .findFirst();
    }

    public Map<String, DataQualityRule> getRulesByName() {
        Map<String, DataQualityRule> byName = new LinkedHashMap<>();
        rules.forEach(rule -> byName.put(rule.getRuleName(), rule));
        return Collections.unmodifiableMap(byName);
    }

    /**
     * Returns the reference datasets required by the rules of this set.
     *
     * @return the reference ids in rule order
     */
    public Set<String> getReferenceIds() {
        Set<String> ids = new LinkedHashSet<>();
        rules.forEach(rule -> ids.addAll(rule.getReferenceIds()));
        return Collections.unmodifiableSet(ids);
    }

    public int size() {
        return rules.size();
    }

    public boolean isEmpty() {
        return rules.isEmpty();
    }

    /**
     * Fluent builder preserving rule insertion order.
     */
    public static final class Builder {

        private final String name;
        private final List<DataQualityRule> rules = new ArrayList<>();

        private Builder(String name) {
            this.name = name;
        }

        public Builder rule(DataQualityRule rule) {
            rules.add(rule);
            return this;
        }

        public Builder rules(List<? extends DataQualityRule> toAdd) {
            rules.addAll(toAdd);
            return this;
        }

        public RuleSet build() {
            return new RuleSet(name, rules);
        }
    }
}
