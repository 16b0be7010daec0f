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

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.dataquality.exception.ConfigurationException;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Named rule sets available to the application.
 *
 * <p>Rule sets declared in configuration are parsed when the registry is created, so a
 * malformed rule set fails application startup instead of the first validation run.</p>
 */
@Slf4j
public class RuleSetRegistry {

    private final Map<String, RuleSet> ruleSets = new ConcurrentHashMap<>();

    public RuleSetRegistry() {
    }

    public RuleSetRegistry(Map<String, Map<String, RuleDefinition>> definitions, RuleSetFactory factory) {
        definitions.forEach((name, rules) -> register(factory.create(name, rules)));
        log.info("Initialized RuleSetRegistry with {} rule sets", ruleSets.size());
    }

    /**
     * Registers or replaces a rule set under its own name.
     *
     * @param ruleSet the rule set
     */
    public void register(RuleSet ruleSet) {
        RuleSet previous = ruleSets.put(ruleSet.getName(), ruleSet);
        if (previous != null) {
            log.info("Replaced rule set '{}'", ruleSet.getName());
        } else {
            log.debug("Registered rule set '{}' with {} rules", ruleSet.getName(), ruleSet.size());
        }
    }

    public Optional<RuleSet> find(String name) {
        return Optional.ofNullable(ruleSets.get(name));
    }

    /**
     * Returns the rule set with the given name.
     *
     * @throws ConfigurationException if no such rule set is registered
     */
    public RuleSet get(String name) {
        return find(name).orElseThrow(() -> new ConfigurationException("Unknown rule set '" + name + "'"));
    }

    public Set<String> names() {
        return Set.copyOf(ruleSets.keySet());
    }
}
