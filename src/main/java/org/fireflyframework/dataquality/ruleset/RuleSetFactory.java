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
import org.fireflyframework.dataquality.rule.DataQualityRule;
import org.fireflyframework.dataquality.rule.RecordPredicate;
import org.fireflyframework.dataquality.rule.RuleKind;
import org.fireflyframework.dataquality.rule.builtin.CustomRule;
import org.fireflyframework.dataquality.rule.builtin.NotNullRule;
import org.fireflyframework.dataquality.rule.builtin.PatternRule;
import org.fireflyframework.dataquality.rule.builtin.RangeRule;
import org.fireflyframework.dataquality.rule.builtin.ReferentialIntegrityRule;
import org.fireflyframework.dataquality.rule.builtin.UniqueRule;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Turns declarative {@link RuleDefinition}s into a validated {@link RuleSet}.
 *
 * <p>All definitions are checked before failing, so a single {@link ConfigurationException}
 * lists every problem of the rule set.</p>
 */
@Slf4j
public class RuleSetFactory {

    private static final Pattern NUMBER = Pattern.compile("[-+]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][-+]?\\d+)?");

    private final Map<String, RecordPredicate> predicates;

    public RuleSetFactory() {
        this(Map.of());
    }

    /**
     * @param predicates custom predicates by name, referenced from {@code custom} definitions
     */
    public RuleSetFactory(Map<String, RecordPredicate> predicates) {
        this.predicates = Map.copyOf(predicates);
    }

    /**
     * Creates a rule set from definitions keyed by rule name, in iteration order.
     *
     * @param ruleSetName the rule set name
     * @param definitions the definitions
     * @return the rule set
     * @throws ConfigurationException if any definition is invalid
     */
    public RuleSet create(String ruleSetName, Map<String, RuleDefinition> definitions) {
        List<DataQualityRule> rules = new ArrayList<>();
        List<String> errors = new ArrayList<>();

        definitions.forEach((ruleName, definition) -> {
            try {
                rules.add(createRule(ruleName, definition));
            } catch (ConfigurationException e) {
                errors.add("rule '" + ruleName + "': " + e.getMessage());
            }
        });

        if (!errors.isEmpty()) {
            throw new ConfigurationException("Invalid rule set '" + ruleSetName + "': "
                    + String.join("; ", errors), errors);
        }

        RuleSet ruleSet = RuleSet.of(ruleSetName, rules);
        log.debug("Created rule set '{}' with {} rules", ruleSetName, ruleSet.size());
        return ruleSet;
    }

    /**
     * Creates a single rule from its definition.
     *
     * @throws ConfigurationException if the definition is invalid
     */
    public DataQualityRule createRule(String ruleName, RuleDefinition definition) {
        if (definition == null) {
            throw new ConfigurationException("definition is missing");
        }
        RuleKind kind = RuleKind.fromString(definition.getKind())
                .orElseThrow(() -> new ConfigurationException("unknown rule kind '" + definition.getKind() + "'"));

        return switch (kind) {
            case NOT_NULL -> NotNullRule.builder()
                    .ruleName(ruleName)
                    .columns(definition.getColumns())
                    .severity(definition.getSeverity())
                    .description(definition.getDescription())
                    .build();
            case UNIQUE -> UniqueRule.builder()
                    .ruleName(ruleName)
                    .columns(definition.getColumns())
                    .severity(definition.getSeverity())
                    .nullPolicy(definition.getNullPolicy())
                    .description(definition.getDescription())
                    .build();
            case RANGE -> RangeRule.builder()
                    .ruleName(ruleName)
                    .columns(definition.getColumns())
                    .min(parseBound(definition.getMin()))
                    .max(parseBound(definition.getMax()))
                    .inclusive(definition.getInclusive())
                    .severity(definition.getSeverity())
                    .nullPolicy(definition.getNullPolicy())
                    .description(definition.getDescription())
                    .build();
            case REGEX -> PatternRule.builder()
                    .ruleName(ruleName)
                    .columns(definition.getColumns())
                    .pattern(compile(definition.getPattern()))
                    .severity(definition.getSeverity())
                    .nullPolicy(definition.getNullPolicy())
                    .description(definition.getDescription())
                    .build();
            case REFERENTIAL_INTEGRITY -> ReferentialIntegrityRule.builder()
                    .ruleName(ruleName)
                    .columns(definition.getColumns())
                    .referenceId(definition.getReference())
                    .severity(definition.getSeverity())
                    .nullPolicy(definition.getNullPolicy())
                    .description(definition.getDescription())
                    .build();
            case CUSTOM -> CustomRule.builder()
                    .ruleName(ruleName)
                    .columns(definition.getColumns())
                    .predicate(lookupPredicate(definition.getPredicate()))
                    .severity(definition.getSeverity())
                    .description(definition.getDescription())
                    .build();
        };
    }

    private RecordPredicate lookupPredicate(String name) {
        if (name == null || name.isBlank()) {
            throw new ConfigurationException("custom rule requires a predicate name");
        }
        return Optional.ofNullable(predicates.get(name))
                .orElseThrow(() -> new ConfigurationException("unknown predicate '" + name + "'"));
    }

    private static Pattern compile(String pattern) {
        if (pattern == null || pattern.isEmpty()) {
            throw new ConfigurationException("regex rule requires a pattern");
        }
        try {
            return Pattern.compile(pattern);
        } catch (PatternSyntaxException e) {
            throw new ConfigurationException("invalid pattern '" + pattern + "': " + e.getDescription());
        }
    }

    /**
     * Parses a configured bound as a number, an ISO date, an ISO date-time, or else keeps the text.
     */
    static Object parseBound(String text) {
        if (text == null || text.isBlank()) {
            return null;
        }
        String trimmed = text.trim();
        if (NUMBER.matcher(trimmed).matches()) {
            return new BigDecimal(trimmed);
        }
        return parseTemporal(trimmed).orElse(trimmed);
    }

    private static Optional<Object> parseTemporal(String text) {
        try {
            return Optional.<Object>of(text.contains("T") ? LocalDateTime.parse(text) : LocalDate.parse(text));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }
}
