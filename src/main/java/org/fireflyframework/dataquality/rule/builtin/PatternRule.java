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

package org.fireflyframework.dataquality.rule.builtin;

import lombok.Builder;
import org.fireflyframework.dataquality.dataset.DataRecord;
import org.fireflyframework.dataquality.exception.ConfigurationException;
import org.fireflyframework.dataquality.rule.FailureReason;
import org.fireflyframework.dataquality.rule.NullPolicy;
import org.fireflyframework.dataquality.rule.QualitySeverity;
import org.fireflyframework.dataquality.rule.RecordRule;
import org.fireflyframework.dataquality.rule.RuleKind;
import org.fireflyframework.dataquality.rule.RuleOutcome;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Built-in rule that validates a string column fully matches a regular expression.
 *
 * <p>Values that are not {@link CharSequence}s fail with {@link FailureReason#NOT_A_STRING}.</p>
 */
public class PatternRule implements RecordRule {

    private final String ruleName;
    private final String column;
    private final Pattern pattern;
    private final QualitySeverity severity;
    private final NullPolicy nullPolicy;
    private final String description;

    public PatternRule(String column, Pattern pattern) {
        this(column, pattern, QualitySeverity.WARNING);
    }

    public PatternRule(String column, Pattern pattern, QualitySeverity severity) {
        this(null, List.of(column), pattern, severity, null, null);
    }

    @Builder
    public PatternRule(String ruleName, List<String> columns, Pattern pattern, QualitySeverity severity,
                       NullPolicy nullPolicy, String description) {
        this.column = RuleArguments.singleColumn(columns, "regex");
        if (pattern == null) {
            throw new ConfigurationException("regex rule on '" + column + "' requires a pattern");
        }
        this.ruleName = ruleName != null ? ruleName : "pattern:" + column;
        this.pattern = pattern;
        this.severity = severity != null ? severity : QualitySeverity.WARNING;
        this.nullPolicy = RuleArguments.nullPolicy(nullPolicy, "regex", column);
        this.description = description;
    }

    @Override
    public RuleOutcome evaluate(DataRecord record) {
        Object value = record.get(column);
        if (value == null) {
            if (nullPolicy == NullPolicy.SKIP) {
                return RuleOutcome.pass(ruleName, record);
            }
            return RuleOutcome.fail(ruleName, record, FailureReason.NULL_VALUE, null,
                    column + " is null, expected pattern: " + pattern.pattern());
        }
        if (!(value instanceof CharSequence text)) {
            return RuleOutcome.fail(ruleName, record, FailureReason.NOT_A_STRING, value,
                    column + " is not a string: " + value.getClass().getSimpleName());
        }
        if (pattern.matcher(text).matches()) {
            return RuleOutcome.pass(ruleName, record);
        }
        return RuleOutcome.fail(ruleName, record, FailureReason.PATTERN_MISMATCH, value,
                column + " does not match pattern: " + pattern.pattern());
    }

    @Override
    public String getRuleName() {
        return ruleName;
    }

    @Override
    public RuleKind getKind() {
        return RuleKind.REGEX;
    }

    @Override
    public List<String> getColumns() {
        return List.of(column);
    }

    @Override
    public QualitySeverity getSeverity() {
        return severity;
    }

    @Override
    public String getDescription() {
        return description;
    }

    public Pattern getPattern() {
        return pattern;
    }
}
