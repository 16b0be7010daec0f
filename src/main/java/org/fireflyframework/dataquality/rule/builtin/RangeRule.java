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
import org.fireflyframework.dataquality.rule.ColumnValues;
import org.fireflyframework.dataquality.rule.FailureReason;
import org.fireflyframework.dataquality.rule.NullPolicy;
import org.fireflyframework.dataquality.rule.QualitySeverity;
import org.fireflyframework.dataquality.rule.RecordRule;
import org.fireflyframework.dataquality.rule.RuleKind;
import org.fireflyframework.dataquality.rule.RuleOutcome;

import java.util.List;

/**
 * Built-in rule that validates a comparable column falls within a range.
 *
 * <p>Bounds are inclusive unless {@code inclusive} is false; a {@code null} bound leaves
 * that side open. Numbers of any type compare numerically. Any other value must be an
 * instance of the bound's class, otherwise the record fails as not comparable.</p>
 */
public class RangeRule implements RecordRule {

    private final String ruleName;
    private final String column;
    private final Object min;
    private final Object max;
    private final boolean inclusive;
    private final QualitySeverity severity;
    private final NullPolicy nullPolicy;
    private final String description;

    public RangeRule(String column, Object min, Object max) {
        this(column, min, max, QualitySeverity.WARNING);
    }

    public RangeRule(String column, Object min, Object max, QualitySeverity severity) {
        this(null, List.of(column), min, max, true, severity, null, null);
    }

    @Builder
    public RangeRule(String ruleName, List<String> columns, Object min, Object max, Boolean inclusive,
                     QualitySeverity severity, NullPolicy nullPolicy, String description) {
        this.column = RuleArguments.singleColumn(columns, "range");
        if (min == null && max == null) {
            throw new ConfigurationException("range rule on '" + column + "' requires min, max or both");
        }
        if (min != null && max != null) {
            Integer order = ColumnValues.compare(min, max);
            if (order == null) {
                throw new ConfigurationException("range rule on '" + column + "' has incomparable bounds "
                        + min + " and " + max);
            }
            if (order > 0) {
                throw new ConfigurationException("range rule on '" + column + "' has min " + min
                        + " greater than max " + max);
            }
        }
        this.ruleName = ruleName != null ? ruleName : "range:" + column;
        this.min = min;
        this.max = max;
        this.inclusive = inclusive == null || inclusive;
        this.severity = severity != null ? severity : QualitySeverity.WARNING;
        this.nullPolicy = RuleArguments.nullPolicy(nullPolicy, "range", column);
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
                    column + " is null, expected range " + describeRange());
        }

        Integer belowMin = min != null ? ColumnValues.compare(value, min) : Integer.valueOf(1);
        Integer aboveMax = max != null ? ColumnValues.compare(value, max) : Integer.valueOf(-1);
        if (belowMin == null || aboveMax == null) {
            return RuleOutcome.fail(ruleName, record, FailureReason.NOT_COMPARABLE, value,
                    column + " value " + value + " is not comparable with range " + describeRange());
        }

        boolean withinMin = inclusive ? belowMin >= 0 : belowMin > 0;
        boolean withinMax = inclusive ? aboveMax <= 0 : aboveMax < 0;
        if (withinMin && withinMax) {
            return RuleOutcome.pass(ruleName, record);
        }
        return RuleOutcome.fail(ruleName, record, FailureReason.OUT_OF_RANGE, value,
                column + " value " + value + " is outside range " + describeRange());
    }

    private String describeRange() {
        return (inclusive ? "[" : "(") + min + ", " + max + (inclusive ? "]" : ")");
    }

    @Override
    public String getRuleName() {
        return ruleName;
    }

    @Override
    public RuleKind getKind() {
        return RuleKind.RANGE;
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

    public NullPolicy getNullPolicy() {
        return nullPolicy;
    }
}
