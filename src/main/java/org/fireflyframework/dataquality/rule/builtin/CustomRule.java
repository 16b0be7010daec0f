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
import org.fireflyframework.dataquality.rule.QualitySeverity;
import org.fireflyframework.dataquality.rule.RecordPredicate;
import org.fireflyframework.dataquality.rule.RecordRule;
import org.fireflyframework.dataquality.rule.RuleKind;
import org.fireflyframework.dataquality.rule.RuleOutcome;

import java.util.ArrayList;
import java.util.List;

/**
 * Rule backed by a user-supplied {@link RecordPredicate}.
 *
 * <p>Columns are optional and only used to report the observed value of failing records.
 * An exception thrown by the predicate is contained by the partition evaluator and
 * reported as an evaluation error.</p>
 */
public class CustomRule implements RecordRule {

    private final String ruleName;
    private final List<String> columns;
    private final RecordPredicate predicate;
    private final QualitySeverity severity;
    private final String description;

    public CustomRule(String ruleName, RecordPredicate predicate) {
        this(ruleName, List.of(), predicate, QualitySeverity.WARNING, null);
    }

    @Builder
    public CustomRule(String ruleName, List<String> columns, RecordPredicate predicate, QualitySeverity severity,
                      String description) {
        if (ruleName == null || ruleName.isBlank()) {
            throw new ConfigurationException("custom rule requires a name");
        }
        if (predicate == null) {
            throw new ConfigurationException("custom rule '" + ruleName + "' requires a predicate");
        }
        this.ruleName = ruleName;
        this.columns = columns != null ? List.copyOf(columns) : List.of();
        this.predicate = predicate;
        this.severity = severity != null ? severity : QualitySeverity.WARNING;
        this.description = description;
    }

    @Override
    public RuleOutcome evaluate(DataRecord record) {
        if (predicate.test(record)) {
            return RuleOutcome.pass(ruleName, record);
        }
        return RuleOutcome.fail(ruleName, record, FailureReason.PREDICATE_FALSE, observedValue(record),
                description != null ? description : ruleName + " predicate returned false");
    }

    private Object observedValue(DataRecord record) {
        if (columns.isEmpty()) {
            return null;
        }
        if (columns.size() == 1) {
            return record.get(columns.get(0));
        }
        List<Object> values = new ArrayList<>(columns.size());
        for (String column : columns) {
            values.add(record.get(column));
        }
        return values;
    }

    @Override
    public String getRuleName() {
        return ruleName;
    }

    @Override
    public RuleKind getKind() {
        return RuleKind.CUSTOM;
    }

    @Override
    public List<String> getColumns() {
        return columns;
    }

    @Override
    public QualitySeverity getSeverity() {
        return severity;
    }

    @Override
    public String getDescription() {
        return description;
    }
}
