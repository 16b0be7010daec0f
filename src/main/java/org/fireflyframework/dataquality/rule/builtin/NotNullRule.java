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
import org.fireflyframework.dataquality.rule.FailureReason;
import org.fireflyframework.dataquality.rule.QualitySeverity;
import org.fireflyframework.dataquality.rule.RecordRule;
import org.fireflyframework.dataquality.rule.RuleKind;
import org.fireflyframework.dataquality.rule.RuleOutcome;

import java.util.List;

/**
 * Built-in rule that validates every target column holds a value.
 *
 * <p>A column missing from the record counts as null.</p>
 */
public class NotNullRule implements RecordRule {

    private final String ruleName;
    private final List<String> columns;
    private final QualitySeverity severity;
    private final String description;

    public NotNullRule(String column) {
        this(column, QualitySeverity.WARNING);
    }

    public NotNullRule(String column, QualitySeverity severity) {
        this(null, List.of(column), severity, null);
    }

    @Builder
    public NotNullRule(String ruleName, List<String> columns, QualitySeverity severity, String description) {
        this.columns = RuleArguments.columns(columns, "not-null");
        this.ruleName = ruleName != null ? ruleName : "not-null:" + String.join(",", this.columns);
        this.severity = severity != null ? severity : QualitySeverity.WARNING;
        this.description = description;
    }

    @Override
    public RuleOutcome evaluate(DataRecord record) {
        for (String column : columns) {
            if (record.isNull(column)) {
                return RuleOutcome.fail(ruleName, record, FailureReason.NULL_VALUE, null,
                        column + " must not be null");
            }
        }
        return RuleOutcome.pass(ruleName, record);
    }

    @Override
    public String getRuleName() {
        return ruleName;
    }

    @Override
    public RuleKind getKind() {
        return RuleKind.NOT_NULL;
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
