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
import org.fireflyframework.dataquality.rule.ColumnValues;
import org.fireflyframework.dataquality.rule.DataQualityRule;
import org.fireflyframework.dataquality.rule.EvaluationContext;
import org.fireflyframework.dataquality.rule.FailureReason;
import org.fireflyframework.dataquality.rule.NullPolicy;
import org.fireflyframework.dataquality.rule.QualitySeverity;
import org.fireflyframework.dataquality.rule.RecordEvaluator;
import org.fireflyframework.dataquality.rule.RuleKind;
import org.fireflyframework.dataquality.rule.RuleOutcome;

import java.util.List;

/**
 * Built-in rule that validates the target column tuple is unique across the whole dataset.
 *
 * <p>A single partition cannot decide uniqueness, so the evaluator emits a provisional
 * passing outcome carrying the record's normalized key. The aggregator counts keys over
 * all partitions and turns every occurrence of a repeated key into a
 * {@link FailureReason#DUPLICATE_KEY} failure.</p>
 *
 * <p>By default ({@link NullPolicy#AS_VALUE}) null is an ordinary key value: a single null
 * passes and repeated nulls are duplicates. {@link NullPolicy#FAIL} and
 * {@link NullPolicy#SKIP} take records with a null key out of duplicate detection.</p>
 */
public class UniqueRule implements DataQualityRule {

    private final String ruleName;
    private final List<String> columns;
    private final QualitySeverity severity;
    private final NullPolicy nullPolicy;
    private final String description;

    public UniqueRule(String column) {
        this(column, QualitySeverity.WARNING);
    }

    public UniqueRule(String column, QualitySeverity severity) {
        this(null, List.of(column), severity, null, null);
    }

    @Builder
    public UniqueRule(String ruleName, List<String> columns, QualitySeverity severity, NullPolicy nullPolicy,
                      String description) {
        this.columns = RuleArguments.columns(columns, "unique");
        this.ruleName = ruleName != null ? ruleName : "unique:" + String.join(",", this.columns);
        this.severity = severity != null ? severity : QualitySeverity.WARNING;
        this.nullPolicy = nullPolicy != null ? nullPolicy : NullPolicy.AS_VALUE;
        this.description = description;
    }

    @Override
    public RecordEvaluator bind(EvaluationContext context) {
        return this::evaluate;
    }

    private RuleOutcome evaluate(DataRecord record) {
        List<Object> key = nullPolicy == NullPolicy.AS_VALUE
                ? ColumnValues.keyWithNulls(record, columns)
                : ColumnValues.keyOf(record, columns);
        if (key == null) {
            if (nullPolicy == NullPolicy.SKIP) {
                return RuleOutcome.pass(ruleName, record);
            }
            return RuleOutcome.fail(ruleName, record, FailureReason.NULL_VALUE, null,
                    String.join(",", columns) + " key contains null");
        }
        return RuleOutcome.pass(ruleName, record).toBuilder()
                .observedValue(columns.size() == 1 ? record.get(columns.get(0)) : key)
                .key(key)
                .build();
    }

    @Override
    public String getRuleName() {
        return ruleName;
    }

    @Override
    public RuleKind getKind() {
        return RuleKind.UNIQUE;
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

    public NullPolicy getNullPolicy() {
        return nullPolicy;
    }
}
