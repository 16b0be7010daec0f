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
import org.fireflyframework.dataquality.exception.ConfigurationException;
import org.fireflyframework.dataquality.rule.DataQualityRule;
import org.fireflyframework.dataquality.rule.EvaluationContext;
import org.fireflyframework.dataquality.rule.FailureReason;
import org.fireflyframework.dataquality.rule.NullPolicy;
import org.fireflyframework.dataquality.rule.QualitySeverity;
import org.fireflyframework.dataquality.rule.RecordEvaluator;
import org.fireflyframework.dataquality.rule.RuleKind;
import org.fireflyframework.dataquality.rule.RuleOutcome;
import org.fireflyframework.dataquality.reference.ReferenceLookup;

import java.util.List;
import java.util.Set;

/**
 * Built-in rule that validates a foreign key column value exists in a reference dataset.
 *
 * <p>The reference is identified by id and resolved by the engine before evaluation;
 * the rule only consumes the resulting {@link ReferenceLookup}.</p>
 */
public class ReferentialIntegrityRule implements DataQualityRule {

    private final String ruleName;
    private final String column;
    private final String referenceId;
    private final QualitySeverity severity;
    private final NullPolicy nullPolicy;
    private final String description;

    public ReferentialIntegrityRule(String column, String referenceId) {
        this(column, referenceId, QualitySeverity.WARNING);
    }

    public ReferentialIntegrityRule(String column, String referenceId, QualitySeverity severity) {
        this(null, List.of(column), referenceId, severity, null, null);
    }

    @Builder
    public ReferentialIntegrityRule(String ruleName, List<String> columns, String referenceId,
                                    QualitySeverity severity, NullPolicy nullPolicy, String description) {
        this.column = RuleArguments.singleColumn(columns, "referential-integrity");
        if (referenceId == null || referenceId.isBlank()) {
            throw new ConfigurationException("referential-integrity rule on '" + column
                    + "' requires a reference id");
        }
        this.ruleName = ruleName != null ? ruleName : "references:" + column + "->" + referenceId;
        this.referenceId = referenceId;
        this.severity = severity != null ? severity : QualitySeverity.WARNING;
        this.nullPolicy = RuleArguments.nullPolicy(nullPolicy, "referential-integrity", column);
        this.description = description;
    }

    @Override
    public RecordEvaluator bind(EvaluationContext context) {
        ReferenceLookup lookup = context.reference(referenceId, ruleName);
        return record -> {
            Object value = record.get(column);
            if (value == null) {
                if (nullPolicy == NullPolicy.SKIP) {
                    return RuleOutcome.pass(ruleName, record);
                }
                return RuleOutcome.fail(ruleName, record, FailureReason.NULL_VALUE, null,
                        column + " is null, expected a key of " + referenceId);
            }
            if (lookup.contains(value)) {
                return RuleOutcome.pass(ruleName, record);
            }
            return RuleOutcome.fail(ruleName, record, FailureReason.MISSING_REFERENCE, value,
                    column + " value " + value + " not found in " + referenceId);
        };
    }

    @Override
    public Set<String> getReferenceIds() {
        return Set.of(referenceId);
    }

    public String getReferenceId() {
        return referenceId;
    }

    @Override
    public String getRuleName() {
        return ruleName;
    }

    @Override
    public RuleKind getKind() {
        return RuleKind.REFERENTIAL_INTEGRITY;
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
}
