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

package org.fireflyframework.dataquality.rule;

import java.util.List;
import java.util.Set;

/**
 * Port interface for data quality validation rules over partitioned records.
 *
 * <p>Every rule, built-in or custom, shares one capability: {@link #bind(EvaluationContext)}
 * prepares the rule for one partition and returns the {@link RecordEvaluator} applied to
 * each of its records. Row-scoped rules ignore the context; referential integrity rules
 * read their reference lookup from it. Implementations must be pure: the same record and
 * context always yield the same outcome.</p>
 *
 * <p><b>Example:</b></p>
 * <pre>{@code
 * public class PositiveAmountRule implements RecordRule {
 *
 *     @Override
 *     public RuleOutcome evaluate(DataRecord record) {
 *         Object amount = record.get("amount");
 *         if (amount instanceof Number n && n.doubleValue() > 0) {
 *             return RuleOutcome.pass(getRuleName(), record);
 *         }
 *         return RuleOutcome.fail(getRuleName(), record, FailureReason.PREDICATE_FALSE, amount,
 *                 "amount must be positive");
 *     }
 *     ...
 * }
 * }</pre>
 */
public interface DataQualityRule {

    /**
     * Returns the name of this rule, unique within its rule set.
     *
     * @return the rule name
     */
    String getRuleName();

    RuleKind getKind();

    /**
     * Returns the target columns in declaration order.
     *
     * @return the target columns
     */
    List<String> getColumns();

    /**
     * Returns the severity level for violations of this rule.
     * Defaults to {@link QualitySeverity#WARNING}.
     *
     * @return the severity level
     */
    default QualitySeverity getSeverity() {
        return QualitySeverity.WARNING;
    }

    default String getDescription() {
        return null;
    }

    default RuleScope getScope() {
        return getKind().getScope();
    }

    /**
     * Returns the identifiers of the reference datasets this rule reads.
     * They are resolved once, before any partition is evaluated.
     *
     * @return the reference identifiers, empty for most rules
     */
    default Set<String> getReferenceIds() {
        return Set.of();
    }

    /**
     * Prepares this rule for one partition.
     *
     * @param context the partition context, including resolved reference lookups
     * @return the evaluator to apply to each record of the partition
     */
    RecordEvaluator bind(EvaluationContext context);
}
