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

package org.fireflyframework.dataquality.engine;

import org.fireflyframework.dataquality.dataset.DataPartition;
import org.fireflyframework.dataquality.dataset.DataRecord;
import org.fireflyframework.dataquality.exception.ReferenceUnavailableException;
import org.fireflyframework.dataquality.rule.DataQualityRule;
import org.fireflyframework.dataquality.rule.EvaluationContext;
import org.fireflyframework.dataquality.rule.FailureReason;
import org.fireflyframework.dataquality.rule.QualitySeverity;
import org.fireflyframework.dataquality.rule.RecordEvaluator;
import org.fireflyframework.dataquality.rule.RuleKind;
import org.fireflyframework.dataquality.rule.RuleOutcome;
import org.fireflyframework.dataquality.rule.builtin.CustomRule;
import org.fireflyframework.dataquality.rule.builtin.NotNullRule;
import org.fireflyframework.dataquality.rule.builtin.RangeRule;
import org.fireflyframework.dataquality.rule.builtin.ReferentialIntegrityRule;
import org.fireflyframework.dataquality.rule.builtin.UniqueRule;
import org.fireflyframework.dataquality.ruleset.RuleSet;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;
import static org.fireflyframework.dataquality.dataset.RecordFixtures.row;

/**
 * Unit tests for {@link PartitionEvaluator}.
 */
class PartitionEvaluatorTest {

    private final PartitionEvaluator evaluator = new PartitionEvaluator(2);

    @Test
    void evaluate_shouldCountOutcomesAndKeepFirstFailures() {
        // Given - four records, three of them out of range
        DataPartition partition = DataPartition.of(3, List.of(
                row("a", "age", 150),
                row("b", "age", 30),
                row("c", "age", -1),
                row("d", "age", 200)));
        RuleSet ruleSet = RuleSet.builder("ages")
                .rule(new RangeRule("age", 0, 120, QualitySeverity.ERROR))
                .build();

        // When
        PartialResult result = evaluator.evaluate(partition, ruleSet, Map.of());

        // Then
        RuleTally tally = result.getTally("range:age");
        assertThat(tally.getPassCount()).isEqualTo(1);
        assertThat(tally.getFailCount()).isEqualTo(3);
        assertThat(tally.getErrorCount()).isZero();
        assertThat(tally.getFailureSample().getOutcomes())
                .extracting(RuleOutcome::getRecordId, RuleOutcome::getPartitionIndex, RuleOutcome::getSequence)
                .containsExactly(
                        tuple("a", 3, 0L),
                        tuple("c", 3, 2L));
        assertThat(result.getRecordCount()).isEqualTo(4);
        assertThat(result.getPartitionCount()).isEqualTo(1);
    }

    @Test
    void evaluate_shouldIsolateRuleEvaluationErrors() {
        // Given - a custom rule that throws for one record, next to a healthy rule
        CustomRule fragile = new CustomRule("fragile", record -> {
            if ("boom".equals(record.get("name"))) {
                throw new IllegalStateException("cannot evaluate");
            }
            return true;
        });
        RuleSet ruleSet = RuleSet.builder("names")
                .rule(fragile)
                .rule(new NotNullRule("name"))
                .build();
        DataPartition partition = DataPartition.of(0, List.of(
                row("1", "name", "ok"),
                row("2", "name", "boom"),
                row("3", "name", null)));

        // When
        PartialResult result = evaluator.evaluate(partition, ruleSet, Map.of());

        // Then - the error is tallied separately and evaluation continues
        RuleTally fragileTally = result.getTally("fragile");
        assertThat(fragileTally.getPassCount()).isEqualTo(2);
        assertThat(fragileTally.getFailCount()).isZero();
        assertThat(fragileTally.getErrorCount()).isEqualTo(1);
        RuleOutcome error = fragileTally.getErrorSample().getOutcomes().get(0);
        assertThat(error.getRecordId()).isEqualTo("2");
        assertThat(error.getReason()).isEqualTo(FailureReason.EVALUATION_ERROR);
        assertThat(error.getMessage()).isEqualTo("IllegalStateException: cannot evaluate");

        RuleTally notNullTally = result.getTally("not-null:name");
        assertThat(notNullTally.getPassCount()).isEqualTo(2);
        assertThat(notNullTally.getFailCount()).isEqualTo(1);
    }

    @Test
    void evaluate_shouldTurnBindFailureIntoErrorsForThatRuleOnly() {
        // Given - a rule that cannot be prepared for the partition
        DataQualityRule broken = new DataQualityRule() {
            @Override
            public String getRuleName() {
                return "broken";
            }

            @Override
            public RuleKind getKind() {
                return RuleKind.CUSTOM;
            }

            @Override
            public List<String> getColumns() {
                return List.of();
            }

            @Override
            public RecordEvaluator bind(EvaluationContext context) {
                throw new IllegalArgumentException("no state for partition " + context.getPartitionIndex());
            }
        };
        RuleSet ruleSet = RuleSet.builder("mixed")
                .rule(broken)
                .rule(new NotNullRule("id"))
                .build();
        DataPartition partition = DataPartition.of(0, List.of(row("1", "id", 1), row("2", "id", 2)));

        // When
        PartialResult result = evaluator.evaluate(partition, ruleSet, Map.of());

        // Then
        assertThat(result.getTally("broken").getErrorCount()).isEqualTo(2);
        assertThat(result.getTally("not-null:id").getPassCount()).isEqualTo(2);
    }

    @Test
    void evaluate_shouldPropagateUnavailableReference() {
        RuleSet ruleSet = RuleSet.builder("orders")
                .rule(new ReferentialIntegrityRule("customer_id", "customers"))
                .build();
        DataPartition partition = DataPartition.of(0, List.of(row("o1", "customer_id", 1)));

        assertThatThrownBy(() -> evaluator.evaluate(partition, ruleSet, Map.of()))
                .isInstanceOf(ReferenceUnavailableException.class);
    }

    @Test
    void evaluate_shouldHoldUniqueKeysUntilAggregation() {
        // Given - a local duplicate and a unique key
        RuleSet ruleSet = RuleSet.builder("ids")
                .rule(new UniqueRule("id", QualitySeverity.ERROR))
                .build();
        List<DataRecord> records = IntStream.of(7, 7, 8)
                .mapToObj(i -> row("r" + i, "id", i))
                .toList();

        // When
        PartialResult result = evaluator.evaluate(DataPartition.of(0, records), ruleSet, Map.of());

        // Then - nothing is decided yet, but every record is accounted for
        RuleTally tally = result.getTally("unique:id");
        assertThat(tally.getPassCount()).isZero();
        assertThat(tally.getFailCount()).isZero();
        assertThat(tally.hasPendingKeys()).isTrue();
        assertThat(tally.getKeys()).hasSize(2);
        assertThat(tally.getTotalCount()).isEqualTo(3);
    }
}
