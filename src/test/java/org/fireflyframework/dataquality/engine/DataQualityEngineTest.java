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
import org.fireflyframework.dataquality.dataset.InMemoryDataset;
import org.fireflyframework.dataquality.event.DataQualityEvent;
import org.fireflyframework.dataquality.exception.ReferenceUnavailableException;
import org.fireflyframework.dataquality.reference.InMemoryReferenceResolver;
import org.fireflyframework.dataquality.report.RuleMetrics;
import org.fireflyframework.dataquality.report.ValidationReport;
import org.fireflyframework.dataquality.rule.FailureReason;
import org.fireflyframework.dataquality.rule.NullPolicy;
import org.fireflyframework.dataquality.rule.QualitySeverity;
import org.fireflyframework.dataquality.rule.RuleOutcome;
import org.fireflyframework.dataquality.rule.builtin.CustomRule;
import org.fireflyframework.dataquality.rule.builtin.NotNullRule;
import org.fireflyframework.dataquality.rule.builtin.PatternRule;
import org.fireflyframework.dataquality.rule.builtin.RangeRule;
import org.fireflyframework.dataquality.rule.builtin.ReferentialIntegrityRule;
import org.fireflyframework.dataquality.rule.builtin.UniqueRule;
import org.fireflyframework.dataquality.ruleset.RuleSet;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;
import reactor.test.StepVerifier;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.regex.Pattern;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;
import static org.fireflyframework.dataquality.dataset.RecordFixtures.row;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

/**
 * Unit tests for {@link DataQualityEngine}.
 */
@ExtendWith(MockitoExtension.class)
class DataQualityEngineTest {

    @Mock
    private ApplicationEventPublisher eventPublisher;

    private final InMemoryReferenceResolver resolver = new InMemoryReferenceResolver();

    private final List<DataRecord> ages = List.of(
            row("1", "id", 1, "age", 30),
            row("2", "id", 2, "age", -5),
            row("3", "id", 3, "age", null));

    @Test
    void validate_shouldCountNullAsRangeFailureByDefault() {
        // Given
        RuleSet ruleSet = RuleSet.builder("ages")
                .rule(new NotNullRule("age", QualitySeverity.ERROR))
                .rule(new RangeRule("age", 0, 120, QualitySeverity.ERROR))
                .build();
        DataQualityEngine engine = new DataQualityEngine(resolver);

        // When & Then
        StepVerifier.create(engine.validate(InMemoryDataset.of(ages), ruleSet))
                .assertNext(report -> {
                    assertThat(report.isOverallPassed()).isFalse();
                    RuleMetrics notNull = report.getRule("not-null:age").orElseThrow();
                    assertThat(notNull.getFailCount()).isEqualTo(1);
                    assertThat(notNull.getFailureSample())
                            .extracting(RuleOutcome::getRecordId)
                            .containsExactly("3");

                    RuleMetrics range = report.getRule("range:age").orElseThrow();
                    assertThat(range.getFailCount()).isEqualTo(2);
                    assertThat(range.getPassCount()).isEqualTo(1);
                    assertThat(range.getFailureSample())
                            .extracting(RuleOutcome::getRecordId, RuleOutcome::getReason)
                            .containsExactly(
                                    tuple("2", FailureReason.OUT_OF_RANGE),
                                    tuple("3", FailureReason.NULL_VALUE));
                    assertThat(range.getPassRate()).isEqualTo(1.0 / 3);
                })
                .verifyComplete();
    }

    @Test
    void validate_shouldExemptNullsFromRangeWhenSkipped() {
        // Given
        RuleSet ruleSet = RuleSet.builder("ages")
                .rule(RangeRule.builder()
                        .columns(List.of("age"))
                        .min(0)
                        .max(120)
                        .severity(QualitySeverity.ERROR)
                        .nullPolicy(NullPolicy.SKIP)
                        .build())
                .build();
        DataQualityEngine engine = new DataQualityEngine(resolver);

        // When & Then
        StepVerifier.create(engine.validate(InMemoryDataset.of(ages), ruleSet))
                .assertNext(report -> {
                    RuleMetrics range = report.getRule("range:age").orElseThrow();
                    assertThat(range.getFailCount()).isEqualTo(1);
                    assertThat(range.getPassCount()).isEqualTo(2);
                    assertThat(report.isOverallPassed()).isFalse();
                })
                .verifyComplete();
    }

    @Test
    void validate_shouldPassEmptyDatasetVacuously() {
        // Given
        RuleSet ruleSet = RuleSet.builder("empty")
                .rule(new NotNullRule("id", QualitySeverity.ERROR))
                .rule(new UniqueRule("id", QualitySeverity.ERROR))
                .build();
        DataQualityEngine engine = new DataQualityEngine(resolver);

        // When & Then
        StepVerifier.create(engine.validate(InMemoryDataset.empty(), ruleSet))
                .assertNext(report -> {
                    assertThat(report.isOverallPassed()).isTrue();
                    assertThat(report.getRecordCount()).isZero();
                    assertThat(report.getPartitionCount()).isZero();
                    assertThat(report.getResults())
                            .hasSize(2)
                            .allSatisfy(metrics -> {
                                assertThat(metrics.getPassRate()).isEqualTo(1.0);
                                assertThat(metrics.getTotalCount()).isZero();
                                assertThat(metrics.isPassed()).isTrue();
                            });
                })
                .verifyComplete();
    }

    @Test
    void validate_shouldDetectDuplicatesSplitAcrossPartitions() {
        // Given - id 5 once in each partition
        InMemoryDataset dataset = InMemoryDataset.of(
                List.of(row("a", "id", 5), row("b", "id", 6)),
                List.of(row("c", "id", 7), row("d", "id", 5)));
        RuleSet ruleSet = RuleSet.builder("ids")
                .rule(new UniqueRule("id", QualitySeverity.ERROR))
                .build();
        DataQualityEngine engine = new DataQualityEngine(resolver);

        // When & Then
        StepVerifier.create(engine.validate(dataset, ruleSet))
                .assertNext(report -> {
                    RuleMetrics unique = report.getRule("unique:id").orElseThrow();
                    assertThat(unique.getFailCount()).isEqualTo(2);
                    assertThat(unique.getPassCount()).isEqualTo(2);
                    assertThat(unique.getFailureSample())
                            .extracting(RuleOutcome::getRecordId)
                            .containsExactly("a", "d");
                    assertThat(report.isOverallPassed()).isFalse();
                })
                .verifyComplete();
    }

    @Test
    void validate_shouldPassSingleNullKeyAndFailRepeatedNullKeys() {
        // Given
        RuleSet ruleSet = RuleSet.builder("ids")
                .rule(new UniqueRule("id", QualitySeverity.ERROR))
                .build();
        DataQualityEngine engine = new DataQualityEngine(resolver, 100, 2, null);
        InMemoryDataset singleNull = InMemoryDataset.of(
                List.of(row("a", "id", 1), row("b", "id", 2)),
                List.of(row("c", "id", null)));
        InMemoryDataset repeatedNulls = InMemoryDataset.of(
                List.of(row("a", "id", 1), row("b", "id", null)),
                List.of(row("c", "id", null)));

        // When & Then
        StepVerifier.create(engine.validate(singleNull, ruleSet))
                .assertNext(report -> {
                    RuleMetrics unique = report.getRule("unique:id").orElseThrow();
                    assertThat(unique.getPassCount()).isEqualTo(3);
                    assertThat(unique.getFailCount()).isZero();
                    assertThat(report.isOverallPassed()).isTrue();
                })
                .verifyComplete();

        StepVerifier.create(engine.validate(repeatedNulls, ruleSet))
                .assertNext(report -> {
                    RuleMetrics unique = report.getRule("unique:id").orElseThrow();
                    assertThat(unique.getPassCount()).isEqualTo(1);
                    assertThat(unique.getFailCount()).isEqualTo(2);
                    assertThat(unique.getFailureSample())
                            .extracting(RuleOutcome::getRecordId, RuleOutcome::getReason)
                            .containsExactly(
                                    tuple("b", FailureReason.DUPLICATE_KEY),
                                    tuple("c", FailureReason.DUPLICATE_KEY));
                    assertThat(report.isOverallPassed()).isFalse();
                })
                .verifyComplete();
    }

    @Test
    void validate_shouldReduceManyPartitionsOnSingleRail() {
        // Given - 400 partitions of distinct ids; "dup" lands in partition 0 and repeats id 399 of partition 399
        List<DataRecord> records = new ArrayList<>();
        for (int i = 0; i < 20_000; i++) {
            records.add(row("r" + i, "id", i));
        }
        records.add(row("dup", "id", 399));
        DataQualityEngine engine = new DataQualityEngine(resolver, 10, 1, null);
        RuleSet ruleSet = RuleSet.builder("ids")
                .rule(new UniqueRule("id", QualitySeverity.ERROR))
                .build();

        // When & Then
        StepVerifier.create(engine.validate(InMemoryDataset.partitionInto(records, 400), ruleSet))
                .assertNext(report -> {
                    RuleMetrics unique = report.getRule("unique:id").orElseThrow();
                    assertThat(report.getPartitionCount()).isEqualTo(400);
                    assertThat(unique.getTotalCount()).isEqualTo(20_001);
                    assertThat(unique.getFailCount()).isEqualTo(2);
                    assertThat(unique.getPassCount()).isEqualTo(19_999);
                    assertThat(unique.getFailureSample())
                            .extracting(RuleOutcome::getRecordId)
                            .containsExactly("dup", "r399");
                })
                .verifyComplete();
    }

    @Test
    void validate_shouldFailRunWhenReferenceIsUnresolved() {
        // Given - no reference registered for "customers"
        RuleSet ruleSet = RuleSet.builder("orders")
                .rule(new ReferentialIntegrityRule("customer_id", "customers", QualitySeverity.ERROR))
                .build();
        DataQualityEngine engine = new DataQualityEngine(resolver, 100, 2, eventPublisher);

        // When & Then
        StepVerifier.create(engine.validate(InMemoryDataset.of(List.of(row("o1", "customer_id", 1))), ruleSet))
                .expectErrorSatisfies(error -> {
                    assertThat(error).isInstanceOf(ReferenceUnavailableException.class);
                    assertThat(((ReferenceUnavailableException) error).getReferenceId()).isEqualTo("customers");
                })
                .verify();

        verify(eventPublisher, never()).publishEvent(any(Object.class));
    }

    @Test
    void validate_shouldWrapResolverFailures() {
        // Given
        RuleSet ruleSet = RuleSet.builder("orders")
                .rule(new ReferentialIntegrityRule("customer_id", "customers"))
                .build();
        DataQualityEngine engine = new DataQualityEngine(referenceId -> {
            throw new IllegalStateException("broadcast failed");
        });

        // When & Then
        StepVerifier.create(engine.validate(InMemoryDataset.of(List.of(row("o1", "customer_id", 1))), ruleSet))
                .expectErrorSatisfies(error -> assertThat(error)
                        .isInstanceOf(ReferenceUnavailableException.class)
                        .hasCauseInstanceOf(IllegalStateException.class))
                .verify();
    }

    @Test
    void validate_shouldCheckForeignKeysAgainstResolvedReference() {
        // Given
        resolver.register("customers", List.of(1L, 2L));
        RuleSet ruleSet = RuleSet.builder("orders")
                .rule(new ReferentialIntegrityRule("customer_id", "customers", QualitySeverity.ERROR))
                .build();
        InMemoryDataset orders = InMemoryDataset.of(
                List.of(row("o1", "customer_id", 1), row("o2", "customer_id", 3)),
                List.of(row("o3", "customer_id", 2), row("o4", "customer_id", null)));
        DataQualityEngine engine = new DataQualityEngine(resolver);

        // When & Then
        StepVerifier.create(engine.validate(orders, ruleSet))
                .assertNext(report -> {
                    RuleMetrics metrics = report.getResults().get(0);
                    assertThat(metrics.getPassCount()).isEqualTo(2);
                    assertThat(metrics.getFailCount()).isEqualTo(2);
                    assertThat(metrics.getFailureSample())
                            .extracting(RuleOutcome::getReason)
                            .containsExactly(FailureReason.MISSING_REFERENCE, FailureReason.NULL_VALUE);
                })
                .verifyComplete();
    }

    @Test
    void validate_shouldReportWarningsWithoutFailingOverall() {
        // Given - WARNING failure should not make overallPassed false
        RuleSet ruleSet = RuleSet.builder("emails")
                .rule(new PatternRule("email", Pattern.compile(".+@.+\\..+"), QualitySeverity.WARNING))
                .build();
        DataQualityEngine engine = new DataQualityEngine(resolver);

        // When & Then
        StepVerifier.create(engine.validate(InMemoryDataset.of(List.of(row("1", "email", "invalid-email"))), ruleSet))
                .assertNext(report -> {
                    assertThat(report.isOverallPassed()).isTrue();
                    assertThat(report.getFailedRules()).isEqualTo(1);
                    assertThat(report.getFailures()).hasSize(1);
                    assertThat(report.getBySeverity(QualitySeverity.WARNING)).hasSize(1);
                    assertThat(report.getBySeverity(QualitySeverity.ERROR)).isEmpty();
                })
                .verifyComplete();
    }

    @Test
    void validate_shouldCompleteReportDespiteEvaluationErrors() {
        // Given - every record makes the custom rule throw
        RuleSet ruleSet = RuleSet.builder("errors")
                .rule(CustomRule.builder()
                        .ruleName("always-throws")
                        .predicate(record -> {
                            throw new UnsupportedOperationException("not implemented");
                        })
                        .severity(QualitySeverity.ERROR)
                        .build())
                .rule(new NotNullRule("id", QualitySeverity.ERROR))
                .build();
        DataQualityEngine engine = new DataQualityEngine(resolver);

        // When & Then
        StepVerifier.create(engine.validate(InMemoryDataset.partitionInto(ages, 2), ruleSet))
                .assertNext(report -> {
                    RuleMetrics throwing = report.getRule("always-throws").orElseThrow();
                    assertThat(throwing.getErrorCount()).isEqualTo(3);
                    assertThat(throwing.getFailCount()).isZero();
                    assertThat(throwing.getTotalCount()).isEqualTo(3);
                    assertThat(throwing.getPassRate()).isEqualTo(1.0);
                    assertThat(report.hasEvaluationErrors()).isTrue();
                    assertThat(report.isOverallPassed()).isTrue();
                })
                .verifyComplete();
    }

    @Test
    void validate_shouldProduceSameCountsForAnyPartitioning() {
        // Given - a dataset with duplicates, nulls and out-of-range values
        Random random = new Random(42);
        List<DataRecord> records = IntStream.range(0, 500)
                .mapToObj(i -> row("r" + i,
                        "id", random.nextInt(400),
                        "age", random.nextInt(10) == 0 ? null : random.nextInt(140) - 10,
                        "email", random.nextBoolean() ? "user" + i + "@example.com" : "broken"))
                .toList();
        RuleSet ruleSet = datasetRules();
        DataQualityEngine engine = new DataQualityEngine(resolver, 10, 4, null);

        ValidationReport baseline = engine.validate(InMemoryDataset.partitionInto(records, 1), ruleSet).block();

        // When & Then
        for (int partitions = 2; partitions <= 9; partitions++) {
            ValidationReport report = engine.validate(InMemoryDataset.partitionInto(records, partitions), ruleSet)
                    .block();
            assertThat(report.getRecordCount()).isEqualTo(500);
            assertThat(report.isOverallPassed()).isEqualTo(baseline.isOverallPassed());
            for (RuleMetrics expected : baseline.getResults()) {
                RuleMetrics actual = report.getRule(expected.getRuleName()).orElseThrow();
                assertThat(actual.getPassCount()).as(expected.getRuleName()).isEqualTo(expected.getPassCount());
                assertThat(actual.getFailCount()).as(expected.getRuleName()).isEqualTo(expected.getFailCount());
                assertThat(actual.getFailureSample()).hasSizeLessThanOrEqualTo(10);
            }
        }
    }

    @Test
    void validate_shouldProduceIdenticalResultsForAnyPartitionOrder() {
        // Given - the same partitions emitted in different orders
        List<DataPartition> partitions = new ArrayList<>();
        for (int p = 0; p < 6; p++) {
            List<DataRecord> records = new ArrayList<>();
            for (int i = 0; i < 40; i++) {
                records.add(row(p + "-" + i, "id", (p * 7 + i) % 90, "age", (i * 13) % 150, "email", "x"));
            }
            partitions.add(DataPartition.of(p, records));
        }
        List<DataPartition> shuffled = new ArrayList<>(partitions);
        Collections.shuffle(shuffled, new Random(7));
        DataQualityEngine engine = new DataQualityEngine(resolver, 5, 3, null);

        // When
        ValidationReport ordered = engine.validate(new InMemoryDataset(partitions), datasetRules()).block();
        ValidationReport reordered = engine.validate(new InMemoryDataset(shuffled), datasetRules()).block();

        // Then
        assertThat(reordered.getResults()).isEqualTo(ordered.getResults());
        assertThat(reordered.getResults())
                .allSatisfy(metrics -> assertThat(metrics.getFailureSample()).hasSizeLessThanOrEqualTo(5));
    }

    @Test
    void validate_shouldPublishEvent() {
        // Given
        RuleSet ruleSet = RuleSet.builder("ids")
                .rule(new NotNullRule("id", QualitySeverity.ERROR))
                .build();
        DataQualityEngine engine = new DataQualityEngine(resolver, 100, 2, eventPublisher);

        // When
        StepVerifier.create(engine.validate(InMemoryDataset.of(ages), ruleSet))
                .assertNext(report -> assertThat(report.isOverallPassed()).isTrue())
                .verifyComplete();

        // Then
        ArgumentCaptor<DataQualityEvent> captor = ArgumentCaptor.forClass(DataQualityEvent.class);
        verify(eventPublisher).publishEvent(captor.capture());

        DataQualityEvent event = captor.getValue();
        assertThat(event.getReport()).isNotNull();
        assertThat(event.getReport().getRuleSetName()).isEqualTo("ids");
        assertThat(event.isPassed()).isTrue();
        assertThat(event.getTimestamp()).isNotNull();
    }

    private static RuleSet datasetRules() {
        return RuleSet.builder("profile")
                .rule(new UniqueRule("id", QualitySeverity.ERROR))
                .rule(new NotNullRule("age", QualitySeverity.WARNING))
                .rule(new RangeRule("age", 0, 120, QualitySeverity.ERROR))
                .rule(new PatternRule("email", Pattern.compile("[\\w.-]+@[\\w.-]+\\.[a-zA-Z]{2,}")))
                .build();
    }
}
