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

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.dataquality.dataset.PartitionedDataset;
import org.fireflyframework.dataquality.event.DataQualityEvent;
import org.fireflyframework.dataquality.exception.DataQualityException;
import org.fireflyframework.dataquality.exception.ReferenceUnavailableException;
import org.fireflyframework.dataquality.reference.ReferenceLookup;
import org.fireflyframework.dataquality.reference.ReferenceResolver;
import org.fireflyframework.dataquality.rule.DataQualityRule;
import org.fireflyframework.dataquality.report.ValidationReport;
import org.fireflyframework.dataquality.ruleset.RuleSet;
import org.springframework.context.ApplicationEventPublisher;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Engine that validates a {@link PartitionedDataset} against a {@link RuleSet}
 * and produces a {@link ValidationReport}.
 *
 * <p>A run proceeds in four steps:</p>
 * <ol>
 *   <li>every reference dataset required by the rule set is resolved; an unresolved
 *       reference fails the run with a {@link ReferenceUnavailableException}</li>
 *   <li>partitions are evaluated independently on {@code parallelism} rails of the scheduler</li>
 *   <li>each rail folds its partial results into its own accumulator; the rail results are
 *       then reduced with the commutative, associative merge of the {@link OutcomeAggregator}
 *       and dataset-scoped rules are decided</li>
 *   <li>the {@link ReportBuilder} produces the report</li>
 * </ol>
 *
 * <p>The returned {@link Mono} emits exactly one complete report or an error; cancelling it
 * discards in-flight partition work and no partial report is ever emitted. When an
 * {@link ApplicationEventPublisher} is provided, a {@link DataQualityEvent} is published
 * for each report.</p>
 */
@Slf4j
public class DataQualityEngine {

    public static final int DEFAULT_SAMPLE_CAPACITY = 100;

    private final ReferenceResolver referenceResolver;
    private final PartitionEvaluator evaluator;
    private final OutcomeAggregator aggregator;
    private final ReportBuilder reportBuilder;
    private final int parallelism;
    private final Scheduler scheduler;
    private final ApplicationEventPublisher eventPublisher;

    /**
     * Creates an engine with the default sample capacity, one rail per available processor
     * and no event publishing.
     *
     * @param referenceResolver resolver for referential integrity rules
     */
    public DataQualityEngine(ReferenceResolver referenceResolver) {
        this(referenceResolver, DEFAULT_SAMPLE_CAPACITY, Runtime.getRuntime().availableProcessors(), null);
    }

    /**
     * Creates an engine on the shared {@link Schedulers#parallel()} scheduler.
     *
     * @param referenceResolver resolver for referential integrity rules
     * @param sampleCapacity    maximum number of sampled failures per rule
     * @param parallelism       number of partitions evaluated concurrently
     * @param eventPublisher    the event publisher, or {@code null} to disable event publishing
     */
    public DataQualityEngine(ReferenceResolver referenceResolver, int sampleCapacity, int parallelism,
                             ApplicationEventPublisher eventPublisher) {
        this(referenceResolver, new PartitionEvaluator(sampleCapacity), new OutcomeAggregator(),
                new ReportBuilder(), parallelism, Schedulers.parallel(), eventPublisher);
    }

    public DataQualityEngine(ReferenceResolver referenceResolver, PartitionEvaluator evaluator,
                             OutcomeAggregator aggregator, ReportBuilder reportBuilder, int parallelism,
                             Scheduler scheduler, ApplicationEventPublisher eventPublisher) {
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be at least 1, got " + parallelism);
        }
        this.referenceResolver = Objects.requireNonNull(referenceResolver, "referenceResolver");
        this.evaluator = evaluator;
        this.aggregator = aggregator;
        this.reportBuilder = reportBuilder;
        this.parallelism = parallelism;
        this.scheduler = scheduler;
        this.eventPublisher = eventPublisher;
    }

    /**
     * Validates the dataset against the rule set.
     *
     * @param dataset the partitioned dataset
     * @param ruleSet the rules to apply
     * @return a {@link Mono} emitting the {@link ValidationReport}, or failing with a
     *         {@link DataQualityException} when the run cannot produce a complete report
     */
    public Mono<ValidationReport> validate(PartitionedDataset dataset, RuleSet ruleSet) {
        return Mono.defer(() -> {
            Objects.requireNonNull(dataset, "dataset");
            Objects.requireNonNull(ruleSet, "ruleSet");
            Map<String, ReferenceLookup> references = resolveReferences(ruleSet);
            long startNanos = System.nanoTime();
            log.info("Validating dataset against rule set '{}' with {} rules", ruleSet.getName(), ruleSet.size());

            return dataset.partitions()
                    .parallel(parallelism)
                    .runOn(scheduler)
                    .map(partition -> evaluator.evaluate(partition, ruleSet, references))
                    .reduce(() -> new ResultAccumulator(ruleSet, evaluator.getSampleCapacity()),
                            ResultAccumulator::add)
                    .map(ResultAccumulator::toResult)
                    .reduce(aggregator::merge)
                    .defaultIfEmpty(PartialResult.empty(ruleSet, evaluator.getSampleCapacity()))
                    .map(merged -> reportBuilder.build(ruleSet, aggregator.finish(merged)))
                    .doOnNext(report -> log.info(
                            "Rule set '{}' {} over {} records in {} partitions: {}/{} rules passed ({} ms)",
                            ruleSet.getName(),
                            report.isOverallPassed() ? "PASSED" : "FAILED",
                            report.getRecordCount(),
                            report.getPartitionCount(),
                            report.getPassedRules(),
                            report.getTotalRules(),
                            Duration.ofNanos(System.nanoTime() - startNanos).toMillis()));
        })
                .doOnError(DataQualityException.class, e -> log.error("Validation run failed: {}", e.getMessage()))
                .doOnNext(this::publishEvent);
    }

    private Map<String, ReferenceLookup> resolveReferences(RuleSet ruleSet) {
        Map<String, ReferenceLookup> resolved = new LinkedHashMap<>();
        for (DataQualityRule rule : ruleSet.getRules()) {
            for (String referenceId : rule.getReferenceIds()) {
                if (resolved.containsKey(referenceId)) {
                    continue;
                }
                ReferenceLookup lookup;
                try {
                    lookup = referenceResolver.resolve(referenceId);
                } catch (ReferenceUnavailableException e) {
                    throw e;
                } catch (RuntimeException e) {
                    throw new ReferenceUnavailableException(referenceId, rule.getRuleName(), e);
                }
                if (lookup == null) {
                    throw new ReferenceUnavailableException(referenceId, rule.getRuleName());
                }
                resolved.put(referenceId, lookup);
                log.debug("Resolved reference dataset '{}' for rule '{}'", referenceId, rule.getRuleName());
            }
        }
        return Collections.unmodifiableMap(resolved);
    }

    private void publishEvent(ValidationReport report) {
        if (eventPublisher != null) {
            eventPublisher.publishEvent(new DataQualityEvent(report));
        }
    }
}
