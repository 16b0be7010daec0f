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

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.dataquality.dataset.DataPartition;
import org.fireflyframework.dataquality.dataset.DataRecord;
import org.fireflyframework.dataquality.exception.DataQualityException;
import org.fireflyframework.dataquality.reference.ReferenceLookup;
import org.fireflyframework.dataquality.rule.DataQualityRule;
import org.fireflyframework.dataquality.rule.EvaluationContext;
import org.fireflyframework.dataquality.rule.RecordEvaluator;
import org.fireflyframework.dataquality.rule.RuleOutcome;
import org.fireflyframework.dataquality.ruleset.RuleSet;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Applies a {@link RuleSet} to one partition and produces its {@link PartialResult}.
 *
 * <p>Records are read once, in partition-local order, and every rule is applied to each
 * record. The record's position in that order is its sequence number. Rules are isolated
 * from each other: an exception thrown by a rule for one record becomes an
 * {@link org.fireflyframework.dataquality.rule.OutcomeStatus#ERROR} outcome for that record
 * and rule only. An exception thrown while binding a rule to the partition turns every
 * record of the partition into an error outcome for that rule.</p>
 *
 * <p>The evaluator holds no state between calls and may be shared by concurrent evaluations.</p>
 */
@Slf4j
public class PartitionEvaluator {

    @Getter
    private final int sampleCapacity;

    public PartitionEvaluator(int sampleCapacity) {
        if (sampleCapacity < 0) {
            throw new IllegalArgumentException("Sample capacity must not be negative: " + sampleCapacity);
        }
        this.sampleCapacity = sampleCapacity;
    }

    /**
     * Evaluates every rule of the rule set over the partition.
     *
     * @param partition  the partition to evaluate
     * @param ruleSet    the rules to apply
     * @param references resolved lookups by reference id
     * @return the partition's partial result
     * @throws DataQualityException if a rule cannot be bound because its reference is unavailable
     */
    public PartialResult evaluate(DataPartition partition, RuleSet ruleSet, Map<String, ReferenceLookup> references) {
        int partitionIndex = partition.getIndex();
        EvaluationContext context = EvaluationContext.builder()
                .partitionIndex(partitionIndex)
                .references(references)
                .build();

        List<DataQualityRule> rules = ruleSet.getRules();
        int ruleCount = rules.size();
        RecordEvaluator[] evaluators = new RecordEvaluator[ruleCount];
        RuntimeException[] bindFailures = new RuntimeException[ruleCount];
        RuleTally.Accumulator[] accumulators = new RuleTally.Accumulator[ruleCount];

        for (int i = 0; i < ruleCount; i++) {
            DataQualityRule rule = rules.get(i);
            accumulators[i] = RuleTally.accumulator(rule.getRuleName(), sampleCapacity);
            try {
                evaluators[i] = rule.bind(context);
            } catch (DataQualityException e) {
                throw e;
            } catch (RuntimeException e) {
                log.warn("Rule '{}' could not be prepared for partition {}: {}",
                        rule.getRuleName(), partitionIndex, e.getMessage());
                bindFailures[i] = e;
            }
        }

        long sequence = 0;
        for (DataRecord record : partition.getRecords()) {
            for (int i = 0; i < ruleCount; i++) {
                RuleOutcome outcome = apply(rules.get(i), evaluators[i], bindFailures[i], record, accumulators[i]);
                accumulators[i].record(outcome.at(partitionIndex, sequence));
            }
            sequence++;
        }

        Map<String, RuleTally> tallies = new LinkedHashMap<>();
        for (int i = 0; i < ruleCount; i++) {
            tallies.put(rules.get(i).getRuleName(), accumulators[i].build());
        }
        log.debug("Evaluated partition {}: {} records against {} rules", partitionIndex, sequence, ruleCount);
        return new PartialResult(tallies, sequence, 1);
    }

    private RuleOutcome apply(DataQualityRule rule, RecordEvaluator evaluator, RuntimeException bindFailure,
                              DataRecord record, RuleTally.Accumulator accumulator) {
        if (bindFailure != null) {
            return RuleOutcome.error(rule.getRuleName(), record, bindFailure);
        }
        try {
            RuleOutcome outcome = evaluator.evaluate(record);
            if (outcome == null) {
                throw new IllegalStateException("Rule '" + rule.getRuleName() + "' returned no outcome");
            }
            return outcome;
        } catch (RuntimeException e) {
            if (accumulator.errorCount() == 0) {
                log.warn("Rule '{}' failed to evaluate record '{}': {}",
                        rule.getRuleName(), record.getRecordId(), e.toString());
            } else {
                log.debug("Rule '{}' failed to evaluate record '{}'", rule.getRuleName(), record.getRecordId(), e);
            }
            return RuleOutcome.error(rule.getRuleName(), record, e);
        }
    }
}
