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
import org.fireflyframework.dataquality.rule.FailureReason;
import org.fireflyframework.dataquality.rule.OutcomeStatus;
import org.fireflyframework.dataquality.rule.RuleOutcome;
import org.fireflyframework.dataquality.ruleset.RuleSet;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reduces partition results into dataset-wide tallies.
 *
 * <p>The aggregator is a pure fold: {@link #merge(PartialResult, PartialResult)} is
 * commutative and associative, so sequential folding and parallel tree reduction over the
 * same partitions produce identical results. {@link #finish(PartialResult)} then decides
 * dataset-scoped rules, whose verdict depends on every partition.</p>
 */
@Slf4j
public class OutcomeAggregator {

    public PartialResult merge(PartialResult left, PartialResult right) {
        return left.merge(right);
    }

    /**
     * Folds partial results sequentially, starting from the empty result of the rule set.
     *
     * @param ruleSet        the rule set that produced the partial results
     * @param sampleCapacity the sample capacity used by the evaluator
     * @param partials       the partial results, in any order
     * @return the merged result, not yet finished
     */
    public PartialResult fold(RuleSet ruleSet, int sampleCapacity, Iterable<PartialResult> partials) {
        ResultAccumulator accumulator = new ResultAccumulator(ruleSet, sampleCapacity);
        for (PartialResult partial : partials) {
            accumulator.add(partial);
        }
        return accumulator.toResult();
    }

    /**
     * Resolves pending keys of uniqueness rules against their global counts.
     *
     * <p>Every occurrence of a key seen more than once across the dataset fails with
     * {@link FailureReason#DUPLICATE_KEY}; keys seen once pass. The failure sample is
     * rebuilt from both the key failures and the failures recorded during evaluation.</p>
     *
     * @param merged the result of merging every partition
     * @return a result without pending keys
     */
    public PartialResult finish(PartialResult merged) {
        Map<String, RuleTally> finished = new LinkedHashMap<>();
        merged.getTallies().forEach((ruleName, tally) ->
                finished.put(ruleName, tally.hasPendingKeys() ? resolveKeys(tally) : tally));
        return new PartialResult(finished, merged.getRecordCount(), merged.getPartitionCount());
    }

    private RuleTally resolveKeys(RuleTally tally) {
        long passCount = tally.getPassCount();
        long failCount = tally.getFailCount();
        long duplicateKeys = 0;
        List<RuleOutcome> duplicates = new ArrayList<>();

        for (KeyOccurrences occurrences : tally.getKeys().values()) {
            if (occurrences.getCount() > 1) {
                duplicateKeys++;
                failCount += occurrences.getCount();
                for (RuleOutcome outcome : occurrences.getFirstOccurrences().getOutcomes()) {
                    duplicates.add(outcome.toBuilder()
                            .status(OutcomeStatus.FAILED)
                            .reason(FailureReason.DUPLICATE_KEY)
                            .message("key " + outcome.getObservedValue() + " appears "
                                    + occurrences.getCount() + " times")
                            .key(null)
                            .build());
                }
            } else {
                passCount += occurrences.getCount();
            }
        }

        if (duplicateKeys > 0) {
            log.debug("Rule '{}' found {} duplicated keys across the dataset", tally.getRuleName(), duplicateKeys);
        }

        int capacity = tally.getFailureSample().getCapacity();
        BoundedSample failureSample = tally.getFailureSample().merge(BoundedSample.of(capacity, duplicates));
        return new RuleTally(tally.getRuleName(), passCount, failCount, tally.getErrorCount(),
                failureSample, tally.getErrorSample(), new HashMap<>());
    }
}
