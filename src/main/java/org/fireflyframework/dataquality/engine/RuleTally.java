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

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import org.fireflyframework.dataquality.rule.RuleOutcome;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Counts and samples of one rule over some subset of the dataset's partitions.
 *
 * <p>Outcomes of dataset-scoped rules that carry a key are not counted as passed or
 * failed yet; they are held per key until {@link OutcomeAggregator#finish(PartialResult)}
 * knows the global count of each key.</p>
 */
@Getter
@ToString(exclude = "keys")
@EqualsAndHashCode
public final class RuleTally {

    private final String ruleName;
    private final long passCount;
    private final long failCount;
    private final long errorCount;
    private final BoundedSample failureSample;
    private final BoundedSample errorSample;
    private final Map<List<Object>, KeyOccurrences> keys;

    RuleTally(String ruleName, long passCount, long failCount, long errorCount,
              BoundedSample failureSample, BoundedSample errorSample, Map<List<Object>, KeyOccurrences> keys) {
        this.ruleName = ruleName;
        this.passCount = passCount;
        this.failCount = failCount;
        this.errorCount = errorCount;
        this.failureSample = failureSample;
        this.errorSample = errorSample;
        this.keys = Collections.unmodifiableMap(keys);
    }

    public static RuleTally empty(String ruleName, int sampleCapacity) {
        return new RuleTally(ruleName, 0, 0, 0,
                BoundedSample.empty(sampleCapacity), BoundedSample.empty(sampleCapacity), Map.of());
    }

    /**
     * Number of records evaluated, including those whose key verdict is still pending.
     */
    public long getTotalCount() {
        long pending = 0;
        for (KeyOccurrences occurrences : keys.values()) {
            pending += occurrences.getCount();
        }
        return passCount + failCount + errorCount + pending;
    }

    public boolean hasPendingKeys() {
        return !keys.isEmpty();
    }

    /**
     * Merges two tallies of the same rule. Commutative and associative.
     */
    public RuleTally merge(RuleTally other) {
        if (!ruleName.equals(other.ruleName)) {
            throw new IllegalArgumentException("Cannot merge tallies of rules '" + ruleName
                    + "' and '" + other.ruleName + "'");
        }
        return new RuleTally(ruleName,
                passCount + other.passCount,
                failCount + other.failCount,
                errorCount + other.errorCount,
                failureSample.merge(other.failureSample),
                errorSample.merge(other.errorSample),
                mergeKeys(keys, other.keys));
    }

    /**
     * Merges the smaller key map into a copy of the larger one.
     */
    static Map<List<Object>, KeyOccurrences> mergeKeys(Map<List<Object>, KeyOccurrences> left,
                                                      Map<List<Object>, KeyOccurrences> right) {
        if (right.isEmpty()) {
            return left;
        }
        if (left.isEmpty()) {
            return right;
        }
        Map<List<Object>, KeyOccurrences> larger = left.size() >= right.size() ? left : right;
        Map<List<Object>, KeyOccurrences> smaller = larger == left ? right : left;
        Map<List<Object>, KeyOccurrences> merged = new HashMap<>(larger);
        for (Map.Entry<List<Object>, KeyOccurrences> entry : smaller.entrySet()) {
            merged.merge(entry.getKey(), entry.getValue(), KeyOccurrences::merge);
        }
        return merged;
    }

    static Accumulator accumulator(String ruleName, int sampleCapacity) {
        return new Accumulator(ruleName, sampleCapacity);
    }

    /**
     * Mutable builder owned by a single partition evaluation.
     * Outcomes must be recorded in partition-local order.
     */
    static final class Accumulator {

        private final String ruleName;
        private final int sampleCapacity;
        private long passCount;
        private long failCount;
        private long errorCount;
        private final List<RuleOutcome> failures = new ArrayList<>();
        private final List<RuleOutcome> errors = new ArrayList<>();
        private final Map<List<Object>, KeyAccumulator> keys = new HashMap<>();

        private Accumulator(String ruleName, int sampleCapacity) {
            this.ruleName = ruleName;
            this.sampleCapacity = sampleCapacity;
        }

        void record(RuleOutcome outcome) {
            switch (outcome.getStatus()) {
                case ERROR -> {
                    errorCount++;
                    keep(errors, outcome);
                }
                case FAILED -> {
                    failCount++;
                    keep(failures, outcome);
                }
                case PASSED -> {
                    if (outcome.getKey() != null) {
                        keys.computeIfAbsent(outcome.getKey(), k -> new KeyAccumulator()).record(outcome);
                    } else {
                        passCount++;
                    }
                }
            }
        }

        private void keep(List<RuleOutcome> sample, RuleOutcome outcome) {
            if (sample.size() < sampleCapacity) {
                sample.add(outcome);
            }
        }

        long errorCount() {
            return errorCount;
        }

        RuleTally build() {
            Map<List<Object>, KeyOccurrences> built = new HashMap<>(keys.size());
            keys.forEach((key, acc) ->
                    built.put(key, new KeyOccurrences(acc.count, BoundedSample.of(sampleCapacity, acc.first))));
            return new RuleTally(ruleName, passCount, failCount, errorCount,
                    BoundedSample.of(sampleCapacity, failures),
                    BoundedSample.of(sampleCapacity, errors),
                    built);
        }

        private final class KeyAccumulator {

            private long count;
            private final List<RuleOutcome> first = new ArrayList<>(1);

            void record(RuleOutcome outcome) {
                count++;
                keep(first, outcome);
            }
        }
    }
}
