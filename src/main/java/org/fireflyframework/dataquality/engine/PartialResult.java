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
import org.fireflyframework.dataquality.rule.DataQualityRule;
import org.fireflyframework.dataquality.ruleset.RuleSet;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-rule tallies produced by evaluating one or more partitions.
 *
 * <p>A partial result is owned by the evaluation that produced it and handed to the
 * aggregator by value. It references rules by name only.</p>
 */
@Getter
@ToString
@EqualsAndHashCode
public final class PartialResult {

    private final Map<String, RuleTally> tallies;
    private final long recordCount;
    private final int partitionCount;

    PartialResult(Map<String, RuleTally> tallies, long recordCount, int partitionCount) {
        this.tallies = Collections.unmodifiableMap(new LinkedHashMap<>(tallies));
        this.recordCount = recordCount;
        this.partitionCount = partitionCount;
    }

    /**
     * Returns the result of evaluating no partitions at all.
     */
    public static PartialResult empty(RuleSet ruleSet, int sampleCapacity) {
        Map<String, RuleTally> tallies = new LinkedHashMap<>();
        for (DataQualityRule rule : ruleSet.getRules()) {
            tallies.put(rule.getRuleName(), RuleTally.empty(rule.getRuleName(), sampleCapacity));
        }
        return new PartialResult(tallies, 0, 0);
    }

    public RuleTally getTally(String ruleName) {
        return tallies.get(ruleName);
    }

    /**
     * Merges two partial results rule by rule. Commutative and associative with respect
     * to every count and sample.
     */
    public PartialResult merge(PartialResult other) {
        Map<String, RuleTally> merged = new LinkedHashMap<>(tallies);
        other.tallies.forEach((ruleName, tally) -> merged.merge(ruleName, tally, RuleTally::merge));
        return new PartialResult(merged, recordCount + other.recordCount, partitionCount + other.partitionCount);
    }
}
