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

import org.fireflyframework.dataquality.rule.DataQualityRule;
import org.fireflyframework.dataquality.ruleset.RuleSet;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Mutable reduction target owned by a single rail.
 *
 * <p>Adding a partial result costs time proportional to that partial result only, so a
 * rail folding many partitions stays linear in the number of keys it sees. The
 * accumulator is never shared: each rail creates its own and converts it back into an
 * immutable {@link PartialResult} with {@link #toResult()} once its partitions are done.</p>
 */
final class ResultAccumulator {

    private final int sampleCapacity;
    private final Map<String, TallyBuilder> tallies = new LinkedHashMap<>();
    private long recordCount;
    private int partitionCount;

    ResultAccumulator(RuleSet ruleSet, int sampleCapacity) {
        this.sampleCapacity = sampleCapacity;
        for (DataQualityRule rule : ruleSet.getRules()) {
            tallies.put(rule.getRuleName(), new TallyBuilder(rule.getRuleName()));
        }
    }

    ResultAccumulator add(PartialResult partial) {
        partial.getTallies().forEach((ruleName, tally) ->
                tallies.computeIfAbsent(ruleName, TallyBuilder::new).add(tally));
        recordCount += partial.getRecordCount();
        partitionCount += partial.getPartitionCount();
        return this;
    }

    PartialResult toResult() {
        Map<String, RuleTally> built = new LinkedHashMap<>();
        tallies.forEach((ruleName, builder) -> built.put(ruleName, builder.build()));
        return new PartialResult(built, recordCount, partitionCount);
    }

    private final class TallyBuilder {

        private final String ruleName;
        private long passCount;
        private long failCount;
        private long errorCount;
        private BoundedSample failureSample = BoundedSample.empty(sampleCapacity);
        private BoundedSample errorSample = BoundedSample.empty(sampleCapacity);
        private final Map<List<Object>, KeyOccurrences> keys = new HashMap<>();

        private TallyBuilder(String ruleName) {
            this.ruleName = ruleName;
        }

        void add(RuleTally tally) {
            passCount += tally.getPassCount();
            failCount += tally.getFailCount();
            errorCount += tally.getErrorCount();
            failureSample = failureSample.merge(tally.getFailureSample());
            errorSample = errorSample.merge(tally.getErrorSample());
            for (Map.Entry<List<Object>, KeyOccurrences> entry : tally.getKeys().entrySet()) {
                keys.merge(entry.getKey(), entry.getValue(), KeyOccurrences::merge);
            }
        }

        RuleTally build() {
            return new RuleTally(ruleName, passCount, failCount, errorCount, failureSample, errorSample,
                    new HashMap<>(keys));
        }
    }
}
