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

import org.fireflyframework.dataquality.report.RuleMetrics;
import org.fireflyframework.dataquality.report.ValidationReport;
import org.fireflyframework.dataquality.rule.DataQualityRule;
import org.fireflyframework.dataquality.rule.QualitySeverity;
import org.fireflyframework.dataquality.ruleset.RuleSet;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Turns finished tallies into an immutable {@link ValidationReport}.
 */
public class ReportBuilder {

    /**
     * Builds the report. Rules appear in rule set order; a rule without a tally is reported
     * as evaluated over zero records.
     *
     * @param ruleSet  the rule set that was applied
     * @param finished the aggregated result after {@link OutcomeAggregator#finish(PartialResult)}
     * @return the report
     */
    public ValidationReport build(RuleSet ruleSet, PartialResult finished) {
        List<RuleMetrics> results = new ArrayList<>(ruleSet.size());
        boolean errorRuleFailed = false;
        int passedRules = 0;

        for (DataQualityRule rule : ruleSet.getRules()) {
            RuleTally tally = finished.getTally(rule.getRuleName());
            if (tally == null) {
                tally = RuleTally.empty(rule.getRuleName(), 0);
            }
            if (tally.hasPendingKeys()) {
                throw new IllegalStateException("Rule '" + rule.getRuleName() + "' has undecided keys; "
                        + "finish the aggregation before building the report");
            }

            RuleMetrics metrics = toMetrics(rule, tally);
            results.add(metrics);
            if (metrics.isPassed()) {
                passedRules++;
            } else if (rule.getSeverity() == QualitySeverity.ERROR) {
                errorRuleFailed = true;
            }
        }

        return ValidationReport.builder()
                .ruleSetName(ruleSet.getName())
                .overallPassed(!errorRuleFailed)
                .totalRules(results.size())
                .passedRules(passedRules)
                .failedRules(results.size() - passedRules)
                .recordCount(finished.getRecordCount())
                .partitionCount(finished.getPartitionCount())
                .results(List.copyOf(results))
                .generatedAt(Instant.now())
                .build();
    }

    private RuleMetrics toMetrics(DataQualityRule rule, RuleTally tally) {
        return RuleMetrics.builder()
                .ruleName(rule.getRuleName())
                .kind(rule.getKind())
                .severity(rule.getSeverity())
                .columns(List.copyOf(rule.getColumns()))
                .description(rule.getDescription())
                .totalCount(tally.getTotalCount())
                .passCount(tally.getPassCount())
                .failCount(tally.getFailCount())
                .errorCount(tally.getErrorCount())
                .passRate(passRate(tally.getPassCount(), tally.getFailCount()))
                .passed(tally.getFailCount() == 0)
                .failureSample(tally.getFailureSample().getOutcomes())
                .errorSample(tally.getErrorSample().getOutcomes())
                .build();
    }

    /**
     * Returns {@code pass / (pass + fail)}, or 1.0 when both are zero.
     */
    static double passRate(long passCount, long failCount) {
        long decided = passCount + failCount;
        return decided == 0 ? 1.0 : (double) passCount / decided;
    }
}
