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

package org.fireflyframework.dataquality.report;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Data;
import org.fireflyframework.dataquality.rule.QualitySeverity;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Immutable result of one validation run, produced by the
 * {@link org.fireflyframework.dataquality.engine.DataQualityEngine}.
 *
 * <p>{@link #isOverallPassed()} is true iff no {@link QualitySeverity#ERROR} rule has a failing
 * record. Warnings and evaluation errors never fail the report by themselves.</p>
 */
@Data
@Builder
@Schema(description = "Dataset-wide result of validating a dataset against a rule set")
public class ValidationReport {

    @Schema(description = "Name of the rule set", example = "customers")
    private final String ruleSetName;

    @Schema(description = "Whether no ERROR-severity rule failed", example = "true")
    private final boolean overallPassed;

    @Schema(description = "Number of rules evaluated", example = "4")
    private final int totalRules;

    @Schema(description = "Number of rules without failing records", example = "3")
    private final int passedRules;

    @Schema(description = "Number of rules with at least one failing record", example = "1")
    private final int failedRules;

    @Schema(description = "Number of records in the dataset", example = "1000")
    private final long recordCount;

    @Schema(description = "Number of partitions evaluated", example = "8")
    private final int partitionCount;

    @Schema(description = "Per-rule metrics in rule set order")
    private final List<RuleMetrics> results;

    @Schema(description = "When the report was built")
    private final Instant generatedAt;

    /**
     * Returns only the rules with failing records.
     *
     * @return list of failed {@link RuleMetrics} entries
     */
    public List<RuleMetrics> getFailures() {
        return results.stream()
                .filter(result -> !result.isPassed())
                .toList();
    }

    /**
     * Returns results filtered by the given severity.
     *
     * @param severity the severity to filter by
     * @return list of {@link RuleMetrics} entries matching the severity
     */
    public List<RuleMetrics> getBySeverity(QualitySeverity severity) {
        return results.stream()
                .filter(result -> result.getSeverity() == severity)
                .toList();
    }

    public Optional<RuleMetrics> getRule(String ruleName) {
        return results.stream()
                .filter(result -> result.getRuleName().equals(ruleName))
                .findFirst();
    }

    public boolean hasEvaluationErrors() {
        return results.stream().anyMatch(RuleMetrics::hasErrors);
    }
}
