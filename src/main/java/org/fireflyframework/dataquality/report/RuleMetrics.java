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
import org.fireflyframework.dataquality.rule.RuleKind;
import org.fireflyframework.dataquality.rule.RuleOutcome;

import java.util.List;

/**
 * Dataset-wide metrics of a single rule.
 */
@Data
@Builder
@Schema(description = "Dataset-wide metrics and sampled failures of one data quality rule")
public class RuleMetrics {

    @Schema(description = "Rule name, unique within the rule set", example = "age-in-range")
    private final String ruleName;

    @Schema(description = "Rule kind", example = "RANGE")
    private final RuleKind kind;

    @Schema(description = "Severity of violations", example = "ERROR")
    private final QualitySeverity severity;

    @Schema(description = "Target columns", example = "[\"age\"]")
    private final List<String> columns;

    @Schema(description = "Human-readable description of the rule")
    private final String description;

    @Schema(description = "Records evaluated, including evaluation errors", example = "1000")
    private final long totalCount;

    @Schema(description = "Records that passed", example = "998")
    private final long passCount;

    @Schema(description = "Records that failed", example = "2")
    private final long failCount;

    @Schema(description = "Records the rule could not evaluate", example = "0")
    private final long errorCount;

    @Schema(description = "passCount / (passCount + failCount); 1.0 when nothing was decided", example = "0.998")
    private final double passRate;

    @Schema(description = "Whether no record failed", example = "false")
    private final boolean passed;

    @Schema(description = "First failing outcomes by partition and position")
    private final List<RuleOutcome> failureSample;

    @Schema(description = "First evaluation errors by partition and position")
    private final List<RuleOutcome> errorSample;

    public boolean hasErrors() {
        return errorCount > 0;
    }
}
