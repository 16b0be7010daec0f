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

package org.fireflyframework.dataquality.ruleset;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.fireflyframework.dataquality.rule.NullPolicy;
import org.fireflyframework.dataquality.rule.QualitySeverity;

import java.util.ArrayList;
import java.util.List;

/**
 * Declarative description of one rule, independent of where it was loaded from.
 *
 * <p>Bound from configuration by Spring or created in code, then turned into a
 * {@link org.fireflyframework.dataquality.rule.DataQualityRule} by {@link RuleSetFactory}.
 * Which parameters are required depends on {@link #kind}:</p>
 * <ul>
 *   <li>{@code range} - {@code min} and/or {@code max}; {@code inclusive} defaults to true</li>
 *   <li>{@code regex} - {@code pattern}</li>
 *   <li>{@code referential-integrity} - {@code reference}</li>
 *   <li>{@code custom} - {@code predicate}, the name of a registered {@code RecordPredicate}</li>
 * </ul>
 *
 * <p><b>Example Configuration:</b></p>
 * <pre>{@code
 * firefly:
 *   data:
 *     quality:
 *       rule-sets:
 *         customers:
 *           age-in-range:
 *             kind: range
 *             columns: [age]
 *             min: 0
 *             max: 120
 *             severity: ERROR
 *             null-policy: SKIP
 * }</pre>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RuleDefinition {

    private String kind;

    @Builder.Default
    private List<String> columns = new ArrayList<>();

    @Builder.Default
    private QualitySeverity severity = QualitySeverity.WARNING;

    private NullPolicy nullPolicy;

    private String description;

    private String min;

    private String max;

    private Boolean inclusive;

    private String pattern;

    private String reference;

    private String predicate;
}
