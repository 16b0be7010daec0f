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

package org.fireflyframework.dataquality.rule;

import org.fireflyframework.dataquality.dataset.DataRecord;

/**
 * A rule that decides each record on its own.
 */
public interface RecordRule extends DataQualityRule {

    /**
     * Evaluates this rule against the given record.
     *
     * @param record the record to validate
     * @return the outcome of the evaluation
     */
    RuleOutcome evaluate(DataRecord record);

    @Override
    default RecordEvaluator bind(EvaluationContext context) {
        return this::evaluate;
    }
}
