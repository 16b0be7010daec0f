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

import lombok.Builder;
import lombok.Data;
import org.fireflyframework.dataquality.dataset.DataRecord;

import java.util.Comparator;
import java.util.List;

/**
 * Verdict of one rule applied to one record.
 *
 * <p>Rules create outcomes without a location; the partition evaluator stamps the
 * partition index and the record's partition-local sequence number, which together
 * define the stable order used for sampling.</p>
 */
@Data
@Builder(toBuilder = true)
public class RuleOutcome {

    /**
     * Orders outcomes by partition index, then by partition-local sequence number.
     */
    public static final Comparator<RuleOutcome> STABLE_ORDER = Comparator
            .comparingInt(RuleOutcome::getPartitionIndex)
            .thenComparingLong(RuleOutcome::getSequence);

    private final String ruleName;
    private final String recordId;
    private final int partitionIndex;
    private final long sequence;
    private final OutcomeStatus status;
    private final FailureReason reason;
    private final Object observedValue;
    private final String message;

    /**
     * Normalized key of the record for dataset-scoped rules; {@code null} otherwise.
     */
    private final List<Object> key;

    public boolean isPassed() {
        return status == OutcomeStatus.PASSED;
    }

    public boolean isFailed() {
        return status == OutcomeStatus.FAILED;
    }

    public boolean isError() {
        return status == OutcomeStatus.ERROR;
    }

    /**
     * Returns a copy of this outcome placed at the given position of its partition.
     */
    public RuleOutcome at(int partitionIndex, long sequence) {
        return toBuilder()
                .partitionIndex(partitionIndex)
                .sequence(sequence)
                .build();
    }

    public static RuleOutcome pass(String ruleName, DataRecord record) {
        return RuleOutcome.builder()
                .ruleName(ruleName)
                .recordId(record.getRecordId())
                .status(OutcomeStatus.PASSED)
                .build();
    }

    public static RuleOutcome fail(String ruleName, DataRecord record, FailureReason reason,
                                   Object observedValue, String message) {
        return RuleOutcome.builder()
                .ruleName(ruleName)
                .recordId(record.getRecordId())
                .status(OutcomeStatus.FAILED)
                .reason(reason)
                .observedValue(observedValue)
                .message(message)
                .build();
    }

    public static RuleOutcome error(String ruleName, DataRecord record, Throwable cause) {
        return RuleOutcome.builder()
                .ruleName(ruleName)
                .recordId(record.getRecordId())
                .status(OutcomeStatus.ERROR)
                .reason(FailureReason.EVALUATION_ERROR)
                .message(cause.getClass().getSimpleName()
                        + (cause.getMessage() != null ? ": " + cause.getMessage() : ""))
                .build();
    }
}
