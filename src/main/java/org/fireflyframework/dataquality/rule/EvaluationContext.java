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
import lombok.Getter;
import org.fireflyframework.dataquality.exception.ReferenceUnavailableException;
import org.fireflyframework.dataquality.reference.ReferenceLookup;

import java.util.Map;

/**
 * Per-partition context handed to {@link DataQualityRule#bind(EvaluationContext)}.
 *
 * <p>Reference lookups are resolved before evaluation starts and passed in explicitly,
 * so rules never hold a reference to a second dataset.</p>
 */
@Getter
@Builder
public class EvaluationContext {

    private final int partitionIndex;

    @Builder.Default
    private final Map<String, ReferenceLookup> references = Map.of();

    /**
     * Returns the resolved lookup for the given reference dataset.
     *
     * @param referenceId the reference identifier
     * @param ruleName    the rule asking, for diagnostics
     * @return the lookup
     * @throws ReferenceUnavailableException if the reference was not resolved
     */
    public ReferenceLookup reference(String referenceId, String ruleName) {
        ReferenceLookup lookup = references.get(referenceId);
        if (lookup == null) {
            throw new ReferenceUnavailableException(referenceId, ruleName);
        }
        return lookup;
    }
}
