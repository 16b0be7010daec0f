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

package org.fireflyframework.dataquality.exception;

import lombok.Getter;

/**
 * Raised when the reference dataset required by a referential integrity rule
 * cannot be resolved. Fatal for the whole run.
 */
@Getter
public class ReferenceUnavailableException extends DataQualityException {

    private final String referenceId;
    private final String ruleName;

    public ReferenceUnavailableException(String referenceId, String ruleName) {
        super("Reference dataset '" + referenceId + "' required by rule '" + ruleName + "' is unavailable");
        this.referenceId = referenceId;
        this.ruleName = ruleName;
    }

    public ReferenceUnavailableException(String referenceId, String ruleName, Throwable cause) {
        super("Reference dataset '" + referenceId + "' required by rule '" + ruleName + "' is unavailable", cause);
        this.referenceId = referenceId;
        this.ruleName = ruleName;
    }
}
