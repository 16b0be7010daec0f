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

import java.util.List;

/**
 * Raised when a rule set is malformed: duplicate rule names, missing or invalid
 * parameters, or an unknown rule kind.
 *
 * <p>Detected before any partition is evaluated. The run fails and no report is produced.</p>
 */
@Getter
public class ConfigurationException extends DataQualityException {

    private final List<String> errors;

    public ConfigurationException(String message) {
        this(message, List.of(message));
    }

    public ConfigurationException(String message, List<String> errors) {
        super(message);
        this.errors = List.copyOf(errors);
    }

    public ConfigurationException(List<String> errors) {
        this("Invalid rule set: " + String.join("; ", errors), errors);
    }
}
