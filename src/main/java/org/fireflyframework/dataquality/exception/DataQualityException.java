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

/**
 * Base class for all fatal data quality errors.
 *
 * <p>Per-record problems never surface as exceptions; they are recorded as
 * outcomes. Only failures that make a complete report impossible extend this type.</p>
 */
public class DataQualityException extends RuntimeException {

    public DataQualityException(String message) {
        super(message);
    }

    public DataQualityException(String message, Throwable cause) {
        super(message, cause);
    }
}
