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

/**
 * Why a record did not pass a rule.
 */
public enum FailureReason {

    NULL_VALUE,
    OUT_OF_RANGE,
    NOT_COMPARABLE,
    PATTERN_MISMATCH,
    NOT_A_STRING,
    DUPLICATE_KEY,
    MISSING_REFERENCE,
    PREDICATE_FALSE,
    EVALUATION_ERROR
}
