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
 * How a rule treats a record whose target value is null or absent.
 *
 * <ul>
 *   <li>{@link #FAIL} - the record fails with {@link FailureReason#NULL_VALUE}</li>
 *   <li>{@link #SKIP} - the record is exempt and counted as passed; pair with a not-null rule
 *       when nulls must be reported separately</li>
 *   <li>{@link #AS_VALUE} - null is an ordinary value; only uniqueness rules accept it, where
 *       a lone null passes and repeated nulls are duplicates</li>
 * </ul>
 */
public enum NullPolicy {

    FAIL,
    SKIP,
    AS_VALUE
}
