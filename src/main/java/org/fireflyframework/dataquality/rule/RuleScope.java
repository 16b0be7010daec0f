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
 * How much of the dataset a rule needs to see to decide a single record.
 *
 * <ul>
 *   <li>{@link #RECORD} - the record alone</li>
 *   <li>{@link #REFERENCE} - the record plus a reference dataset made available to every partition</li>
 *   <li>{@link #DATASET} - every record of the dataset; decided after all partitions are merged</li>
 * </ul>
 */
public enum RuleScope {

    RECORD,
    REFERENCE,
    DATASET
}
