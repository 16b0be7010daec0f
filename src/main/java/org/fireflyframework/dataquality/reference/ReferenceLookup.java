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

package org.fireflyframework.dataquality.reference;

/**
 * Membership lookup over the key column of a reference dataset.
 *
 * <p>Implementations must answer in amortized constant time and be safe to call
 * concurrently from every partition evaluation.</p>
 */
@FunctionalInterface
public interface ReferenceLookup {

    /**
     * Returns whether the given key exists in the reference dataset.
     *
     * @param key the foreign key value, never {@code null}
     * @return true if the key is present
     */
    boolean contains(Object key);
}
