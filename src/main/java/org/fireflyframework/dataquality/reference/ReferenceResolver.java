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

import org.fireflyframework.dataquality.exception.ReferenceUnavailableException;

/**
 * Makes reference datasets available to every partition before evaluation begins.
 *
 * <p>Materializing the key column (a broadcast variable, a join, a hash set) is the
 * substrate's concern. The engine only calls {@link #resolve(String)} once per
 * reference id and run.</p>
 */
@FunctionalInterface
public interface ReferenceResolver {

    /**
     * Resolves the lookup for the given reference dataset.
     *
     * @param referenceId the reference identifier declared by a rule
     * @return the lookup, or {@code null} if the reference is unknown
     * @throws ReferenceUnavailableException if the reference exists but could not be loaded
     */
    ReferenceLookup resolve(String referenceId);
}
