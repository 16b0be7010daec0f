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

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.dataquality.dataset.DataRecord;
import org.fireflyframework.dataquality.rule.ColumnValues;

import java.util.Collection;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link ReferenceResolver} holding reference key sets in memory.
 *
 * <p>Keys are normalized with {@link ColumnValues#normalize(Object)}, so a reference
 * registered with {@code Long} ids matches foreign keys stored as {@code Integer}.
 * Null keys are ignored. Suitable for single-machine validation and tests; distributed
 * deployments should provide a resolver backed by the substrate's broadcast mechanism.</p>
 */
@Slf4j
public class InMemoryReferenceResolver implements ReferenceResolver {

    private final Map<String, Set<Object>> references = new ConcurrentHashMap<>();

    /**
     * Registers or replaces a reference dataset from its key values.
     *
     * @param referenceId the reference identifier
     * @param keys        the key values
     */
    public void register(String referenceId, Collection<?> keys) {
        Set<Object> normalized = new HashSet<>();
        for (Object key : keys) {
            if (key != null) {
                normalized.add(ColumnValues.normalize(key));
            }
        }
        references.put(referenceId, Set.copyOf(normalized));
        log.info("Registered reference dataset '{}' with {} keys", referenceId, normalized.size());
    }

    /**
     * Registers or replaces a reference dataset by materializing a key column of the given records.
     *
     * @param referenceId the reference identifier
     * @param records     the reference records
     * @param keyColumn   the column holding the referenced keys
     */
    public void register(String referenceId, Iterable<DataRecord> records, String keyColumn) {
        Set<Object> keys = new HashSet<>();
        for (DataRecord record : records) {
            Object key = record.get(keyColumn);
            if (key != null) {
                keys.add(key);
            }
        }
        register(referenceId, keys);
    }

    public boolean remove(String referenceId) {
        return references.remove(referenceId) != null;
    }

    @Override
    public ReferenceLookup resolve(String referenceId) {
        Set<Object> keys = references.get(referenceId);
        if (keys == null) {
            log.debug("Reference dataset '{}' is not registered", referenceId);
            return null;
        }
        return key -> keys.contains(ColumnValues.normalize(key));
    }
}
