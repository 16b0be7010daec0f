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

package org.fireflyframework.dataquality.dataset;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * A single row of a partitioned dataset with named-column access.
 *
 * <p>A column that is missing from the record and a column holding {@code null}
 * are both reported as absent by {@link #get(String)}.</p>
 */
@Getter
@ToString
@EqualsAndHashCode
public final class DataRecord {

    private final String recordId;
    private final Map<String, Object> values;

    private DataRecord(String recordId, Map<String, Object> values) {
        this.recordId = recordId;
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    /**
     * Creates a record.
     *
     * @param recordId logical row locator used in diagnostics
     * @param values   column values; {@code null} values are allowed
     * @return the record
     */
    public static DataRecord of(String recordId, Map<String, ?> values) {
        if (recordId == null) {
            throw new IllegalArgumentException("recordId must not be null");
        }
        return new DataRecord(recordId, values == null ? Map.of() : new LinkedHashMap<>(values));
    }

    public Object get(String column) {
        return values.get(column);
    }

    public boolean hasColumn(String column) {
        return values.containsKey(column);
    }

    public boolean isNull(String column) {
        return values.get(column) == null;
    }

    public Set<String> columns() {
        return values.keySet();
    }
}
