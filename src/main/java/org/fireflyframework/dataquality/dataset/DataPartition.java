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

import lombok.Getter;
import lombok.ToString;

import java.util.List;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * One disjoint subset of a dataset, processed as a unit.
 *
 * <p>The index identifies the partition within its dataset and is part of the
 * deterministic ordering of sampled outcomes, so a substrate must assign each
 * partition a stable, unique index.</p>
 */
@Getter
@ToString(exclude = "records")
public final class DataPartition {

    private final int index;
    private final Iterable<DataRecord> records;

    private DataPartition(int index, Iterable<DataRecord> records) {
        this.index = index;
        this.records = records;
    }

    public static DataPartition of(int index, Iterable<DataRecord> records) {
        if (index < 0) {
            throw new IllegalArgumentException("Partition index must not be negative: " + index);
        }
        return new DataPartition(index, records == null ? List.of() : records);
    }

    public Stream<DataRecord> stream() {
        return StreamSupport.stream(records.spliterator(), false);
    }
}
