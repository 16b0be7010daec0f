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

import reactor.core.publisher.Flux;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * {@link PartitionedDataset} backed by partitions held in memory.
 *
 * <p>Suitable for tests and single-machine validation. Distributed substrates
 * provide their own {@link PartitionedDataset} implementation.</p>
 */
public class InMemoryDataset implements PartitionedDataset {

    private final List<DataPartition> partitions;

    /**
     * @param partitions the partitions, each with a distinct index
     * @throws IllegalArgumentException if two partitions share an index
     */
    public InMemoryDataset(List<DataPartition> partitions) {
        Set<Integer> indexes = new HashSet<>();
        for (DataPartition partition : partitions) {
            if (!indexes.add(partition.getIndex())) {
                throw new IllegalArgumentException("Duplicate partition index: " + partition.getIndex());
            }
        }
        this.partitions = List.copyOf(partitions);
    }

    /**
     * Creates a dataset with one partition per record list, indexed in list order.
     *
     * @param partitions the records of each partition
     * @return the dataset
     */
    @SafeVarargs
    public static InMemoryDataset of(List<DataRecord>... partitions) {
        List<DataPartition> result = new ArrayList<>();
        for (int i = 0; i < partitions.length; i++) {
            result.add(DataPartition.of(i, List.copyOf(partitions[i])));
        }
        return new InMemoryDataset(result);
    }

    /**
     * Splits the given records round-robin into {@code partitionCount} partitions.
     * Partitions that would be empty are omitted.
     *
     * @param records        the records to split
     * @param partitionCount the number of partitions, at least 1
     * @return the dataset
     */
    public static InMemoryDataset partitionInto(List<DataRecord> records, int partitionCount) {
        if (partitionCount < 1) {
            throw new IllegalArgumentException("partitionCount must be at least 1, got " + partitionCount);
        }
        List<List<DataRecord>> buckets = new ArrayList<>();
        for (int i = 0; i < partitionCount; i++) {
            buckets.add(new ArrayList<>());
        }
        for (int i = 0; i < records.size(); i++) {
            buckets.get(i % partitionCount).add(records.get(i));
        }

        List<DataPartition> result = new ArrayList<>();
        for (int i = 0; i < partitionCount; i++) {
            if (!buckets.get(i).isEmpty()) {
                result.add(DataPartition.of(i, List.copyOf(buckets.get(i))));
            }
        }
        return new InMemoryDataset(result);
    }

    public static InMemoryDataset empty() {
        return new InMemoryDataset(List.of());
    }

    @Override
    public Flux<DataPartition> partitions() {
        return Flux.fromIterable(partitions);
    }

    public int partitionCount() {
        return partitions.size();
    }
}
