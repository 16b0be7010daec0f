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

/**
 * Input contract of the storage and compute substrate that supplies the data.
 *
 * <p>Implementations decide how records are split into partitions and how
 * partitions are loaded. The engine only requires that partitions are disjoint
 * and carry unique indexes.</p>
 */
@FunctionalInterface
public interface PartitionedDataset {

    /**
     * Returns the partitions of this dataset. The emission order carries no meaning.
     *
     * @return a {@link Flux} of partitions
     */
    Flux<DataPartition> partitions();
}
