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

package org.fireflyframework.dataquality.engine;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * How often one key of a uniqueness rule was seen, with its first occurrences.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class KeyOccurrences {

    private final long count;
    private final BoundedSample firstOccurrences;

    public KeyOccurrences(long count, BoundedSample firstOccurrences) {
        this.count = count;
        this.firstOccurrences = firstOccurrences;
    }

    public KeyOccurrences merge(KeyOccurrences other) {
        return new KeyOccurrences(count + other.count, firstOccurrences.merge(other.firstOccurrences));
    }
}
