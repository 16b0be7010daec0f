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
import org.fireflyframework.dataquality.rule.RuleOutcome;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * Fixed-capacity sample of outcomes kept in {@link RuleOutcome#STABLE_ORDER}.
 *
 * <p>A sample always holds the first {@code capacity} outcomes, by partition index and
 * partition-local sequence, of all outcomes offered to it. Merging is therefore
 * commutative and associative: any merge order over the same partitions yields the
 * same sample.</p>
 */
@Getter
@ToString
@EqualsAndHashCode
public final class BoundedSample {

    private final int capacity;
    private final List<RuleOutcome> outcomes;

    private BoundedSample(int capacity, List<RuleOutcome> outcomes) {
        this.capacity = capacity;
        this.outcomes = Collections.unmodifiableList(outcomes);
    }

    public static BoundedSample empty(int capacity) {
        checkCapacity(capacity);
        return new BoundedSample(capacity, List.of());
    }

    /**
     * Creates a sample from arbitrary candidates, keeping the first {@code capacity} in stable order.
     *
     * @param capacity   the maximum sample size
     * @param candidates the candidate outcomes
     * @return the sample
     */
    public static BoundedSample of(int capacity, Collection<RuleOutcome> candidates) {
        checkCapacity(capacity);
        List<RuleOutcome> sorted = new ArrayList<>(candidates);
        sorted.sort(RuleOutcome.STABLE_ORDER);
        if (sorted.size() > capacity) {
            sorted = new ArrayList<>(sorted.subList(0, capacity));
        }
        return new BoundedSample(capacity, sorted);
    }

    /**
     * Merges two samples of the same capacity.
     *
     * @param other the sample to merge with
     * @return a new sample holding the first {@code capacity} outcomes of both
     */
    public BoundedSample merge(BoundedSample other) {
        if (other.capacity != capacity) {
            throw new IllegalArgumentException("Cannot merge samples of capacity " + capacity
                    + " and " + other.capacity);
        }
        if (other.outcomes.isEmpty()) {
            return this;
        }
        if (outcomes.isEmpty()) {
            return other;
        }

        List<RuleOutcome> merged = new ArrayList<>(Math.min(capacity, outcomes.size() + other.outcomes.size()));
        int left = 0;
        int right = 0;
        while (merged.size() < capacity && (left < outcomes.size() || right < other.outcomes.size())) {
            if (right >= other.outcomes.size()
                    || (left < outcomes.size()
                    && RuleOutcome.STABLE_ORDER.compare(outcomes.get(left), other.outcomes.get(right)) <= 0)) {
                merged.add(outcomes.get(left++));
            } else {
                merged.add(other.outcomes.get(right++));
            }
        }
        return new BoundedSample(capacity, merged);
    }

    public int size() {
        return outcomes.size();
    }

    public boolean isEmpty() {
        return outcomes.isEmpty();
    }

    private static void checkCapacity(int capacity) {
        if (capacity < 0) {
            throw new IllegalArgumentException("Sample capacity must not be negative: " + capacity);
        }
    }
}
