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

import org.fireflyframework.dataquality.rule.builtin.RangeRule;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;

import static org.assertj.core.api.Assertions.assertThat;
import static org.fireflyframework.dataquality.dataset.RecordFixtures.row;

/**
 * Unit tests for {@link ColumnValues}.
 */
class ColumnValuesTest {

    @Test
    void toDecimal_shouldConvertAnyFiniteNumber() {
        LongAdder adder = new LongAdder();
        adder.add(42);

        assertThat(ColumnValues.toDecimal(new AtomicLong(7))).isEqualByComparingTo("7");
        assertThat(ColumnValues.toDecimal(new AtomicInteger(-3))).isEqualByComparingTo("-3");
        assertThat(ColumnValues.toDecimal(adder)).isEqualByComparingTo("42");
        assertThat(ColumnValues.toDecimal(Double.NaN)).isNull();
        assertThat(ColumnValues.toDecimal("7")).isNull();
    }

    @Test
    void normalize_shouldKeyAtomicNumbersLikeBoxedOnes() {
        assertThat(ColumnValues.normalize(new AtomicLong(5))).isEqualTo(ColumnValues.normalize(5));
        assertThat(ColumnValues.normalize(new AtomicLong(5))).isEqualTo(ColumnValues.normalize(new BigDecimal("5.00")));
    }

    @Test
    void keyWithNulls_shouldKeepNullElements() {
        assertThat(ColumnValues.keyWithNulls(row("1", "id", 5L, "region", null), Arrays.asList("id", "region")))
                .containsExactly(BigDecimal.valueOf(5), null);
        assertThat(ColumnValues.keyOf(row("1", "id", 5L, "region", null), Arrays.asList("id", "region")))
                .isNull();
    }

    @Test
    void rangeRule_shouldCompareAtomicNumbers() {
        RangeRule rule = new RangeRule("count", 0, 10);

        assertThat(rule.evaluate(row("1", "count", new AtomicLong(4))).isPassed()).isTrue();
        assertThat(rule.evaluate(row("2", "count", new AtomicLong(11))).getReason())
                .isEqualTo(FailureReason.OUT_OF_RANGE);
    }
}
