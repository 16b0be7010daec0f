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

import org.fireflyframework.dataquality.dataset.DataRecord;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Helpers for comparing and keying column values consistently across rules.
 *
 * <p>Numbers are normalized to {@link BigDecimal} without trailing zeros, so
 * {@code 5}, {@code 5L} and {@code 5.0} produce the same key and compare as equal.</p>
 */
public final class ColumnValues {

    private ColumnValues() {}

    /**
     * Normalizes a value for equality-based lookups. Non-finite floating point values
     * and non-numeric values are returned unchanged.
     */
    public static Object normalize(Object value) {
        BigDecimal decimal = toDecimal(value);
        return decimal != null ? decimal.stripTrailingZeros() : value;
    }

    /**
     * Builds the normalized key of a record over the given columns.
     *
     * @return the key, or {@code null} if any column is null
     */
    public static List<Object> keyOf(DataRecord record, List<String> columns) {
        List<Object> key = new ArrayList<>(columns.size());
        for (String column : columns) {
            Object value = record.get(column);
            if (value == null) {
                return null;
            }
            key.add(normalize(value));
        }
        return Collections.unmodifiableList(key);
    }

    /**
     * Builds the normalized key of a record over the given columns, keeping null values
     * as key elements.
     */
    public static List<Object> keyWithNulls(DataRecord record, List<String> columns) {
        List<Object> key = new ArrayList<>(columns.size());
        for (String column : columns) {
            Object value = record.get(column);
            key.add(value == null ? null : normalize(value));
        }
        return Collections.unmodifiableList(key);
    }

    /**
     * Converts a finite number to {@link BigDecimal}.
     *
     * @return the decimal, or {@code null} if the value is not a finite number
     */
    public static BigDecimal toDecimal(Object value) {
        if (value instanceof BigDecimal decimal) {
            return decimal;
        }
        if (value instanceof BigInteger integer) {
            return new BigDecimal(integer);
        }
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            return Double.isFinite(d) ? BigDecimal.valueOf(d) : null;
        }
        if (value instanceof Byte || value instanceof Short || value instanceof Integer || value instanceof Long) {
            return BigDecimal.valueOf(((Number) value).longValue());
        }
        if (value instanceof Number number) {
            return parseDecimal(number.toString());
        }
        return null;
    }

    private static BigDecimal parseDecimal(String text) {
        try {
            return new BigDecimal(text);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /**
     * Compares two values when they are mutually comparable.
     *
     * @return the comparison result, or {@code null} if the values cannot be compared
     */
    @SuppressWarnings({"unchecked", "rawtypes"})
    public static Integer compare(Object value, Object bound) {
        if (value instanceof Number || bound instanceof Number) {
            BigDecimal left = toDecimal(value);
            BigDecimal right = toDecimal(bound);
            return left != null && right != null ? left.compareTo(right) : null;
        }
        if (value instanceof Comparable comparable && bound != null && bound.getClass().isInstance(value)) {
            return comparable.compareTo(bound);
        }
        return null;
    }
}
