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

package org.fireflyframework.dataquality.rule.builtin;

import org.fireflyframework.dataquality.exception.ConfigurationException;
import org.fireflyframework.dataquality.rule.NullPolicy;

import java.util.List;

final class RuleArguments {

    private RuleArguments() {}

    static List<String> columns(List<String> columns, String kind) {
        if (columns == null || columns.isEmpty()) {
            throw new ConfigurationException(kind + " rule requires at least one target column");
        }
        for (String column : columns) {
            if (column == null || column.isBlank()) {
                throw new ConfigurationException(kind + " rule has a blank target column");
            }
        }
        return List.copyOf(columns);
    }

    static String singleColumn(List<String> columns, String kind) {
        List<String> checked = columns(columns, kind);
        if (checked.size() != 1) {
            throw new ConfigurationException(kind + " rule requires exactly one target column, got " + checked);
        }
        return checked.get(0);
    }

    static NullPolicy nullPolicy(NullPolicy policy, String kind, String column) {
        if (policy == NullPolicy.AS_VALUE) {
            throw new ConfigurationException(kind + " rule on '" + column + "' does not support null policy "
                    + NullPolicy.AS_VALUE);
        }
        return policy != null ? policy : NullPolicy.FAIL;
    }
}
