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

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * The built-in rule variants plus {@link #CUSTOM} for user-supplied predicates.
 */
public enum RuleKind {

    NOT_NULL(RuleScope.RECORD),
    UNIQUE(RuleScope.DATASET),
    RANGE(RuleScope.RECORD),
    REGEX(RuleScope.RECORD),
    REFERENTIAL_INTEGRITY(RuleScope.REFERENCE),
    CUSTOM(RuleScope.RECORD);

    private final RuleScope scope;

    RuleKind(RuleScope scope) {
        this.scope = scope;
    }

    public RuleScope getScope() {
        return scope;
    }

    /**
     * Resolves a kind from its configuration spelling. Matching ignores case and
     * treats {@code -} and {@code _} alike, so {@code not-null} and {@code NOT_NULL}
     * are equivalent. {@code pattern} is accepted as an alias of {@link #REGEX}.
     *
     * @param value the configured kind
     * @return the kind, or empty when unknown
     */
    public static Optional<RuleKind> fromString(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String normalized = value.trim().replace('-', '_').toUpperCase(Locale.ROOT);
        if ("PATTERN".equals(normalized)) {
            return Optional.of(REGEX);
        }
        return Arrays.stream(values())
                .filter(kind -> kind.name().equals(normalized))
                .findFirst();
    }
}
