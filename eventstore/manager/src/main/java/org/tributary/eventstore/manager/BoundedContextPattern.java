/*
 * Copyright 2020 Johan Haleby
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *        http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.tributary.eventstore.manager;

import static java.util.Objects.requireNonNull;

/**
 * A bounded context pattern of an event store registration. A pattern matches a bounded context if they're equal, or if
 * the bounded context is a hierarchical descendant of the pattern, i.e. {@code "Bounded.Context2"} matches
 * {@code "Bounded.Context2"} and {@code "Bounded.Context2.Sub"} but not {@code "Bounded.Context23"}.
 * The {@value #WILDCARD} pattern marks the fallback registration and is never matched directly.
 */
public record BoundedContextPattern(String pattern) {
    public static final String WILDCARD = "*";

    public BoundedContextPattern {
        requireNonNull(pattern, "Pattern cannot be null");
        if (pattern.isBlank()) {
            throw new IllegalArgumentException("Bounded context pattern cannot be blank");
        }
    }

    public boolean isWildcard() {
        return WILDCARD.equals(pattern);
    }

    public boolean matches(String boundedContext) {
        requireNonNull(boundedContext, "Bounded context cannot be null");
        if (isWildcard()) {
            return false;
        }
        return boundedContext.equals(pattern) || boundedContext.startsWith(pattern + ".");
    }

    /**
     * Longer patterns are more specific, the most specific matching pattern wins.
     */
    public int specificity() {
        return isWildcard() ? 0 : pattern.length();
    }

    @Override
    public String toString() {
        return pattern;
    }
}
