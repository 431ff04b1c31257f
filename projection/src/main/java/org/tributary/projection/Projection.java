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

package org.tributary.projection;

import org.jspecify.annotations.NullMarked;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

import static java.util.Objects.requireNonNull;

/**
 * Read-only description of a projection.
 *
 * @param identifier           The projection identifier, {@code "<package>:<name>"} in lower case, see {@link #identifierFor(Class)}
 * @param projectorClass       The class of the projector that builds the read model
 * @param listenerIdentifier   The identifier of the listener the projector is registered as
 * @param eventTypes           The event types the projector handles
 * @param eventStoreIdentifier The identifier of the event store the projector is bound to
 */
@NullMarked
public record Projection(String identifier, Class<? extends Projector> projectorClass, String listenerIdentifier, Set<String> eventTypes,
                         String eventStoreIdentifier) {
    private static final String PROJECTOR_SUFFIX = "Projector";

    public Projection {
        requireNonNull(identifier, "Identifier cannot be null");
        requireNonNull(projectorClass, "Projector class cannot be null");
        requireNonNull(listenerIdentifier, "Listener identifier cannot be null");
        requireNonNull(eventTypes, "Event types cannot be null");
        requireNonNull(eventStoreIdentifier, "Event store identifier cannot be null");
        eventTypes = Collections.unmodifiableSet(new LinkedHashSet<>(eventTypes));
    }

    /**
     * Derive the projection identifier of a projector class. The identifier is the package name and the simple class name,
     * without a trailing {@code Projector}, separated by a colon and in lower case. {@code org.acme.shop.OrderListProjector}
     * becomes {@code org.acme.shop:orderlist}.
     */
    public static String identifierFor(Class<?> projectorClass) {
        requireNonNull(projectorClass, "Projector class cannot be null");
        String name = projectorClass.getSimpleName();
        if (name.endsWith(PROJECTOR_SUFFIX) && name.length() > PROJECTOR_SUFFIX.length()) {
            name = name.substring(0, name.length() - PROJECTOR_SUFFIX.length());
        }
        return (projectorClass.getPackageName() + ":" + name).toLowerCase(Locale.ROOT);
    }

    /**
     * @return The part of the identifier before the colon
     */
    public String packageName() {
        return identifier.substring(0, identifier.indexOf(':'));
    }

    /**
     * @return The part of the identifier after the colon
     */
    public String name() {
        return identifier.substring(identifier.indexOf(':') + 1);
    }
}
