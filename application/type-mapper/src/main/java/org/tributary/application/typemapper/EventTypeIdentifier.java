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

package org.tributary.application.typemapper;

import static java.util.Objects.requireNonNull;

/**
 * The canonical type of an event, {@code "<boundedContext>:<ShortName>"}. The bounded context is what the event
 * store manager uses to route events of this type.
 */
public record EventTypeIdentifier(String boundedContext, String shortName) {

    public EventTypeIdentifier {
        requireNonNull(boundedContext, "Bounded context cannot be null");
        requireNonNull(shortName, "Short name cannot be null");
        if (boundedContext.isBlank() || boundedContext.contains(":")) {
            throw new IllegalArgumentException("Bounded context must be non-blank and cannot contain ':' but was \"" + boundedContext + "\"");
        } else if (shortName.isBlank() || shortName.contains(":")) {
            throw new IllegalArgumentException("Short name must be non-blank and cannot contain ':' but was \"" + shortName + "\"");
        }
    }

    public static EventTypeIdentifier parse(String eventType) {
        requireNonNull(eventType, "Event type cannot be null");
        int index = eventType.indexOf(':');
        if (index < 0) {
            throw new IllegalArgumentException("Event type \"" + eventType + "\" is not of the form <boundedContext>:<ShortName>");
        }
        return new EventTypeIdentifier(eventType.substring(0, index), eventType.substring(index + 1));
    }

    /**
     * @return The event type as stored, e.g. {@code "Acme.Shop:OrderPlaced"}
     */
    public String value() {
        return boundedContext + ":" + shortName;
    }

    @Override
    public String toString() {
        return value();
    }
}
