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

import org.jspecify.annotations.NullMarked;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import static java.util.Objects.requireNonNull;

/**
 * Resolves the event type string of a domain event class and vice versa. By default the bounded context of an event
 * class is its package name and its short name is its simple class name.
 * <p>
 * The mapping is built once, with {@link #builder()}, and is immutable afterwards.
 * </p>
 */
@NullMarked
public class EventTypeResolver {
    private final Map<Class<?>, EventTypeIdentifier> typeByClass;
    private final Map<String, Class<?>> classByType;

    private EventTypeResolver(Map<Class<?>, EventTypeIdentifier> typeByClass, Map<String, Class<?>> classByType) {
        this.typeByClass = Collections.unmodifiableMap(typeByClass);
        this.classByType = Collections.unmodifiableMap(classByType);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return The event type, e.g. {@code "Acme.Shop:OrderPlaced"}
     * @throws UnknownEventTypeException If the class is not registered
     */
    public String getEventType(Class<?> eventClass) {
        return getEventTypeIdentifier(eventClass).value();
    }

    public EventTypeIdentifier getEventTypeIdentifier(Class<?> eventClass) {
        requireNonNull(eventClass, "Event class cannot be null");
        EventTypeIdentifier identifier = typeByClass.get(eventClass);
        if (identifier == null) {
            throw new UnknownEventTypeException("The event class " + eventClass.getName() + " is not registered");
        }
        return identifier;
    }

    /**
     * @return The event class of the event type
     * @throws UnknownEventTypeException If no class is registered for the event type
     */
    public Class<?> getEventClass(String eventType) {
        requireNonNull(eventType, "Event type cannot be null");
        Class<?> eventClass = classByType.get(eventType);
        if (eventClass == null) {
            throw new UnknownEventTypeException("The event type \"" + eventType + "\" is not registered");
        }
        return eventClass;
    }

    public boolean isRegistered(Class<?> eventClass) {
        return typeByClass.containsKey(eventClass);
    }

    public Set<Class<?>> eventClasses() {
        return typeByClass.keySet();
    }

    public static class Builder {
        private final Map<Class<?>, EventTypeIdentifier> typeByClass = new LinkedHashMap<>();

        private Builder() {
        }

        /**
         * Register an event class using its package name as bounded context and its simple name as short name.
         */
        public Builder register(Class<?> eventClass) {
            requireNonNull(eventClass, "Event class cannot be null");
            return register(eventClass, eventClass.getPackageName(), eventClass.getSimpleName());
        }

        public Builder register(Class<?> eventClass, String boundedContext, String shortName) {
            requireNonNull(eventClass, "Event class cannot be null");
            EventTypeIdentifier identifier = new EventTypeIdentifier(boundedContext, shortName);
            EventTypeIdentifier existing = typeByClass.putIfAbsent(eventClass, identifier);
            if (existing != null && !existing.equals(identifier)) {
                throw new DuplicateEventTypeException("The event class " + eventClass.getName() + " is registered both as " + existing + " and as " + identifier);
            }
            return this;
        }

        public Builder registerAll(Class<?>... eventClasses) {
            for (Class<?> eventClass : eventClasses) {
                register(eventClass);
            }
            return this;
        }

        /**
         * @throws DuplicateEventTypeException If two event classes resolve to the same event type
         */
        public EventTypeResolver build() {
            Map<String, Class<?>> classByType = new LinkedHashMap<>();
            typeByClass.forEach((eventClass, identifier) -> {
                Class<?> existing = classByType.putIfAbsent(identifier.value(), eventClass);
                if (existing != null) {
                    throw new DuplicateEventTypeException("The event type \"" + identifier + "\" is used by both " + existing.getName() + " and " + eventClass.getName());
                }
            });
            return new EventTypeResolver(new LinkedHashMap<>(typeByClass), classByType);
        }
    }
}
