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

package org.tributary.application.converter;

import org.tributary.eventstore.api.RawEvent;
import org.tributary.eventstore.api.WritableEvent;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * An event converter interface that is used to convert domain events to events that can be committed to an event
 * store, and stored events back to domain events.
 *
 * @param <T> The type of your domain event
 */
public interface EventConverter<T> {

    /**
     * Convert a domain event into a {@link WritableEvent}
     *
     * @param domainEvent The domain event to convert
     * @param metadata    Metadata such as correlation id to store with the event
     * @return The {@link WritableEvent} instance, converted from the domain event.
     */
    WritableEvent toWritableEvent(T domainEvent, Map<String, Object> metadata);

    default WritableEvent toWritableEvent(T domainEvent) {
        return toWritableEvent(domainEvent, Collections.emptyMap());
    }

    /**
     * Convert a stream of domain events into writable events. All events get the same metadata,
     * which is how a correlation id is shared by the events of one commit.
     */
    default List<WritableEvent> toWritableEvents(Stream<T> events, Map<String, Object> metadata) {
        Stream<T> stream = events == null ? Stream.empty() : events;
        return stream.map(event -> toWritableEvent(event, metadata)).collect(Collectors.toList());
    }

    /**
     * Convert a stored event to a domain event
     *
     * @param rawEvent The event to convert
     * @return The domain event instance, converted from the stored event.
     */
    T toDomainEvent(RawEvent rawEvent);
}
