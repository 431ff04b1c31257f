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

package org.tributary.application.converter.jackson;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.tributary.application.converter.EventConverter;
import org.tributary.application.typemapper.EventTypeResolver;
import org.tributary.eventstore.api.RawEvent;
import org.tributary.eventstore.api.WritableEvent;

import java.util.Map;
import java.util.UUID;
import java.util.function.Function;

import static java.util.Objects.requireNonNull;

/**
 * An {@link EventConverter} that uses a Jackson {@link ObjectMapper} to convert a domain event to the payload of a
 * {@link WritableEvent}, and the payload of a {@link RawEvent} back to a domain event. The event type is resolved by an
 * {@link EventTypeResolver}.
 *
 * @param <T> The type of your domain event(s) to convert
 */
public class JacksonEventConverter<T> implements EventConverter<T> {
    private static final TypeReference<Map<String, Object>> PAYLOAD_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;
    private final EventTypeResolver eventTypeResolver;
    private final Function<T, String> idMapper;

    /**
     * Create a new instance of the {@link JacksonEventConverter} that uses a random UUID as event identifier.
     *
     * @param objectMapper      The ObjectMapper instance to use
     * @param eventTypeResolver Resolves the event type of a domain event class and vice versa
     */
    public JacksonEventConverter(ObjectMapper objectMapper, EventTypeResolver eventTypeResolver) {
        this(objectMapper, eventTypeResolver, __ -> UUID.randomUUID().toString());
    }

    /**
     * @param idMapper Get the event identifier from the domain event
     */
    public JacksonEventConverter(ObjectMapper objectMapper, EventTypeResolver eventTypeResolver, Function<T, String> idMapper) {
        requireNonNull(objectMapper, ObjectMapper.class.getSimpleName() + " cannot be null");
        requireNonNull(eventTypeResolver, EventTypeResolver.class.getSimpleName() + " cannot be null");
        requireNonNull(idMapper, "idMapper cannot be null");
        this.objectMapper = objectMapper;
        this.eventTypeResolver = eventTypeResolver;
        this.idMapper = idMapper;
    }

    @Override
    public WritableEvent toWritableEvent(T domainEvent, Map<String, Object> metadata) {
        requireNonNull(domainEvent, "Domain event cannot be null");
        requireNonNull(metadata, "Metadata cannot be null");
        Map<String, Object> payload = objectMapper.convertValue(domainEvent, PAYLOAD_TYPE);
        return new WritableEvent(idMapper.apply(domainEvent), eventTypeResolver.getEventType(domainEvent.getClass()), payload, metadata);
    }

    @SuppressWarnings("unchecked")
    @Override
    public T toDomainEvent(RawEvent rawEvent) {
        requireNonNull(rawEvent, RawEvent.class.getSimpleName() + " cannot be null");
        Class<T> domainEventType = (Class<T>) eventTypeResolver.getEventClass(rawEvent.type());
        return objectMapper.convertValue(rawEvent.payload(), domainEventType);
    }
}
