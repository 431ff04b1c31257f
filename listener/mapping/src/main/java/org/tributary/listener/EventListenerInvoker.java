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

package org.tributary.listener;

import org.tributary.application.converter.EventConverter;
import org.tributary.eventstore.api.RawEvent;

import static java.util.Objects.requireNonNull;

/**
 * Converts a {@link RawEvent} to its domain event and calls the handler method a {@link Mapping} binds it to.
 */
public class EventListenerInvoker {
    private final EventConverter<?> eventConverter;

    public EventListenerInvoker(EventConverter<?> eventConverter) {
        requireNonNull(eventConverter, EventConverter.class.getSimpleName() + " cannot be null");
        this.eventConverter = eventConverter;
    }

    /**
     * Invoke the handler of {@code mapping} on {@code listener}. Exceptions thrown by the handler are propagated.
     */
    public void invoke(Object listener, Mapping mapping, RawEvent rawEvent) {
        requireNonNull(listener, "Listener cannot be null");
        requireNonNull(mapping, Mapping.class.getSimpleName() + " cannot be null");
        requireNonNull(rawEvent, RawEvent.class.getSimpleName() + " cannot be null");
        if (!mapping.eventType().equals(rawEvent.type())) {
            throw new IllegalArgumentException(String.format("Event of type %s cannot be handled by %s::%s which handles %s", rawEvent.type(), mapping.listenerIdentifier(), mapping.handlerName(), mapping.eventType()));
        } else if (!mapping.listenerClass().isInstance(listener)) {
            throw new IllegalArgumentException(String.format("%s is not an instance of %s", listener.getClass().getName(), mapping.listenerClass().getName()));
        }

        Object domainEvent = eventConverter.toDomainEvent(rawEvent);
        if (!mapping.eventClass().isInstance(domainEvent)) {
            throw new IllegalStateException(String.format("Event %s was converted to %s but %s::%s expects %s", rawEvent.identifier(), domainEvent.getClass().getName(), mapping.listenerIdentifier(), mapping.handlerName(), mapping.eventClass().getName()));
        }
        mapping.method().invocation().invoke(listener, domainEvent, rawEvent);
    }
}
