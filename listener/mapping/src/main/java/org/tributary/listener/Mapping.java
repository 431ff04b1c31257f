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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * Binds one event type to one handler method of a listener.
 *
 * @param eventType          The event type, e.g. {@code "Acme.Shop:OrderPlaced"}
 * @param eventClass         The domain event class of the event type
 * @param listenerIdentifier The identifier of the listener
 * @param listenerClass      The listener class
 * @param method             The handler method
 * @param options            The options of the listener preset that bound the listener
 */
public record Mapping(String eventType, Class<?> eventClass, String listenerIdentifier, Class<?> listenerClass,
                      ListenerMethod method, Map<String, Object> options) {

    public Mapping {
        requireNonNull(eventType, "Event type cannot be null");
        requireNonNull(eventClass, "Event class cannot be null");
        requireNonNull(listenerIdentifier, "Listener identifier cannot be null");
        requireNonNull(listenerClass, "Listener class cannot be null");
        requireNonNull(method, ListenerMethod.class.getSimpleName() + " cannot be null");
        requireNonNull(options, "Options cannot be null");
        options = Collections.unmodifiableMap(new LinkedHashMap<>(options));
    }

    public String handlerName() {
        return method.name();
    }
}
