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

import org.tributary.eventstore.api.RawEvent;

import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * A handler method of an event listener, as discovered by reflection or registered explicitly.
 *
 * @param name           The name of the method, e.g. {@code whenOrderPlaced}
 * @param parameterTypes The parameter types of the method. The first one is the event class, the optional second one must be {@link RawEvent}.
 * @param invocation     Calls the method on a listener instance
 */
public record ListenerMethod(String name, List<Class<?>> parameterTypes, Invocation invocation) {

    public ListenerMethod {
        requireNonNull(name, "Name cannot be null");
        requireNonNull(parameterTypes, "Parameter types cannot be null");
        requireNonNull(invocation, Invocation.class.getSimpleName() + " cannot be null");
        parameterTypes = List.copyOf(parameterTypes);
    }

    public boolean acceptsRawEvent() {
        return parameterTypes.size() > 1;
    }

    @FunctionalInterface
    public interface Invocation {
        void invoke(Object listener, Object event, RawEvent rawEvent);
    }
}
