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

import java.util.LinkedHashMap;
import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * Provides the instance of a listener class. How listeners are constructed (dependency injection) is up to the application.
 */
@FunctionalInterface
public interface ListenerInstanceProvider {

    /**
     * @throws EventListenerNotFoundException If no instance of the listener class is available
     */
    <L> L getInstance(Class<L> listenerClass);

    /**
     * Create a {@link ListenerInstanceProvider} that returns the given, already created, listener instances.
     */
    static ListenerInstanceProvider of(Object... listeners) {
        Map<Class<?>, Object> instances = new LinkedHashMap<>();
        for (Object listener : listeners) {
            requireNonNull(listener, "Listener cannot be null");
            instances.put(listener.getClass(), listener);
        }
        return new ListenerInstanceProvider() {
            @Override
            public <L> L getInstance(Class<L> listenerClass) {
                Object instance = instances.get(listenerClass);
                if (instance == null) {
                    throw new EventListenerNotFoundException(listenerClass.getName(), "No instance of event listener " + listenerClass.getName() + " is available");
                }
                return listenerClass.cast(instance);
            }
        };
    }
}
