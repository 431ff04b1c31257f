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

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * The event store registrations of an application, in declaration order.
 */
public record EventStoreConfiguration(List<EventStoreRegistration> registrations) {

    public EventStoreConfiguration {
        requireNonNull(registrations, "Registrations cannot be null");
        registrations = List.copyOf(registrations);
    }

    public static EventStoreConfiguration of(EventStoreRegistration... registrations) {
        return new EventStoreConfiguration(Arrays.asList(registrations));
    }

    public Optional<EventStoreRegistration> registration(String identifier) {
        return registrations.stream().filter(registration -> registration.identifier().equals(identifier)).findFirst();
    }

    public boolean isEmpty() {
        return registrations.isEmpty();
    }
}
