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

import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static java.util.Objects.requireNonNull;

/**
 * An immutable collection of {@link Mapping}s, in discovery order.
 */
public final class Mappings implements Iterable<Mapping> {
    private final List<Mapping> mappings;

    private Mappings(List<Mapping> mappings) {
        this.mappings = List.copyOf(mappings);
    }

    public static Mappings of(List<Mapping> mappings) {
        requireNonNull(mappings, "Mappings cannot be null");
        return new Mappings(mappings);
    }

    public static Mappings empty() {
        return new Mappings(List.of());
    }

    public Mappings forListener(String listenerIdentifier) {
        return new Mappings(stream().filter(mapping -> mapping.listenerIdentifier().equals(listenerIdentifier)).collect(Collectors.toList()));
    }

    public Optional<Mapping> forListenerAndEventType(String listenerIdentifier, String eventType) {
        return stream().filter(mapping -> mapping.listenerIdentifier().equals(listenerIdentifier) && mapping.eventType().equals(eventType)).findFirst();
    }

    public boolean hasMappingForListener(String listenerIdentifier) {
        return stream().anyMatch(mapping -> mapping.listenerIdentifier().equals(listenerIdentifier));
    }

    /**
     * @return The event types of these mappings, in discovery order
     */
    public Set<String> eventTypes() {
        return stream().map(Mapping::eventType).collect(Collectors.toCollection(LinkedHashSet::new));
    }

    public Set<String> listenerIdentifiers() {
        return stream().map(Mapping::listenerIdentifier).collect(Collectors.toCollection(LinkedHashSet::new));
    }

    public List<Mapping> toList() {
        return mappings;
    }

    public Stream<Mapping> stream() {
        return mappings.stream();
    }

    public boolean isEmpty() {
        return mappings.isEmpty();
    }

    public int size() {
        return mappings.size();
    }

    @Override
    public Iterator<Mapping> iterator() {
        return mappings.iterator();
    }

    @Override
    public String toString() {
        return "Mappings" + mappings;
    }
}
