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

package org.tributary.eventstore.api;

import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Spliterator;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

import static java.util.Objects.requireNonNull;
import static java.util.Spliterators.spliteratorUnknownSize;

/**
 * A lazy, forward-only sequence of {@link RawEvent}s ordered by sequence number. Every call to {@link #iterator()}
 * re-issues the underlying query from the start.
 */
public interface EventStream extends Iterable<RawEvent> {

    /**
     * @return The events of this stream as a {@link Stream}. Events are fetched lazily while the stream is consumed.
     */
    default Stream<RawEvent> events() {
        return StreamSupport.stream(spliteratorUnknownSize(iterator(), Spliterator.ORDERED), false);
    }

    default boolean isEmpty() {
        return !iterator().hasNext();
    }

    /**
     * Materialize the event stream. Use with care for long streams.
     */
    default List<RawEvent> eventList() {
        return events().collect(Collectors.toList());
    }

    /**
     * @return An {@link EventStream} backed by an already materialized list of events
     */
    static EventStream of(List<RawEvent> events) {
        requireNonNull(events, "Events cannot be null");
        List<RawEvent> copy = List.copyOf(events);
        return copy::iterator;
    }

    static EventStream empty() {
        return of(Collections.emptyList());
    }

    @Override
    Iterator<RawEvent> iterator();
}
