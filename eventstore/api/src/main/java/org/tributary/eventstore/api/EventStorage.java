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

import java.util.List;
import java.util.Optional;

/**
 * A durable, append-only storage backend for one logical partition of events. Implementations are handed to an
 * {@link EventStore} which adds the lookup semantics on top of them.
 */
public interface EventStorage {

    /**
     * Load the events matching the filter in increasing sequence number order. Implementations should fetch lazily,
     * in bounded batches, for example by returning a {@link BatchedEventStream}.
     */
    EventStream load(StreamFilter filter);

    /**
     * @return The first event matching the filter
     */
    default Optional<RawEvent> loadOne(StreamFilter filter) {
        return load(filter).events().findFirst();
    }

    /**
     * Append the events to the stream atomically.
     *
     * @return The committed events, in commit order, with their sequence numbers and versions assigned
     * @throws ConcurrencyConflictException If {@code expectedVersion} is not fulfilled by the current version of the stream. Nothing is written.
     * @throws DuplicateEventException      If an event with the same identifier is already stored. Nothing is written.
     */
    List<RawEvent> commit(String streamName, List<WritableEvent> events, ExpectedVersion expectedVersion);

    EventStorageStatus getStatus();

    /**
     * Create whatever the storage needs (tables, indexes, ...). Must be safe to call more than once.
     */
    EventStorageStatus setup();
}
