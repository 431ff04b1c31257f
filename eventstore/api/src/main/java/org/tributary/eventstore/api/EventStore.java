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

import org.jspecify.annotations.NullMarked;

import java.util.List;
import java.util.StringJoiner;

import static java.util.Objects.requireNonNull;

/**
 * Binds an {@link EventStorage} to the get/getOne/commit contract. An {@code EventStore} has an identifier, the name
 * of the registration that configured it, which is how it's referred to by the event store manager and the listener
 * mappings.
 */
@NullMarked
public final class EventStore {
    private final String identifier;
    private final EventStorage storage;

    public EventStore(String identifier, EventStorage storage) {
        requireNonNull(identifier, "Identifier cannot be null");
        requireNonNull(storage, EventStorage.class.getSimpleName() + " cannot be null");
        this.identifier = identifier;
        this.storage = storage;
    }

    public String identifier() {
        return identifier;
    }

    /**
     * Load the events matching the filter.
     *
     * @throws EventStreamNotFoundException If the filter names a stream and no events match it
     */
    public EventStream get(StreamFilter filter) {
        requireNonNull(filter, StreamFilter.class.getSimpleName() + " cannot be null");
        EventStream eventStream = storage.load(filter);
        if (filter.hasStreamName() && eventStream.isEmpty()) {
            throw new EventStreamNotFoundException(filter);
        }
        return eventStream;
    }

    /**
     * @return The first event matching the filter
     * @throws EventNotFoundException If no event matches the filter
     */
    public RawEvent getOne(StreamFilter filter) {
        requireNonNull(filter, StreamFilter.class.getSimpleName() + " cannot be null");
        return storage.loadOne(filter).orElseThrow(() -> new EventNotFoundException(filter));
    }

    /**
     * Append events to a stream without checking its version.
     */
    public List<RawEvent> commit(String streamName, List<WritableEvent> events) {
        return commit(streamName, events, ExpectedVersion.any());
    }

    /**
     * Append events to a stream if {@code expectedVersion} is fulfilled.
     *
     * @return The committed events with their sequence numbers and versions assigned, in commit order
     * @throws ConcurrencyConflictException If the stream isn't at the expected version
     */
    public List<RawEvent> commit(String streamName, List<WritableEvent> events, ExpectedVersion expectedVersion) {
        requireNonNull(streamName, "Stream name cannot be null");
        requireNonNull(events, "Events cannot be null");
        requireNonNull(expectedVersion, ExpectedVersion.class.getSimpleName() + " cannot be null");
        if (streamName.isBlank()) {
            throw new IllegalArgumentException("Stream name cannot be blank");
        }
        return storage.commit(streamName, events, expectedVersion);
    }

    public EventStorageStatus getStatus() {
        return storage.getStatus();
    }

    public EventStorageStatus setup() {
        return storage.setup();
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", EventStore.class.getSimpleName() + "[", "]")
                .add("identifier='" + identifier + "'")
                .add("storage=" + storage.getClass().getSimpleName())
                .toString();
    }
}
