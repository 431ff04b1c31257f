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
import org.jspecify.annotations.Nullable;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;
import java.util.StringJoiner;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static java.util.Objects.requireNonNull;

/**
 * An immutable query descriptor that selects events from an event store. A filter may constrain the stream name,
 * the event types and the minimum (inclusive) sequence number. Constraints that are not specified match everything.
 * <p>
 * The stream name and event types are also what an event store manager uses to pick the event store that owns the
 * events, which is why they're available before any I/O takes place.
 * </p>
 */
@NullMarked
public final class StreamFilter {

    private final @Nullable String streamName;
    private final Set<String> eventTypes;
    private final long minimumSequenceNumber;

    private StreamFilter(@Nullable String streamName, Set<String> eventTypes, long minimumSequenceNumber) {
        if (minimumSequenceNumber < 0) {
            throw new IllegalArgumentException("Minimum sequence number cannot be negative");
        }
        this.streamName = streamName;
        this.eventTypes = Collections.unmodifiableSet(new LinkedHashSet<>(eventTypes));
        this.minimumSequenceNumber = minimumSequenceNumber;
    }

    /**
     * @return A filter that matches all events
     */
    public static StreamFilter all() {
        return new StreamFilter(null, Collections.emptySet(), 0);
    }

    /**
     * @return A filter that matches all events of the stream with the given name
     */
    public static StreamFilter forStream(String streamName) {
        requireNonNull(streamName, "Stream name cannot be null");
        return new StreamFilter(streamName, Collections.emptySet(), 0);
    }

    /**
     * @return A filter that matches events of any of the given types, regardless of stream
     */
    public static StreamFilter forEventTypes(Collection<String> eventTypes) {
        requireNonNull(eventTypes, "Event types cannot be null");
        return new StreamFilter(null, new LinkedHashSet<>(eventTypes), 0);
    }

    /**
     * @return A filter that matches events of any of the given types, regardless of stream
     */
    public static StreamFilter forEventTypes(String eventType, String... additionalEventTypes) {
        requireNonNull(eventType, "Event type cannot be null");
        return forEventTypes(Stream.concat(Stream.of(eventType), Arrays.stream(additionalEventTypes)).collect(Collectors.toList()));
    }

    /**
     * @return A copy of this filter that additionally only matches events of the given types
     */
    public StreamFilter withEventTypes(Collection<String> eventTypes) {
        requireNonNull(eventTypes, "Event types cannot be null");
        return new StreamFilter(streamName, new LinkedHashSet<>(eventTypes), minimumSequenceNumber);
    }

    /**
     * @return A copy of this filter that only matches events whose sequence number is greater than or equal to {@code minimumSequenceNumber}
     */
    public StreamFilter fromSequenceNumber(long minimumSequenceNumber) {
        return new StreamFilter(streamName, eventTypes, minimumSequenceNumber);
    }

    /**
     * @return A copy of this filter that only matches events recorded after the given sequence number
     */
    public StreamFilter afterSequenceNumber(long sequenceNumber) {
        return fromSequenceNumber(sequenceNumber + 1);
    }

    public boolean hasStreamName() {
        return streamName != null;
    }

    public @Nullable String getStreamName() {
        return streamName;
    }

    public Set<String> getEventTypes() {
        return eventTypes;
    }

    public long getMinimumSequenceNumber() {
        return minimumSequenceNumber;
    }

    /**
     * Check whether a {@link RawEvent} is selected by this filter. Storage backends that cannot express the filter
     * natively can use this method to filter in memory.
     */
    public boolean matches(RawEvent rawEvent) {
        requireNonNull(rawEvent, RawEvent.class.getSimpleName() + " cannot be null");
        return matches(rawEvent.streamName(), rawEvent.type(), rawEvent.sequenceNumber());
    }

    public boolean matches(String streamName, String type, long sequenceNumber) {
        if (this.streamName != null && !this.streamName.equals(streamName)) {
            return false;
        } else if (!eventTypes.isEmpty() && !eventTypes.contains(type)) {
            return false;
        }
        return sequenceNumber >= minimumSequenceNumber;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StreamFilter)) return false;
        StreamFilter that = (StreamFilter) o;
        return minimumSequenceNumber == that.minimumSequenceNumber && Objects.equals(streamName, that.streamName) && Objects.equals(eventTypes, that.eventTypes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(streamName, eventTypes, minimumSequenceNumber);
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", StreamFilter.class.getSimpleName() + "[", "]")
                .add("streamName='" + streamName + "'")
                .add("eventTypes=" + eventTypes)
                .add("minimumSequenceNumber=" + minimumSequenceNumber)
                .toString();
    }
}
