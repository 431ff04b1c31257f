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

import java.time.OffsetDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * An event as it was persisted by an {@link EventStorage}. A {@code RawEvent} is created exactly once, when it's committed,
 * and is never changed afterwards.
 *
 * @param sequenceNumber The store-global position of the event. Strictly increasing across all streams of a store, starting at 1.
 * @param type           The event type, for example {@code "Acme.Shop:OrderPlaced"}
 * @param payload        The event data, opaque to the event store
 * @param metadata       Metadata such as correlation and causation ids
 * @param streamName     The name of the stream the event belongs to
 * @param version        The version of the event in its stream, starting at 1 with no gaps
 * @param identifier     A globally unique id of the event
 * @param recordedAt     The time the event was committed
 */
@NullMarked
public record RawEvent(long sequenceNumber, String type, Map<String, Object> payload, Map<String, Object> metadata,
                       String streamName, long version, String identifier, OffsetDateTime recordedAt) {

    public RawEvent {
        if (sequenceNumber < 1) {
            throw new IllegalArgumentException("Sequence number cannot be less than 1");
        } else if (version < 1) {
            throw new IllegalArgumentException("Version cannot be less than 1");
        }
        requireNonNull(type, "Type cannot be null");
        requireNonNull(payload, "Payload cannot be null");
        requireNonNull(metadata, "Metadata cannot be null");
        requireNonNull(streamName, "Stream name cannot be null");
        requireNonNull(identifier, "Identifier cannot be null");
        requireNonNull(recordedAt, "Recorded at cannot be null");
        // Map.copyOf rejects null values which are valid in JSON payloads
        payload = Collections.unmodifiableMap(new LinkedHashMap<>(payload));
        metadata = Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }
}
