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
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

import static java.util.Objects.requireNonNull;

/**
 * An event that is about to be committed. The {@link EventStorage} turns it into a {@link RawEvent} by assigning
 * the sequence number, stream version and recording time.
 */
public record WritableEvent(String identifier, String type, Map<String, Object> payload, Map<String, Object> metadata) {

    public WritableEvent {
        requireNonNull(identifier, "Identifier cannot be null");
        requireNonNull(type, "Type cannot be null");
        requireNonNull(payload, "Payload cannot be null");
        requireNonNull(metadata, "Metadata cannot be null");
        if (type.isBlank()) {
            throw new IllegalArgumentException("Type cannot be blank");
        }
        payload = Collections.unmodifiableMap(new LinkedHashMap<>(payload));
        metadata = Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    /**
     * Create a {@link WritableEvent} with a random UUID as identifier and no metadata.
     */
    public static WritableEvent of(String type, Map<String, Object> payload) {
        return of(type, payload, Collections.emptyMap());
    }

    /**
     * Create a {@link WritableEvent} with a random UUID as identifier.
     */
    public static WritableEvent of(String type, Map<String, Object> payload, Map<String, Object> metadata) {
        return new WritableEvent(UUID.randomUUID().toString(), type, payload, metadata);
    }
}
