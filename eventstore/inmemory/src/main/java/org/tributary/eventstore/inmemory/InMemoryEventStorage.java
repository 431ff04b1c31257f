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

package org.tributary.eventstore.inmemory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.cloudevents.CloudEvent;
import io.cloudevents.core.builder.CloudEventBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tributary.cloudevents.TributaryCloudEventExtension;
import org.tributary.cloudevents.TributaryExtensionGetter;
import org.tributary.eventstore.api.BatchedEventStream;
import org.tributary.eventstore.api.ConcurrencyConflictException;
import org.tributary.eventstore.api.DuplicateEventException;
import org.tributary.eventstore.api.EventStorage;
import org.tributary.eventstore.api.EventStorageStatus;
import org.tributary.eventstore.api.EventStream;
import org.tributary.eventstore.api.ExpectedVersion;
import org.tributary.eventstore.api.RawEvent;
import org.tributary.eventstore.api.StreamFilter;
import org.tributary.eventstore.api.WritableEvent;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Objects.requireNonNull;

/**
 * This is an {@link EventStorage} that stores events in-memory as {@link CloudEvent}s. This is mainly useful for testing
 * and/or demo purposes. Events are returned in batches (see {@link BatchedEventStream}) just like a database backed
 * storage would, the batch size is configurable with the {@value #BATCH_SIZE_OPTION} storage option.
 */
public class InMemoryEventStorage implements EventStorage {
    private static final Logger log = LoggerFactory.getLogger(InMemoryEventStorage.class);

    public static final String STORAGE_NAME = "inmemory";
    public static final String BATCH_SIZE_OPTION = "batchSize";
    static final String METADATA_EXTENSION = "metadata";
    private static final URI SOURCE = URI.create("urn:tributary:inmemory");
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    // All events of all streams, ordered by sequence number. Index i holds sequence number i + 1.
    private final List<CloudEvent> cloudEventLog = new ArrayList<>();
    private final Map<String, Long> streamVersions = new HashMap<>();
    private final Set<String> identifiers = new HashSet<>();

    private final ObjectMapper objectMapper;
    private final int batchSize;

    /**
     * Create an instance of {@link InMemoryEventStorage} with the default batch size
     */
    public InMemoryEventStorage() {
        this(new ObjectMapper(), BatchedEventStream.DEFAULT_BATCH_SIZE);
    }

    public InMemoryEventStorage(int batchSize) {
        this(new ObjectMapper(), batchSize);
    }

    /**
     * @param objectMapper The {@link ObjectMapper} used to serialize payload and metadata
     * @param batchSize    The number of events fetched per batch when an {@link EventStream} is iterated
     */
    public InMemoryEventStorage(ObjectMapper objectMapper, int batchSize) {
        requireNonNull(objectMapper, ObjectMapper.class.getSimpleName() + " cannot be null");
        if (batchSize < 1) {
            throw new IllegalArgumentException("Batch size must be greater than 0");
        }
        this.objectMapper = objectMapper;
        this.batchSize = batchSize;
    }

    /**
     * Create an {@link InMemoryEventStorage} from the storage options of an event store registration.
     * The only supported option is {@value #BATCH_SIZE_OPTION}.
     */
    public static InMemoryEventStorage fromOptions(Map<String, Object> storageOptions) {
        requireNonNull(storageOptions, "Storage options cannot be null");
        Object batchSize = storageOptions.getOrDefault(BATCH_SIZE_OPTION, BatchedEventStream.DEFAULT_BATCH_SIZE);
        if (!(batchSize instanceof Number)) {
            throw new IllegalArgumentException("Storage option " + BATCH_SIZE_OPTION + " must be a number but was " + batchSize);
        }
        return new InMemoryEventStorage(((Number) batchSize).intValue());
    }

    @Override
    public EventStream load(StreamFilter filter) {
        requireNonNull(filter, StreamFilter.class.getSimpleName() + " cannot be null");
        return new BatchedEventStream((offset, limit) -> loadBatch(filter, offset, limit), batchSize);
    }

    private List<RawEvent> loadBatch(StreamFilter filter, int offset, int limit) {
        final List<CloudEvent> batch;
        synchronized (cloudEventLog) {
            // Sequence numbers are 1-based, everything before the minimum can be skipped without inspection
            int start = (int) Math.min(Math.max(filter.getMinimumSequenceNumber() - 1, 0), cloudEventLog.size());
            batch = cloudEventLog.subList(start, cloudEventLog.size()).stream()
                    .filter(cloudEvent -> filter.matches(TributaryExtensionGetter.getStreamName(cloudEvent), cloudEvent.getType(), TributaryExtensionGetter.getSequenceNumber(cloudEvent)))
                    .skip(offset)
                    .limit(limit)
                    .collect(Collectors.toList());
        }
        return batch.stream().map(this::toRawEvent).collect(Collectors.toList());
    }

    @Override
    public List<RawEvent> commit(String streamName, List<WritableEvent> events, ExpectedVersion expectedVersion) {
        requireNonNull(streamName, "Stream name cannot be null");
        requireNonNull(events, "Events cannot be null");
        requireNonNull(expectedVersion, ExpectedVersion.class.getSimpleName() + " cannot be null");

        final List<CloudEvent> cloudEvents = new ArrayList<>(events.size());
        synchronized (cloudEventLog) {
            long currentVersion = streamVersions.getOrDefault(streamName, 0L);
            if (!expectedVersion.isFulfilledBy(currentVersion)) {
                throw new ConcurrencyConflictException(streamName, currentVersion, expectedVersion);
            }

            Set<String> newIdentifiers = new HashSet<>();
            for (WritableEvent event : events) {
                if (identifiers.contains(event.identifier()) || !newIdentifiers.add(event.identifier())) {
                    throw new DuplicateEventException(event.identifier(), streamName);
                }
            }

            OffsetDateTime recordedAt = OffsetDateTime.now(ZoneOffset.UTC).truncatedTo(ChronoUnit.MILLIS);
            long version = currentVersion;
            for (WritableEvent event : events) {
                version++;
                long sequenceNumber = cloudEventLog.size() + cloudEvents.size() + 1;
                cloudEvents.add(toCloudEvent(event, streamName, version, sequenceNumber, recordedAt));
            }

            cloudEventLog.addAll(cloudEvents);
            identifiers.addAll(newIdentifiers);
            if (!cloudEvents.isEmpty()) {
                streamVersions.put(streamName, version);
            }
        }

        log.debug("Committed {} event(s) to stream {}", cloudEvents.size(), streamName);
        return cloudEvents.stream().map(this::toRawEvent).collect(Collectors.toList());
    }

    @Override
    public EventStorageStatus getStatus() {
        synchronized (cloudEventLog) {
            return EventStorageStatus.ok("In-memory storage containing " + cloudEventLog.size() + " event(s) in " + streamVersions.size() + " stream(s)");
        }
    }

    @Override
    public EventStorageStatus setup() {
        return EventStorageStatus.ok("In-memory storage doesn't need any setup");
    }

    /**
     * @return A snapshot of the stored {@link CloudEvent}s in sequence number order
     */
    public List<CloudEvent> cloudEvents() {
        synchronized (cloudEventLog) {
            return Collections.unmodifiableList(new ArrayList<>(cloudEventLog));
        }
    }

    private CloudEvent toCloudEvent(WritableEvent event, String streamName, long version, long sequenceNumber, OffsetDateTime recordedAt) {
        return CloudEventBuilder.v1()
                .withId(event.identifier())
                .withSource(SOURCE)
                .withType(event.type())
                .withSubject(streamName)
                .withTime(recordedAt)
                .withDataContentType("application/json")
                .withData(serialize(event.payload()))
                .withExtension(METADATA_EXTENSION, new String(serialize(event.metadata()), UTF_8))
                .withExtension(new TributaryCloudEventExtension(streamName, version, sequenceNumber))
                .build();
    }

    private RawEvent toRawEvent(CloudEvent cloudEvent) {
        Map<String, Object> payload = cloudEvent.getData() == null ? Collections.emptyMap() : deserialize(cloudEvent.getData().toBytes());
        Object metadata = cloudEvent.getExtension(METADATA_EXTENSION);
        return new RawEvent(
                TributaryExtensionGetter.getSequenceNumber(cloudEvent),
                cloudEvent.getType(),
                payload,
                metadata == null ? Collections.emptyMap() : deserialize(((String) metadata).getBytes(UTF_8)),
                TributaryExtensionGetter.getStreamName(cloudEvent),
                TributaryExtensionGetter.getStreamVersion(cloudEvent),
                cloudEvent.getId(),
                Objects.requireNonNull(cloudEvent.getTime()));
    }

    private byte[] serialize(Map<String, Object> map) {
        try {
            return objectMapper.writeValueAsBytes(map);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize event data to JSON", e);
        }
    }

    private Map<String, Object> deserialize(byte[] bytes) {
        try {
            return objectMapper.readValue(bytes, MAP_TYPE);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    @Override
    public String toString() {
        return InMemoryEventStorage.class.getSimpleName() + "[batchSize=" + batchSize + "]";
    }
}
