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

package org.tributary.cloudevents;

import io.cloudevents.CloudEvent;
import io.cloudevents.CloudEventExtension;
import io.cloudevents.CloudEventExtensions;

import java.util.Objects;
import java.util.Set;

/**
 * A {@link CloudEvent} {@link CloudEventExtension} that adds the positional extensions a storage backend assigns when an event is committed:<br><br>
 *
 * <table>
 *     <tr><th>Key</th><th>Description</th></tr>
 *     <tr><td>{@value #STREAM_NAME}</td><td>The name of the stream the event was committed to</td></tr>
 *     <tr><td>{@value #STREAM_VERSION}</td><td>The version of the event in its stream (starting at 1)</td></tr>
 *     <tr><td>{@value #SEQUENCE_NUMBER}</td><td>The store-global position of the event (starting at 1)</td></tr>
 * </table>
 */
public class TributaryCloudEventExtension implements CloudEventExtension {
    public static final String STREAM_NAME = "streamname";
    public static final String STREAM_VERSION = "streamversion";
    public static final String SEQUENCE_NUMBER = "sequencenumber";

    static final Set<String> KEYS = Set.of(STREAM_NAME, STREAM_VERSION, SEQUENCE_NUMBER);

    private String streamName;
    private long streamVersion;
    private long sequenceNumber;

    public TributaryCloudEventExtension(String streamName, long streamVersion, long sequenceNumber) {
        Objects.requireNonNull(streamName, "Stream name cannot be null");
        if (streamVersion < 1) {
            throw new IllegalArgumentException("Stream version cannot be less than 1");
        } else if (sequenceNumber < 1) {
            throw new IllegalArgumentException("Sequence number cannot be less than 1");
        }
        this.streamName = streamName;
        this.streamVersion = streamVersion;
        this.sequenceNumber = sequenceNumber;
    }

    public static TributaryCloudEventExtension tributary(String streamName, long streamVersion, long sequenceNumber) {
        return new TributaryCloudEventExtension(streamName, streamVersion, sequenceNumber);
    }

    @Override
    public void readFrom(CloudEventExtensions extensions) {
        Object streamName = extensions.getExtension(STREAM_NAME);
        if (streamName != null) {
            this.streamName = streamName.toString();
        }

        Object streamVersion = extensions.getExtension(STREAM_VERSION);
        if (streamVersion != null) {
            this.streamVersion = ((Number) streamVersion).longValue();
        }

        Object sequenceNumber = extensions.getExtension(SEQUENCE_NUMBER);
        if (sequenceNumber != null) {
            this.sequenceNumber = ((Number) sequenceNumber).longValue();
        }
    }

    @Override
    public Object getValue(String key) throws IllegalArgumentException {
        if (STREAM_NAME.equals(key)) {
            return this.streamName;
        } else if (STREAM_VERSION.equals(key)) {
            return this.streamVersion;
        } else if (SEQUENCE_NUMBER.equals(key)) {
            return this.sequenceNumber;
        }
        throw new IllegalArgumentException(this.getClass().getSimpleName() + " doesn't expect the attribute key \"" + key + "\"");
    }

    @Override
    public Set<String> getKeys() {
        return KEYS;
    }
}
