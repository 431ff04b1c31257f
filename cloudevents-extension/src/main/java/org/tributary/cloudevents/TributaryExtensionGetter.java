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

import static org.tributary.cloudevents.TributaryCloudEventExtension.SEQUENCE_NUMBER;
import static org.tributary.cloudevents.TributaryCloudEventExtension.STREAM_NAME;
import static org.tributary.cloudevents.TributaryCloudEventExtension.STREAM_VERSION;

/**
 * Utility class that helps get tributary extension values, and converts them to the correct type, from a {@link CloudEvent}.
 */
public class TributaryExtensionGetter {

    /**
     * Get the stream version from a {@link CloudEvent} that has {@link TributaryCloudEventExtension} applied.
     *
     * @param cloudEvent The cloud event
     * @return the stream version
     */
    public static long getStreamVersion(CloudEvent cloudEvent) {
        return getLong(cloudEvent, STREAM_VERSION);
    }

    /**
     * Get the sequence number from a {@link CloudEvent} that has {@link TributaryCloudEventExtension} applied.
     *
     * @param cloudEvent The cloud event
     * @return the store-global sequence number
     */
    public static long getSequenceNumber(CloudEvent cloudEvent) {
        return getLong(cloudEvent, SEQUENCE_NUMBER);
    }

    /**
     * Get the stream name from a {@link CloudEvent} that has {@link TributaryCloudEventExtension} applied.
     *
     * @param cloudEvent The cloud event
     * @return the stream name
     */
    public static String getStreamName(CloudEvent cloudEvent) {
        if (!cloudEvent.getExtensionNames().contains(STREAM_NAME)) {
            throw new IllegalArgumentException(CloudEvent.class.getSimpleName() + " does not contain the " + STREAM_NAME + " key");
        }

        Object streamName = cloudEvent.getExtension(STREAM_NAME);
        if (!(streamName instanceof String)) {
            throw new IllegalArgumentException(CloudEvent.class.getSimpleName() + " does not contain a " + STREAM_NAME + " value that is an instance of " + String.class.getSimpleName());
        }
        return (String) streamName;
    }

    private static long getLong(CloudEvent cloudEvent, String key) {
        if (!cloudEvent.getExtensionNames().contains(key)) {
            throw new IllegalArgumentException(CloudEvent.class.getSimpleName() + " does not contain the " + key + " key");
        }

        Object value = cloudEvent.getExtension(key);
        if (!(value instanceof Long)) {
            throw new IllegalArgumentException(CloudEvent.class.getSimpleName() + " does not contain a " + key + " value that is an instance of " + long.class.getSimpleName());
        }
        return (long) value;
    }
}
