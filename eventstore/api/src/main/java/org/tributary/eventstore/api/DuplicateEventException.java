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

import java.util.Objects;
import java.util.StringJoiner;

/**
 * An exception thrown if an event with the same identifier already exists in the event store.
 */
public class DuplicateEventException extends RuntimeException {
    private final String identifier;
    private final String streamName;

    public DuplicateEventException(String identifier, String streamName) {
        super("Duplicate event detected with identifier " + identifier + " when committing to stream \"" + streamName + "\"");
        this.identifier = identifier;
        this.streamName = streamName;
    }

    public String getIdentifier() {
        return identifier;
    }

    public String getStreamName() {
        return streamName;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DuplicateEventException)) return false;
        DuplicateEventException that = (DuplicateEventException) o;
        return Objects.equals(identifier, that.identifier) && Objects.equals(streamName, that.streamName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(identifier, streamName);
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", DuplicateEventException.class.getSimpleName() + "[", "]")
                .add("identifier='" + identifier + "'")
                .add("streamName='" + streamName + "'")
                .toString();
    }
}
