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
 * The expected version of a commit was not fulfilled so no events have been written to the event store.
 * This is effectively an optimistic locking exception, reload the aggregate and retry.
 */
public class ConcurrencyConflictException extends RuntimeException {
    public final String streamName;
    public final long actualVersion;
    public final ExpectedVersion expectedVersion;

    public ConcurrencyConflictException(String streamName, long actualVersion, ExpectedVersion expectedVersion) {
        super(String.format("%s was not fulfilled for stream \"%s\". Expected version %s but was %s.", ExpectedVersion.class.getSimpleName(), streamName, expectedVersion, actualVersion));
        this.streamName = streamName;
        this.actualVersion = actualVersion;
        this.expectedVersion = expectedVersion;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ConcurrencyConflictException)) return false;
        ConcurrencyConflictException that = (ConcurrencyConflictException) o;
        return actualVersion == that.actualVersion && Objects.equals(streamName, that.streamName) && Objects.equals(expectedVersion, that.expectedVersion);
    }

    @Override
    public int hashCode() {
        return Objects.hash(streamName, actualVersion, expectedVersion);
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", ConcurrencyConflictException.class.getSimpleName() + "[", "]")
                .add("streamName='" + streamName + "'")
                .add("actualVersion=" + actualVersion)
                .add("expectedVersion=" + expectedVersion)
                .add("message=" + super.getMessage())
                .toString();
    }
}
