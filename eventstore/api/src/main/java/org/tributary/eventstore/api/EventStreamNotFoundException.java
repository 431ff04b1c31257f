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
 * Thrown when a filter that names a stream doesn't match any events.
 */
public class EventStreamNotFoundException extends RuntimeException {
    public final StreamFilter filter;

    public EventStreamNotFoundException(StreamFilter filter) {
        super("The event stream \"" + filter.getStreamName() + "\" does not appear to be valid, filter: " + filter);
        this.filter = filter;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EventStreamNotFoundException)) return false;
        EventStreamNotFoundException that = (EventStreamNotFoundException) o;
        return Objects.equals(filter, that.filter);
    }

    @Override
    public int hashCode() {
        return Objects.hash(filter);
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", EventStreamNotFoundException.class.getSimpleName() + "[", "]")
                .add("filter=" + filter)
                .toString();
    }
}
