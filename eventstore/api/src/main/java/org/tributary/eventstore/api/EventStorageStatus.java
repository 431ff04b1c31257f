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

import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * The health of an {@link EventStorage} as reported by {@link EventStorage#getStatus()} and {@link EventStorage#setup()}.
 */
public record EventStorageStatus(Severity severity, List<String> messages) {

    public enum Severity {
        OK, WARNING, ERROR
    }

    public EventStorageStatus {
        requireNonNull(severity, Severity.class.getSimpleName() + " cannot be null");
        requireNonNull(messages, "Messages cannot be null");
        messages = List.copyOf(messages);
    }

    public static EventStorageStatus ok(String... messages) {
        return new EventStorageStatus(Severity.OK, List.of(messages));
    }

    public static EventStorageStatus warning(String... messages) {
        return new EventStorageStatus(Severity.WARNING, List.of(messages));
    }

    public static EventStorageStatus error(String... messages) {
        return new EventStorageStatus(Severity.ERROR, List.of(messages));
    }

    public boolean isOk() {
        return severity == Severity.OK;
    }
}
