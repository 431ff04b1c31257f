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

/**
 * The optimistic concurrency precondition of a commit, evaluated against the current version of the stream
 * (0 for a stream without events).
 */
public sealed interface ExpectedVersion {

    /**
     * @return {@code true} if a stream with the given version may be appended to
     */
    boolean isFulfilledBy(long currentVersion);

    /**
     * No check is made, the events are appended regardless of the version of the stream.
     */
    static ExpectedVersion any() {
        return new Any();
    }

    /**
     * The stream must not contain any events.
     */
    static ExpectedVersion noStream() {
        return new NoStream();
    }

    /**
     * The stream must be at exactly the given version.
     */
    static ExpectedVersion exactly(long version) {
        return new Exactly(version);
    }

    record Any() implements ExpectedVersion {
        @Override
        public boolean isFulfilledBy(long currentVersion) {
            return true;
        }

        @Override
        public String toString() {
            return "any";
        }
    }

    record NoStream() implements ExpectedVersion {
        @Override
        public boolean isFulfilledBy(long currentVersion) {
            return currentVersion == 0;
        }

        @Override
        public String toString() {
            return "no stream";
        }
    }

    record Exactly(long version) implements ExpectedVersion {
        public Exactly {
            if (version < 0) {
                throw new IllegalArgumentException("Expected version cannot be negative");
            }
        }

        @Override
        public boolean isFulfilledBy(long currentVersion) {
            return currentVersion == version;
        }

        @Override
        public String toString() {
            return String.valueOf(version);
        }
    }
}
