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

package org.tributary.eventstore.manager;

import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.Nullable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static java.util.Objects.requireNonNull;

/**
 * A named event store configuration entry.
 *
 * @param identifier      The identifier of the event store, e.g. {@code "default"}
 * @param storage         The name of the storage backend, resolved by an {@link EventStorageFactory}
 * @param storageOptions  Options handed to the storage backend
 * @param boundedContexts Bounded context patterns mapped to whether they're active. The {@code "*"} pattern marks the fallback store.
 * @param listeners       Listener identifier patterns (regular expressions) mapped to their preset
 */
@NullMarked
public record EventStoreRegistration(String identifier, @Nullable String storage, Map<String, Object> storageOptions,
                                     Map<String, Boolean> boundedContexts, Map<String, ListenerPreset> listeners) {

    public EventStoreRegistration {
        requireNonNull(identifier, "Identifier cannot be null");
        requireNonNull(storageOptions, "Storage options cannot be null");
        requireNonNull(boundedContexts, "Bounded contexts cannot be null");
        requireNonNull(listeners, "Listeners cannot be null");
        storageOptions = Collections.unmodifiableMap(new LinkedHashMap<>(storageOptions));
        boundedContexts = Collections.unmodifiableMap(new LinkedHashMap<>(boundedContexts));
        listeners = Collections.unmodifiableMap(new LinkedHashMap<>(listeners));
    }

    /**
     * @return The active bounded context patterns in declaration order
     */
    public List<BoundedContextPattern> activeBoundedContextPatterns() {
        return boundedContexts.entrySet().stream()
                .filter(Map.Entry::getValue)
                .map(entry -> new BoundedContextPattern(entry.getKey()))
                .collect(Collectors.toList());
    }

    public boolean isFallback() {
        return activeBoundedContextPatterns().stream().anyMatch(BoundedContextPattern::isWildcard);
    }

    /**
     * @return The enabled listener presets in declaration order
     */
    public Map<String, ListenerPreset> activeListenerPresets() {
        return listeners.entrySet().stream()
                .filter(entry -> entry.getValue().enabled())
                .collect(Collectors.toMap(Map.Entry::getKey, Map.Entry::getValue, (a, b) -> a, LinkedHashMap::new));
    }

    public static Builder builder(String identifier) {
        return new Builder(identifier);
    }

    public static class Builder {
        private final String identifier;
        private @Nullable String storage;
        private final Map<String, Object> storageOptions = new LinkedHashMap<>();
        private final Map<String, Boolean> boundedContexts = new LinkedHashMap<>();
        private final Map<String, ListenerPreset> listeners = new LinkedHashMap<>();

        private Builder(String identifier) {
            requireNonNull(identifier, "Identifier cannot be null");
            this.identifier = identifier;
        }

        public Builder storage(String storage) {
            this.storage = storage;
            return this;
        }

        public Builder storageOption(String name, Object value) {
            storageOptions.put(name, value);
            return this;
        }

        public Builder fallback() {
            return boundedContext(BoundedContextPattern.WILDCARD);
        }

        public Builder boundedContext(String pattern) {
            boundedContexts.put(pattern, true);
            return this;
        }

        public Builder boundedContexts(String pattern, String... additionalPatterns) {
            boundedContext(pattern);
            for (String additionalPattern : additionalPatterns) {
                boundedContext(additionalPattern);
            }
            return this;
        }

        public Builder inactiveBoundedContext(String pattern) {
            boundedContexts.put(pattern, false);
            return this;
        }

        public Builder listeners(String pattern) {
            return listeners(pattern, ListenerPreset.active());
        }

        public Builder listeners(String pattern, ListenerPreset preset) {
            listeners.put(pattern, preset);
            return this;
        }

        public EventStoreRegistration build() {
            return new EventStoreRegistration(identifier, storage, storageOptions, boundedContexts, listeners);
        }
    }
}
