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

import org.jspecify.annotations.Nullable;
import org.tributary.eventstore.api.EventStorage;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Function;

import static java.util.Objects.requireNonNull;

/**
 * Creates the {@link EventStorage} of an event store registration. Object construction (dependency injection) is up to
 * the application, the {@link EventStoreManager} only asks for a storage the first time an event store is used.
 */
@FunctionalInterface
public interface EventStorageFactory {

    /**
     * @param storage        The storage name of the registration
     * @param storageOptions The storage options of the registration
     * @return The {@link EventStorage}, or {@code null} if this factory doesn't know the storage
     */
    @Nullable
    EventStorage create(String storage, Map<String, Object> storageOptions);

    /**
     * Create an {@link EventStorageFactory} that looks up storages by name.
     *
     * @param storages Storage names mapped to a function that creates the storage from its options
     */
    static EventStorageFactory registry(Map<String, Function<Map<String, Object>, EventStorage>> storages) {
        requireNonNull(storages, "Storages cannot be null");
        Map<String, Function<Map<String, Object>, EventStorage>> copy = new LinkedHashMap<>(storages);
        return (storage, storageOptions) -> {
            Function<Map<String, Object>, EventStorage> fn = copy.get(storage);
            return fn == null ? null : fn.apply(storageOptions);
        };
    }

    /**
     * Create an {@link EventStorageFactory} that only knows a single storage.
     */
    static EventStorageFactory single(String storage, Function<Map<String, Object>, EventStorage> fn) {
        return registry(Map.of(storage, fn));
    }
}
