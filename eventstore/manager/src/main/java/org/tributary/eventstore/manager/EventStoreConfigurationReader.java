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

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.tributary.eventstore.api.InvalidConfigurationException;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * Reads an {@link EventStoreConfiguration} from JSON or from an already parsed configuration map:
 * <pre>
 * {
 *   "stores": {
 *     "default": { "storage": "inmemory", "storageOptions": {}, "boundedContexts": { "*": true }, "listeners": { "org\\.acme\\..*": true } },
 *     "billing": { "storage": "inmemory", "boundedContexts": { "org.acme.billing": true }, "listeners": { "org\\.acme\\.billing\\..*": { "someOption": 1 } } },
 *     "disabled": false
 *   }
 * }
 * </pre>
 * A store set to {@code false} is skipped. A listener preset set to {@code true} or to an object is enabled, the object
 * being the preset options.
 */
public class EventStoreConfigurationReader {
    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public EventStoreConfigurationReader() {
        this(new ObjectMapper());
    }

    public EventStoreConfigurationReader(ObjectMapper objectMapper) {
        requireNonNull(objectMapper, ObjectMapper.class.getSimpleName() + " cannot be null");
        this.objectMapper = objectMapper;
    }

    public EventStoreConfiguration read(InputStream json) {
        requireNonNull(json, "JSON input cannot be null");
        final Map<String, Object> configuration;
        try {
            configuration = objectMapper.readValue(json, MAP_TYPE);
        } catch (IOException e) {
            throw new InvalidConfigurationException("Failed to read event store configuration: " + e.getMessage(), e);
        }
        return read(configuration == null ? Collections.emptyMap() : configuration);
    }

    public EventStoreConfiguration read(Map<String, Object> configuration) {
        requireNonNull(configuration, "Configuration cannot be null");
        Map<String, Object> stores = mapOrEmpty(configuration.get("stores"), "stores");
        List<EventStoreRegistration> registrations = new ArrayList<>();
        stores.forEach((identifier, store) -> {
            if (Boolean.FALSE.equals(store) || store == null) {
                return;
            }
            registrations.add(readRegistration(identifier, mapOrEmpty(store, "stores." + identifier)));
        });
        return new EventStoreConfiguration(registrations);
    }

    private static EventStoreRegistration readRegistration(String identifier, Map<String, Object> store) {
        Object storage = store.get("storage");
        if (storage != null && !(storage instanceof String)) {
            throw new InvalidConfigurationException("The storage of event store \"" + identifier + "\" must be a string but was " + storage);
        }

        Map<String, Boolean> boundedContexts = new LinkedHashMap<>();
        mapOrEmpty(store.get("boundedContexts"), "stores." + identifier + ".boundedContexts").forEach((pattern, active) -> {
            if (!(active instanceof Boolean)) {
                throw new InvalidConfigurationException("The bounded context \"" + pattern + "\" of event store \"" + identifier + "\" must be set to true or false but was " + active);
            }
            boundedContexts.put(pattern, (Boolean) active);
        });

        Map<String, ListenerPreset> listeners = new LinkedHashMap<>();
        mapOrEmpty(store.get("listeners"), "stores." + identifier + ".listeners").forEach((pattern, preset) -> listeners.put(pattern, toListenerPreset(identifier, pattern, preset)));

        return new EventStoreRegistration(identifier, (String) storage, mapOrEmpty(store.get("storageOptions"), "stores." + identifier + ".storageOptions"), boundedContexts, listeners);
    }

    @SuppressWarnings("unchecked")
    private static ListenerPreset toListenerPreset(String identifier, String pattern, Object preset) {
        if (Boolean.TRUE.equals(preset)) {
            return ListenerPreset.active();
        } else if (Boolean.FALSE.equals(preset) || preset == null) {
            return ListenerPreset.inactive();
        } else if (preset instanceof Map) {
            return ListenerPreset.active((Map<String, Object>) preset);
        }
        throw new InvalidConfigurationException("The listener preset \"" + pattern + "\" of event store \"" + identifier + "\" must be true, false or an object but was " + preset);
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> mapOrEmpty(Object value, String path) {
        if (value == null) {
            return Collections.emptyMap();
        } else if (!(value instanceof Map)) {
            throw new InvalidConfigurationException("Expected \"" + path + "\" to be an object but was " + value);
        }
        return (Map<String, Object>) value;
    }
}
