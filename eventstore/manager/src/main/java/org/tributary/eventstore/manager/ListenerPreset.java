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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * The listener preset of an event store registration. Listeners whose identifier matches the preset pattern are bound
 * to the event store, and the preset options are attached to every mapping produced for them.
 */
public record ListenerPreset(boolean enabled, Map<String, Object> options) {

    public ListenerPreset {
        requireNonNull(options, "Options cannot be null");
        options = Collections.unmodifiableMap(new LinkedHashMap<>(options));
    }

    public static ListenerPreset active() {
        return new ListenerPreset(true, Collections.emptyMap());
    }

    public static ListenerPreset active(Map<String, Object> options) {
        return new ListenerPreset(true, options);
    }

    public static ListenerPreset inactive() {
        return new ListenerPreset(false, Collections.emptyMap());
    }
}
