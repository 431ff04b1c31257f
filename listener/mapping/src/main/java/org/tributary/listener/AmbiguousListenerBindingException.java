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

package org.tributary.listener;

import org.tributary.eventstore.api.InvalidConfigurationException;

/**
 * A listener is matched by more than one listener preset, either of the same event store or of two different ones.
 */
public class AmbiguousListenerBindingException extends InvalidConfigurationException {
    public final String listenerIdentifier;
    public final String eventStoreIdentifier;
    public final String pattern;
    public final String conflictingEventStoreIdentifier;
    public final String conflictingPattern;

    public AmbiguousListenerBindingException(String listenerIdentifier, String eventStoreIdentifier, String pattern, String conflictingEventStoreIdentifier, String conflictingPattern) {
        super(message(listenerIdentifier, eventStoreIdentifier, pattern, conflictingEventStoreIdentifier, conflictingPattern));
        this.listenerIdentifier = listenerIdentifier;
        this.eventStoreIdentifier = eventStoreIdentifier;
        this.pattern = pattern;
        this.conflictingEventStoreIdentifier = conflictingEventStoreIdentifier;
        this.conflictingPattern = conflictingPattern;
    }

    private static String message(String listenerIdentifier, String eventStoreIdentifier, String pattern, String conflictingEventStoreIdentifier, String conflictingPattern) {
        if (eventStoreIdentifier.equals(conflictingEventStoreIdentifier)) {
            return String.format("Listener \"%s\" matches presets \"%s\" and \"%s\" of event store \"%s\". One of the presets needs to be adjusted or removed.",
                    listenerIdentifier, pattern, conflictingPattern, eventStoreIdentifier);
        }
        return String.format("Listener \"%s\" matches preset \"%s\" of event store \"%s\" and preset \"%s\" of event store \"%s\". One of the presets needs to be adjusted or removed.",
                listenerIdentifier, pattern, eventStoreIdentifier, conflictingPattern, conflictingEventStoreIdentifier);
    }
}
