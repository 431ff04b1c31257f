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
 * A listener preset pattern doesn't match any listener.
 */
public class UnmatchedListenerPatternException extends InvalidConfigurationException {
    public final String eventStoreIdentifier;
    public final String pattern;

    public UnmatchedListenerPatternException(String eventStoreIdentifier, String pattern) {
        super(String.format("The pattern \"%s\" of event store \"%s\" does not match any listeners", pattern, eventStoreIdentifier));
        this.eventStoreIdentifier = eventStoreIdentifier;
        this.pattern = pattern;
    }
}
