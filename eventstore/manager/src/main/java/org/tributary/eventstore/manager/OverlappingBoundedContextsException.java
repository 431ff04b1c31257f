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

import org.tributary.eventstore.api.InvalidConfigurationException;

/**
 * Two event store registrations claim the same bounded context.
 */
public class OverlappingBoundedContextsException extends InvalidConfigurationException {
    public final String boundedContextPattern;
    public final String eventStoreIdentifier;
    public final String conflictingEventStoreIdentifier;

    public OverlappingBoundedContextsException(String boundedContextPattern, String eventStoreIdentifier, String conflictingEventStoreIdentifier) {
        super(String.format("The bounded context pattern \"%s\" of event store \"%s\" overlaps with the same pattern of event store \"%s\"",
                boundedContextPattern, conflictingEventStoreIdentifier, eventStoreIdentifier));
        this.boundedContextPattern = boundedContextPattern;
        this.eventStoreIdentifier = eventStoreIdentifier;
        this.conflictingEventStoreIdentifier = conflictingEventStoreIdentifier;
    }
}
