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

package org.tributary.projection;

import org.tributary.eventstore.api.RawEvent;

/**
 * Thrown when a projector fails to apply an event. The position of the projection is not advanced past the event,
 * so catching up again retries it.
 */
public class EventCouldNotBeAppliedException extends RuntimeException {
    public final String projectionIdentifier;
    public final RawEvent rawEvent;

    public EventCouldNotBeAppliedException(String projectionIdentifier, RawEvent rawEvent, Throwable cause) {
        super(String.format("Projection \"%s\" could not apply event %s (type %s, sequence number %d): %s", projectionIdentifier, rawEvent.identifier(),
                rawEvent.type(), rawEvent.sequenceNumber(), cause.getMessage()), cause);
        this.projectionIdentifier = projectionIdentifier;
        this.rawEvent = rawEvent;
    }
}
