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
import java.util.StringJoiner;

/**
 * A set of event types resolves to more than one event store, so there's no single store that can deliver them in order.
 */
public class AmbiguousEventStoreRoutingException extends RuntimeException {
    public final Map<String, String> eventStoreIdentifierByEventType;

    public AmbiguousEventStoreRoutingException(Map<String, String> eventStoreIdentifierByEventType) {
        super("The event types resolve to different event stores: " + eventStoreIdentifierByEventType);
        this.eventStoreIdentifierByEventType = Collections.unmodifiableMap(new LinkedHashMap<>(eventStoreIdentifierByEventType));
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", AmbiguousEventStoreRoutingException.class.getSimpleName() + "[", "]")
                .add("eventStoreIdentifierByEventType=" + eventStoreIdentifierByEventType)
                .toString();
    }
}
