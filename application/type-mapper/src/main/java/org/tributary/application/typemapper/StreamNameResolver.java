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

package org.tributary.application.typemapper;

import static java.util.Objects.requireNonNull;

/**
 * Builds stream names of the form {@code "<boundedContext>:<AggregateShortName>:<aggregateId>"}. The bounded context
 * prefix is what routes the stream to its event store.
 */
public class StreamNameResolver {

    /**
     * @return The name of the stream of the aggregate, using the package of the aggregate class as bounded context
     */
    public String streamNameFor(Class<?> aggregateClass, String aggregateId) {
        requireNonNull(aggregateClass, "Aggregate class cannot be null");
        return streamNameFor(aggregateClass.getPackageName(), aggregateClass.getSimpleName(), aggregateId);
    }

    public String streamNameFor(String boundedContext, String aggregateShortName, String aggregateId) {
        requireNonNull(boundedContext, "Bounded context cannot be null");
        requireNonNull(aggregateShortName, "Aggregate short name cannot be null");
        requireNonNull(aggregateId, "Aggregate id cannot be null");
        if (boundedContext.contains(":") || aggregateShortName.contains(":")) {
            throw new IllegalArgumentException("Bounded context and aggregate short name cannot contain ':'");
        }
        return boundedContext + ":" + aggregateShortName + ":" + aggregateId;
    }
}
