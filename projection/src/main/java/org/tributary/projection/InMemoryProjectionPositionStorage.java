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

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import static java.util.Objects.requireNonNull;

/**
 * A {@link ProjectionPositionStorage} that keeps the positions in memory. Positions are lost when the application is stopped.
 */
public class InMemoryProjectionPositionStorage implements ProjectionPositionStorage {
    private final ConcurrentMap<String, Long> positions = new ConcurrentHashMap<>();

    @Override
    public long read(String projectionIdentifier) {
        requireNonNull(projectionIdentifier, "Projection identifier cannot be null");
        return positions.getOrDefault(projectionIdentifier, BEFORE_FIRST_EVENT);
    }

    @Override
    public long save(String projectionIdentifier, long position) {
        requireNonNull(projectionIdentifier, "Projection identifier cannot be null");
        if (position < BEFORE_FIRST_EVENT) {
            throw new IllegalArgumentException("Position cannot be negative");
        }
        return positions.merge(projectionIdentifier, position, Math::max);
    }

    @Override
    public void delete(String projectionIdentifier) {
        requireNonNull(projectionIdentifier, "Projection identifier cannot be null");
        positions.remove(projectionIdentifier);
    }

    @Override
    public boolean exists(String projectionIdentifier) {
        requireNonNull(projectionIdentifier, "Projection identifier cannot be null");
        return positions.containsKey(projectionIdentifier);
    }
}
