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

/**
 * A {@code ProjectionPositionStorage} provides means to read and write the position of a projection, i.e. the sequence
 * number of the last event that was successfully applied to it. This is what allows a projection to continue where it
 * left off when it's caught up again, for example after the application is restarted.
 * <p>
 * A projection that has never applied any event is at position {@value #BEFORE_FIRST_EVENT}.
 * </p>
 */
public interface ProjectionPositionStorage {

    long BEFORE_FIRST_EVENT = 0;

    /**
     * Read the position of the projection.
     *
     * @param projectionIdentifier The id of the projection whose position to find
     * @return The stored position, or {@value #BEFORE_FIRST_EVENT} if no position is stored for the projection
     */
    long read(String projectionIdentifier);

    /**
     * Save the position of the projection. A position lower than the one already stored is ignored, positions never decrease.
     *
     * @return The position stored after the save
     */
    long save(String projectionIdentifier, long position);

    /**
     * Delete the position of the projection so that it starts before the first event again.
     *
     * @param projectionIdentifier The id of the projection to delete the position for.
     */
    void delete(String projectionIdentifier);

    /**
     * Check if the projection has a stored position in this storage.
     *
     * @param projectionIdentifier The id of the projection to check.
     * @return <code>true</code> if storage contains a position for the projection, <code>false</code> otherwise.
     */
    boolean exists(String projectionIdentifier);
}
