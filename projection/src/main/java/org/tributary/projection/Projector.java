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

import org.tributary.listener.EventListener;

/**
 * An {@link EventListener} that derives read-model state from the events it handles. The read model itself is owned
 * by the projector, which is why it's the projector that clears it when the projection is replayed.
 */
public interface Projector extends EventListener {

    /**
     * Remove all state built so far. Called before the events of the projection are replayed from the beginning.
     */
    void reset();
}
