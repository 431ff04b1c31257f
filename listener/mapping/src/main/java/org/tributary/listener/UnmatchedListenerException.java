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

import java.util.List;

/**
 * One or more listeners are not matched by any listener preset, so no event store would deliver events to them.
 */
public class UnmatchedListenerException extends InvalidConfigurationException {
    public final List<String> listenerIdentifiers;

    public UnmatchedListenerException(List<String> listenerIdentifiers) {
        super("Unmatched listener(s): " + String.join(", ", listenerIdentifiers));
        this.listenerIdentifiers = List.copyOf(listenerIdentifiers);
    }
}
