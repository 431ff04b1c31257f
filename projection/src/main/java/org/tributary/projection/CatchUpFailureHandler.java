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
 * Decides what a watch loop does when a catch-up cycle fails.
 */
@FunctionalInterface
public interface CatchUpFailureHandler {

    /**
     * @param projectionIdentifier The projection whose catch-up failed
     * @param exception            The failure
     * @return <code>true</code> to continue with the next cycle, <code>false</code> to stop watching and rethrow {@code exception}
     */
    boolean onFailure(String projectionIdentifier, RuntimeException exception);

    /**
     * @return A handler that keeps watching after a failed cycle. The failure is logged as a warning.
     */
    static CatchUpFailureHandler logAndContinue() {
        return (projectionIdentifier, exception) -> true;
    }

    /**
     * @return A handler that stops watching on the first failed cycle.
     */
    static CatchUpFailureHandler stopWatching() {
        return (projectionIdentifier, exception) -> false;
    }
}
