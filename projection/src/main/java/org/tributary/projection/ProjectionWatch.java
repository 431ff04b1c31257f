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

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static java.util.Objects.requireNonNull;

/**
 * Cancellation token of a watch loop started by {@link ProjectionManager#watch(String, Duration, ProjectionWatch, java.util.function.Consumer, CatchUpFailureHandler)}.
 * Cancelling wakes up a loop that is waiting for its next cycle, a catch-up that is in progress is allowed to finish.
 */
public class ProjectionWatch {
    private final String projectionIdentifier;
    private final CountDownLatch cancelled = new CountDownLatch(1);

    public ProjectionWatch(String projectionIdentifier) {
        requireNonNull(projectionIdentifier, "Projection identifier cannot be null");
        this.projectionIdentifier = projectionIdentifier;
    }

    public String projectionIdentifier() {
        return projectionIdentifier;
    }

    public void cancel() {
        cancelled.countDown();
    }

    public boolean isCancelled() {
        return cancelled.getCount() == 0;
    }

    /**
     * Wait until the watch is cancelled or the timeout elapses.
     *
     * @return <code>true</code> if the watch was cancelled
     */
    boolean awaitCancellation(Duration timeout) throws InterruptedException {
        return cancelled.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    @Override
    public String toString() {
        return "ProjectionWatch{" +
                "projectionIdentifier='" + projectionIdentifier + '\'' +
                ", cancelled=" + isCancelled() +
                '}';
    }
}
