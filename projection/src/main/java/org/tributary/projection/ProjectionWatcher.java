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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tributary.eventstore.api.RawEvent;
import org.tributary.projection.internal.ExecutorShutdown;

import java.time.Duration;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Consumer;

import static java.util.Objects.requireNonNull;

/**
 * Runs {@link ProjectionManager#watch(String, Duration, ProjectionWatch, Consumer, CatchUpFailureHandler) watch loops} in the background.
 */
public class ProjectionWatcher {
    private static final Logger log = LoggerFactory.getLogger(ProjectionWatcher.class);
    private static final Duration DEFAULT_SHUTDOWN_TIMEOUT = Duration.ofSeconds(5);

    private final ProjectionManager projectionManager;
    private final ExecutorService executorService;
    private final Set<ProjectionWatch> watches = ConcurrentHashMap.newKeySet();
    private volatile boolean shuttingDown = false;

    public ProjectionWatcher(ProjectionManager projectionManager) {
        this(projectionManager, Executors.newCachedThreadPool());
    }

    public ProjectionWatcher(ProjectionManager projectionManager, ExecutorService executorService) {
        requireNonNull(projectionManager, ProjectionManager.class.getSimpleName() + " cannot be null");
        requireNonNull(executorService, ExecutorService.class.getSimpleName() + " cannot be null");
        this.projectionManager = projectionManager;
        this.executorService = executorService;
    }

    /**
     * Start watching a projection. Failed catch-up cycles are logged and retried.
     *
     * @return The token that stops the watch loop when cancelled
     */
    public ProjectionWatch watch(String projectionIdentifier, Duration interval, Consumer<RawEvent> onEvent) {
        return watch(projectionIdentifier, interval, onEvent, CatchUpFailureHandler.logAndContinue());
    }

    public ProjectionWatch watch(String projectionIdentifier, Duration interval, Consumer<RawEvent> onEvent, CatchUpFailureHandler failureHandler) {
        if (shuttingDown) {
            throw new IllegalStateException("Cannot watch projection \"" + projectionIdentifier + "\" since the watcher is shut down");
        }
        String identifier = projectionManager.getProjection(projectionIdentifier).identifier();
        ProjectionWatch watch = new ProjectionWatch(identifier);
        watches.add(watch);
        executorService.execute(() -> {
            try {
                projectionManager.watch(identifier, interval, watch, onEvent, failureHandler);
            } catch (RuntimeException e) {
                log.error("Stopped watching projection {} because of an error", identifier, e);
                throw e;
            } finally {
                watches.remove(watch);
            }
        });
        return watch;
    }

    /**
     * @return The number of watch loops that haven't returned yet
     */
    public int runningWatches() {
        return watches.size();
    }

    /**
     * Cancel all watch loops and stop the executor service.
     */
    public void shutdown() {
        shuttingDown = true;
        watches.forEach(ProjectionWatch::cancel);
        ExecutorShutdown.shutdownSafely(executorService, DEFAULT_SHUTDOWN_TIMEOUT);
    }
}
