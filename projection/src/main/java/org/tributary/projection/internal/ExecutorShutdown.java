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

package org.tributary.projection.internal;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Shuts down the executor services that run watch loops.
 */
public class ExecutorShutdown {
    private static final Logger log = LoggerFactory.getLogger(ExecutorShutdown.class);

    /**
     * Stop accepting new watch loops and wait for the running ones to return. Loops still running when {@code timeout}
     * has elapsed, or when the calling thread is interrupted, are interrupted.
     */
    public static void shutdownSafely(ExecutorService executorService, Duration timeout) {
        if (executorService.isShutdown() || executorService.isTerminated()) {
            return;
        }
        executorService.shutdown();
        try {
            if (!executorService.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                List<Runnable> neverStarted = executorService.shutdownNow();
                log.warn("Watch loops did not stop within {}, interrupted them ({} never started)", timeout, neverStarted.size());
            }
        } catch (InterruptedException e) {
            if (!executorService.isTerminated()) {
                executorService.shutdownNow();
            }
            Thread.currentThread().interrupt();
        }
    }
}
