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

package org.tributary.eventstore.api;

import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.StringJoiner;

import static java.util.Objects.requireNonNull;

/**
 * An {@link EventStream} that fetches events from a {@link BatchLoader} in batches of a fixed size. Only one batch is
 * kept in memory at a time and batch boundaries are not visible to the consumer.
 * <p>
 * A batch that contains fewer events than the batch size is treated as the end of the stream.
 * </p>
 */
public class BatchedEventStream implements EventStream {
    public static final int DEFAULT_BATCH_SIZE = 100;

    private final BatchLoader batchLoader;
    private final int batchSize;

    /**
     * Loads the events between {@code offset} (inclusive) and {@code offset + limit} (exclusive) of the query result.
     */
    @FunctionalInterface
    public interface BatchLoader {
        List<RawEvent> load(int offset, int limit);
    }

    public BatchedEventStream(BatchLoader batchLoader) {
        this(batchLoader, DEFAULT_BATCH_SIZE);
    }

    public BatchedEventStream(BatchLoader batchLoader, int batchSize) {
        requireNonNull(batchLoader, BatchLoader.class.getSimpleName() + " cannot be null");
        if (batchSize < 1) {
            throw new IllegalArgumentException("Batch size must be greater than 0");
        }
        this.batchLoader = batchLoader;
        this.batchSize = batchSize;
    }

    public int getBatchSize() {
        return batchSize;
    }

    @Override
    public Iterator<RawEvent> iterator() {
        return new BatchIterator();
    }

    private class BatchIterator implements Iterator<RawEvent> {
        private int offset = 0;
        private List<RawEvent> currentBatch = List.of();
        private int indexInBatch = 0;
        private boolean exhausted = false;

        @Override
        public boolean hasNext() {
            if (indexInBatch < currentBatch.size()) {
                return true;
            } else if (exhausted) {
                return false;
            }
            fetchNextBatch();
            return indexInBatch < currentBatch.size();
        }

        @Override
        public RawEvent next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            return currentBatch.get(indexInBatch++);
        }

        private void fetchNextBatch() {
            List<RawEvent> batch = batchLoader.load(offset, batchSize);
            currentBatch = batch == null ? List.of() : batch;
            indexInBatch = 0;
            offset += currentBatch.size();
            if (currentBatch.size() < batchSize) {
                exhausted = true;
            }
        }
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", BatchedEventStream.class.getSimpleName() + "[", "]")
                .add("batchSize=" + batchSize)
                .toString();
    }
}
