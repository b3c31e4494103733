/*
 * Copyright (c) 2023-2025 Burak Sezer
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.shardline.partition;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Global cap on rows buffered by all partitions of a query.
 * <p>
 * The counter is updated by fetcher threads when pages arrive and by the consumer when rows are
 * taken. It is a soft cap: a fetch is only started while the budget has room, but a page that
 * completes may take the count above the limit.
 */
public class BufferBudget {
    private final long maxBufferedItemCount;
    private final AtomicLong buffered = new AtomicLong();

    public BufferBudget(long maxBufferedItemCount) {
        if (maxBufferedItemCount <= 0) {
            throw new IllegalArgumentException("maxBufferedItemCount must be positive");
        }
        this.maxBufferedItemCount = maxBufferedItemCount;
    }

    public boolean hasCapacity() {
        return buffered.get() < maxBufferedItemCount;
    }

    public void add(long rows) {
        buffered.addAndGet(rows);
    }

    public void release(long rows) {
        buffered.addAndGet(-rows);
    }

    public long buffered() {
        return buffered.get();
    }

    public long limit() {
        return maxBufferedItemCount;
    }

    /**
     * Splits the budget evenly between the partitions still producing rows. Every partition
     * may buffer at least one row.
     *
     * @param activePartitions number of partitions still producing rows
     * @return the per-partition high-water mark
     */
    public long highWaterMark(int activePartitions) {
        if (activePartitions <= 0) {
            return maxBufferedItemCount;
        }
        return Math.max(1, maxBufferedItemCount / activePartitions);
    }
}
