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

import com.google.common.util.concurrent.AtomicDouble;
import com.shardline.BadRequestException;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Resources shared by all partition fetchers of one query: collaborators, limits, the buffer
 * budget and the accumulated request charge.
 * <p>
 * Fetch slots are counted with an atomic counter. Prefetches leave one slot free so that the
 * consumer can always fetch the partition it is blocked on without exceeding the bound.
 */
public class FetchContext {
    private final PartitionReader reader;
    private final PartitionRouter router;
    private final ExecutorService executor;
    private final RequestContext requestContext;
    private final BufferBudget budget;
    private final int maxConcurrency;
    private final int fetchRetryAttempts;
    private final boolean directExecution;
    private final String queryText;
    private final AtomicInteger inFlight = new AtomicInteger();
    private final AtomicDouble requestCharge = new AtomicDouble();
    private final Set<PartitionFetcher> fetchers = ConcurrentHashMap.newKeySet();
    private volatile int pageSize;
    private volatile boolean cancelled;

    private FetchContext(Builder builder) {
        this.reader = Objects.requireNonNull(builder.reader, "reader");
        this.router = Objects.requireNonNull(builder.router, "router");
        this.executor = Objects.requireNonNull(builder.executor, "executor");
        this.requestContext = Objects.requireNonNull(builder.requestContext, "requestContext");
        this.budget = new BufferBudget(builder.maxBufferedItemCount);
        this.maxConcurrency = builder.maxConcurrency;
        this.fetchRetryAttempts = builder.fetchRetryAttempts;
        this.directExecution = builder.directExecution;
        this.pageSize = builder.pageSize;
        this.queryText = Objects.requireNonNull(builder.queryText, "queryText");
    }

    public static Builder builder() {
        return new Builder();
    }

    public PartitionReader reader() {
        return reader;
    }

    public ExecutorService executor() {
        return executor;
    }

    public RequestContext requestContext() {
        return requestContext;
    }

    public BufferBudget budget() {
        return budget;
    }

    public int maxConcurrency() {
        return maxConcurrency;
    }

    public int fetchRetryAttempts() {
        return fetchRetryAttempts;
    }

    public boolean isDirectExecution() {
        return directExecution;
    }

    public int pageSize() {
        return pageSize;
    }

    /**
     * Text of the query being executed, used to name it in fetch errors.
     */
    public String queryText() {
        return queryText;
    }

    /**
     * Sets the page size requested from partitions by subsequent fetches.
     *
     * @param pageSize max item count per partition page
     */
    public void setPageSize(int pageSize) {
        this.pageSize = pageSize;
    }

    boolean tryAcquirePrefetchSlot() {
        while (true) {
            int current = inFlight.get();
            if (current >= maxConcurrency - 1) {
                return false;
            }
            if (inFlight.compareAndSet(current, current + 1)) {
                return true;
            }
        }
    }

    void acquireDemandSlot() {
        inFlight.incrementAndGet();
    }

    void releaseSlot() {
        inFlight.decrementAndGet();
    }

    public int inFlight() {
        return inFlight.get();
    }

    void addRequestCharge(double charge) {
        requestCharge.addAndGet(charge);
    }

    /**
     * Returns the request charge accumulated since the previous call and resets it.
     *
     * @return the charge
     */
    public double drainRequestCharge() {
        return requestCharge.getAndSet(0);
    }

    void register(PartitionFetcher fetcher) {
        fetchers.add(fetcher);
    }

    void unregister(PartitionFetcher fetcher) {
        fetchers.remove(fetcher);
    }

    int activeFetchers() {
        return fetchers.size();
    }

    public boolean isCancelled() {
        return cancelled;
    }

    /**
     * Cancels every in-flight fetch and drops all buffered rows.
     */
    public void cancel() {
        cancelled = true;
        for (PartitionFetcher fetcher : fetchers) {
            fetcher.close();
        }
        fetchers.clear();
    }

    /**
     * Resolves a key span to the ranges currently serving it, each clipped to the span.
     *
     * @param span the span
     * @return the clipped ranges ordered by their lower bound
     */
    public List<KeyRange> resolve(KeyRange span) {
        List<KeyRange> resolved = router.resolve(span);
        List<KeyRange> clipped = new ArrayList<>(resolved.size());
        for (KeyRange range : resolved) {
            if (!range.overlaps(span)) {
                continue;
            }
            String min = range.minInclusive().compareTo(span.minInclusive()) > 0 ? range.minInclusive() : span.minInclusive();
            String max = range.maxExclusive().compareTo(span.maxExclusive()) < 0 ? range.maxExclusive() : span.maxExclusive();
            clipped.add(new KeyRange(min, max, range.partitionId()));
        }
        clipped.sort(null);
        return clipped;
    }

    /**
     * Maps a cursor saved in a continuation token to the current partition layout. A range that
     * still exists keeps its position; a range that was split yields one cursor per child, all
     * starting from the saved backend cursor and carrying the saved resume filter.
     *
     * @param cursor the saved cursor
     * @return cursors for the ranges currently serving the saved span
     */
    public List<PartitionCursor> resolve(PartitionCursor cursor) {
        List<KeyRange> current = resolve(cursor.range());
        if (current.isEmpty()) {
            throw new BadRequestException("Continuation token refers to an unknown key range " + cursor.range());
        }
        if (current.size() == 1 && current.get(0).sameSpan(cursor.range())) {
            return List.of(cursor.withRange(current.get(0)));
        }
        List<PartitionCursor> children = new ArrayList<>(current.size());
        for (KeyRange child : current) {
            // a child that has not delivered yet still carries its parent's filter with skip == 0
            children.add(new PartitionCursor(child, cursor.resumeToken(), 0, cursor.resumeFilter()));
        }
        return children;
    }

    public static class Builder {
        private PartitionReader reader;
        private PartitionRouter router;
        private ExecutorService executor;
        private RequestContext requestContext;
        private long maxBufferedItemCount = 10_000;
        private int maxConcurrency = 1;
        private int fetchRetryAttempts = 3;
        private boolean directExecution;
        private int pageSize = 100;
        private String queryText = "";

        public Builder reader(PartitionReader reader) {
            this.reader = reader;
            return this;
        }

        public Builder router(PartitionRouter router) {
            this.router = router;
            return this;
        }

        public Builder executor(ExecutorService executor) {
            this.executor = executor;
            return this;
        }

        public Builder requestContext(RequestContext requestContext) {
            this.requestContext = requestContext;
            return this;
        }

        public Builder maxBufferedItemCount(long maxBufferedItemCount) {
            this.maxBufferedItemCount = maxBufferedItemCount;
            return this;
        }

        public Builder maxConcurrency(int maxConcurrency) {
            if (maxConcurrency <= 0) {
                throw new IllegalArgumentException("maxConcurrency must be positive");
            }
            this.maxConcurrency = maxConcurrency;
            return this;
        }

        public Builder fetchRetryAttempts(int fetchRetryAttempts) {
            if (fetchRetryAttempts <= 0) {
                throw new IllegalArgumentException("fetchRetryAttempts must be positive");
            }
            this.fetchRetryAttempts = fetchRetryAttempts;
            return this;
        }

        public Builder directExecution(boolean directExecution) {
            this.directExecution = directExecution;
            return this;
        }

        public Builder pageSize(int pageSize) {
            if (pageSize <= 0) {
                throw new IllegalArgumentException("pageSize must be positive");
            }
            this.pageSize = pageSize;
            return this;
        }

        public Builder queryText(String queryText) {
            this.queryText = queryText;
            return this;
        }

        public FetchContext build() {
            return new FetchContext(this);
        }
    }
}
