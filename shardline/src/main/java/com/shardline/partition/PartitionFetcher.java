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

import com.shardline.PartitionFetchException;
import com.shardline.QueryCancelledException;
import com.shardline.common.ShardlineException;
import com.shardline.pipeline.QueryRow;
import com.shardline.value.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.function.Predicate;

/**
 * Fetches the pages of one partition into a {@link PageBuffer}.
 *
 * <h2>Threading</h2>
 * <p>Page fetches run on the query's executor, at most one at a time per partition; the fetch
 * only appends to the buffer and publishes its outcome through volatile fields. Every other
 * method is called by the single consumer of the query.
 *
 * <h2>Cursor</h2>
 * <p>The backend cursor advances only when a full page arrived. The resume position reported
 * by {@link #position()} is derived from consumed rows only. Throttling is retried by the
 * reader; a throttled result reaching the fetcher fails the query as retryable.
 *
 * <h2>Splits</h2>
 * <p>When the reader reports the range as gone, the router is asked for the child ranges. Rows
 * already buffered are still served; afterwards {@link #await()} reports {@link State#SPLIT}
 * and {@link #children()} creates fetchers that continue from the parent's next cursor.
 */
public class PartitionFetcher {
    private static final Logger LOGGER = LoggerFactory.getLogger(PartitionFetcher.class);

    private final KeyRange range;
    private final FetchContext context;
    private final PageBuffer buffer;
    private final Comparator<List<Value>> orderByItemsComparator;
    private final ResumeFilter inheritedFilter;
    private final int initialSkip;

    private volatile String nextCursor;
    private volatile boolean exhausted;
    private volatile List<KeyRange> splitRanges;
    private volatile ShardlineException failure;

    // fetcher-thread only
    private int pendingSkip;

    // consumer only
    private CompletableFuture<Void> inFlight;
    private QueryRow lastDelivered;
    private boolean started;
    private boolean closed;

    /**
     * @param context                the query's fetch resources
     * @param cursor                 where the partition starts
     * @param orderByItemsComparator sort order of the partition's rows, null for unordered merges
     */
    public PartitionFetcher(FetchContext context, PartitionCursor cursor, @Nullable Comparator<List<Value>> orderByItemsComparator) {
        this.range = cursor.range();
        this.context = context;
        this.orderByItemsComparator = orderByItemsComparator;
        this.inheritedFilter = cursor.resumeFilter();
        this.nextCursor = cursor.resumeToken();
        this.pendingSkip = cursor.skip();
        this.initialSkip = cursor.skip();
        this.buffer = new PageBuffer(cursor.resumeToken(), admission(range, inheritedFilter, orderByItemsComparator), context.budget());
        context.register(this);
    }

    private static Predicate<QueryRow> admission(KeyRange range, ResumeFilter filter, Comparator<List<Value>> comparator) {
        Predicate<QueryRow> inRange = row -> row.epk() == null || range.contains(row.epk());
        if (filter instanceof ResumeFilter.ExcludeRids excludeRids) {
            return inRange.and(row -> !excludeRids.rids().contains(row.rid()));
        }
        if (filter instanceof ResumeFilter.AfterRow afterRow && comparator != null) {
            return inRange.and(row -> {
                int result = comparator.compare(row.orderByItems(), afterRow.orderByItems());
                if (result != 0) {
                    return result > 0;
                }
                return row.rid().compareTo(afterRow.rid()) > 0;
            });
        }
        return inRange;
    }

    public KeyRange range() {
        return range;
    }

    /**
     * Starts a background fetch if the partition has more pages, its buffer is below the
     * high-water mark, the global budget has room and a fetch slot is free.
     */
    public void prefetch() {
        if (!canFetch()) {
            return;
        }
        long highWaterMark = context.budget().highWaterMark(context.activeFetchers());
        if (buffer.bufferedRows() >= highWaterMark || !context.budget().hasCapacity()) {
            return;
        }
        if (context.tryAcquirePrefetchSlot()) {
            startFetch();
        }
    }

    private boolean canFetch() {
        return !closed
                && (inFlight == null || inFlight.isDone())
                && !exhausted
                && splitRanges == null
                && failure == null;
    }

    private void startFetch() {
        started = true;
        inFlight = CompletableFuture.runAsync(this::fetch, context.executor());
    }

    /**
     * Blocks until the partition has a row to deliver, is drained or was split.
     *
     * @return the partition's state
     * @throws PartitionFetchException if fetching failed
     * @throws QueryCancelledException if the query was cancelled while waiting
     */
    public State await() {
        while (true) {
            boolean done = exhausted;
            List<KeyRange> split = splitRanges;
            ShardlineException error = failure;
            if (buffer.peek() != null) {
                return State.READY;
            }
            if (error != null) {
                throw error;
            }
            if (split != null) {
                return State.SPLIT;
            }
            if (done) {
                return State.DRAINED;
            }
            if (closed || context.isCancelled()) {
                throw new QueryCancelledException();
            }
            if (inFlight == null || inFlight.isDone()) {
                context.acquireDemandSlot();
                startFetch();
            }
            join();
        }
    }

    /**
     * Non-blocking variant of {@link #await()}.
     *
     * @return the partition's state, or null while its next page is still being fetched or
     * has not been requested yet
     * @throws PartitionFetchException if fetching failed
     */
    @Nullable
    public State tryState() {
        boolean done = exhausted;
        List<KeyRange> split = splitRanges;
        ShardlineException error = failure;
        if (buffer.peek() != null) {
            return State.READY;
        }
        if (error != null) {
            throw error;
        }
        if (split != null) {
            return State.SPLIT;
        }
        return done ? State.DRAINED : null;
    }

    /**
     * Returns true if a row is buffered and can be delivered without blocking.
     */
    public boolean isReady() {
        return buffer.peek() != null;
    }

    /**
     * Returns the next row without consuming it. Only valid after {@link #await()} returned
     * {@link State#READY} or {@link #isReady()} returned true.
     */
    public QueryRow peek() {
        QueryRow row = buffer.peek();
        if (row == null) {
            throw new IllegalStateException("No buffered row in partition " + range);
        }
        return row;
    }

    public QueryRow poll() {
        QueryRow row = peek();
        buffer.advance();
        lastDelivered = row;
        return row;
    }

    /**
     * Creates the fetchers replacing this one after a split. The children start from the cursor
     * following the last page consumed from this partition.
     *
     * @return child fetchers ordered by key range
     */
    public List<PartitionFetcher> children() {
        List<KeyRange> split = splitRanges;
        if (split == null) {
            throw new IllegalStateException("Partition " + range + " was not split");
        }
        close();
        List<PartitionFetcher> children = new ArrayList<>(split.size());
        for (KeyRange child : split) {
            PartitionCursor cursor = new PartitionCursor(child, buffer.consumedCursor(), 0, inheritedFilter);
            children.add(new PartitionFetcher(context, cursor, orderByItemsComparator));
        }
        return children;
    }

    /**
     * Returns the position to resume this partition from. When part of a page was consumed,
     * the position carries a filter describing the delivered rows so that children of a later
     * split can skip them.
     *
     * @return the partition's cursor
     */
    public PartitionCursor position() {
        PageBuffer.Position position = buffer.position();
        boolean initialPage = !buffer.hasRemovedPage();
        int skip = !position.buffered() && initialPage ? initialSkip : position.skip();
        if (skip == 0 && !(initialPage && inheritedFilter != null)) {
            return new PartitionCursor(range, position.cursor(), 0, null);
        }

        ResumeFilter filter;
        if (orderByItemsComparator != null) {
            filter = lastDelivered != null
                    ? new ResumeFilter.AfterRow(lastDelivered.orderByItems(), lastDelivered.rid())
                    : inheritedFilter;
        } else {
            HashSet<String> rids = new HashSet<>(position.consumedRids());
            if (inheritedFilter instanceof ResumeFilter.ExcludeRids excludeRids) {
                rids.addAll(excludeRids.rids());
            }
            filter = rids.isEmpty() ? null : new ResumeFilter.ExcludeRids(rids);
        }
        return new PartitionCursor(range, position.cursor(), skip, filter);
    }

    /**
     * Returns true if nothing remains to be delivered from this partition. Does not block.
     */
    public boolean isDrained() {
        return exhausted && buffer.peek() == null;
    }

    public boolean hasStarted() {
        return started;
    }

    /**
     * Cancels the in-flight fetch, if any, and releases buffered rows.
     */
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        if (inFlight != null) {
            inFlight.cancel(true);
        }
        buffer.clear();
        context.unregister(this);
    }

    private void join() {
        try {
            inFlight.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new QueryCancelledException(e);
        } catch (CancellationException e) {
            throw new QueryCancelledException(e);
        } catch (ExecutionException e) {
            throw PartitionFetchException.fatal(context.queryText(), range, e.getCause());
        }
    }

    private void fetch() {
        try {
            fetchPage();
        } finally {
            context.releaseSlot();
        }
    }

    private void fetchPage() {
        if (context.isCancelled()) {
            return;
        }
        String cursor = nextCursor;
        FetchRequest request = new FetchRequest(
                context.requestContext(),
                range,
                cursor,
                context.pageSize(),
                context.isDirectExecution()
        );

        FetchResult result;
        try {
            result = context.reader().fetchPage(request);
        } catch (RuntimeException e) {
            LOGGER.error("Fetching a page from partition {} failed", range, e);
            failure = PartitionFetchException.fatal(context.queryText(), range, e);
            return;
        }

        if (result instanceof FetchResult.Success success) {
            Page page = success.page();
            buffer.offer(cursor, page.rows(), page.continuation(), pendingSkip);
            pendingSkip = 0;
            context.addRequestCharge(page.requestCharge());
            LOGGER.debug("Fetched {} rows from partition {}, activity id: {}",
                    page.rows().size(), range, context.requestContext().activityId());
            nextCursor = page.continuation();
            if (page.continuation() == null) {
                exhausted = true;
            }
        } else if (result instanceof FetchResult.Throttled) {
            LOGGER.warn("Partition {} is still throttled after {} attempts", range, context.fetchRetryAttempts());
            failure = PartitionFetchException.transientFailure(context.queryText(), range, context.fetchRetryAttempts());
        } else if (result instanceof FetchResult.Gone) {
            List<KeyRange> children = context.resolve(range);
            if (children.isEmpty() || (children.size() == 1 && children.get(0).equals(range))) {
                failure = PartitionFetchException.fatal(context.queryText(), range,
                        new IllegalStateException("Partition reported a split but the router did not resolve new ranges"));
                return;
            }
            LOGGER.warn("Partition {} was split into {}", range, children);
            splitRanges = List.copyOf(children);
        } else if (result instanceof FetchResult.Failure fetchFailure) {
            LOGGER.error("Fetching a page from partition {} failed", range, fetchFailure.cause());
            failure = PartitionFetchException.fatal(context.queryText(), range, fetchFailure.cause());
        } else {
            throw new IllegalStateException("Unknown fetch result: " + result);
        }
    }

    public enum State {
        READY,
        DRAINED,
        SPLIT
    }
}
