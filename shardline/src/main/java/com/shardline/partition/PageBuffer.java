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

import com.shardline.pipeline.QueryRow;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Predicate;

/**
 * Single-producer, single-consumer queue of fetched pages of one partition.
 * <p>
 * The fetcher thread appends whole pages. The consumer reads rows one at a time and is the only
 * one that removes pages, so the consumption position ({@link #position()}) only depends on
 * consumer-owned state and never on fetches that are still in flight.
 */
public class PageBuffer {
    private final Queue<BufferedPage> pages = new ConcurrentLinkedQueue<>();
    private final AtomicInteger bufferedRows = new AtomicInteger();
    private final Predicate<QueryRow> admit;
    private final BufferBudget budget;

    // Continuation of the last page the consumer removed, owned by the consumer.
    private String consumedCursor;
    private boolean pageRemoved;

    /**
     * @param startCursor cursor the partition starts from
     * @param admit       rows failing the predicate are consumed silently
     * @param budget      the query-wide budget buffered rows are charged to
     */
    public PageBuffer(@Nullable String startCursor, Predicate<QueryRow> admit, BufferBudget budget) {
        this.consumedCursor = startCursor;
        this.admit = admit;
        this.budget = budget;
    }

    /**
     * Producer side: appends a page.
     *
     * @param cursor       the cursor the page was fetched with
     * @param rows         the page's rows
     * @param continuation the cursor of the following page
     * @param initialSkip  rows at the start of the page that were consumed before a suspension
     */
    void offer(@Nullable String cursor, List<QueryRow> rows, @Nullable String continuation, int initialSkip) {
        BufferedPage page = new BufferedPage(cursor, rows, continuation, Math.min(initialSkip, rows.size()));
        int unconsumed = rows.size() - page.offset;
        bufferedRows.addAndGet(unconsumed);
        budget.add(unconsumed);
        pages.add(page);
    }

    /**
     * Returns the next admitted row without consuming it, or null when nothing is buffered.
     *
     * @return the next row or null
     */
    @Nullable
    QueryRow peek() {
        while (true) {
            BufferedPage head = pages.peek();
            if (head == null) {
                return null;
            }
            while (head.offset < head.rows.size()) {
                QueryRow row = head.rows.get(head.offset);
                if (admit.test(row)) {
                    return row;
                }
                consumeOne(head);
            }
            removeHead(head);
        }
    }

    /**
     * Consumes the row last returned by {@link #peek()}.
     */
    void advance() {
        BufferedPage head = pages.peek();
        if (head == null || head.offset >= head.rows.size()) {
            throw new IllegalStateException("No buffered row to consume");
        }
        consumeOne(head);
        if (head.offset == head.rows.size()) {
            removeHead(head);
        }
    }

    private void removeHead(BufferedPage head) {
        pages.poll();
        consumedCursor = head.continuation;
        pageRemoved = true;
    }

    private void consumeOne(BufferedPage head) {
        head.offset++;
        bufferedRows.decrementAndGet();
        budget.release(1);
    }

    /**
     * Returns the current consumption position as (cursor, rows consumed of that cursor's page).
     *
     * @return the position
     */
    Position position() {
        BufferedPage head = pages.peek();
        while (head != null && head.offset >= head.rows.size()) {
            removeHead(head);
            head = pages.peek();
        }
        if (head == null) {
            return new Position(consumedCursor, 0, List.of(), false);
        }
        List<String> rids = new ArrayList<>(head.offset);
        for (int i = 0; i < head.offset; i++) {
            rids.add(head.rows.get(i).rid());
        }
        return new Position(head.cursor, head.offset, rids, true);
    }

    /**
     * Cursor following the last page the consumer finished.
     */
    @Nullable
    String consumedCursor() {
        return consumedCursor;
    }

    public int bufferedRows() {
        return bufferedRows.get();
    }

    public boolean isEmpty() {
        return pages.isEmpty();
    }

    /**
     * Drops every buffered page and returns its rows to the budget.
     */
    void clear() {
        pages.clear();
        budget.release(bufferedRows.getAndSet(0));
    }

    /**
     * Returns true once the consumer finished at least one page.
     */
    boolean hasRemovedPage() {
        return pageRemoved;
    }

    /**
     * @param cursor       cursor of the page being consumed
     * @param skip         rows of that page already consumed
     * @param consumedRids rids of those rows
     * @param buffered     whether the page is in the buffer, false when it has not been fetched
     */
    record Position(@Nullable String cursor, int skip, List<String> consumedRids, boolean buffered) {
    }

    private static final class BufferedPage {
        private final String cursor;
        private final List<QueryRow> rows;
        private final String continuation;
        private int offset;

        private BufferedPage(String cursor, List<QueryRow> rows, String continuation, int offset) {
            this.cursor = cursor;
            this.rows = rows;
            this.continuation = continuation;
            this.offset = offset;
        }
    }
}
