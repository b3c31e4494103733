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

package com.shardline.pipeline;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.shardline.partition.PartitionFetcher;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.PriorityQueue;

/**
 * K-way merge of partitions that each return rows sorted by the ORDER BY columns.
 * <p>
 * A heap holds every partition that has a row to deliver, keyed by that row. Ties are broken
 * by the partition's lower key bound, then by rid, so the output order does not depend on
 * fetch timing. After a row is taken, its partition re-enters the heap once its next row is
 * known, fetching a page if needed.
 */
public class OrderByMergeStage extends AbstractMergeStage {
    private final PriorityQueue<PartitionFetcher> heap;
    private boolean initialized;

    public OrderByMergeStage(PipelineContext context, @Nullable JsonNode state) {
        this(context, new OrderByRowComparator(context.plan().orderBy()), state);
    }

    private OrderByMergeStage(PipelineContext context, OrderByRowComparator comparator, @Nullable JsonNode state) {
        super(context, comparator, state);
        Comparator<PartitionFetcher> order = Comparator
                .comparing((PartitionFetcher fetcher) -> fetcher.peek().orderByItems(), comparator)
                .thenComparing(fetcher -> fetcher.range().minInclusive())
                .thenComparing(fetcher -> fetcher.peek().rid());
        this.heap = new PriorityQueue<>(order);
    }

    private void initialize() {
        if (initialized) {
            return;
        }
        initialized = true;
        List<PartitionFetcher> fetchers = createFetchers();
        prefetchAll(fetchers);
        for (PartitionFetcher fetcher : fetchers) {
            enqueue(fetcher);
        }
    }

    /**
     * Waits for the partition's next row and puts it on the heap, replacing a split partition
     * by its children.
     */
    private void enqueue(PartitionFetcher fetcher) {
        switch (fetcher.await()) {
            case READY -> heap.add(fetcher);
            case DRAINED -> fetcher.close();
            case SPLIT -> {
                List<PartitionFetcher> children = fetcher.children();
                prefetchAll(children);
                for (PartitionFetcher child : children) {
                    enqueue(child);
                }
            }
        }
    }

    @Override
    public List<QueryRow> nextPage(int maxItemCount) {
        initialize();
        List<QueryRow> rows = new ArrayList<>(Math.min(maxItemCount, 1024));
        while (rows.size() < maxItemCount && !heap.isEmpty()) {
            PartitionFetcher winner = heap.poll();
            rows.add(winner.poll());
            winner.prefetch();
            enqueue(winner);
        }
        prefetchAll(heap);
        return rows;
    }

    @Override
    public boolean hasMoreResults() {
        return !initialized || !heap.isEmpty();
    }

    @Override
    public ObjectNode saveState() {
        initialize();
        return saveCursors(new ArrayList<>(heap));
    }
}
