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
import com.shardline.internal.RoundRobin;
import com.shardline.partition.PartitionFetcher;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.List;

/**
 * Concatenates partition outputs without any cross-partition ordering.
 * <p>
 * Partitions with buffered rows are served in round-robin order so that TOP without ORDER BY
 * draws from every partition. The stage only blocks when no partition has a buffered row and
 * it has not produced anything yet; then it waits for the lowest partition still producing.
 */
public class UnorderedMergeStage extends AbstractMergeStage {
    private final List<PartitionFetcher> active = new ArrayList<>();
    private RoundRobin<PartitionFetcher> scheduler;
    private boolean initialized;

    public UnorderedMergeStage(PipelineContext context, @Nullable JsonNode state) {
        super(context, null, state);
    }

    private void initialize() {
        if (initialized) {
            return;
        }
        initialized = true;
        active.addAll(createFetchers());
        scheduler = new RoundRobin<>(active);
        prefetchAll(active);
    }

    @Override
    public List<QueryRow> nextPage(int maxItemCount) {
        initialize();
        List<QueryRow> rows = new ArrayList<>();
        while (rows.size() < maxItemCount && !active.isEmpty()) {
            PartitionFetcher ready = nextReady();
            if (ready == null) {
                if (!rows.isEmpty()) {
                    break;
                }
                PartitionFetcher first = active.get(0);
                settle(first, first.await());
                continue;
            }
            while (rows.size() < maxItemCount && ready.isReady()) {
                rows.add(ready.poll());
            }
            ready.prefetch();
        }
        prune();
        prefetchAll(active);
        return rows;
    }

    @Nullable
    private PartitionFetcher nextReady() {
        for (int i = 0; i < scheduler.size(); i++) {
            PartitionFetcher candidate = scheduler.next();
            if (candidate.isReady()) {
                return candidate;
            }
        }
        return null;
    }

    private void settle(PartitionFetcher fetcher, PartitionFetcher.State state) {
        switch (state) {
            case READY -> {
            }
            case DRAINED -> {
                fetcher.close();
                active.remove(fetcher);
                scheduler.remove(fetcher);
            }
            case SPLIT -> {
                List<PartitionFetcher> children = split(fetcher);
                int index = active.indexOf(fetcher);
                active.remove(index);
                active.addAll(index, children);
                scheduler.replace(fetcher, children);
                prefetchAll(children);
            }
        }
    }

    protected List<PartitionFetcher> split(PartitionFetcher fetcher) {
        return fetcher.children();
    }

    /**
     * Removes partitions that are known to be drained or split without blocking.
     */
    private void prune() {
        for (PartitionFetcher fetcher : new ArrayList<>(active)) {
            PartitionFetcher.State state = fetcher.tryState();
            if (state != null && state != PartitionFetcher.State.READY) {
                settle(fetcher, state);
            }
        }
    }

    @Override
    public boolean hasMoreResults() {
        return !initialized || !active.isEmpty();
    }

    @Override
    public ObjectNode saveState() {
        initialize();
        return saveCursors(active);
    }
}
