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
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.shardline.BadRequestException;
import com.shardline.internal.JSONUtil;
import com.shardline.partition.FetchContext;
import com.shardline.partition.KeyRange;
import com.shardline.partition.PartitionCursor;
import com.shardline.partition.PartitionFetcher;
import com.shardline.token.StateReader;
import com.shardline.value.Value;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * Base class of the source stages that read partitions directly. Creates the partition
 * fetchers, either fresh from the target ranges or from the cursors saved in a continuation
 * token, and saves the cursors of the partitions that are not drained.
 */
public abstract class AbstractMergeStage implements PipelineStage {
    protected static final String CURSORS = "cursors";

    protected final PipelineContext context;
    protected final FetchContext fetchContext;
    private final Comparator<List<Value>> orderByItemsComparator;
    private final List<PartitionCursor> startCursors;

    /**
     * @throws BadRequestException if the saved state refers to ranges outside of the target ranges
     */
    protected AbstractMergeStage(PipelineContext context,
                                 @Nullable Comparator<List<Value>> orderByItemsComparator,
                                 @Nullable JsonNode initialState) {
        this.context = context;
        this.fetchContext = context.fetchContext();
        this.orderByItemsComparator = orderByItemsComparator;
        this.startCursors = startCursors(initialState);
    }

    private List<PartitionCursor> startCursors(@Nullable JsonNode initialState) {
        List<PartitionCursor> cursors = new ArrayList<>();
        if (initialState == null) {
            for (KeyRange range : context.targetRanges()) {
                cursors.add(PartitionCursor.start(range));
            }
        } else {
            for (JsonNode node : StateReader.requireArray(initialState, CURSORS)) {
                PartitionCursor cursor = PartitionCursor.fromJson(node);
                if (!context.isTarget(cursor.range())) {
                    throw new BadRequestException(String.format(
                            "Continuation token range %s is outside of the query's target ranges", cursor.range()));
                }
                cursors.addAll(fetchContext.resolve(cursor));
            }
        }
        cursors.sort(Comparator.comparing(PartitionCursor::range));
        return cursors;
    }

    /**
     * Creates one fetcher per partition that still has rows, ordered by key range.
     */
    protected List<PartitionFetcher> createFetchers() {
        List<PartitionFetcher> fetchers = new ArrayList<>(startCursors.size());
        for (PartitionCursor cursor : startCursors) {
            fetchers.add(newFetcher(cursor));
        }
        return fetchers;
    }

    protected PartitionFetcher newFetcher(PartitionCursor cursor) {
        return new PartitionFetcher(fetchContext, cursor, orderByItemsComparator);
    }

    protected ObjectNode saveCursors(Collection<PartitionFetcher> fetchers) {
        List<PartitionCursor> cursors = new ArrayList<>(fetchers.size());
        for (PartitionFetcher fetcher : fetchers) {
            if (!fetcher.isDrained()) {
                cursors.add(fetcher.position());
            }
        }
        cursors.sort(Comparator.comparing(PartitionCursor::range));

        ObjectNode state = JSONUtil.objectMapper.createObjectNode();
        ArrayNode array = state.putArray(CURSORS);
        for (PartitionCursor cursor : cursors) {
            array.add(cursor.toJson());
        }
        return state;
    }

    protected void prefetchAll(Collection<PartitionFetcher> fetchers) {
        for (PartitionFetcher fetcher : fetchers) {
            fetcher.prefetch();
        }
    }

    @Override
    public void close() {
        fetchContext.cancel();
    }
}
