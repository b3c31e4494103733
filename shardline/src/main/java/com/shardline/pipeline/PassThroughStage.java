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
import com.shardline.PartitionFetchException;
import com.shardline.partition.PartitionFetcher;

import javax.annotation.Nullable;
import java.util.List;

/**
 * Source stage of optimistic direct execution: a single partition executes the whole query
 * and its pages are returned unchanged.
 * <p>
 * The partition applies TOP, OFFSET and ORDER BY itself, so its children cannot be merged
 * after a split; the query fails with a retryable error instead.
 */
public class PassThroughStage extends UnorderedMergeStage {

    public PassThroughStage(PipelineContext context, @Nullable JsonNode state) {
        super(context, state);
        if (context.targetRanges().size() != 1) {
            throw new IllegalStateException("Direct execution requires exactly one target partition, got "
                    + context.targetRanges().size());
        }
        if (!context.fetchContext().isDirectExecution()) {
            throw new IllegalStateException("Fetch context is not in direct execution mode");
        }
    }

    @Override
    protected List<PartitionFetcher> split(PartitionFetcher fetcher) {
        fetcher.close();
        throw PartitionFetchException.splitDuringDirectExecution(fetchContext.queryText(), fetcher.range());
    }
}
