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

import com.shardline.partition.FetchContext;
import com.shardline.partition.KeyRange;
import com.shardline.plan.DistributionPlan;

import java.util.List;

/**
 * Everything the stages of one query share: the plan, the target key ranges and the
 * partition fetch resources.
 *
 * @param plan         the distribution plan
 * @param targetRanges ranges the query targets, ordered and clipped to the requested span
 * @param fetchContext partition fetch resources
 */
public record PipelineContext(DistributionPlan plan, List<KeyRange> targetRanges, FetchContext fetchContext) {
    public PipelineContext {
        targetRanges = List.copyOf(targetRanges);
    }

    /**
     * Returns true if the key range lies within the span the query targets. Ranges saved in a
     * continuation token may have been split or merged since, so they are checked against the
     * whole span rather than against individual partitions.
     *
     * @param range a range read from a continuation token
     * @return whether the range belongs to this query
     */
    public boolean isTarget(KeyRange range) {
        if (targetRanges.isEmpty()) {
            return false;
        }
        String min = targetRanges.get(0).minInclusive();
        String max = targetRanges.get(targetRanges.size() - 1).maxExclusive();
        return min.compareTo(range.minInclusive()) <= 0 && range.maxExclusive().compareTo(max) <= 0;
    }
}
