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

package com.shardline.pipeline.aggregate;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.shardline.pipeline.DelegatingStage;
import com.shardline.pipeline.PipelineStage;
import com.shardline.pipeline.QueryRow;
import com.shardline.plan.DistributionPlan;
import com.shardline.value.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * GROUP BY: drains every partition into a {@link GroupingTable}, then returns one row per group
 * in pages of at most the requested size.
 * <p>
 * The grouping table is not written into continuation tokens. Paging after the drain is held
 * by the iterator, and a query of this shape can never be resumed from a token.
 */
public class GroupByStage extends DelegatingStage {
    public static final String DISALLOW_CONTINUATION_REASON = "GROUP BY queries cannot be resumed with a continuation token";
    private static final Logger LOGGER = LoggerFactory.getLogger(GroupByStage.class);

    private final GroupingTable table;
    private List<QueryRow> results;
    private int position;

    public GroupByStage(PipelineStage source, DistributionPlan plan) {
        super(source);
        this.table = new GroupingTable(plan);
    }

    @Override
    public List<QueryRow> nextPage(int maxItemCount) {
        if (results == null) {
            while (source.hasMoreResults()) {
                for (QueryRow row : source.nextPage(maxItemCount)) {
                    table.add(row);
                }
            }
            List<Value> values = table.results();
            results = new ArrayList<>(values.size());
            for (Value value : values) {
                results.add(QueryRow.of(value));
            }
            LOGGER.debug("Grouped all partitions into {} groups", table.size());
        }
        int end = Math.min(results.size(), position + maxItemCount);
        List<QueryRow> page = results.subList(position, end);
        position = end;
        return page;
    }

    @Override
    public boolean hasMoreResults() {
        return results == null || position < results.size();
    }

    @Override
    public ObjectNode saveState() {
        throw new IllegalStateException(DISALLOW_CONTINUATION_REASON);
    }

    @Override
    public String disallowContinuationReason() {
        return DISALLOW_CONTINUATION_REASON;
    }
}
