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

import com.google.common.hash.HashCode;
import com.shardline.pipeline.QueryRow;
import com.shardline.plan.AggregateSpec;
import com.shardline.plan.DistributionPlan;
import com.shardline.plan.GroupByColumn;
import com.shardline.value.DistinctHash;
import com.shardline.value.ObjectValue;
import com.shardline.value.UndefinedValue;
import com.shardline.value.Value;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Groups partial rows by the canonical hash of their group-by items and merges the partial
 * aggregates of each group. Groups are emitted in first-seen order.
 * <p>
 * Partitions return one row per group they contain, with the payload an object keyed by the
 * projection aliases: group-by aliases map to the group value, aggregate aliases to the
 * partial aggregate.
 */
public class GroupingTable {
    private final DistributionPlan plan;
    private final Map<HashCode, GroupState> groups = new LinkedHashMap<>();

    public GroupingTable(DistributionPlan plan) {
        this.plan = plan;
    }

    public void add(QueryRow row) {
        if (row.groupByItems().size() != plan.groupBy().size()) {
            throw new IllegalStateException(String.format(
                    "Expected %d group-by items, got %d", plan.groupBy().size(), row.groupByItems().size()));
        }
        HashCode key = DistinctHash.of(row.groupByItems());
        GroupState group = groups.computeIfAbsent(key, (ignored) -> new GroupState(plan));
        group.merge(row.payload());
    }

    public int size() {
        return groups.size();
    }

    /**
     * Finalizes every group into its output value.
     *
     * @return one value per group, groups whose SELECT VALUE result is undefined are omitted
     */
    public List<Value> results() {
        List<Value> results = new ArrayList<>(groups.size());
        for (GroupState group : groups.values()) {
            Value result = group.result(plan);
            if (result.isDefined()) {
                results.add(result);
            }
        }
        return results;
    }

    private static final class GroupState {
        private final Map<String, Value> groupValues = new LinkedHashMap<>();
        private final Map<String, Accumulator> accumulators = new LinkedHashMap<>();
        private boolean first = true;

        private GroupState(DistributionPlan plan) {
            for (AggregateSpec aggregate : plan.aggregates()) {
                accumulators.put(aggregate.alias(), Accumulator.create(aggregate.operator()));
            }
            for (GroupByColumn column : plan.groupBy()) {
                groupValues.put(column.alias(), UndefinedValue.INSTANCE);
            }
        }

        private void merge(Value payload) {
            ObjectValue object = payload instanceof ObjectValue o ? o : new ObjectValue(Map.of());
            if (first) {
                groupValues.replaceAll((alias, ignored) -> object.get(alias));
                first = false;
            }
            for (Map.Entry<String, Accumulator> entry : accumulators.entrySet()) {
                entry.getValue().add(object.get(entry.getKey()));
            }
        }

        private Value result(DistributionPlan plan) {
            if (plan.isSelectValue()) {
                if (!accumulators.isEmpty()) {
                    return accumulators.values().iterator().next().result();
                }
                return groupValues.values().iterator().next();
            }
            Map<String, Value> properties = new LinkedHashMap<>();
            groupValues.forEach((alias, value) -> {
                if (value.isDefined()) {
                    properties.put(alias, value);
                }
            });
            accumulators.forEach((alias, accumulator) -> {
                Value value = accumulator.result();
                if (value.isDefined()) {
                    properties.put(alias, value);
                }
            });
            return new ObjectValue(properties);
        }
    }
}
