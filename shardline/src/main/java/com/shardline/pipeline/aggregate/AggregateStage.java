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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.shardline.MalformedContinuationTokenException;
import com.shardline.pipeline.DelegatingStage;
import com.shardline.pipeline.PipelineStage;
import com.shardline.pipeline.QueryRow;
import com.shardline.plan.AggregateSpec;
import com.shardline.plan.DistributionPlan;
import com.shardline.token.StateReader;
import com.shardline.value.ObjectValue;
import com.shardline.value.Value;

import javax.annotation.Nullable;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregates without GROUP BY: every partition contributes partial aggregates to a single
 * implicit group.
 * <p>
 * One source page is consumed per call and an empty page is returned until the source is
 * drained, so the accumulators can be written into a continuation token between calls. The
 * final page holds one row: the aggregate value for SELECT VALUE (no row when undefined), or an
 * object with the defined aliases.
 */
public class AggregateStage extends DelegatingStage {
    private static final String AGGREGATES = "aggregates";

    private final boolean selectValue;
    private final Map<String, Accumulator> accumulators;
    private boolean emitted;

    private AggregateStage(PipelineStage source, boolean selectValue, Map<String, Accumulator> accumulators) {
        super(source);
        this.selectValue = selectValue;
        this.accumulators = accumulators;
    }

    public static AggregateStage create(PipelineStage source, DistributionPlan plan, @Nullable JsonNode state) {
        JsonNode saved = state == null ? null : StateReader.requireObject(state, AGGREGATES);
        Map<String, Accumulator> accumulators = new LinkedHashMap<>();
        for (AggregateSpec aggregate : plan.aggregates()) {
            if (saved == null) {
                accumulators.put(aggregate.alias(), Accumulator.create(aggregate.operator()));
                continue;
            }
            JsonNode node = saved.get(aggregate.alias());
            if (node == null) {
                throw new MalformedContinuationTokenException("missing state of aggregate " + aggregate.alias());
            }
            accumulators.put(aggregate.alias(), Accumulator.restore(AccumulatorState.fromJson(node, aggregate.operator())));
        }
        return new AggregateStage(source, plan.isSelectValue(), accumulators);
    }

    @Override
    public List<QueryRow> nextPage(int maxItemCount) {
        if (emitted) {
            return List.of();
        }
        if (source.hasMoreResults()) {
            for (QueryRow row : source.nextPage(maxItemCount)) {
                merge(row.payload());
            }
        }
        if (source.hasMoreResults()) {
            return List.of();
        }
        emitted = true;
        Value result = result();
        return result.isDefined() ? List.of(QueryRow.of(result)) : List.of();
    }

    private void merge(Value payload) {
        if (!(payload instanceof ObjectValue object)) {
            throw new IllegalStateException("Partial aggregates must be an object keyed by alias, got " + payload.type());
        }
        for (Map.Entry<String, Accumulator> entry : accumulators.entrySet()) {
            entry.getValue().add(object.get(entry.getKey()));
        }
    }

    private Value result() {
        if (selectValue) {
            return accumulators.values().iterator().next().result();
        }
        Map<String, Value> properties = new LinkedHashMap<>();
        for (Map.Entry<String, Accumulator> entry : accumulators.entrySet()) {
            Value value = entry.getValue().result();
            if (value.isDefined()) {
                properties.put(entry.getKey(), value);
            }
        }
        return new ObjectValue(properties);
    }

    @Override
    public boolean hasMoreResults() {
        return !emitted;
    }

    @Override
    public ObjectNode saveState() {
        ObjectNode state = newState();
        ObjectNode aggregates = state.putObject(AGGREGATES);
        accumulators.forEach((alias, accumulator) -> aggregates.set(alias, accumulator.state().toJson()));
        return state;
    }
}
