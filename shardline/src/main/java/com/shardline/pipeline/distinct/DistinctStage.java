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

package com.shardline.pipeline.distinct;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.shardline.pipeline.DelegatingStage;
import com.shardline.pipeline.PipelineStage;
import com.shardline.pipeline.QueryRow;
import com.shardline.plan.DistinctType;
import com.shardline.token.StateReader;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.List;

/**
 * Drops rows whose payload was already emitted.
 */
public class DistinctStage extends DelegatingStage {
    private static final String DISTINCT = "distinct";

    private final DistinctMap distinctMap;

    private DistinctStage(PipelineStage source, DistinctMap distinctMap) {
        super(source);
        this.distinctMap = distinctMap;
    }

    public static DistinctStage create(PipelineStage source, DistinctType type, @Nullable JsonNode state) {
        JsonNode mapState = state == null ? null : StateReader.requireObject(state, DISTINCT);
        return new DistinctStage(source, DistinctMap.create(type, mapState));
    }

    @Override
    public List<QueryRow> nextPage(int maxItemCount) {
        List<QueryRow> rows = source.nextPage(maxItemCount);
        List<QueryRow> distinct = new ArrayList<>(rows.size());
        for (QueryRow row : rows) {
            if (distinctMap.add(row.payload())) {
                distinct.add(row);
            }
        }
        return distinct;
    }

    @Override
    public ObjectNode saveState() {
        ObjectNode state = newState();
        state.set(DISTINCT, distinctMap.saveState());
        return state;
    }
}
