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
import com.shardline.token.StateReader;
import com.shardline.value.NumberValue;
import com.shardline.value.Value;
import com.shardline.value.Values;

import javax.annotation.Nullable;
import java.util.List;

/**
 * Counts the rows of its source, typically the output of an unordered DISTINCT, and emits the
 * count as a single row. Consumes one source page per call so the count can be suspended.
 */
public class DCountStage extends DelegatingStage {
    private static final String COUNT = "count";

    private final String alias;
    private final boolean selectValue;
    private long count;
    private boolean emitted;

    private DCountStage(PipelineStage source, String alias, boolean selectValue, long count) {
        super(source);
        this.alias = alias;
        this.selectValue = selectValue;
        this.count = count;
    }

    public static DCountStage create(PipelineStage source, String alias, boolean selectValue, @Nullable JsonNode state) {
        long count = state == null ? 0 : StateReader.requireLong(state, COUNT);
        return new DCountStage(source, alias, selectValue, count);
    }

    @Override
    public List<QueryRow> nextPage(int maxItemCount) {
        if (emitted) {
            return List.of();
        }
        if (source.hasMoreResults()) {
            count += source.nextPage(maxItemCount).size();
        }
        if (source.hasMoreResults()) {
            return List.of();
        }
        emitted = true;
        Value result = new NumberValue(count);
        return List.of(QueryRow.of(selectValue ? result : Values.object(alias, result)));
    }

    @Override
    public boolean hasMoreResults() {
        return !emitted;
    }

    @Override
    public ObjectNode saveState() {
        ObjectNode state = newState();
        state.put(COUNT, count);
        return state;
    }
}
