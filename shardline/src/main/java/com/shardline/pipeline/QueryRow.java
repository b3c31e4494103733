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

import com.shardline.value.UndefinedValue;
import com.shardline.value.Value;

import javax.annotation.Nullable;
import java.util.List;
import java.util.Objects;

/**
 * A row produced by a partition or by a merge stage.
 *
 * @param rid             stable document identifier inside its partition
 * @param epk             effective partition key of the document, null when unknown
 * @param orderByItems    evaluated ORDER BY expressions, one per column
 * @param groupByItems    evaluated GROUP BY expressions, one per column
 * @param componentScores hybrid search scores, one per component
 * @param payload         the projected value, or the partial aggregates keyed by alias
 */
public record QueryRow(String rid,
                       @Nullable String epk,
                       List<Value> orderByItems,
                       List<Value> groupByItems,
                       List<Value> componentScores,
                       Value payload) {
    public QueryRow {
        Objects.requireNonNull(rid, "rid");
        orderByItems = List.copyOf(orderByItems);
        groupByItems = List.copyOf(groupByItems);
        componentScores = List.copyOf(componentScores);
        Objects.requireNonNull(payload, "payload");
    }

    /**
     * Creates a row that only carries a payload, as emitted by aggregating stages.
     *
     * @param payload the value
     * @return a new row
     */
    public static QueryRow of(Value payload) {
        return new QueryRow("", null, List.of(), List.of(), List.of(), payload);
    }

    public static QueryRow of(String rid, Value payload) {
        return new QueryRow(rid, null, List.of(), List.of(), List.of(), payload);
    }

    public static QueryRow undefined(String rid) {
        return of(rid, UndefinedValue.INSTANCE);
    }

    public QueryRow withEpk(String epk) {
        return new QueryRow(rid, epk, orderByItems, groupByItems, componentScores, payload);
    }

    public QueryRow withOrderByItems(List<Value> items) {
        return new QueryRow(rid, epk, items, groupByItems, componentScores, payload);
    }

    public QueryRow withGroupByItems(List<Value> items) {
        return new QueryRow(rid, epk, orderByItems, items, componentScores, payload);
    }

    public QueryRow withComponentScores(List<Value> scores) {
        return new QueryRow(rid, epk, orderByItems, groupByItems, scores, payload);
    }
}
