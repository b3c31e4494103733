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

package com.shardline.testing;

import com.google.common.hash.HashCode;
import com.shardline.pipeline.QueryRow;
import com.shardline.plan.AggregateSpec;
import com.shardline.testing.InMemoryCollection.Document;
import com.shardline.testing.InMemoryCollection.PartitionQuery;
import com.shardline.value.DistinctHash;
import com.shardline.value.NumberValue;
import com.shardline.value.ObjectValue;
import com.shardline.value.UndefinedValue;
import com.shardline.value.Value;
import com.shardline.value.ValueComparator;
import com.shardline.value.Values;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Partition-side query evaluation for {@link InMemoryCollection}: what a partition returns for
 * the rewritten query of each plan shape.
 */
public final class PartitionQueries {

    private PartitionQueries() {
    }

    public static PartitionQuery selectAll() {
        return select(body -> body);
    }

    public static PartitionQuery select(Function<ObjectValue, Value> projection) {
        return where(body -> true, projection);
    }

    public static PartitionQuery where(Predicate<ObjectValue> filter, Function<ObjectValue, Value> projection) {
        return documents -> {
            List<QueryRow> rows = new ArrayList<>();
            for (Document document : documents) {
                if (filter.test(document.body())) {
                    rows.add(row(document, projection.apply(document.body())));
                }
            }
            return rows;
        };
    }

    /**
     * Rows carrying the values of the given fields as order-by items.
     */
    public static PartitionQuery orderBy(List<String> fields, Function<ObjectValue, Value> projection) {
        return documents -> {
            List<QueryRow> rows = new ArrayList<>();
            for (Document document : documents) {
                List<Value> items = new ArrayList<>(fields.size());
                for (String field : fields) {
                    items.add(document.body().get(field));
                }
                rows.add(row(document, projection.apply(document.body())).withOrderByItems(items));
            }
            return rows;
        };
    }

    /**
     * The first {@code count} rows of a query in the collection's row order.
     */
    public static PartitionQuery top(PartitionQuery query, Comparator<List<Value>> orderByItemsOrder, int count) {
        Comparator<QueryRow> order = Comparator
                .comparing(QueryRow::orderByItems, orderByItemsOrder)
                .thenComparing(QueryRow::rid);
        return documents -> query.execute(documents).stream()
                .sorted(order)
                .limit(count)
                .toList();
    }

    /**
     * One row per partition holding the partial aggregates keyed by alias. Aggregate
     * expressions name a document field; a null expression counts documents.
     */
    public static PartitionQuery aggregate(Predicate<ObjectValue> filter, AggregateSpec... aggregates) {
        return documents -> {
            List<ObjectValue> matching = new ArrayList<>();
            for (Document document : documents) {
                if (filter.test(document.body())) {
                    matching.add(document.body());
                }
            }
            return List.of(QueryRow.of(partials(matching, aggregates)));
        };
    }

    /**
     * One row per group and partition. Group-by expressions name a document field.
     */
    public static PartitionQuery groupBy(List<String> fields, List<String> aliases, AggregateSpec... aggregates) {
        return documents -> {
            Map<HashCode, List<ObjectValue>> groups = new LinkedHashMap<>();
            Map<HashCode, List<Value>> keys = new LinkedHashMap<>();
            for (Document document : documents) {
                List<Value> key = new ArrayList<>(fields.size());
                for (String field : fields) {
                    key.add(document.body().get(field));
                }
                HashCode hash = DistinctHash.of(key);
                groups.computeIfAbsent(hash, (ignored) -> new ArrayList<>()).add(document.body());
                keys.putIfAbsent(hash, key);
            }

            List<QueryRow> rows = new ArrayList<>();
            for (Map.Entry<HashCode, List<ObjectValue>> group : groups.entrySet()) {
                List<Value> key = keys.get(group.getKey());
                Map<String, Value> payload = new LinkedHashMap<>();
                for (int i = 0; i < aliases.size(); i++) {
                    payload.put(aliases.get(i), key.get(i));
                }
                payload.putAll(partials(group.getValue(), aggregates).properties());
                rows.add(QueryRow.of(group.getKey().toString(), new ObjectValue(payload)).withGroupByItems(key));
            }
            return rows;
        };
    }

    /**
     * Rows carrying the given component scores for hybrid search.
     */
    public static PartitionQuery hybrid(Function<ObjectValue, List<Value>> scores, Function<ObjectValue, Value> projection) {
        return documents -> {
            List<QueryRow> rows = new ArrayList<>();
            for (Document document : documents) {
                rows.add(row(document, projection.apply(document.body())).withComponentScores(scores.apply(document.body())));
            }
            return rows;
        };
    }

    private static QueryRow row(Document document, Value payload) {
        return QueryRow.of(document.rid(), payload).withEpk(document.epk());
    }

    private static ObjectValue partials(List<ObjectValue> documents, AggregateSpec... aggregates) {
        Map<String, Value> partials = new LinkedHashMap<>();
        for (AggregateSpec aggregate : aggregates) {
            List<Value> values = new ArrayList<>();
            for (ObjectValue document : documents) {
                Value value = aggregate.expression() == null ? new NumberValue(1) : document.get(aggregate.expression());
                if (value.isDefined()) {
                    values.add(value);
                }
            }
            partials.put(aggregate.alias(), partial(aggregate, values));
        }
        return new ObjectValue(partials);
    }

    private static Value partial(AggregateSpec aggregate, List<Value> values) {
        return switch (aggregate.operator()) {
            case COUNT -> new NumberValue(values.size());
            case SUM -> {
                for (Value value : values) {
                    if (!(value instanceof NumberValue)) {
                        yield value;
                    }
                }
                yield sum(values);
            }
            case MIN -> Values.object("min", extreme(values, ValueComparator.INSTANCE), "count", new NumberValue(values.size()));
            case MAX -> Values.object("max", extreme(values, ValueComparator.INSTANCE.reversed()), "count", new NumberValue(values.size()));
            case AVG -> Values.object("sum", sum(values), "count", new NumberValue(values.size()));
        };
    }

    private static Value extreme(List<Value> values, Comparator<Value> order) {
        return values.stream().min(order).orElse(UndefinedValue.INSTANCE);
    }

    private static Value sum(List<Value> values) {
        double sum = 0;
        for (Value value : values) {
            if (!(value instanceof NumberValue number)) {
                return UndefinedValue.INSTANCE;
            }
            sum += number.value();
        }
        return new NumberValue(sum);
    }
}
