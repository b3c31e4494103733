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

package com.shardline;

import com.shardline.plan.AggregateOperator;
import com.shardline.plan.AggregateSpec;
import com.shardline.plan.DistributionPlan;
import com.shardline.plan.GroupByColumn;
import com.shardline.testing.InMemoryCollection;
import com.shardline.testing.PartitionQueries;
import com.shardline.value.ObjectValue;
import com.shardline.value.Value;
import com.shardline.value.Values;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class GroupByQueryTest extends BaseQueryEngineTest {
    private static final List<ObjectValue> PEOPLE = List.of(
            doc("age", number(11), "name", Values.of("John")),
            doc("age", number(11), "name", Values.of("Mary")),
            doc("age", number(13), "name", Values.of("John"))
    );

    private final DistributionPlan countByAge = DistributionPlan.builder()
            .groupBy(new GroupByColumn("c.age", "age"))
            .aggregate(AggregateOperator.COUNT, null, "count")
            .queryText("SELECT c.age, COUNT(1) AS count FROM c GROUP BY c.age")
            .build();

    private QueryEngine engine(DistributionPlan plan, List<ObjectValue> bodies, List<String> fields, int partitions) {
        List<String> aliases = new ArrayList<>();
        for (GroupByColumn column : plan.groupBy()) {
            aliases.add(column.alias());
        }
        InMemoryCollection collection = InMemoryCollection.create(partitions)
                .addAll(bodies)
                .query(PartitionQueries.groupBy(fields, aliases, plan.aggregates().toArray(new AggregateSpec[0])));
        return newEngine(collection);
    }

    @Test
    void test_count_by_age() {
        QueryEngine engine = engine(countByAge, PEOPLE, List.of("age"), 3);
        List<Value> items = drain(engine, countByAge);
        assertThat(items).containsExactlyInAnyOrder(
                Values.object("age", number(11), "count", number(2)),
                Values.object("age", number(13), "count", number(1))
        );
    }

    @ParameterizedTest
    @ValueSource(ints = {1, 2, 10, -1})
    void test_continuation_tokens_are_rejected(int maxItemCount) {
        QueryEngine engine = engine(countByAge, PEOPLE, List.of("age"), 3);
        QueryRequestOptions.Builder builder = QueryRequestOptions.builder();
        if (maxItemCount > 0) {
            builder.maxItemCount(maxItemCount);
        }
        QueryRequestOptions options = builder.build();

        try (QueryIterator iterator = engine.execute(QueryRequest.builder(countByAge).options(options).build())) {
            QueryResponse response = iterator.next();
            assertNull(response.continuationToken());
            if (iterator.hasMoreResults()) {
                assertNotNull(response.disallowContinuationReason());
            }
        }

        DistributionPlan unordered = DistributionPlan.builder().queryText("SELECT * FROM c").build();
        String token;
        try (QueryIterator iterator = engine.execute(QueryRequest.builder(unordered)
                .options(QueryRequestOptions.builder().maxItemCount(1).build())
                .build())) {
            token = iterator.next().continuationToken();
        }
        assertNotNull(token);

        for (String candidate : List.of(token, "garbage")) {
            QueryRequest resumed = QueryRequest.builder(countByAge)
                    .options(options)
                    .continuationToken(candidate)
                    .build();
            BadRequestException exception = assertThrows(BadRequestException.class, () -> engine.execute(resumed));
            assertFalse(exception.isRetryable());
        }
    }

    @Test
    void test_groups_are_paged_without_tokens() {
        List<ObjectValue> bodies = new ArrayList<>();
        for (int i = 0; i < 100; i++) {
            bodies.add(doc("bucket", number(i % 10), "x", number(i)));
        }
        DistributionPlan plan = DistributionPlan.builder()
                .groupBy(new GroupByColumn("c.bucket", "bucket"))
                .aggregate(AggregateOperator.SUM, "x", "total")
                .aggregate(AggregateOperator.MAX, "x", "highest")
                .queryText("SELECT c.bucket, SUM(c.x) AS total, MAX(c.x) AS highest FROM c GROUP BY c.bucket")
                .build();
        QueryEngine engine = engine(plan, bodies, List.of("bucket"), 4);

        List<Value> expected = new ArrayList<>();
        for (int bucket = 0; bucket < 10; bucket++) {
            int total = 0;
            for (int i = bucket; i < 100; i += 10) {
                total += i;
            }
            expected.add(Values.object("bucket", number(bucket), "total", number(total), "highest", number(90 + bucket)));
        }
        List<Value> items = drain(engine, plan, QueryRequestOptions.builder().maxItemCount(3).build());
        assertThat(items).containsExactlyInAnyOrderElementsOf(expected);
    }

    @Test
    void test_select_value_group_key() {
        DistributionPlan plan = DistributionPlan.builder()
                .groupBy(new GroupByColumn("c.name", "name"))
                .selectValue(true)
                .queryText("SELECT VALUE c.name FROM c GROUP BY c.name")
                .build();
        QueryEngine engine = engine(plan, PEOPLE, List.of("name"), 2);
        assertThat(drain(engine, plan)).containsExactlyInAnyOrder(Values.of("John"), Values.of("Mary"));
    }

    @Test
    void test_missing_group_key_forms_its_own_group() {
        List<ObjectValue> bodies = new ArrayList<>(PEOPLE);
        bodies.add(doc("name", Values.of("Anonymous")));
        QueryEngine engine = engine(countByAge, bodies, List.of("age"), 3);
        assertThat(drain(engine, countByAge)).containsExactlyInAnyOrder(
                Values.object("age", number(11), "count", number(2)),
                Values.object("age", number(13), "count", number(1)),
                Values.object("count", number(1))
        );
    }
}
