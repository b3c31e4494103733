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

import com.shardline.common.ErrorPrefix;
import com.shardline.pipeline.OrderByRowComparator;
import com.shardline.plan.AggregateOperator;
import com.shardline.plan.AggregateSpec;
import com.shardline.plan.DistributionPlan;
import com.shardline.plan.OrderByColumn;
import com.shardline.testing.InMemoryCollection;
import com.shardline.testing.PartitionQueries;
import com.shardline.testing.InMemoryCollection.PartitionQuery;
import com.shardline.value.ObjectValue;
import com.shardline.value.Value;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class DirectExecutionTest extends BaseQueryEngineTest {
    private final DistributionPlan topPlan = DistributionPlan.builder()
            .orderBy(OrderByColumn.asc("n"))
            .top(3)
            .selectValue(true)
            .queryText("SELECT TOP 3 VALUE c.n FROM c ORDER BY c.n")
            .build();

    private final QueryRequestOptions direct = QueryRequestOptions.builder()
            .optimisticDirectExecution(true)
            .build();

    private static List<ObjectValue> bodies(int count) {
        List<ObjectValue> bodies = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            bodies.add(doc("n", number(i)));
        }
        Collections.shuffle(bodies, new Random(7));
        return bodies;
    }

    private InMemoryCollection topCollection(int partitions) {
        OrderByRowComparator comparator = new OrderByRowComparator(topPlan.orderBy());
        PartitionQuery ordered = PartitionQueries.orderBy(List.of("n"), body -> body.get("n"));
        return InMemoryCollection.create(partitions)
                .addAll(bodies(10))
                .query(ordered, comparator)
                .directQuery(PartitionQueries.top(ordered, comparator, 3));
    }

    @Test
    void test_single_partition_executes_the_whole_query() {
        InMemoryCollection collection = topCollection(1);
        QueryEngine engine = newEngine(collection);

        assertEquals(numbers(0, 1, 2), drain(engine, topPlan, direct));
        assertTrue(collection.directFetches() > 0);
    }

    @Test
    void test_enabled_by_configuration() {
        InMemoryCollection collection = topCollection(1);
        QueryEngine engine = newEngine(collection, loadConfig("query.optimistic_direct_execution", true));

        assertEquals(numbers(0, 1, 2), drain(engine, topPlan));
        assertTrue(collection.directFetches() > 0);
    }

    @Test
    void test_resume_direct_execution_from_token() {
        InMemoryCollection collection = topCollection(1);
        QueryEngine engine = newEngine(collection);
        QueryRequestOptions options = QueryRequestOptions.builder()
                .optimisticDirectExecution(true)
                .maxItemCount(1)
                .build();

        assertEquals(numbers(0, 1, 2), drainWithTokens(engine, topPlan, options));
        assertEquals(collection.fetches(), collection.directFetches());
    }

    @Test
    void test_multiple_partitions_are_merged() {
        InMemoryCollection collection = topCollection(3);
        QueryEngine engine = newEngine(collection);

        assertEquals(numbers(0, 1, 2), drain(engine, topPlan, direct));
        assertEquals(0, collection.directFetches());
    }

    @Test
    void test_request_override_disables_direct_execution() {
        InMemoryCollection collection = topCollection(1);
        QueryEngine engine = newEngine(collection, loadConfig("query.optimistic_direct_execution", true));
        QueryRequestOptions options = QueryRequestOptions.builder()
                .optimisticDirectExecution(false)
                .build();

        assertEquals(numbers(0, 1, 2), drain(engine, topPlan, options));
        assertEquals(0, collection.directFetches());
    }

    @Test
    void test_aggregates_are_not_executed_directly() {
        DistributionPlan plan = DistributionPlan.builder()
                .aggregate(AggregateOperator.COUNT, null, "$1")
                .selectValue(true)
                .queryText("SELECT VALUE COUNT(1) FROM c")
                .build();
        InMemoryCollection collection = InMemoryCollection.create(1)
                .addAll(bodies(10))
                .query(PartitionQueries.aggregate(body -> true, plan.aggregates().toArray(new AggregateSpec[0])));
        QueryEngine engine = newEngine(collection);

        assertEquals(numbers(10), drain(engine, plan, direct));
        assertEquals(0, collection.directFetches());
    }

    @Test
    void test_direct_token_is_rejected_by_a_merged_execution() {
        InMemoryCollection collection = topCollection(1);
        QueryEngine engine = newEngine(collection);
        QueryRequestOptions options = QueryRequestOptions.builder()
                .optimisticDirectExecution(true)
                .maxItemCount(1)
                .build();

        String token;
        try (QueryIterator iterator = engine.execute(QueryRequest.builder(topPlan).options(options).build())) {
            token = iterator.next().continuationToken();
        }
        assertNotNull(token);

        QueryRequest merged = QueryRequest.builder(topPlan)
                .options(QueryRequestOptions.builder().optimisticDirectExecution(false).maxItemCount(1).build())
                .continuationToken(token)
                .build();
        assertThrows(BadRequestException.class, () -> engine.execute(merged));
    }

    @Test
    void test_split_during_direct_execution_is_retryable() {
        InMemoryCollection collection = topCollection(1);
        String partitionId = collection.partitions().get(0).partitionId();
        collection.splitAfterFetches(partitionId, 1);
        QueryEngine engine = newEngine(collection);
        QueryRequestOptions options = QueryRequestOptions.builder()
                .optimisticDirectExecution(true)
                .maxItemCount(1)
                .build();

        try (QueryIterator iterator = engine.execute(QueryRequest.builder(topPlan).options(options).build())) {
            List<Value> first = iterator.next().items();
            assertEquals(numbers(0), first);

            PartitionFetchException exception = assertThrows(PartitionFetchException.class, iterator::next);
            assertTrue(exception.isRetryable());
            assertEquals(ErrorPrefix.TRANSIENT, exception.getPrefix());
            assertTrue(exception.getMessage().contains("SELECT TOP 3 VALUE c.n FROM c ORDER BY c.n"));
        }
        assertEquals(2, collection.partitions().size());

        // a fresh execution over the two children merges them
        assertEquals(numbers(0, 1, 2), drain(engine, topPlan, direct));
    }
}
