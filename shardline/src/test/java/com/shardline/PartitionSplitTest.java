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

import com.shardline.partition.KeyRange;
import com.shardline.pipeline.OrderByRowComparator;
import com.shardline.plan.DistributionPlan;
import com.shardline.plan.OrderByColumn;
import com.shardline.testing.InMemoryCollection;
import com.shardline.testing.PartitionQueries;
import com.shardline.value.ObjectValue;
import com.shardline.value.Value;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class PartitionSplitTest extends BaseQueryEngineTest {
    private static final int DOCUMENT_COUNT = 80;

    private final DistributionPlan unordered = DistributionPlan.builder()
            .selectValue(true)
            .queryText("SELECT VALUE c.id FROM c")
            .build();
    private final DistributionPlan ordered = DistributionPlan.builder()
            .orderBy(OrderByColumn.asc("id"))
            .selectValue(true)
            .queryText("SELECT VALUE c.id FROM c ORDER BY c.id")
            .build();
    private List<ObjectValue> bodies;
    private List<Value> ids;

    @BeforeEach
    public void setup() {
        bodies = new ArrayList<>();
        ids = new ArrayList<>();
        for (int i = 0; i < DOCUMENT_COUNT; i++) {
            bodies.add(doc("id", number(i)));
            ids.add(number(i));
        }
    }

    private InMemoryCollection unorderedCollection() {
        return InMemoryCollection.create(2)
                .addAll(bodies)
                .maxPageSize(4)
                .query(PartitionQueries.select(body -> body.get("id")));
    }

    private InMemoryCollection orderedCollection() {
        return InMemoryCollection.create(2)
                .addAll(bodies)
                .maxPageSize(4)
                .query(PartitionQueries.orderBy(List.of("id"), body -> body.get("id")), new OrderByRowComparator(ordered.orderBy()));
    }

    @Test
    void test_split_during_unordered_query() {
        InMemoryCollection collection = unorderedCollection();
        collection.splitAfterFetches("p0", 2);
        QueryEngine engine = newEngine(collection);

        List<Value> items = drain(engine, unordered, QueryRequestOptions.builder().maxItemCount(5).build());
        assertThat(items).containsExactlyInAnyOrderElementsOf(ids);
        assertEquals(3, collection.partitions().size());
    }

    @Test
    void test_split_during_order_by_query() {
        InMemoryCollection collection = orderedCollection();
        collection.splitAfterFetches("p1", 1);
        QueryEngine engine = newEngine(collection);

        List<Value> items = drain(engine, ordered, QueryRequestOptions.builder().maxItemCount(6).build());
        assertEquals(ids, items);
        assertEquals(3, collection.partitions().size());
    }

    @Test
    void test_repeated_splits_during_order_by_query() {
        InMemoryCollection collection = orderedCollection();
        collection.splitAfterFetches("p0", 1);
        collection.splitAfterFetches("p1", 3);
        QueryEngine engine = newEngine(collection);

        List<Value> items = drainWithTokens(engine, ordered, QueryRequestOptions.builder().maxItemCount(3).build());
        assertEquals(ids, items);
    }

    private List<Value> resumeAfterSplit(InMemoryCollection collection, DistributionPlan plan, int maxItemCount) {
        QueryEngine engine = newEngine(collection);
        QueryRequestOptions options = QueryRequestOptions.builder().maxItemCount(maxItemCount).build();

        List<Value> items = new ArrayList<>();
        String token;
        try (QueryIterator iterator = engine.execute(QueryRequest.builder(plan).options(options).build())) {
            QueryResponse response = iterator.next();
            items.addAll(response.items());
            token = response.continuationToken();
        }
        assertNotNull(token);

        for (KeyRange partition : collection.partitions()) {
            collection.split(partition.partitionId());
        }
        assertEquals(4, collection.partitions().size());

        while (token != null) {
            QueryRequest request = QueryRequest.builder(plan).options(options).continuationToken(token).build();
            try (QueryIterator iterator = engine.execute(request)) {
                QueryResponse response = iterator.next();
                items.addAll(response.items());
                token = response.continuationToken();
            }
        }
        return items;
    }

    @Test
    void test_resume_unordered_token_after_split() {
        List<Value> items = resumeAfterSplit(unorderedCollection(), unordered, 7);
        assertThat(items).containsExactlyInAnyOrderElementsOf(ids);
    }

    @Test
    void test_resume_order_by_token_after_split() {
        List<Value> items = resumeAfterSplit(orderedCollection(), ordered, 7);
        assertEquals(ids, items);
    }

    private static String nextPage(QueryEngine engine, DistributionPlan plan, QueryRequestOptions options,
                                   String token, List<Value> items) {
        QueryRequest request = QueryRequest.builder(plan).options(options).continuationToken(token).build();
        try (QueryIterator iterator = engine.execute(request)) {
            QueryResponse response = iterator.next();
            items.addAll(response.items());
            return response.continuationToken();
        }
    }

    private static void splitAll(InMemoryCollection collection) {
        for (KeyRange partition : collection.partitions()) {
            collection.split(partition.partitionId());
        }
    }

    @Test
    void test_resume_unordered_token_after_consecutive_splits() {
        InMemoryCollection collection = unorderedCollection();
        QueryEngine engine = newEngine(collection);
        QueryRequestOptions single = QueryRequestOptions.builder().maxItemCount(1).build();

        List<Value> items = new ArrayList<>();
        String token = nextPage(engine, unordered, single, null, items);
        assertNotNull(token);

        splitAll(collection);
        token = nextPage(engine, unordered, single, token, items);
        assertNotNull(token);

        // children that have not delivered a row yet are split once more
        splitAll(collection);
        assertEquals(8, collection.partitions().size());

        QueryRequestOptions options = QueryRequestOptions.builder().maxItemCount(5).build();
        while (token != null) {
            token = nextPage(engine, unordered, options, token, items);
        }
        assertThat(items).containsExactlyInAnyOrderElementsOf(ids);
    }

    @Test
    void test_resume_order_by_token_after_consecutive_splits() {
        InMemoryCollection collection = orderedCollection();
        QueryEngine engine = newEngine(collection);
        QueryRequestOptions single = QueryRequestOptions.builder().maxItemCount(1).build();

        List<Value> items = new ArrayList<>();
        String token = nextPage(engine, ordered, single, null, items);
        splitAll(collection);
        token = nextPage(engine, ordered, single, token, items);
        splitAll(collection);

        QueryRequestOptions options = QueryRequestOptions.builder().maxItemCount(5).build();
        while (token != null) {
            token = nextPage(engine, ordered, options, token, items);
        }
        assertEquals(ids, items);
    }

    @Test
    void test_token_outside_of_the_feed_range() {
        InMemoryCollection collection = unorderedCollection();
        QueryEngine engine = newEngine(collection);
        QueryRequestOptions options = QueryRequestOptions.builder().maxItemCount(1).build();
        String token;
        try (QueryIterator iterator = engine.execute(QueryRequest.builder(unordered).options(options).build())) {
            token = iterator.next().continuationToken();
        }
        assertNotNull(token);

        KeyRange narrow = KeyRange.of(KeyRange.MIN_KEY, "0001");
        QueryRequest request = QueryRequest.builder(unordered)
                .feedRange(narrow)
                .options(options)
                .continuationToken(token)
                .build();
        assertThrows(BadRequestException.class, () -> engine.execute(request));
    }
}
