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

import com.shardline.plan.DistributionPlan;
import com.shardline.testing.InMemoryCollection;
import com.shardline.value.NumberValue;
import com.shardline.value.ObjectValue;
import com.shardline.value.Value;
import com.shardline.value.Values;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigValueFactory;
import org.junit.jupiter.api.AfterEach;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Base class of the query tests: creates engines over in-memory collections and drains
 * queries, checking the page size contract on every page.
 */
public abstract class BaseQueryEngineTest {
    private final List<QueryEngine> engines = new ArrayList<>();

    protected Config loadConfig() {
        return ConfigFactory.load("test.conf");
    }

    protected Config loadConfig(String path, Object value) {
        return loadConfig().withValue(path, ConfigValueFactory.fromAnyRef(value));
    }

    protected QueryEngine newEngine(InMemoryCollection collection) {
        return newEngine(collection, loadConfig());
    }

    protected QueryEngine newEngine(InMemoryCollection collection, Config config) {
        QueryEngine engine = new QueryEngine(QueryEngineConfig.load(config), collection, collection);
        engines.add(engine);
        return engine;
    }

    @AfterEach
    public void tearDown() {
        for (QueryEngine engine : engines) {
            engine.close();
        }
        engines.clear();
    }

    private static int pageLimit(QueryEngine engine, QueryRequestOptions options) {
        return options.maxItemCount() == QueryRequestOptions.DEFAULT_MAX_ITEM_COUNT
                ? engine.getConfig().maxItemCount()
                : options.maxItemCount();
    }

    /**
     * Drains a query with a single iterator.
     */
    protected static List<Value> drain(QueryEngine engine, DistributionPlan plan, QueryRequestOptions options) {
        QueryRequest request = QueryRequest.builder(plan).options(options).build();
        List<Value> items = new ArrayList<>();
        try (QueryIterator iterator = engine.execute(request)) {
            while (iterator.hasMoreResults()) {
                QueryResponse response = iterator.next();
                assertTrue(response.size() <= pageLimit(engine, options),
                        "page of " + response.size() + " items exceeds the max item count");
                items.addAll(response.items());
            }
        }
        return items;
    }

    protected static List<Value> drain(QueryEngine engine, DistributionPlan plan) {
        return drain(engine, plan, QueryRequestOptions.defaults());
    }

    /**
     * Drains a query one page per execution, resuming every page from the previous token.
     */
    protected static List<Value> drainWithTokens(QueryEngine engine, DistributionPlan plan, QueryRequestOptions options) {
        List<Value> items = new ArrayList<>();
        String token = null;
        int executions = 0;
        do {
            QueryRequest request = QueryRequest.builder(plan)
                    .options(options)
                    .continuationToken(token)
                    .build();
            try (QueryIterator iterator = engine.execute(request)) {
                QueryResponse response = iterator.next();
                assertTrue(response.size() <= pageLimit(engine, options),
                        "page of " + response.size() + " items exceeds the max item count");
                assertNull(response.disallowContinuationReason());
                items.addAll(response.items());
                token = response.continuationToken();
                assertEquals(token != null, iterator.hasMoreResults());
            }
            executions++;
            assertTrue(executions < 10_000, "query does not terminate");
        } while (token != null);
        return items;
    }

    protected static ObjectValue doc(Object... namesAndValues) {
        return Values.object(namesAndValues);
    }

    protected static Value number(double value) {
        return new NumberValue(value);
    }

    protected static List<Value> numbers(int... values) {
        List<Value> result = new ArrayList<>(values.length);
        for (int value : values) {
            result.add(new NumberValue(value));
        }
        return result;
    }
}
