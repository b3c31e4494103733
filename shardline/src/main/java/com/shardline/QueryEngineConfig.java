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

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import java.time.Duration;

/**
 * Process-wide settings of a {@link QueryEngine}, read from the {@code query} section of the
 * configuration. Defaults live in {@code reference.conf}.
 *
 * @param maxItemCount              default rows per response page
 * @param maxConcurrency            concurrent page fetches per query, 0 or less for automatic
 * @param maxConcurrencyCap         upper bound of automatic concurrency, also the fetcher pool size
 * @param maxBufferedItemCount      rows buffered per query before prefetching pauses
 * @param optimisticDirectExecution whether single-partition streaming queries run on the partition
 * @param fetchRetryMaxAttempts     attempts of a throttled fetch
 * @param fetchRetryWaitDuration    wait between attempts of a throttled fetch
 */
public record QueryEngineConfig(int maxItemCount,
                                int maxConcurrency,
                                int maxConcurrencyCap,
                                int maxBufferedItemCount,
                                boolean optimisticDirectExecution,
                                int fetchRetryMaxAttempts,
                                Duration fetchRetryWaitDuration) {

    public QueryEngineConfig {
        if (maxItemCount <= 0) {
            throw new IllegalArgumentException("query.max_item_count must be positive");
        }
        if (maxConcurrencyCap <= 0) {
            throw new IllegalArgumentException("query.max_concurrency_cap must be positive");
        }
        if (maxBufferedItemCount <= 0) {
            throw new IllegalArgumentException("query.max_buffered_item_count must be positive");
        }
        if (fetchRetryMaxAttempts <= 0) {
            throw new IllegalArgumentException("query.fetch_retry.max_attempts must be positive");
        }
    }

    public static QueryEngineConfig load() {
        return load(ConfigFactory.load());
    }

    public static QueryEngineConfig load(Config config) {
        Config query = config.getConfig("query");
        return new QueryEngineConfig(
                query.getInt("max_item_count"),
                query.getInt("max_concurrency"),
                query.getInt("max_concurrency_cap"),
                query.getInt("max_buffered_item_count"),
                query.getBoolean("optimistic_direct_execution"),
                query.getInt("fetch_retry.max_attempts"),
                query.getDuration("fetch_retry.wait_duration")
        );
    }
}
