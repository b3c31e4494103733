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

import com.fasterxml.jackson.databind.JsonNode;
import com.shardline.internal.ExecutorServiceUtil;
import com.shardline.internal.SlExecutors;
import com.shardline.partition.FetchContext;
import com.shardline.partition.KeyRange;
import com.shardline.partition.PartitionReader;
import com.shardline.partition.PartitionRouter;
import com.shardline.partition.RetryingPartitionReader;
import com.shardline.pipeline.PipelineContext;
import com.shardline.pipeline.PipelineFactory;
import com.shardline.pipeline.PipelineStage;
import com.shardline.plan.DistributionPlan;
import com.shardline.plan.PlanValidator;
import com.shardline.token.ContinuationToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutorService;

/**
 * Executes distributed query plans across the partitions of a container.
 * <p>
 * The engine owns the fetcher pool shared by all of its queries; each execution gets its own
 * {@link FetchContext} and pipeline. Throttled fetches are retried by a
 * {@link RetryingPartitionReader} wrapped around the given reader.
 *
 * <pre>{@code
 * try (QueryEngine engine = new QueryEngine(QueryEngineConfig.load(), reader, router);
 *      QueryIterator iterator = engine.execute(QueryRequest.builder(plan).build())) {
 *     while (iterator.hasMoreResults()) {
 *         QueryResponse response = iterator.next();
 *         ...
 *     }
 * }
 * }</pre>
 */
public class QueryEngine implements AutoCloseable {
    private static final Logger LOGGER = LoggerFactory.getLogger(QueryEngine.class);

    private final QueryEngineConfig config;
    private final PartitionReader reader;
    private final PartitionRouter router;
    private final ExecutorService executor;
    private volatile boolean closed;

    public QueryEngine(QueryEngineConfig config, PartitionReader reader, PartitionRouter router) {
        this.config = Objects.requireNonNull(config, "config");
        this.reader = new RetryingPartitionReader(
                Objects.requireNonNull(reader, "reader"),
                config.fetchRetryMaxAttempts(),
                config.fetchRetryWaitDuration()
        );
        this.router = Objects.requireNonNull(router, "router");
        this.executor = SlExecutors.newFetcherExecutor(config.maxConcurrencyCap());
    }

    public QueryEngineConfig getConfig() {
        return config;
    }

    /**
     * Starts or resumes a query.
     *
     * @param request the query
     * @return an iterator over the result pages
     * @throws BadRequestException       if the plan, the options or the continuation token are invalid
     * @throws UnsupportedQueryException if the plan requires an unsupported feature
     */
    public QueryIterator execute(QueryRequest request) {
        if (closed) {
            throw new IllegalStateException("Query engine is closed");
        }
        DistributionPlan plan = request.plan();
        PlanValidator.validate(plan);
        if (request.continuationToken() != null) {
            PipelineFactory.checkResumable(plan);
        }
        try {
            return start(request);
        } catch (BadRequestException e) {
            throw e.forQuery(plan.queryText());
        }
    }

    private QueryIterator start(QueryRequest request) {
        DistributionPlan plan = request.plan();
        JsonNode state = null;
        ContinuationToken token = null;
        if (request.continuationToken() != null) {
            token = ContinuationToken.decode(request.continuationToken());
        }

        FetchContext probe = newFetchContext(request, 1, false);
        List<KeyRange> targetRanges = probe.resolve(request.feedRange());
        if (targetRanges.isEmpty()) {
            throw new BadRequestException("No partition serves the feed range " + request.feedRange());
        }

        QueryRequestOptions options = request.options();
        int maxConcurrency = options.maxConcurrency() != null ? options.maxConcurrency() : config.maxConcurrency();
        if (maxConcurrency <= 0) {
            maxConcurrency = Math.min(targetRanges.size(), config.maxConcurrencyCap());
        }
        boolean optimisticDirectExecution = options.optimisticDirectExecution() != null
                ? options.optimisticDirectExecution()
                : config.optimisticDirectExecution();
        boolean direct = optimisticDirectExecution && targetRanges.size() == 1 && plan.isStreaming();

        String shape = PipelineFactory.shape(plan, direct);
        if (token != null) {
            token.verifyShape(shape);
            state = token.state();
        }

        FetchContext fetchContext = newFetchContext(request, maxConcurrency, direct);
        PipelineContext context = new PipelineContext(plan, targetRanges, fetchContext);
        PipelineStage pipeline = PipelineFactory.create(context, state);

        int maxItemCount = options.maxItemCount() == QueryRequestOptions.DEFAULT_MAX_ITEM_COUNT
                ? config.maxItemCount()
                : options.maxItemCount();
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("Executing '{}' over {} partitions, shape: {}, max concurrency: {}, resumed: {}, activity id: {}",
                    plan.queryText(), targetRanges.size(), shape, maxConcurrency, token != null,
                    request.requestContext().activityId());
        }
        return new QueryIterator(pipeline, fetchContext, shape, maxItemCount);
    }

    private FetchContext newFetchContext(QueryRequest request, int maxConcurrency, boolean direct) {
        QueryRequestOptions options = request.options();
        int maxBufferedItemCount = options.maxBufferedItemCount() != null
                ? options.maxBufferedItemCount()
                : config.maxBufferedItemCount();
        return FetchContext.builder()
                .reader(reader)
                .router(router)
                .executor(executor)
                .requestContext(request.requestContext())
                .maxBufferedItemCount(maxBufferedItemCount)
                .maxConcurrency(maxConcurrency)
                .fetchRetryAttempts(config.fetchRetryMaxAttempts())
                .directExecution(direct)
                .pageSize(config.maxItemCount())
                .queryText(request.plan().queryText())
                .build();
    }

    /**
     * Stops the fetcher pool. Queries still running fail with {@link QueryCancelledException}
     * or a fetch failure.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        if (!ExecutorServiceUtil.shutdownNowThenAwaitTermination(executor)) {
            LOGGER.warn("Fetcher pool did not terminate in time");
        }
    }
}
