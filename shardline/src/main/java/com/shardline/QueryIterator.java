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

import com.shardline.common.ShardlineException;
import com.shardline.partition.FetchContext;
import com.shardline.pipeline.PipelineStage;
import com.shardline.pipeline.QueryRow;
import com.shardline.token.ContinuationToken;
import com.shardline.value.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Produces the result pages of one query execution.
 * <p>
 * An iterator is driven by a single thread. Any error thrown by {@link #next()} is terminal:
 * the query's fetches are cancelled and later calls rethrow the same error. A retryable
 * failure can be resumed by executing the query again with the last returned token.
 */
public class QueryIterator implements AutoCloseable {
    private static final Logger LOGGER = LoggerFactory.getLogger(QueryIterator.class);

    private final PipelineStage pipeline;
    private final FetchContext fetchContext;
    private final String shape;
    private final int maxItemCount;
    private ShardlineException failure;
    private volatile boolean closed;

    QueryIterator(PipelineStage pipeline, FetchContext fetchContext, String shape, int maxItemCount) {
        this.pipeline = pipeline;
        this.fetchContext = fetchContext;
        this.shape = shape;
        this.maxItemCount = maxItemCount;
    }

    public boolean hasMoreResults() {
        return !closed && failure == null && pipeline.hasMoreResults();
    }

    /**
     * Returns the next page. A page may be empty while results remain, for example when an
     * aggregate consumed partition pages without emitting its row yet.
     *
     * @return the page
     * @throws NoSuchElementException  if the query has no more results
     * @throws QueryCancelledException if the iterator was closed
     */
    public QueryResponse next() {
        if (closed) {
            throw new QueryCancelledException();
        }
        if (failure != null) {
            throw failure;
        }
        if (!pipeline.hasMoreResults()) {
            throw new NoSuchElementException("Query has no more results");
        }
        try {
            fetchContext.setPageSize(maxItemCount);
            List<QueryRow> rows = pipeline.nextPage(maxItemCount);
            List<Value> items = new ArrayList<>(rows.size());
            for (QueryRow row : rows) {
                if (row.payload().isDefined()) {
                    items.add(row.payload());
                }
            }

            String token = null;
            String disallowReason = null;
            if (pipeline.hasMoreResults()) {
                disallowReason = pipeline.disallowContinuationReason();
                if (disallowReason == null) {
                    token = new ContinuationToken(shape, pipeline.saveState()).encode();
                }
            }
            double charge = fetchContext.drainRequestCharge();
            LOGGER.trace("Returning {} items, request charge: {}, more results: {}", items.size(), charge, token != null);
            return new QueryResponse(items, token, charge, disallowReason);
        } catch (ShardlineException e) {
            fail(e);
            throw e;
        } catch (RuntimeException e) {
            ShardlineException wrapped = new ShardlineException(e);
            fail(wrapped);
            throw wrapped;
        }
    }

    private void fail(ShardlineException e) {
        if (closed) {
            return;
        }
        LOGGER.debug("Query failed, activity id: {}", fetchContext.requestContext().activityId(), e);
        failure = e;
        pipeline.close();
    }

    /**
     * Cancels in-flight fetches and releases buffered rows. A later {@link #next()} throws
     * {@link QueryCancelledException}.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        pipeline.close();
    }
}
