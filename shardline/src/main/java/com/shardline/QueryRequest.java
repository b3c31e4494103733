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
import com.shardline.partition.RequestContext;
import com.shardline.plan.DistributionPlan;

import javax.annotation.Nullable;
import java.util.Objects;

/**
 * A query submitted to {@link QueryEngine#execute(QueryRequest)}.
 * <p>
 * The target is a span of effective partition keys, the whole key space by default. The span
 * is resolved into partitions through the engine's router; rows outside the span are dropped
 * when it does not align with partition boundaries.
 */
public class QueryRequest {
    private final DistributionPlan plan;
    private final KeyRange feedRange;
    private final String continuationToken;
    private final QueryRequestOptions options;
    private final RequestContext requestContext;

    private QueryRequest(Builder builder) {
        this.plan = Objects.requireNonNull(builder.plan, "plan");
        this.feedRange = builder.feedRange;
        this.continuationToken = builder.continuationToken;
        this.options = builder.options;
        this.requestContext = builder.requestContext == null ? RequestContext.create() : builder.requestContext;
    }

    public static Builder builder(DistributionPlan plan) {
        return new Builder(plan);
    }

    public DistributionPlan plan() {
        return plan;
    }

    public KeyRange feedRange() {
        return feedRange;
    }

    @Nullable
    public String continuationToken() {
        return continuationToken;
    }

    public QueryRequestOptions options() {
        return options;
    }

    public RequestContext requestContext() {
        return requestContext;
    }

    public static class Builder {
        private final DistributionPlan plan;
        private KeyRange feedRange = KeyRange.full();
        private String continuationToken;
        private QueryRequestOptions options = QueryRequestOptions.defaults();
        private RequestContext requestContext;

        private Builder(DistributionPlan plan) {
            this.plan = plan;
        }

        public Builder feedRange(KeyRange feedRange) {
            this.feedRange = Objects.requireNonNull(feedRange, "feedRange");
            return this;
        }

        public Builder continuationToken(@Nullable String continuationToken) {
            this.continuationToken = continuationToken;
            return this;
        }

        public Builder options(QueryRequestOptions options) {
            this.options = Objects.requireNonNull(options, "options");
            return this;
        }

        public Builder requestContext(RequestContext requestContext) {
            this.requestContext = requestContext;
            return this;
        }

        public QueryRequest build() {
            return new QueryRequest(this);
        }
    }
}
