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

import javax.annotation.Nullable;

/**
 * Per-query overrides of {@link QueryEngineConfig}. Unset options fall back to the engine's
 * configuration.
 *
 * <pre>{@code
 * QueryRequestOptions options = QueryRequestOptions.builder()
 *     .maxItemCount(50)
 *     .maxConcurrency(4)
 *     .build();
 * }</pre>
 */
public class QueryRequestOptions {
    public static final int DEFAULT_MAX_ITEM_COUNT = -1;

    private final int maxItemCount;
    private final Integer maxConcurrency;
    private final Integer maxBufferedItemCount;
    private final Boolean optimisticDirectExecution;

    private QueryRequestOptions(Builder builder) {
        this.maxItemCount = builder.maxItemCount;
        this.maxConcurrency = builder.maxConcurrency;
        this.maxBufferedItemCount = builder.maxBufferedItemCount;
        this.optimisticDirectExecution = builder.optimisticDirectExecution;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static QueryRequestOptions defaults() {
        return builder().build();
    }

    /**
     * Rows per response page; {@value #DEFAULT_MAX_ITEM_COUNT} selects the configured default.
     */
    public int maxItemCount() {
        return maxItemCount;
    }

    @Nullable
    public Integer maxConcurrency() {
        return maxConcurrency;
    }

    @Nullable
    public Integer maxBufferedItemCount() {
        return maxBufferedItemCount;
    }

    @Nullable
    public Boolean optimisticDirectExecution() {
        return optimisticDirectExecution;
    }

    public static class Builder {
        private int maxItemCount = DEFAULT_MAX_ITEM_COUNT;
        private Integer maxConcurrency;
        private Integer maxBufferedItemCount;
        private Boolean optimisticDirectExecution;

        /**
         * @param maxItemCount rows per page, positive or -1 for the configured default
         * @return this builder
         */
        public Builder maxItemCount(int maxItemCount) {
            if (maxItemCount == 0 || maxItemCount < DEFAULT_MAX_ITEM_COUNT) {
                throw new BadRequestException("maxItemCount must be positive or -1, got " + maxItemCount);
            }
            this.maxItemCount = maxItemCount;
            return this;
        }

        /**
         * @param maxConcurrency concurrent fetches, 0 or less for min(partitions, configured cap)
         * @return this builder
         */
        public Builder maxConcurrency(int maxConcurrency) {
            this.maxConcurrency = maxConcurrency;
            return this;
        }

        public Builder maxBufferedItemCount(int maxBufferedItemCount) {
            if (maxBufferedItemCount <= 0) {
                throw new BadRequestException("maxBufferedItemCount must be positive, got " + maxBufferedItemCount);
            }
            this.maxBufferedItemCount = maxBufferedItemCount;
            return this;
        }

        public Builder optimisticDirectExecution(boolean optimisticDirectExecution) {
            this.optimisticDirectExecution = optimisticDirectExecution;
            return this;
        }

        public QueryRequestOptions build() {
            return new QueryRequestOptions(this);
        }
    }
}
