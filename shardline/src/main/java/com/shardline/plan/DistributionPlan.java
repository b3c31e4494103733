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

package com.shardline.plan;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Describes how the per-partition results of a query are merged.
 *
 * <p>A plan is produced by the query planner and is immutable. Partitions evaluate the filter
 * and the projection; the plan tells the merge engine what remains to be done client side:
 * <ul>
 *   <li>k-way merge by the ORDER BY columns,</li>
 *   <li>GROUP BY and aggregate merging of partial results,</li>
 *   <li>DISTINCT, DCOUNT, OFFSET/LIMIT and TOP,</li>
 *   <li>hybrid search rank fusion.</li>
 * </ul>
 *
 * <pre>{@code
 * DistributionPlan plan = DistributionPlan.builder()
 *     .orderBy(OrderByColumn.desc("c.ts"))
 *     .top(10)
 *     .queryText("SELECT TOP 10 * FROM c ORDER BY c.ts DESC")
 *     .build();
 * }</pre>
 */
public class DistributionPlan {
    private final List<OrderByColumn> orderBy;
    private final List<GroupByColumn> groupBy;
    private final List<AggregateSpec> aggregates;
    private final DistinctType distinctType;
    private final Integer top;
    private final Integer offset;
    private final Integer limit;
    private final boolean selectValue;
    private final String dCountAlias;
    private final HybridSearchInfo hybridSearch;
    private final Set<QueryFeature> requiredFeatures;
    private final String filterOpaque;
    private final String queryText;

    private DistributionPlan(Builder builder) {
        this.orderBy = List.copyOf(builder.orderBy);
        this.groupBy = List.copyOf(builder.groupBy);
        this.aggregates = List.copyOf(builder.aggregates);
        this.distinctType = builder.distinctType;
        this.top = builder.top;
        this.offset = builder.offset;
        this.limit = builder.limit;
        this.selectValue = builder.selectValue;
        this.dCountAlias = builder.dCountAlias;
        this.hybridSearch = builder.hybridSearch;
        this.requiredFeatures = Collections.unmodifiableSet(builder.requiredFeatures.isEmpty()
                ? EnumSet.noneOf(QueryFeature.class)
                : EnumSet.copyOf(builder.requiredFeatures));
        this.filterOpaque = builder.filterOpaque;
        this.queryText = builder.queryText;
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<OrderByColumn> orderBy() {
        return orderBy;
    }

    public List<GroupByColumn> groupBy() {
        return groupBy;
    }

    public List<AggregateSpec> aggregates() {
        return aggregates;
    }

    public DistinctType distinctType() {
        return distinctType;
    }

    public boolean isDistinct() {
        return distinctType != DistinctType.NONE;
    }

    public boolean isDistinctOrdered() {
        return distinctType == DistinctType.ORDERED;
    }

    @Nullable
    public Integer top() {
        return top;
    }

    @Nullable
    public Integer offset() {
        return offset;
    }

    @Nullable
    public Integer limit() {
        return limit;
    }

    public boolean isSelectValue() {
        return selectValue;
    }

    @Nullable
    public String dCountAlias() {
        return dCountAlias;
    }

    public boolean isDCount() {
        return dCountAlias != null;
    }

    @Nullable
    public HybridSearchInfo hybridSearch() {
        return hybridSearch;
    }

    public boolean isHybridSearch() {
        return hybridSearch != null;
    }

    public boolean hasOrderBy() {
        return !orderBy.isEmpty();
    }

    public boolean hasGroupBy() {
        return !groupBy.isEmpty();
    }

    public boolean hasAggregates() {
        return !aggregates.isEmpty();
    }

    /**
     * Returns true if nothing but concatenation, k-way merge and row counting is needed on the
     * client side, so a single partition's output can be returned as is.
     *
     * @return whether the plan streams without client side state beyond counters
     */
    public boolean isStreaming() {
        return !hasGroupBy() && !hasAggregates() && !isDistinct() && !isDCount() && !isHybridSearch();
    }

    public Set<QueryFeature> requiredFeatures() {
        return requiredFeatures;
    }

    @Nullable
    public String filterOpaque() {
        return filterOpaque;
    }

    public String queryText() {
        return queryText;
    }

    @Override
    public String toString() {
        return "DistributionPlan{" + queryText + "}";
    }

    public static class Builder {
        private final List<OrderByColumn> orderBy = new ArrayList<>();
        private final List<GroupByColumn> groupBy = new ArrayList<>();
        private final List<AggregateSpec> aggregates = new ArrayList<>();
        private final Set<QueryFeature> requiredFeatures = EnumSet.noneOf(QueryFeature.class);
        private DistinctType distinctType = DistinctType.NONE;
        private Integer top;
        private Integer offset;
        private Integer limit;
        private boolean selectValue;
        private String dCountAlias;
        private HybridSearchInfo hybridSearch;
        private String filterOpaque;
        private String queryText = "";

        public Builder orderBy(OrderByColumn... columns) {
            Collections.addAll(orderBy, columns);
            return this;
        }

        public Builder groupBy(GroupByColumn... columns) {
            Collections.addAll(groupBy, columns);
            return this;
        }

        public Builder aggregate(AggregateOperator operator, String expression, String alias) {
            aggregates.add(new AggregateSpec(operator, expression, alias));
            return this;
        }

        public Builder distinct(DistinctType distinctType) {
            this.distinctType = distinctType;
            return this;
        }

        public Builder top(int top) {
            if (top < 0) {
                throw new IllegalArgumentException("top must be a non-negative integer");
            }
            this.top = top;
            return this;
        }

        public Builder offset(int offset) {
            if (offset < 0) {
                throw new IllegalArgumentException("offset must be a non-negative integer");
            }
            this.offset = offset;
            return this;
        }

        public Builder limit(int limit) {
            if (limit < 0) {
                throw new IllegalArgumentException("limit must be a non-negative integer");
            }
            this.limit = limit;
            return this;
        }

        public Builder selectValue(boolean selectValue) {
            this.selectValue = selectValue;
            return this;
        }

        public Builder dCountAlias(String dCountAlias) {
            this.dCountAlias = dCountAlias;
            return this;
        }

        public Builder hybridSearch(HybridSearchInfo hybridSearch) {
            this.hybridSearch = hybridSearch;
            return this;
        }

        public Builder require(QueryFeature... features) {
            Collections.addAll(requiredFeatures, features);
            return this;
        }

        public Builder filterOpaque(String filterOpaque) {
            this.filterOpaque = filterOpaque;
            return this;
        }

        public Builder queryText(String queryText) {
            this.queryText = queryText;
            return this;
        }

        public DistributionPlan build() {
            return new DistributionPlan(this);
        }
    }
}
