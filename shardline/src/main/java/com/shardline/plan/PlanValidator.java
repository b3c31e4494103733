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

import com.shardline.BadRequestException;
import com.shardline.UnsupportedQueryException;

import java.util.EnumSet;
import java.util.Set;

/**
 * Rejects plans the merge engine cannot execute before any partition is contacted.
 */
public final class PlanValidator {

    private PlanValidator() {
    }

    public static void validate(DistributionPlan plan) {
        Set<QueryFeature> unsupported = EnumSet.noneOf(QueryFeature.class);
        for (QueryFeature feature : plan.requiredFeatures()) {
            if (!feature.isSupported()) {
                unsupported.add(feature);
            }
        }
        if (!unsupported.isEmpty()) {
            throw new UnsupportedQueryException(String.format(
                    "Query '%s' requires unsupported features: %s", plan.queryText(), unsupported));
        }

        if (plan.top() != null && plan.limit() != null) {
            throw invalid(plan, "TOP and LIMIT cannot be combined");
        }
        if (plan.offset() != null && plan.limit() == null) {
            throw invalid(plan, "OFFSET requires LIMIT");
        }
        if (plan.isSelectValue() && !plan.hasGroupBy() && plan.aggregates().size() > 1) {
            throw invalid(plan, "SELECT VALUE projects a single aggregate");
        }
        if (plan.isSelectValue() && plan.hasGroupBy() && plan.aggregates().size() > 1) {
            throw invalid(plan, "SELECT VALUE with GROUP BY projects a single value");
        }
        if (plan.isDCount() && (plan.hasGroupBy() || plan.hasAggregates())) {
            throw invalid(plan, "DCOUNT cannot be combined with GROUP BY or aggregates");
        }
        if (plan.isHybridSearch() && (plan.hasOrderBy() || plan.hasGroupBy() || plan.hasAggregates() || plan.isDistinct())) {
            throw invalid(plan, "hybrid search cannot be combined with ORDER BY, GROUP BY, aggregates or DISTINCT");
        }
        if (plan.isDistinctOrdered() && !plan.hasOrderBy()) {
            throw invalid(plan, "ordered DISTINCT requires ORDER BY");
        }
    }

    private static BadRequestException invalid(DistributionPlan plan, String reason) {
        return new BadRequestException(String.format("Invalid plan for query '%s': %s", plan.queryText(), reason));
    }
}
