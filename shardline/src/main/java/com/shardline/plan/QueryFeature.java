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

/**
 * Features a query plan may declare. The planner lists every feature the query uses; the
 * engine refuses plans that need one it does not support.
 */
public enum QueryFeature {
    AGGREGATE(true),
    COMPOSITE_AGGREGATE(false),
    COUNT_IF(false),
    DCOUNT(true),
    DISTINCT(true),
    GROUP_BY(true),
    HYBRID_SEARCH(true),
    LIST_AND_SET_AGGREGATE(false),
    MULTIPLE_AGGREGATES(true),
    MULTIPLE_ORDER_BY(true),
    NON_VALUE_AGGREGATE(true),
    OFFSET_AND_LIMIT(true),
    ORDER_BY(true),
    TOP(true),
    WEIGHTED_RANK_FUSION(false);

    private final boolean supported;

    QueryFeature(boolean supported) {
        this.supported = supported;
    }

    public boolean isSupported() {
        return supported;
    }
}
