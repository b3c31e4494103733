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

import com.shardline.value.Value;

import javax.annotation.Nullable;
import java.util.List;

/**
 * One page of query results.
 *
 * @param items                      result values, at most the requested max item count
 * @param continuationToken          token to resume after this page, null when the query is
 *                                   complete or cannot be resumed
 * @param requestCharge              cost of the fetches performed for this page
 * @param disallowContinuationReason why no token is offered although results remain, or null
 */
public record QueryResponse(List<Value> items,
                            @Nullable String continuationToken,
                            double requestCharge,
                            @Nullable String disallowContinuationReason) {
    public QueryResponse {
        items = List.copyOf(items);
    }

    public int size() {
        return items.size();
    }
}
