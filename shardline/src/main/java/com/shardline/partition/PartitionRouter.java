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

package com.shardline.partition;

import java.util.List;

/**
 * Maps an effective partition key span to the partitions currently serving it.
 */
public interface PartitionRouter {
    /**
     * Resolves the partitions overlapping {@code [minInclusive, maxExclusive)}.
     *
     * @param minInclusive lower bound
     * @param maxExclusive upper bound
     * @return the overlapping ranges ordered by {@link KeyRange#minInclusive()}
     */
    List<KeyRange> resolve(String minInclusive, String maxExclusive);

    default List<KeyRange> resolve(KeyRange span) {
        return resolve(span.minInclusive(), span.maxExclusive());
    }
}
