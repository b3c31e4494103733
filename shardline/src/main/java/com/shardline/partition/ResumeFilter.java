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

import com.shardline.value.Value;

import java.util.List;
import java.util.Set;

/**
 * Identifies rows a partition already delivered before a suspension. Only consulted when the
 * partition was split in the meantime and its children re-read the page the suspension fell in.
 */
public sealed interface ResumeFilter permits ResumeFilter.AfterRow, ResumeFilter.ExcludeRids {

    /**
     * Rows at or before the given sort position were delivered. Used by ORDER BY merges.
     *
     * @param orderByItems order-by values of the last delivered row
     * @param rid          rid of the last delivered row
     */
    record AfterRow(List<Value> orderByItems, String rid) implements ResumeFilter {
        public AfterRow {
            orderByItems = List.copyOf(orderByItems);
        }
    }

    /**
     * The listed rows were delivered. Used by unordered merges, which have no sort position.
     *
     * @param rids rids of the delivered rows of the interrupted page
     */
    record ExcludeRids(Set<String> rids) implements ResumeFilter {
        public ExcludeRids {
            rids = Set.copyOf(rids);
        }
    }
}
