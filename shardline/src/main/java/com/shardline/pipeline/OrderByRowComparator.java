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

package com.shardline.pipeline;

import com.shardline.plan.OrderByColumn;
import com.shardline.plan.SortOrder;
import com.shardline.value.Value;
import com.shardline.value.ValueComparator;

import java.util.Comparator;
import java.util.List;

/**
 * Compares the order-by items of two rows column by column, honoring each column's direction.
 */
public class OrderByRowComparator implements Comparator<List<Value>> {
    private final List<OrderByColumn> columns;

    public OrderByRowComparator(List<OrderByColumn> columns) {
        this.columns = List.copyOf(columns);
    }

    @Override
    public int compare(List<Value> left, List<Value> right) {
        if (left.size() != columns.size() || right.size() != columns.size()) {
            throw new IllegalStateException(String.format(
                    "Expected %d order-by items, got %d and %d", columns.size(), left.size(), right.size()));
        }
        for (int i = 0; i < columns.size(); i++) {
            int result = ValueComparator.INSTANCE.compare(left.get(i), right.get(i));
            if (result != 0) {
                return columns.get(i).order() == SortOrder.DESCENDING ? -result : result;
            }
        }
        return 0;
    }
}
