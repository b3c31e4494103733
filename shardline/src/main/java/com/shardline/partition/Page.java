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

import com.shardline.pipeline.QueryRow;

import javax.annotation.Nullable;
import java.util.List;

/**
 * A page of rows returned by a partition.
 *
 * @param rows          rows in the partition's order
 * @param continuation  cursor of the next page, null when the partition is exhausted
 * @param requestCharge cost reported by the backend
 */
public record Page(List<QueryRow> rows, @Nullable String continuation, double requestCharge) {
    public Page {
        rows = List.copyOf(rows);
    }
}
