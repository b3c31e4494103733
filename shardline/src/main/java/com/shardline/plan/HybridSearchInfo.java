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

import com.google.common.base.Preconditions;

import javax.annotation.Nullable;

/**
 * Rank fusion parameters of a hybrid search query.
 *
 * @param componentCount number of ranked components, each row carries one score per component
 * @param skip           rows dropped after fusion, null for none
 * @param take           rows kept after fusion, null for all
 */
public record HybridSearchInfo(int componentCount, @Nullable Integer skip, @Nullable Integer take) {
    public HybridSearchInfo {
        Preconditions.checkArgument(componentCount > 0, "componentCount must be positive");
        Preconditions.checkArgument(skip == null || skip >= 0, "skip must be non-negative");
        Preconditions.checkArgument(take == null || take >= 0, "take must be non-negative");
    }
}
