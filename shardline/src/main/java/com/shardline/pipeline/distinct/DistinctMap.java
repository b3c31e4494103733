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

package com.shardline.pipeline.distinct;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.shardline.plan.DistinctType;
import com.shardline.value.Value;

import javax.annotation.Nullable;

/**
 * Remembers which values were already emitted by a DISTINCT query.
 */
public interface DistinctMap {

    /**
     * Creates a map, restoring a saved state if given.
     *
     * @param type  ORDERED or UNORDERED
     * @param state state written by {@link #saveState()}, or null
     * @return the map
     */
    static DistinctMap create(DistinctType type, @Nullable JsonNode state) {
        return switch (type) {
            case ORDERED -> OrderedDistinctMap.create(state);
            case UNORDERED -> UnorderedDistinctMap.create(state);
            case NONE -> throw new IllegalArgumentException("DISTINCT is not enabled");
        };
    }

    /**
     * Records a value.
     *
     * @param value the value
     * @return true if the value was not seen before and must be emitted
     */
    boolean add(Value value);

    ObjectNode saveState();
}
