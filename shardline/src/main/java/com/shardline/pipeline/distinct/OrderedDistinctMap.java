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
import com.google.common.hash.HashCode;
import com.shardline.internal.JSONUtil;
import com.shardline.value.DistinctHash;
import com.shardline.value.Value;

import javax.annotation.Nullable;

/**
 * DISTINCT over a result sorted by the distinct projection: duplicates are adjacent, so only
 * the hash of the last emitted value is kept.
 */
class OrderedDistinctMap implements DistinctMap {
    private static final String LAST = "last";

    private HashCode last;

    private OrderedDistinctMap(@Nullable HashCode last) {
        this.last = last;
    }

    static OrderedDistinctMap create(@Nullable JsonNode state) {
        if (state == null) {
            return new OrderedDistinctMap(null);
        }
        JsonNode last = state.get(LAST);
        if (last == null || last.isNull()) {
            return new OrderedDistinctMap(null);
        }
        return new OrderedDistinctMap(UnorderedDistinctMap.parseHash(last));
    }

    @Override
    public boolean add(Value value) {
        HashCode hash = DistinctHash.of(value);
        if (hash.equals(last)) {
            return false;
        }
        last = hash;
        return true;
    }

    @Override
    public ObjectNode saveState() {
        ObjectNode state = JSONUtil.objectMapper.createObjectNode();
        if (last != null) {
            state.put(LAST, last.toString());
        }
        return state;
    }
}
