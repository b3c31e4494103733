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
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.hash.HashCode;
import com.shardline.MalformedContinuationTokenException;
import com.shardline.internal.JSONUtil;
import com.shardline.token.StateReader;
import com.shardline.value.DistinctHash;
import com.shardline.value.Value;

import javax.annotation.Nullable;
import java.util.HashSet;
import java.util.Set;

/**
 * Keeps the canonical hash of every value emitted over the life of the query. The whole set
 * is written into continuation tokens, so its size grows with the number of distinct values.
 */
class UnorderedDistinctMap implements DistinctMap {
    private static final String HASHES = "hashes";

    private final Set<HashCode> seen;

    private UnorderedDistinctMap(Set<HashCode> seen) {
        this.seen = seen;
    }

    static UnorderedDistinctMap create(@Nullable JsonNode state) {
        Set<HashCode> seen = new HashSet<>();
        if (state != null) {
            for (JsonNode hash : StateReader.requireArray(state, HASHES)) {
                seen.add(parseHash(hash));
            }
        }
        return new UnorderedDistinctMap(seen);
    }

    static HashCode parseHash(JsonNode node) {
        if (!node.isTextual()) {
            throw new MalformedContinuationTokenException("distinct hash must be a string");
        }
        try {
            return HashCode.fromString(node.textValue());
        } catch (IllegalArgumentException e) {
            throw new MalformedContinuationTokenException("invalid distinct hash", e);
        }
    }

    @Override
    public boolean add(Value value) {
        return seen.add(DistinctHash.of(value));
    }

    @Override
    public ObjectNode saveState() {
        ObjectNode state = JSONUtil.objectMapper.createObjectNode();
        ArrayNode hashes = state.putArray(HASHES);
        seen.stream().map(HashCode::toString).sorted().forEach(hashes::add);
        return state;
    }

    int size() {
        return seen.size();
    }
}
