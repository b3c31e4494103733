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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.shardline.MalformedContinuationTokenException;
import com.shardline.internal.JSONUtil;
import com.shardline.token.StateReader;
import com.shardline.value.Value;
import com.shardline.value.Values;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Resume position of one partition.
 *
 * @param range        the key range the position refers to
 * @param resumeToken  backend cursor of the page being consumed, null for the first page
 * @param skip         rows of that page already consumed
 * @param resumeFilter rows already delivered, present when {@code skip > 0} or when the position
 *                     was inherited from a split parent and nothing was delivered since
 */
public record PartitionCursor(KeyRange range,
                              @Nullable String resumeToken,
                              int skip,
                              @Nullable ResumeFilter resumeFilter) {
    private static final String MIN = "min";
    private static final String MAX = "max";
    private static final String PARTITION_ID = "id";
    private static final String TOKEN = "token";
    private static final String SKIP = "skip";
    private static final String FILTER = "filter";
    private static final String ITEMS = "items";
    private static final String VALUE = "v";
    private static final String RID = "rid";
    private static final String RIDS = "rids";

    public PartitionCursor {
        Objects.requireNonNull(range, "range");
        if (skip < 0) {
            throw new IllegalArgumentException("skip must be a non-negative integer");
        }
    }

    /**
     * Position at the very beginning of a partition.
     *
     * @param range the partition's key range
     * @return a fresh cursor
     */
    public static PartitionCursor start(KeyRange range) {
        return new PartitionCursor(range, null, 0, null);
    }

    public PartitionCursor withRange(KeyRange other) {
        return new PartitionCursor(other, resumeToken, skip, resumeFilter);
    }

    public ObjectNode toJson() {
        ObjectNode node = JSONUtil.objectMapper.createObjectNode();
        node.put(MIN, range.minInclusive());
        node.put(MAX, range.maxExclusive());
        if (range.partitionId() != null) {
            node.put(PARTITION_ID, range.partitionId());
        }
        if (resumeToken != null) {
            node.put(TOKEN, resumeToken);
        }
        node.put(SKIP, skip);
        if (resumeFilter instanceof ResumeFilter.AfterRow afterRow) {
            ObjectNode filter = node.putObject(FILTER);
            ArrayNode items = filter.putArray(ITEMS);
            for (Value item : afterRow.orderByItems()) {
                // undefined has no JSON form, it is written as an empty holder
                ObjectNode holder = items.addObject();
                JsonNode json = Values.toJson(item);
                if (json != null) {
                    holder.set(VALUE, json);
                }
            }
            filter.put(RID, afterRow.rid());
        } else if (resumeFilter instanceof ResumeFilter.ExcludeRids excludeRids) {
            ArrayNode rids = node.putObject(FILTER).putArray(RIDS);
            excludeRids.rids().stream().sorted().forEach(rids::add);
        }
        return node;
    }

    public static PartitionCursor fromJson(JsonNode node) {
        if (node == null || !node.isObject()) {
            throw new MalformedContinuationTokenException("partition cursor is not an object");
        }
        String min = StateReader.requireText(node, MIN);
        String max = StateReader.requireText(node, MAX);
        if (min.compareTo(max) >= 0) {
            throw new MalformedContinuationTokenException("empty key range in partition cursor");
        }
        KeyRange range = new KeyRange(min, max, StateReader.optionalText(node, PARTITION_ID));
        String token = StateReader.optionalText(node, TOKEN);
        int skip = StateReader.requireInt(node, SKIP);
        if (skip < 0) {
            throw new MalformedContinuationTokenException("'skip' must be non-negative");
        }

        ResumeFilter filter = null;
        JsonNode filterNode = node.get(FILTER);
        if (filterNode != null && !filterNode.isNull()) {
            if (filterNode.has(RIDS)) {
                Set<String> rids = new HashSet<>();
                for (JsonNode rid : StateReader.requireArray(filterNode, RIDS)) {
                    if (!rid.isTextual()) {
                        throw new MalformedContinuationTokenException("'rids' must contain strings");
                    }
                    rids.add(rid.textValue());
                }
                filter = new ResumeFilter.ExcludeRids(rids);
            } else {
                List<Value> items = new ArrayList<>();
                for (JsonNode holder : StateReader.requireArray(filterNode, ITEMS)) {
                    if (!holder.isObject()) {
                        throw new MalformedContinuationTokenException("'items' must contain objects");
                    }
                    items.add(Values.fromJson(holder.get(VALUE)));
                }
                filter = new ResumeFilter.AfterRow(items, StateReader.requireText(filterNode, RID));
            }
        }
        return new PartitionCursor(range, token, skip, filter);
    }
}
