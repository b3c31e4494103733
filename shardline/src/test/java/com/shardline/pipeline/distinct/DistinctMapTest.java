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

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.shardline.MalformedContinuationTokenException;
import com.shardline.internal.JSONUtil;
import com.shardline.plan.DistinctType;
import com.shardline.value.Values;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DistinctMapTest {

    @Test
    void test_unordered() {
        DistinctMap map = DistinctMap.create(DistinctType.UNORDERED, null);
        assertTrue(map.add(Values.of(1)));
        assertTrue(map.add(Values.of("1")));
        assertFalse(map.add(Values.of(1.0)));
        assertTrue(map.add(Values.object("a", Values.of(1), "b", Values.of(2))));
        assertFalse(map.add(Values.object("b", Values.of(2), "a", Values.of(1))));
        assertFalse(map.add(Values.of("1")));
    }

    @Test
    void test_unordered_resumes_from_state() {
        UnorderedDistinctMap map = UnorderedDistinctMap.create(null);
        map.add(Values.of(1));
        map.add(Values.of(2));

        ObjectNode state = map.saveState();
        assertEquals(2, state.get("hashes").size());

        UnorderedDistinctMap restored = UnorderedDistinctMap.create(state);
        assertEquals(2, restored.size());
        assertFalse(restored.add(Values.of(2)));
        assertTrue(restored.add(Values.of(3)));
    }

    @Test
    void test_ordered_only_filters_adjacent_duplicates() {
        DistinctMap map = DistinctMap.create(DistinctType.ORDERED, null);
        assertTrue(map.add(Values.of(1)));
        assertFalse(map.add(Values.of(1)));
        assertTrue(map.add(Values.of(2)));
        assertTrue(map.add(Values.of(1)));
    }

    @Test
    void test_ordered_resumes_from_state() {
        DistinctMap map = DistinctMap.create(DistinctType.ORDERED, null);
        assertTrue(map.saveState().isEmpty());
        map.add(Values.of("x"));

        DistinctMap restored = DistinctMap.create(DistinctType.ORDERED, map.saveState());
        assertFalse(restored.add(Values.of("x")));
        assertTrue(restored.add(Values.of("y")));
    }

    @Test
    void test_malformed_state() {
        ObjectNode state = JSONUtil.objectMapper.createObjectNode();
        state.putArray("hashes").add("not-a-hash");
        assertThrows(MalformedContinuationTokenException.class, () -> DistinctMap.create(DistinctType.UNORDERED, state));

        ObjectNode missing = JSONUtil.objectMapper.createObjectNode();
        assertThrows(MalformedContinuationTokenException.class, () -> DistinctMap.create(DistinctType.UNORDERED, missing));
    }

    @Test
    void test_distinct_not_enabled() {
        assertThrows(IllegalArgumentException.class, () -> DistinctMap.create(DistinctType.NONE, null));
    }
}
