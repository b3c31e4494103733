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

package com.shardline.value;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class ValuesTest {

    @Test
    void test_parse() {
        Value value = Values.parse("{\"a\": 1, \"b\": [true, null, \"x\"], \"c\": 2.5}");
        ObjectValue object = assertInstanceOf(ObjectValue.class, value);
        assertEquals(Values.of(1), object.get("a"));
        assertEquals(Values.array(BooleanValue.TRUE, NullValue.INSTANCE, Values.of("x")), object.get("b"));
        assertEquals(Values.of(2.5), object.get("c"));
        assertEquals(UndefinedValue.INSTANCE, object.get("missing"));
        assertThat(object.properties().keySet()).containsExactly("a", "b", "c");
    }

    @Test
    void test_missing_node_is_undefined() {
        assertEquals(UndefinedValue.INSTANCE, Values.fromJson(MissingNode.getInstance()));
        assertEquals(UndefinedValue.INSTANCE, Values.fromJson(null));
        assertFalse(UndefinedValue.INSTANCE.isDefined());
        assertTrue(NullValue.INSTANCE.isDefined());
    }

    @Test
    void test_toJson_drops_undefined_members() {
        ObjectValue object = Values.object(
                "a", Values.of(1),
                "b", UndefinedValue.INSTANCE,
                "c", Values.array(Values.of("x"), UndefinedValue.INSTANCE)
        );
        assertEquals("{\"a\":1,\"c\":[\"x\"]}", Values.toJsonString(object));
        assertNull(Values.toJson(UndefinedValue.INSTANCE));
        assertEquals("undefined", Values.toJsonString(UndefinedValue.INSTANCE));
    }

    @Test
    void test_integral_numbers_are_written_without_fraction() {
        assertEquals("3", Values.toJsonString(Values.of(3.0)));
        assertEquals("3.5", Values.toJsonString(Values.of(3.5)));
        assertEquals("-7", Values.toJsonString(Values.of(-7)));
    }

    @Test
    void test_toJson_then_fromJson() {
        Value value = Values.parse("[1, \"two\", {\"three\": [false]}, null]");
        JsonNode node = Values.toJson(value);
        assertEquals(value, Values.fromJson(node));
    }

    @Test
    void test_object_requires_pairs() {
        assertThrows(IllegalArgumentException.class, () -> Values.object("a"));
    }

    @Test
    void test_value_types() {
        List<Value> values = List.of(UndefinedValue.INSTANCE, NullValue.INSTANCE, BooleanValue.TRUE,
                Values.of(1), Values.of("s"), Values.array(), Values.object());
        for (int i = 0; i < values.size(); i++) {
            assertEquals(ValueType.values()[i], values.get(i).type());
        }
    }
}
