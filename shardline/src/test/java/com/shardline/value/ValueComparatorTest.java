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

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class ValueComparatorTest {
    private final ValueComparator comparator = ValueComparator.INSTANCE;

    @Test
    void test_cross_type_order() {
        List<Value> expected = List.of(
                UndefinedValue.INSTANCE,
                NullValue.INSTANCE,
                BooleanValue.FALSE,
                BooleanValue.TRUE,
                Values.of(-10),
                Values.of(2.5),
                Values.of("a"),
                Values.of("b"),
                Values.array(Values.of(1)),
                Values.object("a", Values.of(1))
        );
        List<Value> shuffled = new ArrayList<>(expected);
        Collections.shuffle(shuffled, new Random(3));
        shuffled.sort(comparator);
        assertEquals(expected, shuffled);
    }

    @Test
    void test_numbers() {
        assertTrue(comparator.compare(Values.of(1), Values.of(2)) < 0);
        assertTrue(comparator.compare(Values.of(-1.5), Values.of(-2)) > 0);
        assertEquals(0, comparator.compare(Values.of(1), Values.of(1.0)));
        assertEquals(0, comparator.compare(Values.of(-0.0), Values.of(0.0)));
    }

    @Test
    void test_integers_near_two_to_the_63_compare_equal() {
        Value max = new NumberValue(9223372036854775807L);
        Value belowMax = new NumberValue(9223372036854775806L);
        assertEquals(0, comparator.compare(max, belowMax));
        assertEquals(0, comparator.compare(belowMax, max));
        assertTrue(comparator.compare(new NumberValue(9007199254740992L), max) < 0);
    }

    @Test
    void test_strings_by_code_unit() {
        assertTrue(comparator.compare(Values.of("Z"), Values.of("a")) < 0);
        assertTrue(comparator.compare(Values.of("ab"), Values.of("abc")) < 0);
        assertEquals(0, comparator.compare(Values.of("x"), Values.of("x")));
    }

    @Test
    void test_number_before_string() {
        assertTrue(comparator.compare(Values.of(1000), Values.of("1")) < 0);
    }

    @Test
    void test_arrays_and_objects_are_not_ordered_among_themselves() {
        assertEquals(0, comparator.compare(Values.array(Values.of(1)), Values.array(Values.of(2))));
        assertEquals(0, comparator.compare(Values.object("a", Values.of(1)), Values.object("b", Values.of(0))));
        assertTrue(comparator.compare(Values.array(), Values.object()) < 0);
    }
}
