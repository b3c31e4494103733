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

package com.shardline.pipeline.aggregate;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.shardline.MalformedContinuationTokenException;
import com.shardline.internal.JSONUtil;
import com.shardline.plan.AggregateOperator;
import com.shardline.token.StateReader;
import com.shardline.value.NumberValue;
import com.shardline.value.UndefinedValue;
import com.shardline.value.Value;
import com.shardline.value.Values;

/**
 * Snapshot of an {@link Accumulator}, carried by continuation tokens.
 * <p>
 * SUM and COUNT start at zero; MIN, MAX and AVG start undefined. An undefined SUM value or AVG
 * sum means a non-numeric contribution was seen and the result is undefined.
 */
public sealed interface AccumulatorState
        permits AccumulatorState.Sum, AccumulatorState.Count, AccumulatorState.Min, AccumulatorState.Max, AccumulatorState.Avg {

    String OPERATOR = "op";
    String VALUE = "value";
    String COUNT = "count";
    String SUM = "sum";

    AggregateOperator operator();

    /**
     * @param value running sum, undefined once a non-numeric partial was seen
     * @param count number of defined partials
     */
    record Sum(Value value, long count) implements AccumulatorState {
        public static final Sum EMPTY = new Sum(new NumberValue(0), 0);

        @Override
        public AggregateOperator operator() {
            return AggregateOperator.SUM;
        }
    }

    record Count(long value) implements AccumulatorState {
        public static final Count EMPTY = new Count(0);

        @Override
        public AggregateOperator operator() {
            return AggregateOperator.COUNT;
        }
    }

    record Min(Value value) implements AccumulatorState {
        public static final Min EMPTY = new Min(UndefinedValue.INSTANCE);

        @Override
        public AggregateOperator operator() {
            return AggregateOperator.MIN;
        }
    }

    record Max(Value value) implements AccumulatorState {
        public static final Max EMPTY = new Max(UndefinedValue.INSTANCE);

        @Override
        public AggregateOperator operator() {
            return AggregateOperator.MAX;
        }
    }

    /**
     * @param sum   running sum, undefined once a non-numeric partial was seen
     * @param count number of averaged items
     */
    record Avg(Value sum, long count) implements AccumulatorState {
        public static final Avg EMPTY = new Avg(new NumberValue(0), 0);

        @Override
        public AggregateOperator operator() {
            return AggregateOperator.AVG;
        }
    }

    static AccumulatorState empty(AggregateOperator operator) {
        return switch (operator) {
            case SUM -> Sum.EMPTY;
            case COUNT -> Count.EMPTY;
            case MIN -> Min.EMPTY;
            case MAX -> Max.EMPTY;
            case AVG -> Avg.EMPTY;
        };
    }

    default ObjectNode toJson() {
        ObjectNode node = JSONUtil.objectMapper.createObjectNode();
        node.put(OPERATOR, operator().name());
        if (this instanceof Sum sum) {
            putValue(node, VALUE, sum.value());
            node.put(COUNT, sum.count());
        } else if (this instanceof Count count) {
            node.put(VALUE, count.value());
        } else if (this instanceof Min min) {
            putValue(node, VALUE, min.value());
        } else if (this instanceof Max max) {
            putValue(node, VALUE, max.value());
        } else if (this instanceof Avg avg) {
            putValue(node, SUM, avg.sum());
            node.put(COUNT, avg.count());
        }
        return node;
    }

    private static void putValue(ObjectNode node, String field, Value value) {
        JsonNode json = Values.toJson(value);
        if (json != null) {
            node.set(field, json);
        }
    }

    /**
     * Reads a state written by {@link #toJson()}.
     *
     * @param node     the serialized state
     * @param expected the operator of the aggregate being restored
     * @return the state
     * @throws MalformedContinuationTokenException if the state is malformed or of another operator
     */
    static AccumulatorState fromJson(JsonNode node, AggregateOperator expected) {
        if (node == null || !node.isObject()) {
            throw new MalformedContinuationTokenException("aggregate state is not an object");
        }
        String operator = StateReader.requireText(node, OPERATOR);
        if (!expected.name().equals(operator)) {
            throw new MalformedContinuationTokenException(
                    String.format("aggregate state of %s cannot resume %s", operator, expected));
        }
        return switch (expected) {
            case SUM -> new Sum(Values.fromJson(node.get(VALUE)), StateReader.requireLong(node, COUNT));
            case COUNT -> new Count(StateReader.requireLong(node, VALUE));
            case MIN -> new Min(Values.fromJson(node.get(VALUE)));
            case MAX -> new Max(Values.fromJson(node.get(VALUE)));
            case AVG -> new Avg(Values.fromJson(node.get(SUM)), StateReader.requireLong(node, COUNT));
        };
    }
}
