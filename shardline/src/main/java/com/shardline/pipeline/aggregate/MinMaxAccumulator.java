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

import com.shardline.plan.AggregateOperator;
import com.shardline.value.NumberValue;
import com.shardline.value.ObjectValue;
import com.shardline.value.UndefinedValue;
import com.shardline.value.Value;
import com.shardline.value.ValueComparator;

/**
 * MIN and MAX in the cross-type order of {@link ValueComparator}.
 * <p>
 * A partial is either the partition's extreme value itself or an object
 * {@code {"min"|"max": value, "count": n}}; a count of zero means the partition had no
 * defined value.
 */
class MinMaxAccumulator implements Accumulator {
    private final AggregateOperator operator;
    private final String field;
    private Value extreme;

    MinMaxAccumulator(AggregateOperator operator, Value initial) {
        this.operator = operator;
        this.field = operator == AggregateOperator.MIN ? "min" : "max";
        this.extreme = initial;
    }

    @Override
    public void add(Value partial) {
        Value candidate = unwrap(partial);
        if (!candidate.isDefined()) {
            return;
        }
        if (!extreme.isDefined()) {
            extreme = candidate;
            return;
        }
        int result = ValueComparator.INSTANCE.compare(candidate, extreme);
        if (operator == AggregateOperator.MIN ? result < 0 : result > 0) {
            extreme = candidate;
        }
    }

    private Value unwrap(Value partial) {
        if (partial instanceof ObjectValue object
                && object.properties().size() == 2
                && object.properties().containsKey(field)
                && object.get("count") instanceof NumberValue count) {
            return count.value() == 0 ? UndefinedValue.INSTANCE : object.get(field);
        }
        return partial;
    }

    @Override
    public Value result() {
        return extreme;
    }

    @Override
    public AccumulatorState state() {
        return operator == AggregateOperator.MIN
                ? new AccumulatorState.Min(extreme)
                : new AccumulatorState.Max(extreme);
    }
}
