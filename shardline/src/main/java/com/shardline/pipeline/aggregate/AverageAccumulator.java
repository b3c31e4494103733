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

import com.shardline.value.NumberValue;
import com.shardline.value.ObjectValue;
import com.shardline.value.UndefinedValue;
import com.shardline.value.Value;

/**
 * AVG over partials of the form {@code {"sum": number|undefined, "count": n}}. An undefined
 * sum with a positive count means the partition averaged non-numeric values; the result is
 * then undefined.
 */
class AverageAccumulator implements Accumulator {
    private double sum;
    private boolean numeric;
    private long count;

    AverageAccumulator(AccumulatorState.Avg state) {
        if (state.sum() instanceof NumberValue number) {
            this.sum = number.value();
            this.numeric = true;
        }
        this.count = state.count();
    }

    @Override
    public void add(Value partial) {
        if (!partial.isDefined()) {
            return;
        }
        if (!(partial instanceof ObjectValue object) || !(object.get("count") instanceof NumberValue partialCount)) {
            throw new IllegalStateException("AVG partial must be an object with a count, got " + partial.type());
        }
        if (partialCount.value() == 0) {
            return;
        }
        count += (long) partialCount.value();
        if (object.get("sum") instanceof NumberValue partialSum) {
            sum += partialSum.value();
        } else {
            numeric = false;
        }
    }

    @Override
    public Value result() {
        if (!numeric || count == 0) {
            return UndefinedValue.INSTANCE;
        }
        return new NumberValue(sum / count);
    }

    @Override
    public AccumulatorState state() {
        return new AccumulatorState.Avg(numeric ? new NumberValue(sum) : UndefinedValue.INSTANCE, count);
    }
}
