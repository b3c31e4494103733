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
import com.shardline.value.UndefinedValue;
import com.shardline.value.Value;

/**
 * SUM over numeric partials. A non-numeric partial makes the sum undefined.
 */
class SumAccumulator implements Accumulator {
    private double sum;
    private boolean numeric;
    private long count;

    SumAccumulator(AccumulatorState.Sum state) {
        if (state.value() instanceof NumberValue number) {
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
        count++;
        if (partial instanceof NumberValue number) {
            sum += number.value();
        } else {
            numeric = false;
        }
    }

    @Override
    public Value result() {
        return numeric ? new NumberValue(sum) : UndefinedValue.INSTANCE;
    }

    @Override
    public AccumulatorState state() {
        return new AccumulatorState.Sum(result(), count);
    }
}
