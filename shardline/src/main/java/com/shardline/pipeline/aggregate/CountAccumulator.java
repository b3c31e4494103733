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
import com.shardline.value.Value;

class CountAccumulator implements Accumulator {
    private long count;

    CountAccumulator(AccumulatorState.Count state) {
        this.count = state.value();
    }

    @Override
    public void add(Value partial) {
        if (partial instanceof NumberValue number) {
            count += (long) number.value();
        } else if (partial.isDefined()) {
            throw new IllegalStateException("COUNT partial must be a number, got " + partial.type());
        }
    }

    @Override
    public Value result() {
        return new NumberValue(count);
    }

    @Override
    public AccumulatorState state() {
        return new AccumulatorState.Count(count);
    }
}
