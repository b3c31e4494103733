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
import com.shardline.value.Value;

/**
 * Combines the partial aggregates returned by partitions into the final aggregate value.
 * <p>
 * Every partition contributes one partial per group. An undefined partial stands for a
 * partition without matching rows and contributes nothing.
 */
public interface Accumulator {

    static Accumulator create(AggregateOperator operator) {
        return restore(AccumulatorState.empty(operator));
    }

    static Accumulator restore(AccumulatorState state) {
        if (state instanceof AccumulatorState.Sum sum) {
            return new SumAccumulator(sum);
        } else if (state instanceof AccumulatorState.Count count) {
            return new CountAccumulator(count);
        } else if (state instanceof AccumulatorState.Min min) {
            return new MinMaxAccumulator(AggregateOperator.MIN, min.value());
        } else if (state instanceof AccumulatorState.Max max) {
            return new MinMaxAccumulator(AggregateOperator.MAX, max.value());
        } else if (state instanceof AccumulatorState.Avg avg) {
            return new AverageAccumulator(avg);
        }
        throw new IllegalStateException("Unknown accumulator state: " + state);
    }

    /**
     * Merges a partial aggregate.
     *
     * @param partial the partial returned by one partition
     */
    void add(Value partial);

    /**
     * Returns the aggregate of everything merged so far, undefined when there is none.
     *
     * @return the aggregate value
     */
    Value result();

    AccumulatorState state();
}
