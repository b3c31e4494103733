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

/**
 * Numbers are kept in double precision. Integers beyond 2^53 lose precision, so two distinct
 * 64-bit integers near 2^63 may compare and hash as equal.
 */
public record NumberValue(double value) implements Value {

    @Override
    public ValueType type() {
        return ValueType.NUMBER;
    }

    /**
     * Returns true if the number has no fractional part and fits into a long.
     *
     * @return whether the value is integral
     */
    public boolean isIntegral() {
        return value == Math.rint(value) && !Double.isInfinite(value) && Math.abs(value) < 0x1p63;
    }
}
