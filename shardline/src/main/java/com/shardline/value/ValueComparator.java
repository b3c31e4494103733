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

import java.util.Comparator;

/**
 * Total order over {@link Value}s used by ORDER BY, MIN and MAX.
 * <p>
 * Values of different types are ordered by their {@link ValueType} bucket. Within a bucket,
 * booleans order false before true, numbers numerically (with -0 equal to 0), strings by
 * UTF-16 code unit. Arrays and objects compare equal to every other array or object; they
 * keep their position in the cross-type order but are not ordered among themselves.
 */
public final class ValueComparator implements Comparator<Value> {
    public static final ValueComparator INSTANCE = new ValueComparator();

    private ValueComparator() {
    }

    @Override
    public int compare(Value left, Value right) {
        int byType = Integer.compare(left.type().ordinal(), right.type().ordinal());
        if (byType != 0) {
            return byType;
        }
        if (left instanceof BooleanValue l && right instanceof BooleanValue r) {
            return Boolean.compare(l.value(), r.value());
        }
        if (left instanceof NumberValue l && right instanceof NumberValue r) {
            if (l.value() == r.value()) {
                return 0;
            }
            return Double.compare(l.value(), r.value());
        }
        if (left instanceof StringValue l && right instanceof StringValue r) {
            return l.value().compareTo(r.value());
        }
        // Undefined, Null, Array and Object
        return 0;
    }
}
