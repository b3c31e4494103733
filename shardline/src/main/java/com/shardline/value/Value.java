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
 * A typed, immutable document value flowing through the merge stages.
 * <p>
 * The hierarchy is closed: every stage handles exactly the seven variants below, so adding a
 * type is a compile-time visible change.
 *
 * @see ValueType
 * @see ValueComparator
 * @see DistinctHash
 */
public sealed interface Value permits UndefinedValue, NullValue, BooleanValue, NumberValue, StringValue, ArrayValue, ObjectValue {
    ValueType type();

    /**
     * Returns true unless this is the undefined marker, which stands for "no value present".
     *
     * @return whether a value is present
     */
    default boolean isDefined() {
        return type() != ValueType.UNDEFINED;
    }
}
