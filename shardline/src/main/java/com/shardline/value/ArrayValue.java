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

import java.util.List;

public record ArrayValue(List<Value> items) implements Value {
    public ArrayValue {
        items = List.copyOf(items);
    }

    @Override
    public ValueType type() {
        return ValueType.ARRAY;
    }

    public int size() {
        return items.size();
    }
}
