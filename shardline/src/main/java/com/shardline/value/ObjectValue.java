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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * An object value. Property order is preserved for output but ignored by equality-like
 * operations such as {@link DistinctHash}.
 */
public record ObjectValue(Map<String, Value> properties) implements Value {
    public ObjectValue {
        properties = Collections.unmodifiableMap(new LinkedHashMap<>(properties));
    }

    @Override
    public ValueType type() {
        return ValueType.OBJECT;
    }

    /**
     * Returns the property value, or {@link UndefinedValue#INSTANCE} when the property is absent.
     *
     * @param name property name
     * @return the value, never null
     */
    public Value get(String name) {
        Value value = properties.get(name);
        return value == null ? UndefinedValue.INSTANCE : value;
    }
}
