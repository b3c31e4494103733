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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.shardline.internal.JSONUtil;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Factory methods and Jackson conversions for {@link Value}.
 * <p>
 * JSON has no undefined: {@link #toJson(Value)} returns {@code null} for it and drops undefined
 * members of objects and arrays, {@link #fromJson(JsonNode)} maps a missing node to undefined.
 */
public final class Values {
    private static final JsonNodeFactory FACTORY = JsonNodeFactory.instance;

    private Values() {
    }

    public static Value of(double number) {
        return new NumberValue(number);
    }

    public static Value of(String string) {
        return new StringValue(string);
    }

    public static Value of(boolean bool) {
        return bool ? BooleanValue.TRUE : BooleanValue.FALSE;
    }

    public static ArrayValue array(Value... items) {
        return new ArrayValue(List.of(items));
    }

    /**
     * Builds an object from alternating name/value pairs.
     *
     * @param namesAndValues name, value, name, value...
     * @return the object
     */
    public static ObjectValue object(Object... namesAndValues) {
        if (namesAndValues.length % 2 != 0) {
            throw new IllegalArgumentException("names and values must come in pairs");
        }
        Map<String, Value> properties = new LinkedHashMap<>();
        for (int i = 0; i < namesAndValues.length; i += 2) {
            properties.put((String) namesAndValues[i], (Value) namesAndValues[i + 1]);
        }
        return new ObjectValue(properties);
    }

    /**
     * Parses a JSON text into a value.
     *
     * @param json the JSON text
     * @return the parsed value
     */
    public static Value parse(String json) {
        return fromJson(JSONUtil.readTree(json));
    }

    public static Value fromJson(JsonNode node) {
        if (node == null || node.isMissingNode()) {
            return UndefinedValue.INSTANCE;
        }
        if (node.isNull()) {
            return NullValue.INSTANCE;
        }
        if (node.isBoolean()) {
            return of(node.booleanValue());
        }
        if (node.isNumber()) {
            return new NumberValue(node.doubleValue());
        }
        if (node.isTextual()) {
            return new StringValue(node.textValue());
        }
        if (node.isArray()) {
            List<Value> items = new ArrayList<>(node.size());
            for (JsonNode item : node) {
                items.add(fromJson(item));
            }
            return new ArrayValue(items);
        }
        if (node.isObject()) {
            Map<String, Value> properties = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                properties.put(field.getKey(), fromJson(field.getValue()));
            }
            return new ObjectValue(properties);
        }
        throw new IllegalArgumentException("Unsupported JSON node type: " + node.getNodeType());
    }

    /**
     * Converts a value to a Jackson tree.
     *
     * @param value the value
     * @return the JSON node, or {@code null} for undefined
     */
    public static JsonNode toJson(Value value) {
        if (value instanceof UndefinedValue) {
            return null;
        }
        if (value instanceof NullValue) {
            return FACTORY.nullNode();
        }
        if (value instanceof BooleanValue b) {
            return FACTORY.booleanNode(b.value());
        }
        if (value instanceof NumberValue n) {
            if (n.isIntegral()) {
                return FACTORY.numberNode((long) n.value());
            }
            return FACTORY.numberNode(n.value());
        }
        if (value instanceof StringValue s) {
            return FACTORY.textNode(s.value());
        }
        if (value instanceof ArrayValue a) {
            ArrayNode array = FACTORY.arrayNode(a.size());
            for (Value item : a.items()) {
                JsonNode node = toJson(item);
                if (node != null) {
                    array.add(node);
                }
            }
            return array;
        }
        if (value instanceof ObjectValue o) {
            ObjectNode object = FACTORY.objectNode();
            for (Map.Entry<String, Value> entry : o.properties().entrySet()) {
                JsonNode node = toJson(entry.getValue());
                if (node != null) {
                    object.set(entry.getKey(), node);
                }
            }
            return object;
        }
        throw new IllegalStateException("Unknown value type: " + value.type());
    }

    /**
     * Renders a value as compact JSON text; undefined renders as {@code undefined}.
     *
     * @param value the value
     * @return the JSON text
     */
    public static String toJsonString(Value value) {
        JsonNode node = toJson(value);
        return node == null ? "undefined" : node.toString();
    }
}
