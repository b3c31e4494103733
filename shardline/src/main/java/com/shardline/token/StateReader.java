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

package com.shardline.token;

import com.fasterxml.jackson.databind.JsonNode;
import com.shardline.MalformedContinuationTokenException;

import javax.annotation.Nullable;

/**
 * Typed accessors over continuation state that fail with
 * {@link MalformedContinuationTokenException} instead of returning defaults.
 */
public final class StateReader {

    private StateReader() {
    }

    public static JsonNode requireObject(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.isObject()) {
            throw missing(field, "object");
        }
        return value;
    }

    public static JsonNode requireArray(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.isArray()) {
            throw missing(field, "array");
        }
        return value;
    }

    public static int requireInt(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.canConvertToInt() || !value.isIntegralNumber()) {
            throw missing(field, "integer");
        }
        return value.intValue();
    }

    public static long requireLong(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.isIntegralNumber()) {
            throw missing(field, "integer");
        }
        return value.longValue();
    }

    public static double requireDouble(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.isNumber()) {
            throw missing(field, "number");
        }
        return value.doubleValue();
    }

    public static String requireText(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.isTextual()) {
            throw missing(field, "string");
        }
        return value.textValue();
    }

    /**
     * Returns the text of an optional field; an explicit JSON null reads as null.
     */
    @Nullable
    public static String optionalText(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (!value.isTextual()) {
            throw missing(field, "string");
        }
        return value.textValue();
    }

    private static MalformedContinuationTokenException missing(String field, String type) {
        return new MalformedContinuationTokenException(String.format("'%s' must be a %s", field, type));
    }
}
