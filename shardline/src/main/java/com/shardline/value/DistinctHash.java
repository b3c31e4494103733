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

import com.google.common.hash.HashCode;
import com.google.common.hash.HashFunction;
import com.google.common.hash.Hasher;
import com.google.common.hash.Hashing;

import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Canonical 128-bit hash of a {@link Value}, used for DISTINCT and GROUP BY keys.
 * <p>
 * Two values that are equal under the engine's value semantics produce the same hash:
 * <ul>
 *   <li>numbers hash by their double value, so {@code 1} and {@code 1.0} are equal and -0 equals 0,</li>
 *   <li>object members are combined order-independently,</li>
 *   <li>undefined members of arrays and objects are ignored.</li>
 * </ul>
 * Every type is mixed with its own tag, so {@code "1"} and {@code 1} never collide structurally.
 */
public final class DistinctHash {
    private static final HashFunction HASH_FUNCTION = Hashing.murmur3_128(0x5eed);

    private static final byte UNDEFINED_TAG = 0x00;
    private static final byte NULL_TAG = 0x01;
    private static final byte FALSE_TAG = 0x02;
    private static final byte TRUE_TAG = 0x03;
    private static final byte NUMBER_TAG = 0x04;
    private static final byte STRING_TAG = 0x05;
    private static final byte ARRAY_TAG = 0x06;
    private static final byte OBJECT_TAG = 0x07;
    private static final byte MEMBER_TAG = 0x08;

    private DistinctHash() {
    }

    /**
     * Hashes a single value.
     *
     * @param value the value
     * @return the 128-bit canonical hash
     */
    public static HashCode of(Value value) {
        Hasher hasher = HASH_FUNCTION.newHasher();
        put(hasher, value);
        return hasher.hash();
    }

    /**
     * Hashes an ordered list of values, for example the group-by items of a row.
     *
     * @param values the values
     * @return the 128-bit canonical hash
     */
    public static HashCode of(Iterable<Value> values) {
        Hasher hasher = HASH_FUNCTION.newHasher();
        hasher.putByte(ARRAY_TAG);
        for (Value value : values) {
            put(hasher, value);
        }
        return hasher.hash();
    }

    private static void put(Hasher hasher, Value value) {
        if (value instanceof UndefinedValue) {
            hasher.putByte(UNDEFINED_TAG);
        } else if (value instanceof NullValue) {
            hasher.putByte(NULL_TAG);
        } else if (value instanceof BooleanValue b) {
            hasher.putByte(b.value() ? TRUE_TAG : FALSE_TAG);
        } else if (value instanceof NumberValue n) {
            double d = n.value() == 0.0 ? 0.0 : n.value();
            hasher.putByte(NUMBER_TAG).putDouble(d);
        } else if (value instanceof StringValue s) {
            hasher.putByte(STRING_TAG).putString(s.value(), StandardCharsets.UTF_8);
        } else if (value instanceof ArrayValue a) {
            hasher.putByte(ARRAY_TAG);
            for (Value item : a.items()) {
                if (item.isDefined()) {
                    hasher.putBytes(of(item).asBytes());
                }
            }
        } else if (value instanceof ObjectValue o) {
            hasher.putByte(OBJECT_TAG).putBytes(objectDigest(o));
        } else {
            throw new IllegalStateException("Unknown value type: " + value.type());
        }
    }

    private static byte[] objectDigest(ObjectValue object) {
        byte[] digest = new byte[16];
        for (Map.Entry<String, Value> entry : object.properties().entrySet()) {
            if (!entry.getValue().isDefined()) {
                continue;
            }
            Hasher member = HASH_FUNCTION.newHasher();
            member.putByte(MEMBER_TAG).putString(entry.getKey(), StandardCharsets.UTF_8);
            put(member, entry.getValue());
            byte[] bytes = member.hash().asBytes();
            for (int i = 0; i < digest.length; i++) {
                digest[i] ^= bytes[i];
            }
        }
        return digest;
    }
}
