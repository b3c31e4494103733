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
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.io.BaseEncoding;
import com.shardline.BadRequestException;
import com.shardline.MalformedContinuationTokenException;
import com.shardline.common.ShardlineException;
import com.shardline.internal.JSONUtil;

import java.util.Objects;

/**
 * The opaque, composite continuation token handed to callers.
 * <p>
 * A token is a versioned envelope {@code {"version": 1, "shape": "...", "state": {...}}}
 * encoded as unpadded base64url JSON. {@code shape} fingerprints the pipeline that produced the
 * token; {@code state} nests the state of every stage down to the per-partition cursors.
 */
public final class ContinuationToken {
    public static final int VERSION = 1;

    private static final BaseEncoding ENCODING = BaseEncoding.base64Url().omitPadding();
    private static final String VERSION_FIELD = "version";
    private static final String SHAPE_FIELD = "shape";
    private static final String STATE_FIELD = "state";

    private final String shape;
    private final JsonNode state;

    public ContinuationToken(String shape, JsonNode state) {
        this.shape = Objects.requireNonNull(shape, "shape");
        this.state = Objects.requireNonNull(state, "state");
    }

    /**
     * Parses a token produced by {@link #encode()}.
     *
     * @param token the opaque token
     * @return the parsed token
     * @throws MalformedContinuationTokenException if the token cannot be decoded
     */
    public static ContinuationToken decode(String token) {
        byte[] bytes;
        try {
            bytes = ENCODING.decode(token);
        } catch (IllegalArgumentException e) {
            throw new MalformedContinuationTokenException("not base64url", e);
        }

        JsonNode envelope;
        try {
            envelope = JSONUtil.readTree(bytes);
        } catch (ShardlineException e) {
            throw new MalformedContinuationTokenException("not JSON", e);
        }
        if (envelope == null || !envelope.isObject()) {
            throw new MalformedContinuationTokenException("envelope is not an object");
        }

        int version = StateReader.requireInt(envelope, VERSION_FIELD);
        if (version != VERSION) {
            throw new MalformedContinuationTokenException("unsupported version " + version);
        }
        String shape = StateReader.requireText(envelope, SHAPE_FIELD);
        JsonNode state = StateReader.requireObject(envelope, STATE_FIELD);
        return new ContinuationToken(shape, state);
    }

    public String encode() {
        ObjectNode envelope = JSONUtil.objectMapper.createObjectNode();
        envelope.put(VERSION_FIELD, VERSION);
        envelope.put(SHAPE_FIELD, shape);
        envelope.set(STATE_FIELD, state);
        return ENCODING.encode(JSONUtil.writeValueAsBytes(envelope));
    }

    /**
     * Verifies that this token was produced by a pipeline of the given shape.
     *
     * @param expected shape of the pipeline about to resume
     * @throws BadRequestException if the shapes differ
     */
    public void verifyShape(String expected) {
        if (!shape.equals(expected)) {
            throw new BadRequestException(String.format(
                    "Continuation token was produced by a query of shape '%s' but is used with shape '%s'",
                    shape, expected));
        }
    }

    public String shape() {
        return shape;
    }

    public JsonNode state() {
        return state;
    }
}
