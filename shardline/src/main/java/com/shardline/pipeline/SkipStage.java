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

package com.shardline.pipeline;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.shardline.MalformedContinuationTokenException;
import com.shardline.token.StateReader;

import javax.annotation.Nullable;
import java.util.List;

/**
 * OFFSET: drops the first rows of its source. The request charge of dropped rows is still
 * reported, since they were fetched.
 */
public class SkipStage extends DelegatingStage {
    private static final String SKIP = "skip";

    private int skipCount;

    private SkipStage(PipelineStage source, int skipCount) {
        super(source);
        this.skipCount = skipCount;
    }

    public static SkipStage create(PipelineStage source, int offset, @Nullable JsonNode state) {
        if (state == null) {
            return new SkipStage(source, offset);
        }
        int remaining = StateReader.requireInt(state, SKIP);
        if (remaining < 0 || remaining > offset) {
            throw new MalformedContinuationTokenException("'skip' must be between 0 and " + offset);
        }
        return new SkipStage(source, remaining);
    }

    @Override
    public List<QueryRow> nextPage(int maxItemCount) {
        List<QueryRow> rows = source.nextPage(maxItemCount);
        if (skipCount == 0 || rows.isEmpty()) {
            return rows;
        }
        int skipped = Math.min(skipCount, rows.size());
        skipCount -= skipped;
        return rows.subList(skipped, rows.size());
    }

    @Override
    public ObjectNode saveState() {
        ObjectNode state = newState();
        state.put(SKIP, skipCount);
        return state;
    }
}
