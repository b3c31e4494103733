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
 * TOP and LIMIT: passes through at most a fixed number of rows. Never asks its source for more
 * rows than it still needs, and stops pulling once the quota is reached.
 */
public class TakeStage extends DelegatingStage {
    private static final String TAKE = "take";

    private int takeCount;

    private TakeStage(PipelineStage source, int takeCount) {
        super(source);
        this.takeCount = takeCount;
    }

    public static TakeStage create(PipelineStage source, int count, @Nullable JsonNode state) {
        if (state == null) {
            return new TakeStage(source, count);
        }
        int remaining = StateReader.requireInt(state, TAKE);
        if (remaining < 0 || remaining > count) {
            throw new MalformedContinuationTokenException("'take' must be between 0 and " + count);
        }
        return new TakeStage(source, remaining);
    }

    @Override
    public List<QueryRow> nextPage(int maxItemCount) {
        if (takeCount <= 0) {
            return List.of();
        }
        List<QueryRow> rows = source.nextPage(Math.min(maxItemCount, takeCount));
        if (rows.size() > takeCount) {
            rows = rows.subList(0, takeCount);
        }
        takeCount -= rows.size();
        return rows;
    }

    @Override
    public boolean hasMoreResults() {
        return takeCount > 0 && source.hasMoreResults();
    }

    @Override
    public ObjectNode saveState() {
        ObjectNode state = newState();
        state.put(TAKE, takeCount);
        return state;
    }
}
