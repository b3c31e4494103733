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
import com.shardline.internal.JSONUtil;
import com.shardline.token.StateReader;

import javax.annotation.Nullable;

/**
 * Base class of stages that transform the output of a single source stage.
 */
public abstract class DelegatingStage implements PipelineStage {
    protected static final String SOURCE = "source";

    protected final PipelineStage source;

    protected DelegatingStage(PipelineStage source) {
        this.source = source;
    }

    /**
     * Returns the nested source state of a saved state, or null when resuming from scratch.
     */
    @Nullable
    public static JsonNode sourceState(@Nullable JsonNode state) {
        return state == null ? null : StateReader.requireObject(state, SOURCE);
    }

    /**
     * Creates a state object holding the source's state.
     */
    protected ObjectNode newState() {
        ObjectNode state = JSONUtil.objectMapper.createObjectNode();
        state.set(SOURCE, source.saveState());
        return state;
    }

    @Override
    public boolean hasMoreResults() {
        return source.hasMoreResults();
    }

    @Nullable
    @Override
    public String disallowContinuationReason() {
        return source.disallowContinuationReason();
    }

    @Override
    public void close() {
        source.close();
    }
}
