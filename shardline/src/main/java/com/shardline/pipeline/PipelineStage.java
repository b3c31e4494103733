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

import com.fasterxml.jackson.databind.node.ObjectNode;

import javax.annotation.Nullable;
import java.util.List;

/**
 * A pull-based stage of the merge pipeline.
 * <p>
 * Stages are driven by a single consumer thread. A stage may return an empty page while it
 * still has work to do, for instance an aggregate that consumed a source page without
 * producing output yet.
 */
public interface PipelineStage extends AutoCloseable {

    /**
     * Produces the next page.
     *
     * @param maxItemCount the maximum number of rows to return
     * @return at most {@code maxItemCount} rows, possibly none
     */
    List<QueryRow> nextPage(int maxItemCount);

    boolean hasMoreResults();

    /**
     * Serializes the state needed to continue after the last returned page. Only valid while
     * {@link #hasMoreResults()} is true and {@link #disallowContinuationReason()} is null.
     *
     * @return the stage state, nesting the state of its source
     */
    ObjectNode saveState();

    /**
     * Returns why this pipeline cannot be suspended into a continuation token, or null if it can.
     */
    @Nullable
    default String disallowContinuationReason() {
        return null;
    }

    @Override
    void close();
}
