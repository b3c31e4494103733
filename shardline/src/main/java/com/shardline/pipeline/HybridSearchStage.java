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
import com.shardline.plan.HybridSearchInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Hybrid search: drains every partition, fuses the component rankings with
 * {@link RankFusion}, applies the post-fusion skip and take, then pages through the result.
 * The fused result is held by the iterator; the query cannot be resumed from a token.
 */
public class HybridSearchStage extends DelegatingStage {
    public static final String DISALLOW_CONTINUATION_REASON = "hybrid search queries cannot be resumed with a continuation token";
    private static final Logger LOGGER = LoggerFactory.getLogger(HybridSearchStage.class);

    private final HybridSearchInfo info;
    private List<QueryRow> results;
    private int position;

    public HybridSearchStage(PipelineStage source, HybridSearchInfo info) {
        super(source);
        this.info = info;
    }

    @Override
    public List<QueryRow> nextPage(int maxItemCount) {
        if (results == null) {
            List<QueryRow> candidates = new ArrayList<>();
            while (source.hasMoreResults()) {
                candidates.addAll(source.nextPage(maxItemCount));
            }
            List<QueryRow> fused = RankFusion.fuse(candidates, info.componentCount());
            int from = info.skip() == null ? 0 : Math.min(info.skip(), fused.size());
            int to = info.take() == null ? fused.size() : Math.min(fused.size(), from + info.take());
            results = fused.subList(from, to);
            LOGGER.debug("Fused {} candidates into {} results", candidates.size(), results.size());
        }
        int end = Math.min(results.size(), position + maxItemCount);
        List<QueryRow> page = results.subList(position, end);
        position = end;
        return page;
    }

    @Override
    public boolean hasMoreResults() {
        return results == null || position < results.size();
    }

    @Override
    public ObjectNode saveState() {
        throw new IllegalStateException(DISALLOW_CONTINUATION_REASON);
    }

    @Override
    public String disallowContinuationReason() {
        return DISALLOW_CONTINUATION_REASON;
    }
}
