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
import com.shardline.BadRequestException;
import com.shardline.pipeline.aggregate.AggregateStage;
import com.shardline.pipeline.aggregate.GroupByStage;
import com.shardline.pipeline.distinct.DistinctStage;
import com.shardline.plan.AggregateSpec;
import com.shardline.plan.DistributionPlan;
import com.shardline.plan.OrderByColumn;
import com.shardline.plan.SortOrder;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Composes the stage pipeline of a plan.
 * <p>
 * Stages are stacked innermost first:
 * <ol>
 *   <li>source: direct pass-through, ORDER BY merge or unordered merge,</li>
 *   <li>hybrid search rank fusion,</li>
 *   <li>aggregate without GROUP BY, or GROUP BY,</li>
 *   <li>DISTINCT,</li>
 *   <li>OFFSET, LIMIT, TOP,</li>
 *   <li>DCOUNT.</li>
 * </ol>
 * Each stage's saved state nests its source's state, so resuming walks the saved state from
 * the outermost stage inwards.
 */
public final class PipelineFactory {

    private PipelineFactory() {
    }

    private static List<StageKind> stages(DistributionPlan plan, boolean direct) {
        List<StageKind> stages = new ArrayList<>();
        if (direct) {
            stages.add(StageKind.DIRECT);
            return stages;
        }
        stages.add(plan.hasOrderBy() ? StageKind.ORDER_BY : StageKind.UNORDERED);
        if (plan.isHybridSearch()) {
            stages.add(StageKind.HYBRID_SEARCH);
        }
        if (plan.hasGroupBy()) {
            stages.add(StageKind.GROUP_BY);
        } else if (plan.hasAggregates()) {
            stages.add(StageKind.AGGREGATE);
        }
        if (plan.isDistinct()) {
            stages.add(StageKind.DISTINCT);
        }
        if (plan.offset() != null) {
            stages.add(StageKind.SKIP);
        }
        if (plan.limit() != null) {
            stages.add(StageKind.LIMIT);
        }
        if (plan.top() != null) {
            stages.add(StageKind.TOP);
        }
        if (plan.isDCount()) {
            stages.add(StageKind.DCOUNT);
        }
        return stages;
    }

    /**
     * Fingerprints the pipeline of a plan. Tokens can only resume a pipeline of the same shape.
     *
     * @param plan   the plan
     * @param direct whether the query runs in direct execution mode
     * @return the shape
     */
    public static String shape(DistributionPlan plan, boolean direct) {
        List<String> parts = new ArrayList<>();
        for (StageKind kind : stages(plan, direct)) {
            switch (kind) {
                case ORDER_BY -> parts.add("ORDER_BY(" + plan.orderBy().stream()
                        .map(OrderByColumn::order)
                        .map(order -> order == SortOrder.ASCENDING ? "ASC" : "DESC")
                        .collect(Collectors.joining(",")) + ")");
                case AGGREGATE -> parts.add("AGGREGATE(" + plan.aggregates().stream()
                        .map(AggregateSpec::operator)
                        .map(Enum::name)
                        .collect(Collectors.joining(",")) + ")");
                case DISTINCT -> parts.add("DISTINCT(" + plan.distinctType().name() + ")");
                default -> parts.add(kind.name());
            }
        }
        return String.join(">", parts);
    }

    /**
     * Rejects plans whose pipeline holds its whole input and therefore cannot be resumed.
     *
     * @param plan the plan
     * @throws BadRequestException if the plan has GROUP BY or is a hybrid search
     */
    public static void checkResumable(DistributionPlan plan) {
        if (plan.hasGroupBy()) {
            throw new BadRequestException(GroupByStage.DISALLOW_CONTINUATION_REASON + ": " + plan.queryText());
        }
        if (plan.isHybridSearch()) {
            throw new BadRequestException(HybridSearchStage.DISALLOW_CONTINUATION_REASON + ": " + plan.queryText());
        }
    }

    /**
     * Builds the pipeline.
     *
     * @param context the query's shared context
     * @param state   the state saved in a continuation token, null for a fresh start
     * @return the outermost stage
     * @throws BadRequestException if the pipeline cannot be resumed from a token
     */
    public static PipelineStage create(PipelineContext context, @Nullable JsonNode state) {
        DistributionPlan plan = context.plan();
        List<StageKind> stages = stages(plan, context.fetchContext().isDirectExecution());
        if (state != null) {
            checkResumable(plan);
        }

        JsonNode[] states = new JsonNode[stages.size()];
        states[stages.size() - 1] = state;
        for (int i = stages.size() - 1; i > 0; i--) {
            states[i - 1] = DelegatingStage.sourceState(states[i]);
        }

        PipelineStage stage = null;
        for (int i = 0; i < stages.size(); i++) {
            stage = switch (stages.get(i)) {
                case DIRECT -> new PassThroughStage(context, states[i]);
                case ORDER_BY -> new OrderByMergeStage(context, states[i]);
                case UNORDERED -> new UnorderedMergeStage(context, states[i]);
                case HYBRID_SEARCH -> new HybridSearchStage(stage, plan.hybridSearch());
                case GROUP_BY -> new GroupByStage(stage, plan);
                case AGGREGATE -> AggregateStage.create(stage, plan, states[i]);
                case DISTINCT -> DistinctStage.create(stage, plan.distinctType(), states[i]);
                case SKIP -> SkipStage.create(stage, plan.offset(), states[i]);
                case LIMIT -> TakeStage.create(stage, plan.limit(), states[i]);
                case TOP -> TakeStage.create(stage, plan.top(), states[i]);
                case DCOUNT -> DCountStage.create(stage, plan.dCountAlias(), plan.isSelectValue(), states[i]);
            };
        }
        return stage;
    }

    private enum StageKind {
        DIRECT,
        ORDER_BY,
        UNORDERED,
        HYBRID_SEARCH,
        GROUP_BY,
        AGGREGATE,
        DISTINCT,
        SKIP,
        LIMIT,
        TOP,
        DCOUNT
    }
}
