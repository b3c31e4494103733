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

import com.shardline.value.NumberValue;
import com.shardline.value.Value;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reciprocal rank fusion of the component scores of hybrid search results.
 * <p>
 * For each component, rows are ranked by score, highest first, starting at 1; rows with
 * identical scores share a rank. Each row's fused score is the sum of {@code 1 / (k + rank)}
 * over all components with {@code k = 60}. Ties are broken by rid, ascending, both within a
 * component and in the fused order.
 */
public final class RankFusion {
    public static final int RRF_CONSTANT = 60;

    private RankFusion() {
    }

    /**
     * Fuses the rows of all partitions. Rows sharing a rid are returned once.
     *
     * @param rows           rows with one score per component
     * @param componentCount number of components
     * @return rows in fused order
     * @throws IllegalStateException if a row lacks a numeric score for a component
     */
    public static List<QueryRow> fuse(List<QueryRow> rows, int componentCount) {
        Map<String, QueryRow> unique = new LinkedHashMap<>();
        for (QueryRow row : rows) {
            unique.putIfAbsent(row.rid(), row);
        }
        List<QueryRow> candidates = new ArrayList<>(unique.values());
        candidates.sort(Comparator.comparing(QueryRow::rid));

        int size = candidates.size();
        double[][] scores = new double[componentCount][size];
        for (int i = 0; i < size; i++) {
            QueryRow row = candidates.get(i);
            if (row.componentScores().size() != componentCount) {
                throw new IllegalStateException(String.format(
                        "Row %s has %d component scores, expected %d", row.rid(), row.componentScores().size(), componentCount));
            }
            for (int c = 0; c < componentCount; c++) {
                Value score = row.componentScores().get(c);
                if (!(score instanceof NumberValue number)) {
                    throw new IllegalStateException(String.format(
                            "Component score %d of row %s is not a number: %s", c, row.rid(), score.type()));
                }
                scores[c][i] = number.value();
            }
        }

        double[] fused = new double[size];
        for (int c = 0; c < componentCount; c++) {
            double[] component = scores[c];
            List<Integer> order = new ArrayList<>(size);
            for (int i = 0; i < size; i++) {
                order.add(i);
            }
            // candidates are sorted by rid, a stable sort keeps rid order within equal scores
            order.sort((left, right) -> Double.compare(component[right], component[left]));
            int rank = 0;
            for (int position = 0; position < size; position++) {
                int index = order.get(position);
                if (position == 0 || component[index] != component[order.get(position - 1)]) {
                    rank++;
                }
                fused[index] += 1.0 / (RRF_CONSTANT + rank);
            }
        }

        List<Integer> result = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            result.add(i);
        }
        result.sort((left, right) -> Double.compare(fused[right], fused[left]));
        List<QueryRow> ordered = new ArrayList<>(size);
        for (int index : result) {
            ordered.add(candidates.get(index));
        }
        return ordered;
    }
}
