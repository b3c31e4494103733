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

package com.shardline;

import com.shardline.common.ErrorPrefix;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class QueryRequestOptionsTest {

    @Test
    void test_defaults() {
        QueryRequestOptions options = QueryRequestOptions.defaults();
        assertEquals(QueryRequestOptions.DEFAULT_MAX_ITEM_COUNT, options.maxItemCount());
        assertNull(options.maxConcurrency());
        assertNull(options.maxBufferedItemCount());
        assertNull(options.optimisticDirectExecution());
    }

    @Test
    void test_builder() {
        QueryRequestOptions options = QueryRequestOptions.builder()
                .maxItemCount(25)
                .maxConcurrency(0)
                .maxBufferedItemCount(500)
                .optimisticDirectExecution(true)
                .build();
        assertEquals(25, options.maxItemCount());
        assertEquals(0, options.maxConcurrency());
        assertEquals(500, options.maxBufferedItemCount());
        assertTrue(options.optimisticDirectExecution());
    }

    @ParameterizedTest
    @ValueSource(ints = {0, -2, Integer.MIN_VALUE})
    void test_invalid_max_item_count(int maxItemCount) {
        BadRequestException exception = assertThrows(BadRequestException.class,
                () -> QueryRequestOptions.builder().maxItemCount(maxItemCount));
        assertEquals(ErrorPrefix.BADREQUEST, exception.getPrefix());
    }

    @Test
    void test_invalid_max_buffered_item_count() {
        assertThrows(BadRequestException.class, () -> QueryRequestOptions.builder().maxBufferedItemCount(0));
    }
}
