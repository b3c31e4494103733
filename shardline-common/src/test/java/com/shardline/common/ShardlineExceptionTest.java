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

package com.shardline.common;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ShardlineExceptionTest {

    @Test
    void test_default_prefix() {
        ShardlineException exception = new ShardlineException("something went wrong");
        assertEquals(ErrorPrefix.ERR, exception.getPrefix());
        assertEquals("something went wrong", exception.getMessage());
        assertFalse(exception.isRetryable());
    }

    @Test
    void test_prefix_and_cause() {
        IllegalStateException cause = new IllegalStateException("boom");
        ShardlineException exception = new ShardlineException(ErrorPrefix.FATAL, "fetch failed", cause);
        assertEquals(ErrorPrefix.FATAL, exception.getPrefix());
        assertSame(cause, exception.getCause());
        assertEquals("FATAL fetch failed", exception.toString());
    }

    @Test
    void test_wrap_cause() {
        IllegalStateException cause = new IllegalStateException("boom");
        ShardlineException exception = new ShardlineException(cause);
        assertEquals(ErrorPrefix.ERR, exception.getPrefix());
        assertSame(cause, exception.getCause());
    }
}
