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

package com.shardline.internal;

import com.shardline.common.ShardlineException;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Graceful shutdown helper for {@link ExecutorService} instances.
 */
public class ExecutorServiceUtil {
    public static final long DEFAULT_TIMEOUT = 10;

    public static final TimeUnit DEFAULT_TIMEOUT_TIMEUNIT = TimeUnit.SECONDS;

    /**
     * Cancels running tasks and waits up to the default timeout for termination.
     *
     * @param executor the executor; null or already terminated returns true immediately
     * @return true if the executor terminated within the timeout
     * @throws ShardlineException if the waiting thread is interrupted
     */
    public static boolean shutdownNowThenAwaitTermination(ExecutorService executor) {
        if (executor == null || executor.isTerminated()) {
            return true;
        }

        executor.shutdownNow();
        try {
            return executor.awaitTermination(DEFAULT_TIMEOUT, DEFAULT_TIMEOUT_TIMEUNIT);
        } catch (InterruptedException exp) {
            Thread.currentThread().interrupt();
            throw new ShardlineException(exp);
        }
    }
}
