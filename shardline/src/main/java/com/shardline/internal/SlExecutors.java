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

import com.google.common.util.concurrent.ThreadFactoryBuilder;

import java.util.concurrent.*;

/**
 * Factory methods for the engine's fetcher pools.
 * <p>
 * Pools start threads on demand up to a bound, queue excess tasks in an unbounded
 * {@link LinkedBlockingQueue} and let idle threads time out, so an idle engine holds no threads.
 * The bound is the core size: a pool whose core size is zero never grows past one thread when
 * its queue is unbounded.
 * Threads are daemons; an engine that is never closed does not keep the JVM alive.
 */
public final class SlExecutors {
    public static final String FETCHER_THREAD_NAME_FORMAT = "sl-fetcher-%d";

    private SlExecutors() {
    }

    /**
     * Creates a bounded executor.
     *
     * @param maxThreads    the maximum number of threads, greater than 0
     * @param keepAliveTime how long an idle thread stays alive
     * @param timeUnit      unit of {@code keepAliveTime}
     * @param factory       thread factory
     * @return a new executor
     */
    public static ExecutorService newBoundedExecutor(
            int maxThreads,
            long keepAliveTime,
            TimeUnit timeUnit,
            ThreadFactory factory
    ) {
        ThreadPoolExecutor executor = new ThreadPoolExecutor(
                maxThreads,
                maxThreads,
                keepAliveTime,
                timeUnit,
                new LinkedBlockingQueue<>(),
                factory
        );
        executor.allowCoreThreadTimeOut(true);
        return executor;
    }

    /**
     * Creates the partition fetcher pool, threads named {@code sl-fetcher-N}.
     *
     * @param maxThreads the maximum number of concurrent page fetches across all queries
     * @return a new executor
     */
    public static ExecutorService newFetcherExecutor(int maxThreads) {
        ThreadFactory factory = new ThreadFactoryBuilder()
                .setNameFormat(FETCHER_THREAD_NAME_FORMAT)
                .setDaemon(true)
                .build();
        return newBoundedExecutor(maxThreads, 1L, TimeUnit.MINUTES, factory);
    }
}
