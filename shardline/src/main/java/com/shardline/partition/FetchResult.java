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

package com.shardline.partition;

import java.time.Duration;

/**
 * Outcome of {@link PartitionReader#fetchPage(FetchRequest)}. Throttling and splits are
 * ordinary results, not exceptions.
 */
public sealed interface FetchResult permits FetchResult.Success, FetchResult.Throttled, FetchResult.Gone, FetchResult.Failure {

    static FetchResult success(Page page) {
        return new Success(page);
    }

    static FetchResult throttled(Duration retryAfter) {
        return new Throttled(retryAfter);
    }

    static FetchResult gone() {
        return new Gone();
    }

    static FetchResult failure(Throwable cause) {
        return new Failure(cause);
    }

    record Success(Page page) implements FetchResult {
    }

    /**
     * The partition is temporarily overloaded; the same request may be issued again.
     */
    record Throttled(Duration retryAfter) implements FetchResult {
    }

    /**
     * The key range is no longer served by a single partition, it was split.
     */
    record Gone() implements FetchResult {
    }

    record Failure(Throwable cause) implements FetchResult {
    }
}
