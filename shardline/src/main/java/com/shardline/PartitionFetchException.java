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
import com.shardline.common.ShardlineException;
import com.shardline.partition.KeyRange;

/**
 * A page fetch failed. Carries the key range of the partition that failed and names the query
 * in its message. Transient failures
 * that exhausted their retries are retryable, any other failure is terminal for the query.
 */
public class PartitionFetchException extends ShardlineException {
    private final KeyRange range;
    private final boolean retryable;

    private PartitionFetchException(String prefix, KeyRange range, String message, Throwable cause, boolean retryable) {
        super(prefix, message, cause);
        this.range = range;
        this.retryable = retryable;
    }

    public static PartitionFetchException transientFailure(String queryText, KeyRange range, int attempts) {
        String message = String.format("Partition %s is still throttled after %d attempts, query: '%s'",
                range, attempts, queryText);
        return new PartitionFetchException(ErrorPrefix.TRANSIENT, range, message, null, true);
    }

    public static PartitionFetchException splitDuringDirectExecution(String queryText, KeyRange range) {
        String message = String.format("Partition %s was split during direct execution, restart the query: '%s'",
                range, queryText);
        return new PartitionFetchException(ErrorPrefix.TRANSIENT, range, message, null, true);
    }

    public static PartitionFetchException fatal(String queryText, KeyRange range, Throwable cause) {
        String message = String.format("Fetching a page from partition %s failed: %s, query: '%s'",
                range, cause.getMessage(), queryText);
        return new PartitionFetchException(ErrorPrefix.FATAL, range, message, cause, false);
    }

    public KeyRange getRange() {
        return range;
    }

    @Override
    public boolean isRetryable() {
        return retryable;
    }
}
