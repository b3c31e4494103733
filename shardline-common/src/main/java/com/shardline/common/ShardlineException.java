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

/**
 * Base class of all the errors raised by Shardline.
 * <p>
 * Every exception carries a prefix from {@link ErrorPrefix} and tells whether the failed
 * operation may succeed when it is issued again unchanged.
 */
public class ShardlineException extends RuntimeException {
    private final String prefix;

    public ShardlineException(String prefix, String message) {
        super(message);
        this.prefix = prefix;
    }

    public ShardlineException(String prefix, String message, Throwable cause) {
        super(message, cause);
        this.prefix = prefix;
    }

    public ShardlineException(String message) {
        this(ErrorPrefix.ERR, message);
    }

    public ShardlineException(String message, Throwable cause) {
        this(ErrorPrefix.ERR, message, cause);
    }

    public ShardlineException(Throwable cause) {
        super(cause);
        this.prefix = ErrorPrefix.ERR;
    }

    public String getPrefix() {
        return prefix;
    }

    /**
     * Returns true if issuing the same operation again may succeed. Defaults to false, only
     * transient failures override it.
     *
     * @return whether the operation is retryable
     */
    public boolean isRetryable() {
        return false;
    }

    @Override
    public String toString() {
        return prefix + " " + getMessage();
    }
}
