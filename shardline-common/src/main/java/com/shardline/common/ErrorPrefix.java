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
 * Error prefixes attached to every {@link ShardlineException}. Callers branch on the prefix
 * instead of parsing messages.
 */
public final class ErrorPrefix {
    public static final String ERR = "ERR";
    public static final String BADREQUEST = "BADREQUEST";
    public static final String UNSUPPORTED = "UNSUPPORTED";
    public static final String BADTOKEN = "BADTOKEN";
    public static final String TRANSIENT = "TRANSIENT";
    public static final String FATAL = "FATAL";
    public static final String CANCELLED = "CANCELLED";

    public static final String MALFORMED_TOKEN_MESSAGE = "Malformed continuation token";
    public static final String CANCELLED_MESSAGE = "Query execution has been cancelled";

    private ErrorPrefix() {
    }
}
