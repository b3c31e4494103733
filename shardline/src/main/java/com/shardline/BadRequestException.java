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

/**
 * The request cannot be executed as given: a malformed or mismatched continuation token, a
 * token on a query shape that cannot resume, or invalid options.
 */
public class BadRequestException extends ShardlineException {
    public BadRequestException(String message) {
        super(ErrorPrefix.BADREQUEST, message);
    }

    public BadRequestException(String prefix, String message) {
        super(prefix, message);
    }

    public BadRequestException(String prefix, String message, Throwable cause) {
        super(prefix, message, cause);
    }

    protected static String withQueryText(String message, String queryText) {
        return String.format("%s, query: '%s'", message, queryText);
    }

    /**
     * Returns the same error with the query it was raised for appended to the message.
     *
     * @param queryText the query text
     * @return a copy of this error
     */
    public BadRequestException forQuery(String queryText) {
        BadRequestException exception = new BadRequestException(getPrefix(), withQueryText(getMessage(), queryText), getCause());
        exception.setStackTrace(getStackTrace());
        return exception;
    }
}
