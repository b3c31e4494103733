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

import javax.annotation.Nullable;
import java.util.Objects;
import java.util.UUID;

/**
 * Per-request metadata passed explicitly to every page fetch of a query.
 *
 * @param activityId   correlates all fetches of one query
 * @param apiVersion   protocol version the reader should speak
 * @param sessionToken session consistency token, null when not used
 */
public record RequestContext(String activityId, String apiVersion, @Nullable String sessionToken) {
    public static final String DEFAULT_API_VERSION = "2018-12-31";

    public RequestContext {
        Objects.requireNonNull(activityId, "activityId");
        Objects.requireNonNull(apiVersion, "apiVersion");
    }

    public static RequestContext create() {
        return new RequestContext(UUID.randomUUID().toString(), DEFAULT_API_VERSION, null);
    }
}
