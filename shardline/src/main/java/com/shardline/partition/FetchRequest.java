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

/**
 * A single page request sent to a {@link PartitionReader}.
 *
 * @param context         request metadata of the query
 * @param range           the partition's key range
 * @param cursor          opaque resume cursor, null to start from the beginning
 * @param maxItemCount    upper bound of rows in the page
 * @param directExecution true when the partition executes the whole query and its rows are final
 */
public record FetchRequest(RequestContext context,
                           KeyRange range,
                           @Nullable String cursor,
                           int maxItemCount,
                           boolean directExecution) {
}
