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

import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Decorates a {@link PartitionReader} so that {@link FetchResult.Throttled} results are retried
 * with the same request. Once the attempts are exhausted the last throttled result is returned
 * to the caller unchanged. Exceptions thrown by the delegate are not retried.
 */
public class RetryingPartitionReader implements PartitionReader {
    public static final String PARTITION_FETCH = "PARTITION_FETCH";
    private static final Logger LOGGER = LoggerFactory.getLogger(RetryingPartitionReader.class);

    private final PartitionReader delegate;
    private final Retry retry;

    public RetryingPartitionReader(PartitionReader delegate, int maxAttempts, Duration waitDuration) {
        this.delegate = delegate;
        RetryConfig config = RetryConfig.<FetchResult>custom()
                .maxAttempts(maxAttempts)
                .waitDuration(waitDuration)
                .retryOnResult(result -> result instanceof FetchResult.Throttled)
                .retryOnException(e -> false)
                .build();
        RetryRegistry registry = RetryRegistry.of(config);
        registry.getEventPublisher().onEntryAdded(event -> {
            Retry added = event.getAddedEntry();
            added.getEventPublisher()
                    .onRetry(ev -> LOGGER.trace("Retry attempt #{} for [{}]",
                            ev.getNumberOfRetryAttempts(),
                            ev.getName()))
                    .onError(ev -> LOGGER.debug("All retries failed for [{}] after {} attempts",
                            ev.getName(),
                            ev.getNumberOfRetryAttempts(),
                            ev.getLastThrowable()));
        });
        this.retry = registry.retry(PARTITION_FETCH);
    }

    @Override
    public FetchResult fetchPage(FetchRequest request) {
        return Retry.decorateSupplier(retry, () -> delegate.fetchPage(request)).get();
    }

    Retry getRetry() {
        return retry;
    }
}
