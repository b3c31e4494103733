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

import com.shardline.BadRequestException;
import com.shardline.testing.InMemoryCollection;
import com.shardline.value.Values;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;

class FetchContextTest {
    private ExecutorService executor;
    private InMemoryCollection collection;
    private FetchContext context;

    @BeforeEach
    public void setup() {
        executor = Executors.newSingleThreadExecutor();
        collection = InMemoryCollection.create(2);
        context = FetchContext.builder()
                .reader(collection)
                .router(collection)
                .executor(executor)
                .requestContext(RequestContext.create())
                .maxConcurrency(3)
                .build();
    }

    @AfterEach
    public void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void test_resolve_clips_ranges_to_the_span() {
        KeyRange left = collection.partitions().get(0);
        KeyRange right = collection.partitions().get(1);
        KeyRange span = KeyRange.of("4000", "C000");

        List<KeyRange> resolved = context.resolve(span);
        assertEquals(List.of(
                new KeyRange("4000", left.maxExclusive(), left.partitionId()),
                new KeyRange(right.minInclusive(), "C000", right.partitionId())
        ), resolved);
    }

    @Test
    void test_resolve_cursor_of_a_live_partition() {
        KeyRange left = collection.partitions().get(0);
        PartitionCursor cursor = new PartitionCursor(KeyRange.of(left.minInclusive(), left.maxExclusive()), "c9", 2,
                new ResumeFilter.ExcludeRids(Set.of("doc-00001")));

        List<PartitionCursor> resolved = context.resolve(cursor);
        assertEquals(List.of(cursor.withRange(left)), resolved);
    }

    @Test
    void test_resolve_cursor_of_a_split_partition() {
        KeyRange left = collection.partitions().get(0);
        List<KeyRange> children = collection.split(left.partitionId());
        ResumeFilter filter = new ResumeFilter.AfterRow(List.of(Values.of(5)), "doc-00003");
        PartitionCursor cursor = new PartitionCursor(left, "c9", 2, filter);

        List<PartitionCursor> resolved = context.resolve(cursor);
        assertEquals(2, resolved.size());
        for (int i = 0; i < children.size(); i++) {
            assertEquals(new PartitionCursor(children.get(i), "c9", 0, filter), resolved.get(i));
        }
    }

    @Test
    void test_resolve_cursor_of_a_split_partition_without_consumed_rows() {
        KeyRange left = collection.partitions().get(0);
        collection.split(left.partitionId());
        PartitionCursor cursor = new PartitionCursor(left, "c9", 0, null);

        for (PartitionCursor child : context.resolve(cursor)) {
            assertEquals("c9", child.resumeToken());
            assertNull(child.resumeFilter());
        }
    }

    @Test
    void test_resolve_cursor_inherited_from_a_split_parent() {
        KeyRange left = collection.partitions().get(0);
        List<KeyRange> children = collection.split(left.partitionId());
        List<KeyRange> grandchildren = collection.split(children.get(0).partitionId());
        ResumeFilter filter = new ResumeFilter.ExcludeRids(Set.of("doc-00001", "doc-00004"));
        PartitionCursor cursor = new PartitionCursor(children.get(0), "c4", 0, filter);

        List<PartitionCursor> resolved = context.resolve(cursor);
        assertEquals(2, resolved.size());
        for (int i = 0; i < grandchildren.size(); i++) {
            assertEquals(new PartitionCursor(grandchildren.get(i), "c4", 0, filter), resolved.get(i));
        }
    }

    @Test
    void test_resolve_unknown_range() {
        InMemoryCollection empty = InMemoryCollection.create(1);
        FetchContext unrouted = FetchContext.builder()
                .reader(empty)
                .router((min, max) -> List.of())
                .executor(executor)
                .requestContext(RequestContext.create())
                .build();
        assertThrows(BadRequestException.class, () -> unrouted.resolve(PartitionCursor.start(KeyRange.full())));
    }

    @Test
    void test_prefetch_slots_leave_one_slot_for_demand() {
        assertTrue(context.tryAcquirePrefetchSlot());
        assertTrue(context.tryAcquirePrefetchSlot());
        assertFalse(context.tryAcquirePrefetchSlot());
        assertEquals(2, context.inFlight());

        context.acquireDemandSlot();
        assertEquals(3, context.inFlight());

        context.releaseSlot();
        context.releaseSlot();
        assertTrue(context.tryAcquirePrefetchSlot());
    }

    @Test
    void test_single_slot_is_reserved_for_demand() {
        FetchContext sequential = FetchContext.builder()
                .reader(collection)
                .router(collection)
                .executor(executor)
                .requestContext(RequestContext.create())
                .maxConcurrency(1)
                .build();
        assertFalse(sequential.tryAcquirePrefetchSlot());
    }

    @Test
    void test_request_charge_is_drained() {
        context.addRequestCharge(1.5);
        context.addRequestCharge(2.0);
        assertEquals(3.5, context.drainRequestCharge());
        assertEquals(0.0, context.drainRequestCharge());
    }

    @Test
    void test_builder_validation() {
        assertThrows(IllegalArgumentException.class, () -> FetchContext.builder().maxConcurrency(0));
        assertThrows(IllegalArgumentException.class, () -> FetchContext.builder().fetchRetryAttempts(0));
        assertThrows(IllegalArgumentException.class, () -> FetchContext.builder().pageSize(0));
        assertThrows(NullPointerException.class, () -> FetchContext.builder().build());
    }
}
