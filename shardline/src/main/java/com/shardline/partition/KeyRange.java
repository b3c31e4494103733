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

import com.google.common.base.Preconditions;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Comparator;
import java.util.Objects;

/**
 * A half-open span {@code [minInclusive, maxExclusive)} of effective partition key values,
 * optionally bound to the partition currently serving it. Keys compare as strings; the empty
 * string is the lowest key and {@link #MAX_KEY} is above every stored key.
 */
public record KeyRange(@Nonnull String minInclusive, @Nonnull String maxExclusive, @Nullable String partitionId)
        implements Comparable<KeyRange> {
    public static final String MIN_KEY = "";
    public static final String MAX_KEY = "FF";

    private static final Comparator<KeyRange> ORDER = Comparator
            .comparing(KeyRange::minInclusive)
            .thenComparing(KeyRange::maxExclusive);

    public KeyRange {
        Objects.requireNonNull(minInclusive, "minInclusive");
        Objects.requireNonNull(maxExclusive, "maxExclusive");
        Preconditions.checkArgument(minInclusive.compareTo(maxExclusive) < 0,
                "empty key range [%s, %s)", minInclusive, maxExclusive);
    }

    public static KeyRange of(String minInclusive, String maxExclusive) {
        return new KeyRange(minInclusive, maxExclusive, null);
    }

    public static KeyRange full() {
        return of(MIN_KEY, MAX_KEY);
    }

    public boolean contains(String epk) {
        return minInclusive.compareTo(epk) <= 0 && epk.compareTo(maxExclusive) < 0;
    }

    public boolean overlaps(KeyRange other) {
        return minInclusive.compareTo(other.maxExclusive) < 0 && other.minInclusive.compareTo(maxExclusive) < 0;
    }

    /**
     * Returns true if this range covers the same span as the other one, regardless of the
     * partition serving it.
     *
     * @param other the other range
     * @return whether the spans are identical
     */
    public boolean sameSpan(KeyRange other) {
        return minInclusive.equals(other.minInclusive) && maxExclusive.equals(other.maxExclusive);
    }

    @Override
    public int compareTo(KeyRange other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        String span = "[" + minInclusive + ", " + maxExclusive + ")";
        return partitionId == null ? span : partitionId + span;
    }
}
