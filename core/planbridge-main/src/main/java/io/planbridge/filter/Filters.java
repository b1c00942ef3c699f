/*
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.planbridge.filter;

import it.unimi.dsi.fastutil.longs.LongCollection;
import it.unimi.dsi.fastutil.longs.LongOpenHashSet;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Factories choosing the cheapest representation of an integer value set:
 * a single point or a contiguous run becomes a range, a dense set becomes
 * a bitmask and anything else a hash table.
 */
public final class Filters
{
    // Sets spanning at most this many values always use a bitmask
    private static final long MAX_BITMASK_RANGE = 32 * 64;
    // Otherwise the span may be at most this many times the number of values
    private static final long BITMASK_DENSITY_FACTOR = 4 * 64;

    private Filters() {}

    public static Filter createBigintValues(LongCollection values, boolean nullAllowed)
    {
        LongOpenHashSet distinct = new LongOpenHashSet(values);
        checkArgument(!distinct.isEmpty(), "values is empty");
        long min = Long.MAX_VALUE;
        long max = Long.MIN_VALUE;
        for (long value : distinct) {
            min = Math.min(min, value);
            max = Math.max(max, value);
        }
        if (distinct.size() == 1) {
            return new BigintRange(min, max, nullAllowed);
        }
        long span = span(min, max);
        if (span == distinct.size()) {
            return new BigintRange(min, max, nullAllowed);
        }
        if (useBitmask(span, distinct.size())) {
            return new BigintValuesUsingBitmask(distinct, nullAllowed);
        }
        return new BigintValuesUsingHashTable(distinct, nullAllowed);
    }

    public static Filter createNegatedBigintValues(LongCollection values, boolean nullAllowed)
    {
        LongOpenHashSet distinct = new LongOpenHashSet(values);
        checkArgument(!distinct.isEmpty(), "values is empty");
        long min = Long.MAX_VALUE;
        long max = Long.MIN_VALUE;
        for (long value : distinct) {
            min = Math.min(min, value);
            max = Math.max(max, value);
        }
        if (distinct.size() == 1) {
            return new NegatedBigintRange(min, max, nullAllowed);
        }
        long span = span(min, max);
        if (span == distinct.size()) {
            return new NegatedBigintRange(min, max, nullAllowed);
        }
        if (useBitmask(span, distinct.size())) {
            return new NegatedBigintValuesUsingBitmask(distinct, nullAllowed);
        }
        return new NegatedBigintValuesUsingHashTable(distinct, nullAllowed);
    }

    /**
     * Number of integers in {@code [min, max]}, or -1 when that count does not fit in a long.
     */
    private static long span(long min, long max)
    {
        long difference = max - min;
        if (difference < 0 || difference == Long.MAX_VALUE) {
            return -1;
        }
        return difference + 1;
    }

    private static boolean useBitmask(long span, int valueCount)
    {
        if (span < 0 || span > Integer.MAX_VALUE) {
            return false;
        }
        return span <= MAX_BITMASK_RANGE || span <= valueCount * BITMASK_DENSITY_FACTOR;
    }
}
