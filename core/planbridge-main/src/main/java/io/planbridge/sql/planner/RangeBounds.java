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
package io.planbridge.sql.planner;

import io.planbridge.protocol.expression.Block;
import io.planbridge.protocol.predicate.Marker;
import io.planbridge.protocol.predicate.Range;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

import static io.planbridge.protocol.predicate.Marker.Bound.ABOVE;
import static io.planbridge.protocol.predicate.Marker.Bound.BELOW;
import static io.planbridge.util.Failures.checkInvariant;
import static java.util.Objects.requireNonNull;

/**
 * Decoded bounds of a {@link Range}. An empty side is unbounded. The decoder
 * must not return {@code null}.
 */
record RangeBounds<T>(Optional<T> lower, boolean lowerExclusive, Optional<T> upper, boolean upperExclusive)
{
    RangeBounds
    {
        requireNonNull(lower, "lower is null");
        requireNonNull(upper, "upper is null");
    }

    static <T> RangeBounds<T> of(Range range, Function<Block, T> decoder)
    {
        return new RangeBounds<>(
                decode(range.low(), decoder),
                range.low().bound() == ABOVE,
                decode(range.high(), decoder),
                range.high().bound() == BELOW);
    }

    /**
     * True for {@code (-inf, +inf)}, the shape in which "is not null" arrives.
     */
    static boolean isFullyUnbounded(Range range)
    {
        return range.low().isUnbounded() && range.low().bound() == ABOVE &&
                range.high().isUnbounded() && range.high().bound() == BELOW;
    }

    boolean isLowerUnbounded()
    {
        return lower.isEmpty();
    }

    boolean isUpperUnbounded()
    {
        return upper.isEmpty();
    }

    T lowerValue()
    {
        return lower.orElseThrow();
    }

    T upperValue()
    {
        return upper.orElseThrow();
    }

    boolean isSingleValue()
    {
        return lower.isPresent() && !lowerExclusive &&
                upper.isPresent() && !upperExclusive &&
                Objects.equals(lower.get(), upper.get());
    }

    /**
     * Lowest value accepted by an integer range; {@code unboundedValue} when the lower side is unbounded.
     */
    static long inclusiveLower(RangeBounds<Long> bounds, long unboundedValue)
    {
        if (bounds.isLowerUnbounded()) {
            return unboundedValue;
        }
        long value = bounds.lowerValue();
        if (bounds.lowerExclusive()) {
            checkInvariant(value != Long.MAX_VALUE, "Exclusive lower bound cannot be the maximum value");
            return value + 1;
        }
        return value;
    }

    /**
     * Highest value accepted by an integer range; {@code unboundedValue} when the upper side is unbounded.
     */
    static long inclusiveUpper(RangeBounds<Long> bounds, long unboundedValue)
    {
        if (bounds.isUpperUnbounded()) {
            return unboundedValue;
        }
        long value = bounds.upperValue();
        if (bounds.upperExclusive()) {
            checkInvariant(value != Long.MIN_VALUE, "Exclusive upper bound cannot be the minimum value");
            return value - 1;
        }
        return value;
    }

    private static <T> Optional<T> decode(Marker marker, Function<Block, T> decoder)
    {
        return marker.valueBlock().map(decoder);
    }
}
