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

import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Objects;

import static com.google.common.base.MoreObjects.toStringHelper;
import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/**
 * Disjunction of ascending, non-overlapping integer ranges, searched by
 * binary search on the lower bounds.
 */
public final class BigintMultiRange
        extends Filter
{
    private final List<BigintRange> ranges;
    private final long[] lowerBounds;

    public BigintMultiRange(List<BigintRange> ranges, boolean nullAllowed)
    {
        super(nullAllowed);
        this.ranges = ImmutableList.copyOf(requireNonNull(ranges, "ranges is null"));
        checkArgument(this.ranges.size() > 1, "ranges must contain at least two entries");
        lowerBounds = new long[this.ranges.size()];
        for (int i = 0; i < this.ranges.size(); i++) {
            lowerBounds[i] = this.ranges.get(i).getLower();
            if (i > 0) {
                checkArgument(lowerBounds[i] > this.ranges.get(i - 1).getUpper(), "ranges must be ascending and must not overlap");
            }
        }
    }

    public List<BigintRange> getRanges()
    {
        return ranges;
    }

    @Override
    public boolean testLong(long value)
    {
        int low = 0;
        int high = lowerBounds.length - 1;
        int candidate = -1;
        while (low <= high) {
            int middle = (low + high) >>> 1;
            if (lowerBounds[middle] <= value) {
                candidate = middle;
                low = middle + 1;
            }
            else {
                high = middle - 1;
            }
        }
        return candidate >= 0 && ranges.get(candidate).testLong(value);
    }

    @Override
    public boolean equals(Object obj)
    {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        BigintMultiRange other = (BigintMultiRange) obj;
        return ranges.equals(other.ranges) &&
                isNullAllowed() == other.isNullAllowed();
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(ranges, isNullAllowed());
    }

    @Override
    public String toString()
    {
        return toStringHelper(this)
                .add("ranges", ranges)
                .add("nullAllowed", isNullAllowed())
                .toString();
    }
}
