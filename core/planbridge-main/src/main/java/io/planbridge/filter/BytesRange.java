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

import io.airlift.slice.Slice;

import java.util.Objects;

import static com.google.common.base.MoreObjects.toStringHelper;
import static java.util.Objects.requireNonNull;

/**
 * Range of byte strings compared as unsigned bytes. An unbounded side keeps
 * an empty slice as its value.
 */
public final class BytesRange
        extends Filter
{
    private final Slice lower;
    private final boolean lowerUnbounded;
    private final boolean lowerExclusive;
    private final Slice upper;
    private final boolean upperUnbounded;
    private final boolean upperExclusive;

    public BytesRange(Slice lower, boolean lowerUnbounded, boolean lowerExclusive, Slice upper, boolean upperUnbounded, boolean upperExclusive, boolean nullAllowed)
    {
        super(nullAllowed);
        this.lower = requireNonNull(lower, "lower is null");
        this.lowerUnbounded = lowerUnbounded;
        this.lowerExclusive = lowerExclusive;
        this.upper = requireNonNull(upper, "upper is null");
        this.upperUnbounded = upperUnbounded;
        this.upperExclusive = upperExclusive;
    }

    public Slice getLower()
    {
        return lower;
    }

    public boolean isLowerUnbounded()
    {
        return lowerUnbounded;
    }

    public boolean isLowerExclusive()
    {
        return lowerExclusive;
    }

    public Slice getUpper()
    {
        return upper;
    }

    public boolean isUpperUnbounded()
    {
        return upperUnbounded;
    }

    public boolean isUpperExclusive()
    {
        return upperExclusive;
    }

    public boolean isSingleValue()
    {
        return !lowerUnbounded && !upperUnbounded && !lowerExclusive && !upperExclusive && lower.equals(upper);
    }

    @Override
    public boolean testBytes(Slice value)
    {
        if (!lowerUnbounded) {
            int compare = value.compareTo(lower);
            if (compare < 0 || (lowerExclusive && compare == 0)) {
                return false;
            }
        }
        if (!upperUnbounded) {
            int compare = value.compareTo(upper);
            return compare < 0 || (!upperExclusive && compare == 0);
        }
        return true;
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
        BytesRange other = (BytesRange) obj;
        return lower.equals(other.lower) &&
                lowerUnbounded == other.lowerUnbounded &&
                lowerExclusive == other.lowerExclusive &&
                upper.equals(other.upper) &&
                upperUnbounded == other.upperUnbounded &&
                upperExclusive == other.upperExclusive &&
                isNullAllowed() == other.isNullAllowed();
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(lower, lowerUnbounded, lowerExclusive, upper, upperUnbounded, upperExclusive, isNullAllowed());
    }

    @Override
    public String toString()
    {
        return toStringHelper(this)
                .add("lower", lowerUnbounded ? "unbounded" : (lowerExclusive ? "(" : "[") + lower.toStringUtf8())
                .add("upper", upperUnbounded ? "unbounded" : upper.toStringUtf8() + (upperExclusive ? ")" : "]"))
                .add("nullAllowed", isNullAllowed())
                .toString();
    }
}
