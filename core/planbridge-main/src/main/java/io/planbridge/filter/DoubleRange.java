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

import java.util.Objects;

import static com.google.common.base.MoreObjects.toStringHelper;

/**
 * Range of double values with independently unbounded or exclusive sides.
 * NaN never matches.
 */
public final class DoubleRange
        extends Filter
{
    private final double lower;
    private final boolean lowerUnbounded;
    private final boolean lowerExclusive;
    private final double upper;
    private final boolean upperUnbounded;
    private final boolean upperExclusive;

    public DoubleRange(double lower, boolean lowerUnbounded, boolean lowerExclusive, double upper, boolean upperUnbounded, boolean upperExclusive, boolean nullAllowed)
    {
        super(nullAllowed);
        this.lower = lower;
        this.lowerUnbounded = lowerUnbounded;
        this.lowerExclusive = lowerExclusive;
        this.upper = upper;
        this.upperUnbounded = upperUnbounded;
        this.upperExclusive = upperExclusive;
    }

    public double getLower()
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

    public double getUpper()
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

    @Override
    public boolean testDouble(double value)
    {
        if (Double.isNaN(value)) {
            return false;
        }
        if (!lowerUnbounded) {
            if (value < lower || (lowerExclusive && value == lower)) {
                return false;
            }
        }
        if (!upperUnbounded) {
            return value < upper || (!upperExclusive && value == upper);
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
        DoubleRange other = (DoubleRange) obj;
        return Double.compare(lower, other.lower) == 0 &&
                lowerUnbounded == other.lowerUnbounded &&
                lowerExclusive == other.lowerExclusive &&
                Double.compare(upper, other.upper) == 0 &&
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
                .add("lower", lowerUnbounded ? "unbounded" : (lowerExclusive ? "(" : "[") + lower)
                .add("upper", upperUnbounded ? "unbounded" : upper + (upperExclusive ? ")" : "]"))
                .add("nullAllowed", isNullAllowed())
                .toString();
    }
}
