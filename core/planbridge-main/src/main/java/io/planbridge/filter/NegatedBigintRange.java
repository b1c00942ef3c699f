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
 * Matches every integer outside the inclusive range {@code [lower, upper]}.
 */
public final class NegatedBigintRange
        extends Filter
{
    private final long lower;
    private final long upper;

    public NegatedBigintRange(long lower, long upper, boolean nullAllowed)
    {
        super(nullAllowed);
        this.lower = lower;
        this.upper = upper;
    }

    public long getLower()
    {
        return lower;
    }

    public long getUpper()
    {
        return upper;
    }

    @Override
    public boolean testLong(long value)
    {
        return value < lower || value > upper;
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
        NegatedBigintRange other = (NegatedBigintRange) obj;
        return lower == other.lower &&
                upper == other.upper &&
                isNullAllowed() == other.isNullAllowed();
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(lower, upper, isNullAllowed());
    }

    @Override
    public String toString()
    {
        return toStringHelper(this)
                .add("lower", lower)
                .add("upper", upper)
                .add("nullAllowed", isNullAllowed())
                .toString();
    }
}
