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

/**
 * Matches every byte string outside the given range.
 */
public final class NegatedBytesRange
        extends Filter
{
    private final BytesRange nonNegated;

    public NegatedBytesRange(Slice lower, boolean lowerUnbounded, boolean lowerExclusive, Slice upper, boolean upperUnbounded, boolean upperExclusive, boolean nullAllowed)
    {
        super(nullAllowed);
        this.nonNegated = new BytesRange(lower, lowerUnbounded, lowerExclusive, upper, upperUnbounded, upperExclusive, !nullAllowed);
    }

    public Slice getLower()
    {
        return nonNegated.getLower();
    }

    public boolean isLowerExclusive()
    {
        return nonNegated.isLowerExclusive();
    }

    public Slice getUpper()
    {
        return nonNegated.getUpper();
    }

    public boolean isUpperExclusive()
    {
        return nonNegated.isUpperExclusive();
    }

    @Override
    public boolean testBytes(Slice value)
    {
        return !nonNegated.testBytes(value);
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
        NegatedBytesRange other = (NegatedBytesRange) obj;
        return nonNegated.equals(other.nonNegated);
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(nonNegated);
    }

    @Override
    public String toString()
    {
        return toStringHelper(this)
                .add("excluded", nonNegated)
                .toString();
    }
}
