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
import io.airlift.slice.Slice;

import java.util.List;
import java.util.Objects;

import static com.google.common.base.MoreObjects.toStringHelper;
import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/**
 * Disjunction of filters of the same value kind, evaluated in order until
 * one matches. No ordering between the filters is assumed.
 */
public final class MultiRange
        extends Filter
{
    private final List<Filter> filters;

    public MultiRange(List<? extends Filter> filters, boolean nullAllowed)
    {
        super(nullAllowed);
        this.filters = ImmutableList.copyOf(requireNonNull(filters, "filters is null"));
        checkArgument(this.filters.size() > 1, "filters must contain at least two entries");
    }

    public List<Filter> getFilters()
    {
        return filters;
    }

    @Override
    public boolean testLong(long value)
    {
        for (Filter filter : filters) {
            if (filter.testLong(value)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public boolean testDouble(double value)
    {
        for (Filter filter : filters) {
            if (filter.testDouble(value)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public boolean testFloat(float value)
    {
        for (Filter filter : filters) {
            if (filter.testFloat(value)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public boolean testBytes(Slice value)
    {
        for (Filter filter : filters) {
            if (filter.testBytes(value)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public boolean testBoolean(boolean value)
    {
        for (Filter filter : filters) {
            if (filter.testBoolean(value)) {
                return true;
            }
        }
        return false;
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
        MultiRange other = (MultiRange) obj;
        return filters.equals(other.filters) &&
                isNullAllowed() == other.isNullAllowed();
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(filters, isNullAllowed());
    }

    @Override
    public String toString()
    {
        return toStringHelper(this)
                .add("filters", filters)
                .add("nullAllowed", isNullAllowed())
                .toString();
    }
}
