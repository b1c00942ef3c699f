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

import java.util.Arrays;
import java.util.Objects;

import static com.google.common.base.MoreObjects.toStringHelper;
import static com.google.common.base.Preconditions.checkArgument;

/**
 * Base of the filters holding an explicit set of integer values.
 */
abstract class AbstractBigintValues
        extends Filter
{
    private final long[] values;

    protected AbstractBigintValues(LongCollection values, boolean nullAllowed)
    {
        super(nullAllowed);
        long[] distinct = new LongOpenHashSet(values).toLongArray();
        checkArgument(distinct.length > 1, "values must contain at least two distinct entries");
        Arrays.sort(distinct);
        this.values = distinct;
    }

    public long getMin()
    {
        return values[0];
    }

    public long getMax()
    {
        return values[values.length - 1];
    }

    /**
     * Returns the distinct values in ascending order.
     */
    public long[] getValues()
    {
        return values.clone();
    }

    protected long[] sortedValues()
    {
        return values;
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
        AbstractBigintValues other = (AbstractBigintValues) obj;
        return Arrays.equals(values, other.values) &&
                isNullAllowed() == other.isNullAllowed();
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(Arrays.hashCode(values), isNullAllowed());
    }

    @Override
    public String toString()
    {
        return toStringHelper(this)
                .add("values", Arrays.toString(values))
                .add("nullAllowed", isNullAllowed())
                .toString();
    }
}
