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

import java.util.BitSet;

import static io.planbridge.filter.BigintValuesUsingBitmask.toBitmask;

/**
 * Matches every integer except the given values.
 */
public final class NegatedBigintValuesUsingBitmask
        extends AbstractBigintValues
{
    private final BitSet rejected;

    public NegatedBigintValuesUsingBitmask(LongCollection values, boolean nullAllowed)
    {
        super(values, nullAllowed);
        this.rejected = toBitmask(sortedValues());
    }

    @Override
    public boolean testLong(long value)
    {
        if (value < getMin() || value > getMax()) {
            return true;
        }
        return !rejected.get((int) (value - getMin()));
    }
}
