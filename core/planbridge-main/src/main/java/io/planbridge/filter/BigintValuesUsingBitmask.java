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

public final class BigintValuesUsingBitmask
        extends AbstractBigintValues
{
    private final BitSet bitmask;

    public BigintValuesUsingBitmask(LongCollection values, boolean nullAllowed)
    {
        super(values, nullAllowed);
        this.bitmask = toBitmask(sortedValues());
    }

    @Override
    public boolean testLong(long value)
    {
        if (value < getMin() || value > getMax()) {
            return false;
        }
        return bitmask.get((int) (value - getMin()));
    }

    static BitSet toBitmask(long[] sortedValues)
    {
        long min = sortedValues[0];
        BitSet bitmask = new BitSet(Math.toIntExact(sortedValues[sortedValues.length - 1] - min + 1));
        for (long value : sortedValues) {
            bitmask.set((int) (value - min));
        }
        return bitmask;
    }
}
