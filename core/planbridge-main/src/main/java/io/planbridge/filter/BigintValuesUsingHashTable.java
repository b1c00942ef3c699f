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
import it.unimi.dsi.fastutil.longs.LongSet;

public final class BigintValuesUsingHashTable
        extends AbstractBigintValues
{
    private final LongSet hashTable;

    public BigintValuesUsingHashTable(LongCollection values, boolean nullAllowed)
    {
        super(values, nullAllowed);
        this.hashTable = new LongOpenHashSet(sortedValues());
    }

    @Override
    public boolean testLong(long value)
    {
        if (value < getMin() || value > getMax()) {
            return false;
        }
        return hashTable.contains(value);
    }
}
