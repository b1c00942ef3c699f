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

public final class IsNull
        extends Filter
{
    public IsNull()
    {
        super(true);
    }

    @Override
    public boolean testLong(long value)
    {
        return false;
    }

    @Override
    public boolean testDouble(double value)
    {
        return false;
    }

    @Override
    public boolean testFloat(float value)
    {
        return false;
    }

    @Override
    public boolean testBytes(Slice value)
    {
        return false;
    }

    @Override
    public boolean testBoolean(boolean value)
    {
        return false;
    }

    @Override
    public boolean equals(Object obj)
    {
        return obj instanceof IsNull;
    }

    @Override
    public int hashCode()
    {
        return IsNull.class.hashCode();
    }

    @Override
    public String toString()
    {
        return "IsNull";
    }
}
