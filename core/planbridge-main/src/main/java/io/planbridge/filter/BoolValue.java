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

public final class BoolValue
        extends Filter
{
    private final boolean value;

    public BoolValue(boolean value, boolean nullAllowed)
    {
        super(nullAllowed);
        this.value = value;
    }

    public boolean getValue()
    {
        return value;
    }

    @Override
    public boolean testBoolean(boolean value)
    {
        return this.value == value;
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
        BoolValue other = (BoolValue) obj;
        return value == other.value &&
                isNullAllowed() == other.isNullAllowed();
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(value, isNullAllowed());
    }

    @Override
    public String toString()
    {
        return toStringHelper(this)
                .add("value", value)
                .add("nullAllowed", isNullAllowed())
                .toString();
    }
}
