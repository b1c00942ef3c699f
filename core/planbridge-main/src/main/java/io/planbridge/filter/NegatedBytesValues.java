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

import com.google.common.collect.ImmutableSet;
import io.airlift.slice.Slice;

import java.util.Collection;
import java.util.Objects;
import java.util.Set;

import static com.google.common.base.MoreObjects.toStringHelper;
import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/**
 * Matches every byte string except the given values.
 */
public final class NegatedBytesValues
        extends Filter
{
    private final Set<Slice> values;

    public NegatedBytesValues(Collection<Slice> values, boolean nullAllowed)
    {
        super(nullAllowed);
        this.values = ImmutableSet.copyOf(requireNonNull(values, "values is null"));
        checkArgument(!this.values.isEmpty(), "values must not be empty");
    }

    public Set<Slice> getValues()
    {
        return values;
    }

    @Override
    public boolean testBytes(Slice value)
    {
        return !values.contains(value);
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
        NegatedBytesValues other = (NegatedBytesValues) obj;
        return values.equals(other.values) &&
                isNullAllowed() == other.isNullAllowed();
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(values, isNullAllowed());
    }

    @Override
    public String toString()
    {
        return toStringHelper(this)
                .add("values", values.stream().map(Slice::toStringUtf8).toList())
                .add("nullAllowed", isNullAllowed())
                .toString();
    }
}
