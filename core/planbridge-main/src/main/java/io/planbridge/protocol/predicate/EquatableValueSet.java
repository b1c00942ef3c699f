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
package io.planbridge.protocol.predicate;

import com.google.common.collect.ImmutableList;
import io.planbridge.protocol.expression.Block;

import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Explicit enumeration of values for types that are comparable for equality only.
 * A white list admits the entries; a black list admits everything else.
 */
public record EquatableValueSet(String type, boolean whiteList, List<Block> entries)
        implements ValueSet
{
    public EquatableValueSet
    {
        requireNonNull(type, "type is null");
        entries = ImmutableList.copyOf(requireNonNull(entries, "entries is null"));
    }

    public boolean isNone()
    {
        return whiteList && entries.isEmpty();
    }

    public boolean isAll()
    {
        return !whiteList && entries.isEmpty();
    }
}
