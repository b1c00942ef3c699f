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

import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Disjoint ranges, ascending by low bound.
 */
public record SortedRangeSet(String type, List<Range> ranges)
        implements ValueSet
{
    public SortedRangeSet
    {
        requireNonNull(type, "type is null");
        ranges = ImmutableList.copyOf(requireNonNull(ranges, "ranges is null"));
    }
}
