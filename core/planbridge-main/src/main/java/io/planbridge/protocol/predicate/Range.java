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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

public record Range(Marker low, Marker high)
{
    public Range
    {
        requireNonNull(low, "low is null");
        requireNonNull(high, "high is null");
        checkArgument(low.bound() != Marker.Bound.BELOW, "low bound must be EXACTLY or ABOVE");
        checkArgument(high.bound() != Marker.Bound.ABOVE, "high bound must be EXACTLY or BELOW");
    }
}
