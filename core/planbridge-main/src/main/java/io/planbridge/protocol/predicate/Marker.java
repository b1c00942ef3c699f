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

import io.planbridge.protocol.expression.Block;

import java.util.Optional;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/**
 * A point on the ordered value line of a type. A marker without a value is
 * the lower unbounded marker when its bound is {@link Bound#ABOVE} and the
 * upper unbounded marker when its bound is {@link Bound#BELOW}.
 */
public record Marker(String type, Optional<Block> valueBlock, Bound bound)
{
    public Marker
    {
        requireNonNull(type, "type is null");
        requireNonNull(valueBlock, "valueBlock is null");
        requireNonNull(bound, "bound is null");
        checkArgument(valueBlock.isPresent() || bound != Bound.EXACTLY, "Cannot be equal to unbounded");
    }

    public static Marker lowerUnbounded(String type)
    {
        return new Marker(type, Optional.empty(), Bound.ABOVE);
    }

    public static Marker upperUnbounded(String type)
    {
        return new Marker(type, Optional.empty(), Bound.BELOW);
    }

    public static Marker exactly(String type, Block value)
    {
        return new Marker(type, Optional.of(value), Bound.EXACTLY);
    }

    public static Marker above(String type, Block value)
    {
        return new Marker(type, Optional.of(value), Bound.ABOVE);
    }

    public static Marker below(String type, Block value)
    {
        return new Marker(type, Optional.of(value), Bound.BELOW);
    }

    public boolean isUnbounded()
    {
        return valueBlock.isEmpty();
    }

    public enum Bound
    {
        BELOW,
        EXACTLY,
        ABOVE,
    }
}
