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
package io.planbridge.spi.type;

import java.util.Optional;

import static com.google.common.base.Preconditions.checkArgument;

public final class VarcharType
        extends Type
{
    public static final VarcharType VARCHAR = new VarcharType(Optional.empty());

    private final Optional<Integer> length;

    public static VarcharType createVarcharType(int length)
    {
        checkArgument(length >= 0, "Invalid varchar length %s", length);
        return new VarcharType(Optional.of(length));
    }

    private VarcharType(Optional<Integer> length)
    {
        super(TypeKind.VARCHAR);
        this.length = length;
    }

    public Optional<Integer> getLength()
    {
        return length;
    }

    public boolean isUnbounded()
    {
        return length.isEmpty();
    }

    @Override
    public String getDisplayName()
    {
        return length.map(value -> "varchar(" + value + ")").orElse("varchar");
    }
}
