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

import com.google.common.collect.ImmutableList;

import java.util.List;

import static java.util.Objects.requireNonNull;

public abstract class Type
{
    private final TypeKind kind;

    protected Type(TypeKind kind)
    {
        this.kind = requireNonNull(kind, "kind is null");
    }

    public final TypeKind getKind()
    {
        return kind;
    }

    /**
     * Returns the name of this type in the signature syntax understood by
     * {@link TypeSignatureParser}.
     */
    public abstract String getDisplayName();

    public List<Type> getTypeParameters()
    {
        return ImmutableList.of();
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return getDisplayName().equals(((Type) o).getDisplayName());
    }

    @Override
    public int hashCode()
    {
        return getDisplayName().hashCode();
    }

    @Override
    public String toString()
    {
        return getDisplayName();
    }
}
