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
package io.planbridge.expression;

import io.planbridge.protocol.expression.Block;
import io.planbridge.spi.type.Type;
import jakarta.annotation.Nullable;

import java.util.Objects;
import java.util.Optional;

import static com.google.common.base.Preconditions.checkArgument;
import static io.planbridge.spi.type.BooleanType.BOOLEAN;
import static java.util.Objects.requireNonNull;

/**
 * Literal of the executable plan. Scalar literals carry their decoded value,
 * which is {@code null} for SQL NULL. Literals of structural types keep their
 * encoded block and are decoded by the engine.
 */
public final class ConstantTypedExpression
        implements TypedExpression
{
    private final Type type;
    @Nullable
    private final Object value;
    private final Optional<Block> valueVector;

    private ConstantTypedExpression(Type type, @Nullable Object value, Optional<Block> valueVector)
    {
        this.type = requireNonNull(type, "type is null");
        this.value = value;
        this.valueVector = requireNonNull(valueVector, "valueVector is null");
        checkArgument(value == null || valueVector.isEmpty(), "constant cannot have both a value and a value vector");
    }

    public static ConstantTypedExpression constant(Type type, @Nullable Object value)
    {
        return new ConstantTypedExpression(type, value, Optional.empty());
    }

    public static ConstantTypedExpression vectorConstant(Type type, Block valueVector)
    {
        return new ConstantTypedExpression(type, null, Optional.of(valueVector));
    }

    @Override
    public Type type()
    {
        return type;
    }

    @Nullable
    public Object getValue()
    {
        return value;
    }

    public Optional<Block> getValueVector()
    {
        return valueVector;
    }

    public boolean hasValueVector()
    {
        return valueVector.isPresent();
    }

    public boolean isNull()
    {
        return value == null && valueVector.isEmpty();
    }

    public boolean isBooleanLiteral(boolean expected)
    {
        return type.equals(BOOLEAN) && Boolean.valueOf(expected).equals(value);
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
        ConstantTypedExpression other = (ConstantTypedExpression) obj;
        return type.equals(other.type) &&
                Objects.equals(value, other.value) &&
                valueVector.equals(other.valueVector);
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(type, value, valueVector);
    }

    @Override
    public String toString()
    {
        if (valueVector.isPresent()) {
            return type + " <vector>";
        }
        return type + " " + value;
    }
}
