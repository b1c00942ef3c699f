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
import io.planbridge.protocol.expression.RowExpression;
import io.planbridge.spi.type.Type;
import jakarta.annotation.Nullable;

/**
 * Converts coordinator expressions into executable ones. Implementations
 * must be safe for concurrent use.
 */
public interface ExpressionConverter
{
    TypedExpression toTypedExpression(RowExpression expression);

    /**
     * Decodes the single value held by {@code block}; returns {@code null} for SQL NULL.
     */
    @Nullable
    Object getConstantValue(Type type, Block block);
}
