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
package io.planbridge.protocol.expression;

import com.google.common.collect.ImmutableList;

import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

public record LambdaDefinitionExpression(List<String> argumentTypes, List<String> arguments, RowExpression body)
        implements RowExpression
{
    public LambdaDefinitionExpression
    {
        argumentTypes = ImmutableList.copyOf(requireNonNull(argumentTypes, "argumentTypes is null"));
        arguments = ImmutableList.copyOf(requireNonNull(arguments, "arguments is null"));
        requireNonNull(body, "body is null");
        checkArgument(argumentTypes.size() == arguments.size(), "Number of argument types does not match number of arguments");
    }

    @Override
    public <R, C> R accept(RowExpressionVisitor<R, C> visitor, C context)
    {
        return visitor.visitLambda(this, context);
    }

    @Override
    public String type()
    {
        return "function";
    }
}
