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

import com.google.common.collect.ImmutableList;
import io.planbridge.spi.type.Type;

import java.util.List;

import static java.util.Objects.requireNonNull;

public record CallTypedExpression(Type type, String name, List<TypedExpression> inputs)
        implements TypedExpression
{
    public CallTypedExpression
    {
        requireNonNull(type, "type is null");
        requireNonNull(name, "name is null");
        inputs = ImmutableList.copyOf(requireNonNull(inputs, "inputs is null"));
    }

    @Override
    public String toString()
    {
        return name + inputs;
    }
}
