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
package io.planbridge.protocol;

import com.google.common.collect.ImmutableList;
import io.planbridge.protocol.expression.VariableReferenceExpression;

import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.collect.ImmutableList.toImmutableList;
import static java.util.Objects.requireNonNull;

public record OrderingScheme(List<Ordering> orderBy)
{
    public OrderingScheme
    {
        orderBy = ImmutableList.copyOf(requireNonNull(orderBy, "orderBy is null"));
        checkArgument(!orderBy.isEmpty(), "orderBy is empty");
    }

    public List<VariableReferenceExpression> getOrderByVariables()
    {
        return orderBy.stream()
                .map(Ordering::variable)
                .collect(toImmutableList());
    }

    public record Ordering(VariableReferenceExpression variable, SortOrder sortOrder)
    {
        public Ordering
        {
            requireNonNull(variable, "variable is null");
            requireNonNull(sortOrder, "sortOrder is null");
        }
    }
}
