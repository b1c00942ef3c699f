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
package io.planbridge.plan;

import com.google.common.collect.ImmutableList;
import io.planbridge.expression.FieldAccessTypedExpression;
import io.planbridge.spi.type.RowType;

import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

public record OrderByPlanNode(String id, List<FieldAccessTypedExpression> sortingKeys, List<SortOrder> sortingOrders, boolean partial, PhysicalPlanNode source)
        implements PhysicalPlanNode
{
    public OrderByPlanNode
    {
        requireNonNull(id, "id is null");
        sortingKeys = ImmutableList.copyOf(requireNonNull(sortingKeys, "sortingKeys is null"));
        sortingOrders = ImmutableList.copyOf(requireNonNull(sortingOrders, "sortingOrders is null"));
        checkArgument(sortingKeys.size() == sortingOrders.size(), "sortingKeys and sortingOrders sizes do not match");
        requireNonNull(source, "source is null");
    }

    @Override
    public List<PhysicalPlanNode> sources()
    {
        return ImmutableList.of(source);
    }

    @Override
    public RowType outputType()
    {
        return source.outputType();
    }
}
