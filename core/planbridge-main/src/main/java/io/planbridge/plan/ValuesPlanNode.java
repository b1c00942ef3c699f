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
import io.planbridge.expression.ConstantTypedExpression;
import io.planbridge.spi.type.RowType;

import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.collect.ImmutableList.toImmutableList;
import static java.util.Objects.requireNonNull;

public record ValuesPlanNode(String id, RowType outputType, List<List<ConstantTypedExpression>> rows)
        implements PhysicalPlanNode
{
    public ValuesPlanNode
    {
        requireNonNull(id, "id is null");
        requireNonNull(outputType, "outputType is null");
        rows = requireNonNull(rows, "rows is null").stream()
                .map(ImmutableList::copyOf)
                .collect(toImmutableList());
        for (List<ConstantTypedExpression> row : rows) {
            checkArgument(row.size() == outputType.size(), "row has %s values, expected %s", row.size(), outputType.size());
        }
    }

    @Override
    public List<PhysicalPlanNode> sources()
    {
        return ImmutableList.of();
    }
}
