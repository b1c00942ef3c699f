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
import io.planbridge.expression.TypedExpression;
import io.planbridge.spi.type.RowType;

import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.collect.ImmutableList.toImmutableList;
import static java.util.Objects.requireNonNull;

public record ProjectPlanNode(String id, List<String> names, List<TypedExpression> projections, PhysicalPlanNode source)
        implements PhysicalPlanNode
{
    public ProjectPlanNode
    {
        requireNonNull(id, "id is null");
        names = ImmutableList.copyOf(requireNonNull(names, "names is null"));
        projections = ImmutableList.copyOf(requireNonNull(projections, "projections is null"));
        requireNonNull(source, "source is null");
        checkArgument(names.size() == projections.size(), "names and projections sizes do not match");
    }

    @Override
    public List<PhysicalPlanNode> sources()
    {
        return ImmutableList.of(source);
    }

    @Override
    public RowType outputType()
    {
        return RowType.rowType(names, projections.stream()
                .map(TypedExpression::type)
                .collect(toImmutableList()));
    }
}
