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
import io.planbridge.protocol.expression.RowExpression;
import io.planbridge.protocol.expression.VariableReferenceExpression;

import java.util.List;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

public record MergeJoinNode(
        String id,
        JoinType type,
        PlanNode left,
        PlanNode right,
        List<EquiJoinClause> criteria,
        List<VariableReferenceExpression> outputVariables,
        Optional<RowExpression> filter)
        implements PlanNode
{
    public MergeJoinNode
    {
        requireNonNull(id, "id is null");
        requireNonNull(type, "type is null");
        requireNonNull(left, "left is null");
        requireNonNull(right, "right is null");
        criteria = ImmutableList.copyOf(requireNonNull(criteria, "criteria is null"));
        outputVariables = ImmutableList.copyOf(requireNonNull(outputVariables, "outputVariables is null"));
        requireNonNull(filter, "filter is null");
    }

    @Override
    public List<PlanNode> getSources()
    {
        return ImmutableList.of(left, right);
    }

    @Override
    public List<VariableReferenceExpression> getOutputVariables()
    {
        return outputVariables;
    }

    @Override
    public <R, C> R accept(PlanVisitor<R, C> visitor, C context)
    {
        return visitor.visitMergeJoin(this, context);
    }
}
