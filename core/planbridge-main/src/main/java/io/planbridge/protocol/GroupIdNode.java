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
import com.google.common.collect.ImmutableMap;
import io.planbridge.protocol.expression.VariableReferenceExpression;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.google.common.collect.ImmutableList.toImmutableList;
import static java.util.Objects.requireNonNull;

/**
 * Replicates each input row once per grouping set. Grouping sets are
 * expressed in output variables; {@code groupingColumns} maps each output
 * variable to the source variable it copies.
 */
public record GroupIdNode(
        String id,
        PlanNode source,
        List<List<VariableReferenceExpression>> groupingSets,
        Map<VariableReferenceExpression, VariableReferenceExpression> groupingColumns,
        List<VariableReferenceExpression> aggregationArguments,
        VariableReferenceExpression groupIdVariable)
        implements PlanNode
{
    public GroupIdNode
    {
        requireNonNull(id, "id is null");
        requireNonNull(source, "source is null");
        groupingSets = requireNonNull(groupingSets, "groupingSets is null").stream()
                .map(ImmutableList::copyOf)
                .collect(toImmutableList());
        groupingColumns = ImmutableMap.copyOf(requireNonNull(groupingColumns, "groupingColumns is null"));
        aggregationArguments = ImmutableList.copyOf(requireNonNull(aggregationArguments, "aggregationArguments is null"));
        requireNonNull(groupIdVariable, "groupIdVariable is null");
    }

    public List<VariableReferenceExpression> getDistinctGroupingSetVariables()
    {
        Set<VariableReferenceExpression> variables = new LinkedHashSet<>();
        groupingSets.forEach(variables::addAll);
        return ImmutableList.copyOf(variables);
    }

    @Override
    public List<PlanNode> getSources()
    {
        return ImmutableList.of(source);
    }

    @Override
    public List<VariableReferenceExpression> getOutputVariables()
    {
        return ImmutableList.<VariableReferenceExpression>builder()
                .addAll(getDistinctGroupingSetVariables())
                .addAll(aggregationArguments)
                .add(groupIdVariable)
                .build();
    }

    @Override
    public <R, C> R accept(PlanVisitor<R, C> visitor, C context)
    {
        return visitor.visitGroupId(this, context);
    }
}
