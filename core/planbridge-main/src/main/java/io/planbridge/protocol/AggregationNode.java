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
import com.google.common.collect.ImmutableSet;
import io.planbridge.protocol.expression.CallExpression;
import io.planbridge.protocol.expression.RowExpression;
import io.planbridge.protocol.expression.VariableReferenceExpression;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

public record AggregationNode(
        String id,
        PlanNode source,
        Map<VariableReferenceExpression, Aggregation> aggregations,
        GroupingSetDescriptor groupingSets,
        List<VariableReferenceExpression> preGroupedVariables,
        Step step,
        Optional<VariableReferenceExpression> hashVariable,
        Optional<VariableReferenceExpression> groupIdVariable)
        implements PlanNode
{
    public AggregationNode
    {
        requireNonNull(id, "id is null");
        requireNonNull(source, "source is null");
        aggregations = ImmutableMap.copyOf(requireNonNull(aggregations, "aggregations is null"));
        requireNonNull(groupingSets, "groupingSets is null");
        preGroupedVariables = ImmutableList.copyOf(requireNonNull(preGroupedVariables, "preGroupedVariables is null"));
        requireNonNull(step, "step is null");
        requireNonNull(hashVariable, "hashVariable is null");
        requireNonNull(groupIdVariable, "groupIdVariable is null");
        checkArgument(groupingSets.groupingKeys().containsAll(preGroupedVariables), "Pre-grouped variables must be a subset of the grouping keys");
    }

    public List<VariableReferenceExpression> getGroupingKeys()
    {
        return groupingSets.groupingKeys();
    }

    @Override
    public List<PlanNode> getSources()
    {
        return ImmutableList.of(source);
    }

    @Override
    public List<VariableReferenceExpression> getOutputVariables()
    {
        ImmutableList.Builder<VariableReferenceExpression> outputs = ImmutableList.builder();
        outputs.addAll(groupingSets.groupingKeys());
        hashVariable.ifPresent(outputs::add);
        outputs.addAll(aggregations.keySet());
        return outputs.build();
    }

    @Override
    public <R, C> R accept(PlanVisitor<R, C> visitor, C context)
    {
        return visitor.visitAggregation(this, context);
    }

    public enum Step
    {
        PARTIAL,
        FINAL,
        INTERMEDIATE,
        SINGLE,
    }

    public record Aggregation(CallExpression call, Optional<RowExpression> filter, Optional<OrderingScheme> orderBy, boolean distinct, Optional<VariableReferenceExpression> mask)
    {
        public Aggregation
        {
            requireNonNull(call, "call is null");
            requireNonNull(filter, "filter is null");
            requireNonNull(orderBy, "orderBy is null");
            requireNonNull(mask, "mask is null");
        }
    }

    public record GroupingSetDescriptor(List<VariableReferenceExpression> groupingKeys, int groupingSetCount, Set<Integer> globalGroupingSets)
    {
        public GroupingSetDescriptor
        {
            groupingKeys = ImmutableList.copyOf(requireNonNull(groupingKeys, "groupingKeys is null"));
            checkArgument(groupingSetCount > 0, "grouping set count must be larger than 0");
            globalGroupingSets = ImmutableSet.copyOf(requireNonNull(globalGroupingSets, "globalGroupingSets is null"));
        }
    }
}
