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
import io.planbridge.expression.CallTypedExpression;
import io.planbridge.expression.FieldAccessTypedExpression;
import io.planbridge.spi.type.RowType;
import io.planbridge.spi.type.Type;

import java.util.List;
import java.util.Optional;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/**
 * Grouped aggregation. Output is the grouping keys followed by one column per aggregate.
 * When every input row of a group arrives together ({@code preGroupedKeys} is
 * not empty) the aggregation is evaluated in streaming fashion.
 */
public record AggregationPlanNode(
        String id,
        Step step,
        List<FieldAccessTypedExpression> groupingKeys,
        List<FieldAccessTypedExpression> preGroupedKeys,
        List<String> aggregateNames,
        List<Aggregate> aggregates,
        boolean ignoreNullKeys,
        PhysicalPlanNode source)
        implements PhysicalPlanNode
{
    public enum Step
    {
        PARTIAL,
        FINAL,
        INTERMEDIATE,
        SINGLE,
    }

    public record Aggregate(CallTypedExpression call, Optional<FieldAccessTypedExpression> mask)
    {
        public Aggregate
        {
            requireNonNull(call, "call is null");
            requireNonNull(mask, "mask is null");
        }
    }

    public AggregationPlanNode
    {
        requireNonNull(id, "id is null");
        requireNonNull(step, "step is null");
        groupingKeys = ImmutableList.copyOf(requireNonNull(groupingKeys, "groupingKeys is null"));
        preGroupedKeys = ImmutableList.copyOf(requireNonNull(preGroupedKeys, "preGroupedKeys is null"));
        aggregateNames = ImmutableList.copyOf(requireNonNull(aggregateNames, "aggregateNames is null"));
        aggregates = ImmutableList.copyOf(requireNonNull(aggregates, "aggregates is null"));
        requireNonNull(source, "source is null");
        checkArgument(aggregateNames.size() == aggregates.size(), "aggregateNames and aggregates sizes do not match");
    }

    public boolean isStreamable()
    {
        return !preGroupedKeys.isEmpty();
    }

    @Override
    public List<PhysicalPlanNode> sources()
    {
        return ImmutableList.of(source);
    }

    @Override
    public RowType outputType()
    {
        ImmutableList.Builder<String> names = ImmutableList.builder();
        ImmutableList.Builder<Type> types = ImmutableList.builder();
        for (FieldAccessTypedExpression key : groupingKeys) {
            names.add(key.name());
            types.add(key.type());
        }
        for (int i = 0; i < aggregates.size(); i++) {
            names.add(aggregateNames.get(i));
            types.add(aggregates.get(i).call().type());
        }
        return RowType.rowType(names.build(), types.build());
    }
}
