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
import io.planbridge.protocol.expression.VariableReferenceExpression;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static java.util.Objects.requireNonNull;

public record WindowNode(
        String id,
        PlanNode source,
        Specification specification,
        Map<VariableReferenceExpression, Function> windowFunctions,
        Optional<VariableReferenceExpression> hashVariable,
        Set<VariableReferenceExpression> prePartitionedInputs,
        int preSortedOrderPrefix)
        implements PlanNode
{
    public WindowNode
    {
        requireNonNull(id, "id is null");
        requireNonNull(source, "source is null");
        requireNonNull(specification, "specification is null");
        windowFunctions = ImmutableMap.copyOf(requireNonNull(windowFunctions, "windowFunctions is null"));
        requireNonNull(hashVariable, "hashVariable is null");
        prePartitionedInputs = ImmutableSet.copyOf(requireNonNull(prePartitionedInputs, "prePartitionedInputs is null"));
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
                .addAll(source.getOutputVariables())
                .addAll(windowFunctions.keySet())
                .build();
    }

    @Override
    public <R, C> R accept(PlanVisitor<R, C> visitor, C context)
    {
        return visitor.visitWindow(this, context);
    }

    public record Specification(List<VariableReferenceExpression> partitionBy, Optional<OrderingScheme> orderingScheme)
    {
        public Specification
        {
            partitionBy = ImmutableList.copyOf(requireNonNull(partitionBy, "partitionBy is null"));
            requireNonNull(orderingScheme, "orderingScheme is null");
        }
    }

    public record Function(CallExpression functionCall, Frame frame, boolean ignoreNulls)
    {
        public Function
        {
            requireNonNull(functionCall, "functionCall is null");
            requireNonNull(frame, "frame is null");
        }
    }

    public record Frame(
            WindowType type,
            BoundType startType,
            Optional<VariableReferenceExpression> startValue,
            BoundType endType,
            Optional<VariableReferenceExpression> endValue)
    {
        public Frame
        {
            requireNonNull(type, "type is null");
            requireNonNull(startType, "startType is null");
            requireNonNull(startValue, "startValue is null");
            requireNonNull(endType, "endType is null");
            requireNonNull(endValue, "endValue is null");
        }

        public enum WindowType
        {
            RANGE,
            ROWS,
        }

        public enum BoundType
        {
            UNBOUNDED_PRECEDING,
            PRECEDING,
            CURRENT_ROW,
            FOLLOWING,
            UNBOUNDED_FOLLOWING,
        }
    }
}
