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
import io.planbridge.expression.TypedExpression;
import io.planbridge.spi.type.RowType;
import io.planbridge.spi.type.Type;

import java.util.List;
import java.util.Optional;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

public record WindowPlanNode(
        String id,
        List<FieldAccessTypedExpression> partitionKeys,
        List<FieldAccessTypedExpression> sortingKeys,
        List<SortOrder> sortingOrders,
        List<String> windowColumnNames,
        List<Function> windowFunctions,
        PhysicalPlanNode source)
        implements PhysicalPlanNode
{
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

    public record Frame(WindowType type, BoundType startType, Optional<TypedExpression> startValue, BoundType endType, Optional<TypedExpression> endValue)
    {
        public Frame
        {
            requireNonNull(type, "type is null");
            requireNonNull(startType, "startType is null");
            requireNonNull(startValue, "startValue is null");
            requireNonNull(endType, "endType is null");
            requireNonNull(endValue, "endValue is null");
        }
    }

    public record Function(CallTypedExpression functionCall, Frame frame, boolean ignoreNulls)
    {
        public Function
        {
            requireNonNull(functionCall, "functionCall is null");
            requireNonNull(frame, "frame is null");
        }
    }

    public WindowPlanNode
    {
        requireNonNull(id, "id is null");
        partitionKeys = ImmutableList.copyOf(requireNonNull(partitionKeys, "partitionKeys is null"));
        sortingKeys = ImmutableList.copyOf(requireNonNull(sortingKeys, "sortingKeys is null"));
        sortingOrders = ImmutableList.copyOf(requireNonNull(sortingOrders, "sortingOrders is null"));
        windowColumnNames = ImmutableList.copyOf(requireNonNull(windowColumnNames, "windowColumnNames is null"));
        windowFunctions = ImmutableList.copyOf(requireNonNull(windowFunctions, "windowFunctions is null"));
        requireNonNull(source, "source is null");
        checkArgument(sortingKeys.size() == sortingOrders.size(), "sortingKeys and sortingOrders sizes do not match");
        checkArgument(windowColumnNames.size() == windowFunctions.size(), "windowColumnNames and windowFunctions sizes do not match");
    }

    @Override
    public List<PhysicalPlanNode> sources()
    {
        return ImmutableList.of(source);
    }

    @Override
    public RowType outputType()
    {
        RowType sourceType = source.outputType();
        ImmutableList.Builder<String> names = ImmutableList.<String>builder().addAll(sourceType.getFieldNames());
        ImmutableList.Builder<Type> types = ImmutableList.<Type>builder().addAll(sourceType.getTypeParameters());
        for (int i = 0; i < windowFunctions.size(); i++) {
            names.add(windowColumnNames.get(i));
            types.add(windowFunctions.get(i).functionCall().type());
        }
        return RowType.rowType(names.build(), types.build());
    }
}
