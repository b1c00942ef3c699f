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
import io.planbridge.expression.TypedExpression;
import io.planbridge.spi.type.RowType;

import java.util.List;
import java.util.Optional;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/**
 * Equi-join of two inputs already sorted on the join keys.
 */
public record MergeJoinPlanNode(
        String id,
        JoinType joinType,
        List<FieldAccessTypedExpression> leftKeys,
        List<FieldAccessTypedExpression> rightKeys,
        Optional<TypedExpression> filter,
        PhysicalPlanNode left,
        PhysicalPlanNode right,
        RowType outputType)
        implements PhysicalPlanNode
{
    public MergeJoinPlanNode
    {
        requireNonNull(id, "id is null");
        requireNonNull(joinType, "joinType is null");
        leftKeys = ImmutableList.copyOf(requireNonNull(leftKeys, "leftKeys is null"));
        rightKeys = ImmutableList.copyOf(requireNonNull(rightKeys, "rightKeys is null"));
        requireNonNull(filter, "filter is null");
        requireNonNull(left, "left is null");
        requireNonNull(right, "right is null");
        requireNonNull(outputType, "outputType is null");
        checkArgument(leftKeys.size() == rightKeys.size(), "leftKeys and rightKeys sizes do not match");
    }

    @Override
    public List<PhysicalPlanNode> sources()
    {
        return ImmutableList.of(left, right);
    }
}
