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
import io.planbridge.protocol.expression.VariableReferenceExpression;

import java.util.List;
import java.util.Optional;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

public record DistinctLimitNode(String id, PlanNode source, long limit, boolean partial, List<VariableReferenceExpression> distinctVariables, Optional<VariableReferenceExpression> hashVariable)
        implements PlanNode
{
    public DistinctLimitNode
    {
        requireNonNull(id, "id is null");
        requireNonNull(source, "source is null");
        checkArgument(limit >= 0, "limit must be greater than or equal to zero");
        distinctVariables = ImmutableList.copyOf(requireNonNull(distinctVariables, "distinctVariables is null"));
        requireNonNull(hashVariable, "hashVariable is null");
    }

    @Override
    public List<PlanNode> getSources()
    {
        return ImmutableList.of(source);
    }

    @Override
    public List<VariableReferenceExpression> getOutputVariables()
    {
        return source.getOutputVariables();
    }

    @Override
    public <R, C> R accept(PlanVisitor<R, C> visitor, C context)
    {
        return visitor.visitDistinctLimit(this, context);
    }
}
