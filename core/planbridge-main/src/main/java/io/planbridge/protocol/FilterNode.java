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

import static java.util.Objects.requireNonNull;

public record FilterNode(String id, PlanNode source, RowExpression predicate)
        implements PlanNode
{
    public FilterNode
    {
        requireNonNull(id, "id is null");
        requireNonNull(source, "source is null");
        requireNonNull(predicate, "predicate is null");
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
        return visitor.visitFilter(this, context);
    }
}
