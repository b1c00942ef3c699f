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
import java.util.Map;
import java.util.Optional;

import static com.google.common.collect.ImmutableMap.toImmutableMap;
import static java.util.Objects.requireNonNull;

public record UnnestNode(
        String id,
        PlanNode source,
        List<VariableReferenceExpression> replicateVariables,
        Map<VariableReferenceExpression, List<VariableReferenceExpression>> unnestVariables,
        Optional<VariableReferenceExpression> ordinalityVariable)
        implements PlanNode
{
    public UnnestNode
    {
        requireNonNull(id, "id is null");
        requireNonNull(source, "source is null");
        replicateVariables = ImmutableList.copyOf(requireNonNull(replicateVariables, "replicateVariables is null"));
        unnestVariables = requireNonNull(unnestVariables, "unnestVariables is null").entrySet().stream()
                .collect(toImmutableMap(Map.Entry::getKey, entry -> ImmutableList.copyOf(entry.getValue())));
        requireNonNull(ordinalityVariable, "ordinalityVariable is null");
    }

    @Override
    public List<PlanNode> getSources()
    {
        return ImmutableList.of(source);
    }

    @Override
    public List<VariableReferenceExpression> getOutputVariables()
    {
        ImmutableList.Builder<VariableReferenceExpression> outputs = ImmutableList.<VariableReferenceExpression>builder()
                .addAll(replicateVariables);
        unnestVariables.values().forEach(outputs::addAll);
        ordinalityVariable.ifPresent(outputs::add);
        return outputs.build();
    }

    @Override
    public <R, C> R accept(PlanVisitor<R, C> visitor, C context)
    {
        return visitor.visitUnnest(this, context);
    }
}
