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
import static com.google.common.collect.ImmutableList.toImmutableList;
import static java.util.Objects.requireNonNull;

/**
 * Redistributes rows of its sources. {@code inputs.get(i)} lists, for source
 * {@code i}, the variables feeding each output column of the partitioning
 * scheme's layout, position by position.
 */
public record ExchangeNode(
        String id,
        Type type,
        Scope scope,
        PartitioningScheme partitioningScheme,
        List<PlanNode> sources,
        List<List<VariableReferenceExpression>> inputs,
        boolean ensureSourceOrdering,
        Optional<OrderingScheme> orderingScheme)
        implements PlanNode
{
    public ExchangeNode
    {
        requireNonNull(id, "id is null");
        requireNonNull(type, "type is null");
        requireNonNull(scope, "scope is null");
        requireNonNull(partitioningScheme, "partitioningScheme is null");
        sources = ImmutableList.copyOf(requireNonNull(sources, "sources is null"));
        inputs = requireNonNull(inputs, "inputs is null").stream()
                .map(ImmutableList::copyOf)
                .collect(toImmutableList());
        requireNonNull(orderingScheme, "orderingScheme is null");
        checkArgument(!sources.isEmpty(), "sources is empty");
        checkArgument(inputs.size() == sources.size(), "There must be exactly one input list for each source");
        for (List<VariableReferenceExpression> input : inputs) {
            checkArgument(input.size() == partitioningScheme.outputLayout().size(), "Input symbols do not match output symbols");
        }
    }

    @Override
    public List<PlanNode> getSources()
    {
        return sources;
    }

    @Override
    public List<VariableReferenceExpression> getOutputVariables()
    {
        return partitioningScheme.outputLayout();
    }

    @Override
    public <R, C> R accept(PlanVisitor<R, C> visitor, C context)
    {
        return visitor.visitExchange(this, context);
    }

    public enum Type
    {
        GATHER,
        REPARTITION,
        REPLICATE,
    }

    public enum Scope
    {
        LOCAL,
        REMOTE_STREAMING,
        REMOTE_MATERIALIZED;

        public boolean isRemote()
        {
            return this != LOCAL;
        }
    }
}
