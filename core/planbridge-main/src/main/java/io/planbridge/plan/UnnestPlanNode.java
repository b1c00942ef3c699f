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
import io.planbridge.spi.type.RowType;

import java.util.List;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * Expands array and map columns into rows. Output is the replicated columns,
 * the columns named by {@code unnestNames} and the optional ordinality column.
 */
public record UnnestPlanNode(
        String id,
        List<FieldAccessTypedExpression> replicateVariables,
        List<FieldAccessTypedExpression> unnestVariables,
        List<String> unnestNames,
        Optional<String> ordinalityName,
        RowType outputType,
        PhysicalPlanNode source)
        implements PhysicalPlanNode
{
    public UnnestPlanNode
    {
        requireNonNull(id, "id is null");
        replicateVariables = ImmutableList.copyOf(requireNonNull(replicateVariables, "replicateVariables is null"));
        unnestVariables = ImmutableList.copyOf(requireNonNull(unnestVariables, "unnestVariables is null"));
        unnestNames = ImmutableList.copyOf(requireNonNull(unnestNames, "unnestNames is null"));
        requireNonNull(ordinalityName, "ordinalityName is null");
        requireNonNull(outputType, "outputType is null");
        requireNonNull(source, "source is null");
    }

    @Override
    public List<PhysicalPlanNode> sources()
    {
        return ImmutableList.of(source);
    }
}
