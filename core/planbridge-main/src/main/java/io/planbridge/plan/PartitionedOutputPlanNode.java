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
import io.planbridge.expression.TypedExpression;
import io.planbridge.spi.type.RowType;

import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;
import static io.planbridge.plan.GatherPartitionFunctionSpec.GATHER;
import static java.util.Objects.requireNonNull;

/**
 * Root of a fragment whose rows are sent to downstream tasks. Keys are field
 * accesses or constants; {@code outputType} is the layout sent over the wire.
 */
public record PartitionedOutputPlanNode(
        String id,
        List<TypedExpression> keys,
        int numPartitions,
        boolean broadcast,
        boolean replicateNullsAndAny,
        PartitionFunctionSpec partitionFunctionSpec,
        RowType outputType,
        PhysicalPlanNode source)
        implements PhysicalPlanNode
{
    public PartitionedOutputPlanNode
    {
        requireNonNull(id, "id is null");
        keys = ImmutableList.copyOf(requireNonNull(keys, "keys is null"));
        checkArgument(numPartitions > 0, "numPartitions must be positive");
        requireNonNull(partitionFunctionSpec, "partitionFunctionSpec is null");
        requireNonNull(outputType, "outputType is null");
        requireNonNull(source, "source is null");
        checkArgument(!broadcast || keys.isEmpty(), "broadcast output cannot have partitioning keys");
    }

    public static PartitionedOutputPlanNode single(String id, RowType outputType, PhysicalPlanNode source)
    {
        return new PartitionedOutputPlanNode(id, ImmutableList.of(), 1, false, false, GATHER, outputType, source);
    }

    public static PartitionedOutputPlanNode broadcast(String id, int numPartitions, RowType outputType, PhysicalPlanNode source)
    {
        return new PartitionedOutputPlanNode(id, ImmutableList.of(), numPartitions, true, false, GATHER, outputType, source);
    }

    public boolean isSingle()
    {
        return numPartitions == 1 && !broadcast;
    }

    @Override
    public List<PhysicalPlanNode> sources()
    {
        return ImmutableList.of(source);
    }
}
