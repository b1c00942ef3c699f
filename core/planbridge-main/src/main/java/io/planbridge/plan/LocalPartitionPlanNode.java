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
import io.planbridge.spi.type.RowType;

import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;
import static io.planbridge.plan.GatherPartitionFunctionSpec.GATHER;
import static java.util.Objects.requireNonNull;

/**
 * In-process exchange redistributing rows of all sources across the drivers
 * of the consuming pipeline. All sources must produce the same row type.
 */
public record LocalPartitionPlanNode(String id, Type type, PartitionFunctionSpec partitionFunctionSpec, List<PhysicalPlanNode> sources)
        implements PhysicalPlanNode
{
    public enum Type
    {
        GATHER,
        REPARTITION,
    }

    public LocalPartitionPlanNode
    {
        requireNonNull(id, "id is null");
        requireNonNull(type, "type is null");
        requireNonNull(partitionFunctionSpec, "partitionFunctionSpec is null");
        sources = ImmutableList.copyOf(requireNonNull(sources, "sources is null"));
        checkArgument(!sources.isEmpty(), "local partition requires at least one source");
        checkArgument(type != Type.GATHER || partitionFunctionSpec instanceof GatherPartitionFunctionSpec, "gather requires a gather partition function");
    }

    public static LocalPartitionPlanNode gather(String id, List<PhysicalPlanNode> sources)
    {
        return new LocalPartitionPlanNode(id, Type.GATHER, GATHER, sources);
    }

    @Override
    public RowType outputType()
    {
        return sources.get(0).outputType();
    }
}
