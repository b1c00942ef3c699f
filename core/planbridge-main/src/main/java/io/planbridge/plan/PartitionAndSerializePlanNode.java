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
import static io.planbridge.spi.type.IntegerType.INTEGER;
import static io.planbridge.spi.type.VarbinaryType.VARBINARY;
import static java.util.Objects.requireNonNull;

/**
 * Computes the destination partition of each row and serializes the columns
 * of {@code serializedRowType} into a single binary column.
 */
public record PartitionAndSerializePlanNode(
        String id,
        List<TypedExpression> keys,
        int numPartitions,
        RowType serializedRowType,
        PartitionFunctionSpec partitionFunctionSpec,
        PhysicalPlanNode source)
        implements PhysicalPlanNode
{
    public static final RowType OUTPUT_TYPE = RowType.rowType(ImmutableList.of("partition", "data"), ImmutableList.of(INTEGER, VARBINARY));

    public PartitionAndSerializePlanNode
    {
        requireNonNull(id, "id is null");
        keys = ImmutableList.copyOf(requireNonNull(keys, "keys is null"));
        checkArgument(numPartitions > 0, "numPartitions must be positive");
        requireNonNull(serializedRowType, "serializedRowType is null");
        requireNonNull(partitionFunctionSpec, "partitionFunctionSpec is null");
        requireNonNull(source, "source is null");
    }

    @Override
    public List<PhysicalPlanNode> sources()
    {
        return ImmutableList.of(source);
    }

    @Override
    public RowType outputType()
    {
        return OUTPUT_TYPE;
    }
}
