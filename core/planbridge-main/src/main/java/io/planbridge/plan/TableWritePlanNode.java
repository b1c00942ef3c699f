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
import io.planbridge.connector.CommitStrategy;
import io.planbridge.connector.InsertTableTarget;
import io.planbridge.spi.type.RowType;

import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/**
 * Writes the {@code columns} of its input to the insert target, storing them
 * under {@code columnNames}. Produces row count, fragment and commit context
 * columns for the coordinator.
 */
public record TableWritePlanNode(
        String id,
        RowType columns,
        List<String> columnNames,
        InsertTableTarget insertTableTarget,
        RowType outputType,
        CommitStrategy commitStrategy,
        PhysicalPlanNode source)
        implements PhysicalPlanNode
{
    public TableWritePlanNode
    {
        requireNonNull(id, "id is null");
        requireNonNull(columns, "columns is null");
        columnNames = ImmutableList.copyOf(requireNonNull(columnNames, "columnNames is null"));
        requireNonNull(insertTableTarget, "insertTableTarget is null");
        requireNonNull(outputType, "outputType is null");
        requireNonNull(commitStrategy, "commitStrategy is null");
        requireNonNull(source, "source is null");
        checkArgument(columns.size() == columnNames.size(), "columns and columnNames sizes do not match");
    }

    @Override
    public List<PhysicalPlanNode> sources()
    {
        return ImmutableList.of(source);
    }
}
