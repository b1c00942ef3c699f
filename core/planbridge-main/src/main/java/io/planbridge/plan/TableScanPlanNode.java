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
import com.google.common.collect.ImmutableMap;
import io.planbridge.connector.ScanColumnHandle;
import io.planbridge.connector.ScanTableHandle;
import io.planbridge.spi.type.RowType;

import java.util.List;
import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * Leaf reading a connector table. Assignments map output column names to the
 * connector columns that produce them.
 */
public record TableScanPlanNode(String id, RowType outputType, ScanTableHandle tableHandle, Map<String, ScanColumnHandle> assignments)
        implements PhysicalPlanNode
{
    public TableScanPlanNode
    {
        requireNonNull(id, "id is null");
        requireNonNull(outputType, "outputType is null");
        requireNonNull(tableHandle, "tableHandle is null");
        assignments = ImmutableMap.copyOf(requireNonNull(assignments, "assignments is null"));
    }

    @Override
    public List<PhysicalPlanNode> sources()
    {
        return ImmutableList.of();
    }
}
