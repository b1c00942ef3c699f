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

import com.google.common.collect.ImmutableSet;

import java.util.Set;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/**
 * Executable plan of one task together with its grouped execution settings.
 */
public record PhysicalPlanFragment(
        PhysicalPlanNode planNode,
        ExecutionStrategy executionStrategy,
        int numSplitGroups,
        Set<String> groupedExecutionLeafNodeIds)
{
    public PhysicalPlanFragment
    {
        requireNonNull(planNode, "planNode is null");
        requireNonNull(executionStrategy, "executionStrategy is null");
        checkArgument(numSplitGroups >= 0, "numSplitGroups is negative");
        groupedExecutionLeafNodeIds = ImmutableSet.copyOf(requireNonNull(groupedExecutionLeafNodeIds, "groupedExecutionLeafNodeIds is null"));
    }

    public boolean isGroupedExecution()
    {
        return executionStrategy == ExecutionStrategy.GROUPED;
    }
}
