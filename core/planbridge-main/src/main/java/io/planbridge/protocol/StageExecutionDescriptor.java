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

import com.google.common.collect.ImmutableSet;

import java.util.Set;

import static java.util.Objects.requireNonNull;

public record StageExecutionDescriptor(StageExecutionStrategy stageExecutionStrategy, Set<String> groupedExecutionScanNodes, int totalLifespans)
{
    public StageExecutionDescriptor
    {
        requireNonNull(stageExecutionStrategy, "stageExecutionStrategy is null");
        groupedExecutionScanNodes = ImmutableSet.copyOf(requireNonNull(groupedExecutionScanNodes, "groupedExecutionScanNodes is null"));
    }

    public static StageExecutionDescriptor ungroupedExecution()
    {
        return new StageExecutionDescriptor(StageExecutionStrategy.UNGROUPED_EXECUTION, ImmutableSet.of(), 1);
    }
}
