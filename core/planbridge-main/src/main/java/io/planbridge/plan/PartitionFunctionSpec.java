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

/**
 * Describes how the engine assigns rows to output partitions.
 */
public sealed interface PartitionFunctionSpec
        permits GatherPartitionFunctionSpec,
        RoundRobinPartitionFunctionSpec,
        HashPartitionFunctionSpec,
        HivePartitionFunctionSpec
{
    /**
     * Key channel marking a constant partitioning key. The value is taken
     * from the next unused entry of the spec's constant values.
     */
    int CONSTANT_CHANNEL = -1;
}
