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

import io.planbridge.protocol.connector.ConnectorPartitioningHandle;

import java.util.Optional;

import static java.util.Objects.requireNonNull;

public record SystemPartitioningHandle(SystemPartitioning partitioning, SystemPartitionFunction function)
        implements ConnectorPartitioningHandle
{
    public static final PartitioningHandle SINGLE_DISTRIBUTION = handle(SystemPartitioning.SINGLE, SystemPartitionFunction.SINGLE);
    public static final PartitioningHandle FIXED_HASH_DISTRIBUTION = handle(SystemPartitioning.FIXED, SystemPartitionFunction.HASH);
    public static final PartitioningHandle FIXED_ARBITRARY_DISTRIBUTION = handle(SystemPartitioning.FIXED, SystemPartitionFunction.ROUND_ROBIN);
    public static final PartitioningHandle FIXED_BROADCAST_DISTRIBUTION = handle(SystemPartitioning.FIXED, SystemPartitionFunction.BROADCAST);
    public static final PartitioningHandle SOURCE_DISTRIBUTION = handle(SystemPartitioning.SOURCE, SystemPartitionFunction.UNKNOWN);

    public SystemPartitioningHandle
    {
        requireNonNull(partitioning, "partitioning is null");
        requireNonNull(function, "function is null");
    }

    private static PartitioningHandle handle(SystemPartitioning partitioning, SystemPartitionFunction function)
    {
        return new PartitioningHandle(Optional.empty(), new SystemPartitioningHandle(partitioning, function));
    }

    public enum SystemPartitioning
    {
        SINGLE,
        FIXED,
        SOURCE,
        SCALED,
        COORDINATOR_ONLY,
        ARBITRARY,
    }

    public enum SystemPartitionFunction
    {
        SINGLE,
        HASH,
        ROUND_ROBIN,
        BROADCAST,
        UNKNOWN,
    }
}
