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

import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/**
 * Hive compatible bucketing: rows are hashed into {@code bucketCount} buckets
 * and each bucket is mapped to a partition through {@code bucketToPartition}.
 */
public record HivePartitionFunctionSpec(int bucketCount, List<Integer> bucketToPartition, List<Integer> keyChannels, List<ConstantVector> constValues)
        implements PartitionFunctionSpec
{
    public HivePartitionFunctionSpec
    {
        checkArgument(bucketCount > 0, "bucketCount must be positive");
        bucketToPartition = ImmutableList.copyOf(requireNonNull(bucketToPartition, "bucketToPartition is null"));
        keyChannels = ImmutableList.copyOf(requireNonNull(keyChannels, "keyChannels is null"));
        constValues = ImmutableList.copyOf(requireNonNull(constValues, "constValues is null"));
        checkConstantChannels(keyChannels, constValues);
    }

    static void checkConstantChannels(List<Integer> keyChannels, List<ConstantVector> constValues)
    {
        long constantChannels = keyChannels.stream()
                .filter(channel -> channel == CONSTANT_CHANNEL)
                .count();
        checkArgument(constantChannels == constValues.size(), "expected %s constant values, got %s", constantChannels, constValues.size());
    }
}
