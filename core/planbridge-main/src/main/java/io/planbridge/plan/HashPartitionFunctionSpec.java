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

import static io.planbridge.plan.HivePartitionFunctionSpec.checkConstantChannels;
import static java.util.Objects.requireNonNull;

public record HashPartitionFunctionSpec(RowType inputType, List<Integer> keyChannels, List<ConstantVector> constValues)
        implements PartitionFunctionSpec
{
    public HashPartitionFunctionSpec
    {
        requireNonNull(inputType, "inputType is null");
        keyChannels = ImmutableList.copyOf(requireNonNull(keyChannels, "keyChannels is null"));
        constValues = ImmutableList.copyOf(requireNonNull(constValues, "constValues is null"));
        checkConstantChannels(keyChannels, constValues);
    }

    public HashPartitionFunctionSpec(RowType inputType, List<Integer> keyChannels)
    {
        this(inputType, keyChannels, ImmutableList.of());
    }
}
