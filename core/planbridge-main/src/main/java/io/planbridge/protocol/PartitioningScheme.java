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

import com.google.common.collect.ImmutableList;
import io.planbridge.protocol.expression.VariableReferenceExpression;

import java.util.List;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

public record PartitioningScheme(
        Partitioning partitioning,
        List<VariableReferenceExpression> outputLayout,
        Optional<VariableReferenceExpression> hashColumn,
        boolean replicateNullsAndAny,
        Optional<List<Integer>> bucketToPartition)
{
    public PartitioningScheme
    {
        requireNonNull(partitioning, "partitioning is null");
        outputLayout = ImmutableList.copyOf(requireNonNull(outputLayout, "outputLayout is null"));
        requireNonNull(hashColumn, "hashColumn is null");
        bucketToPartition = requireNonNull(bucketToPartition, "bucketToPartition is null").map(ImmutableList::copyOf);
    }

    public PartitioningScheme(Partitioning partitioning, List<VariableReferenceExpression> outputLayout)
    {
        this(partitioning, outputLayout, Optional.empty(), false, Optional.empty());
    }
}
