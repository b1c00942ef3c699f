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
package io.planbridge.sql.planner;

import com.google.common.collect.ImmutableList;
import io.planbridge.expression.ConstantTypedExpression;
import io.planbridge.expression.ExpressionConverter;
import io.planbridge.expression.FieldAccessTypedExpression;
import io.planbridge.expression.TypedExpression;
import io.planbridge.plan.ConstantVector;
import io.planbridge.plan.HashPartitionFunctionSpec;
import io.planbridge.plan.HivePartitionFunctionSpec;
import io.planbridge.plan.PartitionFunctionSpec;
import io.planbridge.plan.PartitionedOutputPlanNode;
import io.planbridge.plan.PhysicalPlanNode;
import io.planbridge.protocol.PartitioningScheme;
import io.planbridge.protocol.SystemPartitioningHandle;
import io.planbridge.protocol.connector.ConnectorPartitioningHandle;
import io.planbridge.protocol.connector.HivePartitioningHandle;
import io.planbridge.protocol.expression.RowExpression;
import io.planbridge.spi.type.RowType;

import java.util.List;

import static io.planbridge.plan.PartitionFunctionSpec.CONSTANT_CHANNEL;
import static io.planbridge.plan.RoundRobinPartitionFunctionSpec.ROUND_ROBIN;
import static io.planbridge.protocol.connector.HivePartitioningHandle.BucketFunctionType.HIVE_COMPATIBLE;
import static io.planbridge.sql.planner.PlanTranslationUtils.toRowType;
import static io.planbridge.util.Failures.checkInvariant;
import static io.planbridge.util.Failures.checkSupported;
import static io.planbridge.util.Failures.invariantViolation;
import static io.planbridge.util.Failures.unsupported;
import static java.util.Objects.requireNonNull;

/**
 * Builds the partitioned output that sends the rows of a fragment to its
 * consumers. Whenever the scheme resolves to a single partition the output is
 * a single destination output, whatever partition function was requested.
 */
public class PartitioningCompiler
{
    private final ExpressionConverter expressionConverter;

    public PartitioningCompiler(ExpressionConverter expressionConverter)
    {
        this.expressionConverter = requireNonNull(expressionConverter, "expressionConverter is null");
    }

    public PartitionedOutputPlanNode compile(String id, PartitioningScheme partitioningScheme, PhysicalPlanNode source)
    {
        ConnectorPartitioningHandle handle = partitioningScheme.partitioning().handle().connectorHandle();
        List<TypedExpression> keys = toPartitioningKeys(partitioningScheme.partitioning().arguments());
        RowType outputType = toRowType(partitioningScheme.outputLayout());

        if (handle instanceof SystemPartitioningHandle systemHandle) {
            switch (systemHandle.partitioning()) {
                case SINGLE:
                    checkSupported(systemHandle.function() == SystemPartitioningHandle.SystemPartitionFunction.SINGLE, "Unsupported partitioning function: %s", systemHandle.function());
                    return PartitionedOutputPlanNode.single(id, outputType, source);
                case FIXED:
                    return compileFixed(id, systemHandle, partitioningScheme, keys, outputType, source);
                default:
                    throw unsupported("Unsupported kind of system partitioning: %s", systemHandle.partitioning());
            }
        }

        if (handle instanceof HivePartitioningHandle hiveHandle) {
            List<Integer> bucketToPartition = bucketToPartition(partitioningScheme);
            checkInvariant(!bucketToPartition.isEmpty(), "Bucket to partition mapping is empty");
            int numPartitions = bucketToPartition.stream()
                    .mapToInt(Integer::intValue)
                    .max()
                    .getAsInt() + 1;
            if (numPartitions == 1) {
                return PartitionedOutputPlanNode.single(id, outputType, source);
            }
            checkSupported(hiveHandle.bucketFunctionType() == HIVE_COMPATIBLE, "Unsupported Hive bucket function type: %s", hiveHandle.bucketFunctionType());
            KeyChannels channels = toKeyChannels(keys, source.outputType());
            return new PartitionedOutputPlanNode(
                    id,
                    keys,
                    numPartitions,
                    false,
                    partitioningScheme.replicateNullsAndAny(),
                    new HivePartitionFunctionSpec(hiveHandle.bucketCount(), bucketToPartition, channels.channels(), channels.constValues()),
                    outputType,
                    source);
        }

        throw unsupported("Unsupported partitioning handle: %s", handle);
    }

    private PartitionedOutputPlanNode compileFixed(
            String id,
            SystemPartitioningHandle handle,
            PartitioningScheme partitioningScheme,
            List<TypedExpression> keys,
            RowType outputType,
            PhysicalPlanNode source)
    {
        PartitionFunctionSpec spec;
        switch (handle.function()) {
            case BROADCAST:
                return PartitionedOutputPlanNode.broadcast(id, 1, outputType, source);
            case ROUND_ROBIN:
                spec = ROUND_ROBIN;
                break;
            case HASH: {
                KeyChannels channels = toKeyChannels(keys, source.outputType());
                spec = new HashPartitionFunctionSpec(source.outputType(), channels.channels(), channels.constValues());
                break;
            }
            default:
                throw unsupported("Unsupported partitioning function: %s", handle.function());
        }

        int numPartitions = bucketToPartition(partitioningScheme).size();
        if (numPartitions == 1) {
            return PartitionedOutputPlanNode.single(id, outputType, source);
        }
        return new PartitionedOutputPlanNode(id, keys, numPartitions, false, partitioningScheme.replicateNullsAndAny(), spec, outputType, source);
    }

    private List<TypedExpression> toPartitioningKeys(List<RowExpression> arguments)
    {
        ImmutableList.Builder<TypedExpression> keys = ImmutableList.builderWithExpectedSize(arguments.size());
        for (RowExpression argument : arguments) {
            TypedExpression key = expressionConverter.toTypedExpression(argument);
            checkInvariant(
                    key instanceof FieldAccessTypedExpression || key instanceof ConstantTypedExpression,
                    "Unexpected partitioning key: %s. Expected variable or constant.", argument);
            keys.add(key);
        }
        return keys.build();
    }

    /**
     * Resolves each key to its channel in {@code inputType}. Constant keys get
     * {@link PartitionFunctionSpec#CONSTANT_CHANNEL} and a one row vector holding the value.
     */
    static KeyChannels toKeyChannels(List<TypedExpression> keys, RowType inputType)
    {
        ImmutableList.Builder<Integer> channels = ImmutableList.builder();
        ImmutableList.Builder<ConstantVector> constValues = ImmutableList.builder();
        for (TypedExpression key : keys) {
            if (key instanceof FieldAccessTypedExpression field) {
                channels.add(toChannel(field, inputType));
            }
            else if (key instanceof ConstantTypedExpression constant) {
                channels.add(CONSTANT_CHANNEL);
                constValues.add(new ConstantVector(constant.type(), constant.getValue()));
            }
            else {
                throw invariantViolation("Partitioning key must be field access or constant: %s", key);
            }
        }
        return new KeyChannels(channels.build(), constValues.build());
    }

    static int toChannel(FieldAccessTypedExpression field, RowType inputType)
    {
        int channel = inputType.indexOf(field.name());
        checkInvariant(channel >= 0, "Column %s not found in %s", field.name(), inputType);
        return channel;
    }

    private static List<Integer> bucketToPartition(PartitioningScheme partitioningScheme)
    {
        return partitioningScheme.bucketToPartition()
                .orElseThrow(() -> invariantViolation("Partitioning scheme has no bucket to partition mapping: %s", partitioningScheme.partitioning()));
    }

    record KeyChannels(List<Integer> channels, List<ConstantVector> constValues)
    {
        KeyChannels
        {
            channels = ImmutableList.copyOf(requireNonNull(channels, "channels is null"));
            constValues = ImmutableList.copyOf(requireNonNull(constValues, "constValues is null"));
        }
    }
}
