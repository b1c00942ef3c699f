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
import io.planbridge.expression.FieldAccessTypedExpression;
import io.planbridge.expression.RowExpressionConverter;
import io.planbridge.plan.ConstantVector;
import io.planbridge.plan.HashPartitionFunctionSpec;
import io.planbridge.plan.HivePartitionFunctionSpec;
import io.planbridge.plan.PartitionedOutputPlanNode;
import io.planbridge.plan.PhysicalPlanNode;
import io.planbridge.plan.ValuesPlanNode;
import io.planbridge.protocol.Partitioning;
import io.planbridge.protocol.PartitioningHandle;
import io.planbridge.protocol.PartitioningScheme;
import io.planbridge.protocol.connector.HivePartitioningHandle;
import io.planbridge.protocol.expression.RowExpression;
import io.planbridge.protocol.expression.VariableReferenceExpression;
import io.planbridge.spi.type.RowType;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static io.planbridge.plan.GatherPartitionFunctionSpec.GATHER;
import static io.planbridge.plan.PartitionFunctionSpec.CONSTANT_CHANNEL;
import static io.planbridge.plan.RoundRobinPartitionFunctionSpec.ROUND_ROBIN;
import static io.planbridge.protocol.ProtocolPlanBuilder.bigintConstant;
import static io.planbridge.protocol.ProtocolPlanBuilder.partitioningScheme;
import static io.planbridge.protocol.ProtocolPlanBuilder.variable;
import static io.planbridge.protocol.SystemPartitioningHandle.FIXED_ARBITRARY_DISTRIBUTION;
import static io.planbridge.protocol.SystemPartitioningHandle.FIXED_BROADCAST_DISTRIBUTION;
import static io.planbridge.protocol.SystemPartitioningHandle.FIXED_HASH_DISTRIBUTION;
import static io.planbridge.protocol.SystemPartitioningHandle.SINGLE_DISTRIBUTION;
import static io.planbridge.protocol.SystemPartitioningHandle.SOURCE_DISTRIBUTION;
import static io.planbridge.protocol.connector.HivePartitioningHandle.BucketFunctionType.HIVE_COMPATIBLE;
import static io.planbridge.protocol.connector.HivePartitioningHandle.BucketFunctionType.PRESTO_NATIVE;
import static io.planbridge.spi.StandardErrorCode.INVARIANT_VIOLATION;
import static io.planbridge.spi.StandardErrorCode.UNSUPPORTED_CONSTRUCT;
import static io.planbridge.spi.type.BigintType.BIGINT;
import static io.planbridge.spi.type.VarcharType.VARCHAR;
import static io.planbridge.testing.PlanBridgeExceptionAssert.assertPlanBridgeExceptionThrownBy;
import static org.assertj.core.api.Assertions.assertThat;

public class TestPartitioningCompiler
{
    private static final VariableReferenceExpression ORDER_KEY = variable("orderkey", "bigint");
    private static final VariableReferenceExpression STATUS = variable("orderstatus", "varchar");
    private static final List<VariableReferenceExpression> LAYOUT = ImmutableList.of(ORDER_KEY, STATUS);
    private static final RowType OUTPUT_TYPE = RowType.rowType(ImmutableList.of("orderkey", "orderstatus"), ImmutableList.of(BIGINT, VARCHAR));
    private static final PhysicalPlanNode SOURCE = new ValuesPlanNode("0", OUTPUT_TYPE, ImmutableList.of());

    private final PartitioningCompiler compiler = new PartitioningCompiler(new RowExpressionConverter());

    @Test
    public void testSingle()
    {
        PartitionedOutputPlanNode output = compiler.compile("root", new PartitioningScheme(new Partitioning(SINGLE_DISTRIBUTION, ImmutableList.of()), LAYOUT), SOURCE);
        assertThat(output).isEqualTo(PartitionedOutputPlanNode.single("root", OUTPUT_TYPE, SOURCE));
        assertThat(output.isSingle()).isTrue();
    }

    @Test
    public void testHash()
    {
        PartitionedOutputPlanNode output = compile(FIXED_HASH_DISTRIBUTION, ImmutableList.of(STATUS), ImmutableList.of(0, 1, 2, 3));
        assertThat(output.numPartitions()).isEqualTo(4);
        assertThat(output.broadcast()).isFalse();
        assertThat(output.keys()).containsExactly(new FieldAccessTypedExpression(VARCHAR, "orderstatus"));
        assertThat(output.partitionFunctionSpec())
                .isEqualTo(new HashPartitionFunctionSpec(OUTPUT_TYPE, ImmutableList.of(1), ImmutableList.of()));
        assertThat(output.outputType()).isEqualTo(OUTPUT_TYPE);
    }

    @Test
    public void testHashWithConstantKey()
    {
        PartitionedOutputPlanNode output = compile(FIXED_HASH_DISTRIBUTION, ImmutableList.of(ORDER_KEY, bigintConstant(3)), ImmutableList.of(0, 1));
        assertThat(output.partitionFunctionSpec())
                .isEqualTo(new HashPartitionFunctionSpec(OUTPUT_TYPE, ImmutableList.of(0, CONSTANT_CHANNEL), ImmutableList.of(new ConstantVector(BIGINT, 3L))));
    }

    @Test
    public void testSinglePartitionCollapses()
    {
        assertThat(compile(FIXED_HASH_DISTRIBUTION, ImmutableList.of(ORDER_KEY), ImmutableList.of(0)))
                .isEqualTo(PartitionedOutputPlanNode.single("root", OUTPUT_TYPE, SOURCE));
        assertThat(compile(FIXED_ARBITRARY_DISTRIBUTION, ImmutableList.of(), ImmutableList.of(0)))
                .isEqualTo(PartitionedOutputPlanNode.single("root", OUTPUT_TYPE, SOURCE));
        assertThat(compile(hive(4, HIVE_COMPATIBLE), ImmutableList.of(ORDER_KEY), ImmutableList.of(0, 0, 0, 0)))
                .isEqualTo(PartitionedOutputPlanNode.single("root", OUTPUT_TYPE, SOURCE));
    }

    @Test
    public void testRoundRobin()
    {
        PartitionedOutputPlanNode output = compile(FIXED_ARBITRARY_DISTRIBUTION, ImmutableList.of(), ImmutableList.of(0, 1, 2));
        assertThat(output.numPartitions()).isEqualTo(3);
        assertThat(output.partitionFunctionSpec()).isEqualTo(ROUND_ROBIN);
    }

    @Test
    public void testBroadcast()
    {
        PartitionedOutputPlanNode output = compile(FIXED_BROADCAST_DISTRIBUTION, ImmutableList.of(), ImmutableList.of(0, 1, 2));
        assertThat(output.broadcast()).isTrue();
        assertThat(output.numPartitions()).isEqualTo(1);
        assertThat(output.partitionFunctionSpec()).isEqualTo(GATHER);
    }

    @Test
    public void testHiveBucketing()
    {
        PartitionedOutputPlanNode output = compile(hive(8, HIVE_COMPATIBLE), ImmutableList.of(ORDER_KEY), ImmutableList.of(0, 1, 0, 1, 2, 2, 0, 1));
        assertThat(output.numPartitions()).isEqualTo(3);
        assertThat(output.partitionFunctionSpec())
                .isEqualTo(new HivePartitionFunctionSpec(8, ImmutableList.of(0, 1, 0, 1, 2, 2, 0, 1), ImmutableList.of(0), ImmutableList.of()));
    }

    @Test
    public void testUnsupportedPartitionings()
    {
        assertPlanBridgeExceptionThrownBy(() -> compile(hive(8, PRESTO_NATIVE), ImmutableList.of(ORDER_KEY), ImmutableList.of(0, 1)))
                .hasErrorCode(UNSUPPORTED_CONSTRUCT);
        assertPlanBridgeExceptionThrownBy(() -> compile(SOURCE_DISTRIBUTION, ImmutableList.of(), ImmutableList.of(0, 1)))
                .hasErrorCode(UNSUPPORTED_CONSTRUCT)
                .hasMessage("Unsupported kind of system partitioning: SOURCE");
    }

    @Test
    public void testInvalidPartitioning()
    {
        assertPlanBridgeExceptionThrownBy(() -> compiler.compile(
                "root",
                new PartitioningScheme(new Partitioning(FIXED_HASH_DISTRIBUTION, ImmutableList.of(ORDER_KEY)), LAYOUT),
                SOURCE))
                .hasErrorCode(INVARIANT_VIOLATION);
        assertPlanBridgeExceptionThrownBy(() -> compile(FIXED_HASH_DISTRIBUTION, ImmutableList.of(variable("custkey", "bigint")), ImmutableList.of(0, 1)))
                .hasErrorCode(INVARIANT_VIOLATION)
                .hasMessageStartingWith("Column custkey not found");
    }

    private PartitionedOutputPlanNode compile(PartitioningHandle handle, List<RowExpression> arguments, List<Integer> bucketToPartition)
    {
        return compiler.compile("root", partitioningScheme(handle, arguments, LAYOUT, bucketToPartition), SOURCE);
    }

    private static PartitioningHandle hive(int bucketCount, HivePartitioningHandle.BucketFunctionType bucketFunctionType)
    {
        return new PartitioningHandle(Optional.of("hive"), new HivePartitioningHandle(bucketCount, Optional.empty(), bucketFunctionType, Optional.empty()));
    }
}
