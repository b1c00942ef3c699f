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
import io.airlift.log.Logger;
import io.planbridge.expression.ExpressionConverter;
import io.planbridge.plan.LocalPartitionPlanNode;
import io.planbridge.plan.PartitionAndSerializePlanNode;
import io.planbridge.plan.PartitionedOutputPlanNode;
import io.planbridge.plan.PhysicalPlanFragment;
import io.planbridge.plan.PhysicalPlanNode;
import io.planbridge.plan.ShuffleReadPlanNode;
import io.planbridge.plan.ShuffleWritePlanNode;
import io.planbridge.protocol.PlanFragment;
import io.planbridge.protocol.RemoteSourceNode;
import io.planbridge.protocol.TaskId;
import io.planbridge.protocol.connector.TableWriteInfo;

import java.util.Optional;

import static io.planbridge.sql.planner.PlanTranslationUtils.toRowType;
import static io.planbridge.util.Failures.checkSupported;
import static io.planbridge.util.Failures.unsupported;
import static java.util.Objects.requireNonNull;

/**
 * Translates fragments for batch execution, where fragments exchange data
 * through a shuffle service instead of the network exchange. Remote sources
 * become shuffle reads. When shuffle write parameters are present, the
 * partitioned output of the fragment is replaced by
 * <pre>
 * ShuffleWrite
 *   LocalPartition (gather)
 *     PartitionAndSerialize
 * </pre>
 */
public class BatchPlanFragmentTranslator
        extends PlanFragmentTranslator
{
    private static final Logger log = Logger.get(BatchPlanFragmentTranslator.class);

    static final String SHUFFLE_GATHER_NODE_ID = "shuffle-gather";
    static final String PARTITION_AND_SERIALIZE_NODE_ID = "shuffle-partition-serialize";

    private final String shuffleName;
    private final Optional<String> serializedShuffleWriteInfo;

    public BatchPlanFragmentTranslator(ExpressionConverter expressionConverter, String shuffleName, Optional<String> serializedShuffleWriteInfo)
    {
        super(expressionConverter);
        this.shuffleName = requireNonNull(shuffleName, "shuffleName is null");
        this.serializedShuffleWriteInfo = requireNonNull(serializedShuffleWriteInfo, "serializedShuffleWriteInfo is null");
    }

    @Override
    public PhysicalPlanFragment translate(PlanFragment fragment, Optional<TableWriteInfo> tableWriteInfo, TaskId taskId)
    {
        PhysicalPlanFragment planFragment = super.translate(fragment, tableWriteInfo, taskId);

        if (!(planFragment.planNode() instanceof PartitionedOutputPlanNode partitionedOutput)) {
            throw unsupported("PartitionedOutputNode is required");
        }
        checkSupported(!partitionedOutput.broadcast(), "Broadcast shuffle is not supported");
        checkSupported(!partitionedOutput.replicateNullsAndAny(), "Replicate-nulls-and-any shuffle mode is not supported");

        // without shuffle parameters the fragment does not end in a shuffle, e.g. a table writer reporting to the coordinator
        if (serializedShuffleWriteInfo.isEmpty()) {
            checkSupported(
                    partitionedOutput.numPartitions() == 1,
                    "Fragment %s without a shuffle must have a single output partition, found %s",
                    fragment.id(),
                    partitionedOutput.numPartitions());
            return planFragment;
        }

        PartitionAndSerializePlanNode partitionAndSerialize = new PartitionAndSerializePlanNode(
                PARTITION_AND_SERIALIZE_NODE_ID,
                partitionedOutput.keys(),
                partitionedOutput.numPartitions(),
                partitionedOutput.outputType(),
                partitionedOutput.partitionFunctionSpec(),
                partitionedOutput.source());

        PhysicalPlanNode shuffleWrite = new ShuffleWritePlanNode(
                ROOT_NODE_ID,
                shuffleName,
                serializedShuffleWriteInfo.get(),
                LocalPartitionPlanNode.gather(SHUFFLE_GATHER_NODE_ID, ImmutableList.of(partitionAndSerialize)));

        log.debug("Fragment %s writes %s partitions to shuffle %s", fragment.id(), partitionedOutput.numPartitions(), shuffleName);
        return new PhysicalPlanFragment(
                shuffleWrite,
                planFragment.executionStrategy(),
                planFragment.numSplitGroups(),
                planFragment.groupedExecutionLeafNodeIds());
    }

    @Override
    protected PhysicalPlanNode translateRemoteSource(RemoteSourceNode node)
    {
        return new ShuffleReadPlanNode(node.id(), toRowType(node.outputVariables()));
    }
}
