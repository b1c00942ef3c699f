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

import com.google.common.collect.ImmutableSet;
import io.airlift.log.Logger;
import io.planbridge.expression.ExpressionConverter;
import io.planbridge.plan.ExecutionStrategy;
import io.planbridge.plan.PhysicalPlanFragment;
import io.planbridge.plan.PhysicalPlanNode;
import io.planbridge.protocol.OutputNode;
import io.planbridge.protocol.PlanFragment;
import io.planbridge.protocol.RemoteSourceNode;
import io.planbridge.protocol.StageExecutionDescriptor;
import io.planbridge.protocol.StageExecutionStrategy;
import io.planbridge.protocol.TaskId;
import io.planbridge.protocol.connector.TableWriteInfo;

import java.util.Optional;
import java.util.Set;

import static io.planbridge.util.Failures.checkInvariant;
import static io.planbridge.util.Failures.unsupported;
import static java.util.Objects.requireNonNull;

/**
 * Translates a plan fragment received from the coordinator into a fragment
 * the local engine can execute. Subclasses decide how the outputs of other
 * fragments are read.
 * <p>
 * Instances hold no per-translation state and may be shared between threads.
 */
public abstract class PlanFragmentTranslator
{
    private static final Logger log = Logger.get(PlanFragmentTranslator.class);

    static final String ROOT_NODE_ID = "root";

    protected final ExpressionConverter expressionConverter;
    private final TableHandleTranslator tableHandleTranslator;
    private final PartitioningCompiler partitioningCompiler;
    private final PlanRewrites planRewrites;

    protected PlanFragmentTranslator(ExpressionConverter expressionConverter)
    {
        this.expressionConverter = requireNonNull(expressionConverter, "expressionConverter is null");
        this.tableHandleTranslator = new TableHandleTranslator(expressionConverter);
        this.partitioningCompiler = new PartitioningCompiler(expressionConverter);
        this.planRewrites = new PlanRewrites(expressionConverter);
    }

    public PhysicalPlanFragment translate(PlanFragment fragment, Optional<TableWriteInfo> tableWriteInfo, TaskId taskId)
    {
        requireNonNull(fragment, "fragment is null");
        requireNonNull(tableWriteInfo, "tableWriteInfo is null");
        requireNonNull(taskId, "taskId is null");

        StageExecutionDescriptor descriptor = fragment.stageExecutionDescriptor();
        ExecutionStrategy executionStrategy = toExecutionStrategy(descriptor.stageExecutionStrategy());
        Set<String> groupedExecutionLeafNodeIds = ImmutableSet.copyOf(descriptor.groupedExecutionScanNodes());
        if (executionStrategy == ExecutionStrategy.GROUPED) {
            checkInvariant(
                    !groupedExecutionLeafNodeIds.isEmpty(),
                    "groupedExecutionScanNodes cannot be empty if stage execution strategy is grouped execution");
        }

        PlanNodeTranslator nodeTranslator = new PlanNodeTranslator(
                expressionConverter,
                tableHandleTranslator,
                planRewrites,
                this::translateRemoteSource,
                tableWriteInfo,
                taskId);

        PhysicalPlanNode root = nodeTranslator.translate(fragment.root());
        if (!(fragment.root() instanceof OutputNode)) {
            root = partitioningCompiler.compile(ROOT_NODE_ID, fragment.partitioningScheme(), root);
        }

        log.debug("Translated fragment %s for task %s with %s execution", fragment.id(), taskId, executionStrategy);
        return new PhysicalPlanFragment(root, executionStrategy, descriptor.totalLifespans(), groupedExecutionLeafNodeIds);
    }

    protected abstract PhysicalPlanNode translateRemoteSource(RemoteSourceNode node);

    private static ExecutionStrategy toExecutionStrategy(StageExecutionStrategy strategy)
    {
        switch (strategy) {
            case UNGROUPED_EXECUTION:
                return ExecutionStrategy.UNGROUPED;
            case FIXED_LIFESPAN_SCHEDULE_GROUPED_EXECUTION:
            case DYNAMIC_LIFESPAN_SCHEDULE_GROUPED_EXECUTION:
                return ExecutionStrategy.GROUPED;
            case RECOVERABLE_GROUPED_EXECUTION:
                throw unsupported("RECOVERABLE_GROUPED_EXECUTION stage execution strategy is not supported");
        }
        throw unsupported("Unknown stage execution strategy: %s", strategy);
    }
}
