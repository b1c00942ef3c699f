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

import io.planbridge.spi.type.RowType;

import java.util.List;

/**
 * Node of the executable plan. Nodes are immutable and own their sources.
 */
public sealed interface PhysicalPlanNode
        permits AggregationPlanNode,
        AssignUniqueIdPlanNode,
        EnforceSingleRowPlanNode,
        ExchangePlanNode,
        FilterPlanNode,
        GroupIdPlanNode,
        HashJoinPlanNode,
        LimitPlanNode,
        LocalMergePlanNode,
        LocalPartitionPlanNode,
        MergeExchangePlanNode,
        MergeJoinPlanNode,
        NestedLoopJoinPlanNode,
        OrderByPlanNode,
        PartitionAndSerializePlanNode,
        PartitionedOutputPlanNode,
        ProjectPlanNode,
        ShuffleReadPlanNode,
        ShuffleWritePlanNode,
        TableScanPlanNode,
        TableWritePlanNode,
        TopNPlanNode,
        UnnestPlanNode,
        ValuesPlanNode,
        WindowPlanNode
{
    String id();

    List<PhysicalPlanNode> sources();

    RowType outputType();
}
