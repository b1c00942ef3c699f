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

public interface PlanVisitor<R, C>
{
    R visitAggregation(AggregationNode node, C context);

    R visitAssignUniqueId(AssignUniqueId node, C context);

    R visitDistinctLimit(DistinctLimitNode node, C context);

    R visitEnforceSingleRow(EnforceSingleRowNode node, C context);

    R visitExchange(ExchangeNode node, C context);

    R visitFilter(FilterNode node, C context);

    R visitGroupId(GroupIdNode node, C context);

    R visitJoin(JoinNode node, C context);

    R visitLimit(LimitNode node, C context);

    R visitMarkDistinct(MarkDistinctNode node, C context);

    R visitMergeJoin(MergeJoinNode node, C context);

    R visitOutput(OutputNode node, C context);

    R visitProject(ProjectNode node, C context);

    R visitRemoteSource(RemoteSourceNode node, C context);

    R visitRowNumber(RowNumberNode node, C context);

    R visitSemiJoin(SemiJoinNode node, C context);

    R visitSort(SortNode node, C context);

    R visitTableScan(TableScanNode node, C context);

    R visitTableWriter(TableWriterNode node, C context);

    R visitTopN(TopNNode node, C context);

    R visitUnnest(UnnestNode node, C context);

    R visitValues(ValuesNode node, C context);

    R visitWindow(WindowNode node, C context);
}
