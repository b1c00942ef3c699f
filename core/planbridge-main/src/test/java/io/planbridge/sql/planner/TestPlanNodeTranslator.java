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
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import io.planbridge.connector.CommitStrategy;
import io.planbridge.connector.InsertTableTarget;
import io.planbridge.connector.hive.HiveColumnKind;
import io.planbridge.connector.hive.HiveScanColumnHandle;
import io.planbridge.connector.tpch.TpchScanColumnHandle;
import io.planbridge.expression.CallTypedExpression;
import io.planbridge.expression.ExpressionConverter;
import io.planbridge.expression.FieldAccessTypedExpression;
import io.planbridge.expression.RowExpressionConverter;
import io.planbridge.plan.AggregationPlanNode;
import io.planbridge.plan.AssignUniqueIdPlanNode;
import io.planbridge.plan.EnforceSingleRowPlanNode;
import io.planbridge.plan.ExchangePlanNode;
import io.planbridge.plan.FilterPlanNode;
import io.planbridge.plan.GroupIdPlanNode;
import io.planbridge.plan.HashJoinPlanNode;
import io.planbridge.plan.HashPartitionFunctionSpec;
import io.planbridge.plan.JoinType;
import io.planbridge.plan.LimitPlanNode;
import io.planbridge.plan.LocalMergePlanNode;
import io.planbridge.plan.LocalPartitionPlanNode;
import io.planbridge.plan.MergeJoinPlanNode;
import io.planbridge.plan.NestedLoopJoinPlanNode;
import io.planbridge.plan.OrderByPlanNode;
import io.planbridge.plan.PartitionedOutputPlanNode;
import io.planbridge.plan.PhysicalPlanNode;
import io.planbridge.plan.ProjectPlanNode;
import io.planbridge.plan.SortOrder;
import io.planbridge.plan.TableScanPlanNode;
import io.planbridge.plan.TableWritePlanNode;
import io.planbridge.plan.TopNPlanNode;
import io.planbridge.plan.UnnestPlanNode;
import io.planbridge.plan.ValuesPlanNode;
import io.planbridge.plan.WindowPlanNode;
import io.planbridge.protocol.AggregationNode;
import io.planbridge.protocol.AssignUniqueId;
import io.planbridge.protocol.DistinctLimitNode;
import io.planbridge.protocol.EnforceSingleRowNode;
import io.planbridge.protocol.EquiJoinClause;
import io.planbridge.protocol.ExchangeNode;
import io.planbridge.protocol.GroupIdNode;
import io.planbridge.protocol.LimitNode;
import io.planbridge.protocol.MarkDistinctNode;
import io.planbridge.protocol.MergeJoinNode;
import io.planbridge.protocol.OutputNode;
import io.planbridge.protocol.OrderingScheme;
import io.planbridge.protocol.Partitioning;
import io.planbridge.protocol.PartitioningScheme;
import io.planbridge.protocol.PlanNode;
import io.planbridge.protocol.ProtocolPlanBuilder;
import io.planbridge.protocol.RemoteSourceNode;
import io.planbridge.protocol.SortNode;
import io.planbridge.protocol.TableScanNode;
import io.planbridge.protocol.TableWriterNode;
import io.planbridge.protocol.TaskId;
import io.planbridge.protocol.TopNNode;
import io.planbridge.protocol.UnnestNode;
import io.planbridge.protocol.ValuesNode;
import io.planbridge.protocol.WindowNode;
import io.planbridge.protocol.connector.ColumnHandle;
import io.planbridge.protocol.connector.HiveColumnHandle;
import io.planbridge.protocol.connector.HiveInsertTableHandle;
import io.planbridge.protocol.connector.HiveTableHandle;
import io.planbridge.protocol.connector.HiveTableLayoutHandle;
import io.planbridge.protocol.connector.InsertHandle;
import io.planbridge.protocol.connector.InsertTableHandle;
import io.planbridge.protocol.connector.LocationHandle;
import io.planbridge.protocol.connector.TableHandle;
import io.planbridge.protocol.connector.TableWriteInfo;
import io.planbridge.protocol.expression.CallExpression;
import io.planbridge.protocol.expression.RowExpression;
import io.planbridge.protocol.expression.VariableReferenceExpression;
import io.planbridge.protocol.predicate.TupleDomain;
import io.planbridge.spi.type.ArrayType;
import io.planbridge.spi.type.RowType;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static io.planbridge.expression.ConstantTypedExpression.constant;
import static io.planbridge.plan.RoundRobinPartitionFunctionSpec.ROUND_ROBIN;
import static io.planbridge.protocol.ProtocolPlanBuilder.ascending;
import static io.planbridge.protocol.ProtocolPlanBuilder.bigintConstant;
import static io.planbridge.protocol.ProtocolPlanBuilder.booleanConstant;
import static io.planbridge.protocol.ProtocolPlanBuilder.call;
import static io.planbridge.protocol.ProtocolPlanBuilder.greaterThan;
import static io.planbridge.protocol.ProtocolPlanBuilder.variable;
import static io.planbridge.protocol.SystemPartitioningHandle.SINGLE_DISTRIBUTION;
import static io.planbridge.spi.StandardErrorCode.INVARIANT_VIOLATION;
import static io.planbridge.spi.StandardErrorCode.UNSUPPORTED_CONSTRUCT;
import static io.planbridge.spi.type.BigintType.BIGINT;
import static io.planbridge.spi.type.BooleanType.BOOLEAN;
import static io.planbridge.spi.type.VarcharType.VARCHAR;
import static io.planbridge.sql.planner.PlanTranslationUtils.toRowType;
import static io.planbridge.testing.PlanBridgeExceptionAssert.assertPlanBridgeExceptionThrownBy;
import static org.assertj.core.api.Assertions.assertThat;

public class TestPlanNodeTranslator
{
    private static final VariableReferenceExpression ORDER_KEY = variable("orderkey", "bigint");
    private static final VariableReferenceExpression STATUS = variable("orderstatus", "varchar");
    private static final VariableReferenceExpression CUST_KEY = variable("custkey", "bigint");
    private static final FieldAccessTypedExpression ORDER_KEY_FIELD = new FieldAccessTypedExpression(BIGINT, "orderkey");
    private static final FieldAccessTypedExpression STATUS_FIELD = new FieldAccessTypedExpression(VARCHAR, "orderstatus");
    private static final TaskId TASK_ID = TaskId.valueOf("20231017_101010_00001_abcde.1.0.2.0");

    private final ExpressionConverter converter = new RowExpressionConverter();
    private final PlanNodeTranslator translator = translator(Optional.empty());
    private final ProtocolPlanBuilder builder = new ProtocolPlanBuilder();

    @Test
    public void testLocalGatherExchange()
    {
        ValuesNode values = builder.values(ORDER_KEY);
        ExchangeNode exchange = builder.localGatherExchange(values);
        assertThat(translator.translate(exchange)).isEqualTo(LocalPartitionPlanNode.gather(
                exchange.id(),
                ImmutableList.of(new ProjectPlanNode(
                        exchange.id() + ".0",
                        ImmutableList.of("orderkey"),
                        ImmutableList.of(ORDER_KEY_FIELD),
                        translator.translate(values)))));
    }

    @Test
    public void testLocalHashExchange()
    {
        ExchangeNode exchange = builder.localHashExchange(builder.values(ORDER_KEY, STATUS), STATUS);
        LocalPartitionPlanNode partition = (LocalPartitionPlanNode) translator.translate(exchange);
        assertThat(partition.type()).isEqualTo(LocalPartitionPlanNode.Type.REPARTITION);
        assertThat(partition.partitionFunctionSpec()).isEqualTo(new HashPartitionFunctionSpec(
                RowType.rowType(ImmutableList.of("orderkey", "orderstatus"), ImmutableList.of(BIGINT, VARCHAR)),
                ImmutableList.of(1)));
    }

    @Test
    public void testLocalRoundRobinExchange()
    {
        LocalPartitionPlanNode partition = (LocalPartitionPlanNode) translator.translate(builder.localRoundRobinExchange(builder.values(ORDER_KEY)));
        assertThat(partition.type()).isEqualTo(LocalPartitionPlanNode.Type.REPARTITION);
        assertThat(partition.partitionFunctionSpec()).isEqualTo(ROUND_ROBIN);
    }

    @Test
    public void testExchangeProjectsEachSourceOntoOutputLayout()
    {
        VariableReferenceExpression key = variable("key", "bigint");
        VariableReferenceExpression leftKey = variable("left_key", "bigint");
        VariableReferenceExpression rightKey = variable("right_key", "bigint");
        ExchangeNode exchange = new ExchangeNode(
                "union",
                ExchangeNode.Type.GATHER,
                ExchangeNode.Scope.LOCAL,
                new PartitioningScheme(new Partitioning(SINGLE_DISTRIBUTION, ImmutableList.of()), ImmutableList.of(key)),
                ImmutableList.of(builder.values(leftKey), builder.values(rightKey)),
                ImmutableList.of(ImmutableList.of(leftKey), ImmutableList.of(rightKey)),
                false,
                Optional.empty());

        LocalPartitionPlanNode partition = (LocalPartitionPlanNode) translator.translate(exchange);
        assertThat(partition.sources()).hasSize(2);
        ProjectPlanNode second = (ProjectPlanNode) partition.sources().get(1);
        assertThat(second.id()).isEqualTo("union.1");
        assertThat(second.names()).containsExactly("key");
        assertThat(second.projections()).containsExactly(new FieldAccessTypedExpression(BIGINT, "right_key"));
    }

    @Test
    public void testLocalMergeExchange()
    {
        OrderingScheme ordering = ascending(ORDER_KEY);
        ValuesNode values = builder.values(ORDER_KEY);
        ExchangeNode exchange = new ExchangeNode(
                "merge",
                ExchangeNode.Type.GATHER,
                ExchangeNode.Scope.LOCAL,
                new PartitioningScheme(new Partitioning(SINGLE_DISTRIBUTION, ImmutableList.of()), ImmutableList.of(ORDER_KEY)),
                ImmutableList.of(values),
                ImmutableList.of(ImmutableList.of(ORDER_KEY)),
                true,
                Optional.of(ordering));
        assertThat(translator.translate(exchange)).isEqualTo(new LocalMergePlanNode(
                "merge",
                ImmutableList.of(ORDER_KEY_FIELD),
                ImmutableList.of(new SortOrder(true, false)),
                ImmutableList.of(translator.translate(values))));
    }

    @Test
    public void testUnsupportedExchanges()
    {
        ValuesNode values = builder.values(ORDER_KEY);
        assertPlanBridgeExceptionThrownBy(() -> translator.translate(exchange(ExchangeNode.Type.GATHER, ExchangeNode.Scope.REMOTE_STREAMING, values)))
                .hasErrorCode(UNSUPPORTED_CONSTRUCT)
                .hasMessage("Unsupported exchange scope: REMOTE_STREAMING");
        assertPlanBridgeExceptionThrownBy(() -> translator.translate(exchange(ExchangeNode.Type.REPLICATE, ExchangeNode.Scope.LOCAL, values)))
                .hasErrorCode(UNSUPPORTED_CONSTRUCT)
                .hasMessage("Unsupported exchange type: REPLICATE");
        assertPlanBridgeExceptionThrownBy(() -> translator.translate(exchange(ExchangeNode.Type.REPARTITION, ExchangeNode.Scope.LOCAL, values)))
                .hasErrorCode(UNSUPPORTED_CONSTRUCT)
                .hasMessageStartingWith("Unsupported flavor of local exchange");
    }

    @Test
    public void testValues()
    {
        ValuesNode values = builder.values(
                ImmutableList.of(ORDER_KEY),
                ImmutableList.of(ImmutableList.of(bigintConstant(1)), ImmutableList.of(bigintConstant(2))));
        assertThat(translator.translate(values)).isEqualTo(new ValuesPlanNode(
                values.id(),
                RowType.rowType(ImmutableList.of("orderkey"), ImmutableList.of(BIGINT)),
                ImmutableList.of(ImmutableList.of(constant(BIGINT, 1L)), ImmutableList.of(constant(BIGINT, 2L)))));

        ValuesNode nonConstant = builder.values(
                ImmutableList.of(ORDER_KEY),
                ImmutableList.of(ImmutableList.<RowExpression>of(CUST_KEY)));
        assertPlanBridgeExceptionThrownBy(() -> translator.translate(nonConstant))
                .hasErrorCode(INVARIANT_VIOLATION)
                .hasMessageStartingWith("Expected constant expression in values node");
    }

    @Test
    public void testTpchTableScan()
    {
        TableScanNode scan = builder.tpchTableScan("orders", ORDER_KEY, CUST_KEY);
        TableScanPlanNode translated = (TableScanPlanNode) translator.translate(scan);
        assertThat(translated.id()).isEqualTo(scan.id());
        assertThat(translated.outputType()).isEqualTo(RowType.rowType(ImmutableList.of("orderkey", "custkey"), ImmutableList.of(BIGINT, BIGINT)));
        assertThat(translated.assignments()).containsExactly(
                Map.entry("orderkey", new TpchScanColumnHandle("orderkey")),
                Map.entry("custkey", new TpchScanColumnHandle("custkey")));
    }

    @Test
    public void testHiveTableScanAddsPartitionColumns()
    {
        HiveColumnHandle dsColumn = new HiveColumnHandle("ds", "varchar", HiveColumnHandle.ColumnType.PARTITION_KEY, ImmutableList.of());
        HiveColumnHandle orderKeyColumn = new HiveColumnHandle("orderkey", "bigint", HiveColumnHandle.ColumnType.REGULAR, ImmutableList.of());
        TableHandle table = new TableHandle(
                "hive",
                new HiveTableHandle("tpch", "orders"),
                Optional.of(new HiveTableLayoutHandle("tpch", "orders", ImmutableList.of(dsColumn), TupleDomain.all(), booleanConstant(true), true, "")));
        TableScanNode scan = new TableScanNode("scan", table, ImmutableList.of(ORDER_KEY), ImmutableMap.<VariableReferenceExpression, ColumnHandle>of(ORDER_KEY, orderKeyColumn));

        TableScanPlanNode translated = (TableScanPlanNode) translator.translate(scan);
        assertThat(translated.assignments()).containsOnlyKeys("orderkey", "ds");
        assertThat(translated.assignments().get("ds"))
                .isEqualTo(new HiveScanColumnHandle("ds", HiveColumnKind.PARTITION_KEY, VARCHAR, ImmutableList.of()));
        assertThat(translated.outputType().size()).isEqualTo(1);
    }

    @Test
    public void testStreamingAggregation()
    {
        VariableReferenceExpression total = variable("total", "bigint");
        PlanNode source = builder.values(ORDER_KEY, STATUS);
        AggregationNode aggregation = new AggregationNode(
                "agg",
                source,
                ImmutableMap.of(total, aggregation(call("presto.default.sum", "bigint", ORDER_KEY), false, Optional.empty())),
                new AggregationNode.GroupingSetDescriptor(ImmutableList.of(STATUS), 1, ImmutableSet.of()),
                ImmutableList.of(STATUS),
                AggregationNode.Step.PARTIAL,
                Optional.empty(),
                Optional.empty());

        assertThat(translator.translate(aggregation)).isEqualTo(new AggregationPlanNode(
                "agg",
                AggregationPlanNode.Step.PARTIAL,
                ImmutableList.of(STATUS_FIELD),
                ImmutableList.of(STATUS_FIELD),
                ImmutableList.of("total"),
                ImmutableList.of(new AggregationPlanNode.Aggregate(
                        new CallTypedExpression(BIGINT, "presto.default.sum", ImmutableList.of(ORDER_KEY_FIELD)),
                        Optional.empty())),
                false,
                translator.translate(source)));
    }

    @Test
    public void testAggregationWithGroupingSets()
    {
        VariableReferenceExpression total = variable("total", "bigint");
        VariableReferenceExpression mask = variable("mask", "boolean");
        AggregationNode aggregation = new AggregationNode(
                "agg",
                builder.values(ORDER_KEY, STATUS, mask),
                ImmutableMap.of(total, aggregation(call("presto.default.sum", "bigint", ORDER_KEY), false, Optional.of(mask))),
                new AggregationNode.GroupingSetDescriptor(ImmutableList.of(STATUS), 2, ImmutableSet.of(1)),
                ImmutableList.of(STATUS),
                AggregationNode.Step.FINAL,
                Optional.empty(),
                Optional.empty());

        AggregationPlanNode translated = (AggregationPlanNode) translator.translate(aggregation);
        assertThat(translated.step()).isEqualTo(AggregationPlanNode.Step.FINAL);
        assertThat(translated.preGroupedKeys()).isEmpty();
        assertThat(translated.aggregates().get(0).mask()).contains(new FieldAccessTypedExpression(BOOLEAN, "mask"));
    }

    @Test
    public void testUnsupportedAggregations()
    {
        VariableReferenceExpression count = variable("count", "bigint");
        AggregationNode distinct = new AggregationNode(
                "agg",
                builder.values(ORDER_KEY),
                ImmutableMap.of(count, aggregation(call("presto.default.count", "bigint", ORDER_KEY), true, Optional.empty())),
                new AggregationNode.GroupingSetDescriptor(ImmutableList.of(), 1, ImmutableSet.of(0)),
                ImmutableList.of(),
                AggregationNode.Step.SINGLE,
                Optional.empty(),
                Optional.empty());
        assertPlanBridgeExceptionThrownBy(() -> translator.translate(distinct))
                .hasErrorCode(UNSUPPORTED_CONSTRUCT)
                .hasMessageStartingWith("Distinct aggregation is not supported");

        AggregationNode ordered = new AggregationNode(
                "agg",
                builder.values(ORDER_KEY),
                ImmutableMap.of(count, new AggregationNode.Aggregation(
                        call("presto.default.count", "bigint", ORDER_KEY),
                        Optional.empty(),
                        Optional.of(ascending(ORDER_KEY)),
                        false,
                        Optional.empty())),
                new AggregationNode.GroupingSetDescriptor(ImmutableList.of(), 1, ImmutableSet.of(0)),
                ImmutableList.of(),
                AggregationNode.Step.SINGLE,
                Optional.empty(),
                Optional.empty());
        assertPlanBridgeExceptionThrownBy(() -> translator.translate(ordered))
                .hasErrorCode(UNSUPPORTED_CONSTRUCT);
    }

    @Test
    public void testGroupId()
    {
        VariableReferenceExpression statusOut = variable("orderstatus_gid", "varchar");
        VariableReferenceExpression groupId = variable("groupid", "bigint");
        GroupIdNode node = new GroupIdNode(
                "gid",
                builder.values(ORDER_KEY, STATUS),
                ImmutableList.of(ImmutableList.of(statusOut), ImmutableList.of()),
                ImmutableMap.of(statusOut, STATUS),
                ImmutableList.of(ORDER_KEY),
                groupId);

        GroupIdPlanNode translated = (GroupIdPlanNode) translator.translate(node);
        assertThat(translated.groupingSets()).containsExactly(ImmutableList.of(STATUS_FIELD), ImmutableList.of());
        assertThat(translated.groupingKeyInfos()).containsExactly(new GroupIdPlanNode.GroupingKeyInfo("orderstatus_gid", STATUS_FIELD));
        assertThat(translated.aggregationInputs()).containsExactly(ORDER_KEY_FIELD);
        assertThat(translated.groupIdName()).isEqualTo("groupid");
    }

    @Test
    public void testDistinctLimit()
    {
        DistinctLimitNode node = new DistinctLimitNode("distinct", builder.values(STATUS), 10, true, ImmutableList.of(STATUS), Optional.empty());
        LimitPlanNode limit = (LimitPlanNode) translator.translate(node);
        assertThat(limit.id()).isEqualTo("distinct.limit");
        assertThat(limit.offset()).isEqualTo(0);
        assertThat(limit.count()).isEqualTo(10);
        assertThat(limit.partial()).isTrue();
        AggregationPlanNode aggregation = (AggregationPlanNode) limit.source();
        assertThat(aggregation.id()).isEqualTo("distinct");
        assertThat(aggregation.step()).isEqualTo(AggregationPlanNode.Step.SINGLE);
        assertThat(aggregation.groupingKeys()).containsExactly(STATUS_FIELD);
        assertThat(aggregation.aggregates()).isEmpty();
    }

    @Test
    public void testJoins()
    {
        PlanNode left = builder.values(ORDER_KEY);
        PlanNode right = builder.values(CUST_KEY);
        List<VariableReferenceExpression> outputs = ImmutableList.of(ORDER_KEY, CUST_KEY);

        PhysicalPlanNode crossJoin = translator.translate(builder.join(io.planbridge.protocol.JoinType.INNER, left, right, ImmutableList.of(), outputs, Optional.empty()));
        assertThat(crossJoin).isInstanceOf(NestedLoopJoinPlanNode.class);
        assertThat(crossJoin.outputType()).isEqualTo(toRowType(outputs));

        PhysicalPlanNode equiJoin = translator.translate(builder.join(
                io.planbridge.protocol.JoinType.LEFT,
                left,
                right,
                ImmutableList.of(new EquiJoinClause(ORDER_KEY, CUST_KEY)),
                outputs,
                Optional.of(greaterThan(ORDER_KEY, bigintConstant(5)))));
        assertThat(equiJoin).isInstanceOf(HashJoinPlanNode.class);
        HashJoinPlanNode hashJoin = (HashJoinPlanNode) equiJoin;
        assertThat(hashJoin.joinType()).isEqualTo(JoinType.LEFT);
        assertThat(hashJoin.nullAware()).isFalse();
        assertThat(hashJoin.leftKeys()).containsExactly(ORDER_KEY_FIELD);
        assertThat(hashJoin.rightKeys()).containsExactly(new FieldAccessTypedExpression(BIGINT, "custkey"));
        assertThat(hashJoin.filter()).isPresent();

        // a filtered inner join without equi criteria is still a hash join
        PhysicalPlanNode filteredCrossJoin = translator.translate(builder.join(
                io.planbridge.protocol.JoinType.INNER,
                left,
                right,
                ImmutableList.of(),
                outputs,
                Optional.of(greaterThan(ORDER_KEY, CUST_KEY))));
        assertThat(filteredCrossJoin).isInstanceOf(HashJoinPlanNode.class);
    }

    @Test
    public void testMergeJoin()
    {
        MergeJoinNode node = new MergeJoinNode(
                "merge-join",
                io.planbridge.protocol.JoinType.INNER,
                builder.values(ORDER_KEY),
                builder.values(CUST_KEY),
                ImmutableList.of(new EquiJoinClause(ORDER_KEY, CUST_KEY)),
                ImmutableList.of(ORDER_KEY, CUST_KEY),
                Optional.empty());
        MergeJoinPlanNode translated = (MergeJoinPlanNode) translator.translate(node);
        assertThat(translated.joinType()).isEqualTo(JoinType.INNER);
        assertThat(translated.leftKeys()).containsExactly(ORDER_KEY_FIELD);
        assertThat(translated.filter()).isEmpty();
    }

    @Test
    public void testRemoteSource()
    {
        RemoteSourceNode remoteSource = builder.remoteSource("2", ORDER_KEY);
        assertThat(translator.translate(remoteSource)).isEqualTo(new ExchangePlanNode(remoteSource.id(), toRowType(ImmutableList.of(ORDER_KEY))));
    }

    @Test
    public void testOrdering()
    {
        PlanNode source = builder.values(ORDER_KEY);
        OrderingScheme descending = new OrderingScheme(ImmutableList.of(new OrderingScheme.Ordering(ORDER_KEY, io.planbridge.protocol.SortOrder.DESC_NULLS_FIRST)));

        assertThat(translator.translate(new TopNNode("topn", source, 5, descending, TopNNode.Step.PARTIAL)))
                .isEqualTo(new TopNPlanNode("topn", ImmutableList.of(ORDER_KEY_FIELD), ImmutableList.of(new SortOrder(false, true)), 5, true, translator.translate(source)));
        assertThat(translator.translate(new SortNode("sort", source, descending, false)))
                .isEqualTo(new OrderByPlanNode("sort", ImmutableList.of(ORDER_KEY_FIELD), ImmutableList.of(new SortOrder(false, true)), false, translator.translate(source)));
        assertThat(translator.translate(new LimitNode("limit", source, 3, LimitNode.Step.FINAL)))
                .isEqualTo(new LimitPlanNode("limit", 0, 3, false, translator.translate(source)));
    }

    @Test
    public void testFilter()
    {
        PlanNode source = builder.values(ORDER_KEY);
        assertThat(translator.translate(builder.filter(source, greaterThan(ORDER_KEY, bigintConstant(1)))))
                .isInstanceOf(FilterPlanNode.class);
    }

    @Test
    public void testTableWriter()
    {
        LocationHandle location = new LocationHandle("/warehouse/orders", "/staging/orders", LocationHandle.TableType.EXISTING);
        HiveColumnHandle orderKeyColumn = new HiveColumnHandle("orderkey", "bigint", HiveColumnHandle.ColumnType.REGULAR, ImmutableList.of());
        TableWriteInfo writeInfo = new TableWriteInfo(Optional.of(new InsertHandle(
                new InsertTableHandle("hive", new HiveInsertTableHandle("tpch", "orders", ImmutableList.of(orderKeyColumn), location)),
                "tpch",
                "orders")));
        TableWriterNode writer = new TableWriterNode(
                "writer",
                builder.values(ORDER_KEY),
                variable("rows", "bigint"),
                variable("fragment", "varbinary"),
                variable("commitcontext", "varbinary"),
                ImmutableList.of(ORDER_KEY),
                ImmutableList.of("orderkey"));

        TableWritePlanNode translated = (TableWritePlanNode) translator(Optional.of(writeInfo)).translate(writer);
        assertThat(translated.columns()).isEqualTo(toRowType(ImmutableList.of(ORDER_KEY)));
        assertThat(translated.columnNames()).containsExactly("orderkey");
        assertThat(translated.insertTableTarget()).isInstanceOf(InsertTableTarget.class);
        assertThat(translated.insertTableTarget().connectorId()).isEqualTo("hive");
        assertThat(translated.outputType().getFieldNames()).containsExactly("rows", "fragment", "commitcontext");
        assertThat(translated.commitStrategy()).isEqualTo(CommitStrategy.NO_COMMIT);

        assertPlanBridgeExceptionThrownBy(() -> translator.translate(writer))
                .hasErrorCode(INVARIANT_VIOLATION)
                .hasMessage("Table writer writer requires table write info");
        assertPlanBridgeExceptionThrownBy(() -> translator(Optional.of(new TableWriteInfo(Optional.empty()))).translate(writer))
                .hasErrorCode(INVARIANT_VIOLATION)
                .hasMessage("Table writer writer requires a writer target");
    }

    @Test
    public void testUnnest()
    {
        VariableReferenceExpression items = variable("items", "array(bigint)");
        VariableReferenceExpression item = variable("item", "bigint");
        VariableReferenceExpression ordinality = variable("ordinality", "bigint");
        UnnestNode node = new UnnestNode(
                "unnest",
                builder.values(ORDER_KEY, items),
                ImmutableList.of(ORDER_KEY),
                ImmutableMap.of(items, ImmutableList.of(item)),
                Optional.of(ordinality));

        UnnestPlanNode translated = (UnnestPlanNode) translator.translate(node);
        assertThat(translated.replicateVariables()).containsExactly(ORDER_KEY_FIELD);
        assertThat(translated.unnestVariables()).containsExactly(new FieldAccessTypedExpression(new ArrayType(BIGINT), "items"));
        assertThat(translated.unnestNames()).containsExactly("item");
        assertThat(translated.ordinalityName()).contains("ordinality");
        assertThat(translated.outputType()).isEqualTo(RowType.rowType(
                ImmutableList.of("orderkey", "item", "ordinality"),
                ImmutableList.of(BIGINT, BIGINT, BIGINT)));
    }

    @Test
    public void testEnforceSingleRowAndAssignUniqueId()
    {
        PlanNode source = builder.values(ORDER_KEY);
        assertThat(translator.translate(new EnforceSingleRowNode("single", source)))
                .isEqualTo(new EnforceSingleRowPlanNode("single", translator.translate(source)));

        AssignUniqueIdPlanNode uniqueId = (AssignUniqueIdPlanNode) translator.translate(new AssignUniqueId("unique", source, variable("unique", "bigint")));
        assertThat(uniqueId.idName()).isEqualTo("unique");
        assertThat(uniqueId.taskUniqueId()).isEqualTo((1 << 14) | 2);
    }

    @Test
    public void testTaskUniqueId()
    {
        assertThat(PlanNodeTranslator.taskUniqueId(TaskId.valueOf("query.0.0.0.0"))).isEqualTo(0);
        assertThat(PlanNodeTranslator.taskUniqueId(TaskId.valueOf("query.3.0.5.0"))).isEqualTo((3 << 14) | 5);
        // only the low bits of each id are kept
        assertThat(PlanNodeTranslator.taskUniqueId(TaskId.valueOf("query.1025.0.16385.0"))).isEqualTo((1 << 14) | 1);
    }

    @Test
    public void testWindow()
    {
        VariableReferenceExpression rank = variable("rank", "bigint");
        WindowNode.Frame frame = new WindowNode.Frame(
                WindowNode.Frame.WindowType.ROWS,
                WindowNode.Frame.BoundType.UNBOUNDED_PRECEDING,
                Optional.empty(),
                WindowNode.Frame.BoundType.CURRENT_ROW,
                Optional.empty());
        WindowNode node = new WindowNode(
                "window",
                builder.values(ORDER_KEY, STATUS),
                new WindowNode.Specification(ImmutableList.of(STATUS), Optional.of(ascending(ORDER_KEY))),
                ImmutableMap.of(rank, new WindowNode.Function(call("presto.default.rank", "bigint"), frame, false)),
                Optional.empty(),
                ImmutableSet.of(),
                0);

        WindowPlanNode translated = (WindowPlanNode) translator.translate(node);
        assertThat(translated.partitionKeys()).containsExactly(STATUS_FIELD);
        assertThat(translated.sortingKeys()).containsExactly(ORDER_KEY_FIELD);
        assertThat(translated.sortingOrders()).containsExactly(new SortOrder(true, false));
        assertThat(translated.windowColumnNames()).containsExactly("rank");
        assertThat(translated.windowFunctions()).containsExactly(new WindowPlanNode.Function(
                new CallTypedExpression(BIGINT, "presto.default.rank", ImmutableList.of()),
                new WindowPlanNode.Frame(
                        WindowPlanNode.WindowType.ROWS,
                        WindowPlanNode.BoundType.UNBOUNDED_PRECEDING,
                        Optional.empty(),
                        WindowPlanNode.BoundType.CURRENT_ROW,
                        Optional.empty()),
                false));
    }

    @Test
    public void testOutput()
    {
        PlanNode source = builder.values(ORDER_KEY);
        OutputNode output = builder.output(source, ORDER_KEY);
        assertThat(translator.translate(output))
                .isEqualTo(PartitionedOutputPlanNode.single(output.id(), toRowType(ImmutableList.of(ORDER_KEY)), translator.translate(source)));
    }

    @Test
    public void testUnsupportedNodes()
    {
        PlanNode source = builder.values(ORDER_KEY);
        assertPlanBridgeExceptionThrownBy(() -> translator.translate(builder.semiJoin(source, builder.values(CUST_KEY), ORDER_KEY, CUST_KEY, variable("match", "boolean"))))
                .hasErrorCode(UNSUPPORTED_CONSTRUCT)
                .hasMessageStartingWith("Unsupported plan node: SemiJoinNode");
        assertPlanBridgeExceptionThrownBy(() -> translator.translate(builder.rowNumber(source, variable("row_number", "bigint"))))
                .hasErrorCode(UNSUPPORTED_CONSTRUCT)
                .hasMessageStartingWith("Unsupported plan node: RowNumberNode");
        assertPlanBridgeExceptionThrownBy(() -> translator.translate(new MarkDistinctNode("mark", source, variable("marker", "boolean"), ImmutableList.of(ORDER_KEY), Optional.empty())))
                .hasErrorCode(UNSUPPORTED_CONSTRUCT)
                .hasMessage("Unsupported plan node: MarkDistinctNode mark");
    }

    private PlanNodeTranslator translator(Optional<TableWriteInfo> tableWriteInfo)
    {
        return new PlanNodeTranslator(
                converter,
                new TableHandleTranslator(converter),
                new PlanRewrites(converter),
                remoteSource -> new ExchangePlanNode(remoteSource.id(), toRowType(remoteSource.outputVariables())),
                tableWriteInfo,
                TASK_ID);
    }

    private static AggregationNode.Aggregation aggregation(CallExpression call, boolean distinct, Optional<VariableReferenceExpression> mask)
    {
        return new AggregationNode.Aggregation(call, Optional.empty(), Optional.empty(), distinct, mask);
    }

    private static ExchangeNode exchange(ExchangeNode.Type type, ExchangeNode.Scope scope, PlanNode source)
    {
        return new ExchangeNode(
                "exchange",
                type,
                scope,
                new PartitioningScheme(new Partitioning(SINGLE_DISTRIBUTION, ImmutableList.of()), source.getOutputVariables()),
                ImmutableList.of(source),
                ImmutableList.of(source.getOutputVariables()),
                false,
                Optional.empty());
    }
}
