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
import io.planbridge.expression.ExpressionConverter;
import io.planbridge.expression.FieldAccessTypedExpression;
import io.planbridge.expression.RowExpressionConverter;
import io.planbridge.plan.FilterPlanNode;
import io.planbridge.plan.HashJoinPlanNode;
import io.planbridge.plan.JoinType;
import io.planbridge.plan.LimitPlanNode;
import io.planbridge.plan.PhysicalPlanNode;
import io.planbridge.plan.ProjectPlanNode;
import io.planbridge.protocol.ExchangeNode;
import io.planbridge.protocol.FilterNode;
import io.planbridge.protocol.LimitNode;
import io.planbridge.protocol.PlanNode;
import io.planbridge.protocol.ProjectNode;
import io.planbridge.protocol.ProtocolPlanBuilder;
import io.planbridge.protocol.SemiJoinNode;
import io.planbridge.protocol.TableScanNode;
import io.planbridge.protocol.TaskId;
import io.planbridge.protocol.expression.ConstantExpression;
import io.planbridge.protocol.expression.RowExpression;
import io.planbridge.protocol.expression.SpecialFormExpression;
import io.planbridge.protocol.expression.VariableReferenceExpression;
import io.planbridge.spi.type.RowType;
import org.junit.jupiter.api.Test;

import java.util.Optional;
import java.util.function.Function;

import static io.planbridge.expression.ConstantTypedExpression.constant;
import static io.planbridge.expression.TestingBlockEncoder.integerBlock;
import static io.planbridge.protocol.ProtocolPlanBuilder.bigintConstant;
import static io.planbridge.protocol.ProtocolPlanBuilder.greaterThan;
import static io.planbridge.protocol.ProtocolPlanBuilder.not;
import static io.planbridge.protocol.ProtocolPlanBuilder.variable;
import static io.planbridge.spi.type.BigintType.BIGINT;
import static io.planbridge.spi.type.BooleanType.BOOLEAN;
import static io.planbridge.util.Failures.unsupported;
import static org.assertj.core.api.Assertions.assertThat;

public class TestPlanRewrites
{
    private static final VariableReferenceExpression ORDER_KEY = variable("orderkey", "bigint");
    private static final VariableReferenceExpression CUST_KEY = variable("custkey", "bigint");
    private static final VariableReferenceExpression ROW_NUMBER = variable("row_number", "bigint");
    private static final VariableReferenceExpression LINE_ORDER_KEY = variable("l_orderkey", "bigint");
    private static final VariableReferenceExpression MATCH = variable("expr", "boolean");

    private final ExpressionConverter converter = new RowExpressionConverter();
    private final PlanRewrites rewrites = new PlanRewrites(converter);
    private final Function<PlanNode, PhysicalPlanNode> lowering = new PlanNodeTranslator(
            converter,
            new TableHandleTranslator(converter),
            rewrites,
            remoteSource -> {
                throw unsupported("remote source in test");
            },
            Optional.empty(),
            TaskId.valueOf("query.1.0.2.0"))::translate;

    @Test
    public void testOffsetLimit()
    {
        ProtocolPlanBuilder builder = new ProtocolPlanBuilder();
        TableScanNode scan = builder.tpchTableScan("orders", ORDER_KEY);
        LimitNode limit = builder.limit(
                builder.localGatherExchange(builder.filter(
                        builder.localGatherExchange(builder.rowNumber(scan, ROW_NUMBER)),
                        greaterThan(ROW_NUMBER, bigintConstant(10)))),
                5,
                LimitNode.Step.FINAL);
        ProjectNode project = builder.identityProject(builder.localRoundRobinExchange(limit), ORDER_KEY);

        Optional<ProjectPlanNode> rewritten = rewrites.tryRewriteOffsetLimit(project, lowering);
        assertThat(rewritten).contains(new ProjectPlanNode(
                project.id(),
                ImmutableList.of("orderkey"),
                ImmutableList.of(new FieldAccessTypedExpression(BIGINT, "orderkey")),
                new LimitPlanNode(limit.id(), 10, 5, false, lowering.apply(scan))));
    }

    @Test
    public void testOffsetLimitThroughTranslator()
    {
        ProtocolPlanBuilder builder = new ProtocolPlanBuilder();
        LimitNode limit = builder.limit(
                builder.localGatherExchange(builder.filter(
                        builder.localGatherExchange(builder.rowNumber(builder.tpchTableScan("orders", ORDER_KEY), ROW_NUMBER)),
                        greaterThan(ROW_NUMBER, bigintConstant(3)))),
                7,
                LimitNode.Step.PARTIAL);
        PhysicalPlanNode translated = lowering.apply(builder.identityProject(builder.localRoundRobinExchange(limit), ORDER_KEY));

        assertThat(translated).isInstanceOf(ProjectPlanNode.class);
        PhysicalPlanNode source = ((ProjectPlanNode) translated).source();
        assertThat(source).isInstanceOf(LimitPlanNode.class);
        LimitPlanNode limitNode = (LimitPlanNode) source;
        assertThat(limitNode.offset()).isEqualTo(3);
        assertThat(limitNode.count()).isEqualTo(7);
        assertThat(limitNode.partial()).isTrue();
    }

    @Test
    public void testOffsetLimitShapeMismatch()
    {
        // gather instead of round robin above the limit
        ProtocolPlanBuilder builder = new ProtocolPlanBuilder();
        assertThat(rewrites.tryRewriteOffsetLimit(
                builder.identityProject(builder.localGatherExchange(offsetLimit(builder, greaterThan(ROW_NUMBER, bigintConstant(10)))), ORDER_KEY),
                lowering))
                .isEmpty();

        // predicate on another column
        assertThat(rewrites.tryRewriteOffsetLimit(
                builder.identityProject(builder.localRoundRobinExchange(offsetLimit(builder, greaterThan(ORDER_KEY, bigintConstant(10)))), ORDER_KEY),
                lowering))
                .isEmpty();

        // offset of a type other than bigint
        RowExpression integerOffset = greaterThan(ROW_NUMBER, new ConstantExpression(integerBlock(10), "integer"));
        assertThat(rewrites.tryRewriteOffsetLimit(
                builder.identityProject(builder.localRoundRobinExchange(offsetLimit(builder, integerOffset)), ORDER_KEY),
                lowering))
                .isEmpty();

        // row number is still needed above the limit
        assertThat(rewrites.tryRewriteOffsetLimit(
                builder.identityProject(builder.localRoundRobinExchange(offsetLimit(builder, greaterThan(ROW_NUMBER, bigintConstant(10)))), ORDER_KEY, ROW_NUMBER),
                lowering))
                .isEmpty();

        // not an identity projection
        assertThat(rewrites.tryRewriteOffsetLimit(
                builder.project(
                        builder.localRoundRobinExchange(offsetLimit(builder, greaterThan(ROW_NUMBER, bigintConstant(10)))),
                        ImmutableMap.of(variable("bigger", "boolean"), greaterThan(ORDER_KEY, bigintConstant(1)))),
                lowering))
                .isEmpty();

        // projection also drops a column produced below the row number
        LimitNode twoColumnLimit = builder.limit(
                builder.localGatherExchange(builder.filter(
                        builder.localGatherExchange(builder.rowNumber(builder.tpchTableScan("orders", ORDER_KEY, CUST_KEY), ROW_NUMBER)),
                        greaterThan(ROW_NUMBER, bigintConstant(10)))),
                5,
                LimitNode.Step.FINAL);
        assertThat(rewrites.tryRewriteOffsetLimit(builder.identityProject(builder.localRoundRobinExchange(twoColumnLimit), ORDER_KEY), lowering))
                .isEmpty();

        // hash repartitioning between the limit and the filter
        LimitNode repartitionedLimit = builder.limit(
                builder.localHashExchange(
                        builder.filter(
                                builder.localGatherExchange(builder.rowNumber(builder.tpchTableScan("orders", ORDER_KEY), ROW_NUMBER)),
                                greaterThan(ROW_NUMBER, bigintConstant(10))),
                        ORDER_KEY),
                5,
                LimitNode.Step.FINAL);
        assertThat(rewrites.tryRewriteOffsetLimit(builder.identityProject(builder.localRoundRobinExchange(repartitionedLimit), ORDER_KEY), lowering))
                .isEmpty();

        // no row number below the filter
        LimitNode limit = builder.limit(
                builder.localGatherExchange(builder.filter(
                        builder.localGatherExchange(builder.tpchTableScan("orders", ORDER_KEY, ROW_NUMBER)),
                        greaterThan(ROW_NUMBER, bigintConstant(10)))),
                5,
                LimitNode.Step.FINAL);
        assertThat(rewrites.tryRewriteOffsetLimit(builder.identityProject(builder.localRoundRobinExchange(limit), ORDER_KEY), lowering))
                .isEmpty();
    }

    @Test
    public void testSemiJoinFilter()
    {
        ProtocolPlanBuilder builder = new ProtocolPlanBuilder();
        TableScanNode orders = builder.tpchTableScan("orders", ORDER_KEY);
        TableScanNode lineitem = builder.tpchTableScan("lineitem", LINE_ORDER_KEY);
        SemiJoinNode semiJoin = builder.semiJoin(orders, lineitem, ORDER_KEY, LINE_ORDER_KEY, MATCH);
        FilterNode filter = builder.filter(semiJoin, MATCH);

        PhysicalPlanNode left = lowering.apply(orders);
        assertThat(rewrites.tryRewriteSemiJoin(filter, lowering)).contains(new ProjectPlanNode(
                filter.id(),
                ImmutableList.of("orderkey", "expr"),
                ImmutableList.of(new FieldAccessTypedExpression(BIGINT, "orderkey"), constant(BOOLEAN, true)),
                new HashJoinPlanNode(
                        semiJoin.id(),
                        JoinType.LEFT_SEMI_FILTER,
                        false,
                        ImmutableList.of(new FieldAccessTypedExpression(BIGINT, "orderkey")),
                        ImmutableList.of(new FieldAccessTypedExpression(BIGINT, "l_orderkey")),
                        Optional.empty(),
                        left,
                        lowering.apply(lineitem),
                        left.outputType())));
    }

    @Test
    public void testAntiJoinFilter()
    {
        ProtocolPlanBuilder builder = new ProtocolPlanBuilder();
        SemiJoinNode semiJoin = builder.semiJoin(
                builder.tpchTableScan("orders", ORDER_KEY),
                builder.tpchTableScan("lineitem", LINE_ORDER_KEY),
                ORDER_KEY,
                LINE_ORDER_KEY,
                MATCH);
        PhysicalPlanNode rewritten = rewrites.tryRewriteSemiJoin(builder.filter(semiJoin, not(MATCH)), lowering).orElseThrow();

        assertThat(rewritten).isInstanceOf(ProjectPlanNode.class);
        ProjectPlanNode project = (ProjectPlanNode) rewritten;
        assertThat(project.projections().get(1)).isEqualTo(constant(BOOLEAN, false));
        HashJoinPlanNode join = (HashJoinPlanNode) project.source();
        assertThat(join.joinType()).isEqualTo(JoinType.ANTI);
        assertThat(join.nullAware()).isTrue();
        assertThat(join.outputType()).isEqualTo(RowType.rowType(ImmutableList.of("orderkey"), ImmutableList.of(BIGINT)));
    }

    @Test
    public void testSemiJoinWithOtherPredicate()
    {
        ProtocolPlanBuilder builder = new ProtocolPlanBuilder();
        SemiJoinNode semiJoin = builder.semiJoin(
                builder.tpchTableScan("orders", ORDER_KEY),
                builder.tpchTableScan("lineitem", LINE_ORDER_KEY),
                ORDER_KEY,
                LINE_ORDER_KEY,
                MATCH);
        RowExpression predicate = new SpecialFormExpression(
                SpecialFormExpression.Form.OR,
                "boolean",
                ImmutableList.of(MATCH, greaterThan(ORDER_KEY, bigintConstant(100))));
        PhysicalPlanNode rewritten = rewrites.tryRewriteSemiJoin(builder.filter(semiJoin, predicate), lowering).orElseThrow();

        assertThat(rewritten).isInstanceOf(FilterPlanNode.class);
        HashJoinPlanNode join = (HashJoinPlanNode) ((FilterPlanNode) rewritten).source();
        assertThat(join.joinType()).isEqualTo(JoinType.LEFT_SEMI_PROJECT);
        assertThat(join.nullAware()).isFalse();
        assertThat(join.outputType()).isEqualTo(RowType.rowType(ImmutableList.of("orderkey", "expr"), ImmutableList.of(BIGINT, BOOLEAN)));
    }

    @Test
    public void testFilterWithoutSemiJoin()
    {
        ProtocolPlanBuilder builder = new ProtocolPlanBuilder();
        FilterNode filter = builder.filter(builder.tpchTableScan("orders", ORDER_KEY), greaterThan(ORDER_KEY, bigintConstant(1)));
        assertThat(rewrites.tryRewriteSemiJoin(filter, lowering)).isEmpty();
    }

    @Test
    public void testExchangeFlavors()
    {
        ProtocolPlanBuilder builder = new ProtocolPlanBuilder();
        ExchangeNode roundRobin = builder.localRoundRobinExchange(builder.values(ORDER_KEY));
        ExchangeNode hash = builder.localHashExchange(builder.values(ORDER_KEY), ORDER_KEY);
        ExchangeNode gather = builder.localGatherExchange(builder.values(ORDER_KEY));

        assertThat(PlanRewrites.isRoundRobin(roundRobin)).isTrue();
        assertThat(PlanRewrites.isHashPartitioned(roundRobin)).isFalse();
        assertThat(PlanRewrites.isHashPartitioned(hash)).isTrue();
        assertThat(PlanRewrites.isRoundRobin(gather)).isFalse();
        assertThat(PlanRewrites.isHashPartitioned(gather)).isFalse();
        assertThat(PlanRewrites.isGather(gather)).isTrue();
        assertThat(PlanRewrites.isGather(roundRobin)).isFalse();
        assertThat(PlanRewrites.isGather(hash)).isFalse();
    }

    private static LimitNode offsetLimit(ProtocolPlanBuilder builder, RowExpression predicate)
    {
        return builder.limit(
                builder.localGatherExchange(builder.filter(
                        builder.localGatherExchange(builder.rowNumber(builder.tpchTableScan("orders", ORDER_KEY), ROW_NUMBER)),
                        predicate)),
                5,
                LimitNode.Step.FINAL);
    }
}
