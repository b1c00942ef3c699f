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
import com.google.common.collect.ImmutableSet;
import io.airlift.log.Logger;
import io.planbridge.expression.ConstantTypedExpression;
import io.planbridge.expression.ExpressionConverter;
import io.planbridge.expression.FieldAccessTypedExpression;
import io.planbridge.expression.TypedExpression;
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
import io.planbridge.protocol.RowNumberNode;
import io.planbridge.protocol.SemiJoinNode;
import io.planbridge.protocol.SystemPartitioningHandle;
import io.planbridge.protocol.expression.BuiltInFunctionHandle;
import io.planbridge.protocol.expression.CallExpression;
import io.planbridge.protocol.expression.RowExpression;
import io.planbridge.protocol.expression.Signature.FunctionKind;
import io.planbridge.protocol.expression.VariableReferenceExpression;
import io.planbridge.spi.type.RowType;
import io.planbridge.spi.type.Type;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

import static com.google.common.collect.ImmutableSet.toImmutableSet;
import static io.planbridge.expression.ConstantTypedExpression.constant;
import static io.planbridge.protocol.SystemPartitioningHandle.SystemPartitionFunction.ROUND_ROBIN;
import static io.planbridge.protocol.SystemPartitioningHandle.SystemPartitioning.FIXED;
import static io.planbridge.protocol.SystemPartitioningHandle.SystemPartitioning.SINGLE;
import static io.planbridge.spi.type.BigintType.BIGINT;
import static io.planbridge.spi.type.BooleanType.BOOLEAN;
import static io.planbridge.sql.planner.PlanTranslationUtils.isReferenceTo;
import static io.planbridge.sql.planner.PlanTranslationUtils.toFieldAccess;
import static java.util.Objects.requireNonNull;

/**
 * Plan shapes lowered to simpler executable plans than a node by node
 * translation would produce. A rewrite returns an empty result when the shape
 * does not match, and the caller lowers the nodes one by one.
 */
public class PlanRewrites
{
    private static final Logger log = Logger.get(PlanRewrites.class);

    static final String NOT_FUNCTION = "presto.default.not";
    static final String GREATER_THAN_FUNCTION = "presto.default.$operator$greater_than";

    private final ExpressionConverter expressionConverter;

    public PlanRewrites(ExpressionConverter expressionConverter)
    {
        this.expressionConverter = requireNonNull(expressionConverter, "expressionConverter is null");
    }

    /**
     * {@code OFFSET n LIMIT m} is planned as
     * <pre>
     * Project (drops the row number)
     *   LocalExchange (round robin)
     *     Limit m
     *       LocalExchange (gather)
     *         Filter (row_number &gt; n)
     *           LocalExchange
     *             RowNumber
     * </pre>
     * which is lowered to a projection over a single limit with offset {@code n}.
     */
    public Optional<ProjectPlanNode> tryRewriteOffsetLimit(ProjectNode node, Function<PlanNode, PhysicalPlanNode> lowering)
    {
        if (!isIdentityProjection(node)) {
            return Optional.empty();
        }

        Optional<ExchangeNode> exchangeBeforeProject = asLocalSingleSourceExchange(node.source());
        if (exchangeBeforeProject.isEmpty() || !isRoundRobin(exchangeBeforeProject.get())) {
            return Optional.empty();
        }
        if (!(exchangeBeforeProject.get().sources().get(0) instanceof LimitNode limit)) {
            return Optional.empty();
        }

        Optional<ExchangeNode> exchangeBeforeLimit = asLocalSingleSourceExchange(limit.source());
        if (exchangeBeforeLimit.isEmpty() || !isGather(exchangeBeforeLimit.get())) {
            return Optional.empty();
        }
        if (!(exchangeBeforeLimit.get().sources().get(0) instanceof FilterNode filter)) {
            return Optional.empty();
        }

        Optional<ExchangeNode> exchangeBeforeFilter = asLocalSingleSourceExchange(filter.source());
        if (exchangeBeforeFilter.isEmpty() || !(exchangeBeforeFilter.get().sources().get(0) instanceof RowNumberNode rowNumber)) {
            return Optional.empty();
        }

        VariableReferenceExpression rowNumberVariable = rowNumber.rowNumberVariable();
        Optional<CallExpression> greaterThan = asBuiltInCall(filter.predicate(), GREATER_THAN_FUNCTION);
        if (greaterThan.isEmpty() || greaterThan.get().arguments().size() != 2 || !isReferenceTo(greaterThan.get().arguments().get(0), rowNumberVariable)) {
            return Optional.empty();
        }

        TypedExpression offsetExpression = expressionConverter.toTypedExpression(greaterThan.get().arguments().get(1));
        if (!(offsetExpression instanceof ConstantTypedExpression offsetConstant) ||
                !offsetConstant.type().equals(BIGINT) ||
                !(offsetConstant.getValue() instanceof Long offset)) {
            return Optional.empty();
        }

        // the projection must keep every column below the row number and nothing else
        Set<VariableReferenceExpression> expectedOutputs = rowNumber.getOutputVariables().stream()
                .filter(variable -> !variable.equals(rowNumberVariable))
                .collect(toImmutableSet());
        if (!ImmutableSet.copyOf(node.getOutputVariables()).equals(expectedOutputs)) {
            return Optional.empty();
        }

        log.debug("Collapsing offset %s limit %s below node %s", offset, limit.count(), node.id());
        return Optional.of(new ProjectPlanNode(
                node.id(),
                projectionNames(node),
                projections(node),
                new LimitPlanNode(
                        limit.id(),
                        offset,
                        limit.count(),
                        limit.step() == LimitNode.Step.PARTIAL,
                        lowering.apply(rowNumber.source()))));
    }

    /**
     * A semi join produces every probe row plus a boolean match flag, and the
     * filter above it usually tests that flag. A filter on the flag becomes a
     * filtering semi join and a filter on {@code NOT(flag)} an anti join; both
     * are followed by a projection restoring the flag column as a constant.
     * Any other predicate is evaluated over a projecting semi join.
     */
    public Optional<PhysicalPlanNode> tryRewriteSemiJoin(FilterNode node, Function<PlanNode, PhysicalPlanNode> lowering)
    {
        if (!(node.source() instanceof SemiJoinNode semiJoin)) {
            return Optional.empty();
        }

        Optional<JoinType> joinType = Optional.empty();
        if (isReferenceTo(node.predicate(), semiJoin.semiJoinOutput())) {
            joinType = Optional.of(JoinType.LEFT_SEMI_FILTER);
        }
        else {
            Optional<CallExpression> not = asBuiltInCall(node.predicate(), NOT_FUNCTION);
            if (not.isPresent() && not.get().arguments().size() == 1 && isReferenceTo(not.get().arguments().get(0), semiJoin.semiJoinOutput())) {
                joinType = Optional.of(JoinType.ANTI);
            }
        }

        List<FieldAccessTypedExpression> leftKeys = ImmutableList.of(toFieldAccess(expressionConverter, semiJoin.sourceJoinVariable()));
        List<FieldAccessTypedExpression> rightKeys = ImmutableList.of(toFieldAccess(expressionConverter, semiJoin.filteringSourceJoinVariable()));

        PhysicalPlanNode left = lowering.apply(semiJoin.source());
        PhysicalPlanNode right = lowering.apply(semiJoin.filteringSource());

        RowType leftType = left.outputType();
        List<String> names = ImmutableList.<String>builder()
                .addAll(leftType.getFieldNames())
                .add(semiJoin.semiJoinOutput().name())
                .build();

        if (joinType.isEmpty()) {
            List<Type> types = ImmutableList.<Type>builder()
                    .addAll(leftType.getTypeParameters())
                    .add(BOOLEAN)
                    .build();
            return Optional.of(new FilterPlanNode(
                    node.id(),
                    expressionConverter.toTypedExpression(node.predicate()),
                    new HashJoinPlanNode(
                            semiJoin.id(),
                            JoinType.LEFT_SEMI_PROJECT,
                            false,
                            leftKeys,
                            rightKeys,
                            Optional.empty(),
                            left,
                            right,
                            RowType.rowType(names, types))));
        }

        ImmutableList.Builder<TypedExpression> projections = ImmutableList.builderWithExpectedSize(names.size());
        for (int i = 0; i < leftType.size(); i++) {
            projections.add(new FieldAccessTypedExpression(leftType.getFieldType(i), leftType.getFieldName(i)));
        }
        projections.add(constant(BOOLEAN, joinType.get() == JoinType.LEFT_SEMI_FILTER));

        log.debug("Lowering filter %s over semi join %s to a %s join", node.id(), semiJoin.id(), joinType.get());
        return Optional.of(new ProjectPlanNode(
                node.id(),
                names,
                projections.build(),
                new HashJoinPlanNode(
                        semiJoin.id(),
                        joinType.get(),
                        joinType.get() == JoinType.ANTI,
                        leftKeys,
                        rightKeys,
                        Optional.empty(),
                        left,
                        right,
                        leftType)));
    }

    List<String> projectionNames(ProjectNode node)
    {
        return node.assignments().getOutputs().stream()
                .map(VariableReferenceExpression::name)
                .collect(ImmutableList.toImmutableList());
    }

    List<TypedExpression> projections(ProjectNode node)
    {
        return node.assignments().assignments().values().stream()
                .map(expressionConverter::toTypedExpression)
                .collect(ImmutableList.toImmutableList());
    }

    private static boolean isIdentityProjection(ProjectNode node)
    {
        for (Map.Entry<VariableReferenceExpression, RowExpression> entry : node.assignments().assignments().entrySet()) {
            if (!isReferenceTo(entry.getValue(), entry.getKey())) {
                return false;
            }
        }
        return true;
    }

    private static Optional<ExchangeNode> asLocalSingleSourceExchange(PlanNode node)
    {
        if (node instanceof ExchangeNode exchange && exchange.scope() == ExchangeNode.Scope.LOCAL && exchange.sources().size() == 1) {
            return Optional.of(exchange);
        }
        return Optional.empty();
    }

    static boolean isRoundRobin(ExchangeNode exchange)
    {
        return isFixedPartitioning(exchange, ROUND_ROBIN);
    }

    static boolean isGather(ExchangeNode exchange)
    {
        return exchange.type() == ExchangeNode.Type.GATHER &&
                exchange.partitioningScheme().partitioning().handle().connectorHandle() instanceof SystemPartitioningHandle handle &&
                handle.partitioning() == SINGLE;
    }

    static boolean isHashPartitioned(ExchangeNode exchange)
    {
        return isFixedPartitioning(exchange, SystemPartitioningHandle.SystemPartitionFunction.HASH);
    }

    private static boolean isFixedPartitioning(ExchangeNode exchange, SystemPartitioningHandle.SystemPartitionFunction function)
    {
        return exchange.type() == ExchangeNode.Type.REPARTITION &&
                exchange.partitioningScheme().partitioning().handle().connectorHandle() instanceof SystemPartitioningHandle handle &&
                handle.partitioning() == FIXED &&
                handle.function() == function;
    }

    private static Optional<CallExpression> asBuiltInCall(RowExpression expression, String functionName)
    {
        if (expression instanceof CallExpression call &&
                call.functionHandle() instanceof BuiltInFunctionHandle handle &&
                handle.signature().kind() == FunctionKind.SCALAR &&
                handle.signature().name().equals(functionName)) {
            return Optional.of(call);
        }
        return Optional.empty();
    }
}
