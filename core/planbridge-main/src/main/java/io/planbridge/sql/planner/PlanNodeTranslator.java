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
import io.airlift.log.Logger;
import io.planbridge.connector.CommitStrategy;
import io.planbridge.connector.ScanColumnHandle;
import io.planbridge.expression.CallTypedExpression;
import io.planbridge.expression.ConstantTypedExpression;
import io.planbridge.expression.ExpressionConverter;
import io.planbridge.expression.FieldAccessTypedExpression;
import io.planbridge.expression.TypedExpression;
import io.planbridge.plan.AggregationPlanNode;
import io.planbridge.plan.AssignUniqueIdPlanNode;
import io.planbridge.plan.EnforceSingleRowPlanNode;
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
import io.planbridge.protocol.FilterNode;
import io.planbridge.protocol.GroupIdNode;
import io.planbridge.protocol.JoinNode;
import io.planbridge.protocol.LimitNode;
import io.planbridge.protocol.MarkDistinctNode;
import io.planbridge.protocol.MergeJoinNode;
import io.planbridge.protocol.OrderingScheme;
import io.planbridge.protocol.OutputNode;
import io.planbridge.protocol.PlanNode;
import io.planbridge.protocol.PlanVisitor;
import io.planbridge.protocol.ProjectNode;
import io.planbridge.protocol.RemoteSourceNode;
import io.planbridge.protocol.RowNumberNode;
import io.planbridge.protocol.SemiJoinNode;
import io.planbridge.protocol.SortNode;
import io.planbridge.protocol.TableScanNode;
import io.planbridge.protocol.TableWriterNode;
import io.planbridge.protocol.TaskId;
import io.planbridge.protocol.TopNNode;
import io.planbridge.protocol.UnnestNode;
import io.planbridge.protocol.ValuesNode;
import io.planbridge.protocol.WindowNode;
import io.planbridge.protocol.connector.ColumnHandle;
import io.planbridge.protocol.connector.TableWriteInfo;
import io.planbridge.protocol.expression.RowExpression;
import io.planbridge.protocol.expression.VariableReferenceExpression;
import io.planbridge.spi.type.RowType;
import io.planbridge.spi.type.Type;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

import static com.google.common.collect.ImmutableList.toImmutableList;
import static io.planbridge.plan.RoundRobinPartitionFunctionSpec.ROUND_ROBIN;
import static io.planbridge.spi.type.BigintType.BIGINT;
import static io.planbridge.spi.type.TypeSignatureParser.parseTypeSignature;
import static io.planbridge.sql.planner.PartitioningCompiler.toChannel;
import static io.planbridge.sql.planner.PlanRewrites.isHashPartitioned;
import static io.planbridge.sql.planner.PlanRewrites.isRoundRobin;
import static io.planbridge.sql.planner.PlanTranslationUtils.toFieldAccess;
import static io.planbridge.sql.planner.PlanTranslationUtils.toFieldAccesses;
import static io.planbridge.sql.planner.PlanTranslationUtils.toRowType;
import static io.planbridge.sql.planner.PlanTranslationUtils.toSortOrders;
import static io.planbridge.sql.planner.PlanTranslationUtils.toSortingKeys;
import static io.planbridge.util.Failures.checkInvariant;
import static io.planbridge.util.Failures.checkSupported;
import static io.planbridge.util.Failures.invariantViolation;
import static io.planbridge.util.Failures.unsupported;
import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Lowers one wire plan tree into the physical plan. Instances are bound to a
 * single fragment: the table write info and the task id are fixed at
 * construction. Remote sources are lowered by the fragment translator that
 * owns this instance, since interactive and batch execution read their inputs
 * differently.
 */
public class PlanNodeTranslator
        implements PlanVisitor<PhysicalPlanNode, Void>
{
    private static final Logger log = Logger.get(PlanNodeTranslator.class);

    private static final int STAGE_ID_BITS = 10;
    private static final int TASK_ID_BITS = 14;

    private final ExpressionConverter expressionConverter;
    private final TableHandleTranslator tableHandleTranslator;
    private final PlanRewrites planRewrites;
    private final Function<RemoteSourceNode, PhysicalPlanNode> remoteSourceTranslator;
    private final Optional<TableWriteInfo> tableWriteInfo;
    private final TaskId taskId;

    public PlanNodeTranslator(
            ExpressionConverter expressionConverter,
            TableHandleTranslator tableHandleTranslator,
            PlanRewrites planRewrites,
            Function<RemoteSourceNode, PhysicalPlanNode> remoteSourceTranslator,
            Optional<TableWriteInfo> tableWriteInfo,
            TaskId taskId)
    {
        this.expressionConverter = requireNonNull(expressionConverter, "expressionConverter is null");
        this.tableHandleTranslator = requireNonNull(tableHandleTranslator, "tableHandleTranslator is null");
        this.planRewrites = requireNonNull(planRewrites, "planRewrites is null");
        this.remoteSourceTranslator = requireNonNull(remoteSourceTranslator, "remoteSourceTranslator is null");
        this.tableWriteInfo = requireNonNull(tableWriteInfo, "tableWriteInfo is null");
        this.taskId = requireNonNull(taskId, "taskId is null");
    }

    public PhysicalPlanNode translate(PlanNode node)
    {
        return node.accept(this, null);
    }

    @Override
    public PhysicalPlanNode visitExchange(ExchangeNode node, Void context)
    {
        checkSupported(node.scope() == ExchangeNode.Scope.LOCAL, "Unsupported exchange scope: %s", node.scope());

        List<PhysicalPlanNode> sources = node.sources().stream()
                .map(this::translate)
                .collect(toImmutableList());

        if (node.orderingScheme().isPresent()) {
            OrderingScheme orderingScheme = node.orderingScheme().get();
            return new LocalMergePlanNode(
                    node.id(),
                    toSortingKeys(expressionConverter, orderingScheme),
                    toSortOrders(orderingScheme),
                    sources);
        }

        LocalPartitionPlanNode.Type type = toLocalPartitionType(node.type());
        RowType outputType = toRowType(node.partitioningScheme().outputLayout());

        // sources may lay out their columns differently, so each one is projected onto the exchange layout
        ImmutableList.Builder<PhysicalPlanNode> projectedSources = ImmutableList.builderWithExpectedSize(sources.size());
        for (int i = 0; i < sources.size(); i++) {
            List<VariableReferenceExpression> sourceLayout = node.inputs().get(i);
            ImmutableList.Builder<TypedExpression> projections = ImmutableList.builderWithExpectedSize(outputType.size());
            for (int column = 0; column < outputType.size(); column++) {
                projections.add(new FieldAccessTypedExpression(outputType.getFieldType(column), sourceLayout.get(column).name()));
            }
            projectedSources.add(new ProjectPlanNode(
                    format("%s.%s", node.id(), i),
                    outputType.getFieldNames(),
                    projections.build(),
                    sources.get(i)));
        }

        if (isHashPartitioned(node)) {
            List<Integer> keyChannels = toFieldAccesses(expressionConverter, node.partitioningScheme().partitioning().arguments()).stream()
                    .map(key -> toChannel(key, outputType))
                    .collect(toImmutableList());
            return new LocalPartitionPlanNode(
                    node.id(),
                    type,
                    new HashPartitionFunctionSpec(outputType, keyChannels),
                    projectedSources.build());
        }
        if (isRoundRobin(node)) {
            return new LocalPartitionPlanNode(node.id(), type, ROUND_ROBIN, projectedSources.build());
        }
        if (type == LocalPartitionPlanNode.Type.GATHER) {
            return LocalPartitionPlanNode.gather(node.id(), projectedSources.build());
        }
        throw unsupported("Unsupported flavor of local exchange: %s", node.partitioningScheme().partitioning().handle());
    }

    @Override
    public PhysicalPlanNode visitFilter(FilterNode node, Void context)
    {
        Optional<PhysicalPlanNode> semiJoin = planRewrites.tryRewriteSemiJoin(node, this::translate);
        if (semiJoin.isPresent()) {
            return semiJoin.get();
        }
        return new FilterPlanNode(
                node.id(),
                expressionConverter.toTypedExpression(node.predicate()),
                translate(node.source()));
    }

    @Override
    public PhysicalPlanNode visitProject(ProjectNode node, Void context)
    {
        Optional<ProjectPlanNode> offsetLimit = planRewrites.tryRewriteOffsetLimit(node, this::translate);
        if (offsetLimit.isPresent()) {
            return offsetLimit.get();
        }
        return new ProjectPlanNode(
                node.id(),
                planRewrites.projectionNames(node),
                planRewrites.projections(node),
                translate(node.source()));
    }

    @Override
    public PhysicalPlanNode visitValues(ValuesNode node, Void context)
    {
        RowType outputType = toRowType(node.outputVariables());
        ImmutableList.Builder<List<ConstantTypedExpression>> rows = ImmutableList.builderWithExpectedSize(node.rows().size());
        for (List<RowExpression> row : node.rows()) {
            ImmutableList.Builder<ConstantTypedExpression> cells = ImmutableList.builderWithExpectedSize(row.size());
            for (RowExpression cell : row) {
                TypedExpression value = expressionConverter.toTypedExpression(cell);
                if (!(value instanceof ConstantTypedExpression constant)) {
                    throw invariantViolation("Expected constant expression in values node %s: %s", node.id(), cell);
                }
                cells.add(constant);
            }
            rows.add(cells.build());
        }
        return new ValuesPlanNode(node.id(), outputType, rows.build());
    }

    @Override
    public PhysicalPlanNode visitTableScan(TableScanNode node, Void context)
    {
        Map<String, ScanColumnHandle> assignments = new LinkedHashMap<>();
        for (Map.Entry<VariableReferenceExpression, ColumnHandle> entry : node.assignments().entrySet()) {
            assignments.put(entry.getKey().name(), tableHandleTranslator.translateColumnHandle(entry.getValue()));
        }
        TranslatedTableHandle table = tableHandleTranslator.translateTableHandle(node.table());
        table.partitionColumns().forEach(assignments::putIfAbsent);

        return new TableScanPlanNode(
                node.id(),
                toRowType(node.outputVariables()),
                table.tableHandle(),
                ImmutableMap.copyOf(assignments));
    }

    @Override
    public PhysicalPlanNode visitAggregation(AggregationNode node, Void context)
    {
        ImmutableList.Builder<String> aggregateNames = ImmutableList.builderWithExpectedSize(node.aggregations().size());
        ImmutableList.Builder<AggregationPlanNode.Aggregate> aggregates = ImmutableList.builderWithExpectedSize(node.aggregations().size());
        for (Map.Entry<VariableReferenceExpression, AggregationNode.Aggregation> entry : node.aggregations().entrySet()) {
            AggregationNode.Aggregation aggregation = entry.getValue();
            checkSupported(!aggregation.distinct(), "Distinct aggregation is not supported: %s", entry.getKey());
            checkSupported(aggregation.orderBy().isEmpty(), "Aggregation with ORDER BY is not supported: %s", entry.getKey());
            checkSupported(aggregation.filter().isEmpty(), "Aggregation with FILTER is not supported: %s", entry.getKey());

            aggregateNames.add(entry.getKey().name());
            aggregates.add(new AggregationPlanNode.Aggregate(
                    toCall(aggregation.call()),
                    aggregation.mask().map(mask -> toFieldAccess(expressionConverter, mask))));
        }

        AggregationNode.GroupingSetDescriptor groupingSets = node.groupingSets();
        boolean streamable = !node.preGroupedVariables().isEmpty() &&
                groupingSets.groupingSetCount() == 1 &&
                groupingSets.globalGroupingSets().isEmpty();

        return new AggregationPlanNode(
                node.id(),
                toAggregationStep(node.step()),
                toFieldAccesses(expressionConverter, groupingSets.groupingKeys()),
                streamable ? toFieldAccesses(expressionConverter, node.preGroupedVariables()) : ImmutableList.of(),
                aggregateNames.build(),
                aggregates.build(),
                false,
                translate(node.source()));
    }

    @Override
    public PhysicalPlanNode visitGroupId(GroupIdNode node, Void context)
    {
        // wire grouping sets name the output columns; the physical node groups by input fields
        ImmutableList.Builder<List<FieldAccessTypedExpression>> groupingSets = ImmutableList.builderWithExpectedSize(node.groupingSets().size());
        for (List<VariableReferenceExpression> groupingSet : node.groupingSets()) {
            ImmutableList.Builder<FieldAccessTypedExpression> keys = ImmutableList.builderWithExpectedSize(groupingSet.size());
            for (VariableReferenceExpression output : groupingSet) {
                VariableReferenceExpression input = node.groupingColumns().get(output);
                checkInvariant(input != null, "Grouping key %s has no input column in group id node %s", output, node.id());
                keys.add(new FieldAccessTypedExpression(parseTypeSignature(output.type()), input.name()));
            }
            groupingSets.add(keys.build());
        }

        ImmutableList.Builder<GroupIdPlanNode.GroupingKeyInfo> groupingKeyInfos = ImmutableList.builderWithExpectedSize(node.groupingColumns().size());
        node.groupingColumns().forEach((output, input) ->
                groupingKeyInfos.add(new GroupIdPlanNode.GroupingKeyInfo(output.name(), toFieldAccess(expressionConverter, input))));

        return new GroupIdPlanNode(
                node.id(),
                groupingSets.build(),
                groupingKeyInfos.build(),
                toFieldAccesses(expressionConverter, node.aggregationArguments()),
                node.groupIdVariable().name(),
                translate(node.source()));
    }

    @Override
    public PhysicalPlanNode visitDistinctLimit(DistinctLimitNode node, Void context)
    {
        // the aggregation keeps the id of the wire node so that its stats are reported against it
        return new LimitPlanNode(
                node.id() + ".limit",
                0,
                node.limit(),
                node.partial(),
                new AggregationPlanNode(
                        node.id(),
                        AggregationPlanNode.Step.SINGLE,
                        toFieldAccesses(expressionConverter, node.distinctVariables()),
                        ImmutableList.of(),
                        ImmutableList.of(),
                        ImmutableList.of(),
                        false,
                        translate(node.source())));
    }

    @Override
    public PhysicalPlanNode visitJoin(JoinNode node, Void context)
    {
        JoinType joinType = toJoinType(node.type());
        if (node.criteria().isEmpty() && joinType.isInnerJoin() && node.filter().isEmpty()) {
            return new NestedLoopJoinPlanNode(
                    node.id(),
                    translate(node.left()),
                    translate(node.right()),
                    toRowType(node.outputVariables()));
        }

        return new HashJoinPlanNode(
                node.id(),
                joinType,
                false,
                leftKeys(node.criteria()),
                rightKeys(node.criteria()),
                node.filter().map(expressionConverter::toTypedExpression),
                translate(node.left()),
                translate(node.right()),
                toRowType(node.outputVariables()));
    }

    @Override
    public PhysicalPlanNode visitMergeJoin(MergeJoinNode node, Void context)
    {
        return new MergeJoinPlanNode(
                node.id(),
                toJoinType(node.type()),
                leftKeys(node.criteria()),
                rightKeys(node.criteria()),
                node.filter().map(expressionConverter::toTypedExpression),
                translate(node.left()),
                translate(node.right()),
                toRowType(node.outputVariables()));
    }

    @Override
    public PhysicalPlanNode visitRemoteSource(RemoteSourceNode node, Void context)
    {
        return remoteSourceTranslator.apply(node);
    }

    @Override
    public PhysicalPlanNode visitTopN(TopNNode node, Void context)
    {
        return new TopNPlanNode(
                node.id(),
                toSortingKeys(expressionConverter, node.orderingScheme()),
                toSortOrders(node.orderingScheme()),
                node.count(),
                node.step() == TopNNode.Step.PARTIAL,
                translate(node.source()));
    }

    @Override
    public PhysicalPlanNode visitLimit(LimitNode node, Void context)
    {
        return new LimitPlanNode(
                node.id(),
                0,
                node.count(),
                node.step() == LimitNode.Step.PARTIAL,
                translate(node.source()));
    }

    @Override
    public PhysicalPlanNode visitSort(SortNode node, Void context)
    {
        return new OrderByPlanNode(
                node.id(),
                toSortingKeys(expressionConverter, node.orderingScheme()),
                toSortOrders(node.orderingScheme()),
                node.partial(),
                translate(node.source()));
    }

    @Override
    public PhysicalPlanNode visitTableWriter(TableWriterNode node, Void context)
    {
        TableWriteInfo writeInfo = tableWriteInfo.orElseThrow(() -> invariantViolation("Table writer %s requires table write info", node.id()));
        return new TableWritePlanNode(
                node.id(),
                toRowType(node.columns()),
                node.columnNames(),
                tableHandleTranslator.translateWriterTarget(writeInfo.writerTarget()
                        .orElseThrow(() -> invariantViolation("Table writer %s requires a writer target", node.id()))),
                toRowType(ImmutableList.of(node.rowCountVariable(), node.fragmentVariable(), node.tableCommitContextVariable())),
                CommitStrategy.NO_COMMIT,
                translate(node.source()));
    }

    @Override
    public PhysicalPlanNode visitUnnest(UnnestNode node, Void context)
    {
        ImmutableList.Builder<FieldAccessTypedExpression> unnestFields = ImmutableList.builderWithExpectedSize(node.unnestVariables().size());
        ImmutableList.Builder<VariableReferenceExpression> outputs = ImmutableList.<VariableReferenceExpression>builder()
                .addAll(node.replicateVariables());
        for (Map.Entry<VariableReferenceExpression, List<VariableReferenceExpression>> entry : node.unnestVariables().entrySet()) {
            unnestFields.add(toFieldAccess(expressionConverter, entry.getKey()));
            outputs.addAll(entry.getValue());
        }

        RowType unnestedType = toRowType(outputs.build());
        List<String> unnestNames = unnestedType.getFieldNames().subList(node.replicateVariables().size(), unnestedType.size());

        ImmutableList.Builder<String> outputNames = ImmutableList.<String>builder().addAll(unnestedType.getFieldNames());
        ImmutableList.Builder<Type> outputTypes = ImmutableList.<Type>builder().addAll(unnestedType.getTypeParameters());
        node.ordinalityVariable().ifPresent(ordinality -> {
            outputNames.add(ordinality.name());
            outputTypes.add(BIGINT);
        });

        return new UnnestPlanNode(
                node.id(),
                toFieldAccesses(expressionConverter, node.replicateVariables()),
                unnestFields.build(),
                unnestNames,
                node.ordinalityVariable().map(VariableReferenceExpression::name),
                RowType.rowType(outputNames.build(), outputTypes.build()),
                translate(node.source()));
    }

    @Override
    public PhysicalPlanNode visitEnforceSingleRow(EnforceSingleRowNode node, Void context)
    {
        return new EnforceSingleRowPlanNode(node.id(), translate(node.source()));
    }

    @Override
    public PhysicalPlanNode visitAssignUniqueId(AssignUniqueId node, Void context)
    {
        return new AssignUniqueIdPlanNode(
                node.id(),
                node.idVariable().name(),
                taskUniqueId(taskId),
                translate(node.source()));
    }

    @Override
    public PhysicalPlanNode visitWindow(WindowNode node, Void context)
    {
        WindowNode.Specification specification = node.specification();
        List<FieldAccessTypedExpression> sortingKeys = specification.orderingScheme()
                .map(orderingScheme -> toSortingKeys(expressionConverter, orderingScheme))
                .orElse(ImmutableList.of());
        List<SortOrder> sortingOrders = specification.orderingScheme()
                .map(PlanTranslationUtils::toSortOrders)
                .orElse(ImmutableList.of());

        ImmutableList.Builder<String> windowColumnNames = ImmutableList.builderWithExpectedSize(node.windowFunctions().size());
        ImmutableList.Builder<WindowPlanNode.Function> windowFunctions = ImmutableList.builderWithExpectedSize(node.windowFunctions().size());
        for (Map.Entry<VariableReferenceExpression, WindowNode.Function> entry : node.windowFunctions().entrySet()) {
            windowColumnNames.add(entry.getKey().name());
            windowFunctions.add(toWindowFunction(entry.getValue()));
        }

        return new WindowPlanNode(
                node.id(),
                toFieldAccesses(expressionConverter, specification.partitionBy()),
                sortingKeys,
                sortingOrders,
                windowColumnNames.build(),
                windowFunctions.build(),
                translate(node.source()));
    }

    @Override
    public PhysicalPlanNode visitOutput(OutputNode node, Void context)
    {
        log.debug("Lowering output node %s to a single destination output", node.id());
        return PartitionedOutputPlanNode.single(
                node.id(),
                toRowType(node.outputVariables()),
                translate(node.source()));
    }

    @Override
    public PhysicalPlanNode visitSemiJoin(SemiJoinNode node, Void context)
    {
        throw unsupported("Unsupported plan node: SemiJoinNode %s without a filter on its match column", node.id());
    }

    @Override
    public PhysicalPlanNode visitRowNumber(RowNumberNode node, Void context)
    {
        throw unsupported("Unsupported plan node: RowNumberNode %s", node.id());
    }

    @Override
    public PhysicalPlanNode visitMarkDistinct(MarkDistinctNode node, Void context)
    {
        throw unsupported("Unsupported plan node: MarkDistinctNode %s", node.id());
    }

    /**
     * Id that is unique among all tasks of a stage: the low 10 bits of the
     * stage id followed by the low 14 bits of the task id.
     */
    static int taskUniqueId(TaskId taskId)
    {
        return (taskId.stageId() & ((1 << STAGE_ID_BITS) - 1)) << TASK_ID_BITS |
                (taskId.id() & ((1 << TASK_ID_BITS) - 1));
    }

    private CallTypedExpression toCall(RowExpression expression)
    {
        TypedExpression typed = expressionConverter.toTypedExpression(expression);
        if (!(typed instanceof CallTypedExpression call)) {
            throw invariantViolation("Expected call expression: %s", expression);
        }
        return call;
    }

    private List<FieldAccessTypedExpression> leftKeys(List<EquiJoinClause> criteria)
    {
        return criteria.stream()
                .map(clause -> toFieldAccess(expressionConverter, clause.left()))
                .collect(toImmutableList());
    }

    private List<FieldAccessTypedExpression> rightKeys(List<EquiJoinClause> criteria)
    {
        return criteria.stream()
                .map(clause -> toFieldAccess(expressionConverter, clause.right()))
                .collect(toImmutableList());
    }

    private WindowPlanNode.Function toWindowFunction(WindowNode.Function function)
    {
        WindowNode.Frame frame = function.frame();
        return new WindowPlanNode.Function(
                toCall(function.functionCall()),
                new WindowPlanNode.Frame(
                        toWindowType(frame.type()),
                        toBoundType(frame.startType()),
                        frame.startValue().map(expressionConverter::toTypedExpression),
                        toBoundType(frame.endType()),
                        frame.endValue().map(expressionConverter::toTypedExpression)),
                function.ignoreNulls());
    }

    private static LocalPartitionPlanNode.Type toLocalPartitionType(ExchangeNode.Type type)
    {
        switch (type) {
            case GATHER:
                return LocalPartitionPlanNode.Type.GATHER;
            case REPARTITION:
                return LocalPartitionPlanNode.Type.REPARTITION;
            default:
                throw unsupported("Unsupported exchange type: %s", type);
        }
    }

    private static AggregationPlanNode.Step toAggregationStep(AggregationNode.Step step)
    {
        switch (step) {
            case PARTIAL:
                return AggregationPlanNode.Step.PARTIAL;
            case FINAL:
                return AggregationPlanNode.Step.FINAL;
            case INTERMEDIATE:
                return AggregationPlanNode.Step.INTERMEDIATE;
            case SINGLE:
                return AggregationPlanNode.Step.SINGLE;
        }
        throw unsupported("Unsupported aggregation step: %s", step);
    }

    private static JoinType toJoinType(io.planbridge.protocol.JoinType type)
    {
        switch (type) {
            case INNER:
                return JoinType.INNER;
            case LEFT:
                return JoinType.LEFT;
            case RIGHT:
                return JoinType.RIGHT;
            case FULL:
                return JoinType.FULL;
        }
        throw unsupported("Unsupported join type: %s", type);
    }

    private static WindowPlanNode.WindowType toWindowType(WindowNode.Frame.WindowType type)
    {
        switch (type) {
            case RANGE:
                return WindowPlanNode.WindowType.RANGE;
            case ROWS:
                return WindowPlanNode.WindowType.ROWS;
        }
        throw unsupported("Unsupported window type: %s", type);
    }

    private static WindowPlanNode.BoundType toBoundType(WindowNode.Frame.BoundType type)
    {
        switch (type) {
            case UNBOUNDED_PRECEDING:
                return WindowPlanNode.BoundType.UNBOUNDED_PRECEDING;
            case PRECEDING:
                return WindowPlanNode.BoundType.PRECEDING;
            case CURRENT_ROW:
                return WindowPlanNode.BoundType.CURRENT_ROW;
            case FOLLOWING:
                return WindowPlanNode.BoundType.FOLLOWING;
            case UNBOUNDED_FOLLOWING:
                return WindowPlanNode.BoundType.UNBOUNDED_FOLLOWING;
        }
        throw unsupported("Unsupported window bound type: %s", type);
    }
}
