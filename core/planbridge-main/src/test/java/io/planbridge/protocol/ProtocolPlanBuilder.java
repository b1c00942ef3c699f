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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import io.planbridge.protocol.connector.ColumnHandle;
import io.planbridge.protocol.connector.TableHandle;
import io.planbridge.protocol.connector.TpchColumnHandle;
import io.planbridge.protocol.connector.TpchTableHandle;
import io.planbridge.protocol.connector.TpchTableLayoutHandle;
import io.planbridge.protocol.expression.BuiltInFunctionHandle;
import io.planbridge.protocol.expression.CallExpression;
import io.planbridge.protocol.expression.ConstantExpression;
import io.planbridge.protocol.expression.RowExpression;
import io.planbridge.protocol.expression.Signature;
import io.planbridge.protocol.expression.VariableReferenceExpression;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.google.common.collect.ImmutableList.toImmutableList;
import static io.planbridge.expression.TestingBlockEncoder.bigintBlock;
import static io.planbridge.expression.TestingBlockEncoder.booleanBlock;
import static io.planbridge.protocol.SystemPartitioningHandle.FIXED_ARBITRARY_DISTRIBUTION;
import static io.planbridge.protocol.SystemPartitioningHandle.FIXED_HASH_DISTRIBUTION;
import static io.planbridge.protocol.SystemPartitioningHandle.SINGLE_DISTRIBUTION;

/**
 * Builds wire plans for tests. Node ids are assigned in creation order.
 */
public class ProtocolPlanBuilder
{
    private int nextId;

    public String nextId()
    {
        return String.valueOf(nextId++);
    }

    public static VariableReferenceExpression variable(String name, String type)
    {
        return new VariableReferenceExpression(name, type);
    }

    public static ConstantExpression bigintConstant(long value)
    {
        return new ConstantExpression(bigintBlock(value), "bigint");
    }

    public static ConstantExpression booleanConstant(boolean value)
    {
        return new ConstantExpression(booleanBlock(value), "boolean");
    }

    public static CallExpression call(String functionName, String returnType, RowExpression... arguments)
    {
        List<RowExpression> argumentList = ImmutableList.copyOf(arguments);
        Signature signature = new Signature(
                functionName,
                Signature.FunctionKind.SCALAR,
                returnType,
                argumentList.stream().map(ProtocolPlanBuilder::typeOf).collect(toImmutableList()));
        return new CallExpression(functionName, new BuiltInFunctionHandle(signature), returnType, argumentList);
    }

    public static CallExpression greaterThan(RowExpression left, RowExpression right)
    {
        return call("presto.default.$operator$greater_than", "boolean", left, right);
    }

    public static CallExpression not(RowExpression argument)
    {
        return call("presto.default.not", "boolean", argument);
    }

    public static OrderingScheme ascending(VariableReferenceExpression... variables)
    {
        return new OrderingScheme(Arrays.stream(variables)
                .map(variable -> new OrderingScheme.Ordering(variable, SortOrder.ASC_NULLS_LAST))
                .collect(toImmutableList()));
    }

    public ValuesNode values(VariableReferenceExpression... columns)
    {
        return new ValuesNode(nextId(), ImmutableList.copyOf(columns), ImmutableList.of());
    }

    public ValuesNode values(List<VariableReferenceExpression> columns, List<List<RowExpression>> rows)
    {
        return new ValuesNode(nextId(), columns, rows);
    }

    /**
     * Scans a TPC-H table, reading each variable from the column of the same name.
     */
    public TableScanNode tpchTableScan(String tableName, VariableReferenceExpression... columns)
    {
        Map<VariableReferenceExpression, ColumnHandle> assignments = new LinkedHashMap<>();
        for (VariableReferenceExpression column : columns) {
            assignments.put(column, new TpchColumnHandle(column.name(), column.type()));
        }
        TpchTableHandle table = new TpchTableHandle(tableName, 0.01);
        return new TableScanNode(
                nextId(),
                new TableHandle("tpch", table, Optional.of(new TpchTableLayoutHandle(table))),
                ImmutableList.copyOf(columns),
                assignments);
    }

    public ProjectNode project(PlanNode source, Map<VariableReferenceExpression, RowExpression> assignments)
    {
        return new ProjectNode(nextId(), source, new Assignments(assignments));
    }

    public ProjectNode identityProject(PlanNode source, VariableReferenceExpression... outputs)
    {
        ImmutableMap.Builder<VariableReferenceExpression, RowExpression> assignments = ImmutableMap.builder();
        for (VariableReferenceExpression output : outputs) {
            assignments.put(output, output);
        }
        return project(source, assignments.buildOrThrow());
    }

    public FilterNode filter(PlanNode source, RowExpression predicate)
    {
        return new FilterNode(nextId(), source, predicate);
    }

    public LimitNode limit(PlanNode source, long count, LimitNode.Step step)
    {
        return new LimitNode(nextId(), source, count, step);
    }

    public RowNumberNode rowNumber(PlanNode source, VariableReferenceExpression rowNumberVariable)
    {
        return new RowNumberNode(nextId(), source, ImmutableList.of(), rowNumberVariable, Optional.empty(), Optional.empty());
    }

    public SemiJoinNode semiJoin(PlanNode source, PlanNode filteringSource, VariableReferenceExpression sourceKey, VariableReferenceExpression filteringSourceKey, VariableReferenceExpression output)
    {
        return new SemiJoinNode(nextId(), source, filteringSource, sourceKey, filteringSourceKey, output);
    }

    public JoinNode join(JoinType type, PlanNode left, PlanNode right, List<EquiJoinClause> criteria, List<VariableReferenceExpression> outputs, Optional<RowExpression> filter)
    {
        return new JoinNode(nextId(), type, left, right, criteria, outputs, filter);
    }

    public ExchangeNode localRoundRobinExchange(PlanNode source)
    {
        return localExchange(ExchangeNode.Type.REPARTITION, FIXED_ARBITRARY_DISTRIBUTION, ImmutableList.of(), source);
    }

    public ExchangeNode localGatherExchange(PlanNode source)
    {
        return localExchange(ExchangeNode.Type.GATHER, SINGLE_DISTRIBUTION, ImmutableList.of(), source);
    }

    public ExchangeNode localHashExchange(PlanNode source, VariableReferenceExpression... keys)
    {
        return localExchange(ExchangeNode.Type.REPARTITION, FIXED_HASH_DISTRIBUTION, ImmutableList.copyOf(keys), source);
    }

    private ExchangeNode localExchange(ExchangeNode.Type type, PartitioningHandle handle, List<RowExpression> arguments, PlanNode source)
    {
        List<VariableReferenceExpression> layout = source.getOutputVariables();
        return new ExchangeNode(
                nextId(),
                type,
                ExchangeNode.Scope.LOCAL,
                new PartitioningScheme(new Partitioning(handle, arguments), layout),
                ImmutableList.of(source),
                ImmutableList.of(layout),
                false,
                Optional.empty());
    }

    public RemoteSourceNode remoteSource(String sourceFragmentId, VariableReferenceExpression... outputs)
    {
        return new RemoteSourceNode(nextId(), ImmutableList.of(sourceFragmentId), ImmutableList.copyOf(outputs), false, Optional.empty(), ExchangeNode.Type.REPARTITION);
    }

    public RemoteSourceNode mergingRemoteSource(String sourceFragmentId, OrderingScheme orderingScheme, VariableReferenceExpression... outputs)
    {
        return new RemoteSourceNode(nextId(), ImmutableList.of(sourceFragmentId), ImmutableList.copyOf(outputs), true, Optional.of(orderingScheme), ExchangeNode.Type.GATHER);
    }

    public OutputNode output(PlanNode source, VariableReferenceExpression... outputs)
    {
        List<VariableReferenceExpression> outputList = ImmutableList.copyOf(outputs);
        return new OutputNode(
                nextId(),
                source,
                outputList.stream().map(VariableReferenceExpression::name).collect(toImmutableList()),
                outputList);
    }

    public static PlanFragment fragment(PlanNode root, PartitioningScheme partitioningScheme)
    {
        return new PlanFragment("1", root, partitioningScheme, StageExecutionDescriptor.ungroupedExecution());
    }

    public static PartitioningScheme partitioningScheme(PartitioningHandle handle, List<RowExpression> arguments, List<VariableReferenceExpression> outputLayout, List<Integer> bucketToPartition)
    {
        return new PartitioningScheme(
                new Partitioning(handle, arguments),
                outputLayout,
                Optional.empty(),
                false,
                Optional.of(bucketToPartition));
    }

    private static String typeOf(RowExpression expression)
    {
        if (expression instanceof VariableReferenceExpression variable) {
            return variable.type();
        }
        if (expression instanceof ConstantExpression constant) {
            return constant.type();
        }
        if (expression instanceof CallExpression call) {
            return call.type();
        }
        throw new IllegalArgumentException("Unsupported argument: " + expression);
    }
}
