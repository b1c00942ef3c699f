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
import io.planbridge.protocol.expression.VariableReferenceExpression;

import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/**
 * Writes its input to the table named by the task's table write info and
 * reports the row count, the written fragments and a commit context.
 */
public record TableWriterNode(
        String id,
        PlanNode source,
        VariableReferenceExpression rowCountVariable,
        VariableReferenceExpression fragmentVariable,
        VariableReferenceExpression tableCommitContextVariable,
        List<VariableReferenceExpression> columns,
        List<String> columnNames)
        implements PlanNode
{
    public TableWriterNode
    {
        requireNonNull(id, "id is null");
        requireNonNull(source, "source is null");
        requireNonNull(rowCountVariable, "rowCountVariable is null");
        requireNonNull(fragmentVariable, "fragmentVariable is null");
        requireNonNull(tableCommitContextVariable, "tableCommitContextVariable is null");
        columns = ImmutableList.copyOf(requireNonNull(columns, "columns is null"));
        columnNames = ImmutableList.copyOf(requireNonNull(columnNames, "columnNames is null"));
        checkArgument(columns.size() == columnNames.size(), "columns and columnNames sizes don't match");
    }

    @Override
    public List<PlanNode> getSources()
    {
        return ImmutableList.of(source);
    }

    @Override
    public List<VariableReferenceExpression> getOutputVariables()
    {
        return ImmutableList.of(rowCountVariable, fragmentVariable, tableCommitContextVariable);
    }

    @Override
    public <R, C> R accept(PlanVisitor<R, C> visitor, C context)
    {
        return visitor.visitTableWriter(this, context);
    }
}
