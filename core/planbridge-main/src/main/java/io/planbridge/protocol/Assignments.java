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
import io.planbridge.protocol.expression.RowExpression;
import io.planbridge.protocol.expression.VariableReferenceExpression;

import java.util.List;
import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * Ordered mapping from projected output variables to the expressions computing them.
 */
public record Assignments(Map<VariableReferenceExpression, RowExpression> assignments)
{
    public Assignments
    {
        assignments = ImmutableMap.copyOf(requireNonNull(assignments, "assignments is null"));
    }

    public List<VariableReferenceExpression> getOutputs()
    {
        return ImmutableList.copyOf(assignments.keySet());
    }

    public RowExpression get(VariableReferenceExpression variable)
    {
        return assignments.get(variable);
    }

    public int size()
    {
        return assignments.size();
    }
}
