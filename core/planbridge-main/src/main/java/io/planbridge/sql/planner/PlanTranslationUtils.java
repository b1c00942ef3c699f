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
import io.planbridge.expression.ExpressionConverter;
import io.planbridge.expression.FieldAccessTypedExpression;
import io.planbridge.expression.TypedExpression;
import io.planbridge.plan.SortOrder;
import io.planbridge.protocol.OrderingScheme;
import io.planbridge.protocol.expression.RowExpression;
import io.planbridge.protocol.expression.VariableReferenceExpression;
import io.planbridge.spi.type.RowType;
import io.planbridge.spi.type.Type;

import java.util.List;

import static com.google.common.collect.ImmutableList.toImmutableList;
import static io.planbridge.spi.type.TypeSignatureParser.parseTypeSignature;
import static io.planbridge.util.Failures.checkInvariant;

final class PlanTranslationUtils
{
    private PlanTranslationUtils() {}

    static RowType toRowType(List<VariableReferenceExpression> variables)
    {
        ImmutableList.Builder<String> names = ImmutableList.builderWithExpectedSize(variables.size());
        ImmutableList.Builder<Type> types = ImmutableList.builderWithExpectedSize(variables.size());
        for (VariableReferenceExpression variable : variables) {
            names.add(variable.name());
            types.add(parseTypeSignature(variable.type()));
        }
        return RowType.rowType(names.build(), types.build());
    }

    static FieldAccessTypedExpression toFieldAccess(ExpressionConverter converter, RowExpression expression)
    {
        TypedExpression typed = converter.toTypedExpression(expression);
        checkInvariant(typed instanceof FieldAccessTypedExpression, "Unexpected expression: %s. Expected variable.", expression);
        return (FieldAccessTypedExpression) typed;
    }

    static List<FieldAccessTypedExpression> toFieldAccesses(ExpressionConverter converter, List<? extends RowExpression> expressions)
    {
        return expressions.stream()
                .map(expression -> toFieldAccess(converter, expression))
                .collect(toImmutableList());
    }

    static List<SortOrder> toSortOrders(OrderingScheme orderingScheme)
    {
        return orderingScheme.orderBy().stream()
                .map(ordering -> new SortOrder(ordering.sortOrder().isAscending(), ordering.sortOrder().isNullsFirst()))
                .collect(toImmutableList());
    }

    static List<FieldAccessTypedExpression> toSortingKeys(ExpressionConverter converter, OrderingScheme orderingScheme)
    {
        return toFieldAccesses(converter, orderingScheme.getOrderByVariables());
    }

    /**
     * True when {@code expression} is a reference to {@code variable} with the same type.
     */
    static boolean isReferenceTo(RowExpression expression, VariableReferenceExpression variable)
    {
        return expression instanceof VariableReferenceExpression reference &&
                reference.name().equals(variable.name()) &&
                reference.type().equals(variable.type());
    }
}
