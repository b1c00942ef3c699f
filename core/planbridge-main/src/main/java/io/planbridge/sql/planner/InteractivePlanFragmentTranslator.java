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

import io.planbridge.expression.ExpressionConverter;
import io.planbridge.plan.ExchangePlanNode;
import io.planbridge.plan.MergeExchangePlanNode;
import io.planbridge.plan.PhysicalPlanNode;
import io.planbridge.protocol.OrderingScheme;
import io.planbridge.protocol.RemoteSourceNode;
import io.planbridge.spi.type.RowType;

import static io.planbridge.sql.planner.PlanTranslationUtils.toRowType;
import static io.planbridge.sql.planner.PlanTranslationUtils.toSortOrders;
import static io.planbridge.sql.planner.PlanTranslationUtils.toSortingKeys;

/**
 * Reads the outputs of upstream fragments over the network exchange, merging
 * sorted streams when the remote source declares an ordering.
 */
public class InteractivePlanFragmentTranslator
        extends PlanFragmentTranslator
{
    public InteractivePlanFragmentTranslator(ExpressionConverter expressionConverter)
    {
        super(expressionConverter);
    }

    @Override
    protected PhysicalPlanNode translateRemoteSource(RemoteSourceNode node)
    {
        RowType outputType = toRowType(node.outputVariables());
        if (node.orderingScheme().isPresent()) {
            OrderingScheme orderingScheme = node.orderingScheme().get();
            return new MergeExchangePlanNode(
                    node.id(),
                    outputType,
                    toSortingKeys(expressionConverter, orderingScheme),
                    toSortOrders(orderingScheme));
        }
        return new ExchangePlanNode(node.id(), outputType);
    }
}
