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
package io.planbridge.plan;

import com.google.common.collect.ImmutableList;
import io.planbridge.expression.FieldAccessTypedExpression;
import io.planbridge.spi.type.RowType;
import io.planbridge.spi.type.Type;

import java.util.List;

import static com.google.common.collect.ImmutableList.toImmutableList;
import static io.planbridge.spi.type.BigintType.BIGINT;
import static java.util.Objects.requireNonNull;

/**
 * Replicates each input row once per grouping set. Grouping sets are expressed
 * in input fields; {@code groupingKeyInfos} names the output column produced
 * for each input grouping key. Output is the grouping keys, then the
 * aggregation inputs, then the group id.
 */
public record GroupIdPlanNode(
        String id,
        List<List<FieldAccessTypedExpression>> groupingSets,
        List<GroupingKeyInfo> groupingKeyInfos,
        List<FieldAccessTypedExpression> aggregationInputs,
        String groupIdName,
        PhysicalPlanNode source)
        implements PhysicalPlanNode
{
    public record GroupingKeyInfo(String output, FieldAccessTypedExpression input)
    {
        public GroupingKeyInfo
        {
            requireNonNull(output, "output is null");
            requireNonNull(input, "input is null");
        }
    }

    public GroupIdPlanNode
    {
        requireNonNull(id, "id is null");
        groupingSets = requireNonNull(groupingSets, "groupingSets is null").stream()
                .map(ImmutableList::copyOf)
                .collect(toImmutableList());
        groupingKeyInfos = ImmutableList.copyOf(requireNonNull(groupingKeyInfos, "groupingKeyInfos is null"));
        aggregationInputs = ImmutableList.copyOf(requireNonNull(aggregationInputs, "aggregationInputs is null"));
        requireNonNull(groupIdName, "groupIdName is null");
        requireNonNull(source, "source is null");
    }

    @Override
    public List<PhysicalPlanNode> sources()
    {
        return ImmutableList.of(source);
    }

    @Override
    public RowType outputType()
    {
        ImmutableList.Builder<String> names = ImmutableList.builder();
        ImmutableList.Builder<Type> types = ImmutableList.builder();
        for (GroupingKeyInfo info : groupingKeyInfos) {
            names.add(info.output());
            types.add(info.input().type());
        }
        for (FieldAccessTypedExpression input : aggregationInputs) {
            names.add(input.name());
            types.add(input.type());
        }
        names.add(groupIdName);
        types.add(BIGINT);
        return RowType.rowType(names.build(), types.build());
    }
}
