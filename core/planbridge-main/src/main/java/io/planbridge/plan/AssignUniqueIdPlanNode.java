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
import io.planbridge.spi.type.RowType;
import io.planbridge.spi.type.Type;

import java.util.List;

import static io.planbridge.spi.type.BigintType.BIGINT;
import static java.util.Objects.requireNonNull;

/**
 * Appends a BIGINT column with a value unique across all tasks of the stage.
 * The {@code taskUniqueId} occupies the high bits of every generated value.
 */
public record AssignUniqueIdPlanNode(String id, String idName, int taskUniqueId, PhysicalPlanNode source)
        implements PhysicalPlanNode
{
    public AssignUniqueIdPlanNode
    {
        requireNonNull(id, "id is null");
        requireNonNull(idName, "idName is null");
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
        RowType sourceType = source.outputType();
        return RowType.rowType(
                ImmutableList.<String>builder().addAll(sourceType.getFieldNames()).add(idName).build(),
                ImmutableList.<Type>builder().addAll(sourceType.getTypeParameters()).add(BIGINT).build());
    }
}
