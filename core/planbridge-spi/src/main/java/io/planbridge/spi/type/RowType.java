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
package io.planbridge.spi.type;

import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Optional;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.collect.ImmutableList.toImmutableList;
import static java.util.Objects.requireNonNull;

public final class RowType
        extends Type
{
    private final List<Field> fields;

    private RowType(List<Field> fields)
    {
        super(TypeKind.ROW);
        this.fields = ImmutableList.copyOf(requireNonNull(fields, "fields is null"));
    }

    public static RowType from(List<Field> fields)
    {
        return new RowType(fields);
    }

    public static RowType rowType(List<String> names, List<Type> types)
    {
        checkArgument(names.size() == types.size(), "names and types size mismatch: %s vs %s", names.size(), types.size());
        ImmutableList.Builder<Field> fields = ImmutableList.builderWithExpectedSize(names.size());
        for (int i = 0; i < names.size(); i++) {
            fields.add(new Field(Optional.of(names.get(i)), types.get(i)));
        }
        return new RowType(fields.build());
    }

    public static RowType anonymous(List<Type> types)
    {
        return new RowType(types.stream()
                .map(type -> new Field(Optional.empty(), type))
                .collect(toImmutableList()));
    }

    public List<Field> getFields()
    {
        return fields;
    }

    public int size()
    {
        return fields.size();
    }

    public String getFieldName(int index)
    {
        return fields.get(index).name().orElseThrow(() -> new IllegalArgumentException("Field " + index + " has no name"));
    }

    public Type getFieldType(int index)
    {
        return fields.get(index).type();
    }

    public List<String> getFieldNames()
    {
        return fields.stream()
                .map(field -> field.name().orElse(""))
                .collect(toImmutableList());
    }

    @Override
    public List<Type> getTypeParameters()
    {
        return fields.stream()
                .map(Field::type)
                .collect(toImmutableList());
    }

    /**
     * Returns the position of the first field with the given name, or -1 when
     * there is no such field.
     */
    public int indexOf(String name)
    {
        for (int i = 0; i < fields.size(); i++) {
            if (fields.get(i).name().filter(name::equals).isPresent()) {
                return i;
            }
        }
        return -1;
    }

    @Override
    public String getDisplayName()
    {
        StringBuilder builder = new StringBuilder("row(");
        for (int i = 0; i < fields.size(); i++) {
            if (i > 0) {
                builder.append(",");
            }
            Field field = fields.get(i);
            field.name().ifPresent(name -> builder.append(name).append(' '));
            builder.append(field.type().getDisplayName());
        }
        return builder.append(")").toString();
    }

    public record Field(Optional<String> name, Type type)
    {
        public Field
        {
            requireNonNull(name, "name is null");
            requireNonNull(type, "type is null");
        }
    }
}
