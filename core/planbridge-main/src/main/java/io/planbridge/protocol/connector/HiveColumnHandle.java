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
package io.planbridge.protocol.connector;

import com.google.common.collect.ImmutableList;
import io.planbridge.spi.Subfield;

import java.util.List;

import static java.util.Objects.requireNonNull;

public record HiveColumnHandle(String name, String typeSignature, ColumnType columnType, List<Subfield> requiredSubfields)
        implements ColumnHandle
{
    public HiveColumnHandle
    {
        requireNonNull(name, "name is null");
        requireNonNull(typeSignature, "typeSignature is null");
        requireNonNull(columnType, "columnType is null");
        requiredSubfields = ImmutableList.copyOf(requireNonNull(requiredSubfields, "requiredSubfields is null"));
    }

    public enum ColumnType
    {
        PARTITION_KEY,
        REGULAR,
        SYNTHESIZED,
        AGGREGATED,
    }
}
