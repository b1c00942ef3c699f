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
package io.planbridge.connector.hive;

import com.google.common.collect.ImmutableList;
import io.planbridge.connector.ScanColumnHandle;
import io.planbridge.spi.Subfield;
import io.planbridge.spi.type.Type;

import java.util.List;

import static java.util.Objects.requireNonNull;

public record HiveScanColumnHandle(String name, HiveColumnKind columnKind, Type dataType, List<Subfield> requiredSubfields)
        implements ScanColumnHandle
{
    public HiveScanColumnHandle
    {
        requireNonNull(name, "name is null");
        requireNonNull(columnKind, "columnKind is null");
        requireNonNull(dataType, "dataType is null");
        requiredSubfields = ImmutableList.copyOf(requireNonNull(requiredSubfields, "requiredSubfields is null"));
    }

    public boolean isPartitionKey()
    {
        return columnKind == HiveColumnKind.PARTITION_KEY;
    }
}
