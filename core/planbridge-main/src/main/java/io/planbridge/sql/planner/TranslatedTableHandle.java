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

import com.google.common.collect.ImmutableMap;
import io.planbridge.connector.ScanColumnHandle;
import io.planbridge.connector.ScanTableHandle;

import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * Scan handle together with the partition columns of its layout, keyed by column name.
 */
public record TranslatedTableHandle(ScanTableHandle tableHandle, Map<String, ScanColumnHandle> partitionColumns)
{
    public TranslatedTableHandle
    {
        requireNonNull(tableHandle, "tableHandle is null");
        partitionColumns = ImmutableMap.copyOf(requireNonNull(partitionColumns, "partitionColumns is null"));
    }
}
