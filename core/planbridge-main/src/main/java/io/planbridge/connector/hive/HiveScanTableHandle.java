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

import com.google.common.collect.ImmutableMap;
import io.planbridge.connector.ScanTableHandle;
import io.planbridge.expression.TypedExpression;
import io.planbridge.filter.Filter;
import io.planbridge.spi.Subfield;

import java.util.Map;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * Scan of a file based table. Subfield filters are applied while reading;
 * the remaining filter is evaluated on the rows that pass them.
 */
public record HiveScanTableHandle(
        String connectorId,
        String tableName,
        boolean filterPushdownEnabled,
        Map<Subfield, Filter> subfieldFilters,
        Optional<TypedExpression> remainingFilter)
        implements ScanTableHandle
{
    public HiveScanTableHandle
    {
        requireNonNull(connectorId, "connectorId is null");
        requireNonNull(tableName, "tableName is null");
        subfieldFilters = ImmutableMap.copyOf(requireNonNull(subfieldFilters, "subfieldFilters is null"));
        requireNonNull(remainingFilter, "remainingFilter is null");
    }
}
