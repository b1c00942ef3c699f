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
import io.planbridge.protocol.expression.RowExpression;
import io.planbridge.protocol.predicate.TupleDomain;

import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Scan layout of a file based table. The domain predicate holds the per
 * column constraints; the remaining predicate is the residual filter the
 * domains cannot express.
 */
public record HiveTableLayoutHandle(
        String schemaName,
        String tableName,
        List<HiveColumnHandle> partitionColumns,
        TupleDomain domainPredicate,
        RowExpression remainingPredicate,
        boolean pushdownFilterEnabled,
        String layoutString)
        implements ConnectorTableLayoutHandle
{
    public HiveTableLayoutHandle
    {
        requireNonNull(schemaName, "schemaName is null");
        requireNonNull(tableName, "tableName is null");
        partitionColumns = ImmutableList.copyOf(requireNonNull(partitionColumns, "partitionColumns is null"));
        requireNonNull(domainPredicate, "domainPredicate is null");
        requireNonNull(remainingPredicate, "remainingPredicate is null");
        requireNonNull(layoutString, "layoutString is null");
    }
}
