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
package io.planbridge.connector.tpch;

import java.util.Optional;

import static java.util.Locale.ENGLISH;

public enum TpchTable
{
    CUSTOMER,
    LINEITEM,
    NATION,
    ORDERS,
    PART,
    PARTSUPP,
    REGION,
    SUPPLIER;

    public String getTableName()
    {
        return name().toLowerCase(ENGLISH);
    }

    public static Optional<TpchTable> fromTableName(String tableName)
    {
        for (TpchTable table : values()) {
            if (table.getTableName().equals(tableName)) {
                return Optional.of(table);
            }
        }
        return Optional.empty();
    }
}
