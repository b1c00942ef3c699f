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
import io.planbridge.connector.InsertTableTarget;
import io.planbridge.connector.ScanColumnHandle;
import io.planbridge.connector.hive.HiveColumnKind;
import io.planbridge.connector.hive.HiveScanColumnHandle;
import io.planbridge.connector.hive.HiveScanTableHandle;
import io.planbridge.connector.hive.HiveWriteLocation;
import io.planbridge.connector.hive.HiveWriteTableHandle;
import io.planbridge.connector.tpch.TpchScanColumnHandle;
import io.planbridge.connector.tpch.TpchScanTableHandle;
import io.planbridge.connector.tpch.TpchTable;
import io.planbridge.expression.ConstantTypedExpression;
import io.planbridge.expression.ExpressionConverter;
import io.planbridge.expression.TypedExpression;
import io.planbridge.filter.Filter;
import io.planbridge.protocol.connector.ColumnHandle;
import io.planbridge.protocol.connector.ConnectorTableLayoutHandle;
import io.planbridge.protocol.connector.CreateHandle;
import io.planbridge.protocol.connector.ExecutionWriterTarget;
import io.planbridge.protocol.connector.HiveColumnHandle;
import io.planbridge.protocol.connector.HiveInsertTableHandle;
import io.planbridge.protocol.connector.HiveOutputTableHandle;
import io.planbridge.protocol.connector.HiveTableHandle;
import io.planbridge.protocol.connector.HiveTableLayoutHandle;
import io.planbridge.protocol.connector.InsertHandle;
import io.planbridge.protocol.connector.LocationHandle;
import io.planbridge.protocol.connector.TableHandle;
import io.planbridge.protocol.connector.TpchColumnHandle;
import io.planbridge.protocol.connector.TpchTableLayoutHandle;
import io.planbridge.protocol.predicate.Domain;
import io.planbridge.protocol.predicate.TupleDomain;
import io.planbridge.spi.Subfield;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.google.common.collect.ImmutableList.toImmutableList;
import static io.planbridge.spi.type.TypeSignatureParser.parseTypeSignature;
import static io.planbridge.util.Failures.checkInvariant;
import static io.planbridge.util.Failures.checkSupported;
import static io.planbridge.util.Failures.unsupported;
import static java.util.Objects.requireNonNull;

/**
 * Translates coordinator table, column and write handles into the handles
 * of the local connectors.
 */
public class TableHandleTranslator
{
    private final ExpressionConverter expressionConverter;
    private final DomainFilterCompiler filterCompiler;

    public TableHandleTranslator(ExpressionConverter expressionConverter)
    {
        this.expressionConverter = requireNonNull(expressionConverter, "expressionConverter is null");
        this.filterCompiler = new DomainFilterCompiler(expressionConverter);
    }

    public TranslatedTableHandle translateTableHandle(TableHandle tableHandle)
    {
        ConnectorTableLayoutHandle layout = tableHandle.connectorTableLayout().orElse(null);
        if (layout instanceof HiveTableLayoutHandle hiveLayout) {
            return translateHiveTableHandle(tableHandle, hiveLayout);
        }
        if (layout instanceof TpchTableLayoutHandle tpchLayout) {
            String tableName = tpchLayout.table().tableName();
            TpchTable table = TpchTable.fromTableName(tableName)
                    .orElseThrow(() -> unsupported("Unsupported TPC-H table: %s", tableName));
            return new TranslatedTableHandle(
                    new TpchScanTableHandle(tableHandle.connectorId(), table, tpchLayout.table().scaleFactor()),
                    ImmutableMap.of());
        }
        throw unsupported("Unsupported table handle: %s", tableHandle);
    }

    private TranslatedTableHandle translateHiveTableHandle(TableHandle tableHandle, HiveTableLayoutHandle layout)
    {
        checkSupported(layout.pushdownFilterEnabled(), "Table scan with filter pushdown disabled is not supported");
        if (!(tableHandle.connectorHandle() instanceof HiveTableHandle hiveTable)) {
            throw unsupported("Hive table layout requires a Hive table handle: %s", tableHandle.connectorHandle());
        }

        ImmutableMap.Builder<String, ScanColumnHandle> partitionColumns = ImmutableMap.builder();
        for (HiveColumnHandle column : layout.partitionColumns()) {
            partitionColumns.put(column.name(), toHiveColumnHandle(column));
        }

        TupleDomain domainPredicate = layout.domainPredicate();
        checkInvariant(!domainPredicate.isNone(), "Unexpected always-false domain predicate");
        ImmutableMap.Builder<Subfield, Filter> subfieldFilters = ImmutableMap.builder();
        for (Map.Entry<Subfield, Domain> entry : domainPredicate.domains().orElseThrow().entrySet()) {
            subfieldFilters.put(entry.getKey(), filterCompiler.compile(entry.getValue()));
        }

        Optional<TypedExpression> remainingFilter = Optional.of(expressionConverter.toTypedExpression(layout.remainingPredicate()));
        if (remainingFilter.get() instanceof ConstantTypedExpression constant) {
            checkInvariant(constant.isBooleanLiteral(true), "Unexpected always-false remaining predicate");
            remainingFilter = Optional.empty();
        }

        String tableName = hiveTable.schemaName().isEmpty()
                ? hiveTable.tableName()
                : hiveTable.schemaName() + "." + hiveTable.tableName();

        return new TranslatedTableHandle(
                new HiveScanTableHandle(tableHandle.connectorId(), tableName, true, subfieldFilters.buildOrThrow(), remainingFilter),
                partitionColumns.buildOrThrow());
    }

    public ScanColumnHandle translateColumnHandle(ColumnHandle column)
    {
        if (column instanceof HiveColumnHandle hiveColumn) {
            return toHiveColumnHandle(hiveColumn);
        }
        if (column instanceof TpchColumnHandle tpchColumn) {
            return new TpchScanColumnHandle(tpchColumn.columnName());
        }
        throw unsupported("Unsupported column handle: %s", column);
    }

    public InsertTableTarget translateWriterTarget(ExecutionWriterTarget writerTarget)
    {
        if (writerTarget instanceof CreateHandle createHandle) {
            if (!(createHandle.handle().connectorHandle() instanceof HiveOutputTableHandle outputHandle)) {
                throw unsupported("Unsupported output table handle: %s", createHandle.handle().connectorHandle());
            }
            return new InsertTableTarget(
                    createHandle.handle().connectorId(),
                    toWriteTableHandle(outputHandle.inputColumns(), outputHandle.locationHandle()));
        }
        if (writerTarget instanceof InsertHandle insertHandle) {
            if (!(insertHandle.handle().connectorHandle() instanceof HiveInsertTableHandle hiveInsertHandle)) {
                throw unsupported("Unsupported insert table handle: %s", insertHandle.handle().connectorHandle());
            }
            return new InsertTableTarget(
                    insertHandle.handle().connectorId(),
                    toWriteTableHandle(hiveInsertHandle.inputColumns(), hiveInsertHandle.locationHandle()));
        }
        throw unsupported("Unsupported table writer handle: %s", writerTarget);
    }

    private static HiveWriteTableHandle toWriteTableHandle(List<HiveColumnHandle> inputColumns, LocationHandle locationHandle)
    {
        List<HiveScanColumnHandle> columns = inputColumns.stream()
                .map(TableHandleTranslator::toHiveColumnHandle)
                .collect(toImmutableList());
        return new HiveWriteTableHandle(columns, toWriteLocation(locationHandle));
    }

    private static HiveScanColumnHandle toHiveColumnHandle(HiveColumnHandle column)
    {
        return new HiveScanColumnHandle(
                column.name(),
                toHiveColumnKind(column.columnType()),
                parseTypeSignature(column.typeSignature()),
                column.requiredSubfields());
    }

    private static HiveWriteLocation toWriteLocation(LocationHandle locationHandle)
    {
        HiveWriteLocation.TableKind tableKind;
        switch (locationHandle.tableType()) {
            case NEW:
                tableKind = HiveWriteLocation.TableKind.NEW;
                break;
            case EXISTING:
                tableKind = HiveWriteLocation.TableKind.EXISTING;
                break;
            default:
                throw unsupported("Unsupported table type: %s", locationHandle.tableType());
        }
        return new HiveWriteLocation(locationHandle.targetPath(), locationHandle.writePath(), tableKind);
    }

    private static HiveColumnKind toHiveColumnKind(HiveColumnHandle.ColumnType columnType)
    {
        switch (columnType) {
            case PARTITION_KEY:
                return HiveColumnKind.PARTITION_KEY;
            case REGULAR:
                return HiveColumnKind.REGULAR;
            case SYNTHESIZED:
                return HiveColumnKind.SYNTHESIZED;
            default:
                throw unsupported("Unsupported Hive column type: %s", columnType);
        }
    }
}
