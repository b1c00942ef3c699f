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
import io.planbridge.spi.PlanBridgeException;

import java.util.List;
import java.util.Optional;

import static io.planbridge.spi.StandardErrorCode.INVALID_PLAN_ARGUMENT;
import static io.planbridge.spi.StandardErrorCode.UNSUPPORTED_CONSTRUCT;
import static io.planbridge.spi.type.BigintType.BIGINT;
import static io.planbridge.spi.type.BooleanType.BOOLEAN;
import static io.planbridge.spi.type.CharType.createCharType;
import static io.planbridge.spi.type.DateType.DATE;
import static io.planbridge.spi.type.DecimalType.createDecimalType;
import static io.planbridge.spi.type.DoubleType.DOUBLE;
import static io.planbridge.spi.type.IntegerType.INTEGER;
import static io.planbridge.spi.type.RealType.REAL;
import static io.planbridge.spi.type.SmallintType.SMALLINT;
import static io.planbridge.spi.type.TimestampType.TIMESTAMP;
import static io.planbridge.spi.type.TinyintType.TINYINT;
import static io.planbridge.spi.type.UnknownType.UNKNOWN;
import static io.planbridge.spi.type.VarbinaryType.VARBINARY;
import static io.planbridge.spi.type.VarcharType.VARCHAR;
import static io.planbridge.spi.type.VarcharType.createVarcharType;
import static java.lang.String.format;
import static java.util.Locale.ENGLISH;

/**
 * Resolves the string encoded types found on the wire, such as {@code bigint},
 * {@code varchar(25)}, {@code decimal(12,2)}, {@code array(map(varchar,bigint))}
 * or {@code row(a bigint,b double)}.
 */
public final class TypeSignatureParser
{
    private TypeSignatureParser() {}

    public static Type parseTypeSignature(String signature)
    {
        String value = signature.trim();
        if (value.isEmpty()) {
            throw new PlanBridgeException(INVALID_PLAN_ARGUMENT, "Type signature is empty");
        }

        int open = value.indexOf('(');
        if (open < 0) {
            return simpleType(value.toLowerCase(ENGLISH));
        }
        if (!value.endsWith(")")) {
            throw new PlanBridgeException(INVALID_PLAN_ARGUMENT, "Malformed type signature: " + signature);
        }

        String base = value.substring(0, open).trim().toLowerCase(ENGLISH);
        List<String> arguments = splitTopLevel(value.substring(open + 1, value.length() - 1), signature);
        switch (base) {
            case "varchar":
                return createVarcharType(parseInt(single(arguments, signature), signature));
            case "char":
                return createCharType(parseInt(single(arguments, signature), signature));
            case "decimal":
                if (arguments.size() != 2) {
                    throw new PlanBridgeException(INVALID_PLAN_ARGUMENT, "Decimal requires precision and scale: " + signature);
                }
                return createDecimalType(parseInt(arguments.get(0), signature), parseInt(arguments.get(1), signature));
            case "array":
                return new ArrayType(parseTypeSignature(single(arguments, signature)));
            case "map":
                if (arguments.size() != 2) {
                    throw new PlanBridgeException(INVALID_PLAN_ARGUMENT, "Map requires key and value types: " + signature);
                }
                return new MapType(parseTypeSignature(arguments.get(0)), parseTypeSignature(arguments.get(1)));
            case "row":
                return parseRow(arguments);
            default:
                throw new PlanBridgeException(UNSUPPORTED_CONSTRUCT, "Unsupported type: " + signature);
        }
    }

    private static Type simpleType(String name)
    {
        switch (name) {
            case "boolean":
                return BOOLEAN;
            case "tinyint":
                return TINYINT;
            case "smallint":
                return SMALLINT;
            case "integer":
            case "int":
                return INTEGER;
            case "bigint":
                return BIGINT;
            case "real":
                return REAL;
            case "double":
                return DOUBLE;
            case "varchar":
                return VARCHAR;
            case "varbinary":
                return VARBINARY;
            case "date":
                return DATE;
            case "timestamp":
                return TIMESTAMP;
            case "unknown":
                return UNKNOWN;
            default:
                throw new PlanBridgeException(UNSUPPORTED_CONSTRUCT, "Unsupported type: " + name);
        }
    }

    private static RowType parseRow(List<String> arguments)
    {
        ImmutableList.Builder<RowType.Field> fields = ImmutableList.builder();
        for (String argument : arguments) {
            String field = argument.trim();
            if (field.startsWith("\"")) {
                int close = field.indexOf('"', 1);
                if (close < 0) {
                    throw new PlanBridgeException(INVALID_PLAN_ARGUMENT, "Unterminated field name: " + field);
                }
                fields.add(new RowType.Field(Optional.of(field.substring(1, close)), parseTypeSignature(field.substring(close + 1))));
                continue;
            }
            int space = topLevelSpace(field);
            if (space < 0) {
                fields.add(new RowType.Field(Optional.empty(), parseTypeSignature(field)));
            }
            else {
                fields.add(new RowType.Field(Optional.of(field.substring(0, space)), parseTypeSignature(field.substring(space + 1))));
            }
        }
        return RowType.from(fields.build());
    }

    private static int topLevelSpace(String value)
    {
        int depth = 0;
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c == '(') {
                depth++;
            }
            else if (c == ')') {
                depth--;
            }
            else if (c == ' ' && depth == 0) {
                return i;
            }
        }
        return -1;
    }

    private static List<String> splitTopLevel(String value, String signature)
    {
        ImmutableList.Builder<String> parts = ImmutableList.builder();
        int depth = 0;
        boolean quoted = false;
        int start = 0;
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c == '"') {
                quoted = !quoted;
            }
            else if (!quoted && c == '(') {
                depth++;
            }
            else if (!quoted && c == ')') {
                depth--;
                if (depth < 0) {
                    throw new PlanBridgeException(INVALID_PLAN_ARGUMENT, "Unbalanced parentheses in type signature: " + signature);
                }
            }
            else if (!quoted && c == ',' && depth == 0) {
                parts.add(value.substring(start, i).trim());
                start = i + 1;
            }
        }
        if (depth != 0 || quoted) {
            throw new PlanBridgeException(INVALID_PLAN_ARGUMENT, "Malformed type signature: " + signature);
        }
        parts.add(value.substring(start).trim());
        return parts.build();
    }

    private static String single(List<String> arguments, String signature)
    {
        if (arguments.size() != 1) {
            throw new PlanBridgeException(INVALID_PLAN_ARGUMENT, format("Expected a single type parameter: %s", signature));
        }
        return arguments.get(0);
    }

    private static int parseInt(String value, String signature)
    {
        try {
            return Integer.parseInt(value.trim());
        }
        catch (NumberFormatException e) {
            throw new PlanBridgeException(INVALID_PLAN_ARGUMENT, "Invalid numeric type parameter in " + signature, e);
        }
    }
}
