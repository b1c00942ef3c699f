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
package io.planbridge.expression;

import io.airlift.slice.BasicSliceInput;
import io.airlift.slice.Slice;
import io.airlift.slice.Slices;
import io.planbridge.protocol.expression.Block;
import io.planbridge.spi.PlanBridgeException;
import io.planbridge.spi.type.Type;
import jakarta.annotation.Nullable;

import java.time.LocalDate;
import java.util.Base64;

import static io.planbridge.spi.StandardErrorCode.INVALID_PLAN_ARGUMENT;
import static io.planbridge.util.Failures.checkCondition;
import static io.planbridge.util.Failures.unsupported;
import static java.lang.String.format;

/**
 * Reads the first value of a block serialized in the coordinator's block
 * encoding format. The serialized form starts with the length prefixed name
 * of the encoding, followed by the position count, the null flags packed as
 * bits (most significant bit first) and the non-null values.
 */
public final class BlockDecoder
{
    private BlockDecoder() {}

    @Nullable
    public static Object decodeSingleValue(Type type, Block block)
    {
        byte[] bytes;
        try {
            bytes = Base64.getDecoder().decode(block.data());
        }
        catch (IllegalArgumentException e) {
            throw new PlanBridgeException(INVALID_PLAN_ARGUMENT, "Block is not valid base64", e);
        }
        try {
            return readFirstValue(type, Slices.wrappedBuffer(bytes).getInput());
        }
        catch (IndexOutOfBoundsException e) {
            throw new PlanBridgeException(INVALID_PLAN_ARGUMENT, format("Truncated block for type %s", type), e);
        }
    }

    @Nullable
    private static Object readFirstValue(Type type, BasicSliceInput input)
    {
        String encoding = readLengthPrefixedString(input);
        int positionCount = input.readInt();
        checkCondition(positionCount > 0, INVALID_PLAN_ARGUMENT, "Block with encoding %s has no positions", encoding);
        switch (encoding) {
            case "RLE":
                return readFirstValue(type, input);
            case "BYTE_ARRAY":
                return readFixedWidth(type, input, positionCount, 1);
            case "SHORT_ARRAY":
                return readFixedWidth(type, input, positionCount, 2);
            case "INT_ARRAY":
                return readFixedWidth(type, input, positionCount, 4);
            case "LONG_ARRAY":
                return readFixedWidth(type, input, positionCount, 8);
            case "VARIABLE_WIDTH":
                return readVariableWidth(type, input, positionCount);
            default:
                throw unsupported("Unsupported block encoding: %s", encoding);
        }
    }

    @Nullable
    private static Object readFixedWidth(Type type, BasicSliceInput input, int positionCount, int width)
    {
        if (isFirstPositionNull(input, positionCount)) {
            return null;
        }
        long raw = switch (width) {
            case 1 -> input.readByte();
            case 2 -> input.readShort();
            case 4 -> input.readInt();
            default -> input.readLong();
        };
        return toValue(type, raw, width);
    }

    @Nullable
    private static Object readVariableWidth(Type type, BasicSliceInput input, int positionCount)
    {
        int firstEndOffset = input.readInt();
        input.skip((positionCount - 1) * (long) Integer.BYTES);
        if (isFirstPositionNull(input, positionCount)) {
            return null;
        }
        int totalLength = input.readInt();
        checkCondition(firstEndOffset >= 0 && firstEndOffset <= totalLength, INVALID_PLAN_ARGUMENT, "Invalid offset in variable width block");
        switch (type.getKind()) {
            case VARCHAR:
            case CHAR:
            case VARBINARY:
                return Slices.copyOf(input.readSlice(firstEndOffset));
            default:
                throw encodingMismatch(type, "VARIABLE_WIDTH");
        }
    }

    private static boolean isFirstPositionNull(BasicSliceInput input, int positionCount)
    {
        boolean mayHaveNull = input.readBoolean();
        if (!mayHaveNull) {
            return false;
        }
        byte firstFlags = input.readByte();
        input.skip((positionCount - 1) / 8);
        return (firstFlags & 0b1000_0000) != 0;
    }

    @Nullable
    private static Object toValue(Type type, long raw, int width)
    {
        switch (type.getKind()) {
            case TINYINT:
            case SMALLINT:
            case INTEGER:
            case BIGINT:
            case DECIMAL:
            case TIMESTAMP:
                return raw;
            case DATE:
                return LocalDate.ofEpochDay(raw);
            case BOOLEAN:
                return raw != 0;
            case DOUBLE:
                checkCondition(width == Long.BYTES, INVALID_PLAN_ARGUMENT, "Double value must be encoded as LONG_ARRAY");
                return Double.longBitsToDouble(raw);
            case REAL:
                checkCondition(width == Integer.BYTES, INVALID_PLAN_ARGUMENT, "Real value must be encoded as INT_ARRAY");
                return Float.intBitsToFloat((int) raw);
            case UNKNOWN:
                return null;
            default:
                throw encodingMismatch(type, "fixed width");
        }
    }

    private static String readLengthPrefixedString(BasicSliceInput input)
    {
        int length = input.readInt();
        checkCondition(length > 0 && length <= input.available(), INVALID_PLAN_ARGUMENT, "Invalid block encoding name length: %s", length);
        Slice name = input.readSlice(length);
        return name.toStringUtf8();
    }

    private static PlanBridgeException encodingMismatch(Type type, String encoding)
    {
        return new PlanBridgeException(INVALID_PLAN_ARGUMENT, format("Type %s cannot be read from a %s block", type, encoding));
    }
}
