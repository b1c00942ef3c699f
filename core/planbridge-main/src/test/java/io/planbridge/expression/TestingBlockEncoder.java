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

import io.airlift.slice.DynamicSliceOutput;
import io.airlift.slice.Slice;
import io.airlift.slice.SliceOutput;
import io.airlift.slice.Slices;
import io.planbridge.protocol.expression.Block;

import java.time.LocalDate;
import java.util.Base64;

/**
 * Writes single value blocks in the coordinator's block encoding format.
 */
public final class TestingBlockEncoder
{
    private TestingBlockEncoder() {}

    public static Block bigintBlock(long value)
    {
        return encode(output -> {
            writeHeader(output, "LONG_ARRAY", 1);
            output.writeBoolean(false);
            output.writeLong(value);
        });
    }

    public static Block integerBlock(int value)
    {
        return encode(output -> {
            writeHeader(output, "INT_ARRAY", 1);
            output.writeBoolean(false);
            output.writeInt(value);
        });
    }

    public static Block smallintBlock(short value)
    {
        return encode(output -> {
            writeHeader(output, "SHORT_ARRAY", 1);
            output.writeBoolean(false);
            output.writeShort(value);
        });
    }

    public static Block booleanBlock(boolean value)
    {
        return encode(output -> {
            writeHeader(output, "BYTE_ARRAY", 1);
            output.writeBoolean(false);
            output.writeByte(value ? 1 : 0);
        });
    }

    public static Block doubleBlock(double value)
    {
        return bigintBlock(Double.doubleToLongBits(value));
    }

    public static Block realBlock(float value)
    {
        return integerBlock(Float.floatToIntBits(value));
    }

    public static Block dateBlock(LocalDate value)
    {
        return integerBlock((int) value.toEpochDay());
    }

    public static Block varcharBlock(String value)
    {
        Slice slice = Slices.utf8Slice(value);
        return encode(output -> {
            writeHeader(output, "VARIABLE_WIDTH", 1);
            output.writeInt(slice.length());
            output.writeBoolean(false);
            output.writeInt(slice.length());
            output.writeBytes(slice);
        });
    }

    public static Block nullBlock()
    {
        return encode(output -> {
            writeHeader(output, "LONG_ARRAY", 1);
            output.writeBoolean(true);
            output.writeByte(0b1000_0000);
        });
    }

    /**
     * A run length encoded block repeating the value of {@code value} {@code positionCount} times.
     */
    public static Block rleBlock(Block value, int positionCount)
    {
        byte[] nested = Base64.getDecoder().decode(value.data());
        return encode(output -> {
            writeHeader(output, "RLE", positionCount);
            output.writeBytes(nested);
        });
    }

    private static void writeHeader(SliceOutput output, String encoding, int positionCount)
    {
        Slice name = Slices.utf8Slice(encoding);
        output.writeInt(name.length());
        output.writeBytes(name);
        output.writeInt(positionCount);
    }

    private static Block encode(BlockWriter writer)
    {
        DynamicSliceOutput output = new DynamicSliceOutput(64);
        writer.write(output);
        return new Block(Base64.getEncoder().encodeToString(output.slice().getBytes()));
    }

    private interface BlockWriter
    {
        void write(SliceOutput output);
    }
}
