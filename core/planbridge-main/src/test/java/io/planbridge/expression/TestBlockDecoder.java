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

import io.planbridge.protocol.expression.Block;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.Base64;

import static io.airlift.slice.Slices.utf8Slice;
import static io.planbridge.expression.BlockDecoder.decodeSingleValue;
import static io.planbridge.expression.TestingBlockEncoder.bigintBlock;
import static io.planbridge.expression.TestingBlockEncoder.booleanBlock;
import static io.planbridge.expression.TestingBlockEncoder.dateBlock;
import static io.planbridge.expression.TestingBlockEncoder.doubleBlock;
import static io.planbridge.expression.TestingBlockEncoder.integerBlock;
import static io.planbridge.expression.TestingBlockEncoder.nullBlock;
import static io.planbridge.expression.TestingBlockEncoder.realBlock;
import static io.planbridge.expression.TestingBlockEncoder.rleBlock;
import static io.planbridge.expression.TestingBlockEncoder.smallintBlock;
import static io.planbridge.expression.TestingBlockEncoder.varcharBlock;
import static io.planbridge.spi.StandardErrorCode.INVALID_PLAN_ARGUMENT;
import static io.planbridge.spi.StandardErrorCode.UNSUPPORTED_CONSTRUCT;
import static io.planbridge.spi.type.BigintType.BIGINT;
import static io.planbridge.spi.type.BooleanType.BOOLEAN;
import static io.planbridge.spi.type.DateType.DATE;
import static io.planbridge.spi.type.DoubleType.DOUBLE;
import static io.planbridge.spi.type.IntegerType.INTEGER;
import static io.planbridge.spi.type.RealType.REAL;
import static io.planbridge.spi.type.SmallintType.SMALLINT;
import static io.planbridge.spi.type.VarcharType.VARCHAR;
import static io.planbridge.testing.PlanBridgeExceptionAssert.assertPlanBridgeExceptionThrownBy;
import static org.assertj.core.api.Assertions.assertThat;

public class TestBlockDecoder
{
    @Test
    public void testFixedWidthValues()
    {
        assertThat(decodeSingleValue(BIGINT, bigintBlock(-42))).isEqualTo(-42L);
        assertThat(decodeSingleValue(INTEGER, integerBlock(7))).isEqualTo(7L);
        assertThat(decodeSingleValue(SMALLINT, smallintBlock((short) 3))).isEqualTo(3L);
        assertThat(decodeSingleValue(BOOLEAN, booleanBlock(true))).isEqualTo(true);
        assertThat(decodeSingleValue(BOOLEAN, booleanBlock(false))).isEqualTo(false);
        assertThat(decodeSingleValue(DOUBLE, doubleBlock(1.5))).isEqualTo(1.5);
        assertThat(decodeSingleValue(REAL, realBlock(2.25f))).isEqualTo(2.25f);
    }

    @Test
    public void testDate()
    {
        assertThat(decodeSingleValue(DATE, dateBlock(LocalDate.of(1995, 3, 15)))).isEqualTo(LocalDate.of(1995, 3, 15));
    }

    @Test
    public void testVarchar()
    {
        assertThat(decodeSingleValue(VARCHAR, varcharBlock("BUILDING"))).isEqualTo(utf8Slice("BUILDING"));
        assertThat(decodeSingleValue(VARCHAR, varcharBlock(""))).isEqualTo(utf8Slice(""));
    }

    @Test
    public void testNull()
    {
        assertThat(decodeSingleValue(BIGINT, nullBlock())).isNull();
    }

    @Test
    public void testRunLengthEncoded()
    {
        assertThat(decodeSingleValue(BIGINT, rleBlock(bigintBlock(11), 5))).isEqualTo(11L);
        assertThat(decodeSingleValue(VARCHAR, rleBlock(varcharBlock("abc"), 3))).isEqualTo(utf8Slice("abc"));
    }

    @Test
    public void testInvalidBlocks()
    {
        assertPlanBridgeExceptionThrownBy(() -> decodeSingleValue(BIGINT, new Block("not base64!")))
                .hasErrorCode(INVALID_PLAN_ARGUMENT);
        assertPlanBridgeExceptionThrownBy(() -> decodeSingleValue(BIGINT, new Block("AAAA")))
                .hasErrorCode(INVALID_PLAN_ARGUMENT);
        assertPlanBridgeExceptionThrownBy(() -> decodeSingleValue(VARCHAR, bigintBlock(1)))
                .hasErrorCode(INVALID_PLAN_ARGUMENT)
                .hasMessageContaining("fixed width");
        assertPlanBridgeExceptionThrownBy(() -> decodeSingleValue(BIGINT, varcharBlock("x")))
                .hasErrorCode(INVALID_PLAN_ARGUMENT)
                .hasMessageContaining("VARIABLE_WIDTH");
        assertPlanBridgeExceptionThrownBy(() -> decodeSingleValue(DOUBLE, integerBlock(1)))
                .hasErrorCode(INVALID_PLAN_ARGUMENT);
    }

    @Test
    public void testUnknownEncoding()
    {
        // little endian name length, "ARRAY", one position
        Block block = new Block(Base64.getEncoder().encodeToString(new byte[] {5, 0, 0, 0, 'A', 'R', 'R', 'A', 'Y', 1, 0, 0, 0}));
        assertPlanBridgeExceptionThrownBy(() -> decodeSingleValue(BIGINT, block))
                .hasErrorCode(UNSUPPORTED_CONSTRUCT)
                .hasMessage("Unsupported block encoding: ARRAY");
    }
}
