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

import com.google.common.collect.ImmutableList;
import io.planbridge.protocol.expression.CallExpression;
import io.planbridge.protocol.expression.ConstantExpression;
import io.planbridge.protocol.expression.InputReferenceExpression;
import io.planbridge.protocol.expression.LambdaDefinitionExpression;
import io.planbridge.protocol.expression.SpecialFormExpression;
import io.planbridge.protocol.expression.SqlFunctionHandle;
import io.planbridge.spi.type.ArrayType;
import org.junit.jupiter.api.Test;

import static io.airlift.slice.Slices.utf8Slice;
import static io.planbridge.expression.ConstantTypedExpression.constant;
import static io.planbridge.expression.TestingBlockEncoder.bigintBlock;
import static io.planbridge.expression.TestingBlockEncoder.nullBlock;
import static io.planbridge.expression.TestingBlockEncoder.varcharBlock;
import static io.planbridge.protocol.ProtocolPlanBuilder.bigintConstant;
import static io.planbridge.protocol.ProtocolPlanBuilder.call;
import static io.planbridge.protocol.ProtocolPlanBuilder.greaterThan;
import static io.planbridge.protocol.ProtocolPlanBuilder.variable;
import static io.planbridge.spi.StandardErrorCode.UNSUPPORTED_CONSTRUCT;
import static io.planbridge.spi.type.BigintType.BIGINT;
import static io.planbridge.spi.type.BooleanType.BOOLEAN;
import static io.planbridge.spi.type.VarcharType.VARCHAR;
import static io.planbridge.testing.PlanBridgeExceptionAssert.assertPlanBridgeExceptionThrownBy;
import static org.assertj.core.api.Assertions.assertThat;

public class TestRowExpressionConverter
{
    private final RowExpressionConverter converter = new RowExpressionConverter();

    @Test
    public void testVariable()
    {
        assertThat(converter.toTypedExpression(variable("orderkey", "bigint")))
                .isEqualTo(new FieldAccessTypedExpression(BIGINT, "orderkey"));
    }

    @Test
    public void testScalarConstants()
    {
        assertThat(converter.toTypedExpression(bigintConstant(5)))
                .isEqualTo(constant(BIGINT, 5L));
        assertThat(converter.toTypedExpression(new ConstantExpression(varcharBlock("AIR"), "varchar")))
                .isEqualTo(constant(VARCHAR, utf8Slice("AIR")));

        TypedExpression nullConstant = converter.toTypedExpression(new ConstantExpression(nullBlock(), "bigint"));
        assertThat(nullConstant).isInstanceOf(ConstantTypedExpression.class);
        assertThat(((ConstantTypedExpression) nullConstant).isNull()).isTrue();
    }

    @Test
    public void testStructuralConstantKeepsBlock()
    {
        ConstantExpression literal = new ConstantExpression(bigintBlock(1), "array(bigint)");
        TypedExpression converted = converter.toTypedExpression(literal);
        assertThat(converted).isInstanceOf(ConstantTypedExpression.class);
        ConstantTypedExpression constant = (ConstantTypedExpression) converted;
        assertThat(constant.type()).isEqualTo(new ArrayType(BIGINT));
        assertThat(constant.hasValueVector()).isTrue();
        assertThat(constant.getValueVector()).contains(literal.valueBlock());
    }

    @Test
    public void testCall()
    {
        CallExpression call = greaterThan(variable("quantity", "bigint"), bigintConstant(10));
        assertThat(converter.toTypedExpression(call))
                .isEqualTo(new CallTypedExpression(
                        BOOLEAN,
                        "presto.default.$operator$greater_than",
                        ImmutableList.of(new FieldAccessTypedExpression(BIGINT, "quantity"), constant(BIGINT, 10L))));
    }

    @Test
    public void testSqlFunctionCall()
    {
        CallExpression call = new CallExpression(
                "tax",
                new SqlFunctionHandle("example.default.tax", "1"),
                "double",
                ImmutableList.of(variable("price", "double")));
        TypedExpression converted = converter.toTypedExpression(call);
        assertThat(converted).isInstanceOf(CallTypedExpression.class);
        assertThat(((CallTypedExpression) converted).name()).isEqualTo("example.default.tax");
    }

    @Test
    public void testSpecialForm()
    {
        SpecialFormExpression and = new SpecialFormExpression(
                SpecialFormExpression.Form.AND,
                "boolean",
                ImmutableList.of(variable("a", "boolean"), variable("b", "boolean")));
        assertThat(converter.toTypedExpression(and))
                .isEqualTo(new CallTypedExpression(
                        BOOLEAN,
                        "and",
                        ImmutableList.of(new FieldAccessTypedExpression(BOOLEAN, "a"), new FieldAccessTypedExpression(BOOLEAN, "b"))));

        SpecialFormExpression isNull = new SpecialFormExpression(SpecialFormExpression.Form.IS_NULL, "boolean", ImmutableList.of(variable("a", "bigint")));
        assertThat(((CallTypedExpression) converter.toTypedExpression(isNull)).name()).isEqualTo("is_null");
    }

    @Test
    public void testNestedCall()
    {
        CallExpression nested = call("presto.default.not", "boolean", greaterThan(variable("x", "bigint"), bigintConstant(0)));
        CallTypedExpression converted = (CallTypedExpression) converter.toTypedExpression(nested);
        assertThat(converted.inputs()).hasSize(1);
        assertThat(converted.inputs().get(0)).isInstanceOf(CallTypedExpression.class);
    }

    @Test
    public void testUnsupportedExpressions()
    {
        assertPlanBridgeExceptionThrownBy(() -> converter.toTypedExpression(new InputReferenceExpression(0, "bigint")))
                .hasErrorCode(UNSUPPORTED_CONSTRUCT);
        LambdaDefinitionExpression lambda = new LambdaDefinitionExpression(
                ImmutableList.of("bigint"),
                ImmutableList.of("x"),
                variable("x", "bigint"));
        assertPlanBridgeExceptionThrownBy(() -> converter.toTypedExpression(lambda))
                .hasErrorCode(UNSUPPORTED_CONSTRUCT);
    }
}
