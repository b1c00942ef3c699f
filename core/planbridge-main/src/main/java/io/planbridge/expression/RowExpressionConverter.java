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
import io.planbridge.protocol.expression.CallExpression;
import io.planbridge.protocol.expression.ConstantExpression;
import io.planbridge.protocol.expression.InputReferenceExpression;
import io.planbridge.protocol.expression.LambdaDefinitionExpression;
import io.planbridge.protocol.expression.RowExpression;
import io.planbridge.protocol.expression.RowExpressionVisitor;
import io.planbridge.protocol.expression.SpecialFormExpression;
import io.planbridge.protocol.expression.VariableReferenceExpression;
import io.planbridge.spi.type.Type;
import jakarta.annotation.Nullable;

import java.util.List;

import static com.google.common.collect.ImmutableList.toImmutableList;
import static io.planbridge.expression.ConstantTypedExpression.constant;
import static io.planbridge.expression.ConstantTypedExpression.vectorConstant;
import static io.planbridge.spi.type.TypeSignatureParser.parseTypeSignature;
import static io.planbridge.util.Failures.unsupported;
import static java.util.Locale.ENGLISH;

/**
 * Default conversion: variables become field accesses, calls keep the name
 * of the resolved function and special forms become calls named after the
 * lower case form. Lambdas and positional input references have no
 * executable counterpart.
 */
public class RowExpressionConverter
        implements ExpressionConverter
{
    private final Visitor visitor = new Visitor();

    @Override
    public TypedExpression toTypedExpression(RowExpression expression)
    {
        return expression.accept(visitor, null);
    }

    @Nullable
    @Override
    public Object getConstantValue(Type type, Block block)
    {
        return BlockDecoder.decodeSingleValue(type, block);
    }

    private List<TypedExpression> toTypedExpressions(List<RowExpression> expressions)
    {
        return expressions.stream()
                .map(this::toTypedExpression)
                .collect(toImmutableList());
    }

    private class Visitor
            implements RowExpressionVisitor<TypedExpression, Void>
    {
        @Override
        public TypedExpression visitCall(CallExpression call, Void context)
        {
            return new CallTypedExpression(parseTypeSignature(call.type()), call.functionHandle().getName(), toTypedExpressions(call.arguments()));
        }

        @Override
        public TypedExpression visitInputReference(InputReferenceExpression reference, Void context)
        {
            throw unsupported("Input reference expressions are not supported: field %s", reference.field());
        }

        @Override
        public TypedExpression visitConstant(ConstantExpression literal, Void context)
        {
            Type type = parseTypeSignature(literal.type());
            if (!type.getKind().isScalar()) {
                return vectorConstant(type, literal.valueBlock());
            }
            return constant(type, getConstantValue(type, literal.valueBlock()));
        }

        @Override
        public TypedExpression visitLambda(LambdaDefinitionExpression lambda, Void context)
        {
            throw unsupported("Lambda expressions are not supported: %s", lambda.arguments());
        }

        @Override
        public TypedExpression visitVariableReference(VariableReferenceExpression reference, Void context)
        {
            return new FieldAccessTypedExpression(parseTypeSignature(reference.type()), reference.name());
        }

        @Override
        public TypedExpression visitSpecialForm(SpecialFormExpression specialForm, Void context)
        {
            return new CallTypedExpression(
                    parseTypeSignature(specialForm.type()),
                    specialForm.form().name().toLowerCase(ENGLISH),
                    toTypedExpressions(specialForm.arguments()));
        }
    }
}
