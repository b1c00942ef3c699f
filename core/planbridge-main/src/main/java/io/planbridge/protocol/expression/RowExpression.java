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
package io.planbridge.protocol.expression;

/**
 * Scalar expression as shipped by the coordinator. Types are carried as
 * signature strings and resolved by the worker.
 */
public sealed interface RowExpression
        permits CallExpression, ConstantExpression, InputReferenceExpression, LambdaDefinitionExpression, SpecialFormExpression, VariableReferenceExpression
{
    String type();

    <R, C> R accept(RowExpressionVisitor<R, C> visitor, C context);
}
