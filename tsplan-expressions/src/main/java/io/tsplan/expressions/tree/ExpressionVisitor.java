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
package io.tsplan.expressions.tree;

public interface ExpressionVisitor<R, C>
{
    R visitLogical(LogicalExpression node, C context);

    R visitBinary(BinaryExpression node, C context);

    R visitUnary(UnaryExpression node, C context);

    R visitMember(MemberExpression node, C context);

    R visitIdentifier(IdentifierExpression node, C context);

    R visitStringLiteral(StringLiteral node, C context);

    R visitIntegerLiteral(IntegerLiteral node, C context);

    R visitFloatLiteral(FloatLiteral node, C context);

    R visitBooleanLiteral(BooleanLiteral node, C context);

    R visitRegexLiteral(RegexLiteral node, C context);

    R visitDurationLiteral(DurationLiteral node, C context);

    R visitDateTimeLiteral(DateTimeLiteral node, C context);

    R visitCall(CallExpression node, C context);

    R visitFunction(FunctionExpression node, C context);
}
