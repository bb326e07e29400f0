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
package io.tsplan.expressions;

import io.tsplan.expressions.tree.BinaryExpression;
import io.tsplan.expressions.tree.BooleanLiteral;
import io.tsplan.expressions.tree.CallExpression;
import io.tsplan.expressions.tree.DateTimeLiteral;
import io.tsplan.expressions.tree.DurationLiteral;
import io.tsplan.expressions.tree.ExpressionVisitor;
import io.tsplan.expressions.tree.FloatLiteral;
import io.tsplan.expressions.tree.FunctionExpression;
import io.tsplan.expressions.tree.IdentifierExpression;
import io.tsplan.expressions.tree.IntegerLiteral;
import io.tsplan.expressions.tree.LogicalExpression;
import io.tsplan.expressions.tree.MemberExpression;
import io.tsplan.expressions.tree.RegexLiteral;
import io.tsplan.expressions.tree.StringLiteral;
import io.tsplan.expressions.tree.UnaryExpression;

/**
 * Template for "consumer-like" traversals: visits every node of the tree
 * and returns nothing. {@param context} is the consumer applied by subclasses.
 */
public class DefaultExpressionTraversalVisitor<C>
        implements ExpressionVisitor<Void, C>
{
    @Override
    public Void visitLogical(LogicalExpression node, C context)
    {
        node.getLeft().accept(this, context);
        node.getRight().accept(this, context);
        return null;
    }

    @Override
    public Void visitBinary(BinaryExpression node, C context)
    {
        node.getLeft().accept(this, context);
        node.getRight().accept(this, context);
        return null;
    }

    @Override
    public Void visitUnary(UnaryExpression node, C context)
    {
        node.getArgument().accept(this, context);
        return null;
    }

    @Override
    public Void visitMember(MemberExpression node, C context)
    {
        node.getObject().accept(this, context);
        return null;
    }

    @Override
    public Void visitIdentifier(IdentifierExpression node, C context)
    {
        return null;
    }

    @Override
    public Void visitStringLiteral(StringLiteral node, C context)
    {
        return null;
    }

    @Override
    public Void visitIntegerLiteral(IntegerLiteral node, C context)
    {
        return null;
    }

    @Override
    public Void visitFloatLiteral(FloatLiteral node, C context)
    {
        return null;
    }

    @Override
    public Void visitBooleanLiteral(BooleanLiteral node, C context)
    {
        return null;
    }

    @Override
    public Void visitRegexLiteral(RegexLiteral node, C context)
    {
        return null;
    }

    @Override
    public Void visitDurationLiteral(DurationLiteral node, C context)
    {
        return null;
    }

    @Override
    public Void visitDateTimeLiteral(DateTimeLiteral node, C context)
    {
        return null;
    }

    @Override
    public Void visitCall(CallExpression node, C context)
    {
        node.getArguments().forEach(argument -> argument.accept(this, context));
        return null;
    }

    @Override
    public Void visitFunction(FunctionExpression node, C context)
    {
        node.getBody().accept(this, context);
        return null;
    }
}
