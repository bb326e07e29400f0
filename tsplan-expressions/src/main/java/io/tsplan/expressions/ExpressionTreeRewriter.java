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
import io.tsplan.expressions.tree.Expression;
import io.tsplan.expressions.tree.ExpressionVisitor;
import io.tsplan.expressions.tree.FloatLiteral;
import io.tsplan.expressions.tree.FunctionExpression;
import io.tsplan.expressions.tree.IdentifierExpression;
import io.tsplan.expressions.tree.IntegerLiteral;
import io.tsplan.expressions.tree.Literal;
import io.tsplan.expressions.tree.LogicalExpression;
import io.tsplan.expressions.tree.MemberExpression;
import io.tsplan.expressions.tree.RegexLiteral;
import io.tsplan.expressions.tree.StringLiteral;
import io.tsplan.expressions.tree.UnaryExpression;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

public final class ExpressionTreeRewriter<C>
{
    private final ExpressionRewriter<C> rewriter;
    private final ExpressionVisitor<Expression, Context<C>> visitor;

    public static <C, T extends Expression> T rewriteWith(ExpressionRewriter<C> rewriter, T node)
    {
        return new ExpressionTreeRewriter<>(rewriter).rewrite(node, null);
    }

    public static <C, T extends Expression> T rewriteWith(ExpressionRewriter<C> rewriter, T node, C context)
    {
        return new ExpressionTreeRewriter<>(rewriter).rewrite(node, context);
    }

    public ExpressionTreeRewriter(ExpressionRewriter<C> rewriter)
    {
        this.rewriter = rewriter;
        this.visitor = new RewritingVisitor();
    }

    @SuppressWarnings("unchecked")
    public <T extends Expression> T rewrite(T node, C context)
    {
        return (T) node.accept(visitor, new Context<>(context, false));
    }

    /**
     * Rewrites the children of the node without offering the node itself to the rewriter.
     */
    @SuppressWarnings("unchecked")
    public <T extends Expression> T defaultRewrite(T node, C context)
    {
        return (T) node.accept(visitor, new Context<>(context, true));
    }

    private List<Expression> rewrite(List<Expression> items, Context<C> context)
    {
        List<Expression> rewrittenExpressions = new ArrayList<>();
        for (Expression expression : items) {
            rewrittenExpressions.add(rewrite(expression, context.get()));
        }
        return Collections.unmodifiableList(rewrittenExpressions);
    }

    private class RewritingVisitor
            implements ExpressionVisitor<Expression, Context<C>>
    {
        @Override
        public Expression visitLogical(LogicalExpression node, Context<C> context)
        {
            if (!context.isDefaultRewrite()) {
                Expression result = rewriter.rewriteLogical(node, context.get(), ExpressionTreeRewriter.this);
                if (result != null) {
                    return result;
                }
            }

            Expression left = rewrite(node.getLeft(), context.get());
            Expression right = rewrite(node.getRight(), context.get());
            if (left != node.getLeft() || right != node.getRight()) {
                return new LogicalExpression(node.getOperator(), left, right);
            }
            return node;
        }

        @Override
        public Expression visitBinary(BinaryExpression node, Context<C> context)
        {
            if (!context.isDefaultRewrite()) {
                Expression result = rewriter.rewriteBinary(node, context.get(), ExpressionTreeRewriter.this);
                if (result != null) {
                    return result;
                }
            }

            Expression left = rewrite(node.getLeft(), context.get());
            Expression right = rewrite(node.getRight(), context.get());
            if (left != node.getLeft() || right != node.getRight()) {
                return new BinaryExpression(node.getOperator(), left, right);
            }
            return node;
        }

        @Override
        public Expression visitUnary(UnaryExpression node, Context<C> context)
        {
            if (!context.isDefaultRewrite()) {
                Expression result = rewriter.rewriteUnary(node, context.get(), ExpressionTreeRewriter.this);
                if (result != null) {
                    return result;
                }
            }

            Expression argument = rewrite(node.getArgument(), context.get());
            if (argument != node.getArgument()) {
                return new UnaryExpression(node.getOperator(), argument);
            }
            return node;
        }

        @Override
        public Expression visitMember(MemberExpression node, Context<C> context)
        {
            if (!context.isDefaultRewrite()) {
                Expression result = rewriter.rewriteMember(node, context.get(), ExpressionTreeRewriter.this);
                if (result != null) {
                    return result;
                }
            }

            Expression object = rewrite(node.getObject(), context.get());
            if (object != node.getObject()) {
                return new MemberExpression(object, node.getProperty());
            }
            return node;
        }

        @Override
        public Expression visitIdentifier(IdentifierExpression node, Context<C> context)
        {
            if (!context.isDefaultRewrite()) {
                Expression result = rewriter.rewriteIdentifier(node, context.get(), ExpressionTreeRewriter.this);
                if (result != null) {
                    return result;
                }
            }

            return node;
        }

        @Override
        public Expression visitStringLiteral(StringLiteral node, Context<C> context)
        {
            return visitLiteral(node, context);
        }

        @Override
        public Expression visitIntegerLiteral(IntegerLiteral node, Context<C> context)
        {
            return visitLiteral(node, context);
        }

        @Override
        public Expression visitFloatLiteral(FloatLiteral node, Context<C> context)
        {
            return visitLiteral(node, context);
        }

        @Override
        public Expression visitBooleanLiteral(BooleanLiteral node, Context<C> context)
        {
            return visitLiteral(node, context);
        }

        @Override
        public Expression visitRegexLiteral(RegexLiteral node, Context<C> context)
        {
            return visitLiteral(node, context);
        }

        @Override
        public Expression visitDurationLiteral(DurationLiteral node, Context<C> context)
        {
            return visitLiteral(node, context);
        }

        @Override
        public Expression visitDateTimeLiteral(DateTimeLiteral node, Context<C> context)
        {
            return visitLiteral(node, context);
        }

        private Expression visitLiteral(Literal literal, Context<C> context)
        {
            if (!context.isDefaultRewrite()) {
                Expression result = rewriter.rewriteLiteral(literal, context.get(), ExpressionTreeRewriter.this);
                if (result != null) {
                    return result;
                }
            }

            return literal;
        }

        @Override
        public Expression visitCall(CallExpression node, Context<C> context)
        {
            if (!context.isDefaultRewrite()) {
                Expression result = rewriter.rewriteCall(node, context.get(), ExpressionTreeRewriter.this);
                if (result != null) {
                    return result;
                }
            }

            List<Expression> arguments = rewrite(node.getArguments(), context);
            if (!sameElements(node.getArguments(), arguments)) {
                return new CallExpression(node.getFunction(), arguments);
            }
            return node;
        }

        @Override
        public Expression visitFunction(FunctionExpression node, Context<C> context)
        {
            if (!context.isDefaultRewrite()) {
                Expression result = rewriter.rewriteFunction(node, context.get(), ExpressionTreeRewriter.this);
                if (result != null) {
                    return result;
                }
            }

            Expression body = rewrite(node.getBody(), context.get());
            if (body != node.getBody()) {
                return node.withBody(body);
            }
            return node;
        }
    }

    public static class Context<C>
    {
        private final boolean defaultRewrite;
        private final C context;

        private Context(C context, boolean defaultRewrite)
        {
            this.context = context;
            this.defaultRewrite = defaultRewrite;
        }

        public C get()
        {
            return context;
        }

        public boolean isDefaultRewrite()
        {
            return defaultRewrite;
        }
    }

    @SuppressWarnings("ObjectEquality")
    private static <T> boolean sameElements(List<? extends T> a, List<? extends T> b)
    {
        if (a.size() != b.size()) {
            return false;
        }

        Iterator<? extends T> first = a.iterator();
        Iterator<? extends T> second = b.iterator();

        while (first.hasNext() && second.hasNext()) {
            if (first.next() != second.next()) {
                return false;
            }
        }

        return true;
    }
}
