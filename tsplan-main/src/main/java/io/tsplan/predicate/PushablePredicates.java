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
package io.tsplan.predicate;

import com.google.common.collect.ImmutableSet;
import io.tsplan.expressions.DefaultExpressionTraversalVisitor;
import io.tsplan.expressions.ExpressionRewriter;
import io.tsplan.expressions.ExpressionTreeRewriter;
import io.tsplan.expressions.tree.BinaryExpression;
import io.tsplan.expressions.tree.BooleanLiteral;
import io.tsplan.expressions.tree.Expression;
import io.tsplan.expressions.tree.FloatLiteral;
import io.tsplan.expressions.tree.IdentifierExpression;
import io.tsplan.expressions.tree.IntegerLiteral;
import io.tsplan.expressions.tree.LogicalExpression;
import io.tsplan.expressions.tree.MemberExpression;
import io.tsplan.expressions.tree.RegexLiteral;
import io.tsplan.expressions.tree.StringLiteral;
import io.tsplan.expressions.tree.UnaryExpression;

import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;

import static io.tsplan.expressions.tree.BinaryExpression.Operator.EQUAL;
import static io.tsplan.expressions.tree.BinaryExpression.Operator.NOT_EQUAL;
import static io.tsplan.expressions.tree.BinaryExpression.Operator.NOT_REGEX_MATCH;
import static io.tsplan.expressions.tree.BinaryExpression.Operator.REGEX_MATCH;
import static io.tsplan.expressions.tree.UnaryExpression.Operator.EXISTS;
import static io.tsplan.expressions.tree.UnaryExpression.Operator.NOT;
import static io.tsplan.plan.ColumnNames.VALUE;
import static io.tsplan.predicate.PredicateScope.TAG_COLUMNS;

/**
 * Decides which filter expressions storage can evaluate, and rewrites the
 * tag existence checks into the comparisons storage understands.
 */
public final class PushablePredicates
{
    private static final Set<BinaryExpression.Operator> VALUE_OPERATORS = ImmutableSet.of(EQUAL, NOT_EQUAL);
    private static final Set<BinaryExpression.Operator> TAG_OPERATORS = ImmutableSet.of(EQUAL, NOT_EQUAL, REGEX_MATCH, NOT_REGEX_MATCH);

    private PushablePredicates() {}

    public static boolean isPushable(Expression expression, String rowParameter, PredicateScope scope)
    {
        if (!isPushable(expression, rowParameter)) {
            return false;
        }
        return scope != TAG_COLUMNS || !referencesValue(expression, rowParameter);
    }

    private static boolean isPushable(Expression expression, String rowParameter)
    {
        if (expression instanceof LogicalExpression) {
            LogicalExpression logical = (LogicalExpression) expression;
            return isPushable(logical.getLeft(), rowParameter) && isPushable(logical.getRight(), rowParameter);
        }
        if (expression instanceof UnaryExpression) {
            return isExistenceCheck((UnaryExpression) expression, rowParameter);
        }
        if (expression instanceof BinaryExpression) {
            return isPushableComparison((BinaryExpression) expression, rowParameter);
        }
        return false;
    }

    private static boolean isExistenceCheck(UnaryExpression unary, String rowParameter)
    {
        if (unary.getOperator() == NOT && unary.getArgument() instanceof UnaryExpression) {
            UnaryExpression argument = (UnaryExpression) unary.getArgument();
            return argument.getOperator() == EXISTS && isTagReference(argument.getArgument(), rowParameter);
        }
        return unary.getOperator() == EXISTS && isTagReference(unary.getArgument(), rowParameter);
    }

    private static boolean isPushableComparison(BinaryExpression comparison, String rowParameter)
    {
        Optional<String> key = rowMember(comparison.getLeft(), rowParameter);
        if (!key.isPresent()) {
            return false;
        }
        Expression literal = comparison.getRight();
        if (key.get().equals(VALUE)) {
            return VALUE_OPERATORS.contains(comparison.getOperator()) &&
                    (literal instanceof StringLiteral ||
                            literal instanceof IntegerLiteral ||
                            literal instanceof FloatLiteral ||
                            literal instanceof BooleanLiteral);
        }
        if (!TAG_OPERATORS.contains(comparison.getOperator())) {
            return false;
        }
        if (comparison.getOperator() == REGEX_MATCH || comparison.getOperator() == NOT_REGEX_MATCH) {
            return literal instanceof RegexLiteral;
        }
        if (!(literal instanceof StringLiteral)) {
            return false;
        }
        // storage reads an absent tag as the empty string, only `not exists` may ask for it
        return comparison.getOperator() != EQUAL || !((StringLiteral) literal).getValue().isEmpty();
    }

    private static boolean isTagReference(Expression expression, String rowParameter)
    {
        return rowMember(expression, rowParameter)
                .filter(key -> !key.equals(VALUE))
                .isPresent();
    }

    private static Optional<String> rowMember(Expression expression, String rowParameter)
    {
        if (!(expression instanceof MemberExpression)) {
            return Optional.empty();
        }
        MemberExpression member = (MemberExpression) expression;
        if (member.getObject() instanceof IdentifierExpression && ((IdentifierExpression) member.getObject()).getName().equals(rowParameter)) {
            return Optional.of(member.getProperty());
        }
        return Optional.empty();
    }

    static boolean referencesValue(Expression expression, String rowParameter)
    {
        AtomicBoolean found = new AtomicBoolean();
        expression.accept(new DefaultExpressionTraversalVisitor<AtomicBoolean>()
        {
            @Override
            public Void visitMember(MemberExpression node, AtomicBoolean context)
            {
                if (rowMember(node, rowParameter).filter(VALUE::equals).isPresent()) {
                    context.set(true);
                }
                return super.visitMember(node, context);
            }
        }, found);
        return found.get();
    }

    /**
     * Rewrites {@code exists r.k} to {@code r.k != ""} and {@code not exists r.k}
     * to {@code r.k == ""}.
     */
    public static Expression rewriteExistenceChecks(Expression expression, String rowParameter)
    {
        return ExpressionTreeRewriter.rewriteWith(new ExpressionRewriter<Void>()
        {
            @Override
            public Expression rewriteUnary(UnaryExpression node, Void context, ExpressionTreeRewriter<Void> treeRewriter)
            {
                if (!isExistenceCheck(node, rowParameter)) {
                    return null;
                }
                if (node.getOperator() == EXISTS) {
                    return new BinaryExpression(NOT_EQUAL, node.getArgument(), new StringLiteral(""));
                }
                return new BinaryExpression(EQUAL, ((UnaryExpression) node.getArgument()).getArgument(), new StringLiteral(""));
            }
        }, expression);
    }
}
