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

import com.google.common.collect.ImmutableMap;
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
import io.tsplan.expressions.tree.LogicalExpression;
import io.tsplan.expressions.tree.MemberExpression;
import io.tsplan.expressions.tree.RegexLiteral;
import io.tsplan.expressions.tree.StringLiteral;
import io.tsplan.expressions.tree.UnaryExpression;
import io.tsplan.spi.TsplanException;
import io.tsplan.spi.predicate.ComparisonOperator;
import io.tsplan.spi.predicate.LogicalOperator;
import io.tsplan.spi.predicate.PredicateNode;
import io.tsplan.spi.predicate.StoragePredicate;

import java.util.Map;

import static io.tsplan.PushdownErrorCode.UNKNOWN_OBJECT;
import static io.tsplan.PushdownErrorCode.UNSUPPORTED_EXPRESSION;
import static io.tsplan.PushdownErrorCode.UNSUPPORTED_LITERAL_KIND;
import static io.tsplan.PushdownErrorCode.UNSUPPORTED_OPERATOR;
import static io.tsplan.plan.ColumnNames.FIELD;
import static io.tsplan.plan.ColumnNames.MEASUREMENT;
import static io.tsplan.plan.ColumnNames.VALUE;
import static io.tsplan.spi.predicate.StoragePredicate.FIELD_TAG_KEY;
import static io.tsplan.spi.predicate.StoragePredicate.MEASUREMENT_TAG_KEY;
import static io.tsplan.spi.predicate.StoragePredicate.VALUE_FIELD_KEY;
import static java.util.Objects.requireNonNull;

/**
 * Converts a boolean expression over a single row variable into the predicate
 * tree evaluated by storage. Translation is all or nothing: any construct
 * storage cannot evaluate fails the whole expression.
 */
public final class StoragePredicateTranslator
{
    private static final Map<BinaryExpression.Operator, ComparisonOperator> COMPARISON_OPERATORS = ImmutableMap.<BinaryExpression.Operator, ComparisonOperator>builder()
            .put(BinaryExpression.Operator.EQUAL, ComparisonOperator.EQUAL)
            .put(BinaryExpression.Operator.NOT_EQUAL, ComparisonOperator.NOT_EQUAL)
            .put(BinaryExpression.Operator.REGEX_MATCH, ComparisonOperator.REGEX)
            .put(BinaryExpression.Operator.NOT_REGEX_MATCH, ComparisonOperator.NOT_REGEX)
            .put(BinaryExpression.Operator.STARTS_WITH, ComparisonOperator.STARTS_WITH)
            .put(BinaryExpression.Operator.LESS_THAN, ComparisonOperator.LESS)
            .put(BinaryExpression.Operator.LESS_THAN_OR_EQUAL, ComparisonOperator.LESS_EQUAL)
            .put(BinaryExpression.Operator.GREATER_THAN, ComparisonOperator.GREATER)
            .put(BinaryExpression.Operator.GREATER_THAN_OR_EQUAL, ComparisonOperator.GREATER_EQUAL)
            .build();

    private StoragePredicateTranslator() {}

    public static StoragePredicate toStoragePredicate(Expression expression, String rowParameter)
    {
        return new StoragePredicate(expression.accept(new Visitor(rowParameter), null));
    }

    private static class Visitor
            implements ExpressionVisitor<PredicateNode, Void>
    {
        private final String rowParameter;

        private Visitor(String rowParameter)
        {
            this.rowParameter = requireNonNull(rowParameter, "rowParameter is null");
        }

        @Override
        public PredicateNode visitLogical(LogicalExpression node, Void context)
        {
            PredicateNode left = node.getLeft().accept(this, context);
            PredicateNode right = node.getRight().accept(this, context);
            switch (node.getOperator()) {
                case AND:
                    return PredicateNode.logical(LogicalOperator.AND, left, right);
                case OR:
                    return PredicateNode.logical(LogicalOperator.OR, left, right);
                default:
                    throw new TsplanException(UNSUPPORTED_OPERATOR, "unknown logical operator " + node.getOperator().getValue());
            }
        }

        @Override
        public PredicateNode visitBinary(BinaryExpression node, Void context)
        {
            PredicateNode left = node.getLeft().accept(this, context);
            PredicateNode right = node.getRight().accept(this, context);
            ComparisonOperator operator = COMPARISON_OPERATORS.get(node.getOperator());
            if (operator == null) {
                throw new TsplanException(UNSUPPORTED_OPERATOR, "unknown operator " + node.getOperator().getValue());
            }
            return PredicateNode.comparison(operator, left, right);
        }

        @Override
        public PredicateNode visitMember(MemberExpression node, Void context)
        {
            if (!(node.getObject() instanceof IdentifierExpression) || !((IdentifierExpression) node.getObject()).getName().equals(rowParameter)) {
                throw new TsplanException(UNKNOWN_OBJECT, "unknown object \"" + node.getObject() + "\"");
            }
            switch (node.getProperty()) {
                case FIELD:
                    return PredicateNode.tagRef(FIELD_TAG_KEY);
                case MEASUREMENT:
                    return PredicateNode.tagRef(MEASUREMENT_TAG_KEY);
                case VALUE:
                    return PredicateNode.fieldRef(VALUE_FIELD_KEY);
                default:
                    return PredicateNode.tagRef(node.getProperty());
            }
        }

        @Override
        public PredicateNode visitStringLiteral(StringLiteral node, Void context)
        {
            return PredicateNode.stringLiteral(node.getValue());
        }

        @Override
        public PredicateNode visitIntegerLiteral(IntegerLiteral node, Void context)
        {
            return PredicateNode.integerLiteral(node.getValue());
        }

        @Override
        public PredicateNode visitFloatLiteral(FloatLiteral node, Void context)
        {
            return PredicateNode.floatLiteral(node.getValue());
        }

        @Override
        public PredicateNode visitBooleanLiteral(BooleanLiteral node, Void context)
        {
            return PredicateNode.booleanLiteral(node.getValue());
        }

        @Override
        public PredicateNode visitRegexLiteral(RegexLiteral node, Void context)
        {
            return PredicateNode.regexLiteral(node.getValue());
        }

        @Override
        public PredicateNode visitDurationLiteral(DurationLiteral node, Void context)
        {
            throw new TsplanException(UNSUPPORTED_LITERAL_KIND, "duration literals not supported in storage predicates");
        }

        @Override
        public PredicateNode visitDateTimeLiteral(DateTimeLiteral node, Void context)
        {
            throw new TsplanException(UNSUPPORTED_LITERAL_KIND, "time literals not supported in storage predicates");
        }

        @Override
        public PredicateNode visitUnary(UnaryExpression node, Void context)
        {
            throw unsupported(node);
        }

        @Override
        public PredicateNode visitIdentifier(IdentifierExpression node, Void context)
        {
            throw unsupported(node);
        }

        @Override
        public PredicateNode visitCall(CallExpression node, Void context)
        {
            throw unsupported(node);
        }

        @Override
        public PredicateNode visitFunction(FunctionExpression node, Void context)
        {
            throw unsupported(node);
        }

        private static TsplanException unsupported(Expression node)
        {
            return new TsplanException(UNSUPPORTED_EXPRESSION, "unsupported expression in storage predicate: " + node);
        }
    }
}
