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
import io.tsplan.expressions.tree.LogicalExpression;
import io.tsplan.expressions.tree.MemberExpression;
import io.tsplan.expressions.tree.RegexLiteral;
import io.tsplan.expressions.tree.StringLiteral;
import io.tsplan.expressions.tree.UnaryExpression;

import java.util.regex.Pattern;

import static java.util.stream.Collectors.joining;

/**
 * Renders expressions back to query-language text.
 */
public final class ExpressionFormatter
{
    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private ExpressionFormatter() {}

    public static String formatExpression(Expression expression)
    {
        return expression.accept(new Formatter(), null);
    }

    private static String formatStringLiteral(String value)
    {
        return "\"" + value.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
    }

    private static class Formatter
            implements ExpressionVisitor<String, Void>
    {
        @Override
        public String visitLogical(LogicalExpression node, Void context)
        {
            String left = node.getLeft().accept(this, context);
            if (node.getLeft() instanceof LogicalExpression && ((LogicalExpression) node.getLeft()).getOperator() != node.getOperator()) {
                left = "(" + left + ")";
            }
            String right = node.getRight().accept(this, context);
            if (node.getRight() instanceof LogicalExpression) {
                right = "(" + right + ")";
            }
            return left + " " + node.getOperator().getValue() + " " + right;
        }

        @Override
        public String visitBinary(BinaryExpression node, Void context)
        {
            return formatOperand(node.getLeft()) + " " + node.getOperator().getValue() + " " + formatOperand(node.getRight());
        }

        @Override
        public String visitUnary(UnaryExpression node, Void context)
        {
            String argument = formatOperand(node.getArgument());
            if (node.getOperator() == UnaryExpression.Operator.NEGATE) {
                return "-" + argument;
            }
            return node.getOperator().getValue() + " " + argument;
        }

        @Override
        public String visitMember(MemberExpression node, Void context)
        {
            String object = node.getObject().accept(this, context);
            if (IDENTIFIER.matcher(node.getProperty()).matches()) {
                return object + "." + node.getProperty();
            }
            return object + "[" + formatStringLiteral(node.getProperty()) + "]";
        }

        @Override
        public String visitIdentifier(IdentifierExpression node, Void context)
        {
            return node.getName();
        }

        @Override
        public String visitStringLiteral(StringLiteral node, Void context)
        {
            return formatStringLiteral(node.getValue());
        }

        @Override
        public String visitIntegerLiteral(IntegerLiteral node, Void context)
        {
            return String.valueOf(node.getValue());
        }

        @Override
        public String visitFloatLiteral(FloatLiteral node, Void context)
        {
            return String.valueOf(node.getValue());
        }

        @Override
        public String visitBooleanLiteral(BooleanLiteral node, Void context)
        {
            return String.valueOf(node.getValue());
        }

        @Override
        public String visitRegexLiteral(RegexLiteral node, Void context)
        {
            return "/" + node.getValue().replace("/", "\\/") + "/";
        }

        @Override
        public String visitDurationLiteral(DurationLiteral node, Void context)
        {
            return node.getValue().toString();
        }

        @Override
        public String visitDateTimeLiteral(DateTimeLiteral node, Void context)
        {
            return node.getValue().toString();
        }

        @Override
        public String visitCall(CallExpression node, Void context)
        {
            return node.getFunction() + node.getArguments().stream()
                    .map(argument -> argument.accept(this, context))
                    .collect(joining(", ", "(", ")"));
        }

        @Override
        public String visitFunction(FunctionExpression node, Void context)
        {
            return "(" + String.join(", ", node.getParameters()) + ") => " + node.getBody().accept(this, context);
        }

        private String formatOperand(Expression operand)
        {
            String formatted = operand.accept(this, null);
            if (operand instanceof LogicalExpression || operand instanceof BinaryExpression) {
                return "(" + formatted + ")";
            }
            return formatted;
        }
    }
}
