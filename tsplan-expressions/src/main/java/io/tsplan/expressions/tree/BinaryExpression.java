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

import java.util.Objects;

import static java.util.Objects.requireNonNull;

public final class BinaryExpression
        extends Expression
{
    public enum Operator
    {
        EQUAL("==", true),
        NOT_EQUAL("!=", true),
        LESS_THAN("<", true),
        LESS_THAN_OR_EQUAL("<=", true),
        GREATER_THAN(">", true),
        GREATER_THAN_OR_EQUAL(">=", true),
        REGEX_MATCH("=~", true),
        NOT_REGEX_MATCH("!~", true),
        STARTS_WITH("startswith", true),
        ADD("+", false),
        SUBTRACT("-", false),
        MULTIPLY("*", false),
        DIVIDE("/", false),
        MODULO("%", false);

        private final String value;
        private final boolean comparison;

        Operator(String value, boolean comparison)
        {
            this.value = value;
            this.comparison = comparison;
        }

        public String getValue()
        {
            return value;
        }

        public boolean isComparison()
        {
            return comparison;
        }
    }

    private final Operator operator;
    private final Expression left;
    private final Expression right;

    public BinaryExpression(Operator operator, Expression left, Expression right)
    {
        this.operator = requireNonNull(operator, "operator is null");
        this.left = requireNonNull(left, "left is null");
        this.right = requireNonNull(right, "right is null");
    }

    public Operator getOperator()
    {
        return operator;
    }

    public Expression getLeft()
    {
        return left;
    }

    public Expression getRight()
    {
        return right;
    }

    @Override
    public <R, C> R accept(ExpressionVisitor<R, C> visitor, C context)
    {
        return visitor.visitBinary(this, context);
    }

    @Override
    public boolean equals(Object obj)
    {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        BinaryExpression other = (BinaryExpression) obj;
        return operator == other.operator &&
                left.equals(other.left) &&
                right.equals(other.right);
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(operator, left, right);
    }
}
