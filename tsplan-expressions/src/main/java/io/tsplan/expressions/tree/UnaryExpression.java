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

public final class UnaryExpression
        extends Expression
{
    public enum Operator
    {
        NOT("not"),
        EXISTS("exists"),
        NEGATE("-");

        private final String value;

        Operator(String value)
        {
            this.value = value;
        }

        public String getValue()
        {
            return value;
        }
    }

    private final Operator operator;
    private final Expression argument;

    public UnaryExpression(Operator operator, Expression argument)
    {
        this.operator = requireNonNull(operator, "operator is null");
        this.argument = requireNonNull(argument, "argument is null");
    }

    public Operator getOperator()
    {
        return operator;
    }

    public Expression getArgument()
    {
        return argument;
    }

    @Override
    public <R, C> R accept(ExpressionVisitor<R, C> visitor, C context)
    {
        return visitor.visitUnary(this, context);
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
        UnaryExpression other = (UnaryExpression) obj;
        return operator == other.operator &&
                argument.equals(other.argument);
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(operator, argument);
    }
}
