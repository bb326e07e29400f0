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

import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Objects;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/**
 * Function literal {@code (r) => body}. Row predicates bind exactly one
 * parameter, the row variable.
 */
public final class FunctionExpression
        extends Expression
{
    private final List<String> parameters;
    private final Expression body;

    public FunctionExpression(List<String> parameters, Expression body)
    {
        this.parameters = ImmutableList.copyOf(requireNonNull(parameters, "parameters is null"));
        this.body = requireNonNull(body, "body is null");
    }

    public List<String> getParameters()
    {
        return parameters;
    }

    public Expression getBody()
    {
        return body;
    }

    public String getRowParameter()
    {
        checkArgument(parameters.size() == 1, "expected a single row parameter, found %s", parameters);
        return parameters.get(0);
    }

    public FunctionExpression withBody(Expression body)
    {
        return new FunctionExpression(parameters, body);
    }

    @Override
    public <R, C> R accept(ExpressionVisitor<R, C> visitor, C context)
    {
        return visitor.visitFunction(this, context);
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
        FunctionExpression other = (FunctionExpression) obj;
        return parameters.equals(other.parameters) &&
                body.equals(other.body);
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(parameters, body);
    }
}
