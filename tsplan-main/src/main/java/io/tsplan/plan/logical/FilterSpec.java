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
package io.tsplan.plan.logical;

import io.tsplan.expressions.tree.Expression;
import io.tsplan.expressions.tree.FunctionExpression;
import io.tsplan.plan.ProcedureKind;
import io.tsplan.plan.ProcedureSpec;

import static com.google.common.base.MoreObjects.toStringHelper;
import static java.util.Objects.requireNonNull;

/**
 * Row filter given as a one-parameter predicate function, {@code (r) => body}.
 */
public final class FilterSpec
        implements ProcedureSpec
{
    private final FunctionExpression function;

    public FilterSpec(FunctionExpression function)
    {
        this.function = requireNonNull(function, "function is null");
        // validates the arity
        function.getRowParameter();
    }

    public FunctionExpression getFunction()
    {
        return function;
    }

    public String getRowParameter()
    {
        return function.getRowParameter();
    }

    public Expression getBody()
    {
        return function.getBody();
    }

    public FilterSpec withBody(Expression body)
    {
        return new FilterSpec(function.withBody(body));
    }

    @Override
    public ProcedureKind getKind()
    {
        return ProcedureKind.FILTER;
    }

    @Override
    public String getPlanDetails()
    {
        return "fn = " + function;
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return function.equals(((FilterSpec) o).function);
    }

    @Override
    public int hashCode()
    {
        return function.hashCode();
    }

    @Override
    public String toString()
    {
        return toStringHelper(this)
                .add("function", function)
                .toString();
    }
}
