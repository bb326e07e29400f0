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

import io.tsplan.expressions.tree.Expression;
import io.tsplan.expressions.tree.LogicalExpression;

import java.util.Optional;

import static io.tsplan.expressions.tree.LogicalExpression.Operator.AND;
import static java.util.Objects.requireNonNull;

/**
 * Splits a filter body along its {@code and} nodes into the part storage can
 * evaluate and the remainder the query engine keeps. Every other node is
 * atomic. Both parts keep the original nesting and operand order.
 */
public final class FilterSplitter
{
    private FilterSplitter() {}

    public static FilterSplit split(Expression body, String rowParameter, PredicateScope scope)
    {
        if (body instanceof LogicalExpression && ((LogicalExpression) body).getOperator() == AND) {
            LogicalExpression and = (LogicalExpression) body;
            FilterSplit left = split(and.getLeft(), rowParameter, scope);
            FilterSplit right = split(and.getRight(), rowParameter, scope);
            return new FilterSplit(
                    combine(left.getPushable(), right.getPushable()),
                    combine(left.getRemainder(), right.getRemainder()));
        }
        if (PushablePredicates.isPushable(body, rowParameter, scope)) {
            return new FilterSplit(Optional.of(body), Optional.empty());
        }
        return new FilterSplit(Optional.empty(), Optional.of(body));
    }

    private static Optional<Expression> combine(Optional<Expression> left, Optional<Expression> right)
    {
        if (left.isPresent() && right.isPresent()) {
            return Optional.of(new LogicalExpression(AND, left.get(), right.get()));
        }
        return left.isPresent() ? left : right;
    }

    public static final class FilterSplit
    {
        private final Optional<Expression> pushable;
        private final Optional<Expression> remainder;

        public FilterSplit(Optional<Expression> pushable, Optional<Expression> remainder)
        {
            this.pushable = requireNonNull(pushable, "pushable is null");
            this.remainder = requireNonNull(remainder, "remainder is null");
        }

        public Optional<Expression> getPushable()
        {
            return pushable;
        }

        public Optional<Expression> getRemainder()
        {
            return remainder;
        }
    }
}
