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

/**
 * Property access {@code object.property}, e.g. {@code r._value}.
 */
public final class MemberExpression
        extends Expression
{
    private final Expression object;
    private final String property;

    public MemberExpression(Expression object, String property)
    {
        this.object = requireNonNull(object, "object is null");
        this.property = requireNonNull(property, "property is null");
    }

    public Expression getObject()
    {
        return object;
    }

    public String getProperty()
    {
        return property;
    }

    @Override
    public <R, C> R accept(ExpressionVisitor<R, C> visitor, C context)
    {
        return visitor.visitMember(this, context);
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
        MemberExpression other = (MemberExpression) obj;
        return object.equals(other.object) &&
                property.equals(other.property);
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(object, property);
    }
}
