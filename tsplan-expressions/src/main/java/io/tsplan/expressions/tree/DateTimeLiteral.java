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

import java.time.Instant;

import static java.util.Objects.requireNonNull;

public final class DateTimeLiteral
        extends Literal
{
    private final Instant value;

    public DateTimeLiteral(Instant value)
    {
        this.value = requireNonNull(value, "value is null");
    }

    @Override
    public Instant getValue()
    {
        return value;
    }

    @Override
    public <R, C> R accept(ExpressionVisitor<R, C> visitor, C context)
    {
        return visitor.visitDateTimeLiteral(this, context);
    }
}
