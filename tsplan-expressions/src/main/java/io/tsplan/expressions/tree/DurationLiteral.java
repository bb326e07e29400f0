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

import io.tsplan.spi.type.CalendarDuration;

import static java.util.Objects.requireNonNull;

public final class DurationLiteral
        extends Literal
{
    private final CalendarDuration value;

    public DurationLiteral(CalendarDuration value)
    {
        this.value = requireNonNull(value, "value is null");
    }

    @Override
    public CalendarDuration getValue()
    {
        return value;
    }

    @Override
    public <R, C> R accept(ExpressionVisitor<R, C> visitor, C context)
    {
        return visitor.visitDurationLiteral(this, context);
    }
}
