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

import static java.util.Objects.requireNonNull;

/**
 * Regular expression literal, kept as its source pattern text.
 */
public final class RegexLiteral
        extends Literal
{
    private final String value;

    public RegexLiteral(String value)
    {
        this.value = requireNonNull(value, "pattern is null");
    }

    @Override
    public String getValue()
    {
        return value;
    }

    @Override
    public <R, C> R accept(ExpressionVisitor<R, C> visitor, C context)
    {
        return visitor.visitRegexLiteral(this, context);
    }
}
