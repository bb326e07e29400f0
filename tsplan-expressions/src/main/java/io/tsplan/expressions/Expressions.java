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

import com.google.common.collect.ImmutableList;
import io.tsplan.expressions.tree.BinaryExpression;
import io.tsplan.expressions.tree.BooleanLiteral;
import io.tsplan.expressions.tree.CallExpression;
import io.tsplan.expressions.tree.DateTimeLiteral;
import io.tsplan.expressions.tree.DurationLiteral;
import io.tsplan.expressions.tree.Expression;
import io.tsplan.expressions.tree.FloatLiteral;
import io.tsplan.expressions.tree.FunctionExpression;
import io.tsplan.expressions.tree.IdentifierExpression;
import io.tsplan.expressions.tree.IntegerLiteral;
import io.tsplan.expressions.tree.LogicalExpression;
import io.tsplan.expressions.tree.MemberExpression;
import io.tsplan.expressions.tree.RegexLiteral;
import io.tsplan.expressions.tree.StringLiteral;
import io.tsplan.expressions.tree.UnaryExpression;
import io.tsplan.spi.type.CalendarDuration;

import java.time.Instant;

import static io.tsplan.expressions.tree.BinaryExpression.Operator.EQUAL;
import static io.tsplan.expressions.tree.BinaryExpression.Operator.GREATER_THAN;
import static io.tsplan.expressions.tree.BinaryExpression.Operator.LESS_THAN;
import static io.tsplan.expressions.tree.BinaryExpression.Operator.NOT_EQUAL;
import static io.tsplan.expressions.tree.BinaryExpression.Operator.NOT_REGEX_MATCH;
import static io.tsplan.expressions.tree.BinaryExpression.Operator.REGEX_MATCH;

/**
 * Static factories for building expression trees in code.
 */
public final class Expressions
{
    private Expressions() {}

    public static FunctionExpression function(String parameter, Expression body)
    {
        return new FunctionExpression(ImmutableList.of(parameter), body);
    }

    public static IdentifierExpression identifier(String name)
    {
        return new IdentifierExpression(name);
    }

    public static MemberExpression member(String object, String property)
    {
        return new MemberExpression(identifier(object), property);
    }

    public static StringLiteral string(String value)
    {
        return new StringLiteral(value);
    }

    public static IntegerLiteral integer(long value)
    {
        return new IntegerLiteral(value);
    }

    public static FloatLiteral floating(double value)
    {
        return new FloatLiteral(value);
    }

    public static BooleanLiteral bool(boolean value)
    {
        return new BooleanLiteral(value);
    }

    public static RegexLiteral regex(String pattern)
    {
        return new RegexLiteral(pattern);
    }

    public static DurationLiteral duration(String value)
    {
        return new DurationLiteral(CalendarDuration.parse(value));
    }

    public static DateTimeLiteral dateTime(Instant value)
    {
        return new DateTimeLiteral(value);
    }

    public static BinaryExpression comparison(BinaryExpression.Operator operator, Expression left, Expression right)
    {
        return new BinaryExpression(operator, left, right);
    }

    public static BinaryExpression equal(Expression left, Expression right)
    {
        return comparison(EQUAL, left, right);
    }

    public static BinaryExpression notEqual(Expression left, Expression right)
    {
        return comparison(NOT_EQUAL, left, right);
    }

    public static BinaryExpression lessThan(Expression left, Expression right)
    {
        return comparison(LESS_THAN, left, right);
    }

    public static BinaryExpression greaterThan(Expression left, Expression right)
    {
        return comparison(GREATER_THAN, left, right);
    }

    public static BinaryExpression regexMatch(Expression left, Expression right)
    {
        return comparison(REGEX_MATCH, left, right);
    }

    public static BinaryExpression notRegexMatch(Expression left, Expression right)
    {
        return comparison(NOT_REGEX_MATCH, left, right);
    }

    public static LogicalExpression and(Expression left, Expression right)
    {
        return new LogicalExpression(LogicalExpression.Operator.AND, left, right);
    }

    public static LogicalExpression or(Expression left, Expression right)
    {
        return new LogicalExpression(LogicalExpression.Operator.OR, left, right);
    }

    public static UnaryExpression not(Expression argument)
    {
        return new UnaryExpression(UnaryExpression.Operator.NOT, argument);
    }

    public static UnaryExpression exists(Expression argument)
    {
        return new UnaryExpression(UnaryExpression.Operator.EXISTS, argument);
    }

    public static CallExpression call(String function, Expression... arguments)
    {
        return new CallExpression(function, ImmutableList.copyOf(arguments));
    }
}
