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
import io.tsplan.spi.TsplanException;
import io.tsplan.spi.predicate.ComparisonOperator;
import io.tsplan.spi.predicate.PredicateNode;
import org.testng.annotations.Test;

import java.time.Instant;

import static io.tsplan.PushdownErrorCode.UNKNOWN_OBJECT;
import static io.tsplan.PushdownErrorCode.UNSUPPORTED_EXPRESSION;
import static io.tsplan.PushdownErrorCode.UNSUPPORTED_LITERAL_KIND;
import static io.tsplan.PushdownErrorCode.UNSUPPORTED_OPERATOR;
import static io.tsplan.expressions.Expressions.and;
import static io.tsplan.expressions.Expressions.bool;
import static io.tsplan.expressions.Expressions.call;
import static io.tsplan.expressions.Expressions.comparison;
import static io.tsplan.expressions.Expressions.dateTime;
import static io.tsplan.expressions.Expressions.duration;
import static io.tsplan.expressions.Expressions.equal;
import static io.tsplan.expressions.Expressions.exists;
import static io.tsplan.expressions.Expressions.greaterThan;
import static io.tsplan.expressions.Expressions.integer;
import static io.tsplan.expressions.Expressions.lessThan;
import static io.tsplan.expressions.Expressions.member;
import static io.tsplan.expressions.Expressions.notRegexMatch;
import static io.tsplan.expressions.Expressions.or;
import static io.tsplan.expressions.Expressions.regex;
import static io.tsplan.expressions.Expressions.string;
import static io.tsplan.expressions.tree.BinaryExpression.Operator.ADD;
import static io.tsplan.expressions.tree.BinaryExpression.Operator.STARTS_WITH;
import static io.tsplan.predicate.StoragePredicateTranslator.toStoragePredicate;
import static io.tsplan.spi.predicate.ComparisonOperator.EQUAL;
import static io.tsplan.spi.predicate.ComparisonOperator.GREATER;
import static io.tsplan.spi.predicate.ComparisonOperator.LESS;
import static io.tsplan.spi.predicate.ComparisonOperator.NOT_REGEX;
import static io.tsplan.spi.predicate.LogicalOperator.AND;
import static io.tsplan.spi.predicate.LogicalOperator.OR;
import static io.tsplan.spi.predicate.PredicateNode.booleanLiteral;
import static io.tsplan.spi.predicate.PredicateNode.fieldRef;
import static io.tsplan.spi.predicate.PredicateNode.integerLiteral;
import static io.tsplan.spi.predicate.PredicateNode.logical;
import static io.tsplan.spi.predicate.PredicateNode.regexLiteral;
import static io.tsplan.spi.predicate.PredicateNode.stringLiteral;
import static io.tsplan.spi.predicate.PredicateNode.tagRef;
import static io.tsplan.spi.predicate.StoragePredicate.FIELD_TAG_KEY;
import static io.tsplan.spi.predicate.StoragePredicate.MEASUREMENT_TAG_KEY;
import static org.testng.Assert.assertEquals;
import static org.testng.Assert.fail;

public class TestStoragePredicateTranslator
{
    @Test
    public void testWellKnownKeys()
    {
        assertTranslation(equal(member("r", "_measurement"), string("cpu")), PredicateNode.comparison(EQUAL, tagRef(MEASUREMENT_TAG_KEY), stringLiteral("cpu")));
        assertTranslation(equal(member("r", "_field"), string("usage")), PredicateNode.comparison(EQUAL, tagRef(FIELD_TAG_KEY), stringLiteral("usage")));
        assertTranslation(equal(member("r", "_value"), integer(3)), PredicateNode.comparison(EQUAL, fieldRef("_value"), integerLiteral(3)));
        assertTranslation(equal(member("r", "host"), bool(true)), PredicateNode.comparison(EQUAL, tagRef("host"), booleanLiteral(true)));
    }

    @Test
    public void testOperators()
    {
        assertTranslation(lessThan(member("r", "_value"), integer(3)), PredicateNode.comparison(LESS, fieldRef("_value"), integerLiteral(3)));
        assertTranslation(greaterThan(member("r", "_value"), integer(3)), PredicateNode.comparison(GREATER, fieldRef("_value"), integerLiteral(3)));
        assertTranslation(notRegexMatch(member("r", "host"), regex("^a.*")), PredicateNode.comparison(NOT_REGEX, tagRef("host"), regexLiteral("^a.*")));
    }

    @Test
    public void testLogicalExpressions()
    {
        assertTranslation(
                and(equal(member("r", "a"), string("1")), or(equal(member("r", "b"), string("2")), equal(member("r", "c"), string("3")))),
                logical(
                        AND,
                        PredicateNode.comparison(EQUAL, tagRef("a"), stringLiteral("1")),
                        logical(
                                OR,
                                PredicateNode.comparison(EQUAL, tagRef("b"), stringLiteral("2")),
                                PredicateNode.comparison(EQUAL, tagRef("c"), stringLiteral("3")))));
    }

    @Test
    public void testStartsWith()
    {
        assertTranslation(
                comparison(STARTS_WITH, member("r", "host"), string("web")),
                PredicateNode.comparison(ComparisonOperator.STARTS_WITH, tagRef("host"), stringLiteral("web")));
    }

    @Test
    public void testErrors()
    {
        assertFailure(comparison(ADD, member("r", "_value"), integer(1)), UNSUPPORTED_OPERATOR.toErrorCode().getName(), "unknown operator +");
        assertFailure(equal(member("x", "host"), string("a")), UNKNOWN_OBJECT.toErrorCode().getName(), "unknown object \"x\"");
        assertFailure(equal(member("r", "_value"), duration("1m")), UNSUPPORTED_LITERAL_KIND.toErrorCode().getName(), "duration literals not supported in storage predicates");
        assertFailure(equal(member("r", "_time"), dateTime(Instant.EPOCH)), UNSUPPORTED_LITERAL_KIND.toErrorCode().getName(), "time literals not supported in storage predicates");
        assertFailure(exists(member("r", "host")), UNSUPPORTED_EXPRESSION.toErrorCode().getName(), null);
        assertFailure(equal(call("strings.toUpper", member("r", "host")), string("A")), UNSUPPORTED_EXPRESSION.toErrorCode().getName(), null);
    }

    private static void assertTranslation(Expression expression, PredicateNode expected)
    {
        assertEquals(toStoragePredicate(expression, "r").getRoot(), expected);
    }

    private static void assertFailure(Expression expression, String errorCode, String message)
    {
        try {
            toStoragePredicate(expression, "r");
            fail("expected translation of " + expression + " to fail");
        }
        catch (TsplanException e) {
            assertEquals(e.getErrorCode().getName(), errorCode);
            if (message != null) {
                assertEquals(e.getMessage(), message);
            }
        }
    }
}
