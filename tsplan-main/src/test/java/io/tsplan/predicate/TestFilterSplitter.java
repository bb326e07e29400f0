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
import io.tsplan.predicate.FilterSplitter.FilterSplit;
import org.testng.annotations.Test;

import java.util.Optional;

import static io.tsplan.expressions.Expressions.and;
import static io.tsplan.expressions.Expressions.call;
import static io.tsplan.expressions.Expressions.equal;
import static io.tsplan.expressions.Expressions.floating;
import static io.tsplan.expressions.Expressions.greaterThan;
import static io.tsplan.expressions.Expressions.member;
import static io.tsplan.expressions.Expressions.or;
import static io.tsplan.expressions.Expressions.string;
import static io.tsplan.predicate.FilterSplitter.split;
import static io.tsplan.predicate.PredicateScope.ALL_COLUMNS;
import static io.tsplan.predicate.PredicateScope.TAG_COLUMNS;
import static org.testng.Assert.assertEquals;

public class TestFilterSplitter
{
    private static final Expression MEASUREMENT = equal(member("r", "_measurement"), string("cpu"));
    private static final Expression FIELD = equal(member("r", "_field"), string("usage_idle"));
    private static final Expression VALUE_EQUALS = equal(member("r", "_value"), floating(1.0));
    private static final Expression VALUE_ABOVE = greaterThan(member("r", "_value"), floating(1.0));
    private static final Expression CALL = equal(call("strings.toUpper", member("r", "host")), string("A"));

    @Test
    public void testFullyPushable()
    {
        assertSplit(split(and(MEASUREMENT, FIELD), "r", ALL_COLUMNS), Optional.of(and(MEASUREMENT, FIELD)), Optional.empty());
    }

    @Test
    public void testNothingPushable()
    {
        assertSplit(split(and(VALUE_ABOVE, CALL), "r", ALL_COLUMNS), Optional.empty(), Optional.of(and(VALUE_ABOVE, CALL)));
    }

    @Test
    public void testKeepsConjunctOrder()
    {
        Expression body = and(and(MEASUREMENT, VALUE_ABOVE), and(CALL, FIELD));
        assertSplit(split(body, "r", ALL_COLUMNS), Optional.of(and(MEASUREMENT, FIELD)), Optional.of(and(VALUE_ABOVE, CALL)));
    }

    @Test
    public void testDisjunctionIsAtomic()
    {
        Expression body = or(MEASUREMENT, VALUE_ABOVE);
        assertSplit(split(body, "r", ALL_COLUMNS), Optional.empty(), Optional.of(body));
        assertSplit(split(or(MEASUREMENT, FIELD), "r", ALL_COLUMNS), Optional.of(or(MEASUREMENT, FIELD)), Optional.empty());
    }

    @Test
    public void testTagScope()
    {
        assertSplit(split(and(MEASUREMENT, VALUE_EQUALS), "r", ALL_COLUMNS), Optional.of(and(MEASUREMENT, VALUE_EQUALS)), Optional.empty());
        assertSplit(split(and(MEASUREMENT, VALUE_EQUALS), "r", TAG_COLUMNS), Optional.of(MEASUREMENT), Optional.of(VALUE_EQUALS));
    }

    private static void assertSplit(FilterSplit split, Optional<Expression> pushable, Optional<Expression> remainder)
    {
        assertEquals(split.getPushable(), pushable);
        assertEquals(split.getRemainder(), remainder);
    }
}
