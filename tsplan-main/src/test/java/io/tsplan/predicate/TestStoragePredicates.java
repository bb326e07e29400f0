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

import com.google.common.collect.ImmutableList;
import io.tsplan.spi.predicate.StoragePredicate;
import org.testng.annotations.Test;

import static io.tsplan.predicate.StoragePredicates.merge;
import static io.tsplan.spi.predicate.ComparisonOperator.EQUAL;
import static io.tsplan.spi.predicate.LogicalOperator.AND;
import static io.tsplan.spi.predicate.LogicalOperator.OR;
import static io.tsplan.spi.predicate.PredicateNode.comparison;
import static io.tsplan.spi.predicate.PredicateNode.logical;
import static io.tsplan.spi.predicate.PredicateNode.stringLiteral;
import static io.tsplan.spi.predicate.PredicateNode.tagRef;
import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertSame;

public class TestStoragePredicates
{
    private static final StoragePredicate A = tagEquals("a");
    private static final StoragePredicate B = tagEquals("b");
    private static final StoragePredicate C = tagEquals("c");

    @Test
    public void testSingle()
    {
        assertSame(merge(AND, ImmutableList.of(A)).getRoot(), A.getRoot());
    }

    @Test
    public void testNestsToTheRight()
    {
        assertEquals(
                merge(AND, ImmutableList.of(A, B, C)).getRoot(),
                logical(AND, A.getRoot(), logical(AND, B.getRoot(), C.getRoot())));
        assertEquals(
                merge(OR, ImmutableList.of(A, B)).getRoot(),
                logical(OR, A.getRoot(), B.getRoot()));
    }

    @Test(expectedExceptions = IllegalArgumentException.class, expectedExceptionsMessageRegExp = "at least one predicate is needed")
    public void testEmpty()
    {
        merge(AND, ImmutableList.of());
    }

    private static StoragePredicate tagEquals(String tag)
    {
        return new StoragePredicate(comparison(EQUAL, tagRef(tag), stringLiteral("x")));
    }
}
