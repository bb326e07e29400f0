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
package io.tsplan.spi.predicate;

import com.facebook.airlift.json.JsonCodec;
import org.testng.annotations.Test;

import static com.facebook.airlift.json.JsonCodec.jsonCodec;
import static io.tsplan.spi.predicate.ComparisonOperator.EQUAL;
import static io.tsplan.spi.predicate.ComparisonOperator.NOT_EQUAL;
import static io.tsplan.spi.predicate.LogicalOperator.AND;
import static io.tsplan.spi.predicate.PredicateNode.comparison;
import static io.tsplan.spi.predicate.PredicateNode.fieldRef;
import static io.tsplan.spi.predicate.PredicateNode.floatLiteral;
import static io.tsplan.spi.predicate.PredicateNode.logical;
import static io.tsplan.spi.predicate.PredicateNode.stringLiteral;
import static io.tsplan.spi.predicate.PredicateNode.tagRef;
import static io.tsplan.spi.predicate.StoragePredicate.MEASUREMENT_TAG_KEY;
import static io.tsplan.spi.predicate.StoragePredicate.VALUE_FIELD_KEY;
import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertFalse;
import static org.testng.Assert.assertThrows;
import static org.testng.Assert.assertTrue;

public class TestStoragePredicate
{
    private static final JsonCodec<StoragePredicate> CODEC = jsonCodec(StoragePredicate.class);

    private static final StoragePredicate PREDICATE = new StoragePredicate(logical(
            AND,
            comparison(EQUAL, tagRef(MEASUREMENT_TAG_KEY), stringLiteral("cpu")),
            comparison(NOT_EQUAL, fieldRef(VALUE_FIELD_KEY), floatLiteral(0.5))));

    @Test
    public void testJsonRoundTrip()
    {
        assertEquals(CODEC.fromJson(CODEC.toJson(PREDICATE)), PREDICATE);
    }

    @Test
    public void testWireNames()
    {
        String json = CODEC.toJson(PREDICATE);
        assertTrue(json.contains("\"nodeType\" : \"LogicalExpression\""), json);
        assertTrue(json.contains("\"logical\" : \"And\""), json);
        assertTrue(json.contains("\"comparison\" : \"NotEqual\""), json);
        assertTrue(json.contains("\"nodeType\" : \"FieldRef\""), json);
        assertTrue(json.contains("\"fieldRefValue\" : \"_value\""), json);
        assertTrue(json.contains("\"floatValue\" : 0.5"), json);
        assertFalse(json.contains("null"), json);
    }

    @Test
    public void testToString()
    {
        assertEquals(PREDICATE.toString(), "(_m == 'cpu' AND $_value != 0.5)");
    }

    @Test
    public void testNodeShape()
    {
        assertThrows(IllegalArgumentException.class, () -> new PredicateNode(NodeType.LITERAL, null, null, null, "a", true, null, null, null, null, null));
        assertThrows(IllegalArgumentException.class, () -> new PredicateNode(NodeType.TAG_REF, null, null, null, "a", null, null, null, null, null, null));
        assertThrows(IllegalArgumentException.class, () -> new PredicateNode(NodeType.COMPARISON_EXPRESSION, null, null, EQUAL, null, null, null, null, null, null, null));
    }

    @Test
    public void testOperatorWireNames()
    {
        for (ComparisonOperator operator : ComparisonOperator.values()) {
            assertEquals(ComparisonOperator.fromWireName(operator.getWireName()), operator);
        }
        assertEquals(LogicalOperator.fromWireName("Or"), LogicalOperator.OR);
        assertThrows(IllegalArgumentException.class, () -> LogicalOperator.fromWireName("Xor"));
    }
}
