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

import io.tsplan.expressions.tree.Expression;
import io.tsplan.expressions.tree.Literal;
import io.tsplan.expressions.tree.MemberExpression;
import io.tsplan.expressions.tree.StringLiteral;
import org.testng.annotations.Test;

import java.util.HashSet;
import java.util.Set;

import static io.tsplan.expressions.Expressions.and;
import static io.tsplan.expressions.Expressions.equal;
import static io.tsplan.expressions.Expressions.function;
import static io.tsplan.expressions.Expressions.member;
import static io.tsplan.expressions.Expressions.not;
import static io.tsplan.expressions.Expressions.string;
import static io.tsplan.expressions.ExpressionTreeRewriter.rewriteWith;
import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertSame;

public class TestExpressionTreeRewriter
{
    private static final ExpressionRewriter<Void> UPPER_CASE_STRINGS = new ExpressionRewriter<Void>()
    {
        @Override
        public Expression rewriteLiteral(Literal node, Void context, ExpressionTreeRewriter<Void> treeRewriter)
        {
            if (node instanceof StringLiteral) {
                return string(((StringLiteral) node).getValue().toUpperCase());
            }
            return null;
        }
    };

    @Test
    public void testRewrite()
    {
        Expression expression = and(equal(member("r", "host"), string("a")), not(equal(member("r", "dc"), string("b"))));
        assertEquals(
                rewriteWith(UPPER_CASE_STRINGS, expression),
                and(equal(member("r", "host"), string("A")), not(equal(member("r", "dc"), string("B")))));
        assertEquals(
                rewriteWith(UPPER_CASE_STRINGS, function("r", expression)),
                function("r", and(equal(member("r", "host"), string("A")), not(equal(member("r", "dc"), string("B"))))));
    }

    @Test
    public void testUnchangedTreeIsReused()
    {
        Expression expression = and(equal(member("r", "host"), member("r", "dc")), not(member("r", "x")));
        assertSame(rewriteWith(UPPER_CASE_STRINGS, expression), expression);
    }

    @Test
    public void testTraversal()
    {
        Set<String> properties = new HashSet<>();
        and(equal(member("r", "host"), string("a")), not(equal(member("r", "dc"), string("b"))))
                .accept(new DefaultExpressionTraversalVisitor<Set<String>>()
                {
                    @Override
                    public Void visitMember(MemberExpression node, Set<String> context)
                    {
                        context.add(node.getProperty());
                        return super.visitMember(node, context);
                    }
                }, properties);
        assertEquals(properties, Set.of("host", "dc"));
    }
}
