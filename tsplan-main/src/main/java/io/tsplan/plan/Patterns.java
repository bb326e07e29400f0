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
package io.tsplan.plan;

import com.facebook.presto.matching.Pattern;
import com.facebook.presto.matching.Property;
import com.google.common.collect.ImmutableSet;

import java.util.Optional;
import java.util.Set;

import static com.facebook.presto.matching.Pattern.typeOf;
import static com.facebook.presto.matching.Property.optionalProperty;
import static com.facebook.presto.matching.Property.property;
import static io.tsplan.plan.ProcedureKind.DISTINCT;
import static io.tsplan.plan.ProcedureKind.DUPLICATE;
import static io.tsplan.plan.ProcedureKind.FILTER;
import static io.tsplan.plan.ProcedureKind.FROM;
import static io.tsplan.plan.ProcedureKind.GROUP;
import static io.tsplan.plan.ProcedureKind.KEEP;
import static io.tsplan.plan.ProcedureKind.KEYS;
import static io.tsplan.plan.ProcedureKind.RANGE;
import static io.tsplan.plan.ProcedureKind.READ_GROUP;
import static io.tsplan.plan.ProcedureKind.READ_RANGE;
import static io.tsplan.plan.ProcedureKind.READ_WINDOW_AGGREGATE;
import static io.tsplan.plan.ProcedureKind.WINDOW;

/**
 * Patterns over plan nodes. The {@link #source()} property yields a node id;
 * a {@code PlanNodeMatcher} resolves it against the plan before matching the
 * nested pattern.
 */
public final class Patterns
{
    private Patterns() {}

    public static Pattern<PlanNode> node(ProcedureKind kind)
    {
        return typeOf(PlanNode.class).with(kind().equalTo(kind));
    }

    public static Pattern<PlanNode> anyNode(Set<ProcedureKind> kinds)
    {
        Set<ProcedureKind> expected = ImmutableSet.copyOf(kinds);
        return typeOf(PlanNode.class).matching(node -> expected.contains(node.getKind()));
    }

    public static Pattern<PlanNode> from()
    {
        return node(FROM);
    }

    public static Pattern<PlanNode> range()
    {
        return node(RANGE);
    }

    public static Pattern<PlanNode> filter()
    {
        return node(FILTER);
    }

    public static Pattern<PlanNode> group()
    {
        return node(GROUP);
    }

    public static Pattern<PlanNode> window()
    {
        return node(WINDOW);
    }

    public static Pattern<PlanNode> duplicate()
    {
        return node(DUPLICATE);
    }

    public static Pattern<PlanNode> keep()
    {
        return node(KEEP);
    }

    public static Pattern<PlanNode> keys()
    {
        return node(KEYS);
    }

    public static Pattern<PlanNode> distinct()
    {
        return node(DISTINCT);
    }

    public static Pattern<PlanNode> readRange()
    {
        return node(READ_RANGE);
    }

    public static Pattern<PlanNode> readGroup()
    {
        return node(READ_GROUP);
    }

    public static Pattern<PlanNode> readWindowAggregate()
    {
        return node(READ_WINDOW_AGGREGATE);
    }

    public static Property<PlanNode, ProcedureKind> kind()
    {
        return property("kind", PlanNode::getKind);
    }

    public static Property<PlanNode, PlanNodeId> source()
    {
        return optionalProperty("source", node -> node.getSources().size() == 1 ?
                Optional.of(node.getSources().get(0)) :
                Optional.empty());
    }
}
