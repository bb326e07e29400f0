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
package io.tsplan.iterative.rule;

import com.google.common.collect.ImmutableSet;
import io.tsplan.plan.Lookup;
import io.tsplan.plan.PlanNode;
import io.tsplan.plan.ProcedureKind;
import io.tsplan.plan.logical.AggregateSpec;
import io.tsplan.plan.logical.WindowSpec;

import java.util.Set;

import static io.tsplan.plan.ProcedureKind.COUNT;
import static io.tsplan.plan.ProcedureKind.FIRST;
import static io.tsplan.plan.ProcedureKind.LAST;
import static io.tsplan.plan.ProcedureKind.MAX;
import static io.tsplan.plan.ProcedureKind.MIN;
import static io.tsplan.plan.ProcedureKind.SUM;

/**
 * Conditions shared by the rules that move windowed aggregation into storage.
 */
final class WindowAggregates
{
    /**
     * Aggregates storage can compute per window.
     */
    static final Set<ProcedureKind> WINDOW_AGGREGATES = ImmutableSet.of(MIN, MAX, FIRST, LAST, COUNT, SUM);

    private WindowAggregates() {}

    /**
     * Tumbling windows over the default time columns, with a positive
     * {@code every} and a non-negative offset.
     */
    static boolean canPushWindow(WindowSpec window)
    {
        return window.getEvery().isPositive() &&
                window.getPeriod().equals(window.getEvery()) &&
                !window.getOffset().isNegative() &&
                window.hasDefaultColumns();
    }

    static boolean canPushAggregate(PlanNode aggregate)
    {
        return aggregate.getSpec(AggregateSpec.class).isOverValueColumn();
    }

    /**
     * Whether every given node feeds only the next node of the chain, so
     * that collapsing the chain hides no output from another reader.
     */
    static boolean isLinearChain(Lookup lookup, PlanNode... upstreamNodes)
    {
        for (PlanNode node : upstreamNodes) {
            if (!lookup.hasSingleSuccessor(node)) {
                return false;
            }
        }
        return true;
    }
}
