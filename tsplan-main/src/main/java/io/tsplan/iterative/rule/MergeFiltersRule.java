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

import com.facebook.presto.matching.Capture;
import com.facebook.presto.matching.Captures;
import com.facebook.presto.matching.Pattern;
import io.tsplan.expressions.tree.LogicalExpression;
import io.tsplan.iterative.Rule;
import io.tsplan.plan.PlanNode;
import io.tsplan.plan.logical.FilterSpec;

import static com.facebook.presto.matching.Capture.newCapture;
import static io.tsplan.expressions.tree.LogicalExpression.Operator.AND;
import static io.tsplan.plan.Patterns.filter;
import static io.tsplan.plan.Patterns.source;

/**
 * Merges two adjacent filters into one whose body is
 * {@code downstream and upstream}.
 */
public class MergeFiltersRule
        implements Rule<PlanNode>
{
    private static final Capture<PlanNode> UPSTREAM = newCapture();

    private static final Pattern<PlanNode> PATTERN = filter()
            .with(source().matching(filter().capturedAs(UPSTREAM)));

    @Override
    public Pattern<PlanNode> getPattern()
    {
        return PATTERN;
    }

    @Override
    public Result apply(PlanNode downstream, Captures captures, Context context)
    {
        PlanNode upstream = captures.get(UPSTREAM);
        FilterSpec downstreamFilter = downstream.getSpec(FilterSpec.class);
        FilterSpec upstreamFilter = upstream.getSpec(FilterSpec.class);
        if (!context.getLookup().hasSingleSuccessor(upstream) ||
                !downstreamFilter.getRowParameter().equals(upstreamFilter.getRowParameter())) {
            return Result.empty();
        }

        FilterSpec merged = upstreamFilter.withBody(new LogicalExpression(AND, downstreamFilter.getBody(), upstreamFilter.getBody()));
        return Result.ofPlanNode(new PlanNode(context.getIdAllocator().getNextId(), merged, upstream.getSources()));
    }
}
