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
import io.tsplan.iterative.Rule;
import io.tsplan.plan.PlanNode;
import io.tsplan.plan.logical.WindowSpec;
import io.tsplan.plan.physical.ReadRangeSpec;
import io.tsplan.plan.physical.ReadWindowAggregateSpec;

import static com.facebook.presto.matching.Capture.newCapture;
import static io.tsplan.iterative.rule.WindowAggregates.WINDOW_AGGREGATES;
import static io.tsplan.iterative.rule.WindowAggregates.canPushAggregate;
import static io.tsplan.iterative.rule.WindowAggregates.canPushWindow;
import static io.tsplan.iterative.rule.WindowAggregates.isLinearChain;
import static io.tsplan.plan.Patterns.anyNode;
import static io.tsplan.plan.Patterns.readRange;
import static io.tsplan.plan.Patterns.source;
import static io.tsplan.plan.Patterns.window;

/**
 * Replaces {@code ReadRange |> window |> aggregate} with a windowed aggregate
 * computed by storage. {@code mean} is left alone.
 */
public class PushDownWindowAggregateRule
        implements Rule<PlanNode>
{
    private static final Capture<PlanNode> WINDOW = newCapture();
    private static final Capture<PlanNode> READ = newCapture();

    private static final Pattern<PlanNode> PATTERN = anyNode(WINDOW_AGGREGATES)
            .with(source().matching(window().capturedAs(WINDOW)
                    .with(source().matching(readRange().capturedAs(READ)))));

    @Override
    public Pattern<PlanNode> getPattern()
    {
        return PATTERN;
    }

    @Override
    public Result apply(PlanNode aggregate, Captures captures, Context context)
    {
        PlanNode window = captures.get(WINDOW);
        PlanNode read = captures.get(READ);
        WindowSpec windowSpec = window.getSpec(WindowSpec.class);
        if (!isLinearChain(context.getLookup(), read, window) || !canPushWindow(windowSpec) || !canPushAggregate(aggregate)) {
            return Result.empty();
        }

        ReadWindowAggregateSpec windowAggregate = ReadWindowAggregateSpec.windowAggregate(
                read.getSpec(ReadRangeSpec.class),
                windowSpec.getEvery(),
                windowSpec.getOffset(),
                aggregate.getKind(),
                windowSpec.isCreateEmpty());
        return Result.ofPlanNode(new PlanNode(context.getIdAllocator().getNextId(), windowAggregate, read.getSources()));
    }
}
