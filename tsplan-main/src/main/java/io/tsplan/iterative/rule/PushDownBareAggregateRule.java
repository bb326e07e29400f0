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
import com.google.common.collect.ImmutableSet;
import io.tsplan.iterative.Rule;
import io.tsplan.plan.PlanNode;
import io.tsplan.plan.ProcedureKind;
import io.tsplan.plan.physical.ReadRangeSpec;
import io.tsplan.plan.physical.ReadWindowAggregateSpec;
import io.tsplan.spi.type.CalendarDuration;

import java.util.Set;

import static com.facebook.presto.matching.Capture.newCapture;
import static io.tsplan.iterative.rule.WindowAggregates.canPushAggregate;
import static io.tsplan.plan.Patterns.anyNode;
import static io.tsplan.plan.Patterns.readRange;
import static io.tsplan.plan.Patterns.source;
import static io.tsplan.plan.ProcedureKind.COUNT;
import static io.tsplan.plan.ProcedureKind.FIRST;
import static io.tsplan.plan.ProcedureKind.LAST;
import static io.tsplan.plan.ProcedureKind.SUM;

/**
 * Pushes an aggregate read directly off a range read into storage as a single
 * window spanning the whole range.
 */
public class PushDownBareAggregateRule
        implements Rule<PlanNode>
{
    private static final Set<ProcedureKind> AGGREGATES = ImmutableSet.of(COUNT, SUM, FIRST, LAST);

    private static final Capture<PlanNode> READ = newCapture();

    private static final Pattern<PlanNode> PATTERN = anyNode(AGGREGATES)
            .with(source().matching(readRange().capturedAs(READ)));

    @Override
    public Pattern<PlanNode> getPattern()
    {
        return PATTERN;
    }

    @Override
    public Result apply(PlanNode aggregate, Captures captures, Context context)
    {
        PlanNode read = captures.get(READ);
        if (!context.getLookup().hasSingleSuccessor(read) || !canPushAggregate(aggregate)) {
            return Result.empty();
        }

        ReadWindowAggregateSpec windowAggregate = ReadWindowAggregateSpec.windowAggregate(
                read.getSpec(ReadRangeSpec.class),
                CalendarDuration.MAX,
                CalendarDuration.ZERO,
                aggregate.getKind(),
                false);
        return Result.ofPlanNode(new PlanNode(context.getIdAllocator().getNextId(), windowAggregate, read.getSources()));
    }
}
