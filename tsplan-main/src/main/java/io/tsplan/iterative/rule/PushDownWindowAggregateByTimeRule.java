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
import io.tsplan.plan.logical.DuplicateSpec;
import io.tsplan.plan.logical.WindowSpec;
import io.tsplan.plan.physical.ReadWindowAggregateSpec;
import io.tsplan.spi.type.CalendarDuration;

import static com.facebook.presto.matching.Capture.newCapture;
import static io.tsplan.iterative.rule.WindowAggregates.isLinearChain;
import static io.tsplan.plan.ColumnNames.START;
import static io.tsplan.plan.ColumnNames.STOP;
import static io.tsplan.plan.ColumnNames.TIME;
import static io.tsplan.plan.Patterns.duplicate;
import static io.tsplan.plan.Patterns.readWindowAggregate;
import static io.tsplan.plan.Patterns.source;
import static io.tsplan.plan.Patterns.window;

/**
 * Recognizes {@code ReadWindowAggregate |> duplicate(column: "_stop", as: "_time") |> window(every: inf)},
 * which restores a single table after a windowed aggregate and stamps each row
 * with a window bound, and asks storage for that bound as {@code _time} instead.
 */
public class PushDownWindowAggregateByTimeRule
        implements Rule<PlanNode>
{
    private static final Capture<PlanNode> DUPLICATE = newCapture();
    private static final Capture<PlanNode> READ = newCapture();

    private static final Pattern<PlanNode> PATTERN = window()
            .with(source().matching(duplicate().capturedAs(DUPLICATE)
                    .with(source().matching(readWindowAggregate().capturedAs(READ)))));

    @Override
    public Pattern<PlanNode> getPattern()
    {
        return PATTERN;
    }

    @Override
    public Result apply(PlanNode window, Captures captures, Context context)
    {
        PlanNode duplicate = captures.get(DUPLICATE);
        PlanNode read = captures.get(READ);
        ReadWindowAggregateSpec windowAggregate = read.getSpec(ReadWindowAggregateSpec.class);
        DuplicateSpec duplicateSpec = duplicate.getSpec(DuplicateSpec.class);
        if (!isLinearChain(context.getLookup(), read, duplicate) ||
                windowAggregate.getTimeColumn().isPresent() ||
                !isWindowBoundAsTime(duplicateSpec) ||
                !isInfiniteWindow(window.getSpec(WindowSpec.class))) {
            return Result.empty();
        }

        return Result.ofPlanNode(new PlanNode(
                context.getIdAllocator().getNextId(),
                windowAggregate.withTimeColumn(duplicateSpec.getColumn()),
                read.getSources()));
    }

    private static boolean isWindowBoundAsTime(DuplicateSpec duplicate)
    {
        return (duplicate.getColumn().equals(START) || duplicate.getColumn().equals(STOP)) &&
                duplicate.getAs().equals(TIME);
    }

    private static boolean isInfiniteWindow(WindowSpec window)
    {
        return window.getEvery().equals(CalendarDuration.MAX) &&
                window.getPeriod().equals(CalendarDuration.MAX) &&
                window.getOffset().isZero() &&
                window.hasDefaultColumns() &&
                !window.isCreateEmpty();
    }
}
