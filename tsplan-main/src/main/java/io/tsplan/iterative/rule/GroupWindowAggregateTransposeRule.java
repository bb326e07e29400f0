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
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import io.tsplan.CompilationContext;
import io.tsplan.iterative.Rule;
import io.tsplan.plan.PlanNode;
import io.tsplan.plan.ProcedureSpec;
import io.tsplan.plan.logical.AggregateSpec;
import io.tsplan.plan.logical.GroupSpec;
import io.tsplan.plan.logical.WindowSpec;
import io.tsplan.plan.physical.ReadGroupSpec;
import io.tsplan.plan.physical.ReadWindowAggregateSpec;

import java.util.LinkedHashSet;
import java.util.Set;

import static com.facebook.presto.matching.Capture.newCapture;
import static io.tsplan.Capability.GROUP_WINDOW_AGGREGATE_TRANSPOSE;
import static io.tsplan.iterative.rule.WindowAggregates.WINDOW_AGGREGATES;
import static io.tsplan.iterative.rule.WindowAggregates.canPushAggregate;
import static io.tsplan.iterative.rule.WindowAggregates.canPushWindow;
import static io.tsplan.iterative.rule.WindowAggregates.isLinearChain;
import static io.tsplan.plan.ColumnNames.START;
import static io.tsplan.plan.ColumnNames.STOP;
import static io.tsplan.plan.Patterns.anyNode;
import static io.tsplan.plan.Patterns.readGroup;
import static io.tsplan.plan.Patterns.source;
import static io.tsplan.plan.Patterns.window;
import static io.tsplan.plan.ProcedureKind.COUNT;
import static io.tsplan.plan.ProcedureKind.SUM;
import static io.tsplan.plan.logical.GroupMode.BY;

/**
 * Rewrites {@code ReadGroup |> window |> aggregate} so that storage computes the
 * windowed aggregate per series first:
 * <pre>
 * ReadWindowAggregate |> group(columns: keys + [_start, _stop]) |> aggregate
 * </pre>
 * The second aggregate combines the per-series partial results of each window,
 * so a {@code count} is combined with {@code sum}. {@code mean} cannot be
 * combined from partial means and is never rewritten.
 */
public class GroupWindowAggregateTransposeRule
        implements Rule<PlanNode>
{
    private static final Capture<PlanNode> WINDOW = newCapture();
    private static final Capture<PlanNode> READ = newCapture();

    private static final Pattern<PlanNode> PATTERN = anyNode(WINDOW_AGGREGATES)
            .with(source().matching(window().capturedAs(WINDOW)
                    .with(source().matching(readGroup().capturedAs(READ)))));

    @Override
    public Pattern<PlanNode> getPattern()
    {
        return PATTERN;
    }

    @Override
    public boolean isEnabled(CompilationContext context)
    {
        return context.hasCapability(GROUP_WINDOW_AGGREGATE_TRANSPOSE);
    }

    @Override
    public Result apply(PlanNode aggregate, Captures captures, Context context)
    {
        PlanNode window = captures.get(WINDOW);
        PlanNode read = captures.get(READ);
        ReadGroupSpec readGroup = read.getSpec(ReadGroupSpec.class);
        WindowSpec windowSpec = window.getSpec(WindowSpec.class);
        if (readGroup.getMode() != BY ||
                !isLinearChain(context.getLookup(), read, window) ||
                !canPushWindow(windowSpec) ||
                !canPushAggregate(aggregate)) {
            return Result.empty();
        }

        PlanNode windowAggregate = new PlanNode(
                context.getIdAllocator().getNextId(),
                ReadWindowAggregateSpec.windowAggregate(
                        readGroup.getReadRange(),
                        windowSpec.getEvery(),
                        windowSpec.getOffset(),
                        aggregate.getKind(),
                        windowSpec.isCreateEmpty()),
                read.getSources());

        Set<String> keys = new LinkedHashSet<>(readGroup.getKeys());
        keys.add(START);
        keys.add(STOP);
        PlanNode group = new PlanNode(
                context.getIdAllocator().getNextId(),
                new GroupSpec(BY, ImmutableList.copyOf(keys)),
                ImmutableList.of(windowAggregate.getId()));

        ProcedureSpec combine = aggregate.getKind() == COUNT ? AggregateSpec.of(SUM) : aggregate.getSpec();
        PlanNode combined = new PlanNode(
                context.getIdAllocator().getNextId(),
                combine,
                ImmutableList.of(group.getId()));

        return Result.ofPlanNodes(ImmutableList.of(windowAggregate, group, combined));
    }
}
