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
import io.tsplan.plan.physical.ReadGroupSpec;

import java.util.Set;

import static com.facebook.presto.matching.Capture.newCapture;
import static io.tsplan.iterative.rule.WindowAggregates.canPushAggregate;
import static io.tsplan.plan.Patterns.anyNode;
import static io.tsplan.plan.Patterns.readGroup;
import static io.tsplan.plan.Patterns.source;
import static io.tsplan.plan.ProcedureKind.COUNT;
import static io.tsplan.plan.ProcedureKind.FIRST;
import static io.tsplan.plan.ProcedureKind.LAST;
import static io.tsplan.plan.ProcedureKind.MAX;
import static io.tsplan.plan.ProcedureKind.MIN;
import static io.tsplan.plan.ProcedureKind.SUM;

/**
 * Sets the aggregate method of a group read from the aggregate that follows it.
 * A read that already aggregates is a {@code ReadGroupAggregate} and does not match.
 */
public class PushDownGroupAggregateRule
        implements Rule<PlanNode>
{
    private static final Set<ProcedureKind> AGGREGATES = ImmutableSet.of(COUNT, SUM, FIRST, LAST, MIN, MAX);

    private static final Capture<PlanNode> READ = newCapture();

    private static final Pattern<PlanNode> PATTERN = anyNode(AGGREGATES)
            .with(source().matching(readGroup().capturedAs(READ)));

    @Override
    public Pattern<PlanNode> getPattern()
    {
        return PATTERN;
    }

    @Override
    public Result apply(PlanNode aggregate, Captures captures, Context context)
    {
        PlanNode read = captures.get(READ);
        ReadGroupSpec readGroup = read.getSpec(ReadGroupSpec.class);
        if (readGroup.getAggregateMethod().isPresent() ||
                !context.getLookup().hasSingleSuccessor(read) ||
                !canPushAggregate(aggregate)) {
            return Result.empty();
        }

        return Result.ofPlanNode(new PlanNode(
                context.getIdAllocator().getNextId(),
                readGroup.withAggregateMethod(aggregate.getKind()),
                read.getSources()));
    }
}
