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
import io.tsplan.plan.logical.GroupSpec;
import io.tsplan.plan.physical.ReadGroupSpec;
import io.tsplan.plan.physical.ReadRangeSpec;

import static com.facebook.presto.matching.Capture.newCapture;
import static io.tsplan.plan.Patterns.group;
import static io.tsplan.plan.Patterns.readRange;
import static io.tsplan.plan.Patterns.source;
import static io.tsplan.plan.logical.GroupMode.EXCEPT;

/**
 * Folds a {@code group} into the range read below it. Storage cannot group by
 * every column except a set, so {@code except} groups stay in the plan.
 */
public class PushDownGroupRule
        implements Rule<PlanNode>
{
    private static final Capture<PlanNode> READ = newCapture();

    private static final Pattern<PlanNode> PATTERN = group()
            .with(source().matching(readRange().capturedAs(READ)));

    @Override
    public Pattern<PlanNode> getPattern()
    {
        return PATTERN;
    }

    @Override
    public Result apply(PlanNode group, Captures captures, Context context)
    {
        PlanNode read = captures.get(READ);
        GroupSpec groupSpec = group.getSpec(GroupSpec.class);
        if (groupSpec.getMode() == EXCEPT || !context.getLookup().hasSingleSuccessor(read)) {
            return Result.empty();
        }

        ReadGroupSpec readGroup = ReadGroupSpec.readGroup(read.getSpec(ReadRangeSpec.class), groupSpec.getMode(), groupSpec.getKeys());
        return Result.ofPlanNode(new PlanNode(context.getIdAllocator().getNextId(), readGroup, read.getSources()));
    }
}
