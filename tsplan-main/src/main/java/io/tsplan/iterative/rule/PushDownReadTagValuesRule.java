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
import io.tsplan.plan.logical.DistinctSpec;
import io.tsplan.plan.logical.GroupSpec;
import io.tsplan.plan.logical.KeepSpec;
import io.tsplan.plan.physical.ReadRangeSpec;
import io.tsplan.plan.physical.ReadTagValuesSpec;

import java.util.List;

import static com.facebook.presto.matching.Capture.newCapture;
import static io.tsplan.iterative.rule.WindowAggregates.isLinearChain;
import static io.tsplan.plan.Patterns.distinct;
import static io.tsplan.plan.Patterns.group;
import static io.tsplan.plan.Patterns.keep;
import static io.tsplan.plan.Patterns.readRange;
import static io.tsplan.plan.Patterns.source;
import static io.tsplan.plan.logical.GroupMode.BY;

/**
 * Replaces {@code ReadRange |> keep(columns: [k]) |> group() |> distinct(column: k)},
 * the listing of the values of tag {@code k}, with a tag value read.
 */
public class PushDownReadTagValuesRule
        implements Rule<PlanNode>
{
    private static final Capture<PlanNode> GROUP = newCapture();
    private static final Capture<PlanNode> KEEP = newCapture();
    private static final Capture<PlanNode> READ = newCapture();

    private static final Pattern<PlanNode> PATTERN = distinct()
            .with(source().matching(group().capturedAs(GROUP)
                    .with(source().matching(keep().capturedAs(KEEP)
                            .with(source().matching(readRange().capturedAs(READ)))))));

    @Override
    public Pattern<PlanNode> getPattern()
    {
        return PATTERN;
    }

    @Override
    public Result apply(PlanNode distinct, Captures captures, Context context)
    {
        PlanNode group = captures.get(GROUP);
        PlanNode keep = captures.get(KEEP);
        PlanNode read = captures.get(READ);
        if (!isLinearChain(context.getLookup(), read, keep, group)) {
            return Result.empty();
        }

        List<String> kept = keep.getSpec(KeepSpec.class).getColumns();
        GroupSpec groupSpec = group.getSpec(GroupSpec.class);
        if (kept.size() != 1 || groupSpec.getMode() != BY || !groupSpec.getKeys().isEmpty()) {
            return Result.empty();
        }
        String tagKey = kept.get(0);
        if (!distinct.getSpec(DistinctSpec.class).getColumn().equals(tagKey)) {
            return Result.empty();
        }

        return Result.ofPlanNode(new PlanNode(
                context.getIdAllocator().getNextId(),
                new ReadTagValuesSpec(read.getSpec(ReadRangeSpec.class), tagKey),
                read.getSources()));
    }
}
