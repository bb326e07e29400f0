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
import io.tsplan.iterative.Rule;
import io.tsplan.plan.PlanNode;
import io.tsplan.plan.logical.DistinctSpec;
import io.tsplan.plan.logical.KeepSpec;
import io.tsplan.plan.logical.KeysSpec;
import io.tsplan.plan.physical.ReadRangeSpec;
import io.tsplan.plan.physical.ReadTagKeysSpec;

import static com.facebook.presto.matching.Capture.newCapture;
import static io.tsplan.iterative.rule.WindowAggregates.isLinearChain;
import static io.tsplan.plan.ColumnNames.VALUE;
import static io.tsplan.plan.Patterns.distinct;
import static io.tsplan.plan.Patterns.keep;
import static io.tsplan.plan.Patterns.keys;
import static io.tsplan.plan.Patterns.readRange;
import static io.tsplan.plan.Patterns.source;

/**
 * Replaces {@code ReadRange |> keys() |> keep(columns: ["_value"]) |> distinct()},
 * the listing of tag keys, with a tag key read.
 */
public class PushDownReadTagKeysRule
        implements Rule<PlanNode>
{
    private static final Capture<PlanNode> KEEP = newCapture();
    private static final Capture<PlanNode> KEYS = newCapture();
    private static final Capture<PlanNode> READ = newCapture();

    private static final Pattern<PlanNode> PATTERN = distinct()
            .with(source().matching(keep().capturedAs(KEEP)
                    .with(source().matching(keys().capturedAs(KEYS)
                            .with(source().matching(readRange().capturedAs(READ)))))));

    @Override
    public Pattern<PlanNode> getPattern()
    {
        return PATTERN;
    }

    @Override
    public Result apply(PlanNode distinct, Captures captures, Context context)
    {
        PlanNode keep = captures.get(KEEP);
        PlanNode keys = captures.get(KEYS);
        PlanNode read = captures.get(READ);
        if (!isLinearChain(context.getLookup(), read, keys, keep) ||
                !keys.getSpec(KeysSpec.class).getColumn().equals(VALUE) ||
                !keep.getSpec(KeepSpec.class).getColumns().equals(ImmutableList.of(VALUE)) ||
                !distinct.getSpec(DistinctSpec.class).getColumn().equals(VALUE)) {
            return Result.empty();
        }

        return Result.ofPlanNode(new PlanNode(
                context.getIdAllocator().getNextId(),
                new ReadTagKeysSpec(read.getSpec(ReadRangeSpec.class)),
                read.getSources()));
    }
}
