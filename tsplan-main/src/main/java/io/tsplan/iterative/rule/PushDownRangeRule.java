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
import io.tsplan.CompilationContext;
import io.tsplan.iterative.Rule;
import io.tsplan.plan.PlanNode;
import io.tsplan.plan.logical.FromSpec;
import io.tsplan.plan.logical.RangeSpec;
import io.tsplan.plan.physical.ReadRangeSpec;

import java.util.Optional;

import static com.facebook.presto.matching.Capture.newCapture;
import static io.tsplan.plan.Patterns.from;
import static io.tsplan.plan.Patterns.range;
import static io.tsplan.plan.Patterns.source;

/**
 * Replaces {@code from |> range} with a storage range read. The bucket
 * reference is validated here so that an unknown bucket fails the compile.
 */
public class PushDownRangeRule
        implements Rule<PlanNode>
{
    private static final Capture<PlanNode> FROM = newCapture();

    private static final Pattern<PlanNode> PATTERN = range()
            .with(source().matching(from().capturedAs(FROM)));

    @Override
    public Pattern<PlanNode> getPattern()
    {
        return PATTERN;
    }

    @Override
    public Result apply(PlanNode range, Captures captures, Context context)
    {
        PlanNode from = captures.get(FROM);
        if (!context.getLookup().hasSingleSuccessor(from)) {
            return Result.empty();
        }

        FromSpec fromSpec = from.getSpec(FromSpec.class);
        RangeSpec rangeSpec = range.getSpec(RangeSpec.class);
        ReadRangeSpec readRange;
        if (fromSpec.getBucketId().isPresent()) {
            readRange = ReadRangeSpec.forBucketId(fromSpec.getBucketId().get(), rangeSpec.getBounds());
        }
        else {
            readRange = new ReadRangeSpec(fromSpec.getBucket(), Optional.empty(), rangeSpec.getBounds(), Optional.empty());
        }

        CompilationContext compilationContext = context.getCompilationContext();
        readRange.lookupBucketId(compilationContext.getOrganizationId(), compilationContext.getBucketResolver());

        return Result.ofPlanNode(new PlanNode(context.getIdAllocator().getNextId(), readRange, from.getSources()));
    }
}
