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
import io.tsplan.expressions.tree.Expression;
import io.tsplan.iterative.Rule;
import io.tsplan.plan.PlanNode;
import io.tsplan.plan.ProcedureKind;
import io.tsplan.plan.logical.FilterSpec;
import io.tsplan.plan.physical.ReadRangeSpec;
import io.tsplan.plan.physical.ReadSpec;
import io.tsplan.predicate.FilterSplitter.FilterSplit;
import io.tsplan.predicate.PredicateScope;
import io.tsplan.spi.predicate.StoragePredicate;

import java.util.Set;

import static com.facebook.presto.matching.Capture.newCapture;
import static io.tsplan.plan.Patterns.anyNode;
import static io.tsplan.plan.Patterns.filter;
import static io.tsplan.plan.Patterns.source;
import static io.tsplan.plan.ProcedureKind.READ_GROUP;
import static io.tsplan.plan.ProcedureKind.READ_GROUP_AGGREGATE;
import static io.tsplan.plan.ProcedureKind.READ_RANGE;
import static io.tsplan.plan.ProcedureKind.READ_TAG_KEYS;
import static io.tsplan.plan.ProcedureKind.READ_TAG_VALUES;
import static io.tsplan.plan.ProcedureKind.READ_WINDOW_AGGREGATE;
import static io.tsplan.predicate.FilterSplitter.split;
import static io.tsplan.predicate.PredicateScope.ALL_COLUMNS;
import static io.tsplan.predicate.PredicateScope.TAG_COLUMNS;
import static io.tsplan.predicate.PushablePredicates.rewriteExistenceChecks;
import static io.tsplan.predicate.StoragePredicateTranslator.toStoragePredicate;
import static io.tsplan.predicate.StoragePredicates.merge;
import static io.tsplan.spi.predicate.LogicalOperator.AND;

/**
 * Moves the conjuncts of a filter that storage can evaluate into the storage
 * read feeding it. The filter is dropped when nothing remains of it.
 */
public class PushDownFilterRule
        implements Rule<PlanNode>
{
    private static final Set<ProcedureKind> READS = ImmutableSet.of(READ_RANGE, READ_GROUP, READ_GROUP_AGGREGATE, READ_WINDOW_AGGREGATE, READ_TAG_KEYS, READ_TAG_VALUES);

    private static final Capture<PlanNode> READ = newCapture();

    private static final Pattern<PlanNode> PATTERN = filter()
            .with(source().matching(anyNode(READS).capturedAs(READ)));

    @Override
    public Pattern<PlanNode> getPattern()
    {
        return PATTERN;
    }

    @Override
    public Result apply(PlanNode filter, Captures captures, Context context)
    {
        PlanNode read = captures.get(READ);
        if (!context.getLookup().hasSingleSuccessor(read)) {
            return Result.empty();
        }

        FilterSpec filterSpec = filter.getSpec(FilterSpec.class);
        String rowParameter = filterSpec.getRowParameter();
        FilterSplit split = split(filterSpec.getBody(), rowParameter, scopeOf(read.getKind()));
        if (!split.getPushable().isPresent()) {
            return Result.empty();
        }

        Expression pushable = rewriteExistenceChecks(split.getPushable().get(), rowParameter);
        StoragePredicate predicate = toStoragePredicate(pushable, rowParameter);

        ReadSpec readSpec = (ReadSpec) read.getSpec();
        ReadRangeSpec readRange = readSpec.getReadRange();
        StoragePredicate merged = readRange.getPredicate()
                .map(existing -> merge(AND, ImmutableList.of(existing, predicate)))
                .orElse(predicate);
        PlanNode newRead = new PlanNode(
                context.getIdAllocator().getNextId(),
                readSpec.withReadRange(readRange.withPredicate(merged)),
                read.getSources());

        if (!split.getRemainder().isPresent()) {
            return Result.ofPlanNode(newRead);
        }
        PlanNode remainder = new PlanNode(
                context.getIdAllocator().getNextId(),
                filterSpec.withBody(split.getRemainder().get()),
                ImmutableList.of(newRead.getId()));
        return Result.ofPlanNodes(ImmutableList.of(newRead, remainder));
    }

    private static PredicateScope scopeOf(ProcedureKind read)
    {
        // value predicates do not commute with aggregation or tag listing
        if (read == READ_RANGE || read == READ_GROUP) {
            return ALL_COLUMNS;
        }
        return TAG_COLUMNS;
    }
}
