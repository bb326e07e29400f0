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
package io.tsplan.iterative.rule.test;

import com.google.common.collect.ImmutableList;
import io.tsplan.expressions.tree.Expression;
import io.tsplan.plan.Bounds;
import io.tsplan.plan.PlanGraph;
import io.tsplan.plan.PlanNode;
import io.tsplan.plan.ProcedureKind;
import io.tsplan.plan.ProcedureSpec;
import io.tsplan.plan.logical.AggregateSpec;
import io.tsplan.plan.logical.DistinctSpec;
import io.tsplan.plan.logical.DuplicateSpec;
import io.tsplan.plan.logical.FilterSpec;
import io.tsplan.plan.logical.FromSpec;
import io.tsplan.plan.logical.GroupMode;
import io.tsplan.plan.logical.GroupSpec;
import io.tsplan.plan.logical.KeepSpec;
import io.tsplan.plan.logical.KeysSpec;
import io.tsplan.plan.logical.RangeSpec;
import io.tsplan.plan.logical.WindowSpec;

import java.time.Instant;
import java.util.Arrays;

import static io.tsplan.expressions.Expressions.function;
import static io.tsplan.plan.ColumnNames.VALUE;
import static java.util.Objects.requireNonNull;

public class PlanBuilder
{
    public static final Bounds BOUNDS = new Bounds(Instant.parse("2018-05-22T19:53:00Z"), Instant.parse("2018-05-22T19:54:00Z"));
    public static final String ROW = "r";

    private final PlanGraph graph;

    public PlanBuilder(PlanGraph graph)
    {
        this.graph = requireNonNull(graph, "graph is null");
    }

    public PlanGraph getGraph()
    {
        return graph;
    }

    public PlanNode node(ProcedureSpec spec, PlanNode... sources)
    {
        return graph.add(new PlanNode(
                graph.getIdAllocator().getNextId(),
                spec,
                Arrays.stream(sources).map(PlanNode::getId).collect(ImmutableList.toImmutableList())));
    }

    public PlanNode from(String bucket)
    {
        return node(FromSpec.fromBucket(bucket));
    }

    public PlanNode fromBucketId(String bucketId)
    {
        return node(FromSpec.fromBucketId(bucketId));
    }

    public PlanNode range(PlanNode source)
    {
        return node(new RangeSpec(BOUNDS), source);
    }

    /**
     * Filter with body {@code body} over row parameter {@value #ROW}.
     */
    public PlanNode filter(PlanNode source, Expression body)
    {
        return node(new FilterSpec(function(ROW, body)), source);
    }

    public PlanNode group(PlanNode source, GroupMode mode, String... keys)
    {
        return node(new GroupSpec(mode, ImmutableList.copyOf(keys)), source);
    }

    public PlanNode window(PlanNode source, WindowSpec window)
    {
        return node(window, source);
    }

    public PlanNode aggregate(PlanNode source, ProcedureKind kind)
    {
        return node(AggregateSpec.of(kind), source);
    }

    public PlanNode duplicate(PlanNode source, String column, String as)
    {
        return node(new DuplicateSpec(column, as), source);
    }

    public PlanNode keep(PlanNode source, String... columns)
    {
        return node(new KeepSpec(ImmutableList.copyOf(columns)), source);
    }

    public PlanNode keys(PlanNode source)
    {
        return node(new KeysSpec(VALUE), source);
    }

    public PlanNode distinct(PlanNode source, String column)
    {
        return node(new DistinctSpec(column), source);
    }
}
