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
package io.tsplan.iterative;

import com.facebook.airlift.log.Logger;
import com.facebook.presto.matching.Captures;
import com.facebook.presto.matching.Match;
import com.facebook.presto.matching.Matcher;
import com.google.common.collect.ImmutableList;
import io.airlift.units.Duration;
import io.tsplan.CompilationContext;
import io.tsplan.plan.Lookup;
import io.tsplan.plan.PlanGraph;
import io.tsplan.plan.PlanNode;
import io.tsplan.plan.PlanNodeId;
import io.tsplan.plan.PlanNodeIdAllocator;
import io.tsplan.spi.TsplanException;

import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;
import static io.tsplan.spi.StandardErrorCode.OPTIMIZER_TIMEOUT;
import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Applies rules to a plan until a full pass over every node rewrites nothing.
 * The first enabled rule that fires on a node replaces it; nodes created by a
 * rewrite are visited on the next pass.
 */
public class IterativeOptimizer
{
    private static final Logger log = Logger.get(IterativeOptimizer.class);

    private final List<Rule<?>> rules;
    private final int maxPasses;
    private final Duration timeout;

    public IterativeOptimizer(List<Rule<?>> rules, int maxPasses, Duration timeout)
    {
        this.rules = ImmutableList.copyOf(requireNonNull(rules, "rules is null"));
        checkArgument(maxPasses > 0, "maxPasses must be positive");
        this.maxPasses = maxPasses;
        this.timeout = requireNonNull(timeout, "timeout is null");
    }

    public List<Rule<?>> getRules()
    {
        return rules;
    }

    /**
     * Returns the rewritten plan. The given plan is not modified.
     */
    public PlanGraph optimize(PlanGraph plan, CompilationContext compilationContext)
    {
        PlanGraph graph = plan.copy();
        Matcher matcher = new PlanNodeMatcher(graph);
        Context context = new Context(graph, compilationContext);
        long start = System.nanoTime();

        for (int pass = 1; pass <= maxPasses; pass++) {
            int rewrites = 0;
            for (PlanNodeId id : graph.topologicalOrder()) {
                if (!graph.contains(id)) {
                    continue;
                }
                if (exploreNode(graph, graph.resolve(id), matcher, context)) {
                    rewrites++;
                }
                checkTimeout(start);
            }
            if (rewrites == 0) {
                log.debug("plan reached a fixed point after %s passes", pass);
                return graph;
            }
        }
        throw new TsplanException(OPTIMIZER_TIMEOUT, format("The optimizer did not reach a fixed point within %s passes", maxPasses));
    }

    private boolean exploreNode(PlanGraph graph, PlanNode node, Matcher matcher, Context context)
    {
        for (Rule<?> rule : rules) {
            if (!rule.isEnabled(context.getCompilationContext())) {
                continue;
            }
            Rule.Result result = transform(node, rule, matcher, context);
            if (!result.isEmpty()) {
                List<PlanNode> newNodes = result.getNewNodes();
                graph.replace(node.getId(), newNodes);
                log.debug("%s rewrote %s[%s] into %s[%s]",
                        rule.getName(),
                        node.getKind(),
                        node.getId(),
                        newNodes.get(newNodes.size() - 1).getKind(),
                        newNodes.get(newNodes.size() - 1).getId());
                return true;
            }
        }
        return false;
    }

    private <T> Rule.Result transform(PlanNode node, Rule<T> rule, Matcher matcher, Context context)
    {
        Match<T> match = matcher.match(rule.getPattern(), node, Captures.empty());
        if (!match.isPresent()) {
            return Rule.Result.empty();
        }
        return rule.apply(match.value(), match.captures(), context);
    }

    private void checkTimeout(long start)
    {
        if (Duration.nanosSince(start).compareTo(timeout) > 0) {
            throw new TsplanException(OPTIMIZER_TIMEOUT, format("The optimizer exhausted the time limit of %s", timeout));
        }
    }

    private static class Context
            implements Rule.Context
    {
        private final PlanGraph graph;
        private final CompilationContext compilationContext;

        Context(PlanGraph graph, CompilationContext compilationContext)
        {
            this.graph = requireNonNull(graph, "graph is null");
            this.compilationContext = requireNonNull(compilationContext, "compilationContext is null");
        }

        @Override
        public Lookup getLookup()
        {
            return graph;
        }

        @Override
        public PlanNodeIdAllocator getIdAllocator()
        {
            return graph.getIdAllocator();
        }

        @Override
        public CompilationContext getCompilationContext()
        {
            return compilationContext;
        }
    }
}
