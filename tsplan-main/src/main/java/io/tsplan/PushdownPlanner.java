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
package io.tsplan;

import com.facebook.airlift.log.Logger;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import io.tsplan.iterative.IterativeOptimizer;
import io.tsplan.iterative.Rule;
import io.tsplan.iterative.rule.GroupWindowAggregateTransposeRule;
import io.tsplan.iterative.rule.MergeFiltersRule;
import io.tsplan.iterative.rule.PushDownBareAggregateRule;
import io.tsplan.iterative.rule.PushDownFilterRule;
import io.tsplan.iterative.rule.PushDownGroupAggregateRule;
import io.tsplan.iterative.rule.PushDownGroupRule;
import io.tsplan.iterative.rule.PushDownRangeRule;
import io.tsplan.iterative.rule.PushDownReadTagKeysRule;
import io.tsplan.iterative.rule.PushDownReadTagValuesRule;
import io.tsplan.iterative.rule.PushDownWindowAggregateByTimeRule;
import io.tsplan.iterative.rule.PushDownWindowAggregateRule;
import io.tsplan.plan.PlanGraph;
import io.tsplan.spi.BucketResolver;
import io.tsplan.spi.OrganizationId;

import javax.inject.Inject;

import java.util.List;
import java.util.Set;

import static io.tsplan.Capability.GROUP_WINDOW_AGGREGATE_TRANSPOSE;
import static java.util.Objects.requireNonNull;

/**
 * Rewrites logical query plans so that as much of the query as possible is
 * evaluated by the storage engine.
 */
public class PushdownPlanner
{
    private static final Logger log = Logger.get(PushdownPlanner.class);

    private final boolean enabled;
    private final Set<Capability> defaultCapabilities;
    private final BucketResolver bucketResolver;
    private final IterativeOptimizer optimizer;

    @Inject
    public PushdownPlanner(PushdownConfig config, BucketResolver bucketResolver)
    {
        requireNonNull(config, "config is null");
        this.enabled = config.isEnabled();
        this.defaultCapabilities = config.isGroupWindowAggregateTransposeEnabled() ? ImmutableSet.of(GROUP_WINDOW_AGGREGATE_TRANSPOSE) : ImmutableSet.of();
        this.bucketResolver = requireNonNull(bucketResolver, "bucketResolver is null");
        this.optimizer = new IterativeOptimizer(createRules(config), config.getMaxRewritePasses(), config.getOptimizerTimeout());
    }

    private static List<Rule<?>> createRules(PushdownConfig config)
    {
        ImmutableList.Builder<Rule<?>> rules = ImmutableList.builder();
        rules.add(
                new PushDownRangeRule(),
                new PushDownFilterRule(),
                new PushDownGroupRule(),
                new PushDownWindowAggregateRule(),
                new PushDownWindowAggregateByTimeRule(),
                new GroupWindowAggregateTransposeRule(),
                new PushDownBareAggregateRule(),
                new PushDownGroupAggregateRule(),
                new PushDownReadTagKeysRule(),
                new PushDownReadTagValuesRule());
        if (config.isMergeFiltersEnabled()) {
            rules.add(new MergeFiltersRule());
        }
        return rules.build();
    }

    public List<Rule<?>> getRules()
    {
        return optimizer.getRules();
    }

    /**
     * Context for a query that does not state its capabilities.
     */
    public CompilationContext createCompilationContext(OrganizationId organizationId)
    {
        return createCompilationContext(organizationId, defaultCapabilities);
    }

    public CompilationContext createCompilationContext(OrganizationId organizationId, Set<Capability> capabilities)
    {
        return new CompilationContext(organizationId, capabilities, bucketResolver);
    }

    /**
     * Returns the rewritten plan; {@code plan} itself is left untouched.
     */
    public PlanGraph optimize(PlanGraph plan, CompilationContext context)
    {
        requireNonNull(plan, "plan is null");
        requireNonNull(context, "context is null");
        if (!enabled) {
            return plan.copy();
        }
        log.debug("optimizing plan of %s nodes with capabilities %s", plan.size(), context.getCapabilities());
        return optimizer.optimize(plan, context);
    }
}
