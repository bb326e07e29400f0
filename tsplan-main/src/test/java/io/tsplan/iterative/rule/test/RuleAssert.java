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

import com.facebook.presto.matching.Captures;
import com.facebook.presto.matching.Match;
import io.tsplan.Capability;
import io.tsplan.CompilationContext;
import io.tsplan.assertions.PlanMatchPattern;
import io.tsplan.iterative.PlanNodeMatcher;
import io.tsplan.iterative.Rule;
import io.tsplan.plan.Lookup;
import io.tsplan.plan.PlanGraph;
import io.tsplan.plan.PlanNode;
import io.tsplan.plan.PlanNodeIdAllocator;

import java.util.List;
import java.util.Set;
import java.util.function.Function;

import static com.google.common.base.Preconditions.checkState;
import static io.tsplan.assertions.PlanAssert.assertPlan;
import static io.tsplan.plan.PlanPrinter.textPlan;
import static java.lang.String.format;
import static java.util.Objects.requireNonNull;
import static org.testng.Assert.fail;

public class RuleAssert
{
    private final Rule<?> rule;
    private CompilationContext compilationContext;
    private PlanGraph plan;
    private PlanNode target;

    public RuleAssert(Rule<?> rule, CompilationContext compilationContext)
    {
        this.rule = requireNonNull(rule, "rule is null");
        this.compilationContext = requireNonNull(compilationContext, "compilationContext is null");
    }

    public RuleAssert withCapabilities(Set<Capability> capabilities)
    {
        compilationContext = new CompilationContext(compilationContext.getOrganizationId(), capabilities, compilationContext.getBucketResolver());
        return this;
    }

    /**
     * Builds the plan to test. The node returned by {@code planProvider} is
     * the one the rule is applied to.
     */
    public RuleAssert on(Function<PlanBuilder, PlanNode> planProvider)
    {
        plan = new PlanGraph();
        target = planProvider.apply(new PlanBuilder(plan));
        return this;
    }

    public void doesNotFire()
    {
        Rule.Result result = applyRule();
        if (!result.isEmpty()) {
            fail(format(
                    "Expected %s to not fire for:\n%s",
                    rule.getName(),
                    textPlan(plan)));
        }
    }

    /**
     * Applies the rule and matches the subtree rooted at the replacement.
     */
    public void matches(PlanMatchPattern pattern)
    {
        String before = textPlan(plan);
        Rule.Result result = applyRule();
        if (result.isEmpty()) {
            fail(format(
                    "%s did not fire for:\n%s",
                    rule.getName(),
                    before));
        }
        List<PlanNode> newNodes = result.getNewNodes();
        plan.replace(target.getId(), newNodes);
        assertPlan(plan, newNodes.get(newNodes.size() - 1), pattern);
    }

    /**
     * Applies the rule and matches the plan feeding its single output.
     */
    public void matchesPlan(PlanMatchPattern pattern)
    {
        Rule.Result result = applyRule();
        if (result.isEmpty()) {
            fail(format("%s did not fire for:\n%s", rule.getName(), textPlan(plan)));
        }
        plan.replace(target.getId(), result.getNewNodes());
        assertPlan(plan, pattern);
    }

    private Rule.Result applyRule()
    {
        checkState(plan != null, "no plan given, call on() first");
        return applyRule(rule);
    }

    private <T> Rule.Result applyRule(Rule<T> rule)
    {
        if (!rule.isEnabled(compilationContext)) {
            return Rule.Result.empty();
        }
        Match<T> match = new PlanNodeMatcher(plan).match(rule.getPattern(), target, Captures.empty());
        if (!match.isPresent()) {
            return Rule.Result.empty();
        }
        return rule.apply(match.value(), match.captures(), new TestingContext(plan, compilationContext));
    }

    private static class TestingContext
            implements Rule.Context
    {
        private final PlanGraph plan;
        private final CompilationContext compilationContext;

        TestingContext(PlanGraph plan, CompilationContext compilationContext)
        {
            this.plan = plan;
            this.compilationContext = compilationContext;
        }

        @Override
        public Lookup getLookup()
        {
            return plan;
        }

        @Override
        public PlanNodeIdAllocator getIdAllocator()
        {
            return plan.getIdAllocator();
        }

        @Override
        public CompilationContext getCompilationContext()
        {
            return compilationContext;
        }
    }
}
