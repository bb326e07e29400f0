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
package io.tsplan.assertions;

import io.tsplan.plan.PlanGraph;
import io.tsplan.plan.PlanNode;

import java.util.List;

import static io.tsplan.plan.PlanPrinter.textPlan;
import static java.lang.String.format;
import static org.testng.Assert.fail;

public final class PlanAssert
{
    private PlanAssert() {}

    /**
     * Asserts that the plan has a single output and that the tree feeding it
     * matches {@code pattern}.
     */
    public static void assertPlan(PlanGraph plan, PlanMatchPattern pattern)
    {
        List<PlanNode> sinks = plan.getSinks();
        if (sinks.size() != 1) {
            fail(format("Plan has %s outputs:\n%s", sinks.size(), textPlan(plan)));
        }
        assertPlan(plan, sinks.get(0), pattern);
    }

    public static void assertPlan(PlanGraph plan, PlanNode root, PlanMatchPattern pattern)
    {
        if (!pattern.matches(root, plan)) {
            fail(format("Plan does not match, expected [\n%s] but found [\n%s]", pattern, textPlan(plan)));
        }
    }
}
