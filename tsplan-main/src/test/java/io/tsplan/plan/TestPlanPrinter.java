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
package io.tsplan.plan;

import io.tsplan.iterative.rule.test.PlanBuilder;
import org.testng.annotations.Test;

import static io.tsplan.plan.PlanPrinter.textPlan;
import static io.tsplan.plan.ProcedureKind.COUNT;
import static org.testng.Assert.assertEquals;

public class TestPlanPrinter
{
    @Test
    public void testTextPlan()
    {
        PlanGraph graph = new PlanGraph();
        PlanBuilder p = new PlanBuilder(graph);
        p.aggregate(p.range(p.from("telegraf")), COUNT);

        assertEquals(
                textPlan(graph),
                "count[2] columns = [_value]\n" +
                        "    range[1] bounds = [2018-05-22T19:53:00Z, 2018-05-22T19:54:00Z)\n" +
                        "        from[0] bucket = \"telegraf\"\n");
    }

    @Test
    public void testEmptyPlan()
    {
        assertEquals(textPlan(new PlanGraph()), "");
    }
}
