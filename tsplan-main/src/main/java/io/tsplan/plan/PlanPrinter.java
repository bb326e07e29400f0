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

import com.google.common.base.Strings;

/**
 * Text rendering of a plan for explain output, one node per line, walking
 * from each sink towards the storage reads.
 */
public final class PlanPrinter
{
    private static final int INDENT = 4;

    private PlanPrinter() {}

    public static String textPlan(PlanGraph plan)
    {
        StringBuilder output = new StringBuilder();
        for (PlanNode sink : plan.getSinks()) {
            print(plan, sink, 0, output);
        }
        return output.toString();
    }

    private static void print(PlanGraph plan, PlanNode node, int level, StringBuilder output)
    {
        output.append(Strings.repeat(" ", level * INDENT))
                .append(node.getKind().getName())
                .append('[')
                .append(node.getId())
                .append(']');
        String details = node.getSpec().getPlanDetails();
        if (!details.isEmpty()) {
            output.append(' ').append(details);
        }
        output.append('\n');
        for (PlanNode source : plan.getPredecessors(node.getId())) {
            print(plan, source, level + 1, output);
        }
    }
}
