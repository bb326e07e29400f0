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

/**
 * Data-only description of the operator carried by a plan node. Specs are
 * immutable values; rewrites build new specs instead of editing them.
 */
public interface ProcedureSpec
{
    ProcedureKind getKind();

    default PlanCost getCost()
    {
        return PlanCost.ZERO;
    }

    /**
     * Operator arguments as shown in explain output.
     */
    default String getPlanDetails()
    {
        return "";
    }
}
