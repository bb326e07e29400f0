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

import java.util.List;

/**
 * Read access to the plan a rule is matched against.
 */
public interface Lookup
{
    PlanNode resolve(PlanNodeId id);

    List<PlanNode> getSuccessors(PlanNodeId id);

    default boolean hasSingleSuccessor(PlanNode node)
    {
        return getSuccessors(node.getId()).size() == 1;
    }
}
