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

import java.util.function.Predicate;

import static java.util.Objects.requireNonNull;

public class PlanNodeIdAllocator
{
    private final Predicate<PlanNodeId> taken;
    private int nextId;

    public PlanNodeIdAllocator()
    {
        this(id -> false);
    }

    /**
     * @param taken ids that must never be handed out, typically the ids already in a plan
     */
    public PlanNodeIdAllocator(Predicate<PlanNodeId> taken)
    {
        this.taken = requireNonNull(taken, "taken is null");
    }

    public PlanNodeId getNextId()
    {
        PlanNodeId id;
        do {
            id = new PlanNodeId(Integer.toString(nextId++));
        }
        while (taken.test(id));
        return id;
    }
}
