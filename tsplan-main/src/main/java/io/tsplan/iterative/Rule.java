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

import com.facebook.presto.matching.Captures;
import com.facebook.presto.matching.Pattern;
import com.google.common.collect.ImmutableList;
import io.tsplan.CompilationContext;
import io.tsplan.plan.Lookup;
import io.tsplan.plan.PlanNode;
import io.tsplan.plan.PlanNodeIdAllocator;

import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

public interface Rule<T>
{
    /**
     * Returns a pattern to which plan nodes this rule applies.
     */
    Pattern<T> getPattern();

    default boolean isEnabled(CompilationContext context)
    {
        return true;
    }

    Result apply(T node, Captures captures, Context context);

    default String getName()
    {
        return getClass().getSimpleName();
    }

    interface Context
    {
        Lookup getLookup();

        PlanNodeIdAllocator getIdAllocator();

        CompilationContext getCompilationContext();
    }

    final class Result
    {
        private static final Result EMPTY = new Result(ImmutableList.of());

        private final List<PlanNode> newNodes;

        private Result(List<PlanNode> newNodes)
        {
            this.newNodes = ImmutableList.copyOf(requireNonNull(newNodes, "newNodes is null"));
        }

        public static Result empty()
        {
            return EMPTY;
        }

        public static Result ofPlanNode(PlanNode node)
        {
            return new Result(ImmutableList.of(node));
        }

        /**
         * Replacement for the matched node, listed upstream first. The last
         * node takes over the matched node's successors.
         */
        public static Result ofPlanNodes(List<PlanNode> nodes)
        {
            checkArgument(!nodes.isEmpty(), "nodes is empty");
            return new Result(nodes);
        }

        public boolean isEmpty()
        {
            return newNodes.isEmpty();
        }

        public List<PlanNode> getNewNodes()
        {
            return newNodes;
        }
    }
}
