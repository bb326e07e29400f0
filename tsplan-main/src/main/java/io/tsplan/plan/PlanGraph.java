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

import com.google.common.collect.ArrayListMultimap;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ListMultimap;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Queue;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;
import static com.google.common.collect.ImmutableList.toImmutableList;

/**
 * Arena owning the nodes of one query plan. Nodes are addressed by id;
 * predecessor edges live on the nodes and successor edges are indexed here.
 * Not thread safe: each compilation owns its own graph.
 */
public final class PlanGraph
        implements Lookup
{
    private final Map<PlanNodeId, PlanNode> nodes = new LinkedHashMap<>();
    private final ListMultimap<PlanNodeId, PlanNodeId> successors = ArrayListMultimap.create();
    private final PlanNodeIdAllocator idAllocator = new PlanNodeIdAllocator(nodes::containsKey);

    public PlanNodeIdAllocator getIdAllocator()
    {
        return idAllocator;
    }

    public PlanNode add(PlanNode node)
    {
        checkArgument(!nodes.containsKey(node.getId()), "duplicate plan node id: %s", node.getId());
        for (PlanNodeId source : node.getSources()) {
            checkArgument(nodes.containsKey(source), "node %s reads from unknown node %s", node.getId(), source);
        }
        nodes.put(node.getId(), node);
        for (PlanNodeId source : node.getSources()) {
            successors.put(source, node.getId());
        }
        return node;
    }

    public boolean contains(PlanNodeId id)
    {
        return nodes.containsKey(id);
    }

    public int size()
    {
        return nodes.size();
    }

    @Override
    public PlanNode resolve(PlanNodeId id)
    {
        PlanNode node = nodes.get(id);
        checkArgument(node != null, "unknown plan node: %s", id);
        return node;
    }

    @Override
    public List<PlanNode> getSuccessors(PlanNodeId id)
    {
        return successors.get(id).stream()
                .map(this::resolve)
                .collect(toImmutableList());
    }

    public List<PlanNode> getPredecessors(PlanNodeId id)
    {
        return resolve(id).getSources().stream()
                .map(this::resolve)
                .collect(toImmutableList());
    }

    /**
     * Nodes without predecessors, typically the storage reads.
     */
    public List<PlanNode> getRoots()
    {
        return nodes.values().stream()
                .filter(node -> node.getSources().isEmpty())
                .collect(toImmutableList());
    }

    /**
     * Nodes without successors, the plan's outputs.
     */
    public List<PlanNode> getSinks()
    {
        return nodes.values().stream()
                .filter(node -> !successors.containsKey(node.getId()))
                .collect(toImmutableList());
    }

    /**
     * Node ids ordered so that every node comes after all of its predecessors.
     * Ties keep insertion order.
     */
    public List<PlanNodeId> topologicalOrder()
    {
        Map<PlanNodeId, Integer> pending = new HashMap<>();
        Queue<PlanNodeId> ready = new ArrayDeque<>();
        for (PlanNode node : nodes.values()) {
            pending.put(node.getId(), node.getSources().size());
            if (node.getSources().isEmpty()) {
                ready.add(node.getId());
            }
        }

        ImmutableList.Builder<PlanNodeId> order = ImmutableList.builder();
        while (!ready.isEmpty()) {
            PlanNodeId id = ready.remove();
            order.add(id);
            for (PlanNodeId successor : successors.get(id)) {
                int remaining = pending.merge(successor, -1, Integer::sum);
                if (remaining == 0) {
                    ready.add(successor);
                }
            }
        }
        return order.build();
    }

    /**
     * Replaces {@code target} with the given nodes. The nodes are listed
     * upstream first and may read from each other or from nodes already in
     * the plan. The last one takes over every successor of the target.
     * Upstream nodes left without successors are removed.
     */
    public void replace(PlanNodeId target, List<PlanNode> replacement)
    {
        checkArgument(!replacement.isEmpty(), "replacement is empty");
        PlanNode removed = resolve(target);
        for (PlanNode node : replacement) {
            checkArgument(!node.getSources().contains(target), "replacement node %s reads from the replaced node %s", node.getId(), target);
            add(node);
        }

        PlanNodeId newRoot = replacement.get(replacement.size() - 1).getId();
        for (PlanNodeId successorId : ImmutableList.copyOf(successors.get(target))) {
            PlanNode successor = nodes.get(successorId);
            nodes.put(successorId, successor.replaceSource(target, newRoot));
            successors.put(newRoot, successorId);
        }
        successors.removeAll(target);

        remove(removed);
    }

    public PlanGraph copy()
    {
        PlanGraph copy = new PlanGraph();
        for (PlanNodeId id : topologicalOrder()) {
            copy.add(nodes.get(id));
        }
        return copy;
    }

    private void remove(PlanNode node)
    {
        checkState(!successors.containsKey(node.getId()), "node %s still has successors", node.getId());
        nodes.remove(node.getId());
        List<PlanNodeId> orphans = new ArrayList<>();
        for (PlanNodeId source : node.getSources()) {
            successors.remove(source, node.getId());
            if (!successors.containsKey(source)) {
                orphans.add(source);
            }
        }
        for (PlanNodeId orphan : orphans) {
            // a node read twice by the same successor is only collected once
            if (nodes.containsKey(orphan)) {
                remove(nodes.get(orphan));
            }
        }
    }
}
