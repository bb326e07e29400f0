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

import com.google.common.collect.ImmutableList;

import java.util.List;

import static com.google.common.base.MoreObjects.toStringHelper;
import static com.google.common.base.Preconditions.checkState;
import static java.util.Objects.requireNonNull;

/**
 * Immutable plan vertex. Edges are stored as the ids of the nodes this node
 * reads from; the owning {@link PlanGraph} keeps the reverse edges.
 */
public final class PlanNode
{
    private final PlanNodeId id;
    private final ProcedureSpec spec;
    private final List<PlanNodeId> sources;

    public PlanNode(PlanNodeId id, ProcedureSpec spec, List<PlanNodeId> sources)
    {
        this.id = requireNonNull(id, "id is null");
        this.spec = requireNonNull(spec, "spec is null");
        this.sources = ImmutableList.copyOf(requireNonNull(sources, "sources is null"));
    }

    public PlanNodeId getId()
    {
        return id;
    }

    public ProcedureSpec getSpec()
    {
        return spec;
    }

    public <T extends ProcedureSpec> T getSpec(Class<T> specClass)
    {
        checkState(specClass.isInstance(spec), "node %s carries %s, not %s", id, spec.getKind(), specClass.getSimpleName());
        return specClass.cast(spec);
    }

    public ProcedureKind getKind()
    {
        return spec.getKind();
    }

    public List<PlanNodeId> getSources()
    {
        return sources;
    }

    public PlanNode replaceSource(PlanNodeId oldSource, PlanNodeId newSource)
    {
        ImmutableList.Builder<PlanNodeId> newSources = ImmutableList.builder();
        for (PlanNodeId source : sources) {
            newSources.add(source.equals(oldSource) ? newSource : source);
        }
        return new PlanNode(id, spec, newSources.build());
    }

    @Override
    public String toString()
    {
        return toStringHelper(this)
                .add("id", id)
                .add("kind", spec.getKind())
                .add("sources", sources)
                .toString();
    }
}
