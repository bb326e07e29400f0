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

import com.google.common.collect.ImmutableList;
import io.tsplan.plan.Lookup;
import io.tsplan.plan.PlanNode;
import io.tsplan.plan.ProcedureKind;
import io.tsplan.plan.ProcedureSpec;

import java.util.List;
import java.util.Optional;

import static com.google.common.base.Strings.repeat;
import static java.util.Objects.requireNonNull;

/**
 * Structural expectation for a plan subtree: the kind or the exact spec of a
 * node, followed by patterns for its sources in order.
 */
public final class PlanMatchPattern
{
    private final ProcedureKind kind;
    private final Optional<ProcedureSpec> spec;
    private final List<PlanMatchPattern> sources;

    private PlanMatchPattern(ProcedureKind kind, Optional<ProcedureSpec> spec, List<PlanMatchPattern> sources)
    {
        this.kind = requireNonNull(kind, "kind is null");
        this.spec = requireNonNull(spec, "spec is null");
        this.sources = ImmutableList.copyOf(requireNonNull(sources, "sources is null"));
    }

    public static PlanMatchPattern node(ProcedureKind kind, PlanMatchPattern... sources)
    {
        return new PlanMatchPattern(kind, Optional.empty(), ImmutableList.copyOf(sources));
    }

    public static PlanMatchPattern spec(ProcedureSpec spec, PlanMatchPattern... sources)
    {
        return new PlanMatchPattern(spec.getKind(), Optional.of(spec), ImmutableList.copyOf(sources));
    }

    public boolean matches(PlanNode node, Lookup lookup)
    {
        if (node.getKind() != kind) {
            return false;
        }
        if (spec.isPresent() && !spec.get().equals(node.getSpec())) {
            return false;
        }
        if (node.getSources().size() != sources.size()) {
            return false;
        }
        for (int i = 0; i < sources.size(); i++) {
            if (!sources.get(i).matches(lookup.resolve(node.getSources().get(i)), lookup)) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String toString()
    {
        StringBuilder builder = new StringBuilder();
        toString(builder, 0);
        return builder.toString();
    }

    private void toString(StringBuilder builder, int level)
    {
        builder.append(repeat("    ", level)).append(kind);
        spec.ifPresent(value -> builder.append(' ').append(value.getPlanDetails()));
        builder.append('\n');
        for (PlanMatchPattern source : sources) {
            source.toString(builder, level + 1);
        }
    }
}
