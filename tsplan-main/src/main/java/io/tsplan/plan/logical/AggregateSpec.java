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
package io.tsplan.plan.logical;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import io.tsplan.plan.ProcedureKind;
import io.tsplan.plan.ProcedureSpec;

import java.util.List;
import java.util.Objects;
import java.util.Set;

import static com.google.common.base.MoreObjects.toStringHelper;
import static com.google.common.base.Preconditions.checkArgument;
import static io.tsplan.plan.ColumnNames.VALUE;
import static io.tsplan.plan.ProcedureKind.COUNT;
import static io.tsplan.plan.ProcedureKind.FIRST;
import static io.tsplan.plan.ProcedureKind.LAST;
import static io.tsplan.plan.ProcedureKind.MAX;
import static io.tsplan.plan.ProcedureKind.MEAN;
import static io.tsplan.plan.ProcedureKind.MIN;
import static io.tsplan.plan.ProcedureKind.SUM;
import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * An aggregate or selector applied per table. Selectors ({@code min},
 * {@code max}, {@code first}, {@code last}) read a single column; aggregates
 * ({@code count}, {@code sum}, {@code mean}) read a list of columns.
 */
public final class AggregateSpec
        implements ProcedureSpec
{
    public static final Set<ProcedureKind> SELECTORS = ImmutableSet.of(MIN, MAX, FIRST, LAST);
    public static final Set<ProcedureKind> AGGREGATES = ImmutableSet.of(COUNT, SUM, MEAN);

    private final ProcedureKind kind;
    private final List<String> columns;

    private AggregateSpec(ProcedureKind kind, List<String> columns)
    {
        this.kind = requireNonNull(kind, "kind is null");
        this.columns = ImmutableList.copyOf(requireNonNull(columns, "columns is null"));
    }

    public static AggregateSpec selector(ProcedureKind kind, String column)
    {
        checkArgument(SELECTORS.contains(kind), "not a selector: %s", kind);
        return new AggregateSpec(kind, ImmutableList.of(column));
    }

    public static AggregateSpec aggregate(ProcedureKind kind, List<String> columns)
    {
        checkArgument(AGGREGATES.contains(kind), "not an aggregate: %s", kind);
        return new AggregateSpec(kind, columns);
    }

    /**
     * The aggregate or selector over the default value column.
     */
    public static AggregateSpec of(ProcedureKind kind)
    {
        if (SELECTORS.contains(kind)) {
            return selector(kind, VALUE);
        }
        return aggregate(kind, ImmutableList.of(VALUE));
    }

    public boolean isSelector()
    {
        return SELECTORS.contains(kind);
    }

    public List<String> getColumns()
    {
        return columns;
    }

    /**
     * Whether the spec reads exactly the default value column.
     */
    public boolean isOverValueColumn()
    {
        return columns.equals(ImmutableList.of(VALUE));
    }

    @Override
    public ProcedureKind getKind()
    {
        return kind;
    }

    @Override
    public String getPlanDetails()
    {
        if (isSelector()) {
            return format("column = \"%s\"", columns.get(0));
        }
        return format("columns = %s", columns);
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        AggregateSpec that = (AggregateSpec) o;
        return kind == that.kind && columns.equals(that.columns);
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(kind, columns);
    }

    @Override
    public String toString()
    {
        return toStringHelper(this)
                .add("kind", kind)
                .add("columns", columns)
                .toString();
    }
}
