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
import io.tsplan.plan.ProcedureKind;
import io.tsplan.plan.ProcedureSpec;

import java.util.List;

import static com.google.common.base.MoreObjects.toStringHelper;
import static java.util.Objects.requireNonNull;

public final class KeepSpec
        implements ProcedureSpec
{
    private final List<String> columns;

    public KeepSpec(List<String> columns)
    {
        this.columns = ImmutableList.copyOf(requireNonNull(columns, "columns is null"));
    }

    public List<String> getColumns()
    {
        return columns;
    }

    @Override
    public ProcedureKind getKind()
    {
        return ProcedureKind.KEEP;
    }

    @Override
    public String getPlanDetails()
    {
        return "columns = " + columns;
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
        return columns.equals(((KeepSpec) o).columns);
    }

    @Override
    public int hashCode()
    {
        return columns.hashCode();
    }

    @Override
    public String toString()
    {
        return toStringHelper(this)
                .add("columns", columns)
                .toString();
    }
}
