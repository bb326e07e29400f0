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

import io.tsplan.plan.ProcedureKind;
import io.tsplan.plan.ProcedureSpec;

import java.util.Objects;

import static com.google.common.base.MoreObjects.toStringHelper;
import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Copies {@code column} into a new column named {@code as}.
 */
public final class DuplicateSpec
        implements ProcedureSpec
{
    private final String column;
    private final String as;

    public DuplicateSpec(String column, String as)
    {
        this.column = requireNonNull(column, "column is null");
        this.as = requireNonNull(as, "as is null");
    }

    public String getColumn()
    {
        return column;
    }

    public String getAs()
    {
        return as;
    }

    @Override
    public ProcedureKind getKind()
    {
        return ProcedureKind.DUPLICATE;
    }

    @Override
    public String getPlanDetails()
    {
        return format("column = \"%s\", as = \"%s\"", column, as);
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
        DuplicateSpec that = (DuplicateSpec) o;
        return column.equals(that.column) && as.equals(that.as);
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(column, as);
    }

    @Override
    public String toString()
    {
        return toStringHelper(this)
                .add("column", column)
                .add("as", as)
                .toString();
    }
}
