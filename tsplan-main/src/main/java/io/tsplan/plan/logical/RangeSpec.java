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

import io.tsplan.plan.Bounds;
import io.tsplan.plan.ProcedureKind;
import io.tsplan.plan.ProcedureSpec;

import static com.google.common.base.MoreObjects.toStringHelper;
import static java.util.Objects.requireNonNull;

public final class RangeSpec
        implements ProcedureSpec
{
    private final Bounds bounds;

    public RangeSpec(Bounds bounds)
    {
        this.bounds = requireNonNull(bounds, "bounds is null");
    }

    public Bounds getBounds()
    {
        return bounds;
    }

    @Override
    public ProcedureKind getKind()
    {
        return ProcedureKind.RANGE;
    }

    @Override
    public String getPlanDetails()
    {
        return "bounds = " + bounds;
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
        return bounds.equals(((RangeSpec) o).bounds);
    }

    @Override
    public int hashCode()
    {
        return bounds.hashCode();
    }

    @Override
    public String toString()
    {
        return toStringHelper(this)
                .add("bounds", bounds)
                .toString();
    }
}
