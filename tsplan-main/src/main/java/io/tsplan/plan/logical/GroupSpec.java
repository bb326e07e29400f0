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
import java.util.Objects;

import static com.google.common.base.MoreObjects.toStringHelper;
import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

public final class GroupSpec
        implements ProcedureSpec
{
    private final GroupMode mode;
    private final List<String> keys;

    public GroupSpec(GroupMode mode, List<String> keys)
    {
        this.mode = requireNonNull(mode, "mode is null");
        this.keys = ImmutableList.copyOf(requireNonNull(keys, "keys is null"));
    }

    public GroupMode getMode()
    {
        return mode;
    }

    public List<String> getKeys()
    {
        return keys;
    }

    @Override
    public ProcedureKind getKind()
    {
        return ProcedureKind.GROUP;
    }

    @Override
    public String getPlanDetails()
    {
        return format("mode = %s, columns = %s", mode, keys);
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
        GroupSpec that = (GroupSpec) o;
        return mode == that.mode && keys.equals(that.keys);
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(mode, keys);
    }

    @Override
    public String toString()
    {
        return toStringHelper(this)
                .add("mode", mode)
                .add("keys", keys)
                .toString();
    }
}
