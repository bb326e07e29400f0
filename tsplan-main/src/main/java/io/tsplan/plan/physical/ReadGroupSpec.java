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
package io.tsplan.plan.physical;

import com.google.common.collect.ImmutableList;
import io.tsplan.plan.ProcedureKind;
import io.tsplan.plan.logical.GroupMode;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

import static com.google.common.base.MoreObjects.toStringHelper;
import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;
import static io.tsplan.plan.logical.GroupMode.EXCEPT;
import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * A range read that groups series in storage. Once an aggregate method is
 * set the read also aggregates each group and reports itself as
 * {@link ProcedureKind#READ_GROUP_AGGREGATE}.
 */
public final class ReadGroupSpec
        implements ReadSpec
{
    private final ReadRangeSpec readRange;
    private final GroupMode mode;
    private final List<String> keys;
    private final Optional<ProcedureKind> aggregateMethod;

    public ReadGroupSpec(ReadRangeSpec readRange, GroupMode mode, List<String> keys, Optional<ProcedureKind> aggregateMethod)
    {
        this.readRange = requireNonNull(readRange, "readRange is null");
        this.mode = requireNonNull(mode, "mode is null");
        this.keys = ImmutableList.copyOf(requireNonNull(keys, "keys is null"));
        this.aggregateMethod = requireNonNull(aggregateMethod, "aggregateMethod is null");
        checkArgument(mode != EXCEPT, "group mode %s cannot be read from storage", mode);
    }

    public static ReadGroupSpec readGroup(ReadRangeSpec readRange, GroupMode mode, List<String> keys)
    {
        return new ReadGroupSpec(readRange, mode, keys, Optional.empty());
    }

    @Override
    public ReadRangeSpec getReadRange()
    {
        return readRange;
    }

    @Override
    public ReadGroupSpec withReadRange(ReadRangeSpec readRange)
    {
        return new ReadGroupSpec(readRange, mode, keys, aggregateMethod);
    }

    public GroupMode getMode()
    {
        return mode;
    }

    public List<String> getKeys()
    {
        return keys;
    }

    public Optional<ProcedureKind> getAggregateMethod()
    {
        return aggregateMethod;
    }

    public ReadGroupSpec withAggregateMethod(ProcedureKind aggregateMethod)
    {
        checkState(!this.aggregateMethod.isPresent(), "aggregate method already set to %s", this.aggregateMethod.orElse(null));
        return new ReadGroupSpec(readRange, mode, keys, Optional.of(aggregateMethod));
    }

    @Override
    public ProcedureKind getKind()
    {
        return aggregateMethod.isPresent() ? ProcedureKind.READ_GROUP_AGGREGATE : ProcedureKind.READ_GROUP;
    }

    @Override
    public String getPlanDetails()
    {
        return format("GroupMode: %s, GroupKeys: %s, AggregateMethod: \"%s\"", mode, keys, aggregateMethod.map(ProcedureKind::getName).orElse(""));
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
        ReadGroupSpec that = (ReadGroupSpec) o;
        return readRange.equals(that.readRange) &&
                mode == that.mode &&
                keys.equals(that.keys) &&
                aggregateMethod.equals(that.aggregateMethod);
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(readRange, mode, keys, aggregateMethod);
    }

    @Override
    public String toString()
    {
        return toStringHelper(this)
                .add("readRange", readRange)
                .add("mode", mode)
                .add("keys", keys)
                .add("aggregateMethod", aggregateMethod.orElse(null))
                .omitNullValues()
                .toString();
    }
}
