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
import io.tsplan.spi.type.CalendarDuration;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

import static com.google.common.base.MoreObjects.toStringHelper;
import static com.google.common.base.Preconditions.checkArgument;
import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * A range read that aggregates each series per window in storage. The time
 * column, when set, names the window bound ({@code _start} or {@code _stop})
 * that storage reports as each row's {@code _time}.
 */
public final class ReadWindowAggregateSpec
        implements ReadSpec
{
    private final ReadRangeSpec readRange;
    private final CalendarDuration every;
    private final CalendarDuration offset;
    private final List<ProcedureKind> aggregates;
    private final boolean createEmpty;
    private final Optional<String> timeColumn;

    public ReadWindowAggregateSpec(
            ReadRangeSpec readRange,
            CalendarDuration every,
            CalendarDuration offset,
            List<ProcedureKind> aggregates,
            boolean createEmpty,
            Optional<String> timeColumn)
    {
        this.readRange = requireNonNull(readRange, "readRange is null");
        this.every = requireNonNull(every, "every is null");
        this.offset = requireNonNull(offset, "offset is null");
        this.aggregates = ImmutableList.copyOf(requireNonNull(aggregates, "aggregates is null"));
        this.createEmpty = createEmpty;
        this.timeColumn = requireNonNull(timeColumn, "timeColumn is null");
        checkArgument(!aggregates.isEmpty(), "aggregates is empty");
    }

    public static ReadWindowAggregateSpec windowAggregate(ReadRangeSpec readRange, CalendarDuration every, CalendarDuration offset, ProcedureKind aggregate, boolean createEmpty)
    {
        return new ReadWindowAggregateSpec(readRange, every, offset, ImmutableList.of(aggregate), createEmpty, Optional.empty());
    }

    @Override
    public ReadRangeSpec getReadRange()
    {
        return readRange;
    }

    @Override
    public ReadWindowAggregateSpec withReadRange(ReadRangeSpec readRange)
    {
        return new ReadWindowAggregateSpec(readRange, every, offset, aggregates, createEmpty, timeColumn);
    }

    public CalendarDuration getEvery()
    {
        return every;
    }

    public CalendarDuration getOffset()
    {
        return offset;
    }

    public List<ProcedureKind> getAggregates()
    {
        return aggregates;
    }

    public boolean isCreateEmpty()
    {
        return createEmpty;
    }

    public Optional<String> getTimeColumn()
    {
        return timeColumn;
    }

    public ReadWindowAggregateSpec withTimeColumn(String timeColumn)
    {
        return new ReadWindowAggregateSpec(readRange, every, offset, aggregates, createEmpty, Optional.of(timeColumn));
    }

    @Override
    public ProcedureKind getKind()
    {
        return ProcedureKind.READ_WINDOW_AGGREGATE;
    }

    @Override
    public String getPlanDetails()
    {
        return format("every = %s, aggregates = %s, createEmpty = %s, timeColumn = \"%s\"", every, aggregates, createEmpty, timeColumn.orElse(""));
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
        ReadWindowAggregateSpec that = (ReadWindowAggregateSpec) o;
        return createEmpty == that.createEmpty &&
                readRange.equals(that.readRange) &&
                every.equals(that.every) &&
                offset.equals(that.offset) &&
                aggregates.equals(that.aggregates) &&
                timeColumn.equals(that.timeColumn);
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(readRange, every, offset, aggregates, createEmpty, timeColumn);
    }

    @Override
    public String toString()
    {
        return toStringHelper(this)
                .add("readRange", readRange)
                .add("every", every)
                .add("offset", offset)
                .add("aggregates", aggregates)
                .add("createEmpty", createEmpty)
                .add("timeColumn", timeColumn.orElse(null))
                .omitNullValues()
                .toString();
    }
}
