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
import io.tsplan.spi.type.CalendarDuration;

import java.util.Objects;

import static com.google.common.base.MoreObjects.toStringHelper;
import static io.tsplan.plan.ColumnNames.START;
import static io.tsplan.plan.ColumnNames.STOP;
import static io.tsplan.plan.ColumnNames.TIME;
import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Windowing of the time axis. A window is tumbling when {@code period} equals
 * {@code every}; it is sliding otherwise.
 */
public final class WindowSpec
        implements ProcedureSpec
{
    private final CalendarDuration every;
    private final CalendarDuration period;
    private final CalendarDuration offset;
    private final String timeColumn;
    private final String startColumn;
    private final String stopColumn;
    private final boolean createEmpty;

    public WindowSpec(
            CalendarDuration every,
            CalendarDuration period,
            CalendarDuration offset,
            String timeColumn,
            String startColumn,
            String stopColumn,
            boolean createEmpty)
    {
        this.every = requireNonNull(every, "every is null");
        this.period = requireNonNull(period, "period is null");
        this.offset = requireNonNull(offset, "offset is null");
        this.timeColumn = requireNonNull(timeColumn, "timeColumn is null");
        this.startColumn = requireNonNull(startColumn, "startColumn is null");
        this.stopColumn = requireNonNull(stopColumn, "stopColumn is null");
        this.createEmpty = createEmpty;
    }

    /**
     * Tumbling window with no offset over the default time columns.
     */
    public static WindowSpec window(CalendarDuration every)
    {
        return new WindowSpec(every, every, CalendarDuration.ZERO, TIME, START, STOP, false);
    }

    public CalendarDuration getEvery()
    {
        return every;
    }

    public CalendarDuration getPeriod()
    {
        return period;
    }

    public CalendarDuration getOffset()
    {
        return offset;
    }

    public String getTimeColumn()
    {
        return timeColumn;
    }

    public String getStartColumn()
    {
        return startColumn;
    }

    public String getStopColumn()
    {
        return stopColumn;
    }

    public boolean isCreateEmpty()
    {
        return createEmpty;
    }

    public boolean hasDefaultColumns()
    {
        return timeColumn.equals(TIME) && startColumn.equals(START) && stopColumn.equals(STOP);
    }

    public WindowSpec withPeriod(CalendarDuration period)
    {
        return new WindowSpec(every, period, offset, timeColumn, startColumn, stopColumn, createEmpty);
    }

    public WindowSpec withOffset(CalendarDuration offset)
    {
        return new WindowSpec(every, period, offset, timeColumn, startColumn, stopColumn, createEmpty);
    }

    public WindowSpec withColumns(String timeColumn, String startColumn, String stopColumn)
    {
        return new WindowSpec(every, period, offset, timeColumn, startColumn, stopColumn, createEmpty);
    }

    public WindowSpec withCreateEmpty(boolean createEmpty)
    {
        return new WindowSpec(every, period, offset, timeColumn, startColumn, stopColumn, createEmpty);
    }

    @Override
    public ProcedureKind getKind()
    {
        return ProcedureKind.WINDOW;
    }

    @Override
    public String getPlanDetails()
    {
        return format("every = %s, period = %s, offset = %s, createEmpty = %s", every, period, offset, createEmpty);
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
        WindowSpec that = (WindowSpec) o;
        return createEmpty == that.createEmpty &&
                every.equals(that.every) &&
                period.equals(that.period) &&
                offset.equals(that.offset) &&
                timeColumn.equals(that.timeColumn) &&
                startColumn.equals(that.startColumn) &&
                stopColumn.equals(that.stopColumn);
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(every, period, offset, timeColumn, startColumn, stopColumn, createEmpty);
    }

    @Override
    public String toString()
    {
        return toStringHelper(this)
                .add("every", every)
                .add("period", period)
                .add("offset", offset)
                .add("timeColumn", timeColumn)
                .add("startColumn", startColumn)
                .add("stopColumn", stopColumn)
                .add("createEmpty", createEmpty)
                .toString();
    }
}
