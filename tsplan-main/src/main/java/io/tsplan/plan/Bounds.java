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

import java.time.Instant;
import java.util.Objects;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/**
 * Absolute time interval {@code [start, stop)} a scan is restricted to.
 */
public final class Bounds
{
    private final Instant start;
    private final Instant stop;

    public Bounds(Instant start, Instant stop)
    {
        this.start = requireNonNull(start, "start is null");
        this.stop = requireNonNull(stop, "stop is null");
        checkArgument(!stop.isBefore(start), "stop %s is before start %s", stop, start);
    }

    public Instant getStart()
    {
        return start;
    }

    public Instant getStop()
    {
        return stop;
    }

    public boolean isEmpty()
    {
        return start.equals(stop);
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
        Bounds that = (Bounds) o;
        return start.equals(that.start) && stop.equals(that.stop);
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(start, stop);
    }

    @Override
    public String toString()
    {
        return "[" + start + ", " + stop + ")";
    }
}
