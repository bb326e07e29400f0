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
package io.tsplan.spi.type;

import com.google.common.collect.ImmutableMap;

import java.util.Map;
import java.util.Objects;

import static com.google.common.base.Preconditions.checkArgument;
import static java.lang.String.format;
import static java.util.concurrent.TimeUnit.DAYS;
import static java.util.concurrent.TimeUnit.HOURS;
import static java.util.concurrent.TimeUnit.MICROSECONDS;
import static java.util.concurrent.TimeUnit.MILLISECONDS;
import static java.util.concurrent.TimeUnit.MINUTES;
import static java.util.concurrent.TimeUnit.SECONDS;

/**
 * A duration that keeps calendar months apart from fixed nanoseconds, so that
 * {@code 1mo} and {@code 30d} are different values. Years are stored as
 * twelve months.
 */
public final class CalendarDuration
{
    public static final CalendarDuration ZERO = new CalendarDuration(0, 0, false);
    public static final CalendarDuration MAX = new CalendarDuration(0, Long.MAX_VALUE, false);

    private static final long NANOS_PER_WEEK = DAYS.toNanos(7);

    // ordered from the largest unit down, as printed
    private static final Map<String, Long> FIXED_UNITS = ImmutableMap.<String, Long>builder()
            .put("w", NANOS_PER_WEEK)
            .put("d", DAYS.toNanos(1))
            .put("h", HOURS.toNanos(1))
            .put("m", MINUTES.toNanos(1))
            .put("s", SECONDS.toNanos(1))
            .put("ms", MILLISECONDS.toNanos(1))
            .put("us", MICROSECONDS.toNanos(1))
            .put("ns", 1L)
            .build();

    private final long months;
    private final long nanoseconds;
    private final boolean negative;

    private CalendarDuration(long months, long nanoseconds, boolean negative)
    {
        checkArgument(months >= 0, "months is negative");
        checkArgument(nanoseconds >= 0, "nanoseconds is negative");
        this.months = months;
        this.nanoseconds = nanoseconds;
        this.negative = negative && (months != 0 || nanoseconds != 0);
    }

    public static CalendarDuration of(long months, long nanoseconds, boolean negative)
    {
        return new CalendarDuration(months, nanoseconds, negative);
    }

    public static CalendarDuration ofNanos(long nanoseconds)
    {
        if (nanoseconds < 0) {
            checkArgument(nanoseconds != Long.MIN_VALUE, "duration out of range");
            return new CalendarDuration(0, -nanoseconds, true);
        }
        return new CalendarDuration(0, nanoseconds, false);
    }

    public static CalendarDuration ofMonths(long months)
    {
        if (months < 0) {
            return new CalendarDuration(-months, 0, true);
        }
        return new CalendarDuration(months, 0, false);
    }

    /**
     * Parses a duration literal such as {@code 1m}, {@code 1h30m}, {@code 1mo5m}
     * or {@code -2y}.
     */
    public static CalendarDuration parse(String value)
    {
        checkArgument(value != null && !value.isEmpty(), "duration is empty");
        int position = 0;
        boolean negative = false;
        if (value.charAt(0) == '-') {
            negative = true;
            position++;
        }
        checkArgument(position < value.length(), "invalid duration: %s", value);

        long months = 0;
        long nanoseconds = 0;
        while (position < value.length()) {
            int start = position;
            while (position < value.length() && Character.isDigit(value.charAt(position))) {
                position++;
            }
            checkArgument(position > start, "invalid duration: %s", value);
            long magnitude = parseMagnitude(value, value.substring(start, position));

            start = position;
            while (position < value.length() && !Character.isDigit(value.charAt(position))) {
                position++;
            }
            String unit = value.substring(start, position);
            try {
                switch (unit) {
                    case "y":
                        months = Math.addExact(months, Math.multiplyExact(magnitude, 12));
                        break;
                    case "mo":
                        months = Math.addExact(months, magnitude);
                        break;
                    case "\u00b5s":
                        nanoseconds = Math.addExact(nanoseconds, Math.multiplyExact(magnitude, FIXED_UNITS.get("us")));
                        break;
                    default:
                        Long unitNanos = FIXED_UNITS.get(unit);
                        checkArgument(unitNanos != null, "invalid duration unit '%s' in %s", unit, value);
                        nanoseconds = Math.addExact(nanoseconds, Math.multiplyExact(magnitude, unitNanos));
                }
            }
            catch (ArithmeticException e) {
                throw new IllegalArgumentException("duration out of range: " + value, e);
            }
        }
        return new CalendarDuration(months, nanoseconds, negative);
    }

    private static long parseMagnitude(String value, String digits)
    {
        try {
            return Long.parseLong(digits);
        }
        catch (NumberFormatException e) {
            throw new IllegalArgumentException("duration out of range: " + value, e);
        }
    }

    public long getMonths()
    {
        return months;
    }

    public long getNanoseconds()
    {
        return nanoseconds;
    }

    public boolean isNegative()
    {
        return negative;
    }

    public boolean isZero()
    {
        return months == 0 && nanoseconds == 0;
    }

    public boolean isPositive()
    {
        return !negative && !isZero();
    }

    @Override
    public boolean equals(Object obj)
    {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        CalendarDuration other = (CalendarDuration) obj;
        return months == other.months &&
                nanoseconds == other.nanoseconds &&
                negative == other.negative;
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(months, nanoseconds, negative);
    }

    @Override
    public String toString()
    {
        if (isZero()) {
            return "0s";
        }
        StringBuilder builder = new StringBuilder();
        if (negative) {
            builder.append('-');
        }
        if (months / 12 > 0) {
            builder.append(format("%sy", months / 12));
        }
        if (months % 12 > 0) {
            builder.append(format("%smo", months % 12));
        }
        long remaining = nanoseconds;
        for (Map.Entry<String, Long> unit : FIXED_UNITS.entrySet()) {
            long count = remaining / unit.getValue();
            if (count > 0) {
                builder.append(count).append(unit.getKey());
                remaining -= count * unit.getValue();
            }
        }
        return builder.toString();
    }
}
