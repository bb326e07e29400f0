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
package io.tsplan.iterative.rule;

import io.tsplan.iterative.rule.test.BaseRuleTest;
import io.tsplan.plan.PlanNode;
import io.tsplan.plan.physical.ReadRangeSpec;
import io.tsplan.plan.physical.ReadWindowAggregateSpec;
import io.tsplan.spi.type.CalendarDuration;
import org.testng.annotations.Test;

import static io.tsplan.assertions.PlanMatchPattern.spec;
import static io.tsplan.iterative.rule.test.PlanBuilder.BOUNDS;
import static io.tsplan.iterative.rule.test.RuleTester.BUCKET;
import static io.tsplan.plan.ColumnNames.START;
import static io.tsplan.plan.ColumnNames.STOP;
import static io.tsplan.plan.ColumnNames.TIME;
import static io.tsplan.plan.ProcedureKind.COUNT;
import static io.tsplan.plan.logical.WindowSpec.window;

public class TestPushDownWindowAggregateByTimeRule
        extends BaseRuleTest
{
    private static final ReadRangeSpec READ_RANGE = ReadRangeSpec.forBucket(BUCKET, BOUNDS);
    private static final ReadWindowAggregateSpec COUNT_PER_MINUTE = ReadWindowAggregateSpec.windowAggregate(READ_RANGE, CalendarDuration.parse("1m"), CalendarDuration.ZERO, COUNT, false);

    @Test
    public void testStopAsTime()
    {
        tester().assertThat(new PushDownWindowAggregateByTimeRule())
                .on(p -> p.window(p.duplicate(p.node(COUNT_PER_MINUTE), STOP, TIME), window(CalendarDuration.MAX)))
                .matches(spec(COUNT_PER_MINUTE.withTimeColumn(STOP)));
    }

    @Test
    public void testStartAsTime()
    {
        tester().assertThat(new PushDownWindowAggregateByTimeRule())
                .on(p -> p.window(p.duplicate(p.node(COUNT_PER_MINUTE), START, TIME), window(CalendarDuration.MAX)))
                .matches(spec(COUNT_PER_MINUTE.withTimeColumn(START)));
    }

    @Test
    public void testCreateEmptyAggregate()
    {
        ReadWindowAggregateSpec createEmpty = ReadWindowAggregateSpec.windowAggregate(READ_RANGE, CalendarDuration.parse("1m"), CalendarDuration.ZERO, COUNT, true);
        tester().assertThat(new PushDownWindowAggregateByTimeRule())
                .on(p -> p.window(p.duplicate(p.node(createEmpty), STOP, TIME), window(CalendarDuration.MAX)))
                .matches(spec(createEmpty.withTimeColumn(STOP)));
    }

    @Test
    public void testInvalidDuplicateColumn()
    {
        tester().assertThat(new PushDownWindowAggregateByTimeRule())
                .on(p -> p.window(p.duplicate(p.node(COUNT_PER_MINUTE), "_value", TIME), window(CalendarDuration.MAX)))
                .doesNotFire();
    }

    @Test
    public void testInvalidDuplicateAs()
    {
        tester().assertThat(new PushDownWindowAggregateByTimeRule())
                .on(p -> p.window(p.duplicate(p.node(COUNT_PER_MINUTE), STOP, "time"), window(CalendarDuration.MAX)))
                .doesNotFire();
    }

    @Test
    public void testInvalidClosingWindow()
    {
        tester().assertThat(new PushDownWindowAggregateByTimeRule())
                .on(p -> p.window(p.duplicate(p.node(COUNT_PER_MINUTE), STOP, TIME), window(CalendarDuration.parse("1h"))))
                .doesNotFire();
        tester().assertThat(new PushDownWindowAggregateByTimeRule())
                .on(p -> p.window(p.duplicate(p.node(COUNT_PER_MINUTE), STOP, TIME), window(CalendarDuration.MAX).withCreateEmpty(true)))
                .doesNotFire();
        tester().assertThat(new PushDownWindowAggregateByTimeRule())
                .on(p -> p.window(p.duplicate(p.node(COUNT_PER_MINUTE), STOP, TIME), window(CalendarDuration.MAX).withOffset(CalendarDuration.parse("1m"))))
                .doesNotFire();
    }

    @Test
    public void testTimeColumnAlreadySet()
    {
        tester().assertThat(new PushDownWindowAggregateByTimeRule())
                .on(p -> p.window(p.duplicate(p.node(COUNT_PER_MINUTE.withTimeColumn(STOP)), STOP, TIME), window(CalendarDuration.MAX)))
                .doesNotFire();
    }

    @Test
    public void testAggregateWithMultipleSuccessors()
    {
        tester().assertThat(new PushDownWindowAggregateByTimeRule())
                .on(p -> {
                    PlanNode read = p.node(COUNT_PER_MINUTE);
                    p.keep(read, "_value");
                    return p.window(p.duplicate(read, STOP, TIME), window(CalendarDuration.MAX));
                })
                .doesNotFire();
    }
}
