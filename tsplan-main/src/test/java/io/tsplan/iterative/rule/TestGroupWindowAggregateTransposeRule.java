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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import io.tsplan.iterative.rule.test.BaseRuleTest;
import io.tsplan.iterative.rule.test.RuleAssert;
import io.tsplan.plan.PlanNode;
import io.tsplan.plan.logical.AggregateSpec;
import io.tsplan.plan.logical.GroupSpec;
import io.tsplan.plan.physical.ReadGroupSpec;
import io.tsplan.plan.physical.ReadRangeSpec;
import io.tsplan.plan.physical.ReadWindowAggregateSpec;
import io.tsplan.spi.type.CalendarDuration;
import org.testng.annotations.Test;

import static io.tsplan.Capability.GROUP_WINDOW_AGGREGATE_TRANSPOSE;
import static io.tsplan.assertions.PlanMatchPattern.node;
import static io.tsplan.assertions.PlanMatchPattern.spec;
import static io.tsplan.iterative.rule.test.PlanBuilder.BOUNDS;
import static io.tsplan.iterative.rule.test.RuleTester.BUCKET;
import static io.tsplan.plan.ProcedureKind.COUNT;
import static io.tsplan.plan.ProcedureKind.GROUP;
import static io.tsplan.plan.ProcedureKind.MAX;
import static io.tsplan.plan.ProcedureKind.MEAN;
import static io.tsplan.plan.ProcedureKind.MIN;
import static io.tsplan.plan.ProcedureKind.READ_WINDOW_AGGREGATE;
import static io.tsplan.plan.ProcedureKind.SUM;
import static io.tsplan.plan.logical.GroupMode.BY;
import static io.tsplan.plan.logical.GroupMode.NONE;
import static io.tsplan.plan.logical.WindowSpec.window;

public class TestGroupWindowAggregateTransposeRule
        extends BaseRuleTest
{
    private static final ReadRangeSpec READ_RANGE = ReadRangeSpec.forBucket(BUCKET, BOUNDS);
    private static final ReadGroupSpec GROUP_BY_HOST = ReadGroupSpec.readGroup(READ_RANGE, BY, ImmutableList.of("host"));
    private static final CalendarDuration ONE_MINUTE = CalendarDuration.parse("1m");

    @Test
    public void testMin()
    {
        assertTranspose()
                .on(p -> p.aggregate(p.window(p.node(GROUP_BY_HOST), window(ONE_MINUTE)), MIN))
                .matches(spec(
                        AggregateSpec.of(MIN),
                        spec(
                                new GroupSpec(BY, ImmutableList.of("host", "_start", "_stop")),
                                spec(ReadWindowAggregateSpec.windowAggregate(READ_RANGE, ONE_MINUTE, CalendarDuration.ZERO, MIN, false)))));
    }

    @Test
    public void testCountIsCombinedWithSum()
    {
        assertTranspose()
                .on(p -> p.aggregate(p.window(p.node(GROUP_BY_HOST), window(ONE_MINUTE)), COUNT))
                .matches(spec(
                        AggregateSpec.of(SUM),
                        spec(
                                new GroupSpec(BY, ImmutableList.of("host", "_start", "_stop")),
                                spec(ReadWindowAggregateSpec.windowAggregate(READ_RANGE, ONE_MINUTE, CalendarDuration.ZERO, COUNT, false)))));
    }

    @Test
    public void testGroupKeysAlreadyHoldWindowBounds()
    {
        ReadGroupSpec groupByStart = ReadGroupSpec.readGroup(READ_RANGE, BY, ImmutableList.of("_start", "host"));
        assertTranspose()
                .on(p -> p.aggregate(p.window(p.node(groupByStart), window(ONE_MINUTE)), MAX))
                .matches(spec(
                        AggregateSpec.of(MAX),
                        spec(
                                new GroupSpec(BY, ImmutableList.of("_start", "host", "_stop")),
                                node(READ_WINDOW_AGGREGATE))));
    }

    @Test
    public void testPositiveOffsetAndCreateEmpty()
    {
        CalendarDuration offset = CalendarDuration.parse("2m");
        assertTranspose()
                .on(p -> p.aggregate(p.window(p.node(GROUP_BY_HOST), window(ONE_MINUTE).withOffset(offset).withCreateEmpty(true)), SUM))
                .matches(spec(
                        AggregateSpec.of(SUM),
                        spec(
                                new GroupSpec(BY, ImmutableList.of("host", "_start", "_stop")),
                                spec(ReadWindowAggregateSpec.windowAggregate(READ_RANGE, ONE_MINUTE, offset, SUM, true)))));
    }

    @Test
    public void testMean()
    {
        assertTranspose()
                .on(p -> p.aggregate(p.window(p.node(GROUP_BY_HOST), window(ONE_MINUTE)), MEAN))
                .doesNotFire();
    }

    @Test
    public void testWithoutCapability()
    {
        tester().assertThat(new GroupWindowAggregateTransposeRule())
                .on(p -> p.aggregate(p.window(p.node(GROUP_BY_HOST), window(ONE_MINUTE)), MIN))
                .doesNotFire();
    }

    @Test
    public void testGroupNone()
    {
        ReadGroupSpec groupNone = ReadGroupSpec.readGroup(READ_RANGE, NONE, ImmutableList.of());
        assertTranspose()
                .on(p -> p.aggregate(p.window(p.node(groupNone), window(ONE_MINUTE)), MIN))
                .doesNotFire();
    }

    @Test
    public void testAggregateOverOtherColumn()
    {
        assertTranspose()
                .on(p -> p.node(AggregateSpec.selector(MIN, "_other"), p.window(p.node(GROUP_BY_HOST), window(ONE_MINUTE))))
                .doesNotFire();
    }

    @Test
    public void testWithSuccessor()
    {
        assertTranspose()
                .on(p -> {
                    PlanNode min = p.aggregate(p.window(p.node(GROUP_BY_HOST), window(ONE_MINUTE)), MIN);
                    p.aggregate(min, COUNT);
                    return min;
                })
                .matchesPlan(node(COUNT, node(MIN, node(GROUP, node(READ_WINDOW_AGGREGATE)))));
    }

    private RuleAssert assertTranspose()
    {
        return tester().assertThat(new GroupWindowAggregateTransposeRule())
                .withCapabilities(ImmutableSet.of(GROUP_WINDOW_AGGREGATE_TRANSPOSE));
    }
}
