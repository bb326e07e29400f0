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
import io.tsplan.plan.physical.ReadTagValuesSpec;
import org.testng.annotations.Test;

import static io.tsplan.assertions.PlanMatchPattern.node;
import static io.tsplan.assertions.PlanMatchPattern.spec;
import static io.tsplan.iterative.rule.test.PlanBuilder.BOUNDS;
import static io.tsplan.iterative.rule.test.RuleTester.BUCKET;
import static io.tsplan.plan.ProcedureKind.COUNT;
import static io.tsplan.plan.logical.GroupMode.BY;
import static io.tsplan.plan.logical.GroupMode.NONE;

public class TestPushDownReadTagValuesRule
        extends BaseRuleTest
{
    private static final ReadRangeSpec READ_RANGE = ReadRangeSpec.forBucket(BUCKET, BOUNDS);

    @Test
    public void testSimple()
    {
        tester().assertThat(new PushDownReadTagValuesRule())
                .on(p -> p.distinct(p.group(p.keep(p.node(READ_RANGE), "host"), BY), "host"))
                .matches(spec(new ReadTagValuesSpec(READ_RANGE, "host")));
    }

    @Test
    public void testWithSuccessor()
    {
        tester().assertThat(new PushDownReadTagValuesRule())
                .on(p -> {
                    PlanNode distinct = p.distinct(p.group(p.keep(p.node(READ_RANGE), "host"), BY), "host");
                    p.aggregate(distinct, COUNT);
                    return distinct;
                })
                .matchesPlan(node(COUNT, spec(new ReadTagValuesSpec(READ_RANGE, "host"))));
    }

    @Test
    public void testDistinctOnOtherColumn()
    {
        tester().assertThat(new PushDownReadTagValuesRule())
                .on(p -> p.distinct(p.group(p.keep(p.node(READ_RANGE), "host"), BY), "region"))
                .doesNotFire();
    }

    @Test
    public void testGroupedByKeys()
    {
        tester().assertThat(new PushDownReadTagValuesRule())
                .on(p -> p.distinct(p.group(p.keep(p.node(READ_RANGE), "host"), BY, "host"), "host"))
                .doesNotFire();
        tester().assertThat(new PushDownReadTagValuesRule())
                .on(p -> p.distinct(p.group(p.keep(p.node(READ_RANGE), "host"), NONE), "host"))
                .doesNotFire();
    }

    @Test
    public void testKeepMultipleColumns()
    {
        tester().assertThat(new PushDownReadTagValuesRule())
                .on(p -> p.distinct(p.group(p.keep(p.node(READ_RANGE), "host", "region"), BY), "host"))
                .doesNotFire();
    }

    @Test
    public void testGroupWithMultipleSuccessors()
    {
        tester().assertThat(new PushDownReadTagValuesRule())
                .on(p -> {
                    PlanNode group = p.group(p.keep(p.node(READ_RANGE), "host"), BY);
                    p.aggregate(group, COUNT);
                    return p.distinct(group, "host");
                })
                .doesNotFire();
    }
}
