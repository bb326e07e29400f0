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
package io.tsplan.iterative.rule.test;

import com.google.common.collect.ImmutableSet;
import io.tsplan.CompilationContext;
import io.tsplan.iterative.Rule;
import io.tsplan.spi.BucketId;
import io.tsplan.spi.BucketResolver;
import io.tsplan.spi.OrganizationId;
import io.tsplan.testing.InMemoryBucketResolver;

public class RuleTester
{
    public static final OrganizationId ORGANIZATION_ID = new OrganizationId(0x0a1b2c3d4e5f6071L);
    public static final String BUCKET = "my-bucket";
    public static final BucketId BUCKET_ID = new BucketId(0x0123456789abcdefL);

    private final BucketResolver bucketResolver = InMemoryBucketResolver.builder()
            .addBucket(ORGANIZATION_ID, BUCKET, BUCKET_ID)
            .build();

    public RuleAssert assertThat(Rule<?> rule)
    {
        return new RuleAssert(rule, new CompilationContext(ORGANIZATION_ID, ImmutableSet.of(), bucketResolver));
    }

    public BucketResolver getBucketResolver()
    {
        return bucketResolver;
    }
}
