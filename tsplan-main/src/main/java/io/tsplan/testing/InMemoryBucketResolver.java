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
package io.tsplan.testing;

import com.google.common.collect.ImmutableMap;
import io.tsplan.spi.BucketId;
import io.tsplan.spi.BucketResolver;
import io.tsplan.spi.OrganizationId;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

public class InMemoryBucketResolver
        implements BucketResolver
{
    private final Map<OrganizationId, Map<String, BucketId>> buckets;

    private InMemoryBucketResolver(Map<OrganizationId, Map<String, BucketId>> buckets)
    {
        this.buckets = requireNonNull(buckets, "buckets is null");
    }

    public static Builder builder()
    {
        return new Builder();
    }

    @Override
    public Optional<BucketId> lookup(OrganizationId organizationId, String bucketName)
    {
        return Optional.ofNullable(buckets.getOrDefault(organizationId, ImmutableMap.of()).get(bucketName));
    }

    public static class Builder
    {
        private final Map<OrganizationId, ImmutableMap.Builder<String, BucketId>> buckets = new LinkedHashMap<>();

        public Builder addBucket(OrganizationId organizationId, String name, BucketId id)
        {
            buckets.computeIfAbsent(organizationId, ignored -> ImmutableMap.builder()).put(name, id);
            return this;
        }

        public InMemoryBucketResolver build()
        {
            ImmutableMap.Builder<OrganizationId, Map<String, BucketId>> result = ImmutableMap.builder();
            buckets.forEach((organizationId, names) -> result.put(organizationId, names.build()));
            return new InMemoryBucketResolver(result.build());
        }
    }
}
