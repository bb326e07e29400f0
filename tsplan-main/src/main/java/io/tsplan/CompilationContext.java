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
package io.tsplan;

import com.google.common.collect.ImmutableSet;
import io.tsplan.spi.BucketResolver;
import io.tsplan.spi.OrganizationId;

import java.util.Set;

import static com.google.common.base.MoreObjects.toStringHelper;
import static java.util.Objects.requireNonNull;

/**
 * Per-query inputs to planning. One context belongs to exactly one compilation.
 */
public final class CompilationContext
{
    private final OrganizationId organizationId;
    private final Set<Capability> capabilities;
    private final BucketResolver bucketResolver;

    public CompilationContext(OrganizationId organizationId, Set<Capability> capabilities, BucketResolver bucketResolver)
    {
        this.organizationId = requireNonNull(organizationId, "organizationId is null");
        this.capabilities = ImmutableSet.copyOf(requireNonNull(capabilities, "capabilities is null"));
        this.bucketResolver = requireNonNull(bucketResolver, "bucketResolver is null");
    }

    public OrganizationId getOrganizationId()
    {
        return organizationId;
    }

    public Set<Capability> getCapabilities()
    {
        return capabilities;
    }

    public boolean hasCapability(Capability capability)
    {
        return capabilities.contains(capability);
    }

    public BucketResolver getBucketResolver()
    {
        return bucketResolver;
    }

    @Override
    public String toString()
    {
        return toStringHelper(this)
                .add("organizationId", organizationId)
                .add("capabilities", capabilities)
                .toString();
    }
}
