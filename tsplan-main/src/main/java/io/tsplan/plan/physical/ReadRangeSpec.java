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

import io.tsplan.plan.Bounds;
import io.tsplan.plan.ProcedureKind;
import io.tsplan.spi.BucketId;
import io.tsplan.spi.BucketResolver;
import io.tsplan.spi.OrganizationId;
import io.tsplan.spi.TsplanException;
import io.tsplan.spi.predicate.StoragePredicate;

import java.util.Objects;
import java.util.Optional;

import static com.google.common.base.MoreObjects.toStringHelper;
import static com.google.common.base.Preconditions.checkArgument;
import static io.tsplan.PushdownErrorCode.BUCKET_NOT_FOUND;
import static io.tsplan.PushdownErrorCode.INVALID_BUCKET_ID;
import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Reads every series of one bucket within absolute time bounds, optionally
 * restricted by a storage predicate.
 */
public final class ReadRangeSpec
        implements ReadSpec
{
    private final Optional<String> bucket;
    private final Optional<String> bucketId;
    private final Bounds bounds;
    private final Optional<StoragePredicate> predicate;

    public ReadRangeSpec(Optional<String> bucket, Optional<String> bucketId, Bounds bounds, Optional<StoragePredicate> predicate)
    {
        this.bucket = requireNonNull(bucket, "bucket is null");
        this.bucketId = requireNonNull(bucketId, "bucketId is null");
        this.bounds = requireNonNull(bounds, "bounds is null");
        this.predicate = requireNonNull(predicate, "predicate is null");
        checkArgument(!(bucket.isPresent() && bucketId.isPresent()), "bucket and bucketId are both set");
    }

    public static ReadRangeSpec forBucket(String bucket, Bounds bounds)
    {
        return new ReadRangeSpec(Optional.of(bucket), Optional.empty(), bounds, Optional.empty());
    }

    public static ReadRangeSpec forBucketId(String bucketId, Bounds bounds)
    {
        return new ReadRangeSpec(Optional.empty(), Optional.of(bucketId), bounds, Optional.empty());
    }

    public Optional<String> getBucket()
    {
        return bucket;
    }

    public Optional<String> getBucketId()
    {
        return bucketId;
    }

    public Bounds getBounds()
    {
        return bounds;
    }

    public Bounds getTimeBounds()
    {
        return bounds;
    }

    @Override
    public Optional<StoragePredicate> getPredicate()
    {
        return predicate;
    }

    public ReadRangeSpec withPredicate(StoragePredicate predicate)
    {
        return new ReadRangeSpec(bucket, bucketId, bounds, Optional.of(predicate));
    }

    /**
     * Resolves the bucket this read scans. An explicit id is decoded without
     * consulting the resolver.
     */
    public BucketId lookupBucketId(OrganizationId organizationId, BucketResolver resolver)
    {
        if (bucketId.isPresent()) {
            try {
                return BucketId.fromString(bucketId.get());
            }
            catch (IllegalArgumentException e) {
                throw new TsplanException(INVALID_BUCKET_ID, "invalid bucket id", e);
            }
        }
        if (bucket.isPresent()) {
            return resolver.lookup(organizationId, bucket.get())
                    .orElseThrow(() -> new TsplanException(BUCKET_NOT_FOUND, format("could not find bucket \"%s\"", bucket.get())));
        }
        throw new TsplanException(INVALID_BUCKET_ID, "no bucket name or id have been specified");
    }

    @Override
    public ReadRangeSpec getReadRange()
    {
        return this;
    }

    @Override
    public ReadRangeSpec withReadRange(ReadRangeSpec readRange)
    {
        return readRange;
    }

    @Override
    public ProcedureKind getKind()
    {
        return ProcedureKind.READ_RANGE;
    }

    @Override
    public String getPlanDetails()
    {
        StringBuilder details = new StringBuilder();
        if (bucketId.isPresent()) {
            details.append(format("bucketID = \"%s\"", bucketId.get()));
        }
        else {
            details.append(format("bucket = \"%s\"", bucket.orElse("")));
        }
        details.append(", bounds = ").append(bounds);
        predicate.ifPresent(value -> details.append(", predicate = ").append(value));
        return details.toString();
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
        ReadRangeSpec that = (ReadRangeSpec) o;
        return bucket.equals(that.bucket) &&
                bucketId.equals(that.bucketId) &&
                bounds.equals(that.bounds) &&
                predicate.equals(that.predicate);
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(bucket, bucketId, bounds, predicate);
    }

    @Override
    public String toString()
    {
        return toStringHelper(this)
                .add("bucket", bucket.orElse(null))
                .add("bucketId", bucketId.orElse(null))
                .add("bounds", bounds)
                .add("predicate", predicate.orElse(null))
                .omitNullValues()
                .toString();
    }
}
