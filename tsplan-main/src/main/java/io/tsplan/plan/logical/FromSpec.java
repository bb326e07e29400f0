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

import java.util.Objects;
import java.util.Optional;

import static com.google.common.base.MoreObjects.toStringHelper;
import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Source of a query, naming the bucket either by name or by its encoded id.
 * Neither may be set; that is reported when the source is pushed down.
 */
public final class FromSpec
        implements ProcedureSpec
{
    private final Optional<String> bucket;
    private final Optional<String> bucketId;

    public FromSpec(Optional<String> bucket, Optional<String> bucketId)
    {
        this.bucket = requireNonNull(bucket, "bucket is null");
        this.bucketId = requireNonNull(bucketId, "bucketId is null");
    }

    public static FromSpec fromBucket(String bucket)
    {
        return new FromSpec(Optional.of(bucket), Optional.empty());
    }

    public static FromSpec fromBucketId(String bucketId)
    {
        return new FromSpec(Optional.empty(), Optional.of(bucketId));
    }

    public Optional<String> getBucket()
    {
        return bucket;
    }

    public Optional<String> getBucketId()
    {
        return bucketId;
    }

    @Override
    public ProcedureKind getKind()
    {
        return ProcedureKind.FROM;
    }

    @Override
    public String getPlanDetails()
    {
        if (bucketId.isPresent()) {
            return format("bucketID = \"%s\"", bucketId.get());
        }
        return format("bucket = \"%s\"", bucket.orElse(""));
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
        FromSpec that = (FromSpec) o;
        return bucket.equals(that.bucket) && bucketId.equals(that.bucketId);
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(bucket, bucketId);
    }

    @Override
    public String toString()
    {
        return toStringHelper(this)
                .add("bucket", bucket.orElse(null))
                .add("bucketId", bucketId.orElse(null))
                .omitNullValues()
                .toString();
    }
}
