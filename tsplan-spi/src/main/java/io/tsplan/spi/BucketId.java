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
package io.tsplan.spi;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Opaque identifier of a bucket, encoded as 16 hexadecimal characters.
 */
public final class BucketId
{
    private final long id;

    public BucketId(long id)
    {
        checkArgument(id != 0, "bucket id must not be zero");
        this.id = id;
    }

    /**
     * @throws IllegalArgumentException if the value is not a valid encoded id
     */
    @JsonCreator
    public static BucketId fromString(String value)
    {
        return new BucketId(PlatformIds.decode(value));
    }

    public long getId()
    {
        return id;
    }

    @JsonValue
    @Override
    public String toString()
    {
        return PlatformIds.encode(id);
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
        return id == ((BucketId) obj).id;
    }

    @Override
    public int hashCode()
    {
        return Long.hashCode(id);
    }
}
