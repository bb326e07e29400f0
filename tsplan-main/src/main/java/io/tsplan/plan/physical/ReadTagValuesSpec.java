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

import io.tsplan.plan.ProcedureKind;

import java.util.Objects;

import static com.google.common.base.MoreObjects.toStringHelper;
import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Lists the distinct values of one tag across the series a range read would scan.
 */
public final class ReadTagValuesSpec
        implements ReadSpec
{
    private final ReadRangeSpec readRange;
    private final String tagKey;

    public ReadTagValuesSpec(ReadRangeSpec readRange, String tagKey)
    {
        this.readRange = requireNonNull(readRange, "readRange is null");
        this.tagKey = requireNonNull(tagKey, "tagKey is null");
    }

    @Override
    public ReadRangeSpec getReadRange()
    {
        return readRange;
    }

    @Override
    public ReadTagValuesSpec withReadRange(ReadRangeSpec readRange)
    {
        return new ReadTagValuesSpec(readRange, tagKey);
    }

    public String getTagKey()
    {
        return tagKey;
    }

    @Override
    public ProcedureKind getKind()
    {
        return ProcedureKind.READ_TAG_VALUES;
    }

    @Override
    public String getPlanDetails()
    {
        return format("%s, tagKey = \"%s\"", readRange.getPlanDetails(), tagKey);
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
        ReadTagValuesSpec that = (ReadTagValuesSpec) o;
        return readRange.equals(that.readRange) && tagKey.equals(that.tagKey);
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(readRange, tagKey);
    }

    @Override
    public String toString()
    {
        return toStringHelper(this)
                .add("readRange", readRange)
                .add("tagKey", tagKey)
                .toString();
    }
}
