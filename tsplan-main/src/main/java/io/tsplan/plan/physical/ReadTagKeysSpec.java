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

import static com.google.common.base.MoreObjects.toStringHelper;
import static java.util.Objects.requireNonNull;

/**
 * Lists the distinct tag keys of the series a range read would scan.
 */
public final class ReadTagKeysSpec
        implements ReadSpec
{
    private final ReadRangeSpec readRange;

    public ReadTagKeysSpec(ReadRangeSpec readRange)
    {
        this.readRange = requireNonNull(readRange, "readRange is null");
    }

    @Override
    public ReadRangeSpec getReadRange()
    {
        return readRange;
    }

    @Override
    public ReadTagKeysSpec withReadRange(ReadRangeSpec readRange)
    {
        return new ReadTagKeysSpec(readRange);
    }

    @Override
    public ProcedureKind getKind()
    {
        return ProcedureKind.READ_TAG_KEYS;
    }

    @Override
    public String getPlanDetails()
    {
        return readRange.getPlanDetails();
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
        return readRange.equals(((ReadTagKeysSpec) o).readRange);
    }

    @Override
    public int hashCode()
    {
        return readRange.hashCode();
    }

    @Override
    public String toString()
    {
        return toStringHelper(this)
                .add("readRange", readRange)
                .toString();
    }
}
