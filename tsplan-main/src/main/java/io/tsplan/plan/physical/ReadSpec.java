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

import io.tsplan.plan.ProcedureSpec;
import io.tsplan.spi.predicate.StoragePredicate;

import java.util.Optional;

/**
 * A physical operator that scans storage. Every such operator is a storage
 * range read refined by what was pushed into it.
 */
public interface ReadSpec
        extends ProcedureSpec
{
    ReadRangeSpec getReadRange();

    ReadSpec withReadRange(ReadRangeSpec readRange);

    default Optional<StoragePredicate> getPredicate()
    {
        return getReadRange().getPredicate();
    }
}
