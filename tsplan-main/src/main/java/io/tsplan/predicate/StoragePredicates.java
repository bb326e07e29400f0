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
package io.tsplan.predicate;

import io.tsplan.spi.predicate.LogicalOperator;
import io.tsplan.spi.predicate.PredicateNode;
import io.tsplan.spi.predicate.StoragePredicate;

import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;

public final class StoragePredicates
{
    private StoragePredicates() {}

    /**
     * Combines the predicates nested to the right: {@code p0 op (p1 op (p2 op p3))}.
     */
    public static StoragePredicate merge(LogicalOperator operator, List<StoragePredicate> predicates)
    {
        checkArgument(!predicates.isEmpty(), "at least one predicate is needed");
        PredicateNode root = predicates.get(predicates.size() - 1).getRoot();
        for (int i = predicates.size() - 2; i >= 0; i--) {
            root = PredicateNode.logical(operator, predicates.get(i).getRoot(), root);
        }
        return new StoragePredicate(root);
    }
}
