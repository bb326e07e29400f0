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

/**
 * Which columns a pushed predicate may reference.
 */
public enum PredicateScope
{
    /**
     * Raw points: tags and the value column.
     */
    ALL_COLUMNS,
    /**
     * Rows that storage already aggregated or projected; only tags commute
     * with those operators.
     */
    TAG_COLUMNS,
}
