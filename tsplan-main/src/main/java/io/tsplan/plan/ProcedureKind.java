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
package io.tsplan.plan;

import static java.util.Objects.requireNonNull;

/**
 * Tag of every operator a plan node can carry. Logical kinds come from the
 * query; physical kinds are produced by pushdown and run inside storage.
 */
public enum ProcedureKind
{
    FROM("from", false),
    RANGE("range", false),
    FILTER("filter", false),
    GROUP("group", false),
    WINDOW("window", false),
    MIN("min", false),
    MAX("max", false),
    FIRST("first", false),
    LAST("last", false),
    COUNT("count", false),
    SUM("sum", false),
    MEAN("mean", false),
    DUPLICATE("duplicate", false),
    KEEP("keep", false),
    RENAME("rename", false),
    KEYS("keys", false),
    DISTINCT("distinct", false),

    READ_RANGE("ReadRange", true),
    READ_GROUP("ReadGroup", true),
    READ_GROUP_AGGREGATE("ReadGroupAggregate", true),
    READ_WINDOW_AGGREGATE("ReadWindowAggregate", true),
    READ_TAG_KEYS("ReadTagKeys", true),
    READ_TAG_VALUES("ReadTagValues", true);

    private final String name;
    private final boolean physical;

    ProcedureKind(String name, boolean physical)
    {
        this.name = requireNonNull(name, "name is null");
        this.physical = physical;
    }

    public String getName()
    {
        return name;
    }

    public boolean isPhysical()
    {
        return physical;
    }

    @Override
    public String toString()
    {
        return name;
    }
}
