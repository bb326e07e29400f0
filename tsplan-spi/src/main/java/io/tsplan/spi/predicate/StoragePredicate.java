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
package io.tsplan.spi.predicate;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import static java.util.Objects.requireNonNull;

/**
 * Rooted predicate tree handed to the storage engine's scan evaluator.
 */
public final class StoragePredicate
{
    public static final String MEASUREMENT_TAG_KEY = "\u0000";
    public static final String FIELD_TAG_KEY = "\u00ff";
    public static final String VALUE_FIELD_KEY = "_value";

    private final PredicateNode root;

    @JsonCreator
    public StoragePredicate(@JsonProperty("root") PredicateNode root)
    {
        this.root = requireNonNull(root, "root is null");
    }

    @JsonProperty
    public PredicateNode getRoot()
    {
        return root;
    }

    static String displayTagKey(String key)
    {
        if (MEASUREMENT_TAG_KEY.equals(key)) {
            return "_m";
        }
        if (FIELD_TAG_KEY.equals(key)) {
            return "_f";
        }
        return key;
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
        return root.equals(((StoragePredicate) obj).root);
    }

    @Override
    public int hashCode()
    {
        return root.hashCode();
    }

    @Override
    public String toString()
    {
        return root.toString();
    }
}
