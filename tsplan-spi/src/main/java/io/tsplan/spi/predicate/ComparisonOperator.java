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
import com.fasterxml.jackson.annotation.JsonValue;

import static java.util.Objects.requireNonNull;

public enum ComparisonOperator
{
    EQUAL("Equal", "=="),
    NOT_EQUAL("NotEqual", "!="),
    STARTS_WITH("StartsWith", "startswith"),
    REGEX("Regex", "=~"),
    NOT_REGEX("NotRegex", "!~"),
    LESS("Less", "<"),
    LESS_EQUAL("LessEqual", "<="),
    GREATER("Greater", ">"),
    GREATER_EQUAL("GreaterEqual", ">=");

    private final String wireName;
    private final String symbol;

    ComparisonOperator(String wireName, String symbol)
    {
        this.wireName = requireNonNull(wireName, "wireName is null");
        this.symbol = requireNonNull(symbol, "symbol is null");
    }

    @JsonValue
    public String getWireName()
    {
        return wireName;
    }

    public String getSymbol()
    {
        return symbol;
    }

    @JsonCreator
    public static ComparisonOperator fromWireName(String wireName)
    {
        for (ComparisonOperator operator : values()) {
            if (operator.wireName.equals(wireName)) {
                return operator;
            }
        }
        throw new IllegalArgumentException("Unknown comparison operator: " + wireName);
    }
}
