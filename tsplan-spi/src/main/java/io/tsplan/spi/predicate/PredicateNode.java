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
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableList;

import javax.annotation.Nullable;

import java.util.List;
import java.util.Objects;
import java.util.stream.Stream;

import static com.google.common.base.Preconditions.checkArgument;
import static io.tsplan.spi.predicate.NodeType.COMPARISON_EXPRESSION;
import static io.tsplan.spi.predicate.NodeType.FIELD_REF;
import static io.tsplan.spi.predicate.NodeType.LITERAL;
import static io.tsplan.spi.predicate.NodeType.LOGICAL_EXPRESSION;
import static io.tsplan.spi.predicate.NodeType.TAG_REF;
import static java.util.Objects.requireNonNull;

/**
 * Node of a storage predicate tree. Inner nodes are logical or comparison
 * expressions with exactly two children; leaves carry exactly one value.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class PredicateNode
{
    private final NodeType nodeType;
    private final List<PredicateNode> children;
    private final LogicalOperator logical;
    private final ComparisonOperator comparison;
    private final String stringValue;
    private final Boolean booleanValue;
    private final Long integerValue;
    private final Double floatValue;
    private final String regexValue;
    private final String tagRefValue;
    private final String fieldRefValue;

    @JsonCreator
    public PredicateNode(
            @JsonProperty("nodeType") NodeType nodeType,
            @JsonProperty("children") @Nullable List<PredicateNode> children,
            @JsonProperty("logical") @Nullable LogicalOperator logical,
            @JsonProperty("comparison") @Nullable ComparisonOperator comparison,
            @JsonProperty("stringValue") @Nullable String stringValue,
            @JsonProperty("booleanValue") @Nullable Boolean booleanValue,
            @JsonProperty("integerValue") @Nullable Long integerValue,
            @JsonProperty("floatValue") @Nullable Double floatValue,
            @JsonProperty("regexValue") @Nullable String regexValue,
            @JsonProperty("tagRefValue") @Nullable String tagRefValue,
            @JsonProperty("fieldRefValue") @Nullable String fieldRefValue)
    {
        this.nodeType = requireNonNull(nodeType, "nodeType is null");
        this.children = children == null ? ImmutableList.of() : ImmutableList.copyOf(children);
        this.logical = logical;
        this.comparison = comparison;
        this.stringValue = stringValue;
        this.booleanValue = booleanValue;
        this.integerValue = integerValue;
        this.floatValue = floatValue;
        this.regexValue = regexValue;
        this.tagRefValue = tagRefValue;
        this.fieldRefValue = fieldRefValue;

        long values = Stream.of(logical, comparison, stringValue, booleanValue, integerValue, floatValue, regexValue, tagRefValue, fieldRefValue)
                .filter(Objects::nonNull)
                .count();
        checkArgument(values == 1, "predicate node must carry exactly one value, found %s", values);
        switch (nodeType) {
            case LOGICAL_EXPRESSION:
                checkArgument(logical != null && this.children.size() == 2, "logical expression requires an operator and two children");
                break;
            case COMPARISON_EXPRESSION:
                checkArgument(comparison != null && this.children.size() == 2, "comparison expression requires an operator and two children");
                break;
            case TAG_REF:
                checkArgument(tagRefValue != null && this.children.isEmpty(), "tag reference requires a key and no children");
                break;
            case FIELD_REF:
                checkArgument(fieldRefValue != null && this.children.isEmpty(), "field reference requires a key and no children");
                break;
            case LITERAL:
                checkArgument(logical == null && comparison == null && tagRefValue == null && fieldRefValue == null, "literal requires a literal value");
                checkArgument(this.children.isEmpty(), "literal must not have children");
                break;
            default:
                throw new IllegalArgumentException("Unsupported node type: " + nodeType);
        }
    }

    public static PredicateNode logical(LogicalOperator operator, PredicateNode left, PredicateNode right)
    {
        return new PredicateNode(LOGICAL_EXPRESSION, ImmutableList.of(left, right), requireNonNull(operator, "operator is null"), null, null, null, null, null, null, null, null);
    }

    public static PredicateNode comparison(ComparisonOperator operator, PredicateNode left, PredicateNode right)
    {
        return new PredicateNode(COMPARISON_EXPRESSION, ImmutableList.of(left, right), null, requireNonNull(operator, "operator is null"), null, null, null, null, null, null, null);
    }

    public static PredicateNode stringLiteral(String value)
    {
        return new PredicateNode(LITERAL, null, null, null, requireNonNull(value, "value is null"), null, null, null, null, null, null);
    }

    public static PredicateNode booleanLiteral(boolean value)
    {
        return new PredicateNode(LITERAL, null, null, null, null, value, null, null, null, null, null);
    }

    public static PredicateNode integerLiteral(long value)
    {
        return new PredicateNode(LITERAL, null, null, null, null, null, value, null, null, null, null);
    }

    public static PredicateNode floatLiteral(double value)
    {
        return new PredicateNode(LITERAL, null, null, null, null, null, null, value, null, null, null);
    }

    public static PredicateNode regexLiteral(String pattern)
    {
        return new PredicateNode(LITERAL, null, null, null, null, null, null, null, requireNonNull(pattern, "pattern is null"), null, null);
    }

    public static PredicateNode tagRef(String key)
    {
        return new PredicateNode(TAG_REF, null, null, null, null, null, null, null, null, requireNonNull(key, "key is null"), null);
    }

    public static PredicateNode fieldRef(String key)
    {
        return new PredicateNode(FIELD_REF, null, null, null, null, null, null, null, null, null, requireNonNull(key, "key is null"));
    }

    @JsonProperty
    public NodeType getNodeType()
    {
        return nodeType;
    }

    @JsonProperty
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public List<PredicateNode> getChildren()
    {
        return children;
    }

    @Nullable
    @JsonProperty
    public LogicalOperator getLogical()
    {
        return logical;
    }

    @Nullable
    @JsonProperty
    public ComparisonOperator getComparison()
    {
        return comparison;
    }

    @Nullable
    @JsonProperty
    public String getStringValue()
    {
        return stringValue;
    }

    @Nullable
    @JsonProperty
    public Boolean getBooleanValue()
    {
        return booleanValue;
    }

    @Nullable
    @JsonProperty
    public Long getIntegerValue()
    {
        return integerValue;
    }

    @Nullable
    @JsonProperty
    public Double getFloatValue()
    {
        return floatValue;
    }

    @Nullable
    @JsonProperty
    public String getRegexValue()
    {
        return regexValue;
    }

    @Nullable
    @JsonProperty
    public String getTagRefValue()
    {
        return tagRefValue;
    }

    @Nullable
    @JsonProperty
    public String getFieldRefValue()
    {
        return fieldRefValue;
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
        PredicateNode other = (PredicateNode) obj;
        return nodeType == other.nodeType &&
                children.equals(other.children) &&
                logical == other.logical &&
                comparison == other.comparison &&
                Objects.equals(stringValue, other.stringValue) &&
                Objects.equals(booleanValue, other.booleanValue) &&
                Objects.equals(integerValue, other.integerValue) &&
                Objects.equals(floatValue, other.floatValue) &&
                Objects.equals(regexValue, other.regexValue) &&
                Objects.equals(tagRefValue, other.tagRefValue) &&
                Objects.equals(fieldRefValue, other.fieldRefValue);
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(nodeType, children, logical, comparison, stringValue, booleanValue, integerValue, floatValue, regexValue, tagRefValue, fieldRefValue);
    }

    @Override
    public String toString()
    {
        switch (nodeType) {
            case LOGICAL_EXPRESSION:
                return "(" + children.get(0) + " " + logical.name() + " " + children.get(1) + ")";
            case COMPARISON_EXPRESSION:
                return children.get(0) + " " + comparison.getSymbol() + " " + children.get(1);
            case TAG_REF:
                return StoragePredicate.displayTagKey(tagRefValue);
            case FIELD_REF:
                return "$" + fieldRefValue;
            default:
                if (stringValue != null) {
                    return "'" + stringValue + "'";
                }
                if (regexValue != null) {
                    return "/" + regexValue + "/";
                }
                return String.valueOf(Stream.of(booleanValue, integerValue, floatValue)
                        .filter(Objects::nonNull)
                        .findFirst()
                        .orElseThrow(() -> new IllegalStateException("literal without value")));
        }
    }
}
