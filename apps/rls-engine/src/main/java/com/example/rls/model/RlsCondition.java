package com.example.rls.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Leaf condition of an RLS filter.
 *
 * <p>Exactly one value source is expected, matching {@link #filterType()}: a literal
 * {@code value} (static), a {@link UserAttribute} (dynamic) or a raw {@code expression}.
 * On the wire the attribute is flattened into {@code userAttribute}/{@code customAttribute}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RlsCondition(
        String id,
        String column,
        RlsOperator operator,
        FilterType filterType,
        Object value,
        @JsonIgnore UserAttribute attribute,
        String expression
) implements ConditionNode {

    public RlsCondition {
        if (filterType == null) {
            filterType = FilterType.STATIC;
        }
    }

    @JsonCreator
    public static RlsCondition fromJson(
            @JsonProperty("id") String id,
            @JsonProperty("column") String column,
            @JsonProperty("operator") RlsOperator operator,
            @JsonProperty("filterType") FilterType filterType,
            @JsonProperty("value") Object value,
            @JsonProperty("userAttribute") String userAttribute,
            @JsonProperty("customAttribute") String customAttribute,
            @JsonProperty("expression") String expression) {
        return new RlsCondition(id, column, operator, filterType, value,
                UserAttribute.of(userAttribute, customAttribute), expression);
    }

    public static RlsCondition staticValue(String id, String column, RlsOperator operator, Object value) {
        return new RlsCondition(id, column, operator, FilterType.STATIC, value, null, null);
    }

    public static RlsCondition dynamic(String id, String column, RlsOperator operator, UserAttribute attribute) {
        return new RlsCondition(id, column, operator, FilterType.DYNAMIC, null, attribute, null);
    }

    public static RlsCondition expression(String id, String column, String expression) {
        return new RlsCondition(id, column, RlsOperator.EQUALS, FilterType.EXPRESSION, null, null, expression);
    }

    @JsonProperty("userAttribute")
    public String userAttribute() {
        return attribute != null ? attribute.typeName() : null;
    }

    @JsonProperty("customAttribute")
    public String customAttribute() {
        return attribute != null ? attribute.customName() : null;
    }
}
