package com.secops.threatintel.subscription;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.List;

/**
 * 订阅过滤表达式
 * 可序列化的标签变体，字段为 payload 中的点分路径
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "op")
@JsonSubTypes({
    @JsonSubTypes.Type(value = FilterExpression.Equals.class, name = "eq"),
    @JsonSubTypes.Type(value = FilterExpression.In.class, name = "in"),
    @JsonSubTypes.Type(value = FilterExpression.AtLeast.class, name = "gte"),
    @JsonSubTypes.Type(value = FilterExpression.Intersects.class, name = "intersects"),
    @JsonSubTypes.Type(value = FilterExpression.And.class, name = "and")
})
public sealed interface FilterExpression {

    /** 标量相等 */
    record Equals(String field, Object value) implements FilterExpression {}

    /** 值属于集合，如 severity ∈ {HIGH, CRITICAL} */
    record In(String field, List<Object> values) implements FilterExpression {}

    /** 数值 ≥ 阈值 */
    record AtLeast(String field, Double threshold) implements FilterExpression {}

    /** payload 中的 ID 列表与关注列表有交集 */
    record Intersects(String field, List<Object> values) implements FilterExpression {}

    /** 所有子表达式都满足 */
    record And(List<FilterExpression> operands) implements FilterExpression {}

    static FilterExpression eq(String field, Object value) {
        return new Equals(field, value);
    }

    static FilterExpression in(String field, Object... values) {
        return new In(field, List.of(values));
    }

    static FilterExpression atLeast(String field, double threshold) {
        return new AtLeast(field, threshold);
    }

    static FilterExpression intersects(String field, Object... values) {
        return new Intersects(field, List.of(values));
    }

    static FilterExpression and(FilterExpression... operands) {
        return new And(List.of(operands));
    }
}
