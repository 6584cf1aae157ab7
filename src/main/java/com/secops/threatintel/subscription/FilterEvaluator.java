package com.secops.threatintel.subscription;

import com.secops.threatintel.exception.ValidationException;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 订阅过滤求值
 * 没有过滤条件的订阅匹配主题上的所有事件
 */
@Component
public class FilterEvaluator {

    static final int MAX_DEPTH = 8;

    /**
     * 订阅时校验，非法时抛出 {@link ValidationException}
     */
    public void validate(FilterExpression expression) {
        if (expression != null) {
            validate(expression, 1);
        }
    }

    public boolean matches(FilterExpression expression, Map<String, Object> payload) {
        if (expression == null) {
            return true;
        }
        Map<String, Object> source = payload == null ? Map.of() : payload;
        if (expression instanceof FilterExpression.Equals eq) {
            return valueEquals(resolve(source, eq.field()), eq.value());
        }
        if (expression instanceof FilterExpression.In in) {
            Object actual = resolve(source, in.field());
            if (actual instanceof Collection<?> collection) {
                return collection.stream().anyMatch(a -> containsValue(in.values(), a));
            }
            return containsValue(in.values(), actual);
        }
        if (expression instanceof FilterExpression.AtLeast atLeast) {
            Double actual = toDouble(resolve(source, atLeast.field()));
            return actual != null && actual >= atLeast.threshold();
        }
        if (expression instanceof FilterExpression.Intersects intersects) {
            Object actual = resolve(source, intersects.field());
            if (actual == null) {
                return false;
            }
            Collection<?> related = actual instanceof Collection<?> c ? c : List.of(actual);
            return related.stream().anyMatch(a -> containsValue(intersects.values(), a));
        }
        if (expression instanceof FilterExpression.And and) {
            for (FilterExpression operand : and.operands()) {
                if (!matches(operand, source)) {
                    return false;
                }
            }
            return true;
        }
        throw new IllegalStateException("Unsupported filter expression: " + expression.getClass().getSimpleName());
    }

    private void validate(FilterExpression expression, int depth) {
        if (depth > MAX_DEPTH) {
            throw new ValidationException("Filter nesting exceeds " + MAX_DEPTH + " levels");
        }
        if (expression instanceof FilterExpression.Equals eq) {
            requireField(eq.field());
            if (eq.value() == null) {
                throw new ValidationException("eq filter on '" + eq.field() + "' requires a value");
            }
        } else if (expression instanceof FilterExpression.In in) {
            requireField(in.field());
            requireValues(in.field(), in.values());
        } else if (expression instanceof FilterExpression.AtLeast atLeast) {
            requireField(atLeast.field());
            if (atLeast.threshold() == null || !Double.isFinite(atLeast.threshold())) {
                throw new ValidationException("gte filter on '" + atLeast.field() + "' requires a finite threshold");
            }
        } else if (expression instanceof FilterExpression.Intersects intersects) {
            requireField(intersects.field());
            requireValues(intersects.field(), intersects.values());
        } else if (expression instanceof FilterExpression.And and) {
            if (and.operands() == null || and.operands().isEmpty()) {
                throw new ValidationException("and filter requires at least one operand");
            }
            for (FilterExpression operand : and.operands()) {
                if (operand == null) {
                    throw new ValidationException("and filter contains a null operand");
                }
                validate(operand, depth + 1);
            }
        }
    }

    private static void requireField(String field) {
        if (field == null || field.isBlank()) {
            throw new ValidationException("Filter field is required");
        }
    }

    private static void requireValues(String field, List<Object> values) {
        if (values == null || values.isEmpty()) {
            throw new ValidationException("Filter on '" + field + "' requires a non-empty value set");
        }
    }

    /**
     * 按点分路径取值，中途遇到非 Map 返回 null
     */
    static Object resolve(Map<String, Object> payload, String path) {
        Object current = payload;
        for (String segment : path.split("\\.")) {
            if (!(current instanceof Map<?, ?> map)) {
                return null;
            }
            current = map.get(segment);
        }
        return current;
    }

    private static boolean containsValue(List<Object> candidates, Object actual) {
        for (Object candidate : candidates) {
            if (valueEquals(actual, candidate)) {
                return true;
            }
        }
        return false;
    }

    /**
     * 数值按大小比较，其余按字符串比较（兼容枚举名）
     * NaN 与无穷大没有 BigDecimal 表示，按 double 比较
     */
    private static boolean valueEquals(Object actual, Object expected) {
        if (actual == null || expected == null) {
            return actual == expected;
        }
        if (actual instanceof Number a && expected instanceof Number e) {
            if (!isFinite(a) || !isFinite(e)) {
                return Double.compare(a.doubleValue(), e.doubleValue()) == 0;
            }
            return new BigDecimal(a.toString()).compareTo(new BigDecimal(e.toString())) == 0;
        }
        return Objects.equals(actual.toString(), expected.toString());
    }

    private static boolean isFinite(Number number) {
        if (number instanceof Double || number instanceof Float) {
            return Double.isFinite(number.doubleValue());
        }
        return true;
    }

    private static Double toDouble(Object value) {
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        if (value instanceof String text) {
            try {
                return Double.parseDouble(text);
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }
}
