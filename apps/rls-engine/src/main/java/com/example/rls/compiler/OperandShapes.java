package com.example.rls.compiler;

import com.example.rls.model.RlsOperator;
import org.springframework.lang.Nullable;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.OptionalInt;

/**
 * Type rules shared by the compiler (which folds mismatches to false) and the policy
 * validator (which rejects them at save time).
 */
public final class OperandShapes {

    private OperandShapes() {}

    public static boolean isScalar(@Nullable Object value) {
        return value instanceof String || value instanceof Number || value instanceof Boolean;
    }

    public static boolean isOrderable(@Nullable Object value) {
        return value instanceof String || value instanceof Number;
    }

    /**
     * Whether {@code operand} has the shape {@code operator} requires.
     */
    public static boolean fits(RlsOperator operator, @Nullable Object operand) {
        return switch (operator) {
            case IS_NULL, IS_NOT_NULL -> true;
            case EQUALS, NOT_EQUALS -> isScalar(operand);
            case IN, NOT_IN -> asList(operand).stream().allMatch(OperandShapes::isScalar);
            case CONTAINS, STARTS_WITH -> operand instanceof String;
            case GREATER_THAN, LESS_THAN -> isOrderable(operand);
            case BETWEEN -> {
                List<Object> bounds = asList(operand);
                yield bounds.size() == 2 && compare(bounds.get(0), bounds.get(1)).isPresent();
            }
        };
    }

    /**
     * Membership list for {@code in}/{@code not_in}; a scalar becomes a one-element list.
     */
    public static List<Object> asList(@Nullable Object operand) {
        if (operand == null) {
            return List.of();
        }
        if (operand instanceof Collection<?> collection) {
            return new ArrayList<>(collection);
        }
        if (operand instanceof Object[] array) {
            return List.of(array);
        }
        return List.of(operand);
    }

    /**
     * Orders two values of the same kind: numbers numerically, strings lexicographically.
     *
     * @return empty when the values are not mutually comparable
     */
    public static OptionalInt compare(@Nullable Object left, @Nullable Object right) {
        if (left instanceof Number l && right instanceof Number r) {
            return OptionalInt.of(toBigDecimal(l).compareTo(toBigDecimal(r)));
        }
        if (left instanceof String l && right instanceof String r) {
            return OptionalInt.of(l.compareTo(r));
        }
        return OptionalInt.empty();
    }

    /**
     * Equality that treats numerically equal numbers of different boxed types as equal.
     */
    public static boolean valuesEqual(@Nullable Object left, @Nullable Object right) {
        if (left instanceof Number l && right instanceof Number r) {
            return toBigDecimal(l).compareTo(toBigDecimal(r)) == 0;
        }
        return left != null && left.equals(right);
    }

    private static BigDecimal toBigDecimal(Number number) {
        if (number instanceof BigDecimal decimal) {
            return decimal;
        }
        if (number instanceof Double || number instanceof Float) {
            return BigDecimal.valueOf(number.doubleValue());
        }
        return new BigDecimal(number.toString());
    }
}
