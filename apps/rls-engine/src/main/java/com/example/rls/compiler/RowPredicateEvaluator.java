package com.example.rls.compiler;

import org.springframework.lang.NonNull;

import java.util.List;
import java.util.Map;
import java.util.OptionalInt;

/**
 * Evaluates a {@link FilterExpression} against one row held in memory.
 *
 * <p>Follows SQL semantics for nulls: a null column value satisfies only {@code is_null}.
 * Raw fragments are never interpreted, so a row cannot be shown to satisfy one and the
 * fragment evaluates to false.
 */
public final class RowPredicateEvaluator {

    private RowPredicateEvaluator() {}

    public static boolean test(@NonNull FilterExpression expression, @NonNull Map<String, ?> row) {
        if (expression instanceof FilterExpression.Constant constant) {
            return constant.value();
        }
        if (expression instanceof FilterExpression.Raw) {
            return false;
        }
        if (expression instanceof FilterExpression.Junction junction) {
            return switch (junction.logic()) {
                case AND -> junction.operands().stream().allMatch(operand -> test(operand, row));
                case OR -> junction.operands().stream().anyMatch(operand -> test(operand, row));
            };
        }
        return testComparison((FilterExpression.Comparison) expression, row);
    }

    private static boolean testComparison(FilterExpression.Comparison comparison, Map<String, ?> row) {
        Object actual = row.get(comparison.column());
        Object operand = comparison.operand();
        switch (comparison.operator()) {
            case IS_NULL:
                return actual == null;
            case IS_NOT_NULL:
                return actual != null;
            default:
                break;
        }
        if (actual == null) {
            return false;
        }
        return switch (comparison.operator()) {
            case EQUALS -> OperandShapes.valuesEqual(actual, operand);
            case NOT_EQUALS -> !OperandShapes.valuesEqual(actual, operand);
            case IN -> OperandShapes.asList(operand).stream()
                    .anyMatch(candidate -> OperandShapes.valuesEqual(actual, candidate));
            case NOT_IN -> OperandShapes.asList(operand).stream()
                    .noneMatch(candidate -> OperandShapes.valuesEqual(actual, candidate));
            case CONTAINS -> actual instanceof String text && text.contains((String) operand);
            case STARTS_WITH -> actual instanceof String text && text.startsWith((String) operand);
            case GREATER_THAN -> isPositive(OperandShapes.compare(actual, operand));
            case LESS_THAN -> isNegative(OperandShapes.compare(actual, operand));
            case BETWEEN -> {
                List<Object> bounds = OperandShapes.asList(operand);
                OptionalInt low = OperandShapes.compare(actual, bounds.get(0));
                OptionalInt high = OperandShapes.compare(actual, bounds.get(1));
                yield low.isPresent() && high.isPresent() && low.getAsInt() >= 0 && high.getAsInt() <= 0;
            }
            case IS_NULL, IS_NOT_NULL -> false;
        };
    }

    private static boolean isPositive(OptionalInt comparison) {
        return comparison.isPresent() && comparison.getAsInt() > 0;
    }

    private static boolean isNegative(OptionalInt comparison) {
        return comparison.isPresent() && comparison.getAsInt() < 0;
    }
}
