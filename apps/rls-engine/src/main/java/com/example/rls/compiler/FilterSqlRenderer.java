package com.example.rls.compiler;

import com.example.rls.model.GroupLogic;
import org.springframework.lang.NonNull;

import java.math.BigDecimal;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Renders a {@link FilterExpression} as a SQL boolean expression for a WHERE clause.
 *
 * <p>Column names are emitted as authored. String literals are single-quoted with embedded
 * quotes doubled; LIKE patterns escape {@code %}, {@code _} and {@code !} with {@code !}, which
 * no mainstream dialect treats specially inside string literals. Numbers are written in
 * plain notation.
 */
public final class FilterSqlRenderer {

    static final String TRUE_SQL = "1 = 1";
    static final String FALSE_SQL = "1 = 0";
    static final char LIKE_ESCAPE = '!';

    private FilterSqlRenderer() {}

    @NonNull
    public static String render(@NonNull FilterExpression expression) {
        if (expression instanceof FilterExpression.Constant constant) {
            return constant.value() ? TRUE_SQL : FALSE_SQL;
        }
        if (expression instanceof FilterExpression.Raw raw) {
            return "(" + raw.fragment() + ")";
        }
        if (expression instanceof FilterExpression.Junction junction) {
            String separator = junction.logic() == GroupLogic.AND ? " AND " : " OR ";
            return junction.operands().stream()
                    .map(operand -> operand instanceof FilterExpression.Junction
                            ? "(" + render(operand) + ")"
                            : render(operand))
                    .collect(Collectors.joining(separator));
        }
        return renderComparison((FilterExpression.Comparison) expression);
    }

    private static String renderComparison(FilterExpression.Comparison comparison) {
        String column = comparison.column();
        Object operand = comparison.operand();
        return switch (comparison.operator()) {
            case EQUALS -> column + " = " + literal(operand);
            case NOT_EQUALS -> column + " <> " + literal(operand);
            case IN -> column + " IN (" + literalList(OperandShapes.asList(operand)) + ")";
            case NOT_IN -> column + " NOT IN (" + literalList(OperandShapes.asList(operand)) + ")";
            case CONTAINS -> like(column, "%", (String) operand, "%");
            case STARTS_WITH -> like(column, "", (String) operand, "%");
            case GREATER_THAN -> column + " > " + literal(operand);
            case LESS_THAN -> column + " < " + literal(operand);
            case BETWEEN -> {
                List<Object> bounds = OperandShapes.asList(operand);
                yield column + " BETWEEN " + literal(bounds.get(0)) + " AND " + literal(bounds.get(1));
            }
            case IS_NULL -> column + " IS NULL";
            case IS_NOT_NULL -> column + " IS NOT NULL";
        };
    }

    /**
     * SQL literal for a scalar value.
     */
    @NonNull
    public static String literal(Object value) {
        if (value instanceof String text) {
            return "'" + text.replace("'", "''") + "'";
        }
        if (value instanceof Boolean flag) {
            return flag ? "TRUE" : "FALSE";
        }
        if (value instanceof BigDecimal decimal) {
            return decimal.toPlainString();
        }
        if (value instanceof Double || value instanceof Float) {
            double number = ((Number) value).doubleValue();
            if (Double.isNaN(number) || Double.isInfinite(number)) {
                throw new IllegalArgumentException("Unsupported SQL literal: " + value);
            }
            return BigDecimal.valueOf(number).toPlainString();
        }
        if (value instanceof Number number) {
            return number.toString();
        }
        throw new IllegalArgumentException("Unsupported SQL literal type: "
                + (value == null ? "null" : value.getClass().getSimpleName()));
    }

    private static String literalList(List<Object> values) {
        return values.stream()
                .map(FilterSqlRenderer::literal)
                .collect(Collectors.joining(", "));
    }

    private static String like(String column, String prefix, String value, String suffix) {
        boolean needsEscape = value.indexOf('%') >= 0 || value.indexOf('_') >= 0
                || value.indexOf(LIKE_ESCAPE) >= 0;
        String pattern = needsEscape
                ? value.replace("!", "!!").replace("%", "!%").replace("_", "!_")
                : value;
        String sql = column + " LIKE " + literal(prefix + pattern + suffix);
        return needsEscape ? sql + " ESCAPE '" + LIKE_ESCAPE + "'" : sql;
    }
}
