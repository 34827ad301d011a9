package com.example.rls.compiler;

import com.example.rls.model.GroupLogic;
import com.example.rls.model.RlsOperator;

import java.util.ArrayList;
import java.util.List;

/**
 * Compiled, user-resolved row predicate.
 *
 * <p>A closed tree of constants, column comparisons, opaque SQL fragments and AND/OR
 * junctions. Rendering and in-memory evaluation are single recursive functions over this
 * tree ({@link FilterSqlRenderer}, {@link RowPredicateEvaluator}). The factory methods
 * fold constants, so a junction never holds a {@link Constant} operand.
 */
public sealed interface FilterExpression
        permits FilterExpression.Constant, FilterExpression.Comparison,
                FilterExpression.Raw, FilterExpression.Junction {

    Constant TRUE = new Constant(true);
    Constant FALSE = new Constant(false);

    record Constant(boolean value) implements FilterExpression {}

    /**
     * {@code column operator operand}; the operand is a scalar, a list (in/not_in),
     * a two-element list (between) or null (null checks).
     */
    record Comparison(String column, RlsOperator operator, Object operand) implements FilterExpression {
        public Comparison {
            if (operand instanceof List<?> list) {
                operand = List.copyOf(list);
            }
        }
    }

    /**
     * Administrator-authored SQL fragment, never parsed or rewritten.
     */
    record Raw(String fragment) implements FilterExpression {}

    record Junction(GroupLogic logic, List<FilterExpression> operands) implements FilterExpression {
        public Junction {
            operands = List.copyOf(operands);
        }
    }

    static FilterExpression constant(boolean value) {
        return value ? TRUE : FALSE;
    }

    static FilterExpression or(List<FilterExpression> operands) {
        return combine(GroupLogic.OR, operands);
    }

    /**
     * Builds a junction, folding constants: the identity element (true for AND, false for
     * OR) is dropped, the absorbing element short-circuits, and an empty operand list
     * yields the identity.
     */
    static FilterExpression combine(GroupLogic logic, List<FilterExpression> operands) {
        boolean identity = logic == GroupLogic.AND;
        List<FilterExpression> kept = new ArrayList<>(operands.size());
        for (FilterExpression operand : operands) {
            if (operand instanceof Constant constant) {
                if (constant.value() != identity) {
                    return constant;
                }
                continue;
            }
            kept.add(operand);
        }
        if (kept.isEmpty()) {
            return constant(identity);
        }
        if (kept.size() == 1) {
            return kept.get(0);
        }
        return new Junction(logic, kept);
    }
}
