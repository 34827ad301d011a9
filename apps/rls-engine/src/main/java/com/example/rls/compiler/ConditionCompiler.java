package com.example.rls.compiler;

import com.example.rls.model.ConditionGroup;
import com.example.rls.model.ConditionNode;
import com.example.rls.model.FilterType;
import com.example.rls.model.RlsCondition;
import com.example.rls.model.RlsOperator;
import com.example.rls.model.RlsPolicy;
import com.example.rls.model.UserSecurityContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Compiles a policy's condition tree into a {@link FilterExpression} for one user.
 *
 * <p>Compilation is total: malformed or unresolvable conditions fold to {@code false}
 * (the row is excluded) instead of throwing. Rules per leaf:
 * <ul>
 *   <li>static: compares the column with the literal value; null checks test the column</li>
 *   <li>dynamic: compares the column with the resolved user attribute; null checks test the
 *       attribute itself, so a missing attribute makes {@code is_null} true</li>
 *   <li>expression: the fragment is passed through verbatim</li>
 * </ul>
 * An empty group is vacuously true.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ConditionCompiler {

    private final AttributeResolver attributeResolver;

    @NonNull
    public CompiledPolicy compile(@NonNull RlsPolicy policy, @NonNull UserSecurityContext context) {
        Set<String> columns = new TreeSet<>();
        FilterExpression expression = policy.filterGroup() == null
                ? FilterExpression.TRUE
                : compileNode(policy.filterGroup(), context, columns);
        log.debug("Compiled policy {} for user {}: {}", policy.id(), context.userId(), expression);
        return new CompiledPolicy(policy.id(), expression, columns);
    }

    @NonNull
    public FilterExpression compileGroup(@NonNull ConditionGroup group, @NonNull UserSecurityContext context) {
        return compileNode(group, context, new TreeSet<>());
    }

    private FilterExpression compileNode(ConditionNode node, UserSecurityContext context, Set<String> columns) {
        if (node instanceof RlsCondition condition) {
            return compileCondition(condition, context, columns);
        }
        ConditionGroup group = (ConditionGroup) node;
        List<FilterExpression> operands = new ArrayList<>();
        for (ConditionNode child : group.children()) {
            operands.add(compileNode(child, context, columns));
        }
        return FilterExpression.combine(group.logic(), operands);
    }

    private FilterExpression compileCondition(RlsCondition condition, UserSecurityContext context,
                                              Set<String> columns) {
        String column = condition.column();
        boolean hasColumn = column != null && !column.isBlank();
        if (hasColumn) {
            columns.add(column);
        }

        if (condition.filterType() == FilterType.EXPRESSION) {
            String fragment = condition.expression();
            if (fragment == null || fragment.isBlank()) {
                return FilterExpression.FALSE;
            }
            return new FilterExpression.Raw(fragment);
        }

        RlsOperator operator = condition.operator();
        if (operator == null || !hasColumn) {
            return FilterExpression.FALSE;
        }

        ResolvedValue resolved = condition.filterType() == FilterType.DYNAMIC
                ? attributeResolver.resolve(condition.attribute(), context)
                : ResolvedValue.of(condition.value());

        if (operator.isNullCheck()) {
            if (condition.filterType() == FilterType.DYNAMIC) {
                boolean unknown = resolved instanceof ResolvedValue.Unknown;
                return FilterExpression.constant(operator == RlsOperator.IS_NULL ? unknown : !unknown);
            }
            return new FilterExpression.Comparison(column, operator, null);
        }

        if (!(resolved instanceof ResolvedValue.Known known)) {
            return FilterExpression.FALSE;
        }
        return comparison(column, operator, known.value());
    }

    private FilterExpression comparison(String column, RlsOperator operator, Object operand) {
        if (!OperandShapes.fits(operator, operand)) {
            return FilterExpression.FALSE;
        }
        if (operator == RlsOperator.IN || operator == RlsOperator.NOT_IN) {
            List<Object> members = OperandShapes.asList(operand);
            if (members.isEmpty()) {
                return FilterExpression.constant(operator == RlsOperator.NOT_IN);
            }
            return new FilterExpression.Comparison(column, operator, members);
        }
        if (operator == RlsOperator.BETWEEN) {
            return new FilterExpression.Comparison(column, operator, OperandShapes.asList(operand));
        }
        return new FilterExpression.Comparison(column, operator, operand);
    }
}
