package com.example.rls.store;

import com.example.rls.compiler.OperandShapes;
import com.example.rls.exception.PolicyValidationException;
import com.example.rls.model.ConditionGroup;
import com.example.rls.model.FilterType;
import com.example.rls.model.RlsCondition;
import com.example.rls.model.RlsOperator;
import com.example.rls.model.RlsPolicy;
import com.example.rls.model.UserAttribute;
import com.example.rls.model.UserAttributeType;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Rejects policies the compiler could only ever fold to {@code false}: missing value
 * sources, operand shapes that do not fit the operator, and references to unknown roles.
 *
 * <p>Violations are reported with the path of the offending node, for example
 * {@code filterGroup.groups[0].conditions[1]: value required for operator equals}.
 */
@Component
public class PolicyValidator {

    private static final Set<RlsOperator> ROLE_OPERATORS =
            Set.of(RlsOperator.IN, RlsOperator.NOT_IN, RlsOperator.IS_NULL, RlsOperator.IS_NOT_NULL);

    /**
     * @param knownRoleIds ids of the roles currently defined
     * @throws PolicyValidationException listing every violation found
     */
    public void validate(@NonNull RlsPolicy policy, @NonNull Set<String> knownRoleIds) {
        List<String> violations = new ArrayList<>();

        if (policy.name() == null || policy.name().isBlank()) {
            violations.add("name: must not be blank");
        }
        for (String roleId : policy.roleIds()) {
            if (!knownRoleIds.contains(roleId)) {
                violations.add("roleIds: unknown role " + roleId);
            }
        }
        if (policy.filterGroup() == null) {
            violations.add("filterGroup: must not be null");
        } else {
            validateGroup(policy.filterGroup(), "filterGroup", violations);
        }

        if (!violations.isEmpty()) {
            throw new PolicyValidationException(violations);
        }
    }

    private void validateGroup(ConditionGroup group, String path, List<String> violations) {
        for (int i = 0; i < group.conditions().size(); i++) {
            validateCondition(group.conditions().get(i), path + ".conditions[" + i + "]", violations);
        }
        for (int i = 0; i < group.groups().size(); i++) {
            validateGroup(group.groups().get(i), path + ".groups[" + i + "]", violations);
        }
    }

    private void validateCondition(RlsCondition condition, String path, List<String> violations) {
        if (condition.filterType() == FilterType.EXPRESSION) {
            if (condition.expression() == null || condition.expression().isBlank()) {
                violations.add(path + ": expression required for filter type expression");
            }
            return;
        }

        if (condition.column() == null || condition.column().isBlank()) {
            violations.add(path + ": column must not be blank");
        }
        RlsOperator operator = condition.operator();
        if (operator == null) {
            violations.add(path + ": operator required");
            return;
        }

        if (condition.filterType() == FilterType.DYNAMIC) {
            validateAttribute(condition.attribute(), operator, path, violations);
            return;
        }

        if (operator.isNullCheck()) {
            return;
        }
        if (condition.value() == null) {
            violations.add(path + ": value required for operator " + operator.value());
        } else if (!OperandShapes.fits(operator, condition.value())) {
            violations.add(path + ": value does not fit operator " + operator.value());
        }
    }

    private void validateAttribute(UserAttribute attribute, RlsOperator operator, String path,
                                   List<String> violations) {
        if (attribute == null) {
            violations.add(path + ": userAttribute required for filter type dynamic");
            return;
        }
        if (operator == RlsOperator.BETWEEN) {
            violations.add(path + ": operator between cannot compare against a user attribute");
            return;
        }
        if (attribute instanceof UserAttribute.Standard standard
                && standard.type() == UserAttributeType.ROLE
                && !ROLE_OPERATORS.contains(operator)) {
            violations.add(path + ": attribute role only supports in, not_in, is_null and is_not_null");
        }
    }
}
