package com.example.rls.compiler;

import com.example.rls.model.ConditionGroup;
import com.example.rls.model.RlsCondition;
import com.example.rls.model.RlsOperator;
import com.example.rls.model.RlsPolicy;
import com.example.rls.model.UserAttribute;
import com.example.rls.model.UserAttributeType;
import com.example.rls.model.UserSecurityContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.example.rls.util.PolicyTestBuilder.aPolicy;
import static com.example.rls.util.UserContextTestBuilder.aUser;
import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ConditionCompiler")
class ConditionCompilerTest {

    private ConditionCompiler compiler;
    private UserSecurityContext user;

    @BeforeEach
    void setUp() {
        compiler = new ConditionCompiler(new AttributeResolver());
        user = aUser()
                .withUserId("u-42")
                .withRoles("sales", "analyst")
                .withAttribute("region", "US")
                .withAttribute("department", "O'Brien & Co")
                .withAttribute("cost_center", 1200)
                .build();
    }

    private String compileToSql(RlsCondition... conditions) {
        RlsPolicy policy = aPolicy().withConditions(conditions).build();
        return FilterSqlRenderer.render(compiler.compile(policy, user).expression());
    }

    private FilterExpression compileOne(RlsCondition condition) {
        return compiler.compile(aPolicy().withConditions(condition).build(), user).expression();
    }

    @Nested
    @DisplayName("static conditions")
    class StaticConditions {

        @Test
        @DisplayName("should compare the column with the literal value")
        void shouldCompareColumnWithLiteral() {
            assertThat(compileToSql(RlsCondition.staticValue("c1", "region", RlsOperator.EQUALS, "US")))
                    .isEqualTo("region = 'US'");
        }

        @Test
        @DisplayName("should test the column for null checks")
        void shouldTestColumnForNullChecks() {
            assertThat(compileToSql(RlsCondition.staticValue("c1", "deleted_at", RlsOperator.IS_NULL, null)))
                    .isEqualTo("deleted_at IS NULL");
            assertThat(compileToSql(RlsCondition.staticValue("c1", "owner", RlsOperator.IS_NOT_NULL, null)))
                    .isEqualTo("owner IS NOT NULL");
        }

        @Test
        @DisplayName("should fold a missing value to false")
        void shouldFoldMissingValueToFalse() {
            assertThat(compileOne(RlsCondition.staticValue("c1", "region", RlsOperator.EQUALS, null)))
                    .isEqualTo(FilterExpression.FALSE);
        }

        @Test
        @DisplayName("should treat a scalar in operand as a one-element list")
        void shouldTreatScalarInOperandAsSingleton() {
            assertThat(compileToSql(RlsCondition.staticValue("c1", "region", RlsOperator.IN, "US")))
                    .isEqualTo("region IN ('US')");
        }

        @Test
        @DisplayName("should fold empty in to false and empty not_in to true")
        void shouldFoldEmptyMembership() {
            assertThat(compileOne(RlsCondition.staticValue("c1", "region", RlsOperator.IN, List.of())))
                    .isEqualTo(FilterExpression.FALSE);
            assertThat(compileOne(RlsCondition.staticValue("c1", "region", RlsOperator.NOT_IN, List.of())))
                    .isEqualTo(FilterExpression.TRUE);
        }

        @Test
        @DisplayName("should render between for two comparable bounds")
        void shouldRenderBetween() {
            assertThat(compileToSql(RlsCondition.staticValue("c1", "amount", RlsOperator.BETWEEN, List.of(10, 20))))
                    .isEqualTo("amount BETWEEN 10 AND 20");
        }

        @Test
        @DisplayName("should fold between with mismatched or missing bounds to false")
        void shouldFoldInvalidBetweenToFalse() {
            assertThat(compileOne(RlsCondition.staticValue("c1", "amount", RlsOperator.BETWEEN, List.of(10, "x"))))
                    .isEqualTo(FilterExpression.FALSE);
            assertThat(compileOne(RlsCondition.staticValue("c1", "amount", RlsOperator.BETWEEN, List.of(10))))
                    .isEqualTo(FilterExpression.FALSE);
        }

        @Test
        @DisplayName("should fold string operators with non-string values to false")
        void shouldFoldNonStringContainsToFalse() {
            assertThat(compileOne(RlsCondition.staticValue("c1", "name", RlsOperator.CONTAINS, 5)))
                    .isEqualTo(FilterExpression.FALSE);
            assertThat(compileOne(RlsCondition.staticValue("c1", "amount", RlsOperator.GREATER_THAN, true)))
                    .isEqualTo(FilterExpression.FALSE);
        }

        @Test
        @DisplayName("should fold a blank column to false")
        void shouldFoldBlankColumnToFalse() {
            assertThat(compileOne(RlsCondition.staticValue("c1", " ", RlsOperator.EQUALS, "US")))
                    .isEqualTo(FilterExpression.FALSE);
        }
    }

    @Nested
    @DisplayName("dynamic conditions")
    class DynamicConditions {

        @Test
        @DisplayName("should resolve attributes and escape quotes in literals")
        void shouldResolveAttributesAndEscapeQuotes() {
            assertThat(compileToSql(RlsCondition.dynamic("c1", "department", RlsOperator.EQUALS,
                    UserAttribute.standard(UserAttributeType.DEPARTMENT))))
                    .isEqualTo("department = 'O''Brien & Co'");
        }

        @Test
        @DisplayName("should resolve identity fields from the context")
        void shouldResolveIdentityFields() {
            assertThat(compileToSql(RlsCondition.dynamic("c1", "owner_id", RlsOperator.EQUALS,
                    UserAttribute.standard(UserAttributeType.USER_ID))))
                    .isEqualTo("owner_id = 'u-42'");
        }

        @Test
        @DisplayName("should resolve custom attributes by name")
        void shouldResolveCustomAttributes() {
            assertThat(compileToSql(RlsCondition.dynamic("c1", "cost_center", RlsOperator.EQUALS,
                    UserAttribute.custom("cost_center"))))
                    .isEqualTo("cost_center = 1200");
        }

        @Test
        @DisplayName("should resolve role to the sorted role set")
        void shouldResolveRoleToSortedSet() {
            assertThat(compileToSql(RlsCondition.dynamic("c1", "visible_to", RlsOperator.IN,
                    UserAttribute.standard(UserAttributeType.ROLE))))
                    .isEqualTo("visible_to IN ('analyst', 'sales')");
        }

        @Test
        @DisplayName("should make is_null true and equals false for an absent attribute")
        void shouldHandleAbsentAttribute() {
            UserAttribute team = UserAttribute.standard(UserAttributeType.TEAM);

            assertThat(compileOne(RlsCondition.dynamic("c1", "team_id", RlsOperator.IS_NULL, team)))
                    .isEqualTo(FilterExpression.TRUE);
            assertThat(compileOne(RlsCondition.dynamic("c1", "team_id", RlsOperator.IS_NOT_NULL, team)))
                    .isEqualTo(FilterExpression.FALSE);
            assertThat(compileOne(RlsCondition.dynamic("c1", "team_id", RlsOperator.EQUALS, team)))
                    .isEqualTo(FilterExpression.FALSE);
            assertThat(compileOne(RlsCondition.dynamic("c1", "team_id", RlsOperator.NOT_IN, team)))
                    .isEqualTo(FilterExpression.FALSE);
        }

        @Test
        @DisplayName("should make is_not_null true for a present attribute")
        void shouldHandlePresentAttributeNullCheck() {
            assertThat(compileOne(RlsCondition.dynamic("c1", "region", RlsOperator.IS_NOT_NULL,
                    UserAttribute.standard(UserAttributeType.REGION))))
                    .isEqualTo(FilterExpression.TRUE);
        }

        @Test
        @DisplayName("should fold a missing attribute reference to false")
        void shouldFoldMissingAttributeReference() {
            assertThat(compileOne(RlsCondition.dynamic("c1", "region", RlsOperator.EQUALS, null)))
                    .isEqualTo(FilterExpression.FALSE);
        }
    }

    @Nested
    @DisplayName("expression conditions")
    class ExpressionConditions {

        @Test
        @DisplayName("should pass the fragment through verbatim")
        void shouldPassFragmentThrough() {
            assertThat(compileOne(RlsCondition.expression("c1", "org_id", "org_id IN (SELECT id FROM orgs)")))
                    .isEqualTo(new FilterExpression.Raw("org_id IN (SELECT id FROM orgs)"));
        }

        @Test
        @DisplayName("should fold a blank fragment to false")
        void shouldFoldBlankFragmentToFalse() {
            assertThat(compileOne(RlsCondition.expression("c1", "org_id", "  ")))
                    .isEqualTo(FilterExpression.FALSE);
        }
    }

    @Nested
    @DisplayName("groups")
    class Groups {

        @Test
        @DisplayName("should compile an empty group to true")
        void shouldCompileEmptyGroupToTrue() {
            CompiledPolicy compiled = compiler.compile(aPolicy().build(), user);

            assertThat(compiled.expression()).isEqualTo(FilterExpression.TRUE);
            assertThat(compiled.columns()).isEmpty();
        }

        @Test
        @DisplayName("should parenthesize nested groups and collect columns")
        void shouldCompileNestedGroups() {
            ConditionGroup nested = ConditionGroup.or("g1", List.of(
                    RlsCondition.staticValue("c2", "status", RlsOperator.EQUALS, "open"),
                    RlsCondition.staticValue("c3", "priority", RlsOperator.GREATER_THAN, 3)
            ), List.of());
            ConditionGroup root = ConditionGroup.and("root", List.of(
                    RlsCondition.dynamic("c1", "region", RlsOperator.EQUALS,
                            UserAttribute.standard(UserAttributeType.REGION))
            ), List.of(nested));

            CompiledPolicy compiled = compiler.compile(aPolicy().withFilter(root).build(), user);

            assertThat(FilterSqlRenderer.render(compiled.expression()))
                    .isEqualTo("region = 'US' AND (status = 'open' OR priority > 3)");
            assertThat(compiled.columns()).containsExactlyInAnyOrder("priority", "region", "status");
        }

        @Test
        @DisplayName("should short-circuit an AND group holding an unresolvable condition")
        void shouldShortCircuitAndGroup() {
            ConditionGroup root = ConditionGroup.and("root", List.of(
                    RlsCondition.staticValue("c1", "status", RlsOperator.EQUALS, "open"),
                    RlsCondition.dynamic("c2", "team_id", RlsOperator.EQUALS,
                            UserAttribute.standard(UserAttributeType.TEAM))
            ), List.of());

            assertThat(compiler.compileGroup(root, user)).isEqualTo(FilterExpression.FALSE);
        }

        @Test
        @DisplayName("should drop false operands of an OR group")
        void shouldDropFalseOperandsOfOrGroup() {
            ConditionGroup root = ConditionGroup.or("root", List.of(
                    RlsCondition.staticValue("c1", "status", RlsOperator.EQUALS, "open"),
                    RlsCondition.dynamic("c2", "team_id", RlsOperator.EQUALS,
                            UserAttribute.standard(UserAttributeType.TEAM))
            ), List.of());

            assertThat(FilterSqlRenderer.render(compiler.compileGroup(root, user)))
                    .isEqualTo("status = 'open'");
        }
    }
}
