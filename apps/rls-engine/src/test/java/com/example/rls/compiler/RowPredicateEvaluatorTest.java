package com.example.rls.compiler;

import com.example.rls.model.RlsOperator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("RowPredicateEvaluator")
class RowPredicateEvaluatorTest {

    private static FilterExpression comparison(String column, RlsOperator operator, Object operand) {
        return new FilterExpression.Comparison(column, operator, operand);
    }

    private static Map<String, Object> row(Object... keyValues) {
        Map<String, Object> row = new HashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            row.put((String) keyValues[i], keyValues[i + 1]);
        }
        return row;
    }

    @Test
    @DisplayName("should compare numbers across boxed types")
    void shouldCompareNumbersAcrossTypes() {
        assertThat(RowPredicateEvaluator.test(comparison("amount", RlsOperator.EQUALS, 10), row("amount", 10L)))
                .isTrue();
        assertThat(RowPredicateEvaluator.test(comparison("amount", RlsOperator.GREATER_THAN, 5), row("amount", 7.5)))
                .isTrue();
        assertThat(RowPredicateEvaluator.test(
                comparison("amount", RlsOperator.BETWEEN, List.of(1, 10)), row("amount", 10)))
                .isTrue();
    }

    @Test
    @DisplayName("should follow SQL null semantics")
    void shouldFollowSqlNullSemantics() {
        Map<String, Object> row = row("region", null);

        assertThat(RowPredicateEvaluator.test(comparison("region", RlsOperator.NOT_EQUALS, "US"), row)).isFalse();
        assertThat(RowPredicateEvaluator.test(comparison("region", RlsOperator.NOT_IN, List.of("US")), row)).isFalse();
        assertThat(RowPredicateEvaluator.test(comparison("region", RlsOperator.IS_NULL, null), row)).isTrue();
    }

    @Test
    @DisplayName("should evaluate case-sensitive string operators")
    void shouldEvaluateStringOperators() {
        Map<String, Object> row = row("name", "Acme Corp");

        assertThat(RowPredicateEvaluator.test(comparison("name", RlsOperator.CONTAINS, "Corp"), row)).isTrue();
        assertThat(RowPredicateEvaluator.test(comparison("name", RlsOperator.CONTAINS, "corp"), row)).isFalse();
        assertThat(RowPredicateEvaluator.test(comparison("name", RlsOperator.STARTS_WITH, "Acme"), row)).isTrue();
    }

    @Test
    @DisplayName("should not compare values of different kinds")
    void shouldNotCompareDifferentKinds() {
        assertThat(RowPredicateEvaluator.test(comparison("code", RlsOperator.GREATER_THAN, 5), row("code", "9")))
                .isFalse();
        assertThat(RowPredicateEvaluator.test(comparison("code", RlsOperator.LESS_THAN, "b"), row("code", "a")))
                .isTrue();
    }

    @Test
    @DisplayName("should evaluate junctions and treat raw fragments as unsatisfied")
    void shouldEvaluateJunctions() {
        FilterExpression either = FilterExpression.or(List.of(
                comparison("region", RlsOperator.EQUALS, "US"),
                new FilterExpression.Raw("owner_id = current_user")));

        assertThat(RowPredicateEvaluator.test(either, row("region", "US"))).isTrue();
        assertThat(RowPredicateEvaluator.test(either, row("region", "EU"))).isFalse();
    }
}
