package com.example.rls.service;

import com.example.rls.exception.RlsAccessDeniedException;
import com.example.rls.model.FilterDecision;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("RlsQueryRewriter")
class RlsQueryRewriterTest {

    private final RlsQueryRewriter rewriter = new RlsQueryRewriter();

    @Test
    @DisplayName("should wrap the query in a filtered sub-select")
    void shouldWrapQuery() {
        String rewritten = rewriter.rewrite("SELECT id, region FROM orders;  ",
                FilterDecision.filtered("region = 'US'", List.of("us")));

        assertThat(rewritten).isEqualTo("""
                SELECT * FROM (
                    SELECT id, region FROM orders
                ) AS __rls_filtered
                WHERE region = 'US'""");
    }

    @Test
    @DisplayName("should leave the query unchanged without a filter")
    void shouldLeaveUnfilteredQuery() {
        String query = "SELECT * FROM orders";

        assertThat(rewriter.rewrite(query, FilterDecision.unrestricted(List.of("all")))).isSameAs(query);
    }

    @Test
    @DisplayName("should refuse to rewrite for a denied decision")
    void shouldRefuseDeniedDecision() {
        assertThatThrownBy(() -> rewriter.rewrite("SELECT * FROM orders",
                FilterDecision.denied(FilterDecision.NO_MATCHING_POLICY)))
                .isInstanceOf(RlsAccessDeniedException.class)
                .hasMessageContaining(FilterDecision.NO_MATCHING_POLICY);
    }
}
