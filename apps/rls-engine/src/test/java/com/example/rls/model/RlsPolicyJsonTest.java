package com.example.rls.model;

import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("RlsPolicy JSON")
class RlsPolicyJsonTest {

    private ObjectMapper objectMapper;

    @BeforeEach
    void setUp() {
        objectMapper = new ObjectMapper()
                .findAndRegisterModules()
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    private RlsPolicy nestedPolicy() {
        ConditionGroup either = ConditionGroup.or("g-or", List.of(
                RlsCondition.staticValue("c1", "region", RlsOperator.IN, List.of("US", "CA")),
                RlsCondition.dynamic("c2", "cost_center", RlsOperator.EQUALS, UserAttribute.custom("cost_center"))
        ), List.of());
        ConditionGroup root = ConditionGroup.and("g-and", List.of(), List.of(either));
        return new RlsPolicy("p1", "Regional", "Region or cost center", true, 5, "public", "orders",
                null, root, List.of("sales"), Instant.parse("2024-05-01T10:00:00Z"),
                Instant.parse("2024-05-02T10:00:00Z"), "admin");
    }

    @Test
    @DisplayName("should round-trip an AND group holding an OR group of two leaves")
    void shouldRoundTripNestedPolicy() throws Exception {
        RlsPolicy policy = nestedPolicy();

        String json = objectMapper.writeValueAsString(policy);
        RlsPolicy parsed = objectMapper.readValue(json, RlsPolicy.class);

        assertThat(parsed).isEqualTo(policy);
    }

    @Test
    @DisplayName("should write camelCase fields and lower-case enum values")
    void shouldWriteWireFormat() throws Exception {
        JsonNode json = objectMapper.readTree(objectMapper.writeValueAsString(nestedPolicy()));

        JsonNode group = json.get("filterGroup").get("groups").get(0);
        assertThat(json.has("connectionId")).isFalse();
        assertThat(group.get("logic").asText()).isEqualTo("OR");
        assertThat(group.get("conditions").get(0).get("operator").asText()).isEqualTo("in");
        JsonNode dynamic = group.get("conditions").get(1);
        assertThat(dynamic.get("filterType").asText()).isEqualTo("dynamic");
        assertThat(dynamic.get("userAttribute").asText()).isEqualTo("custom");
        assertThat(dynamic.get("customAttribute").asText()).isEqualTo("cost_center");
        assertThat(dynamic.has("attribute")).isFalse();
    }

    @Test
    @DisplayName("should reject a custom attribute without a name")
    void shouldRejectCustomWithoutName() {
        String json = """
                {"id":"c1","column":"cc","operator":"equals","filterType":"dynamic","userAttribute":"custom"}
                """;

        assertThatThrownBy(() -> objectMapper.readValue(json, RlsCondition.class))
                .isInstanceOf(JsonMappingException.class);
    }

    @Test
    @DisplayName("should reject unknown operators")
    void shouldRejectUnknownOperator() {
        String json = """
                {"id":"c1","column":"cc","operator":"matches","value":"x"}
                """;

        assertThatThrownBy(() -> objectMapper.readValue(json, RlsCondition.class))
                .isInstanceOf(JsonMappingException.class);
    }

    @Test
    @DisplayName("should apply defaults for omitted fields")
    void shouldApplyDefaults() throws Exception {
        RlsPolicy policy = objectMapper.readValue("""
                {"name":"minimal","filterGroup":{"conditions":[{"column":"a","operator":"equals","value":1}]}}
                """, RlsPolicy.class);

        assertThat(policy.enabled()).isTrue();
        assertThat(policy.roleIds()).isEmpty();
        assertThat(policy.filterGroup().logic()).isEqualTo(GroupLogic.AND);
        assertThat(policy.filterGroup().conditions().get(0).filterType()).isEqualTo(FilterType.STATIC);
    }

    @Test
    @DisplayName("should map isDefault on roles")
    void shouldMapRoleDefaultFlag() throws Exception {
        SecurityRole role = objectMapper.readValue("""
                {"id":"viewer","name":"Viewer","isDefault":true}
                """, SecurityRole.class);

        assertThat(role.defaultRole()).isTrue();
        assertThat(objectMapper.readTree(objectMapper.writeValueAsString(role)).get("isDefault").asBoolean())
                .isTrue();
    }
}
