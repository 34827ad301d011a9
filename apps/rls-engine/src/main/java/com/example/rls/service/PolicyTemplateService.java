package com.example.rls.service;

import com.example.rls.exception.PolicyNotFoundException;
import com.example.rls.model.ConditionGroup;
import com.example.rls.model.PolicyTemplate;
import com.example.rls.model.RlsCondition;
import com.example.rls.model.RlsOperator;
import com.example.rls.model.RlsPolicy;
import com.example.rls.model.UserAttribute;
import com.example.rls.model.UserAttributeType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Optional;

/**
 * Built-in policy templates and policy creation from a template.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PolicyTemplateService {

    static final String DEFAULT_SCHEMA = "public";

    private static final List<PolicyTemplate> TEMPLATES = List.of(
            new PolicyTemplate(
                    "department_filter",
                    "Department Filter",
                    "Users can only see data for their department",
                    ConditionGroup.and("dept_group", List.of(
                            dynamic("dept_cond", "department", RlsOperator.EQUALS, UserAttributeType.DEPARTMENT)
                    ), List.of())),
            new PolicyTemplate(
                    "region_filter",
                    "Region Filter",
                    "Users can only see data for their region(s)",
                    ConditionGroup.and("region_group", List.of(
                            dynamic("region_cond", "region", RlsOperator.IN, UserAttributeType.REGION)
                    ), List.of())),
            new PolicyTemplate(
                    "owner_filter",
                    "Owner Filter",
                    "Users can only see records they own",
                    ConditionGroup.and("owner_group", List.of(
                            dynamic("owner_cond", "owner_id", RlsOperator.EQUALS, UserAttributeType.USER_ID)
                    ), List.of())),
            new PolicyTemplate(
                    "team_hierarchy",
                    "Team Hierarchy",
                    "Users can see their team's data and subordinates",
                    ConditionGroup.or("team_group", List.of(
                            dynamic("team_cond", "team_id", RlsOperator.EQUALS, UserAttributeType.TEAM),
                            dynamic("owner_cond", "created_by", RlsOperator.EQUALS, UserAttributeType.USER_ID)
                    ), List.of()))
    );

    private final PolicyAdminService policyAdminService;

    @NonNull
    public List<PolicyTemplate> listTemplates() {
        return TEMPLATES;
    }

    @NonNull
    public Optional<PolicyTemplate> findTemplate(@NonNull String templateId) {
        return TEMPLATES.stream()
                .filter(template -> template.id().equals(templateId))
                .findFirst();
    }

    /**
     * Creates an enabled policy for {@code tableName} from a template.
     *
     * @param schemaName defaults to {@code public} when blank
     */
    @NonNull
    public Mono<RlsPolicy> applyTemplate(@NonNull String templateId, @NonNull String tableName,
                                         @Nullable String schemaName, @Nullable String connectionId,
                                         @Nullable List<String> roleIds, @Nullable String createdBy) {
        return Mono.justOrEmpty(findTemplate(templateId))
                .switchIfEmpty(Mono.error(() -> new PolicyNotFoundException("Template", templateId)))
                .flatMap(template -> {
                    RlsPolicy policy = new RlsPolicy(
                            null,
                            template.name() + " - " + tableName,
                            template.description(),
                            true,
                            null,
                            schemaName == null || schemaName.isBlank() ? DEFAULT_SCHEMA : schemaName,
                            tableName,
                            connectionId,
                            template.filterGroup(),
                            roleIds,
                            null,
                            null,
                            null);
                    log.debug("Applying template {} to table {}", templateId, tableName);
                    return policyAdminService.createPolicy(policy, createdBy);
                });
    }

    private static RlsCondition dynamic(String id, String column, RlsOperator operator, UserAttributeType type) {
        return RlsCondition.dynamic(id, column, operator, UserAttribute.standard(type));
    }
}
