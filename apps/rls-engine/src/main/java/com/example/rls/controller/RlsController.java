package com.example.rls.controller;

import com.example.rls.dto.ApplyTemplateRequest;
import com.example.rls.dto.OperationResult;
import com.example.rls.dto.PolicyTestRequest;
import com.example.rls.dto.PolicyTestResponse;
import com.example.rls.dto.QueryRewriteRequest;
import com.example.rls.dto.QueryRewriteResponse;
import com.example.rls.engine.FilterRequest;
import com.example.rls.engine.RlsPolicyEngine;
import com.example.rls.model.FilterDecision;
import com.example.rls.model.ObjectPermission;
import com.example.rls.model.ObjectPermissions;
import com.example.rls.model.PolicyTemplate;
import com.example.rls.model.RlsConfiguration;
import com.example.rls.model.RlsPolicy;
import com.example.rls.model.SecurityRole;
import com.example.rls.model.UserRoleMapping;
import com.example.rls.model.UserSecurityContext;
import com.example.rls.service.PolicyAdminService;
import com.example.rls.service.PolicyTemplateService;
import com.example.rls.service.ObjectPermissionService;
import com.example.rls.service.RlsQueryRewriter;
import com.example.rls.service.UserRoleService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.LinkedHashSet;
import java.util.List;

/**
 * REST API for row-level security: evaluation, policy preview, query rewriting and
 * administration of policies, roles, configuration, templates, user role assignments and
 * object permissions.
 *
 * <p>Authentication happens upstream; the optional {@code X-User-Id} header names the
 * administrator recorded as a policy's creator. Together with {@code X-User-Roles}
 * (comma-separated role ids) it identifies the caller whose effective object permission is
 * reported.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/rls")
@RequiredArgsConstructor
public class RlsController {

    static final String USER_ID_HEADER = "X-User-Id";
    static final String USER_ROLES_HEADER = "X-User-Roles";

    private final RlsPolicyEngine policyEngine;
    private final PolicyAdminService policyAdminService;
    private final PolicyTemplateService policyTemplateService;
    private final RlsQueryRewriter queryRewriter;
    private final ObjectPermissionService objectPermissionService;
    private final UserRoleService userRoleService;

    // Evaluation

    @PostMapping("/evaluate")
    public Mono<FilterDecision> evaluate(@Valid @RequestBody FilterRequest request) {
        log.debug("POST /evaluate - table: {}, user: {}", request.objectId(), request.userContext().userId());
        return Mono.fromCallable(() -> policyEngine.evaluate(request));
    }

    @PostMapping("/test")
    public Mono<PolicyTestResponse> testPolicy(@Valid @RequestBody PolicyTestRequest request) {
        log.debug("POST /test - policy: {}, table: {}", request.policy().id(), request.tableName());
        FilterRequest filterRequest = new FilterRequest(
                request.connectionId(), request.schemaName(), request.tableName(), request.testUser());
        return Mono.fromCallable(() -> PolicyTestResponse.from(
                policyEngine.preview(request.policy(), filterRequest)));
    }

    @PostMapping("/rewrite")
    public Mono<QueryRewriteResponse> rewrite(@Valid @RequestBody QueryRewriteRequest request) {
        log.debug("POST /rewrite - table: {}", request.request().objectId());
        return Mono.fromCallable(() -> {
            FilterDecision decision = policyEngine.evaluate(request.request());
            return new QueryRewriteResponse(queryRewriter.rewrite(request.query(), decision), decision);
        });
    }

    // Policies

    @GetMapping("/policies")
    public Flux<RlsPolicy> listPolicies(
            @RequestParam(required = false) String tableName,
            @RequestParam(required = false) String schemaName,
            @RequestParam(required = false) String connectionId) {
        return policyAdminService.listPolicies(tableName, schemaName, connectionId);
    }

    @PostMapping("/policies")
    @ResponseStatus(HttpStatus.CREATED)
    public Mono<RlsPolicy> createPolicy(
            @RequestBody RlsPolicy policy,
            @RequestHeader(value = USER_ID_HEADER, required = false) String userId) {
        return policyAdminService.createPolicy(policy, userId);
    }

    @GetMapping("/policies/{policyId}")
    public Mono<RlsPolicy> getPolicy(@PathVariable String policyId) {
        return policyAdminService.getPolicy(policyId);
    }

    @PutMapping("/policies/{policyId}")
    public Mono<RlsPolicy> updatePolicy(@PathVariable String policyId, @RequestBody RlsPolicy policy) {
        return policyAdminService.updatePolicy(policyId, policy);
    }

    @DeleteMapping("/policies/{policyId}")
    public Mono<OperationResult> deletePolicy(@PathVariable String policyId) {
        return policyAdminService.deletePolicy(policyId)
                .thenReturn(OperationResult.ok("Policy deleted"));
    }

    @PutMapping("/policies/{policyId}/toggle")
    public Mono<OperationResult> togglePolicy(@PathVariable String policyId, @RequestParam boolean enabled) {
        return policyAdminService.togglePolicy(policyId, enabled)
                .map(policy -> OperationResult.toggled(policy.enabled()));
    }

    // Roles

    @GetMapping("/roles")
    public Flux<SecurityRole> listRoles() {
        return policyAdminService.listRoles();
    }

    @PostMapping("/roles")
    @ResponseStatus(HttpStatus.CREATED)
    public Mono<SecurityRole> createRole(@RequestBody SecurityRole role) {
        return policyAdminService.createRole(role);
    }

    @GetMapping("/roles/{roleId}")
    public Mono<SecurityRole> getRole(@PathVariable String roleId) {
        return policyAdminService.getRole(roleId);
    }

    @PutMapping("/roles/{roleId}")
    public Mono<SecurityRole> updateRole(@PathVariable String roleId, @RequestBody SecurityRole role) {
        return policyAdminService.updateRole(roleId, role);
    }

    @DeleteMapping("/roles/{roleId}")
    public Mono<OperationResult> deleteRole(@PathVariable String roleId) {
        return policyAdminService.deleteRole(roleId)
                .thenReturn(OperationResult.ok("Role deleted"));
    }

    // User role assignments

    @GetMapping("/user-roles/{userId}")
    public Mono<UserRoleMapping> getUserRoles(@PathVariable String userId) {
        return userRoleService.getUserRoles(userId);
    }

    @PutMapping("/user-roles/{userId}")
    public Mono<OperationResult> setUserRoles(@PathVariable String userId, @RequestBody UserRoleMapping mapping) {
        return userRoleService.setUserRoles(userId, mapping)
                .thenReturn(OperationResult.ok("Roles assigned"));
    }

    // Object permissions

    @GetMapping("/permissions/{objectType}/{objectId}")
    public Mono<ObjectPermissions> getObjectPermissions(
            @PathVariable String objectType,
            @PathVariable String objectId,
            @RequestHeader(value = USER_ID_HEADER, required = false) String userId,
            @RequestHeader(value = USER_ROLES_HEADER, required = false) List<String> roles) {
        UserSecurityContext caller = new UserSecurityContext(
                userId, null, null, roles == null ? null : new LinkedHashSet<>(roles), null);
        return objectPermissionService.getPermissions(objectType, objectId, caller);
    }

    @PutMapping("/permissions/{objectType}/{objectId}")
    public Mono<OperationResult> setObjectPermissions(
            @PathVariable String objectType,
            @PathVariable String objectId,
            @RequestBody List<ObjectPermission> permissions) {
        return objectPermissionService.setPermissions(objectType, objectId, permissions)
                .thenReturn(OperationResult.ok("Permissions updated"));
    }

    // Configuration

    @GetMapping("/config")
    public Mono<RlsConfiguration> getConfig() {
        return policyAdminService.getConfig();
    }

    @PutMapping("/config")
    public Mono<RlsConfiguration> updateConfig(@RequestBody RlsConfiguration config) {
        return policyAdminService.updateConfig(config);
    }

    // Templates

    @GetMapping("/templates")
    public Mono<List<PolicyTemplate>> listTemplates() {
        return Mono.just(policyTemplateService.listTemplates());
    }

    @PostMapping("/templates/{templateId}/apply")
    @ResponseStatus(HttpStatus.CREATED)
    public Mono<RlsPolicy> applyTemplate(
            @PathVariable String templateId,
            @Valid @RequestBody ApplyTemplateRequest request,
            @RequestHeader(value = USER_ID_HEADER, required = false) String userId) {
        return policyTemplateService.applyTemplate(templateId, request.tableName(), request.schemaName(),
                request.connectionId(), request.roleIds(), userId);
    }
}
