package com.example.rls.snapshot;

import com.example.rls.model.RlsConfiguration;
import com.example.rls.model.RlsPolicy;
import com.example.rls.model.SecurityRole;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Immutable, consistent view of policies, roles and configuration.
 *
 * @param generation increases by one with every published change
 * @param verifiedAt last time this content was confirmed against the policy store
 */
public record PolicySnapshot(
        List<RlsPolicy> policies,
        List<SecurityRole> roles,
        RlsConfiguration config,
        long generation,
        Instant verifiedAt
) {
    public PolicySnapshot {
        policies = List.copyOf(policies);
        roles = List.copyOf(roles);
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(verifiedAt, "verifiedAt");
    }

    public boolean sameContentAs(List<RlsPolicy> otherPolicies, List<SecurityRole> otherRoles,
                                 RlsConfiguration otherConfig) {
        return policies.equals(otherPolicies) && roles.equals(otherRoles) && config.equals(otherConfig);
    }

    PolicySnapshot next(List<RlsPolicy> newPolicies, List<SecurityRole> newRoles,
                        RlsConfiguration newConfig, Instant newVerifiedAt) {
        return new PolicySnapshot(newPolicies, newRoles, newConfig, generation + 1, newVerifiedAt);
    }

    PolicySnapshot verified(Instant at) {
        return new PolicySnapshot(policies, roles, config, generation, at);
    }

    public PolicySnapshot withPolicy(RlsPolicy policy) {
        List<RlsPolicy> updated = new ArrayList<>(policies);
        updated.removeIf(existing -> existing.id().equals(policy.id()));
        updated.add(policy);
        return new PolicySnapshot(updated, roles, config, generation, verifiedAt);
    }

    public PolicySnapshot withoutPolicy(String policyId) {
        List<RlsPolicy> updated = new ArrayList<>(policies);
        updated.removeIf(existing -> existing.id().equals(policyId));
        return new PolicySnapshot(updated, roles, config, generation, verifiedAt);
    }

    public PolicySnapshot withRole(SecurityRole role) {
        List<SecurityRole> updated = new ArrayList<>(roles);
        updated.removeIf(existing -> existing.id().equals(role.id()));
        updated.add(role);
        return new PolicySnapshot(policies, updated, config, generation, verifiedAt);
    }

    public PolicySnapshot withoutRole(String roleId) {
        List<SecurityRole> updated = new ArrayList<>(roles);
        updated.removeIf(existing -> existing.id().equals(roleId));
        return new PolicySnapshot(policies, updated, config, generation, verifiedAt);
    }

    public PolicySnapshot withConfig(RlsConfiguration newConfig) {
        return new PolicySnapshot(policies, roles, newConfig, generation, verifiedAt);
    }
}
