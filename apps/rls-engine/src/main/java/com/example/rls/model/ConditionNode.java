package com.example.rls.model;

/**
 * Node of a policy's condition tree: either a leaf {@link RlsCondition} or a nested
 * {@link ConditionGroup}.
 */
public sealed interface ConditionNode permits RlsCondition, ConditionGroup {

    String id();
}
