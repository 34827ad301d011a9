package com.example.rls.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.ArrayList;
import java.util.List;

/**
 * Boolean node combining leaf conditions and nested groups with AND/OR.
 *
 * <p>Groups are immutable and only ever built bottom-up, so the tree cannot contain cycles.
 */
public record ConditionGroup(
        String id,
        GroupLogic logic,
        List<RlsCondition> conditions,
        List<ConditionGroup> groups
) implements ConditionNode {

    public ConditionGroup {
        if (logic == null) {
            logic = GroupLogic.AND;
        }
        conditions = conditions == null ? List.of() : List.copyOf(conditions);
        groups = groups == null ? List.of() : List.copyOf(groups);
    }

    public static ConditionGroup and(String id, List<RlsCondition> conditions, List<ConditionGroup> groups) {
        return new ConditionGroup(id, GroupLogic.AND, conditions, groups);
    }

    public static ConditionGroup or(String id, List<RlsCondition> conditions, List<ConditionGroup> groups) {
        return new ConditionGroup(id, GroupLogic.OR, conditions, groups);
    }

    public static ConditionGroup empty(String id) {
        return new ConditionGroup(id, GroupLogic.AND, List.of(), List.of());
    }

    /**
     * Direct children in evaluation order: conditions first, then nested groups.
     */
    public List<ConditionNode> children() {
        List<ConditionNode> children = new ArrayList<>(conditions.size() + groups.size());
        children.addAll(conditions);
        children.addAll(groups);
        return children;
    }

    @JsonIgnore
    public boolean isEmpty() {
        return conditions.isEmpty() && groups.isEmpty();
    }
}
