package com.example.rls.cache;

import com.example.rls.engine.FilterRequest;
import com.example.rls.model.UserSecurityContext;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Key of a cached combined filter.
 *
 * <p>Besides the table and the user's sorted role set, the key carries every user field a
 * dynamic condition may read, so two users with equal roles but different attributes never
 * share a cached predicate.
 */
public record DecisionCacheKey(
        String connectionId,
        String schemaName,
        String tableName,
        List<String> roleIds,
        String userId,
        String username,
        String email,
        Map<String, Object> attributes
) {
    public static DecisionCacheKey of(FilterRequest request) {
        UserSecurityContext user = request.userContext();
        return new DecisionCacheKey(
                request.connectionId(),
                request.schemaName(),
                request.tableName(),
                user.roles().stream().sorted().toList(),
                user.userId(),
                user.username(),
                user.email(),
                Collections.unmodifiableMap(new TreeMap<>(user.attributes())));
    }
}
