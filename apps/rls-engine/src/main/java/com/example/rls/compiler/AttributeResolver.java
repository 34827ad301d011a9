package com.example.rls.compiler;

import com.example.rls.model.UserAttribute;
import com.example.rls.model.UserSecurityContext;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.TreeSet;

/**
 * Looks up the value of a user attribute in a {@link UserSecurityContext}.
 *
 * <p>Identity attributes come from the context itself; {@code role} is the sorted role set;
 * everything else, custom keys included, is read from the attribute map.
 */
@Component
public class AttributeResolver {

    @NonNull
    public ResolvedValue resolve(@Nullable UserAttribute attribute, @NonNull UserSecurityContext context) {
        if (attribute == null) {
            return ResolvedValue.UNKNOWN;
        }
        if (attribute instanceof UserAttribute.Custom custom) {
            return ResolvedValue.of(context.attributes().get(custom.name()));
        }
        UserAttribute.Standard standard = (UserAttribute.Standard) attribute;
        return switch (standard.type()) {
            case USER_ID -> ResolvedValue.of(context.userId());
            case USERNAME -> ResolvedValue.of(context.username());
            case EMAIL -> ResolvedValue.of(context.email());
            case ROLE -> context.roles().isEmpty()
                    ? ResolvedValue.UNKNOWN
                    : ResolvedValue.of(List.copyOf(new TreeSet<>(context.roles())));
            default -> ResolvedValue.of(context.attributes().get(standard.typeName()));
        };
    }
}
