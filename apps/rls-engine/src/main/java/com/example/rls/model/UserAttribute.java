package com.example.rls.model;

import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;

/**
 * Reference to the user attribute a dynamic condition compares against.
 *
 * <p>Either one of the well-known attributes or a named custom attribute. A custom
 * reference always carries its name, so "custom without a name" cannot be represented.
 */
public sealed interface UserAttribute permits UserAttribute.Standard, UserAttribute.Custom {

    /**
     * Wire name of the attribute type ({@code user_id}, {@code region}, {@code custom}, ...).
     */
    @NonNull
    String typeName();

    /**
     * Custom attribute key, or null for well-known attributes.
     */
    @Nullable
    String customName();

    record Standard(UserAttributeType type) implements UserAttribute {
        public Standard {
            if (type == null || type == UserAttributeType.CUSTOM) {
                throw new IllegalArgumentException("Standard attribute requires a non-custom type");
            }
        }

        @Override
        public String typeName() {
            return type.value();
        }

        @Override
        public String customName() {
            return null;
        }
    }

    record Custom(String name) implements UserAttribute {
        public Custom {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("Custom attribute requires a name");
            }
        }

        @Override
        public String typeName() {
            return UserAttributeType.CUSTOM.value();
        }

        @Override
        public String customName() {
            return name;
        }
    }

    static UserAttribute standard(UserAttributeType type) {
        return new Standard(type);
    }

    static UserAttribute custom(String name) {
        return new Custom(name);
    }

    /**
     * Builds a reference from its persisted pair ({@code userAttribute}, {@code customAttribute}).
     *
     * @return the reference, or null when no attribute type is given
     * @throws IllegalArgumentException for unknown types or {@code custom} without a name
     */
    @Nullable
    static UserAttribute of(@Nullable String type, @Nullable String customName) {
        if (type == null || type.isBlank()) {
            return null;
        }
        UserAttributeType attributeType = UserAttributeType.fromValue(type);
        if (attributeType == UserAttributeType.CUSTOM) {
            return new Custom(customName);
        }
        return new Standard(attributeType);
    }
}
