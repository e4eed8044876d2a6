package tech.terrareg.platform.authorization;

import java.util.Locale;
import java.util.Optional;

/**
 * Namespace permission levels, totally ordered:
 * FULL includes PUBLISH includes UPLOAD includes MODIFY includes READ.
 */
public enum NamespacePermission {
    READ(1),
    MODIFY(2),
    UPLOAD(3),
    PUBLISH(4),
    FULL(5);

    private final int level;

    NamespacePermission(int level) {
        this.level = level;
    }

    public int level() {
        return level;
    }

    /**
     * Whether holding this permission satisfies {@code required}.
     */
    public boolean allows(NamespacePermission required) {
        return level >= required.level;
    }

    public static NamespacePermission strongest(NamespacePermission a, NamespacePermission b) {
        if (a == null) {
            return b;
        }
        if (b == null) {
            return a;
        }
        return a.level >= b.level ? a : b;
    }

    public static Optional<NamespacePermission> parse(String value) {
        if (value == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(valueOf(value.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
