package tech.terrareg.platform.config;

import java.util.Locale;

/**
 * Whether module source archives are hosted by the registry.
 */
public enum ModuleHostingMode {
    ALLOW,
    DISALLOW,
    ENFORCE;

    /**
     * Unknown or empty values fall back to {@link #ALLOW}.
     */
    public static ModuleHostingMode parse(String value) {
        if (value == null) {
            return ALLOW;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "disallow" -> DISALLOW;
            case "enforce" -> ENFORCE;
            default -> ALLOW;
        };
    }
}
