package tech.terrareg.platform.module;

import org.semver4j.Semver;
import tech.terrareg.platform.error.RegistryException;

import java.util.Comparator;

/**
 * SemVer 2.0.0 parsing for module and provider versions.
 */
public final class SemanticVersion {

    /**
     * Orders version strings by SemVer precedence. Both must be valid.
     */
    public static final Comparator<String> PRECEDENCE = (a, b) -> parse(a).compareTo(parse(b));

    /**
     * @throws RegistryException INVALID_INPUT if {@code version} is not SemVer 2.0.0
     */
    public static Semver parse(String version) {
        Semver parsed = version == null ? null : Semver.parse(version);
        if (parsed == null) {
            throw RegistryException.invalidInput("Version is not a valid semantic version: " + version);
        }
        return parsed;
    }

    /**
     * True iff the pre-release segment is non-empty.
     */
    public static boolean isBeta(Semver version) {
        return !version.getPreRelease().isEmpty();
    }

    private SemanticVersion() {
        // Utility class
    }
}
