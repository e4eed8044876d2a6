package tech.terrareg.platform.registry;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.semver4j.Semver;
import tech.terrareg.platform.error.ErrorKind;
import tech.terrareg.platform.error.RegistryException;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class VersionConstraintTest {

    private static final List<String> PUBLISHED = List.of("1.0.0", "1.1.0", "2.0.0-rc1");

    // ========================================
    // Pessimistic operator
    // ========================================

    @Test
    @DisplayName("~> 1.0 resolves to the highest 1.x release")
    void resolve_shouldPickHighestMinor_whenPessimisticTwoParts() {
        assertThat(VersionConstraint.parse("~> 1.0").resolve(PUBLISHED)).contains("1.1.0");
    }

    @Test
    @DisplayName("~> 1.2.3 stays within the 1.2 line")
    void resolve_shouldStayOnMinorLine_whenPessimisticThreeParts() {
        VersionConstraint constraint = VersionConstraint.parse("~> 1.2.3");

        assertThat(constraint.resolve(List.of("1.2.2", "1.2.3", "1.2.9", "1.3.0"))).contains("1.2.9");
    }

    @Test
    @DisplayName("~> with a single part has no upper bound")
    void resolve_shouldHaveNoUpperBound_whenPessimisticSinglePart() {
        assertThat(VersionConstraint.parse("~> 1").resolve(List.of("0.9.0", "1.0.0", "5.2.0"))).contains("5.2.0");
    }

    // ========================================
    // Comparison operators
    // ========================================

    @Test
    @DisplayName("Comma separated clauses must all hold")
    void resolve_shouldApplyEveryClause_whenRangeGiven() {
        VersionConstraint constraint = VersionConstraint.parse(">= 1.0, < 2.0");

        assertThat(constraint.resolve(List.of("0.9.0", "1.5.0", "2.0.0"))).contains("1.5.0");
    }

    @Test
    @DisplayName("!= excludes exactly one version")
    void resolve_shouldSkipExcludedVersion_whenNotEqual() {
        assertThat(VersionConstraint.parse("!= 1.5.0").resolve(List.of("1.4.0", "1.5.0"))).contains("1.4.0");
    }

    @Test
    @DisplayName("A bare partial version is an exact match on the padded version")
    void isSatisfiedBy_shouldPadPartialVersion_whenNoOperator() {
        VersionConstraint constraint = VersionConstraint.parse("1.0");

        assertThat(constraint.isSatisfiedBy(new Semver("1.0.0"))).isTrue();
        assertThat(constraint.isSatisfiedBy(new Semver("1.0.1"))).isFalse();
    }

    // ========================================
    // Pre-releases
    // ========================================

    @Test
    @DisplayName(">= 2.0.0 finds nothing when only a pre-release of 2.0.0 exists")
    void resolve_shouldIgnorePreRelease_whenNotPinned() {
        assertThat(VersionConstraint.parse(">= 2.0.0").resolve(PUBLISHED)).isEmpty();
    }

    @Test
    @DisplayName(">=2.0.0-rc1 returns the pinned pre-release")
    void resolve_shouldReturnPreRelease_whenPinned() {
        assertThat(VersionConstraint.parse(">=2.0.0-rc1").resolve(PUBLISHED)).contains("2.0.0-rc1");
    }

    @Test
    @DisplayName("An empty constraint resolves to the highest release, never a pre-release")
    void resolve_shouldSkipPreReleases_whenConstraintBlank() {
        assertThat(VersionConstraint.parse("").resolve(List.of("1.0.0", "2.0.0-beta"))).contains("1.0.0");
        assertThat(VersionConstraint.parse(null).resolve(List.of("3.1.0", "3.0.0"))).contains("3.1.0");
    }

    @Test
    @DisplayName("Unparseable versions in the candidate list are ignored")
    void resolve_shouldIgnoreGarbage_whenCandidatesContainInvalidVersions() {
        assertThat(VersionConstraint.parse(">= 1.0").resolve(List.of("latest", "1.2.0"))).contains("1.2.0");
    }

    // ========================================
    // Parsing
    // ========================================

    @Test
    @DisplayName("Malformed clauses are rejected as invalid input")
    void parse_shouldThrowInvalidInput_whenClauseMalformed() {
        assertThatThrownBy(() -> VersionConstraint.parse(">> 1.0"))
            .isInstanceOf(RegistryException.class)
            .extracting(e -> ((RegistryException) e).kind())
            .isEqualTo(ErrorKind.INVALID_INPUT);
        assertThatThrownBy(() -> VersionConstraint.parse("1.2.3.4"))
            .isInstanceOf(RegistryException.class);
    }
}
