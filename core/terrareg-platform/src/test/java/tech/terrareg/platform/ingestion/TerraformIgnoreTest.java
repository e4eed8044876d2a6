package tech.terrareg.platform.ingestion;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class TerraformIgnoreTest {

    private final TerraformIgnore ignore = TerraformIgnore.parse("""
        # state files
        *.tfstate
        !keep.tfstate

        /docs/
        """);

    @Test
    @DisplayName("Unanchored patterns match at any depth")
    void isIgnored_shouldMatchAnyDepth_whenUnanchored() {
        assertThat(ignore.isIgnored("terraform.tfstate", false)).isTrue();
        assertThat(ignore.isIgnored("envs/prod/terraform.tfstate", false)).isTrue();
        assertThat(ignore.isIgnored("main.tf", false)).isFalse();
    }

    @Test
    @DisplayName("Negated patterns re-include a file")
    void isIgnored_shouldReinclude_whenNegated() {
        assertThat(ignore.isIgnored("keep.tfstate", false)).isFalse();
    }

    @Test
    @DisplayName("Anchored directory rules only apply at the module root")
    void isIgnored_shouldApplyAnchoredRuleAtRootOnly() {
        assertThat(ignore.isIgnored("docs/usage.md", false)).isTrue();
        assertThat(ignore.isIgnored("modules/docs/usage.md", false)).isFalse();
        assertThat(ignore.isIgnored("docs", false)).isFalse();
    }

    @Test
    @DisplayName(".git and .terraform are always excluded")
    void isIgnored_shouldAlwaysExcludeToolDirectories() {
        TerraformIgnore defaults = TerraformIgnore.defaults();

        assertThat(defaults.isIgnored(".git/config", false)).isTrue();
        assertThat(defaults.isIgnored("examples/basic/.terraform/providers/x", false)).isTrue();
        assertThat(defaults.isIgnored("variables.tf", false)).isFalse();
    }
}
