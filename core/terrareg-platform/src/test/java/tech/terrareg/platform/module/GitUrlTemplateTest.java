package tech.terrareg.platform.module;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tech.terrareg.platform.error.RegistryException;

import static org.assertj.core.api.Assertions.*;

class GitUrlTemplateTest {

    @Test
    @DisplayName("All placeholders are substituted")
    void render_shouldReplacePlaceholders() {
        String url = GitUrlTemplate.render("https://git.example.com/{namespace}/terraform-{provider}-{module}/tree/{tag}/{path}",
            "acme", "vpc", "aws", "v1.2.3", "modules/core");

        assertThat(url).isEqualTo("https://git.example.com/acme/terraform-aws-vpc/tree/v1.2.3/modules/core");
    }

    @Test
    @DisplayName("Missing tag and path render as empty strings; an empty template renders null")
    void render_shouldHandleMissingValues() {
        assertThat(GitUrlTemplate.render("ssh://git@host/{namespace}/{module}.git?ref={tag}", "acme", "vpc", "aws", null, null))
            .isEqualTo("ssh://git@host/acme/vpc.git?ref=");
        assertThat(GitUrlTemplate.render("", "acme", "vpc", "aws", null, null)).isNull();
    }

    @Test
    @DisplayName("Unknown placeholders are rejected")
    void validate_shouldThrow_whenPlaceholderUnknown() {
        assertThatThrownBy(() -> GitUrlTemplate.validate("https://host/{org}/{module}"))
            .isInstanceOf(RegistryException.class)
            .hasMessageContaining("{org}");
        assertThatCode(() -> GitUrlTemplate.validate("https://host/{namespace}/{module}")).doesNotThrowAnyException();
    }
}
