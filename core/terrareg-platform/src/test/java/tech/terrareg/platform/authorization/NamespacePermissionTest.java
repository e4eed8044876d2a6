package tech.terrareg.platform.authorization;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class NamespacePermissionTest {

    @Test
    @DisplayName("Higher levels include every lower level")
    void allows_shouldFollowTotalOrder() {
        assertThat(NamespacePermission.FULL.allows(NamespacePermission.PUBLISH)).isTrue();
        assertThat(NamespacePermission.PUBLISH.allows(NamespacePermission.UPLOAD)).isTrue();
        assertThat(NamespacePermission.UPLOAD.allows(NamespacePermission.MODIFY)).isTrue();
        assertThat(NamespacePermission.MODIFY.allows(NamespacePermission.UPLOAD)).isFalse();
        assertThat(NamespacePermission.READ.allows(NamespacePermission.READ)).isTrue();
    }

    @Test
    @DisplayName("strongest picks the higher level and tolerates nulls")
    void strongest_shouldPickHigher() {
        assertThat(NamespacePermission.strongest(NamespacePermission.READ, NamespacePermission.UPLOAD))
            .isEqualTo(NamespacePermission.UPLOAD);
        assertThat(NamespacePermission.strongest(null, NamespacePermission.MODIFY)).isEqualTo(NamespacePermission.MODIFY);
        assertThat(NamespacePermission.strongest(null, null)).isNull();
    }

    @Test
    @DisplayName("parse is case-insensitive and rejects unknown values")
    void parse_shouldHandleCaseAndUnknown() {
        assertThat(NamespacePermission.parse(" publish ")).contains(NamespacePermission.PUBLISH);
        assertThat(NamespacePermission.parse("owner")).isEmpty();
        assertThat(NamespacePermission.parse(null)).isEmpty();
    }
}
