package tech.terrareg.platform.module;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import tech.terrareg.platform.authentication.AuthContext;
import tech.terrareg.platform.authentication.AuthMethodType;
import tech.terrareg.platform.authentication.CurrentAuthContext;
import tech.terrareg.platform.authorization.NamespacePermission;
import tech.terrareg.platform.error.ErrorKind;
import tech.terrareg.platform.error.RegistryException;
import tech.terrareg.platform.ingestion.ModuleIngestionService;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("ModuleAdminResource")
class ModuleAdminResourceTest {

    @Mock
    private CurrentAuthContext currentAuthContext;

    @Mock
    private ModuleIngestionService moduleIngestionService;

    @InjectMocks
    private ModuleAdminResource resource;

    private InputStream archive;

    @BeforeEach
    void setUp() {
        archive = new ByteArrayInputStream(new byte[] {1, 2, 3});
    }

    private void givenCaller(NamespacePermission permission) {
        when(currentAuthContext.get()).thenReturn(AuthContext.builder(AuthMethodType.OPENID_CONNECT)
            .username("jane")
            .namespacePermissions(Map.of("acme", permission))
            .build());
    }

    private static ModuleVersion indexed(boolean published) {
        ModuleVersion row = new ModuleVersion();
        row.id = 42L;
        row.version = "1.0.0";
        row.published = published;
        return row;
    }

    // ==================== Upload ====================

    @Test
    @DisplayName("An UPLOAD holder cannot publish by omitting the publish flag")
    void upload_shouldRequirePublish_whenFlagOmitted() {
        // Arrange
        givenCaller(NamespacePermission.UPLOAD);

        // Act & Assert
        assertThatThrownBy(() -> resource.upload("acme", "vpc", "aws", "1.0.0", null, archive))
            .isInstanceOf(RegistryException.class)
            .extracting(e -> ((RegistryException) e).kind())
            .isEqualTo(ErrorKind.FORBIDDEN);
        verifyNoInteractions(moduleIngestionService);
    }

    @Test
    @DisplayName("An UPLOAD holder may upload an unpublished version")
    void upload_shouldIndexUnpublished_whenPublishFalse() {
        // Arrange
        givenCaller(NamespacePermission.UPLOAD);
        when(moduleIngestionService.ingestUpload("acme", "vpc", "aws", "1.0.0", archive, false))
            .thenReturn(indexed(false));

        // Act
        int status = resource.upload("acme", "vpc", "aws", "1.0.0", false, archive).getStatus();

        // Assert
        assertThat(status).isEqualTo(204);
    }

    @Test
    @DisplayName("A PUBLISH holder uploads and publishes by default")
    void upload_shouldPublish_whenFlagOmittedAndPublishHeld() {
        // Arrange
        givenCaller(NamespacePermission.PUBLISH);
        when(moduleIngestionService.ingestUpload(eq("acme"), eq("vpc"), eq("aws"), eq("1.0.0"), any(), eq(true)))
            .thenReturn(indexed(true));

        // Act
        resource.upload("acme", "vpc", "aws", "1.0.0", null, archive);

        // Assert
        verify(moduleIngestionService).ingestUpload("acme", "vpc", "aws", "1.0.0", archive, true);
    }

    // ==================== Import ====================

    @Test
    @DisplayName("Git import stays unpublished by default and needs only UPLOAD")
    void importFromGit_shouldStayUnpublished_whenFlagOmitted() {
        // Arrange
        givenCaller(NamespacePermission.UPLOAD);
        when(moduleIngestionService.ingestFromGit("acme", "vpc", "aws", "1.0.0", false)).thenReturn(indexed(false));

        // Act
        ModuleAdminResource.ImportResponse response =
            resource.importFromGit("acme", "vpc", "aws", new ModuleAdminResource.ImportRequest("1.0.0", null));

        // Assert
        assertThat(response.published()).isFalse();
    }

    @Test
    @DisplayName("Git import with publish=true needs PUBLISH")
    void importFromGit_shouldRequirePublish_whenPublishRequested() {
        // Arrange
        givenCaller(NamespacePermission.UPLOAD);

        // Act & Assert
        assertThatThrownBy(() -> resource.importFromGit("acme", "vpc", "aws",
            new ModuleAdminResource.ImportRequest("1.0.0", true)))
            .isInstanceOf(RegistryException.class)
            .extracting(e -> ((RegistryException) e).kind())
            .isEqualTo(ErrorKind.FORBIDDEN);
        verifyNoInteractions(moduleIngestionService);
    }
}
