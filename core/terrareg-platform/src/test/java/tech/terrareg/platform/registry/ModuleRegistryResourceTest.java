package tech.terrareg.platform.registry;

import jakarta.ws.rs.core.Response;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import tech.terrareg.platform.error.ErrorKind;
import tech.terrareg.platform.error.RegistryException;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("ModuleRegistryResource")
class ModuleRegistryResourceTest {

    @Mock
    private ModuleRegistryService moduleRegistryService;

    @InjectMocks
    private ModuleRegistryResource resource;

    @Test
    @DisplayName("download without a version redirects to the version matching the constraint")
    void downloadLatest_shouldRedirectToConstrainedVersion() {
        // Arrange
        ModuleWire.ModuleDetail detail = mock(ModuleWire.ModuleDetail.class);
        when(detail.version()).thenReturn("2.0.0-rc1");
        when(moduleRegistryService.detailMatching("hashicorp", "consul", "aws", ">=2.0.0-rc1")).thenReturn(detail);

        // Act
        Response response = resource.downloadLatest("my-app__hashicorp", "consul", "aws", ">=2.0.0-rc1");

        // Assert
        assertThat(response.getStatus()).isEqualTo(302);
        assertThat(response.getLocation().toString())
            .isEqualTo("/v1/modules/my-app__hashicorp/consul/aws/2.0.0-rc1/download");
    }

    @Test
    @DisplayName("download without any query redirects to the latest version")
    void downloadLatest_shouldPassNullConstraint_whenQueryAbsent() {
        // Arrange
        ModuleWire.ModuleDetail detail = mock(ModuleWire.ModuleDetail.class);
        when(detail.version()).thenReturn("1.1.0");
        when(moduleRegistryService.detailMatching("hashicorp", "consul", "aws", null)).thenReturn(detail);

        // Act
        Response response = resource.downloadLatest("hashicorp", "consul", "aws", null);

        // Assert
        assertThat(response.getLocation().toString()).endsWith("/consul/aws/1.1.0/download");
    }

    @Test
    @DisplayName("the module provider endpoint resolves the version query as a constraint")
    void latest_shouldResolveConstraint() {
        // Arrange
        ModuleWire.ModuleDetail detail = mock(ModuleWire.ModuleDetail.class);
        when(moduleRegistryService.detailMatching("hashicorp", "consul", "aws", "~> 1.0")).thenReturn(detail);

        // Act & Assert
        assertThat(resource.latest("my-app__hashicorp", "consul", "aws", "~> 1.0")).isSameAs(detail);
    }

    @Test
    @DisplayName("a constraint nothing satisfies surfaces as NOT_FOUND")
    void downloadLatest_shouldThrowNotFound_whenNothingMatches() {
        // Arrange
        when(moduleRegistryService.detailMatching("hashicorp", "consul", "aws", ">= 2.0.0"))
            .thenThrow(RegistryException.notFound("No published version of hashicorp/consul/aws matches >= 2.0.0"));

        // Act & Assert
        assertThatThrownBy(() -> resource.downloadLatest("hashicorp", "consul", "aws", ">= 2.0.0"))
            .isInstanceOf(RegistryException.class)
            .extracting(e -> ((RegistryException) e).kind())
            .isEqualTo(ErrorKind.NOT_FOUND);
    }
}
