package tech.terrareg.platform.registry;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import tech.terrareg.platform.authentication.terraform.TerraformIdpService;

import java.util.List;

/**
 * Terraform remote service discovery.
 */
@Path("/.well-known/terraform.json")
@Tag(name = "Discovery", description = "Terraform remote service discovery")
@Produces(MediaType.APPLICATION_JSON)
public class ServiceDiscoveryResource {

    @GET
    @Operation(summary = "Advertise module, provider and login service endpoints")
    public DiscoveryResponse discover() {
        return new DiscoveryResponse(
            "/v1/modules/",
            "/v1/providers/",
            new LoginService(TerraformIdpService.CLIENT_ID, List.of("authz_code"),
                "/terraform/oauth/authorization", "/terraform/oauth/token", TerraformIdpService.PORTS));
    }

    public record DiscoveryResponse(
        @JsonProperty("modules.v1") String modules,
        @JsonProperty("providers.v1") String providers,
        @JsonProperty("login.v1") LoginService login
    ) {}

    public record LoginService(
        String client,
        @JsonProperty("grant_types") List<String> grantTypes,
        String authz,
        String token,
        List<Integer> ports
    ) {}
}
