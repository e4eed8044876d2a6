package tech.terrareg.platform.provider;

import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;

/**
 * Terraform Registry provider protocol (providers.v1).
 */
@Path("/v1/providers/{namespace}/{name}")
@Tag(name = "Providers", description = "Terraform provider registry protocol")
@Produces(MediaType.APPLICATION_JSON)
public class ProviderRegistryResource {

    @Inject
    ProviderService providerService;

    @GET
    @Operation(summary = "Latest published version of a provider")
    @APIResponse(responseCode = "404", description = "Provider not found or unpublished")
    public ProviderWire.ProviderDetail detail(@PathParam("namespace") String namespace, @PathParam("name") String name) {
        return providerService.detail(namespace, name);
    }

    @GET
    @Path("/versions")
    @Operation(summary = "Published versions with their protocols and platforms")
    public ProviderWire.VersionsResponse versions(@PathParam("namespace") String namespace, @PathParam("name") String name) {
        return providerService.versions(namespace, name);
    }

    @GET
    @Path("/{version}/download/{os}/{arch}")
    @Operation(summary = "Download metadata for one platform", description = "URLs are presigned")
    @APIResponse(responseCode = "404", description = "Version or platform not found")
    public ProviderWire.Download download(
            @PathParam("namespace") String namespace,
            @PathParam("name") String name,
            @PathParam("version") String version,
            @PathParam("os") String os,
            @PathParam("arch") String arch) {
        return providerService.download(namespace, name, version, os, arch);
    }
}
