package tech.terrareg.platform.registry;

import jakarta.inject.Inject;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponses;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import tech.terrareg.platform.analytics.AnalyticsTokenParser;
import tech.terrareg.platform.authentication.CurrentAuthContext;
import tech.terrareg.platform.search.ModuleSearchService;
import tech.terrareg.platform.shared.PageMeta;

import java.net.URI;
import java.util.List;

/**
 * Terraform Registry module protocol (modules.v1).
 */
@Path("/v1/modules")
@Tag(name = "Modules", description = "Terraform module registry protocol")
@Produces(MediaType.APPLICATION_JSON)
public class ModuleRegistryResource {

    static final String TERRAFORM_GET = "X-Terraform-Get";
    static final String TERRAFORM_VERSION = "X-Terraform-Version";

    @Inject
    ModuleRegistryService moduleRegistryService;

    @Inject
    ModuleSearchService moduleSearchService;

    @Inject
    CurrentAuthContext currentAuthContext;

    // ==================== Listing and search ====================

    @GET
    @Operation(summary = "List modules at their latest version")
    public ModuleSearchService.SearchResult list(
            @QueryParam("offset") Integer offset,
            @QueryParam("limit") Integer limit,
            @QueryParam("provider") String provider,
            @QueryParam("verified") Boolean verified) {
        return moduleSearchService.search(ModuleSearchService.SearchQuery.listing(null, provider, verified, offset, limit));
    }

    @GET
    @Path("/search")
    @Operation(summary = "Search modules")
    public ModuleSearchService.SearchResult search(
            @QueryParam("q") String query,
            @QueryParam("offset") Integer offset,
            @QueryParam("limit") Integer limit,
            @QueryParam("namespace") List<String> namespaces,
            @QueryParam("provider") List<String> providers,
            @QueryParam("verified") Boolean verified,
            @QueryParam("trusted_namespaces") Boolean trustedNamespaces,
            @QueryParam("contributed") Boolean contributed,
            @QueryParam("include_internal") @DefaultValue("false") boolean includeInternal) {
        return moduleSearchService.search(new ModuleSearchService.SearchQuery(query,
            namespaces == null ? List.of() : namespaces,
            providers == null ? List.of() : providers,
            verified, trustedNamespaces, contributed, includeInternal, offset, limit));
    }

    @GET
    @Path("/{namespace}")
    @Operation(summary = "List modules in a namespace")
    public ModuleSearchService.SearchResult listNamespace(
            @PathParam("namespace") String namespace,
            @QueryParam("offset") Integer offset,
            @QueryParam("limit") Integer limit,
            @QueryParam("provider") String provider,
            @QueryParam("verified") Boolean verified) {
        String name = AnalyticsTokenParser.parse(namespace).namespace();
        return moduleSearchService.search(ModuleSearchService.SearchQuery.listing(name, provider, verified, offset, limit));
    }

    @GET
    @Path("/{namespace}/{module}")
    @Operation(summary = "List the providers of a module")
    public ModuleListResponse providers(@PathParam("namespace") String namespace, @PathParam("module") String module) {
        List<ModuleWire.ModuleSummary> modules = moduleRegistryService.providersOf(
            AnalyticsTokenParser.parse(namespace).namespace(), module);
        return new ModuleListResponse(PageMeta.of(modules.size(), 0, modules.size()), modules);
    }

    // ==================== Module provider ====================

    @GET
    @Path("/{namespace}/{module}/{provider}")
    @Operation(summary = "Latest version of a module provider",
        description = "The optional version query is a constraint such as '~> 1.2' or '>= 2.0.0-rc1'")
    @APIResponses({
        @APIResponse(responseCode = "400", description = "Malformed version constraint"),
        @APIResponse(responseCode = "404", description = "Module provider or matching published version not found")
    })
    public ModuleWire.ModuleDetail latest(
            @PathParam("namespace") String namespace,
            @PathParam("module") String module,
            @PathParam("provider") String provider,
            @QueryParam("version") String constraint) {
        return moduleRegistryService.detailMatching(AnalyticsTokenParser.parse(namespace).namespace(), module, provider,
            constraint);
    }

    @GET
    @Path("/{namespace}/{module}/{provider}/versions")
    @Operation(summary = "List published versions")
    public ModuleWire.VersionsResponse versions(
            @PathParam("namespace") String namespace,
            @PathParam("module") String module,
            @PathParam("provider") String provider) {
        return moduleRegistryService.versions(namespace, module, provider);
    }

    @GET
    @Path("/{namespace}/{module}/{provider}/download")
    @Operation(summary = "Redirect to the download of the latest version",
        description = "The optional version query is a constraint selecting the highest matching version")
    @APIResponses({
        @APIResponse(responseCode = "302", description = "Redirect to the version download endpoint"),
        @APIResponse(responseCode = "400", description = "Malformed version constraint"),
        @APIResponse(responseCode = "404", description = "No matching published version")
    })
    public Response downloadLatest(
            @PathParam("namespace") String namespace,
            @PathParam("module") String module,
            @PathParam("provider") String provider,
            @QueryParam("version") String constraint) {
        String name = AnalyticsTokenParser.parse(namespace).namespace();
        ModuleWire.ModuleDetail latest = moduleRegistryService.detailMatching(name, module, provider, constraint);
        return Response.status(Response.Status.FOUND)
            .location(URI.create("/v1/modules/" + namespace + "/" + module + "/" + provider + "/" + latest.version() + "/download"))
            .build();
    }

    @GET
    @Path("/{namespace}/{module}/{provider}/{version}")
    @Operation(summary = "Detail of one published version")
    public ModuleWire.ModuleDetail version(
            @PathParam("namespace") String namespace,
            @PathParam("module") String module,
            @PathParam("provider") String provider,
            @PathParam("version") String version) {
        return moduleRegistryService.detail(AnalyticsTokenParser.parse(namespace).namespace(), module, provider, version);
    }

    @GET
    @Path("/{namespace}/{module}/{provider}/{version}/download")
    @Operation(summary = "Download location of a version", description = "Location is returned in X-Terraform-Get")
    @APIResponses({
        @APIResponse(responseCode = "204", description = "Download location in X-Terraform-Get"),
        @APIResponse(responseCode = "401", description = "Analytics token required"),
        @APIResponse(responseCode = "404", description = "Version not found")
    })
    public Response download(
            @PathParam("namespace") String namespace,
            @PathParam("module") String module,
            @PathParam("provider") String provider,
            @PathParam("version") String version,
            @HeaderParam(TERRAFORM_VERSION) String terraformVersion,
            @HeaderParam(HttpHeaders.USER_AGENT) String userAgent) {
        ModuleRegistryService.Download download = moduleRegistryService.download(namespace, module, provider, version,
            currentAuthContext.get(), terraformVersion, userAgent);
        return Response.noContent().header(TERRAFORM_GET, download.terraformGet()).build();
    }

    public record ModuleListResponse(PageMeta meta, List<ModuleWire.ModuleSummary> modules) {}
}
