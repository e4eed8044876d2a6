package tech.terrareg.platform.analytics;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import tech.terrareg.platform.error.RegistryException;
import tech.terrareg.platform.module.ModuleProviderService;
import tech.terrareg.platform.registry.ModuleRegistryService;
import tech.terrareg.platform.registry.ModuleWire;

import java.time.format.DateTimeFormatter;
import java.util.List;

@Path("/v1/terrareg/analytics")
@Tag(name = "Analytics", description = "Download statistics")
@Produces(MediaType.APPLICATION_JSON)
public class AnalyticsResource {

    @Inject
    AnalyticsService analyticsService;

    @Inject
    ModuleProviderService moduleProviderService;

    @Inject
    ModuleRegistryService moduleRegistryService;

    @GET
    @Path("/global/stats_summary")
    @Operation(summary = "Counts of namespaces, modules, published versions and downloads")
    public StatsSummaryResponse statsSummary() {
        AnalyticsService.StatsSummary summary = analyticsService.statsSummary();
        return new StatsSummaryResponse(summary.namespaces(), summary.modules(), summary.moduleVersions(),
            summary.downloads());
    }

    @GET
    @Path("/global/most_recently_published_module_version")
    @Operation(summary = "The most recently published module version")
    @APIResponse(responseCode = "404", description = "Nothing has been published")
    public ModuleWire.ModuleSummary mostRecentlyPublished() {
        return analyticsService.mostRecentlyPublished()
            .flatMap(moduleRegistryService::summarize)
            .orElseThrow(() -> RegistryException.notFound("No module versions have been published"));
    }

    @GET
    @Path("/{namespace}/{module}/{provider}/token_versions")
    @Operation(summary = "Latest version downloaded by each analytics token")
    public List<TokenVersionResponse> tokenVersions(
            @PathParam("namespace") String namespace,
            @PathParam("module") String module,
            @PathParam("provider") String provider) {
        ModuleProviderService.ResolvedModuleProvider resolved = moduleProviderService.require(namespace, module, provider);
        return analyticsService.tokenVersions(resolved.moduleProvider().id).stream()
            .map(t -> new TokenVersionResponse(t.token(), t.version(), t.environment(), t.terraformVersion(),
                t.timestamp() == null ? null : DateTimeFormatter.ISO_INSTANT.format(t.timestamp())))
            .toList();
    }

    public record StatsSummaryResponse(
        long namespaces,
        long modules,
        @JsonProperty("module_versions") long moduleVersions,
        long downloads
    ) {}

    public record TokenVersionResponse(
        @JsonProperty("analytics_token") String analyticsToken,
        @JsonProperty("module_version") String moduleVersion,
        String environment,
        @JsonProperty("terraform_version") String terraformVersion,
        @JsonProperty("last_download") String lastDownload
    ) {}
}
