package tech.terrareg.platform.search;

import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;

@Path("/v1/terrareg/search_filters")
@Tag(name = "Modules", description = "Terraform module registry protocol")
@Produces(MediaType.APPLICATION_JSON)
public class SearchFiltersResource {

    @Inject
    ModuleSearchService moduleSearchService;

    @GET
    @Operation(summary = "Facet counts for a module search")
    public ModuleSearchService.SearchFilters filters(@QueryParam("q") String query) {
        return moduleSearchService.filters(query);
    }
}
