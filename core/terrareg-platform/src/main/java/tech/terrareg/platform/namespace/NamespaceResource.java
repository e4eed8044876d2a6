package tech.terrareg.platform.namespace;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.inject.Inject;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponses;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import tech.terrareg.platform.authentication.CurrentAuthContext;
import tech.terrareg.platform.error.RegistryException;
import tech.terrareg.platform.shared.PageMeta;

import java.util.List;
import java.util.Locale;

@Path("/v1/terrareg/namespaces")
@Tag(name = "Namespaces", description = "Namespace administration")
@Produces(MediaType.APPLICATION_JSON)
public class NamespaceResource {

    static final int DEFAULT_LIMIT = 10;

    @Inject
    NamespaceService namespaceService;

    @Inject
    CurrentAuthContext currentAuthContext;

    @GET
    @Operation(summary = "List namespaces")
    public NamespaceListResponse list(@QueryParam("offset") Integer offset, @QueryParam("limit") Integer limit) {
        int clampedLimit = PageMeta.clampLimit(limit, DEFAULT_LIMIT);
        int clampedOffset = PageMeta.clampOffset(offset);
        List<NamespaceView> namespaces = namespaceService.list(clampedOffset, clampedLimit).stream()
            .map(NamespaceView::of)
            .toList();
        return new NamespaceListResponse(PageMeta.of(clampedLimit, clampedOffset, namespaceService.count()), namespaces);
    }

    @POST
    @Consumes(MediaType.APPLICATION_JSON)
    @Operation(summary = "Create a namespace", description = "Site admin only")
    @APIResponses({
        @APIResponse(responseCode = "201", description = "Namespace created"),
        @APIResponse(responseCode = "400", description = "Invalid name or type"),
        @APIResponse(responseCode = "409", description = "Namespace already exists")
    })
    public Response create(CreateNamespaceRequest request) {
        currentAuthContext.get().requireSiteAdmin();
        if (request == null) {
            throw RegistryException.invalidInput("Request body is required");
        }
        Namespace created = namespaceService.create(request.name(), request.displayName(), parseType(request.type()));
        return Response.status(Response.Status.CREATED).entity(NamespaceView.of(created)).build();
    }

    @GET
    @Path("/{namespace}")
    @Operation(summary = "Get a namespace")
    @APIResponse(responseCode = "404", description = "Namespace not found")
    public NamespaceView get(@PathParam("namespace") String namespace) {
        return NamespaceView.of(namespaceService.require(namespace));
    }

    @DELETE
    @Path("/{namespace}")
    @Operation(summary = "Delete an empty namespace", description = "Site admin only")
    @APIResponses({
        @APIResponse(responseCode = "204", description = "Namespace deleted"),
        @APIResponse(responseCode = "400", description = "Namespace still contains modules or providers")
    })
    public Response delete(@PathParam("namespace") String namespace) {
        currentAuthContext.get().requireSiteAdmin();
        namespaceService.delete(namespace);
        return Response.noContent().build();
    }

    static NamespaceType parseType(String type) {
        if (type == null || type.isBlank()) {
            return NamespaceType.ORGANISATION;
        }
        try {
            return NamespaceType.valueOf(type.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw RegistryException.invalidInput("Invalid namespace type: " + type);
        }
    }

    public record CreateNamespaceRequest(
        String name,
        @JsonProperty("display_name") String displayName,
        String type
    ) {}

    public record NamespaceView(
        String name,
        @JsonProperty("display_name") String displayName,
        String type,
        @JsonProperty("view_href") String viewHref
    ) {
        static NamespaceView of(Namespace namespace) {
            return new NamespaceView(namespace.name, namespace.displayNameOrName(), namespace.type.name(),
                "/modules/" + namespace.name);
        }
    }

    public record NamespaceListResponse(PageMeta meta, List<NamespaceView> namespaces) {}
}
