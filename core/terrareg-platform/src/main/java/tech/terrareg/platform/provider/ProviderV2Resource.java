package tech.terrareg.platform.provider;

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
import tech.terrareg.platform.authorization.NamespacePermission;
import tech.terrareg.platform.error.RegistryException;

import java.time.format.DateTimeFormatter;
import java.util.Arrays;
import java.util.List;

/**
 * Registry v2 endpoints: provider categories and namespace GPG keys in JSON:API form.
 */
@Path("/v2")
@Tag(name = "Providers", description = "Terraform provider registry protocol")
@Produces(MediaType.APPLICATION_JSON)
public class ProviderV2Resource {

    static final String GPG_KEY_TYPE = "gpg-keys";

    @Inject
    ProviderService providerService;

    @Inject
    GpgKeyService gpgKeyService;

    @Inject
    CurrentAuthContext currentAuthContext;

    // ==================== Categories ====================

    @GET
    @Path("/provider-categories")
    @Operation(summary = "List provider categories")
    public DataList<CategoryResource> categories() {
        return new DataList<>(providerService.categories().stream()
            .map(c -> new CategoryResource("categories", String.valueOf(c.id()),
                new CategoryAttributes(c.name(), c.slug(), c.userSelectable())))
            .toList());
    }

    // ==================== GPG keys ====================

    @GET
    @Path("/gpg-keys")
    @Operation(summary = "List GPG keys of one or more namespaces", description = "filter[namespace] is comma separated")
    public DataList<GpgKeyResource> listKeys(@QueryParam("filter[namespace]") String namespaceFilter) {
        if (namespaceFilter == null || namespaceFilter.isBlank()) {
            throw RegistryException.invalidInput("filter[namespace] is required");
        }
        List<String> namespaces = Arrays.stream(namespaceFilter.split(","))
            .map(String::trim)
            .filter(s -> !s.isEmpty())
            .toList();
        return new DataList<>(gpgKeyService.list(namespaces).stream().map(GpgKeyResource::of).toList());
    }

    @GET
    @Path("/gpg-keys/{namespace}/{keyId}")
    @Operation(summary = "Get one GPG key")
    public Data<GpgKeyResource> getKey(@PathParam("namespace") String namespace, @PathParam("keyId") String keyId) {
        return new Data<>(GpgKeyResource.of(gpgKeyService.get(namespace, keyId)));
    }

    @POST
    @Path("/gpg-keys")
    @Consumes({MediaType.APPLICATION_JSON, "application/vnd.api+json"})
    @Operation(summary = "Add a GPG key to a namespace", description = "Requires FULL on the namespace")
    @APIResponses({
        @APIResponse(responseCode = "201", description = "Key added"),
        @APIResponse(responseCode = "400", description = "Malformed body or key"),
        @APIResponse(responseCode = "409", description = "Key already exists")
    })
    public Response createKey(Data<CreateGpgKey> request) {
        if (request == null || request.data() == null || request.data().attributes() == null
            || !GPG_KEY_TYPE.equals(request.data().type())) {
            throw RegistryException.invalidInput("Body must be a gpg-keys resource");
        }
        CreateGpgKeyAttributes attributes = request.data().attributes();
        if (attributes.namespace() == null || attributes.asciiArmor() == null) {
            throw RegistryException.invalidInput("namespace and ascii-armor are required");
        }
        currentAuthContext.get().requireNamespaceAccess(NamespacePermission.FULL, attributes.namespace());
        GpgKeyService.NamespacedKey created = gpgKeyService.create(attributes.namespace(), attributes.asciiArmor(),
            attributes.source(), attributes.sourceUrl());
        return Response.status(Response.Status.CREATED).entity(new Data<>(GpgKeyResource.of(created))).build();
    }

    @DELETE
    @Path("/gpg-keys/{namespace}/{keyId}")
    @Operation(summary = "Delete a GPG key", description = "Requires FULL on the namespace")
    public Response deleteKey(@PathParam("namespace") String namespace, @PathParam("keyId") String keyId) {
        currentAuthContext.get().requireNamespaceAccess(NamespacePermission.FULL, namespace);
        gpgKeyService.delete(namespace, keyId);
        return Response.noContent().build();
    }

    // ==================== JSON:API documents ====================

    public record Data<T>(T data) {}

    public record DataList<T>(List<T> data) {}

    public record CategoryResource(String type, String id, CategoryAttributes attributes) {}

    public record CategoryAttributes(String name, String slug, @JsonProperty("user-selectable") boolean userSelectable) {}

    public record CreateGpgKey(String type, CreateGpgKeyAttributes attributes) {}

    public record CreateGpgKeyAttributes(
        String namespace,
        @JsonProperty("ascii-armor") String asciiArmor,
        String source,
        @JsonProperty("source-url") String sourceUrl
    ) {}

    public record GpgKeyResource(String type, String id, GpgKeyAttributes attributes) {

        static GpgKeyResource of(GpgKeyService.NamespacedKey namespaced) {
            GpgKey key = namespaced.key();
            return new GpgKeyResource(GPG_KEY_TYPE, key.keyId, new GpgKeyAttributes(
                key.asciiArmor,
                key.createdAt == null ? null : DateTimeFormatter.ISO_INSTANT.format(key.createdAt),
                key.keyId,
                namespaced.namespace(),
                key.source,
                key.sourceUrl,
                key.trustSignature));
        }
    }

    public record GpgKeyAttributes(
        @JsonProperty("ascii-armor") String asciiArmor,
        @JsonProperty("created-at") String createdAt,
        @JsonProperty("key-id") String keyId,
        String namespace,
        String source,
        @JsonProperty("source-url") String sourceUrl,
        @JsonProperty("trust-signature") String trustSignature
    ) {}
}
