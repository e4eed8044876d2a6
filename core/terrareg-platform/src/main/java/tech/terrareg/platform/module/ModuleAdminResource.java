package tech.terrareg.platform.module;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.inject.Inject;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.UriInfo;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponses;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.jboss.logging.Logger;
import tech.terrareg.platform.authentication.AuthContext;
import tech.terrareg.platform.authentication.CurrentAuthContext;
import tech.terrareg.platform.authorization.NamespacePermission;
import tech.terrareg.platform.error.RegistryException;
import tech.terrareg.platform.ingestion.ModuleIngestionService;
import tech.terrareg.platform.presign.PresignedUrlService;
import tech.terrareg.platform.registry.ModuleRegistryService;
import tech.terrareg.platform.storage.StoragePaths;

import java.io.InputStream;

/**
 * Module management API: module provider lifecycle, version ingestion and
 * publication, and the presigned archive endpoint used by Terraform downloads.
 */
@Path("/v1/terrareg/modules/{namespace}/{module}/{provider}")
@Tag(name = "Module Administration", description = "Module provider and version management")
@Produces(MediaType.APPLICATION_JSON)
public class ModuleAdminResource {

    private static final Logger LOG = Logger.getLogger(ModuleAdminResource.class);

    @Inject
    CurrentAuthContext currentAuthContext;

    @Inject
    ModuleProviderService moduleProviderService;

    @Inject
    ModuleVersionService moduleVersionService;

    @Inject
    ModuleIngestionService moduleIngestionService;

    @Inject
    ModuleRegistryService moduleRegistryService;

    @Inject
    PresignedUrlService presignedUrlService;

    // ==================== Module provider ====================

    @POST
    @Path("/create")
    @Consumes(MediaType.APPLICATION_JSON)
    @Operation(summary = "Create a module provider", description = "Requires FULL on the namespace")
    @APIResponses({
        @APIResponse(responseCode = "200", description = "Module provider created"),
        @APIResponse(responseCode = "403", description = "Insufficient namespace permission"),
        @APIResponse(responseCode = "409", description = "Module provider already exists")
    })
    public ModuleProviderView create(
            @PathParam("namespace") String namespace,
            @PathParam("module") String module,
            @PathParam("provider") String provider,
            SettingsRequest request) {
        AuthContext auth = currentAuthContext.get();
        auth.requireNamespaceAccess(NamespacePermission.FULL, namespace);
        ModuleProviderService.Settings settings = request == null ? null : request.toSettings();
        if (settings != null && settings.verified() != null) {
            auth.requireSiteAdmin();
        }
        return ModuleProviderView.of(moduleProviderService.create(namespace, module, provider, settings));
    }

    @POST
    @Path("/settings")
    @Consumes(MediaType.APPLICATION_JSON)
    @Operation(summary = "Update repository settings", description = "Requires MODIFY on the namespace; verified requires site admin")
    public ModuleProviderView updateSettings(
            @PathParam("namespace") String namespace,
            @PathParam("module") String module,
            @PathParam("provider") String provider,
            SettingsRequest request) {
        if (request == null) {
            throw RegistryException.invalidInput("Request body is required");
        }
        AuthContext auth = currentAuthContext.get();
        auth.requireNamespaceAccess(NamespacePermission.MODIFY, namespace);
        if (request.verified() != null) {
            auth.requireSiteAdmin();
        }
        return ModuleProviderView.of(moduleProviderService.updateSettings(namespace, module, provider, request.toSettings()));
    }

    @DELETE
    @Path("/delete")
    @Operation(summary = "Delete a module provider with all of its versions", description = "Requires FULL on the namespace")
    @APIResponse(responseCode = "204", description = "Deleted")
    public Response delete(
            @PathParam("namespace") String namespace,
            @PathParam("module") String module,
            @PathParam("provider") String provider) {
        currentAuthContext.get().requireNamespaceAccess(NamespacePermission.FULL, namespace);
        moduleProviderService.delete(namespace, module, provider);
        return Response.noContent().build();
    }

    // ==================== Ingestion ====================

    @POST
    @Path("/{version}/upload")
    @Consumes(MediaType.WILDCARD)
    @Operation(summary = "Upload a module archive", description = "tar.gz or zip body; requires UPLOAD on the namespace, and PUBLISH unless publish=false")
    @APIResponses({
        @APIResponse(responseCode = "204", description = "Version indexed"),
        @APIResponse(responseCode = "400", description = "Invalid archive, version or hosting mode"),
        @APIResponse(responseCode = "403", description = "Insufficient namespace permission"),
        @APIResponse(responseCode = "409", description = "Another ingestion of this module provider is running")
    })
    public Response upload(
            @PathParam("namespace") String namespace,
            @PathParam("module") String module,
            @PathParam("provider") String provider,
            @PathParam("version") String version,
            @QueryParam("publish") Boolean publish,
            InputStream body) {
        AuthContext auth = currentAuthContext.get();
        auth.requireUpload(namespace);
        boolean publishVersion = publish == null || publish;
        if (publishVersion) {
            auth.requirePublish(namespace);
        }
        if (body == null) {
            throw RegistryException.invalidInput("Request body must contain the module archive");
        }
        ModuleVersion indexed = moduleIngestionService.ingestUpload(namespace, module, provider, version, body,
            publishVersion);
        LOG.infof("Upload of %s/%s/%s/%s by %s indexed as row %d", namespace, module, provider, version,
            auth.username(), indexed.id);
        return Response.noContent().build();
    }

    @POST
    @Path("/import")
    @Consumes(MediaType.APPLICATION_JSON)
    @Operation(summary = "Index a version from the module provider's git repository",
        description = "Requires UPLOAD on the namespace; the version is left unpublished unless publish is set")
    @APIResponses({
        @APIResponse(responseCode = "200", description = "Version indexed"),
        @APIResponse(responseCode = "400", description = "Missing clone URL, invalid version or hosting mode"),
        @APIResponse(responseCode = "403", description = "Insufficient namespace permission")
    })
    public ImportResponse importFromGit(
            @PathParam("namespace") String namespace,
            @PathParam("module") String module,
            @PathParam("provider") String provider,
            ImportRequest request) {
        if (request == null || request.version() == null || request.version().isBlank()) {
            throw RegistryException.invalidInput("version is required");
        }
        AuthContext auth = currentAuthContext.get();
        auth.requireUpload(namespace);
        boolean publishVersion = Boolean.TRUE.equals(request.publish());
        if (publishVersion) {
            auth.requirePublish(namespace);
        }
        ModuleVersion indexed = moduleIngestionService.ingestFromGit(namespace, module, provider, request.version(),
            publishVersion);
        return new ImportResponse(indexed.version, indexed.published, indexed.repoSnapshotSha);
    }

    @POST
    @Path("/{version}/publish")
    @Operation(summary = "Publish an indexed version", description = "Requires PUBLISH on the namespace")
    @APIResponses({
        @APIResponse(responseCode = "204", description = "Published"),
        @APIResponse(responseCode = "404", description = "Version was never indexed")
    })
    public Response publish(
            @PathParam("namespace") String namespace,
            @PathParam("module") String module,
            @PathParam("provider") String provider,
            @PathParam("version") String version) {
        currentAuthContext.get().requirePublish(namespace);
        moduleVersionService.publish(moduleProviderService.require(namespace, module, provider), version);
        return Response.noContent().build();
    }

    @DELETE
    @Path("/{version}/delete")
    @Operation(summary = "Delete a version with its submodules, examples, files and archives",
        description = "Requires FULL on the namespace")
    public Response deleteVersion(
            @PathParam("namespace") String namespace,
            @PathParam("module") String module,
            @PathParam("provider") String provider,
            @PathParam("version") String version) {
        currentAuthContext.get().requireNamespaceAccess(NamespacePermission.FULL, namespace);
        moduleVersionService.delete(moduleProviderService.require(namespace, module, provider), version);
        return Response.noContent().build();
    }

    // ==================== Source archives ====================

    @GET
    @Path("/{version}/{archive: source\\.(tar\\.gz|zip)}")
    @Produces(MediaType.APPLICATION_OCTET_STREAM)
    @Operation(summary = "Download a module archive through a presigned URL")
    @APIResponses({
        @APIResponse(responseCode = "200", description = "Archive bytes"),
        @APIResponse(responseCode = "403", description = "Missing, expired or tampered signature")
    })
    public Response source(
            @PathParam("namespace") String namespace,
            @PathParam("module") String module,
            @PathParam("provider") String provider,
            @PathParam("version") String version,
            @PathParam("archive") String archive,
            @QueryParam("ts") String ts,
            @QueryParam("exp") String exp,
            @QueryParam("sig") String sig,
            @Context UriInfo uriInfo) {
        String path = uriInfo.getPath();
        if (!presignedUrlService.verify(path, ts, exp, sig)) {
            LOG.debugf("Rejected unsigned archive request for %s", path);
            throw RegistryException.forbidden("Invalid or expired download URL");
        }
        InputStream content = moduleRegistryService.openSourceArchive(namespace, module, provider, version, archive);
        String mediaType = StoragePaths.SOURCE_ZIP.equals(archive) ? "application/zip" : "application/gzip";
        return Response.ok(content, mediaType)
            .header("Content-Disposition", "attachment; filename=\"" + archive + "\"")
            .build();
    }

    // ==================== DTOs ====================

    public record SettingsRequest(
        @JsonProperty("repo_base_url_template") String repoBaseUrlTemplate,
        @JsonProperty("repo_clone_url_template") String repoCloneUrlTemplate,
        @JsonProperty("repo_browse_url_template") String repoBrowseUrlTemplate,
        @JsonProperty("git_tag_format") String gitTagFormat,
        @JsonProperty("git_path") String gitPath,
        Boolean verified
    ) {
        ModuleProviderService.Settings toSettings() {
            return new ModuleProviderService.Settings(repoBaseUrlTemplate, repoCloneUrlTemplate,
                repoBrowseUrlTemplate, gitTagFormat, gitPath, verified);
        }
    }

    public record ModuleProviderView(
        String id,
        String namespace,
        String module,
        String provider,
        @JsonProperty("repo_base_url_template") String repoBaseUrlTemplate,
        @JsonProperty("repo_clone_url_template") String repoCloneUrlTemplate,
        @JsonProperty("repo_browse_url_template") String repoBrowseUrlTemplate,
        @JsonProperty("git_tag_format") String gitTagFormat,
        @JsonProperty("git_path") String gitPath,
        boolean verified
    ) {
        static ModuleProviderView of(ModuleProviderService.ResolvedModuleProvider resolved) {
            ModuleProvider mp = resolved.moduleProvider();
            return new ModuleProviderView(resolved.id(), resolved.namespace().name, mp.moduleName, mp.providerName,
                mp.repoBaseUrlTemplate, mp.repoCloneUrlTemplate, mp.repoBrowseUrlTemplate,
                mp.gitTagFormat, mp.gitPath, mp.verified);
        }
    }

    public record ImportRequest(String version, Boolean publish) {}

    public record ImportResponse(
        String version,
        boolean published,
        @JsonProperty("repo_snapshot_sha") String repoSnapshotSha
    ) {}
}
