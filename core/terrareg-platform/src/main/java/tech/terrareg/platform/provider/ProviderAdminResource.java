package tech.terrareg.platform.provider;

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
import tech.terrareg.platform.authentication.CurrentAuthContext;
import tech.terrareg.platform.error.RegistryException;
import tech.terrareg.platform.presign.PresignedUrlService;

import java.io.InputStream;

/**
 * Provider release ingestion and the presigned artifact endpoint.
 */
@Path("/v1/terrareg/providers/{namespace}/{name}/{version}")
@Tag(name = "Provider Administration", description = "Provider release ingestion")
@Produces(MediaType.APPLICATION_JSON)
public class ProviderAdminResource {

    private static final Logger LOG = Logger.getLogger(ProviderAdminResource.class);

    @Inject
    ProviderService providerService;

    @Inject
    PresignedUrlService presignedUrlService;

    @Inject
    CurrentAuthContext currentAuthContext;

    // ==================== Release ingestion ====================

    @POST
    @Path("/binaries/{os}/{arch}")
    @Consumes(MediaType.WILDCARD)
    @Operation(summary = "Upload a platform zip", description = "Requires UPLOAD on the namespace")
    @APIResponses({
        @APIResponse(responseCode = "200", description = "Binary stored"),
        @APIResponse(responseCode = "400", description = "Provider hosting disabled or invalid platform"),
        @APIResponse(responseCode = "403", description = "Insufficient namespace permission")
    })
    public BinaryResponse uploadBinary(
            @PathParam("namespace") String namespace,
            @PathParam("name") String name,
            @PathParam("version") String version,
            @PathParam("os") String os,
            @PathParam("arch") String arch,
            InputStream body) {
        currentAuthContext.get().requireUpload(namespace);
        ProviderVersionBinary binary = providerService.uploadBinary(namespace, name, version, os, arch, requireBody(body));
        return new BinaryResponse(binary.filename, binary.os, binary.arch, binary.sha256, binary.size);
    }

    @POST
    @Path("/shasums")
    @Consumes(MediaType.WILDCARD)
    @Operation(summary = "Upload the SHA256SUMS file", description = "Requires UPLOAD on the namespace")
    public Response uploadShasums(
            @PathParam("namespace") String namespace,
            @PathParam("name") String name,
            @PathParam("version") String version,
            InputStream body) {
        currentAuthContext.get().requireUpload(namespace);
        providerService.uploadShasums(namespace, name, version, requireBody(body));
        return Response.noContent().build();
    }

    @POST
    @Path("/shasums-signature")
    @Consumes(MediaType.WILDCARD)
    @Operation(summary = "Upload the detached SHA256SUMS signature",
        description = "key_id selects which namespace key is advertised; requires UPLOAD on the namespace")
    public Response uploadShasumsSignature(
            @PathParam("namespace") String namespace,
            @PathParam("name") String name,
            @PathParam("version") String version,
            @QueryParam("key_id") String keyId,
            InputStream body) {
        currentAuthContext.get().requireUpload(namespace);
        providerService.uploadShasumsSignature(namespace, name, version, keyId, requireBody(body));
        return Response.noContent().build();
    }

    // ==================== Artifacts ====================

    @GET
    @Path("/{filename}")
    @Produces(MediaType.APPLICATION_OCTET_STREAM)
    @Operation(summary = "Download a release artifact through a presigned URL")
    @APIResponses({
        @APIResponse(responseCode = "200", description = "Artifact bytes"),
        @APIResponse(responseCode = "403", description = "Missing, expired or tampered signature")
    })
    public Response artifact(
            @PathParam("namespace") String namespace,
            @PathParam("name") String name,
            @PathParam("version") String version,
            @PathParam("filename") String filename,
            @QueryParam("ts") String ts,
            @QueryParam("exp") String exp,
            @QueryParam("sig") String sig,
            @Context UriInfo uriInfo) {
        String path = uriInfo.getPath();
        if (!presignedUrlService.verify(path, ts, exp, sig)) {
            LOG.debugf("Rejected unsigned artifact request for %s", path);
            throw RegistryException.forbidden("Invalid or expired download URL");
        }
        return Response.ok(providerService.openArtifact(namespace, name, version, filename), MediaType.APPLICATION_OCTET_STREAM)
            .header("Content-Disposition", "attachment; filename=\"" + filename + "\"")
            .build();
    }

    private static InputStream requireBody(InputStream body) {
        if (body == null) {
            throw RegistryException.invalidInput("Request body is required");
        }
        return body;
    }

    public record BinaryResponse(String filename, String os, String arch,
                                 @JsonProperty("shasum") String sha256, long size) {}
}
