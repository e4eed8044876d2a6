package tech.terrareg.platform.authorization;

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

import java.util.List;
import java.util.Map;

/**
 * User group and namespace permission administration. Site admin only.
 */
@Path("/v1/terrareg/user-groups")
@Tag(name = "User Groups", description = "SSO group to namespace permission mapping")
@Produces(MediaType.APPLICATION_JSON)
public class UserGroupResource {

    @Inject
    UserGroupService userGroupService;

    @Inject
    CurrentAuthContext currentAuthContext;

    // ==================== Groups ====================

    @GET
    @Operation(summary = "List user groups with their namespace permissions")
    public List<UserGroupView> list() {
        currentAuthContext.get().requireSiteAdmin();
        return userGroupService.listGroups().stream()
            .map(view -> new UserGroupView(view.group().name, view.group().siteAdmin, view.namespacePermissions()))
            .toList();
    }

    @POST
    @Consumes(MediaType.APPLICATION_JSON)
    @Operation(summary = "Create a user group")
    @APIResponses({
        @APIResponse(responseCode = "201", description = "Group created"),
        @APIResponse(responseCode = "409", description = "Group already exists")
    })
    public Response create(CreateGroupRequest request) {
        currentAuthContext.get().requireSiteAdmin();
        if (request == null) {
            throw RegistryException.invalidInput("Request body is required");
        }
        UserGroup group = userGroupService.createGroup(request.name(), Boolean.TRUE.equals(request.siteAdmin()));
        return Response.status(Response.Status.CREATED)
            .entity(new UserGroupView(group.name, group.siteAdmin, Map.of()))
            .build();
    }

    @DELETE
    @Path("/{group}")
    @Operation(summary = "Delete a user group and its permissions")
    public Response delete(@PathParam("group") String group) {
        currentAuthContext.get().requireSiteAdmin();
        userGroupService.deleteGroup(group);
        return Response.noContent().build();
    }

    // ==================== Permissions ====================

    @POST
    @Path("/{group}/permissions/{namespace}")
    @Consumes(MediaType.APPLICATION_JSON)
    @Operation(summary = "Grant or replace a group's permission on a namespace")
    public Response grant(@PathParam("group") String group, @PathParam("namespace") String namespace,
                          GrantRequest request) {
        currentAuthContext.get().requireSiteAdmin();
        NamespacePermission permission = NamespacePermission.parse(request == null ? null : request.permissionType())
            .orElseThrow(() -> RegistryException.invalidInput("Invalid permission_type"));
        userGroupService.grant(group, namespace, permission);
        return Response.noContent().build();
    }

    @DELETE
    @Path("/{group}/permissions/{namespace}")
    @Operation(summary = "Remove a group's permission on a namespace")
    public Response revoke(@PathParam("group") String group, @PathParam("namespace") String namespace) {
        currentAuthContext.get().requireSiteAdmin();
        userGroupService.revoke(group, namespace);
        return Response.noContent().build();
    }

    public record CreateGroupRequest(String name, @JsonProperty("site_admin") Boolean siteAdmin) {}

    public record GrantRequest(@JsonProperty("permission_type") String permissionType) {}

    public record UserGroupView(
        String name,
        @JsonProperty("site_admin") boolean siteAdmin,
        @JsonProperty("namespace_permissions") Map<String, NamespacePermission> namespacePermissions
    ) {}
}
