package tech.terrareg.platform.authentication;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.inject.Inject;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.*;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.media.Content;
import org.eclipse.microprofile.openapi.annotations.media.Schema;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponses;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.jboss.logging.Logger;
import tech.terrareg.platform.authentication.session.Session;
import tech.terrareg.platform.authentication.session.SessionCookieService;
import tech.terrareg.platform.authentication.session.SessionData;
import tech.terrareg.platform.authentication.session.SessionService;
import tech.terrareg.platform.authentication.sso.OidcLoginService;
import tech.terrareg.platform.authentication.sso.SamlLoginService;
import tech.terrareg.platform.authentication.sso.SsoLoginResult;
import tech.terrareg.platform.config.InfraConfig;
import tech.terrareg.platform.error.InvalidSessionCookieException;
import tech.terrareg.platform.error.RegistryException;

import java.net.URI;
import java.util.Map;
import java.util.TreeMap;

/**
 * Browser login and logout: admin token, OpenID Connect and SAML.
 *
 * Every successful login creates a server-side session and sets the encrypted
 * session cookie; logout deletes the session and clears the cookies.
 */
@Path("/")
@Tag(name = "Authentication", description = "Browser login and session endpoints")
@Produces(MediaType.APPLICATION_JSON)
public class LoginResource {

    private static final Logger LOG = Logger.getLogger(LoginResource.class);

    @Inject
    CurrentAuthContext currentAuthContext;

    @Inject
    SessionService sessionService;

    @Inject
    SessionCookieService sessionCookieService;

    @Inject
    ClaimsCodec claimsCodec;

    @Inject
    OidcLoginService oidcLoginService;

    @Inject
    SamlLoginService samlLoginService;

    @Inject
    InfraConfig infraConfig;

    // ==================== Admin ====================

    /**
     * Exchange the admin API key for an admin session.
     */
    @POST
    @Path("/v1/terrareg/auth/admin/login")
    @Operation(summary = "Log in with the admin authentication token",
        description = "Requires X-Terrareg-ApiKey equal to ADMIN_AUTHENTICATION_TOKEN")
    @APIResponses({
        @APIResponse(responseCode = "200", description = "Admin session created",
            content = @Content(schema = @Schema(implementation = AdminLoginResponse.class))),
        @APIResponse(responseCode = "401", description = "Admin token missing or wrong")
    })
    public Response adminLogin() {
        AuthContext context = currentAuthContext.get();
        if (context.providerType() != AuthMethodType.ADMIN_API_KEY) {
            throw RegistryException.unauthorized("Invalid admin authentication token");
        }
        ProviderClaims claims = new ProviderClaims.AdminSession(context.username());
        Session session = sessionService.create(infraConfig.adminSessionExpiry(), claimsCodec.encode(claims));
        LOG.infof("Admin session created, expires %s", session.expiry);
        return Response.ok(new AdminLoginResponse(true))
            .cookie(sessionCookieService.issue(session, true), sessionCookieService.adminFlag())
            .build();
    }

    @GET
    @Path("/v1/terrareg/auth/admin/is_authenticated")
    @Operation(summary = "Describe the caller's authentication state")
    @APIResponse(responseCode = "200", description = "Authentication state",
        content = @Content(schema = @Schema(implementation = AuthStatusResponse.class)))
    public AuthStatusResponse isAuthenticated() {
        AuthContext context = currentAuthContext.get();
        Map<String, String> permissions = new TreeMap<>();
        context.namespacePermissions().forEach((ns, perm) -> permissions.put(ns, perm.name()));
        return new AuthStatusResponse(
            context.isAuthenticated(),
            context.providerType().name(),
            context.username(),
            context.siteAdmin(),
            permissions);
    }

    @GET
    @Path("/logout")
    @Operation(summary = "End the browser session")
    @APIResponse(responseCode = "303", description = "Session removed, redirect to home")
    public Response logout(@Context HttpHeaders headers) {
        Cookie cookie = headers.getCookies().get(sessionCookieService.cookieName());
        if (cookie != null && !cookie.getValue().isEmpty()) {
            try {
                SessionData data = sessionCookieService.read(cookie.getValue());
                sessionService.delete(data.sessionId());
                LOG.debugf("Deleted session on logout");
            } catch (InvalidSessionCookieException e) {
                LOG.debugf("Logout with unreadable session cookie: %s", e.getMessage());
            }
        }
        return Response.seeOther(URI.create("/"))
            .cookie(sessionCookieService.clearSession(), sessionCookieService.clearAdminFlag())
            .build();
    }

    // ==================== OpenID Connect ====================

    @GET
    @Path("/openid/login")
    @Operation(summary = "Start an OpenID Connect login")
    @APIResponses({
        @APIResponse(responseCode = "303", description = "Redirect to the identity provider"),
        @APIResponse(responseCode = "404", description = "OpenID Connect is not configured")
    })
    public Response openidLogin(@QueryParam("redirect") String redirect) {
        return Response.seeOther(URI.create(oidcLoginService.loginRedirect(safeReturnPath(redirect)))).build();
    }

    @GET
    @Path("/openid/callback")
    @Operation(summary = "OpenID Connect redirect endpoint")
    @APIResponses({
        @APIResponse(responseCode = "303", description = "Logged in, redirect to the original page"),
        @APIResponse(responseCode = "400", description = "Invalid or replayed state"),
        @APIResponse(responseCode = "401", description = "Identity provider rejected the login")
    })
    public Response openidCallback(
            @QueryParam("code") String code,
            @QueryParam("state") String state,
            @QueryParam("error") String error) {
        return startSession(oidcLoginService.completeLogin(code, state, error));
    }

    // ==================== SAML ====================

    @GET
    @Path("/saml/login")
    @Operation(summary = "Start a SAML login")
    @APIResponses({
        @APIResponse(responseCode = "303", description = "Redirect to the identity provider"),
        @APIResponse(responseCode = "404", description = "SAML is not configured")
    })
    public Response samlLogin(@QueryParam("redirect") String redirect) {
        return Response.seeOther(URI.create(samlLoginService.loginRedirect(safeReturnPath(redirect)))).build();
    }

    @POST
    @Path("/saml/acs")
    @Consumes(MediaType.APPLICATION_FORM_URLENCODED)
    @Operation(summary = "SAML assertion consumer service (HTTP-POST binding)")
    @APIResponses({
        @APIResponse(responseCode = "303", description = "Logged in, redirect to the original page"),
        @APIResponse(responseCode = "400", description = "Invalid RelayState or response"),
        @APIResponse(responseCode = "401", description = "Assertion failed verification")
    })
    public Response samlAcs(
            @FormParam("SAMLResponse") String samlResponse,
            @FormParam("RelayState") String relayState) {
        return startSession(samlLoginService.completeLogin(samlResponse, relayState));
    }

    @GET
    @Path("/saml/metadata")
    @Produces(MediaType.APPLICATION_XML)
    @Operation(summary = "SAML service provider metadata")
    public String samlMetadata() {
        return samlLoginService.serviceProviderMetadata();
    }

    private Response startSession(SsoLoginResult result) {
        Session session = sessionService.create(infraConfig.sessionExpiry(), claimsCodec.encode(result.claims()));
        return Response.seeOther(URI.create(safeReturnPath(result.redirectUrl())))
            .cookie(sessionCookieService.issue(session, false))
            .build();
    }

    /**
     * Only same-origin absolute paths are followed after login.
     */
    static String safeReturnPath(String redirect) {
        if (redirect == null || !redirect.startsWith("/") || redirect.startsWith("//") || redirect.contains("\\")) {
            return "/";
        }
        return redirect;
    }

    // ==================== DTOs ====================

    public record AdminLoginResponse(boolean authenticated) {}

    public record AuthStatusResponse(
        boolean authenticated,
        @JsonProperty("auth_method") String authMethod,
        String username,
        @JsonProperty("site_admin") boolean siteAdmin,
        @JsonProperty("namespace_permissions") Map<String, String> namespacePermissions
    ) {}
}
