package tech.terrareg.platform.authentication.terraform;

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
import tech.terrareg.platform.authentication.AuthContext;
import tech.terrareg.platform.authentication.CurrentAuthContext;
import tech.terrareg.platform.authentication.sso.OidcLoginService;
import tech.terrareg.platform.authentication.sso.SamlLoginService;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;

/**
 * OAuth endpoints used by {@code terraform login}.
 *
 * Browsers without an SSO or admin session are sent to the configured login
 * flow and brought back to the authorization request afterwards.
 */
@Path("/terraform/oauth")
@Tag(name = "Terraform Login", description = "Authorization code flow for the Terraform CLI")
@Produces(MediaType.APPLICATION_JSON)
public class TerraformLoginResource {

    private static final Logger LOG = Logger.getLogger(TerraformLoginResource.class);

    @Inject
    TerraformIdpService terraformIdpService;

    @Inject
    CurrentAuthContext currentAuthContext;

    @Inject
    OidcLoginService oidcLoginService;

    @Inject
    SamlLoginService samlLoginService;

    @Context
    UriInfo uriInfo;

    @GET
    @Path("/authorization")
    @Operation(summary = "Authorize the Terraform CLI",
        description = "Issues a single-use code and redirects to the CLI's loopback listener")
    @APIResponses({
        @APIResponse(responseCode = "303", description = "Redirect to the CLI or to the login flow"),
        @APIResponse(responseCode = "400", description = "Invalid client, redirect URI or PKCE parameters"),
        @APIResponse(responseCode = "401", description = "No browser login is available")
    })
    public Response authorize(
            @QueryParam("client_id") String clientId,
            @QueryParam("redirect_uri") String redirectUri,
            @QueryParam("response_type") String responseType,
            @QueryParam("state") String state,
            @QueryParam("code_challenge") String codeChallenge,
            @QueryParam("code_challenge_method") String codeChallengeMethod) {

        AuthContext context = currentAuthContext.get();
        if (!context.isAuthenticated() || !TerraformIdpService.LOGIN_METHODS.contains(context.providerType())) {
            String loginPath = loginPath();
            if (loginPath != null) {
                String returnTo = uriInfo.getRequestUri().getRawPath() + "?" + uriInfo.getRequestUri().getRawQuery();
                LOG.debugf("Terraform login requires a browser session, redirecting to %s", loginPath);
                return Response.seeOther(URI.create(loginPath + "?redirect="
                    + URLEncoder.encode(returnTo, StandardCharsets.UTF_8))).build();
            }
        }

        String location = terraformIdpService.authorize(context, clientId, redirectUri, responseType,
            state, codeChallenge, codeChallengeMethod);
        return Response.seeOther(URI.create(location)).build();
    }

    @POST
    @Path("/token")
    @Consumes(MediaType.APPLICATION_FORM_URLENCODED)
    @Operation(summary = "Exchange an authorization code for an access token")
    @APIResponses({
        @APIResponse(responseCode = "200", description = "Access token issued",
            content = @Content(schema = @Schema(implementation = TokenResponseDto.class))),
        @APIResponse(responseCode = "400", description = "Invalid, expired or already used code")
    })
    public TokenResponseDto token(
            @FormParam("grant_type") String grantType,
            @FormParam("code") String code,
            @FormParam("client_id") String clientId,
            @FormParam("redirect_uri") String redirectUri,
            @FormParam("code_verifier") String codeVerifier) {
        TerraformIdpService.TokenResponse response =
            terraformIdpService.exchange(grantType, code, clientId, redirectUri, codeVerifier);
        return new TokenResponseDto(response.accessToken(), response.tokenType(), response.expiresIn());
    }

    private String loginPath() {
        if (oidcLoginService.isEnabled()) {
            return "/openid/login";
        }
        if (samlLoginService.isEnabled()) {
            return "/saml/login";
        }
        return null;
    }

    public record TokenResponseDto(
        @JsonProperty("access_token") String accessToken,
        @JsonProperty("token_type") String tokenType,
        @JsonProperty("expires_in") long expiresIn
    ) {}
}
