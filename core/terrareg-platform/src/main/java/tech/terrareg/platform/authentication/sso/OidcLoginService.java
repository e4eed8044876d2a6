package tech.terrareg.platform.authentication.sso;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.quarkus.cache.CacheResult;
import io.smallrye.jwt.auth.principal.DefaultJWTParser;
import io.smallrye.jwt.auth.principal.JWTAuthContextInfo;
import io.smallrye.jwt.auth.principal.ParseException;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.json.JsonString;
import org.eclipse.microprofile.jwt.JsonWebToken;
import org.jboss.logging.Logger;
import tech.terrareg.platform.authentication.AuthMethodType;
import tech.terrareg.platform.authentication.ProviderClaims;
import tech.terrareg.platform.authentication.session.OAuthState;
import tech.terrareg.platform.authentication.session.OAuthStateService;
import tech.terrareg.platform.config.InfraConfig;
import tech.terrareg.platform.error.ErrorKind;
import tech.terrareg.platform.error.RegistryException;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * OpenID Connect relying party: authorization code flow against the configured issuer.
 *
 * The ID token signature is verified against the issuer's JWKS and its issuer,
 * audience, expiry and nonce are checked before any claims are trusted.
 */
@ApplicationScoped
public class OidcLoginService {

    private static final Logger LOG = Logger.getLogger(OidcLoginService.class);

    static final String CALLBACK_PATH = "/openid/callback";
    private static final String CACHE_NAME = "oidc-discovery";

    @Inject
    InfraConfig infraConfig;

    @Inject
    OAuthStateService oauthStateService;

    @Inject
    ObjectMapper objectMapper;

    private final HttpClient httpClient;

    public OidcLoginService() {
        this.httpClient = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(10))
            .followRedirects(HttpClient.Redirect.NORMAL)
            .build();
    }

    public boolean isEnabled() {
        return infraConfig.oidc().isPresent();
    }

    /**
     * Fetch and cache the issuer's discovery document.
     */
    @CacheResult(cacheName = CACHE_NAME)
    public OidcDiscovery discovery(String issuer) {
        String url = stripTrailingSlash(issuer) + "/.well-known/openid-configuration";
        JsonNode document = getJson(url);
        OidcDiscovery discovery = new OidcDiscovery(
            text(document, "issuer"),
            text(document, "authorization_endpoint"),
            text(document, "token_endpoint"),
            text(document, "jwks_uri"));
        LOG.infof("Loaded OpenID Connect discovery document for %s", discovery.issuer());
        return discovery;
    }

    /**
     * URL of the issuer's authorization endpoint for a new login.
     */
    public String loginRedirect(String returnTo) {
        InfraConfig.OidcSettings oidc = settings();
        OidcDiscovery discovery = discovery(oidc.issuer());
        OAuthStateService.IssuedState issued = oauthStateService.issue(AuthMethodType.OPENID_CONNECT, returnTo);

        return discovery.authorizationEndpoint()
            + (discovery.authorizationEndpoint().contains("?") ? "&" : "?")
            + "response_type=code"
            + "&client_id=" + encode(oidc.clientId())
            + "&redirect_uri=" + encode(infraConfig.absoluteUrl(CALLBACK_PATH))
            + "&scope=" + encode(String.join(" ", oidc.scopes()))
            + "&state=" + encode(issued.parameter())
            + "&nonce=" + encode(issued.state().nonce());
    }

    /**
     * Complete a login from the callback parameters.
     *
     * @return verified claims and the URL to return the browser to
     */
    public SsoLoginResult completeLogin(String code, String stateParameter, String error) {
        OAuthState state = oauthStateService.consume(stateParameter, AuthMethodType.OPENID_CONNECT);
        if (error != null && !error.isEmpty()) {
            throw RegistryException.unauthorized("Identity provider returned an error: " + error);
        }
        if (code == null || code.isEmpty()) {
            throw RegistryException.invalidInput("Missing authorization code");
        }
        InfraConfig.OidcSettings oidc = settings();
        OidcDiscovery discovery = discovery(oidc.issuer());

        String idToken = exchangeCode(discovery, oidc, code);
        JsonWebToken token = verifyIdToken(discovery, oidc, idToken);
        String nonce = token.getClaim("nonce");
        if (state.nonce() != null && !state.nonce().equals(nonce)) {
            throw RegistryException.unauthorized("ID token nonce does not match the login request");
        }

        String username = firstNonEmpty(token.getClaim("preferred_username"), token.getClaim("email"),
            token.getSubject());
        List<String> groups = stringList(token.getClaim(oidc.groupsClaim()));
        Map<String, Object> rawClaims = new LinkedHashMap<>();
        for (String name : token.getClaimNames()) {
            if (!"raw_token".equals(name)) {
                rawClaims.put(name, String.valueOf((Object) token.getClaim(name)));
            }
        }
        ProviderClaims.Oidc claims = new ProviderClaims.Oidc(
            token.getSubject(),
            username,
            token.getClaim("email"),
            groups,
            Instant.ofEpochSecond(token.getExpirationTime()),
            rawClaims);
        LOG.infof("OpenID Connect login for %s with groups %s", username, groups);
        return new SsoLoginResult(claims, state.redirectUrl());
    }

    private String exchangeCode(OidcDiscovery discovery, InfraConfig.OidcSettings oidc, String code) {
        String form = "grant_type=authorization_code"
            + "&code=" + encode(code)
            + "&redirect_uri=" + encode(infraConfig.absoluteUrl(CALLBACK_PATH))
            + "&client_id=" + encode(oidc.clientId())
            + "&client_secret=" + encode(oidc.clientSecret());
        HttpRequest request = HttpRequest.newBuilder()
            .uri(URI.create(discovery.tokenEndpoint()))
            .timeout(infraConfig.standardRequestTimeout())
            .header("Content-Type", "application/x-www-form-urlencoded")
            .header("Accept", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(form))
            .build();
        JsonNode body = send(request);
        String idToken = text(body, "id_token");
        if (idToken == null) {
            throw RegistryException.unauthorized("Token endpoint returned no id_token");
        }
        return idToken;
    }

    JsonWebToken verifyIdToken(OidcDiscovery discovery, InfraConfig.OidcSettings oidc, String idToken) {
        JWTAuthContextInfo contextInfo = new JWTAuthContextInfo(discovery.jwksUri(),
            discovery.issuer() != null ? discovery.issuer() : oidc.issuer());
        contextInfo.setExpectedAudience(Set.of(oidc.clientId()));
        try {
            return new DefaultJWTParser().parse(idToken, contextInfo);
        } catch (ParseException e) {
            LOG.warnf("Rejected OpenID Connect ID token: %s", e.getMessage());
            throw new RegistryException(ErrorKind.UNAUTHORIZED, "ID token could not be verified", e);
        }
    }

    private JsonNode getJson(String url) {
        HttpRequest request = HttpRequest.newBuilder()
            .uri(URI.create(url))
            .timeout(infraConfig.standardRequestTimeout())
            .header("Accept", "application/json")
            .GET()
            .build();
        return send(request);
    }

    private JsonNode send(HttpRequest request) {
        try {
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() / 100 != 2) {
                LOG.warnf("OpenID Connect request to %s returned HTTP %d", request.uri(), response.statusCode());
                throw RegistryException.unauthorized("Identity provider request failed");
            }
            return objectMapper.readTree(response.body());
        } catch (IOException e) {
            throw new RegistryException(ErrorKind.UNAUTHORIZED, "Identity provider unreachable", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RegistryException(ErrorKind.UNAUTHORIZED, "Identity provider request interrupted", e);
        }
    }

    private InfraConfig.OidcSettings settings() {
        return infraConfig.oidc()
            .orElseThrow(() -> RegistryException.notFound("OpenID Connect is not configured"));
    }

    static List<String> stringList(Object claim) {
        if (claim == null) {
            return List.of();
        }
        if (claim instanceof Collection<?> values) {
            List<String> result = new ArrayList<>();
            for (Object value : values) {
                result.add(value instanceof JsonString s ? s.getString() : String.valueOf(value));
            }
            return result;
        }
        if (claim instanceof JsonString s) {
            return List.of(s.getString());
        }
        return List.of(String.valueOf(claim)).stream()
            .flatMap(v -> List.of(v.split(",")).stream())
            .map(String::trim)
            .filter(v -> !v.isEmpty())
            .collect(Collectors.toList());
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    private static String firstNonEmpty(String... values) {
        for (String value : values) {
            if (value != null && !value.isEmpty()) {
                return value;
            }
        }
        return null;
    }

    private static String stripTrailingSlash(String value) {
        return value.endsWith("/") ? value.substring(0, value.length() - 1) : value;
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
