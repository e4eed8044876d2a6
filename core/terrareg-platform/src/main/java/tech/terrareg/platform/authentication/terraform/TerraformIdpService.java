package tech.terrareg.platform.authentication.terraform;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.terrareg.platform.authentication.AuthContext;
import tech.terrareg.platform.authentication.AuthMethodType;
import tech.terrareg.platform.authentication.ClaimsCodec;
import tech.terrareg.platform.authentication.ProviderClaims;
import tech.terrareg.platform.config.InfraConfig;
import tech.terrareg.platform.error.RegistryException;
import tech.terrareg.platform.shared.Hashing;

import java.net.URI;
import java.net.URISyntaxException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Base64;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Authorization server behind {@code terraform login}.
 *
 * Implements the authorization code grant with PKCE (S256) for the
 * {@code terraform-cli} client and loopback redirect URIs. Codes and access
 * tokens are opaque random values; only their SHA-256 is stored.
 */
@ApplicationScoped
public class TerraformIdpService {

    private static final Logger LOG = Logger.getLogger(TerraformIdpService.class);

    public static final String CLIENT_ID = "terraform-cli";
    public static final int FIRST_PORT = 10000;
    public static final int LAST_PORT = 10010;
    public static final List<Integer> PORTS = List.of(FIRST_PORT, LAST_PORT);

    static final Duration CODE_TTL = Duration.ofMinutes(10);

    static final Set<AuthMethodType> LOGIN_METHODS =
        Set.of(AuthMethodType.SAML, AuthMethodType.OPENID_CONNECT, AuthMethodType.ADMIN_SESSION);

    @Inject
    TerraformIdpRepository repository;

    @Inject
    ClaimsCodec claimsCodec;

    @Inject
    InfraConfig infraConfig;

    @Inject
    Clock clock;

    /**
     * Identity behind a valid access token.
     */
    public record ValidatedToken(String subjectId, String username, ProviderClaims upstream) {}

    /**
     * Response body of the token endpoint.
     */
    public record TokenResponse(String accessToken, String tokenType, long expiresIn) {}

    /**
     * Issue a single-use authorization code for the logged-in browser user and
     * return the loopback URL to redirect to.
     */
    public String authorize(AuthContext context, String clientId, String redirectUri, String responseType,
                            String state, String codeChallenge, String codeChallengeMethod) {
        if (!context.isAuthenticated() || !LOGIN_METHODS.contains(context.providerType())) {
            throw RegistryException.unauthorized("Log in to the registry before running terraform login");
        }
        if (!CLIENT_ID.equals(clientId)) {
            throw RegistryException.invalidInput("Unknown client_id");
        }
        if (!"code".equals(responseType)) {
            throw RegistryException.invalidInput("Unsupported response_type");
        }
        if (!isLoopbackRedirect(redirectUri)) {
            throw RegistryException.invalidInput("redirect_uri must be a localhost URL on ports "
                + FIRST_PORT + "-" + LAST_PORT);
        }
        if (!"S256".equals(codeChallengeMethod) || codeChallenge == null || codeChallenge.isBlank()) {
            throw RegistryException.invalidInput("PKCE with code_challenge_method S256 is required");
        }

        String code = Hashing.randomToken(32);
        TerraformAuthorizationCode record = new TerraformAuthorizationCode();
        record.codeHash = Hashing.sha256Hex(code);
        record.clientId = clientId;
        record.redirectUri = redirectUri;
        record.codeChallenge = codeChallenge;
        record.username = context.username();
        record.providerSourceAuth = claimsCodec.encode(context.claims());
        record.expiry = now().plus(CODE_TTL);
        repository.persistCode(record);
        LOG.infof("Issued terraform login code for %s", context.username());

        StringBuilder location = new StringBuilder(redirectUri)
            .append(redirectUri.contains("?") ? '&' : '?')
            .append("code=").append(encode(code));
        if (state != null) {
            location.append("&state=").append(encode(state));
        }
        return location.toString();
    }

    /**
     * Redeem an authorization code for an access token.
     */
    public TokenResponse exchange(String grantType, String code, String clientId, String redirectUri,
                                  String codeVerifier) {
        if (!"authorization_code".equals(grantType)) {
            throw RegistryException.invalidInput("Unsupported grant_type");
        }
        if (code == null || codeVerifier == null) {
            throw RegistryException.invalidInput("code and code_verifier are required");
        }
        TerraformAuthorizationCode record = repository.consumeCode(Hashing.sha256Hex(code))
            .orElseThrow(() -> RegistryException.invalidInput("Invalid authorization code"));
        Instant now = now();
        if (!now.isBefore(record.expiry)) {
            throw RegistryException.invalidInput("Authorization code has expired");
        }
        if (!record.clientId.equals(clientId) || !record.redirectUri.equals(redirectUri)) {
            throw RegistryException.invalidInput("Authorization code was issued to another client");
        }
        if (!Hashing.constantTimeEquals(record.codeChallenge, s256(codeVerifier))) {
            throw RegistryException.invalidInput("code_verifier does not match code_challenge");
        }

        String accessToken = Hashing.randomToken(48);
        Duration ttl = infraConfig.terraformOidcSessionExpiry();
        TerraformAccessToken token = new TerraformAccessToken();
        token.tokenHash = Hashing.sha256Hex(accessToken);
        token.subjectId = subjectId(record.username);
        token.username = record.username;
        token.providerSourceAuth = record.providerSourceAuth;
        token.createdAt = now;
        token.expiry = now.plus(ttl);
        repository.persistToken(token);
        LOG.infof("Issued terraform access token for %s, expires %s", record.username, token.expiry);
        return new TokenResponse(accessToken, "bearer", ttl.toSeconds());
    }

    public Optional<ValidatedToken> validateAccessToken(String accessToken) {
        if (accessToken == null || accessToken.isEmpty()) {
            return Optional.empty();
        }
        return repository.findToken(Hashing.sha256Hex(accessToken))
            .filter(token -> now().isBefore(token.expiry))
            .map(token -> new ValidatedToken(token.subjectId, token.username,
                claimsCodec.decode(token.providerSourceAuth).orElse(new ProviderClaims.None())));
    }

    /**
     * @return number of codes and tokens removed
     */
    public long deleteExpired() {
        Instant now = now();
        return repository.deleteExpiredCodes(now) + repository.deleteExpiredTokens(now);
    }

    /**
     * Stable, salted subject identifier for a username.
     */
    public String subjectId(String username) {
        return Hashing.sha256Hex(infraConfig.terraformOidcSubjectSalt() + ":" + username);
    }

    static String s256(String verifier) {
        byte[] digest = Hashing.sha256(verifier.getBytes(StandardCharsets.US_ASCII));
        return Base64.getUrlEncoder().withoutPadding().encodeToString(digest);
    }

    static boolean isLoopbackRedirect(String redirectUri) {
        if (redirectUri == null) {
            return false;
        }
        try {
            URI uri = new URI(redirectUri);
            String host = uri.getHost();
            return "http".equals(uri.getScheme())
                && ("localhost".equals(host) || "127.0.0.1".equals(host))
                && uri.getPort() >= FIRST_PORT && uri.getPort() <= LAST_PORT
                && uri.getUserInfo() == null;
        } catch (URISyntaxException e) {
            LOG.debugf("Rejected malformed redirect_uri: %s", e.getMessage());
            return false;
        }
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.SECONDS);
    }
}
