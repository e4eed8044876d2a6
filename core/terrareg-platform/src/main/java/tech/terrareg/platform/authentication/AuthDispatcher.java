package tech.terrareg.platform.authentication;

import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.terrareg.platform.authentication.method.AdminApiKeyAuthMethod;
import tech.terrareg.platform.authentication.method.AdminSessionAuthMethod;
import tech.terrareg.platform.authentication.method.OpenidConnectAuthMethod;
import tech.terrareg.platform.authentication.method.PublishApiKeyAuthMethod;
import tech.terrareg.platform.authentication.method.SamlAuthMethod;
import tech.terrareg.platform.authentication.method.TerraformAnalyticsKeyAuthMethod;
import tech.terrareg.platform.authentication.method.TerraformInternalExtractionAuthMethod;
import tech.terrareg.platform.authentication.method.TerraformOidcAuthMethod;
import tech.terrareg.platform.authentication.method.UploadApiKeyAuthMethod;

import java.util.List;
import java.util.Optional;

/**
 * Ordered chain of credential recognizers.
 *
 * The first enabled method that recognizes the request wins; when none does the
 * request is {@link AuthContext#notAuthenticated()}. The chain is fixed at startup
 * and read-only afterwards, so one dispatcher serves all requests in parallel.
 */
@ApplicationScoped
public class AuthDispatcher {

    private static final Logger LOG = Logger.getLogger(AuthDispatcher.class);

    @Inject
    AdminApiKeyAuthMethod adminApiKey;

    @Inject
    AdminSessionAuthMethod adminSession;

    @Inject
    UploadApiKeyAuthMethod uploadApiKey;

    @Inject
    PublishApiKeyAuthMethod publishApiKey;

    @Inject
    SamlAuthMethod saml;

    @Inject
    OpenidConnectAuthMethod openidConnect;

    @Inject
    TerraformOidcAuthMethod terraformOidc;

    @Inject
    TerraformAnalyticsKeyAuthMethod terraformAnalyticsKey;

    @Inject
    TerraformInternalExtractionAuthMethod terraformInternalExtraction;

    @Inject
    SessionResolver sessionResolver;

    private List<AuthMethod> chain;

    public AuthDispatcher() {
    }

    AuthDispatcher(List<AuthMethod> chain, SessionResolver sessionResolver) {
        this.chain = List.copyOf(chain);
        this.sessionResolver = sessionResolver;
    }

    @PostConstruct
    void init() {
        chain = List.of(
            adminApiKey,
            adminSession,
            uploadApiKey,
            publishApiKey,
            saml,
            openidConnect,
            terraformOidc,
            terraformAnalyticsKey,
            terraformInternalExtraction);
        LOG.infof("Authentication chain: %s", chain.stream()
            .map(m -> m.type() + (m.isEnabled() ? "" : " (disabled)"))
            .toList());
    }

    public List<AuthMethod> chain() {
        return chain;
    }

    public AuthContext authenticate(AuthRequest request) {
        Optional<String> apiKey = request.apiKey();
        Optional<String> bearer = request.bearerToken();
        Optional<ActiveSession> session = Optional.empty();
        boolean sessionResolved = false;

        for (AuthMethod method : chain) {
            if (!method.isEnabled()) {
                continue;
            }
            Optional<AuthContext> result = Optional.empty();
            if (method instanceof TokenAuth tokenAuth) {
                if (apiKey.isPresent()) {
                    result = tokenAuth.authenticate(apiKey.get());
                }
            } else if (method instanceof SessionAuth sessionAuth) {
                if (!sessionResolved) {
                    session = sessionResolver.resolve(request);
                    sessionResolved = true;
                }
                if (session.isPresent()) {
                    result = sessionAuth.authenticate(session.get());
                }
            } else if (method instanceof BearerAuth bearerAuth) {
                if (bearer.isPresent()) {
                    result = bearerAuth.authenticate(bearer.get());
                }
            }
            if (result.isPresent()) {
                LOG.debugf("Request to %s authenticated by %s", request.path(), method.type());
                return result.get();
            }
        }
        return AuthContext.notAuthenticated();
    }
}
