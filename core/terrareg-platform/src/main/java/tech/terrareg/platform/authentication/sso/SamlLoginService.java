package tech.terrareg.platform.authentication.sso;

import io.quarkus.cache.CacheResult;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.terrareg.platform.authentication.AuthMethodType;
import tech.terrareg.platform.authentication.ProviderClaims;
import tech.terrareg.platform.authentication.session.OAuthState;
import tech.terrareg.platform.authentication.session.OAuthStateService;
import tech.terrareg.platform.config.InfraConfig;
import tech.terrareg.platform.error.ErrorKind;
import tech.terrareg.platform.error.RegistryException;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.Signature;
import java.time.Clock;
import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.zip.Deflater;
import java.util.zip.DeflaterOutputStream;

/**
 * SAML 2.0 service provider: HTTP-Redirect AuthnRequests and HTTP-POST responses.
 */
@ApplicationScoped
public class SamlLoginService {

    private static final Logger LOG = Logger.getLogger(SamlLoginService.class);

    static final String ACS_PATH = "/saml/acs";
    static final String SIG_ALG_RSA_SHA256 = "http://www.w3.org/2001/04/xmldsig-more#rsa-sha256";
    private static final String CACHE_NAME = "saml-idp-metadata";

    @Inject
    InfraConfig infraConfig;

    @Inject
    OAuthStateService oauthStateService;

    @Inject
    Clock clock;

    private final HttpClient httpClient = HttpClient.newBuilder()
        .connectTimeout(Duration.ofSeconds(10))
        .followRedirects(HttpClient.Redirect.NORMAL)
        .build();

    public boolean isEnabled() {
        return infraConfig.saml().isPresent();
    }

    @CacheResult(cacheName = CACHE_NAME)
    public SamlIdpMetadata metadata(String metadataUrl) {
        HttpRequest request = HttpRequest.newBuilder()
            .uri(URI.create(metadataUrl))
            .timeout(infraConfig.standardRequestTimeout())
            .GET()
            .build();
        try {
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() / 100 != 2) {
                LOG.warnf("SAML metadata request to %s returned HTTP %d", metadataUrl, response.statusCode());
                throw RegistryException.unauthorized("Identity provider metadata unavailable");
            }
            SamlIdpMetadata metadata = SamlIdpMetadata.parse(response.body());
            LOG.infof("Loaded SAML IdP metadata for %s", metadata.entityId());
            return metadata;
        } catch (IOException e) {
            throw new RegistryException(ErrorKind.UNAUTHORIZED, "Identity provider unreachable", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RegistryException(ErrorKind.UNAUTHORIZED, "Identity provider request interrupted", e);
        }
    }

    /**
     * URL of the IdP single sign-on endpoint carrying a signed AuthnRequest.
     */
    public String loginRedirect(String returnTo) {
        InfraConfig.SamlSettings saml = settings();
        SamlIdpMetadata idp = metadata(saml.idpMetadataUrl());
        OAuthStateService.IssuedState issued = oauthStateService.issue(AuthMethodType.SAML, returnTo);

        String query = "SAMLRequest=" + encode(deflateAndEncode(authnRequest(saml, idp, requestId(issued.state()))))
            + "&RelayState=" + encode(issued.parameter())
            + "&SigAlg=" + encode(SIG_ALG_RSA_SHA256);
        String signature = sign(saml, query);
        return idp.ssoUrl() + (idp.ssoUrl().contains("?") ? "&" : "?") + query + "&Signature=" + encode(signature);
    }

    /**
     * Verify a posted SAMLResponse and its RelayState.
     */
    public SsoLoginResult completeLogin(String samlResponse, String relayState) {
        OAuthState state = oauthStateService.consume(relayState, AuthMethodType.SAML);
        if (samlResponse == null || samlResponse.isEmpty()) {
            throw RegistryException.invalidInput("Missing SAMLResponse");
        }
        InfraConfig.SamlSettings saml = settings();
        SamlIdpMetadata idp = metadata(saml.idpMetadataUrl());

        byte[] xml;
        try {
            xml = Base64.getMimeDecoder().decode(samlResponse);
        } catch (IllegalArgumentException e) {
            throw new RegistryException(ErrorKind.INVALID_INPUT, "SAMLResponse is not base64", e);
        }
        SamlResponseValidator.SamlAssertion assertion = new SamlResponseValidator(
            idp.signingCertificate().getPublicKey(), saml.entityId(), infraConfig.absoluteUrl(ACS_PATH), clock)
            .validate(xml, requestId(state));

        Map<String, List<String>> attributes = assertion.attributes();
        List<String> groups = attributes.getOrDefault(saml.groupAttribute(), List.of());
        String username = firstValue(attributes, "username").orElse(assertion.nameId());
        LOG.infof("SAML login for %s with groups %s", username, groups);
        return new SsoLoginResult(
            new ProviderClaims.Saml(assertion.nameId(), username, List.copyOf(groups), attributes),
            state.redirectUrl());
    }

    /**
     * Service provider metadata for registering this registry with the IdP.
     */
    public String serviceProviderMetadata() {
        InfraConfig.SamlSettings saml = settings();
        return "<?xml version=\"1.0\" encoding=\"UTF-8\"?>"
            + "<md:EntityDescriptor xmlns:md=\"" + SamlXml.METADATA_NS + "\" entityID=\"" + SamlXml.escape(saml.entityId()) + "\">"
            + "<md:SPSSODescriptor AuthnRequestsSigned=\"true\" WantAssertionsSigned=\"true\""
            + " protocolSupportEnumeration=\"urn:oasis:names:tc:SAML:2.0:protocol\">"
            + "<md:KeyDescriptor use=\"signing\"><ds:KeyInfo xmlns:ds=\"" + SamlXml.DSIG_NS + "\"><ds:X509Data>"
            + "<ds:X509Certificate>" + PemKeys.body(saml.publicKey()) + "</ds:X509Certificate>"
            + "</ds:X509Data></ds:KeyInfo></md:KeyDescriptor>"
            + "<md:AssertionConsumerService Binding=\"urn:oasis:names:tc:SAML:2.0:bindings:HTTP-POST\""
            + " Location=\"" + SamlXml.escape(infraConfig.absoluteUrl(ACS_PATH)) + "\" index=\"0\"/>"
            + "</md:SPSSODescriptor></md:EntityDescriptor>";
    }

    /**
     * AuthnRequest ID for a login; derived from the state nonce so the callback can check InResponseTo.
     */
    static String requestId(OAuthState state) {
        return "_" + state.nonce();
    }

    String authnRequest(InfraConfig.SamlSettings saml, SamlIdpMetadata idp, String id) {
        String issueInstant = clock.instant().truncatedTo(ChronoUnit.SECONDS).toString();
        return "<samlp:AuthnRequest xmlns:samlp=\"" + SamlXml.PROTOCOL_NS + "\""
            + " xmlns:saml=\"" + SamlXml.ASSERTION_NS + "\""
            + " ID=\"" + id + "\" Version=\"2.0\" IssueInstant=\"" + issueInstant + "\""
            + " Destination=\"" + SamlXml.escape(idp.ssoUrl()) + "\""
            + " ProtocolBinding=\"urn:oasis:names:tc:SAML:2.0:bindings:HTTP-POST\""
            + " AssertionConsumerServiceURL=\"" + SamlXml.escape(infraConfig.absoluteUrl(ACS_PATH)) + "\">"
            + "<saml:Issuer>" + SamlXml.escape(saml.entityId()) + "</saml:Issuer>"
            + "<samlp:NameIDPolicy Format=\"urn:oasis:names:tc:SAML:1.1:nameid-format:unspecified\" AllowCreate=\"true\"/>"
            + "</samlp:AuthnRequest>";
    }

    static String deflateAndEncode(String xml) {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        Deflater deflater = new Deflater(Deflater.DEFLATED, true);
        try (DeflaterOutputStream out = new DeflaterOutputStream(buffer, deflater)) {
            out.write(xml.getBytes(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new IllegalStateException("In-memory deflate failed", e);
        } finally {
            deflater.end();
        }
        return Base64.getEncoder().encodeToString(buffer.toByteArray());
    }

    private String sign(InfraConfig.SamlSettings saml, String query) {
        try {
            Signature signer = Signature.getInstance("SHA256withRSA");
            signer.initSign(PemKeys.privateKey(saml.privateKey()));
            signer.update(query.getBytes(StandardCharsets.UTF_8));
            return Base64.getEncoder().encodeToString(signer.sign());
        } catch (GeneralSecurityException e) {
            throw new RegistryException(ErrorKind.INTERNAL, "Unable to sign SAML AuthnRequest", e);
        }
    }

    private InfraConfig.SamlSettings settings() {
        return infraConfig.saml()
            .orElseThrow(() -> RegistryException.notFound("SAML is not configured"));
    }

    private static Optional<String> firstValue(Map<String, List<String>> attributes, String name) {
        List<String> values = attributes.get(name);
        return values == null || values.isEmpty() ? Optional.empty() : Optional.of(values.get(0));
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
