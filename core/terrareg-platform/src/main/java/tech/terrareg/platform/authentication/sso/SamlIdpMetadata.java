package tech.terrareg.platform.authentication.sso;

import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.xml.sax.SAXException;
import tech.terrareg.platform.config.ConfigurationException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.cert.X509Certificate;
import java.util.List;

/**
 * The parts of an IdP metadata document used for login: entity id, the
 * HTTP-Redirect single sign-on endpoint and the signing certificate.
 */
public record SamlIdpMetadata(String entityId, String ssoUrl, X509Certificate signingCertificate) {

    static final String REDIRECT_BINDING = "urn:oasis:names:tc:SAML:2.0:bindings:HTTP-Redirect";

    /**
     * Parse an {@code EntityDescriptor} (or the first one inside an {@code EntitiesDescriptor}).
     *
     * @throws ConfigurationException if the document lacks a redirect endpoint or signing key
     */
    public static SamlIdpMetadata parse(String xml) {
        Document document;
        try {
            document = SamlXml.parse(xml.getBytes(StandardCharsets.UTF_8));
        } catch (IOException | SAXException e) {
            throw new ConfigurationException("SAML IdP metadata is not valid XML", e);
        }
        List<Element> descriptors = SamlXml.descendants(document.getDocumentElement(), SamlXml.METADATA_NS, "EntityDescriptor");
        if (descriptors.isEmpty()) {
            throw new ConfigurationException("SAML IdP metadata has no EntityDescriptor");
        }
        Element entity = descriptors.get(0);
        Element idp = SamlXml.child(entity, SamlXml.METADATA_NS, "IDPSSODescriptor");
        if (idp == null) {
            throw new ConfigurationException("SAML IdP metadata has no IDPSSODescriptor");
        }

        String ssoUrl = null;
        for (Element service : SamlXml.children(idp, SamlXml.METADATA_NS, "SingleSignOnService")) {
            if (REDIRECT_BINDING.equals(service.getAttribute("Binding"))) {
                ssoUrl = service.getAttribute("Location");
                break;
            }
        }
        if (ssoUrl == null || ssoUrl.isEmpty()) {
            throw new ConfigurationException("SAML IdP metadata has no HTTP-Redirect SingleSignOnService");
        }

        X509Certificate certificate = null;
        for (Element keyDescriptor : SamlXml.children(idp, SamlXml.METADATA_NS, "KeyDescriptor")) {
            String use = keyDescriptor.getAttribute("use");
            if (!use.isEmpty() && !"signing".equals(use)) {
                continue;
            }
            List<Element> certificates = SamlXml.descendants(keyDescriptor, SamlXml.DSIG_NS, "X509Certificate");
            if (!certificates.isEmpty()) {
                certificate = PemKeys.certificate(certificates.get(0).getTextContent());
                break;
            }
        }
        if (certificate == null) {
            throw new ConfigurationException("SAML IdP metadata has no signing certificate");
        }
        return new SamlIdpMetadata(entity.getAttribute("entityID"), ssoUrl, certificate);
    }
}
