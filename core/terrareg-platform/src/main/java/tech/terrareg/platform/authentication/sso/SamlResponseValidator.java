package tech.terrareg.platform.authentication.sso;

import org.jboss.logging.Logger;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.xml.sax.SAXException;
import tech.terrareg.platform.error.ErrorKind;
import tech.terrareg.platform.error.RegistryException;

import javax.xml.crypto.MarshalException;
import javax.xml.crypto.dsig.CanonicalizationMethod;
import javax.xml.crypto.dsig.Reference;
import javax.xml.crypto.dsig.Transform;
import javax.xml.crypto.dsig.XMLSignature;
import javax.xml.crypto.dsig.XMLSignatureException;
import javax.xml.crypto.dsig.XMLSignatureFactory;
import javax.xml.crypto.dsig.dom.DOMValidateContext;
import java.io.IOException;
import java.security.PublicKey;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Verifies a SAML 2.0 {@code Response} received on the assertion consumer endpoint.
 *
 * The Response or its single Assertion must carry a valid enveloped signature by
 * the IdP certificate, and the signed element must be the one whose contents are
 * read. Only the enveloped-signature and exclusive canonicalization transforms
 * are accepted. The Response must answer the AuthnRequest this login sent and be
 * addressed to the assertion consumer URL. Status, audience and validity window
 * are checked before the subject and attributes are returned.
 */
public class SamlResponseValidator {

    private static final Logger LOG = Logger.getLogger(SamlResponseValidator.class);

    static final String SUCCESS = "urn:oasis:names:tc:SAML:2.0:status:Success";
    static final Duration CLOCK_SKEW = Duration.ofSeconds(90);

    static final Set<String> ALLOWED_TRANSFORMS = Set.of(
        Transform.ENVELOPED,
        CanonicalizationMethod.EXCLUSIVE,
        CanonicalizationMethod.EXCLUSIVE_WITH_COMMENTS);

    private final PublicKey idpKey;
    private final String audience;
    private final String acsUrl;
    private final Clock clock;

    /**
     * @param idpKey   public key of the IdP signing certificate
     * @param audience this service provider's entity id
     * @param acsUrl   absolute assertion consumer URL responses must be addressed to
     */
    public SamlResponseValidator(PublicKey idpKey, String audience, String acsUrl, Clock clock) {
        this.idpKey = idpKey;
        this.audience = audience;
        this.acsUrl = acsUrl;
        this.clock = clock;
    }

    /**
     * Subject and attributes of a verified assertion.
     */
    public record SamlAssertion(String nameId, Map<String, List<String>> attributes) {}

    /**
     * @param requestId ID of the AuthnRequest this login sent; the Response must answer it
     * @throws RegistryException INVALID_INPUT for malformed XML, UNAUTHORIZED for anything
     *         that fails verification
     */
    public SamlAssertion validate(byte[] responseXml, String requestId) {
        Document document;
        try {
            document = SamlXml.parse(responseXml);
        } catch (IOException | SAXException e) {
            throw new RegistryException(ErrorKind.INVALID_INPUT, "SAMLResponse is not valid XML", e);
        }
        Element response = document.getDocumentElement();
        if (!SamlXml.PROTOCOL_NS.equals(response.getNamespaceURI()) || !"Response".equals(response.getLocalName())) {
            throw RegistryException.invalidInput("SAMLResponse does not contain a Response element");
        }

        checkStatus(response);
        checkAddressing(response, requestId);

        if (!SamlXml.children(response, SamlXml.ASSERTION_NS, "EncryptedAssertion").isEmpty()) {
            throw RegistryException.unauthorized("Encrypted SAML assertions are not supported");
        }
        List<Element> assertions = SamlXml.children(response, SamlXml.ASSERTION_NS, "Assertion");
        if (assertions.size() != 1) {
            throw RegistryException.unauthorized("SAMLResponse must contain exactly one assertion");
        }
        Element assertion = assertions.get(0);

        markId(response);
        markId(assertion);
        boolean responseSigned = verifySignatureOf(response);
        boolean assertionSigned = verifySignatureOf(assertion);
        if (!responseSigned && !assertionSigned) {
            throw RegistryException.unauthorized("SAMLResponse is not signed by the identity provider");
        }

        checkConditions(assertion);

        Element subject = SamlXml.child(assertion, SamlXml.ASSERTION_NS, "Subject");
        if (subject != null) {
            checkSubjectConfirmations(subject, requestId);
        }
        Element nameIdElement = subject == null ? null : SamlXml.child(subject, SamlXml.ASSERTION_NS, "NameID");
        if (nameIdElement == null || nameIdElement.getTextContent().isBlank()) {
            throw RegistryException.unauthorized("SAML assertion has no NameID");
        }
        return new SamlAssertion(nameIdElement.getTextContent().trim(), attributes(assertion));
    }

    private void checkStatus(Element response) {
        Element status = SamlXml.child(response, SamlXml.PROTOCOL_NS, "Status");
        Element code = status == null ? null : SamlXml.child(status, SamlXml.PROTOCOL_NS, "StatusCode");
        String value = code == null ? null : code.getAttribute("Value");
        if (!SUCCESS.equals(value)) {
            LOG.warnf("SAML login failed with status %s", value);
            throw RegistryException.unauthorized("Identity provider reported an unsuccessful login");
        }
    }

    private void checkAddressing(Element response, String requestId) {
        String inResponseTo = response.getAttribute("InResponseTo");
        if (inResponseTo.isEmpty() || !inResponseTo.equals(requestId)) {
            LOG.warnf("SAMLResponse answers request %s, expected %s", inResponseTo, requestId);
            throw RegistryException.unauthorized("SAMLResponse does not answer this login request");
        }
        String destination = response.getAttribute("Destination");
        if (!destination.isEmpty() && !destination.equals(acsUrl)) {
            LOG.warnf("SAMLResponse addressed to %s, expected %s", destination, acsUrl);
            throw RegistryException.unauthorized("SAMLResponse is addressed to another service");
        }
    }

    // Bearer confirmation data must agree with the Response when the IdP includes it.
    private void checkSubjectConfirmations(Element subject, String requestId) {
        for (Element confirmation : SamlXml.children(subject, SamlXml.ASSERTION_NS, "SubjectConfirmation")) {
            Element data = SamlXml.child(confirmation, SamlXml.ASSERTION_NS, "SubjectConfirmationData");
            if (data == null) {
                continue;
            }
            String inResponseTo = data.getAttribute("InResponseTo");
            String recipient = data.getAttribute("Recipient");
            if (!inResponseTo.isEmpty() && !inResponseTo.equals(requestId)
                || !recipient.isEmpty() && !recipient.equals(acsUrl)) {
                throw RegistryException.unauthorized("SAML subject confirmation does not match this login request");
            }
        }
    }

    /**
     * Verify the enveloped signature that is a direct child of {@code element}.
     *
     * @return false if the element carries no signature
     * @throws RegistryException UNAUTHORIZED if a signature is present but invalid, does not
     *                           reference {@code element} or uses a transform outside
     *                           {@link #ALLOWED_TRANSFORMS}
     */
    boolean verifySignatureOf(Element element) {
        Element signature = SamlXml.child(element, SamlXml.DSIG_NS, "Signature");
        if (signature == null) {
            return false;
        }
        try {
            DOMValidateContext context = new DOMValidateContext(idpKey, signature);
            context.setProperty("org.jcp.xml.dsig.secureValidation", Boolean.TRUE);
            XMLSignature xmlSignature = XMLSignatureFactory.getInstance("DOM").unmarshalXMLSignature(context);

            List<?> references = xmlSignature.getSignedInfo().getReferences();
            String expectedUri = "#" + element.getAttribute("ID");
            if (references.size() != 1 || !expectedUri.equals(((Reference) references.get(0)).getURI())) {
                throw RegistryException.unauthorized("SAML signature does not cover the signed element");
            }
            for (Object transform : ((Reference) references.get(0)).getTransforms()) {
                String algorithm = ((Transform) transform).getAlgorithm();
                if (!ALLOWED_TRANSFORMS.contains(algorithm)) {
                    LOG.warnf("Rejected SAML signature with transform %s", algorithm);
                    throw RegistryException.unauthorized("SAML signature uses an unsupported transform");
                }
            }
            if (!xmlSignature.validate(context)) {
                throw RegistryException.unauthorized("SAML signature is invalid");
            }
            return true;
        } catch (MarshalException | XMLSignatureException e) {
            throw new RegistryException(ErrorKind.UNAUTHORIZED, "SAML signature could not be verified", e);
        }
    }

    private void checkConditions(Element assertion) {
        Instant now = clock.instant();
        Element conditions = SamlXml.child(assertion, SamlXml.ASSERTION_NS, "Conditions");
        if (conditions == null) {
            throw RegistryException.unauthorized("SAML assertion has no Conditions");
        }
        Instant notBefore = instant(conditions.getAttribute("NotBefore"));
        Instant notOnOrAfter = instant(conditions.getAttribute("NotOnOrAfter"));
        if (notBefore != null && now.plus(CLOCK_SKEW).isBefore(notBefore)) {
            throw RegistryException.unauthorized("SAML assertion is not yet valid");
        }
        if (notOnOrAfter != null && !now.minus(CLOCK_SKEW).isBefore(notOnOrAfter)) {
            throw RegistryException.unauthorized("SAML assertion has expired");
        }

        List<Element> restrictions = SamlXml.children(conditions, SamlXml.ASSERTION_NS, "AudienceRestriction");
        if (restrictions.isEmpty()) {
            throw RegistryException.unauthorized("SAML assertion has no audience restriction");
        }
        for (Element restriction : restrictions) {
            boolean matched = SamlXml.children(restriction, SamlXml.ASSERTION_NS, "Audience").stream()
                .anyMatch(a -> audience.equals(a.getTextContent().trim()));
            if (!matched) {
                throw RegistryException.unauthorized("SAML assertion is not addressed to this service");
            }
        }
    }

    private static Map<String, List<String>> attributes(Element assertion) {
        Map<String, List<String>> result = new LinkedHashMap<>();
        for (Element statement : SamlXml.children(assertion, SamlXml.ASSERTION_NS, "AttributeStatement")) {
            for (Element attribute : SamlXml.children(statement, SamlXml.ASSERTION_NS, "Attribute")) {
                List<String> values = new ArrayList<>();
                for (Element value : SamlXml.children(attribute, SamlXml.ASSERTION_NS, "AttributeValue")) {
                    values.add(value.getTextContent().trim());
                }
                result.computeIfAbsent(attribute.getAttribute("Name"), k -> new ArrayList<>()).addAll(values);
            }
        }
        return result;
    }

    private static void markId(Element element) {
        Node id = element.getAttributeNode("ID");
        if (id == null) {
            throw RegistryException.invalidInput("SAML " + element.getLocalName() + " has no ID");
        }
        element.setIdAttribute("ID", true);
    }

    private static Instant instant(String value) {
        if (value == null || value.isEmpty()) {
            return null;
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            throw new RegistryException(ErrorKind.INVALID_INPUT, "Invalid SAML timestamp: " + value, e);
        }
    }
}
