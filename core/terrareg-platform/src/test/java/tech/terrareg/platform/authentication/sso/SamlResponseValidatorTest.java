package tech.terrareg.platform.authentication.sso;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import tech.terrareg.platform.error.ErrorKind;
import tech.terrareg.platform.error.RegistryException;

import javax.xml.crypto.dsig.CanonicalizationMethod;
import javax.xml.crypto.dsig.DigestMethod;
import javax.xml.crypto.dsig.Reference;
import javax.xml.crypto.dsig.SignatureMethod;
import javax.xml.crypto.dsig.SignedInfo;
import javax.xml.crypto.dsig.Transform;
import javax.xml.crypto.dsig.XMLSignatureFactory;
import javax.xml.crypto.dsig.dom.DOMSignContext;
import javax.xml.crypto.dsig.spec.C14NMethodParameterSpec;
import javax.xml.crypto.dsig.spec.TransformParameterSpec;
import javax.xml.transform.TransformerFactory;
import javax.xml.transform.dom.DOMSource;
import javax.xml.transform.stream.StreamResult;
import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

@DisplayName("SamlResponseValidator")
class SamlResponseValidatorTest {

    private static final String ACS_URL = "https://registry.example.com/saml/acs";
    private static final String ENTITY_ID = "https://registry.example.com";
    private static final String REQUEST_ID = "_c2FtbC1yZXF1ZXN0";

    private static KeyPair idpKeys;

    private SamlResponseValidator validator;

    @BeforeAll
    static void generateKeys() throws Exception {
        KeyPairGenerator generator = KeyPairGenerator.getInstance("RSA");
        generator.initialize(2048);
        idpKeys = generator.generateKeyPair();
    }

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2024-05-01T08:00:00Z"), ZoneOffset.UTC);
        validator = new SamlResponseValidator(idpKeys.getPublic(), ENTITY_ID, ACS_URL, clock);
    }

    private static String response(String inResponseTo, String destination, String recipient) {
        return "<samlp:Response xmlns:samlp=\"" + SamlXml.PROTOCOL_NS + "\" xmlns:saml=\"" + SamlXml.ASSERTION_NS + "\""
            + " ID=\"_response\" Version=\"2.0\" IssueInstant=\"2024-05-01T07:59:58Z\""
            + (destination == null ? "" : " Destination=\"" + destination + "\"")
            + (inResponseTo == null ? "" : " InResponseTo=\"" + inResponseTo + "\"") + ">"
            + "<saml:Issuer>https://idp.example.com</saml:Issuer>"
            + "<samlp:Status><samlp:StatusCode Value=\"" + SamlResponseValidator.SUCCESS + "\"/></samlp:Status>"
            + "<saml:Assertion ID=\"_assertion\" Version=\"2.0\" IssueInstant=\"2024-05-01T07:59:58Z\">"
            + "<saml:Issuer>https://idp.example.com</saml:Issuer>"
            + "<saml:Subject><saml:NameID>jane@example.com</saml:NameID>"
            + "<saml:SubjectConfirmation Method=\"urn:oasis:names:tc:SAML:2.0:cm:bearer\">"
            + "<saml:SubjectConfirmationData InResponseTo=\"" + REQUEST_ID + "\" Recipient=\"" + recipient + "\""
            + " NotOnOrAfter=\"2024-05-01T08:05:00Z\"/>"
            + "</saml:SubjectConfirmation></saml:Subject>"
            + "<saml:Conditions NotBefore=\"2024-05-01T07:55:00Z\" NotOnOrAfter=\"2024-05-01T08:05:00Z\">"
            + "<saml:AudienceRestriction><saml:Audience>" + ENTITY_ID + "</saml:Audience></saml:AudienceRestriction>"
            + "</saml:Conditions>"
            + "<saml:AttributeStatement><saml:Attribute Name=\"groups\">"
            + "<saml:AttributeValue>platform-admins</saml:AttributeValue>"
            + "<saml:AttributeValue>developers</saml:AttributeValue>"
            + "</saml:Attribute></saml:AttributeStatement>"
            + "</saml:Assertion></samlp:Response>";
    }

    private static String validResponse() {
        return response(REQUEST_ID, ACS_URL, ACS_URL);
    }

    private static Document signedAssertion(String xml) throws Exception {
        return signedAssertion(xml, CanonicalizationMethod.EXCLUSIVE);
    }

    private static Document signedAssertion(String xml, String canonicalization) throws Exception {
        Document document = SamlXml.parse(xml.getBytes(StandardCharsets.UTF_8));
        Element assertion = SamlXml.child(document.getDocumentElement(), SamlXml.ASSERTION_NS, "Assertion");
        assertion.setIdAttribute("ID", true);

        XMLSignatureFactory factory = XMLSignatureFactory.getInstance("DOM");
        List<Transform> transforms = new ArrayList<>();
        transforms.add(factory.newTransform(Transform.ENVELOPED, (TransformParameterSpec) null));
        transforms.add(factory.newTransform(canonicalization, (TransformParameterSpec) null));
        Reference reference = factory.newReference("#_assertion",
            factory.newDigestMethod(DigestMethod.SHA256, null), transforms, null, null);
        SignedInfo signedInfo = factory.newSignedInfo(
            factory.newCanonicalizationMethod(CanonicalizationMethod.EXCLUSIVE, (C14NMethodParameterSpec) null),
            factory.newSignatureMethod(SignatureMethod.RSA_SHA256, null),
            List.of(reference));
        factory.newXMLSignature(signedInfo, null).sign(new DOMSignContext(idpKeys.getPrivate(), assertion));
        return document;
    }

    private static byte[] bytes(Document document) throws Exception {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        TransformerFactory.newInstance().newTransformer().transform(new DOMSource(document), new StreamResult(out));
        return out.toByteArray();
    }

    private static void assertUnauthorized(org.assertj.core.api.ThrowableAssert.ThrowingCallable call) {
        assertThatThrownBy(call)
            .isInstanceOf(RegistryException.class)
            .extracting(e -> ((RegistryException) e).kind())
            .isEqualTo(ErrorKind.UNAUTHORIZED);
    }

    @Test
    @DisplayName("A signed response answering this request returns the subject and attributes")
    void validate_shouldReturnAssertion_whenSignedAndAddressed() throws Exception {
        // Arrange
        byte[] xml = bytes(signedAssertion(validResponse()));

        // Act
        SamlResponseValidator.SamlAssertion assertion = validator.validate(xml, REQUEST_ID);

        // Assert
        assertThat(assertion.nameId()).isEqualTo("jane@example.com");
        assertThat(assertion.attributes().get("groups")).containsExactly("platform-admins", "developers");
    }

    @Test
    @DisplayName("An unsigned response is rejected")
    void validate_shouldReject_whenUnsigned() {
        assertUnauthorized(() -> validator.validate(validResponse().getBytes(StandardCharsets.UTF_8), REQUEST_ID));
    }

    @Test
    @DisplayName("A response altered after signing is rejected")
    void validate_shouldReject_whenTampered() throws Exception {
        // Arrange
        Document document = signedAssertion(validResponse());
        Element assertion = SamlXml.child(document.getDocumentElement(), SamlXml.ASSERTION_NS, "Assertion");
        Element subject = SamlXml.child(assertion, SamlXml.ASSERTION_NS, "Subject");
        SamlXml.child(subject, SamlXml.ASSERTION_NS, "NameID").setTextContent("admin@example.com");

        // Act & Assert
        byte[] xml = bytes(document);
        assertUnauthorized(() -> validator.validate(xml, REQUEST_ID));
    }

    // ==================== Transforms ====================

    @Nested
    @DisplayName("transforms")
    class TransformTests {

        @Test
        @DisplayName("A reference with a transform other than enveloped-signature or exclusive c14n is rejected")
        void validate_shouldReject_whenTransformNotAllowed() throws Exception {
            // Arrange
            byte[] xml = bytes(signedAssertion(validResponse(), CanonicalizationMethod.INCLUSIVE));

            // Act & Assert
            assertThatThrownBy(() -> validator.validate(xml, REQUEST_ID))
                .isInstanceOf(RegistryException.class)
                .hasMessageContaining("unsupported transform");
        }

        @Test
        @DisplayName("Exclusive c14n with comments is accepted")
        void validate_shouldAccept_whenExclusiveWithComments() throws Exception {
            // Arrange
            byte[] xml = bytes(signedAssertion(validResponse(), CanonicalizationMethod.EXCLUSIVE_WITH_COMMENTS));

            // Act & Assert
            assertThat(validator.validate(xml, REQUEST_ID).nameId()).isEqualTo("jane@example.com");
        }
    }

    // ==================== Addressing ====================

    @Nested
    @DisplayName("addressing")
    class AddressingTests {

        @Test
        @DisplayName("A response to another AuthnRequest is rejected")
        void validate_shouldReject_whenInResponseToDiffers() throws Exception {
            // Arrange
            byte[] xml = bytes(signedAssertion(response("_another-request", ACS_URL, ACS_URL)));

            // Act & Assert
            assertUnauthorized(() -> validator.validate(xml, REQUEST_ID));
        }

        @Test
        @DisplayName("An unsolicited response without InResponseTo is rejected")
        void validate_shouldReject_whenInResponseToMissing() throws Exception {
            // Arrange
            byte[] xml = bytes(signedAssertion(response(null, ACS_URL, ACS_URL)));

            // Act & Assert
            assertUnauthorized(() -> validator.validate(xml, REQUEST_ID));
        }

        @Test
        @DisplayName("A response addressed to another service is rejected")
        void validate_shouldReject_whenDestinationDiffers() throws Exception {
            // Arrange
            byte[] xml = bytes(signedAssertion(response(REQUEST_ID, "https://other.example.com/saml/acs", ACS_URL)));

            // Act & Assert
            assertUnauthorized(() -> validator.validate(xml, REQUEST_ID));
        }

        @Test
        @DisplayName("A bearer confirmation for another recipient is rejected")
        void validate_shouldReject_whenRecipientDiffers() throws Exception {
            // Arrange
            byte[] xml = bytes(signedAssertion(response(REQUEST_ID, ACS_URL, "https://other.example.com/saml/acs")));

            // Act & Assert
            assertUnauthorized(() -> validator.validate(xml, REQUEST_ID));
        }

        @Test
        @DisplayName("A response without Destination is accepted when the rest matches")
        void validate_shouldAccept_whenDestinationOmitted() throws Exception {
            // Arrange
            byte[] xml = bytes(signedAssertion(response(REQUEST_ID, null, ACS_URL)));

            // Act & Assert
            assertThat(validator.validate(xml, REQUEST_ID).nameId()).isEqualTo("jane@example.com");
        }
    }
}
