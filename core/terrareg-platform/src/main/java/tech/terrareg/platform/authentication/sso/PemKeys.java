package tech.terrareg.platform.authentication.sso;

import tech.terrareg.platform.config.ConfigurationException;

import java.io.ByteArrayInputStream;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.PrivateKey;
import java.security.cert.CertificateFactory;
import java.security.cert.X509Certificate;
import java.security.spec.PKCS8EncodedKeySpec;
import java.util.Base64;

/**
 * Decoding of PEM (or bare base64) certificates and PKCS#8 RSA keys.
 */
final class PemKeys {

    static X509Certificate certificate(String pemOrBase64) {
        try {
            CertificateFactory factory = CertificateFactory.getInstance("X.509");
            return (X509Certificate) factory.generateCertificate(new ByteArrayInputStream(der(pemOrBase64)));
        } catch (GeneralSecurityException e) {
            throw new ConfigurationException("Invalid X.509 certificate", e);
        }
    }

    static PrivateKey privateKey(String pemOrBase64) {
        try {
            return KeyFactory.getInstance("RSA").generatePrivate(new PKCS8EncodedKeySpec(der(pemOrBase64)));
        } catch (GeneralSecurityException e) {
            throw new ConfigurationException("Invalid PKCS#8 RSA private key", e);
        }
    }

    /**
     * Base64 body of a PEM block with headers and whitespace removed.
     */
    static String body(String pemOrBase64) {
        return pemOrBase64
            .replaceAll("-----BEGIN [A-Z ]+-----", "")
            .replaceAll("-----END [A-Z ]+-----", "")
            .replaceAll("\\s", "");
    }

    private static byte[] der(String pemOrBase64) {
        try {
            return Base64.getDecoder().decode(body(pemOrBase64));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Key material is not valid base64", e);
        }
    }

    private PemKeys() {
        // Utility class
    }
}
