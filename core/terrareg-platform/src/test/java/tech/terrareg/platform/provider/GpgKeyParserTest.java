package tech.terrareg.platform.provider;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tech.terrareg.platform.error.RegistryException;

import java.io.ByteArrayOutputStream;
import java.security.MessageDigest;
import java.util.Base64;
import java.util.HexFormat;
import java.util.Locale;

import static org.assertj.core.api.Assertions.*;

class GpgKeyParserTest {

    /**
     * v4 public key body: version, creation time, algorithm (RSA) and two small MPIs.
     */
    private static final byte[] KEY_BODY = {
        4, 0x66, 0x2A, 0x3B, 0x00, 1,
        0x00, 0x10, (byte) 0xC3, 0x5F,
        0x00, 0x11, 0x01, 0x00, 0x01
    };

    @Test
    @DisplayName("Fingerprint is SHA-1 of the framed key body; key id is its last 16 hex digits")
    void parse_shouldDeriveFingerprintAndKeyId_whenNewFormatPacket() throws Exception {
        byte[] packet = concat(new byte[]{(byte) 0xC6, (byte) KEY_BODY.length}, KEY_BODY);

        GpgKeyParser.ParsedKey parsed = GpgKeyParser.parse(armor(packet, true));

        String expected = expectedFingerprint();
        assertThat(parsed.fingerprint()).isEqualTo(expected);
        assertThat(parsed.keyId()).isEqualTo(expected.substring(24)).hasSize(16);
    }

    @Test
    @DisplayName("Old-format packet headers give the same fingerprint")
    void parse_shouldAcceptOldFormatHeader() throws Exception {
        byte[] packet = concat(new byte[]{(byte) 0x98, (byte) KEY_BODY.length}, KEY_BODY);

        assertThat(GpgKeyParser.parse(armor(packet, false)).fingerprint()).isEqualTo(expectedFingerprint());
    }

    @Test
    @DisplayName("Non-key packets, v3 keys and broken armor are invalid input")
    void parse_shouldReject_whenMalformed() {
        byte[] signaturePacket = concat(new byte[]{(byte) 0xC2, (byte) KEY_BODY.length}, KEY_BODY);
        byte[] v3 = KEY_BODY.clone();
        v3[0] = 3;

        assertThatThrownBy(() -> GpgKeyParser.parse(armor(signaturePacket, false)))
            .isInstanceOf(RegistryException.class).hasMessageContaining("not a public key");
        assertThatThrownBy(() -> GpgKeyParser.parse(armor(concat(new byte[]{(byte) 0xC6, (byte) v3.length}, v3), false)))
            .isInstanceOf(RegistryException.class).hasMessageContaining("version 4");
        assertThatThrownBy(() -> GpgKeyParser.parse("not a key"))
            .isInstanceOf(RegistryException.class);
        assertThatThrownBy(() -> GpgKeyParser.parse(null))
            .isInstanceOf(RegistryException.class);
    }

    private static String expectedFingerprint() throws Exception {
        MessageDigest sha1 = MessageDigest.getInstance("SHA-1");
        sha1.update((byte) 0x99);
        sha1.update((byte) 0);
        sha1.update((byte) KEY_BODY.length);
        sha1.update(KEY_BODY);
        return HexFormat.of().formatHex(sha1.digest()).toUpperCase(Locale.ROOT);
    }

    private static String armor(byte[] packet, boolean withHeaders) {
        StringBuilder armor = new StringBuilder("-----BEGIN PGP PUBLIC KEY BLOCK-----\n");
        if (withHeaders) {
            armor.append("Comment: test key\n");
        }
        armor.append('\n')
            .append(Base64.getEncoder().encodeToString(packet)).append('\n')
            .append("=abcd\n")
            .append("-----END PGP PUBLIC KEY BLOCK-----\n");
        return armor.toString();
    }

    private static byte[] concat(byte[] a, byte[] b) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        out.writeBytes(a);
        out.writeBytes(b);
        return out.toByteArray();
    }
}
