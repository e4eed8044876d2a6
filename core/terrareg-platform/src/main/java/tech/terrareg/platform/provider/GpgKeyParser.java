package tech.terrareg.platform.provider;

import tech.terrareg.platform.error.ErrorKind;
import tech.terrareg.platform.error.RegistryException;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Base64;
import java.util.HexFormat;
import java.util.Locale;

/**
 * Reads the key id and fingerprint of an ASCII-armored OpenPGP public key.
 *
 * Only the first packet is inspected; it must be a version 4 public-key packet.
 * The fingerprint is SHA-1 over {@code 0x99 || length || body} and the key id is
 * its low 64 bits.
 */
public final class GpgKeyParser {

    private static final String BEGIN = "-----BEGIN PGP PUBLIC KEY BLOCK-----";
    private static final String END = "-----END PGP PUBLIC KEY BLOCK-----";
    private static final int PUBLIC_KEY_TAG = 6;

    public record ParsedKey(String keyId, String fingerprint) {}

    /**
     * @throws RegistryException INVALID_INPUT if the armor or packet is malformed
     */
    public static ParsedKey parse(String asciiArmor) {
        byte[] packets = dearmor(asciiArmor);
        if (packets.length < 2) {
            throw invalid("empty key block");
        }
        int header = packets[0] & 0xFF;
        if ((header & 0x80) == 0) {
            throw invalid("not an OpenPGP packet");
        }
        int tag;
        int offset;
        int length;
        if ((header & 0x40) != 0) {
            tag = header & 0x3F;
            int first = packets[1] & 0xFF;
            if (first < 192) {
                length = first;
                offset = 2;
            } else if (first < 224) {
                length = ((first - 192) << 8) + (byteAt(packets, 2) & 0xFF) + 192;
                offset = 3;
            } else if (first == 255) {
                length = readInt(packets, 2, 4);
                offset = 6;
            } else {
                throw invalid("partial body lengths are not supported for keys");
            }
        } else {
            tag = (header >> 2) & 0x0F;
            int lengthBytes = switch (header & 0x03) {
                case 0 -> 1;
                case 1 -> 2;
                case 2 -> 4;
                default -> throw invalid("indeterminate packet length");
            };
            length = readInt(packets, 1, lengthBytes);
            offset = 1 + lengthBytes;
        }
        if (tag != PUBLIC_KEY_TAG) {
            throw invalid("first packet is not a public key");
        }
        if (length <= 0 || offset + length > packets.length) {
            throw invalid("truncated public key packet");
        }
        if (packets[offset] != 4) {
            throw invalid("only version 4 keys are supported");
        }

        try {
            MessageDigest sha1 = MessageDigest.getInstance("SHA-1");
            sha1.update((byte) 0x99);
            sha1.update((byte) (length >> 8));
            sha1.update((byte) length);
            sha1.update(packets, offset, length);
            String fingerprint = HexFormat.of().formatHex(sha1.digest()).toUpperCase(Locale.ROOT);
            return new ParsedKey(fingerprint.substring(fingerprint.length() - 16), fingerprint);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-1 unavailable", e);
        }
    }

    static byte[] dearmor(String asciiArmor) {
        if (asciiArmor == null) {
            throw invalid("missing ASCII armor");
        }
        int begin = asciiArmor.indexOf(BEGIN);
        int end = asciiArmor.indexOf(END);
        if (begin < 0 || end < begin) {
            throw invalid("missing PGP PUBLIC KEY BLOCK markers");
        }
        String[] lines = asciiArmor.substring(begin + BEGIN.length(), end).split("\\r?\\n");
        // lines[0] is the remainder of the BEGIN line; armor headers end at a blank line
        int start = 1;
        while (start < lines.length && lines[start].contains(":")) {
            start++;
        }
        StringBuilder body = new StringBuilder();
        for (int i = start; i < lines.length; i++) {
            String line = lines[i].trim();
            if (line.startsWith("=")) {
                break;
            }
            body.append(line);
        }
        try {
            return Base64.getDecoder().decode(body.toString());
        } catch (IllegalArgumentException e) {
            throw new RegistryException(ErrorKind.INVALID_INPUT,
                "Invalid GPG key: armor is not valid base64", e);
        }
    }

    private static int readInt(byte[] data, int offset, int count) {
        int value = 0;
        for (int i = 0; i < count; i++) {
            value = (value << 8) | (byteAt(data, offset + i) & 0xFF);
        }
        return value;
    }

    private static byte byteAt(byte[] data, int index) {
        if (index >= data.length) {
            throw invalid("truncated packet header");
        }
        return data[index];
    }

    private static RegistryException invalid(String reason) {
        return RegistryException.invalidInput("Invalid GPG key: " + reason);
    }

    private GpgKeyParser() {
        // Utility class
    }
}
