package tech.terrareg.platform.authentication.session;

import tech.terrareg.platform.error.InvalidSessionCookieException;
import tech.terrareg.platform.shared.Hashing;

import javax.crypto.AEADBadTagException;
import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Base64;

/**
 * AES-256-GCM cookie encryption.
 *
 * The key is SHA-256 of the configured secret. Output is
 * {@code base64url(nonce || ciphertext || tag)} with a fresh 12-byte nonce per call.
 */
public class CookieCipher {

    private static final String TRANSFORMATION = "AES/GCM/NoPadding";
    private static final int NONCE_LENGTH = 12;
    private static final int TAG_BITS = 128;

    private static final SecureRandom SECURE_RANDOM = new SecureRandom();

    private final SecretKeySpec key;

    public CookieCipher(byte[] secretKey) {
        this.key = new SecretKeySpec(Hashing.sha256(secretKey), "AES");
    }

    public String encrypt(byte[] plaintext) {
        byte[] nonce = new byte[NONCE_LENGTH];
        SECURE_RANDOM.nextBytes(nonce);
        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(TAG_BITS, nonce));
            byte[] ciphertext = cipher.doFinal(plaintext);
            byte[] out = new byte[NONCE_LENGTH + ciphertext.length];
            System.arraycopy(nonce, 0, out, 0, NONCE_LENGTH);
            System.arraycopy(ciphertext, 0, out, NONCE_LENGTH, ciphertext.length);
            return Base64.getUrlEncoder().withoutPadding().encodeToString(out);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("AES-GCM encryption failed", e);
        }
    }

    /**
     * @throws InvalidSessionCookieException if the value is malformed or was modified
     */
    public byte[] decrypt(String encoded) {
        byte[] raw;
        try {
            raw = Base64.getUrlDecoder().decode(encoded);
        } catch (IllegalArgumentException e) {
            throw new InvalidSessionCookieException("Session cookie is not valid base64url", e);
        }
        if (raw.length <= NONCE_LENGTH) {
            throw new InvalidSessionCookieException("Session cookie is too short");
        }
        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.DECRYPT_MODE, key,
                new GCMParameterSpec(TAG_BITS, Arrays.copyOfRange(raw, 0, NONCE_LENGTH)));
            return cipher.doFinal(raw, NONCE_LENGTH, raw.length - NONCE_LENGTH);
        } catch (AEADBadTagException e) {
            throw new InvalidSessionCookieException("Session cookie failed authentication", e);
        } catch (GeneralSecurityException e) {
            throw new InvalidSessionCookieException("Session cookie could not be decrypted", e);
        }
    }
}
