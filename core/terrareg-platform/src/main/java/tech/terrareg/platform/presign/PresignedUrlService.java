package tech.terrareg.platform.presign;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.terrareg.platform.config.InfraConfig;
import tech.terrareg.platform.shared.Hashing;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.time.Clock;
import java.time.Duration;
import java.util.HexFormat;

/**
 * Signs and verifies time-limited download URLs.
 *
 * A signed URL is {@code path?ts=<unix>&exp=<unix>&sig=<hex>} where
 * {@code sig} is HMAC-SHA256 over path, ts and exp joined by newlines. The secret is
 * {@code TERRAFORM_PRESIGNED_URL_SECRET}, independent of the session key.
 */
@ApplicationScoped
public class PresignedUrlService {

    private static final Logger LOG = Logger.getLogger(PresignedUrlService.class);

    private static final String HMAC_ALGORITHM = "HmacSHA256";

    @Inject
    InfraConfig infraConfig;

    @Inject
    Clock clock;

    /**
     * Signed path and query, valid for the configured expiry.
     */
    public String sign(String path) {
        return sign(path, infraConfig.presignedUrlExpiry());
    }

    public String sign(String path, Duration validity) {
        long ts = clock.instant().getEpochSecond();
        long exp = ts + validity.getSeconds();
        return path + "?ts=" + ts + "&exp=" + exp + "&sig=" + signature(path, ts, exp);
    }

    /**
     * Absolute signed URL on the public host.
     */
    public String signAbsolute(String path) {
        return infraConfig.absoluteUrl(sign(path));
    }

    /**
     * True only when the signature matches, the URL has not expired and its
     * lifetime does not exceed the configured maximum.
     */
    public boolean verify(String path, String ts, String exp, String sig) {
        if (ts == null || exp == null || sig == null) {
            return false;
        }
        long issued;
        long expires;
        try {
            issued = Long.parseLong(ts);
            expires = Long.parseLong(exp);
        } catch (NumberFormatException e) {
            LOG.debugf("Rejecting presigned URL for %s with malformed timestamps", path);
            return false;
        }
        if (!Hashing.constantTimeEquals(signature(path, issued, expires), sig)) {
            LOG.debugf("Rejecting presigned URL for %s: signature mismatch", path);
            return false;
        }
        if (clock.instant().getEpochSecond() > expires) {
            LOG.debugf("Rejecting presigned URL for %s: expired", path);
            return false;
        }
        if (expires - issued > infraConfig.presignedUrlMaxLifetime().getSeconds() || expires < issued) {
            LOG.debugf("Rejecting presigned URL for %s: lifetime exceeds maximum", path);
            return false;
        }
        return true;
    }

    String signature(String path, long ts, long exp) {
        try {
            Mac mac = Mac.getInstance(HMAC_ALGORITHM);
            mac.init(new SecretKeySpec(infraConfig.presignedUrlSecret(), HMAC_ALGORITHM));
            String payload = path + "\n" + ts + "\n" + exp;
            mac.update(payload.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(mac.doFinal());
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HMAC-SHA256 unavailable", e);
        }
    }
}
