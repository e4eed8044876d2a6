package tech.terrareg.platform.authentication.session;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.core.NewCookie;
import tech.terrareg.platform.config.InfraConfig;
import tech.terrareg.platform.error.InvalidSessionCookieException;
import tech.terrareg.platform.shared.Hashing;

import java.io.IOException;

/**
 * Issues and reads the encrypted {@code terrareg_session} cookie and the
 * {@code is_admin_authenticated} flag cookie.
 */
@ApplicationScoped
public class SessionCookieService {

    public static final String ADMIN_FLAG_COOKIE = "is_admin_authenticated";

    @Inject
    InfraConfig infraConfig;

    @Inject
    ObjectMapper objectMapper;

    CookieCipher cipher;

    @PostConstruct
    void init() {
        cipher = new CookieCipher(infraConfig.secretKey());
    }

    public String cookieName() {
        return infraConfig.sessionCookieName();
    }

    public NewCookie issue(Session session, boolean adminAuthenticated) {
        SessionData data = new SessionData(session.id, adminAuthenticated, Hashing.randomToken(16));
        return baseCookie(cookieName(), encode(data))
            .httpOnly(true)
            .maxAge((int) Math.max(0, session.expiry.getEpochSecond() - session.createdAt.getEpochSecond()))
            .build();
    }

    /**
     * Decrypt and parse a cookie value.
     *
     * @throws InvalidSessionCookieException if the cookie was tampered with or is malformed
     */
    public SessionData read(String cookieValue) {
        byte[] plaintext = cipher.decrypt(cookieValue);
        try {
            SessionData data = objectMapper.readValue(plaintext, SessionData.class);
            if (data.sessionId() == null) {
                throw new InvalidSessionCookieException("Session cookie carries no session id");
            }
            return data;
        } catch (IOException e) {
            throw new InvalidSessionCookieException("Session cookie payload is not valid", e);
        }
    }

    String encode(SessionData data) {
        try {
            return cipher.encrypt(objectMapper.writeValueAsBytes(data));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize session cookie", e);
        }
    }

    public NewCookie adminFlag() {
        return baseCookie(ADMIN_FLAG_COOKIE, "True").httpOnly(false).build();
    }

    public NewCookie clearSession() {
        return baseCookie(cookieName(), "").httpOnly(true).maxAge(0).build();
    }

    public NewCookie clearAdminFlag() {
        return baseCookie(ADMIN_FLAG_COOKIE, "").maxAge(0).build();
    }

    private NewCookie.Builder baseCookie(String name, String value) {
        return new NewCookie.Builder(name)
            .value(value)
            .path("/")
            .secure(infraConfig.secureCookies())
            .sameSite(NewCookie.SameSite.LAX);
    }
}
