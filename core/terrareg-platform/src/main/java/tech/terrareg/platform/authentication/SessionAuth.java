package tech.terrareg.platform.authentication;

import java.util.Optional;

/**
 * Recognizes a valid, decrypted session cookie.
 */
public interface SessionAuth extends AuthMethod {

    Optional<AuthContext> authenticate(ActiveSession session);
}
