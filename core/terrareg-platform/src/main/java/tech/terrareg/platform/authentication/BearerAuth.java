package tech.terrareg.platform.authentication;

import java.util.Optional;

/**
 * Recognizes {@code Authorization: Bearer <token>}.
 */
public interface BearerAuth extends AuthMethod {

    Optional<AuthContext> authenticate(String bearerToken);
}
