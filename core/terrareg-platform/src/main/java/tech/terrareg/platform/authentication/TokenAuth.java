package tech.terrareg.platform.authentication;

import java.util.Optional;

/**
 * Recognizes the {@code X-Terrareg-ApiKey} header.
 */
public interface TokenAuth extends AuthMethod {

    Optional<AuthContext> authenticate(String apiKey);
}
