package tech.terrareg.platform.authentication;

/**
 * One credential recognizer in the {@link AuthDispatcher} chain.
 *
 * Implementations are stateless: everything learned about a request goes into
 * the returned {@link AuthContext}. The dispatcher picks the call by capability
 * subtype ({@link TokenAuth}, {@link SessionAuth}, {@link BearerAuth}).
 */
public interface AuthMethod {

    AuthMethodType type();

    /**
     * Whether the method is configured. Disabled methods are skipped.
     */
    boolean isEnabled();
}
