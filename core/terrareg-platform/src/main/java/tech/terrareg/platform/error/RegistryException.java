package tech.terrareg.platform.error;

/**
 * Domain failure carrying an {@link ErrorKind}.
 *
 * Commands may wrap a RegistryException with extra context but must keep its kind.
 */
public class RegistryException extends RuntimeException {

    private final ErrorKind kind;

    public RegistryException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public RegistryException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind kind() {
        return kind;
    }

    public static RegistryException invalidInput(String message) {
        return new RegistryException(ErrorKind.INVALID_INPUT, message);
    }

    public static RegistryException notFound(String message) {
        return new RegistryException(ErrorKind.NOT_FOUND, message);
    }

    public static RegistryException conflict(String message) {
        return new RegistryException(ErrorKind.CONFLICT, message);
    }

    public static RegistryException unauthorized(String message) {
        return new RegistryException(ErrorKind.UNAUTHORIZED, message);
    }

    public static RegistryException forbidden(String message) {
        return new RegistryException(ErrorKind.FORBIDDEN, message);
    }

    /**
     * Re-throw with added context while keeping the original kind.
     */
    public RegistryException withContext(String context) {
        return new RegistryException(kind, context + ": " + getMessage(), this);
    }
}
