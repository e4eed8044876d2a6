package tech.terrareg.platform.error;

public class InvalidSessionCookieException extends RegistryException {

    public InvalidSessionCookieException(String message) {
        super(ErrorKind.INVALID_SESSION_COOKIE, message);
    }

    public InvalidSessionCookieException(String message, Throwable cause) {
        super(ErrorKind.INVALID_SESSION_COOKIE, message, cause);
    }
}
