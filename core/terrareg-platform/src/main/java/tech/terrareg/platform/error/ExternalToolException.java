package tech.terrareg.platform.error;

/**
 * An external analyzer or helper process failed, timed out or could not be started.
 */
public class ExternalToolException extends RegistryException {

    public ExternalToolException(String message) {
        super(ErrorKind.EXTERNAL_TOOL, message);
    }

    public ExternalToolException(String message, Throwable cause) {
        super(ErrorKind.EXTERNAL_TOOL, message, cause);
    }
}
