package tech.terrareg.platform.error;

/**
 * Retryable failure of the blob storage backend.
 */
public class StorageUnavailableException extends RegistryException {

    public StorageUnavailableException(String message, Throwable cause) {
        super(ErrorKind.STORAGE_UNAVAILABLE, message, cause);
    }
}
