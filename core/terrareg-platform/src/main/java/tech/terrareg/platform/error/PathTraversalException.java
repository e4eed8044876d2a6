package tech.terrareg.platform.error;

/**
 * A path component tried to escape its base directory.
 */
public class PathTraversalException extends RegistryException {

    public PathTraversalException(String message) {
        super(ErrorKind.INVALID_PATH, message);
    }
}
