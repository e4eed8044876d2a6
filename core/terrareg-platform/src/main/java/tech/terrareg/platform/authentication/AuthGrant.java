package tech.terrareg.platform.authentication;

/**
 * Namespace-independent abilities carried by an {@link AuthContext}.
 */
public enum AuthGrant {
    /** Upload module versions to any namespace (upload API key). */
    UPLOAD_ANY_NAMESPACE,
    /** Publish module versions in any namespace (publish API key). */
    PUBLISH_ANY_NAMESPACE,
    /** Token issued through {@code terraform login}. */
    TERRAFORM_API
}
