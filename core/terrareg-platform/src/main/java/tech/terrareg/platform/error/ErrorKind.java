package tech.terrareg.platform.error;

import jakarta.ws.rs.core.Response;

/**
 * Error categories raised by the domain layer and mapped once at the HTTP boundary.
 */
public enum ErrorKind {
    INVALID_INPUT(Response.Status.BAD_REQUEST),
    NOT_FOUND(Response.Status.NOT_FOUND),
    CONFLICT(Response.Status.CONFLICT),
    UNAUTHORIZED(Response.Status.UNAUTHORIZED),
    FORBIDDEN(Response.Status.FORBIDDEN),
    INVALID_PATH(Response.Status.BAD_REQUEST),
    STORAGE_UNAVAILABLE(Response.Status.SERVICE_UNAVAILABLE),
    EXTERNAL_TOOL(Response.Status.INTERNAL_SERVER_ERROR),
    SESSION_EXPIRED(Response.Status.UNAUTHORIZED),
    INVALID_SESSION_COOKIE(Response.Status.UNAUTHORIZED),
    INTERNAL(Response.Status.INTERNAL_SERVER_ERROR);

    private final Response.Status status;

    ErrorKind(Response.Status status) {
        this.status = status;
    }

    public Response.Status status() {
        return status;
    }

    /**
     * Server-side kinds never expose their message on the wire.
     */
    public boolean exposesMessage() {
        return status.getFamily() != Response.Status.Family.SERVER_ERROR;
    }
}
