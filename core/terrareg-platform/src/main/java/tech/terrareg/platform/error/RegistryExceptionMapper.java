package tech.terrareg.platform.error;

import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import org.jboss.logging.Logger;

/**
 * Maps domain errors to the registry error envelope.
 */
@Provider
public class RegistryExceptionMapper implements ExceptionMapper<RegistryException> {

    private static final Logger LOG = Logger.getLogger(RegistryExceptionMapper.class);

    @Override
    public Response toResponse(RegistryException e) {
        ErrorKind kind = e.kind();
        String message;
        if (kind == ErrorKind.NOT_FOUND) {
            message = "Not Found";
        } else if (kind.exposesMessage()) {
            message = e.getMessage();
        } else {
            LOG.errorf(e, "Request failed with %s", kind);
            message = "Internal Error";
        }
        LOG.debugf("Mapped %s to HTTP %d: %s", kind, kind.status().getStatusCode(), e.getMessage());
        return Response.status(kind.status())
            .type(MediaType.APPLICATION_JSON)
            .entity(ErrorResponse.of(message))
            .build();
    }
}
