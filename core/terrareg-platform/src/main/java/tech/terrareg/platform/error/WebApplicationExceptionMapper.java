package tech.terrareg.platform.error;

import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;

/**
 * Renders framework errors (unknown route, wrong method, unsupported media type)
 * in the registry error envelope.
 */
@Provider
public class WebApplicationExceptionMapper implements ExceptionMapper<WebApplicationException> {

    @Override
    public Response toResponse(WebApplicationException e) {
        int status = e.getResponse().getStatus();
        String message = status == Response.Status.NOT_FOUND.getStatusCode()
            ? "Not Found"
            : Response.Status.fromStatusCode(status) != null
                ? Response.Status.fromStatusCode(status).getReasonPhrase()
                : "Error";
        return Response.status(status)
            .type(MediaType.APPLICATION_JSON)
            .entity(ErrorResponse.of(message))
            .build();
    }
}
