package tech.terrareg.platform.authentication;

import jakarta.annotation.Priority;
import jakarta.inject.Inject;
import jakarta.ws.rs.Priorities;
import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.container.ContainerRequestFilter;
import jakarta.ws.rs.core.Cookie;
import jakarta.ws.rs.ext.Provider;
import org.jboss.logging.Logger;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs the {@link AuthDispatcher} once per request and exposes the result
 * through {@link CurrentAuthContext}.
 */
@Provider
@Priority(Priorities.AUTHENTICATION + 10)
public class AuthContextFilter implements ContainerRequestFilter {

    private static final Logger LOG = Logger.getLogger(AuthContextFilter.class);

    @Inject
    AuthDispatcher authDispatcher;

    @Inject
    CurrentAuthContext currentAuthContext;

    @Override
    public void filter(ContainerRequestContext ctx) {
        Map<String, String> headers = new HashMap<>();
        for (Map.Entry<String, List<String>> header : ctx.getHeaders().entrySet()) {
            if (!header.getValue().isEmpty()) {
                headers.put(header.getKey(), header.getValue().get(0));
            }
        }
        Map<String, String> cookies = new HashMap<>();
        for (Map.Entry<String, Cookie> cookie : ctx.getCookies().entrySet()) {
            cookies.put(cookie.getKey(), cookie.getValue().getValue());
        }

        String path = ctx.getUriInfo().getPath();
        AuthContext context = authDispatcher.authenticate(new AuthRequest(headers, cookies, path));
        currentAuthContext.set(context);
        LOG.debugf("Auth context for %s: %s (%s)", path, context.providerType(), context.username());
    }
}
