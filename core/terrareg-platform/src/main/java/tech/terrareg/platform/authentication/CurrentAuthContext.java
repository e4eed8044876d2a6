package tech.terrareg.platform.authentication;

import jakarta.enterprise.context.RequestScoped;

/**
 * Holds the {@link AuthContext} built for the current request by {@link AuthContextFilter}.
 */
@RequestScoped
public class CurrentAuthContext {

    private AuthContext context = AuthContext.notAuthenticated();

    public AuthContext get() {
        return context;
    }

    void set(AuthContext context) {
        this.context = context;
    }
}
