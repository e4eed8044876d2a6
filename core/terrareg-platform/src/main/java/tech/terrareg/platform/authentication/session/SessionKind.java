package tech.terrareg.platform.authentication.session;

public enum SessionKind {
    /** Logged-in browser session. */
    SESSION,
    /** Short-lived OAuth/OIDC/SAML state record, consumed once. */
    OAUTH_STATE
}
