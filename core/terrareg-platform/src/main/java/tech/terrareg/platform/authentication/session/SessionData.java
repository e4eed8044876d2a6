package tech.terrareg.platform.authentication.session;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Content of the encrypted session cookie.
 */
public record SessionData(
    @JsonProperty("session_id") String sessionId,
    @JsonProperty("is_admin_authenticated") boolean adminAuthenticated,
    @JsonProperty("csrf_token") String csrfToken
) {}
