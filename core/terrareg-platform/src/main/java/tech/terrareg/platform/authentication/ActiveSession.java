package tech.terrareg.platform.authentication;

import tech.terrareg.platform.authentication.session.Session;
import tech.terrareg.platform.authentication.session.SessionData;

/**
 * A session that passed cookie decryption and server-side validation.
 */
public record ActiveSession(Session session, SessionData cookie, ProviderClaims claims) {}
