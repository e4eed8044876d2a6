package tech.terrareg.platform.authentication;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * The parts of an HTTP request the recognizers may look at.
 * Header names are case-insensitive.
 */
public record AuthRequest(Map<String, String> headers, Map<String, String> cookies, String path) {

    public static final String API_KEY_HEADER = "X-Terrareg-ApiKey";
    public static final String AUTHORIZATION_HEADER = "Authorization";

    public AuthRequest {
        headers = headers.entrySet().stream()
            .collect(Collectors.toUnmodifiableMap(e -> e.getKey().toLowerCase(Locale.ROOT), Map.Entry::getValue,
                (first, second) -> first));
        cookies = Map.copyOf(cookies);
    }

    public Optional<String> header(String name) {
        String value = headers.get(name.toLowerCase(Locale.ROOT));
        return value == null || value.isEmpty() ? Optional.empty() : Optional.of(value);
    }

    public Optional<String> cookie(String name) {
        String value = cookies.get(name);
        return value == null || value.isEmpty() ? Optional.empty() : Optional.of(value);
    }

    public Optional<String> apiKey() {
        return header(API_KEY_HEADER);
    }

    /**
     * Token from {@code Authorization: Bearer <token>}, if present.
     */
    public Optional<String> bearerToken() {
        return header(AUTHORIZATION_HEADER)
            .filter(value -> value.regionMatches(true, 0, "Bearer ", 0, 7))
            .map(value -> value.substring(7).trim())
            .filter(token -> !token.isEmpty());
    }
}
