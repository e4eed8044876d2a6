package tech.terrareg.platform.analytics;

/**
 * Splits the {@code <token>__<namespace>} form Terraform users put in module
 * sources to identify themselves.
 */
public final class AnalyticsTokenParser {

    static final String SEPARATOR = "__";

    /**
     * @param token     analytics token, null when the segment carries none
     * @param namespace namespace name with the token removed
     */
    public record ParsedNamespace(String token, String namespace) {}

    public static ParsedNamespace parse(String namespaceSegment) {
        int separator = namespaceSegment.indexOf(SEPARATOR);
        if (separator <= 0 || separator + SEPARATOR.length() >= namespaceSegment.length()) {
            return new ParsedNamespace(null, namespaceSegment);
        }
        return new ParsedNamespace(
            namespaceSegment.substring(0, separator),
            namespaceSegment.substring(separator + SEPARATOR.length()));
    }

    private AnalyticsTokenParser() {
        // Utility class
    }
}
