package tech.terrareg.platform.search;

import java.util.Locale;

/**
 * Relevance of a module to a free-text query.
 *
 * The query is lower-cased and split on whitespace; each term adds the weight of
 * every field it matches. An exact match on a field excludes the substring
 * weight for that field.
 */
public final class SearchScorer {

    static final int EXACT_MODULE = 20;
    static final int EXACT_NAMESPACE = 18;
    static final int EXACT_PROVIDER = 14;
    static final int EXACT_DESCRIPTION = 13;
    static final int EXACT_OWNER = 12;
    static final int PARTIAL_MODULE = 5;
    static final int PARTIAL_DESCRIPTION = 4;
    static final int PARTIAL_OWNER = 3;
    static final int PARTIAL_NAMESPACE = 2;

    /**
     * Searchable fields of one module provider at its latest version.
     */
    public record Document(String namespace, String module, String provider, String description, String owner) {}

    public static String[] terms(String query) {
        if (query == null || query.isBlank()) {
            return new String[0];
        }
        return query.trim().toLowerCase(Locale.ROOT).split("\\s+");
    }

    public static int score(Document document, String[] terms) {
        String module = lower(document.module());
        String namespace = lower(document.namespace());
        String provider = lower(document.provider());
        String description = lower(document.description());
        String owner = lower(document.owner());

        int score = 0;
        for (String term : terms) {
            score += weigh(module, term, EXACT_MODULE, PARTIAL_MODULE);
            score += weigh(namespace, term, EXACT_NAMESPACE, PARTIAL_NAMESPACE);
            score += weigh(provider, term, EXACT_PROVIDER, 0);
            score += weigh(description, term, EXACT_DESCRIPTION, PARTIAL_DESCRIPTION);
            score += weigh(owner, term, EXACT_OWNER, PARTIAL_OWNER);
        }
        return score;
    }

    /**
     * True when at least one term matches any field.
     */
    public static boolean matches(Document document, String[] terms) {
        return terms.length == 0 || score(document, terms) > 0;
    }

    private static int weigh(String field, String term, int exact, int partial) {
        if (field.isEmpty()) {
            return 0;
        }
        if (field.equals(term)) {
            return exact;
        }
        return field.contains(term) ? partial : 0;
    }

    private static String lower(String value) {
        return value == null ? "" : value.toLowerCase(Locale.ROOT);
    }

    private SearchScorer() {
        // Utility class
    }
}
