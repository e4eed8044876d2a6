package tech.terrareg.platform.ingestion;

/**
 * Derives a one-line module description from README text.
 */
public final class ReadmeDescriptionExtractor {

    static final int MIN_WORDS = 6;
    static final int MIN_LETTERS = 20;
    static final int SOFT_LIMIT = 80;
    static final int HARD_LIMIT = 130;

    /**
     * First README line that reads like prose: at least six words and twenty
     * letters, no URL and no {@code @}. Whole sentences are kept while the result
     * stays under 80 characters; a single first sentence may run to 130.
     *
     * @return the description, or {@code null} if no line qualifies
     */
    public static String extract(String readme) {
        if (readme == null || readme.isBlank()) {
            return null;
        }
        for (String raw : readme.split("\n")) {
            String line = raw.trim();
            if (line.isEmpty() || line.startsWith("#")) {
                continue;
            }
            if (line.contains("http://") || line.contains("https://") || line.contains("@")) {
                continue;
            }
            if (line.split("\\s+").length < MIN_WORDS || countLetters(line) < MIN_LETTERS) {
                continue;
            }
            String description = sentences(line);
            if (!description.isEmpty()) {
                return description;
            }
        }
        return null;
    }

    private static String sentences(String line) {
        String description = "";
        for (String part : line.split("\\. ")) {
            String sentence = part.trim();
            String candidate = description.isEmpty() ? sentence : description + ". " + sentence;
            if (candidate.length() >= SOFT_LIMIT && !description.isEmpty()
                || description.isEmpty() && candidate.length() >= HARD_LIMIT) {
                break;
            }
            description = candidate;
        }
        return description;
    }

    private static int countLetters(String line) {
        int letters = 0;
        for (int i = 0; i < line.length(); i++) {
            if (Character.isLetter(line.charAt(i))) {
                letters++;
            }
        }
        return letters;
    }

    private ReadmeDescriptionExtractor() {
        // Utility class
    }
}
