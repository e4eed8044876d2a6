package tech.terrareg.platform.ingestion;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * {@code .terraformignore} rules.
 *
 * Lines are split on newlines and trimmed; blank lines and {@code #} comments are
 * skipped. {@code !} re-includes, a trailing {@code /} limits a rule to directories
 * and a leading {@code /} anchors it at the module root. Unanchored rules match at
 * any depth. {@code .git/} and {@code .terraform/} are always excluded.
 */
public final class TerraformIgnore {

    public static final String FILE_NAME = ".terraformignore";

    private static final List<String> DEFAULT_RULES = List.of(".git/", ".terraform/");

    private record Rule(Pattern pattern, boolean negated, boolean directoryOnly) {}

    private final List<Rule> rules;

    private TerraformIgnore(List<Rule> rules) {
        this.rules = rules;
    }

    public static TerraformIgnore parse(String content) {
        List<Rule> rules = new ArrayList<>();
        for (String line : DEFAULT_RULES) {
            rules.add(compile(line));
        }
        if (content != null) {
            for (String raw : content.split("\r?\n")) {
                String line = raw.trim();
                if (line.isEmpty() || line.startsWith("#")) {
                    continue;
                }
                rules.add(compile(line));
            }
        }
        return new TerraformIgnore(rules);
    }

    public static TerraformIgnore defaults() {
        return parse(null);
    }

    /**
     * Whether {@code relativePath} (POSIX separators, no leading slash) is excluded.
     * A path is also excluded when any of its parent directories is.
     */
    public boolean isIgnored(String relativePath, boolean directory) {
        String[] segments = relativePath.split("/");
        StringBuilder prefix = new StringBuilder();
        for (int i = 0; i < segments.length; i++) {
            if (i > 0) {
                prefix.append('/');
            }
            prefix.append(segments[i]);
            boolean isDirectory = i < segments.length - 1 || directory;
            if (matches(prefix.toString(), isDirectory)) {
                return true;
            }
        }
        return false;
    }

    private boolean matches(String path, boolean directory) {
        boolean ignored = false;
        for (Rule rule : rules) {
            if (rule.directoryOnly() && !directory) {
                continue;
            }
            if (rule.pattern().matcher(path).matches()) {
                ignored = !rule.negated();
            }
        }
        return ignored;
    }

    private static Rule compile(String line) {
        boolean negated = line.startsWith("!");
        String pattern = negated ? line.substring(1) : line;
        boolean directoryOnly = pattern.endsWith("/");
        if (directoryOnly) {
            pattern = pattern.substring(0, pattern.length() - 1);
        }
        boolean anchored = pattern.startsWith("/");
        if (anchored) {
            pattern = pattern.substring(1);
        }
        String regex = globToRegex(pattern);
        if (!anchored) {
            regex = "(?:.*/)?" + regex;
        }
        return new Rule(Pattern.compile(regex), negated, directoryOnly);
    }

    static String globToRegex(String glob) {
        StringBuilder regex = new StringBuilder();
        for (int i = 0; i < glob.length(); i++) {
            char c = glob.charAt(i);
            if (c == '*') {
                if (i + 1 < glob.length() && glob.charAt(i + 1) == '*') {
                    boolean slashFollows = i + 2 < glob.length() && glob.charAt(i + 2) == '/';
                    regex.append(slashFollows ? "(?:.*/)?" : ".*");
                    i += slashFollows ? 2 : 1;
                } else {
                    regex.append("[^/]*");
                }
            } else if (c == '?') {
                regex.append("[^/]");
            } else if ("\\.[]{}()+-^$|".indexOf(c) >= 0) {
                regex.append('\\').append(c);
            } else {
                regex.append(c);
            }
        }
        return regex.toString();
    }
}
