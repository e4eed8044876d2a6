package tech.terrareg.platform.module;

import tech.terrareg.platform.error.RegistryException;

import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Repository URL templates with {@code {namespace}}, {@code {module}},
 * {@code {provider}}, {@code {tag}} and {@code {path}} placeholders.
 */
public final class GitUrlTemplate {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{([a-z_]+)}");
    private static final Set<String> PLACEHOLDERS = Set.of("namespace", "module", "provider", "tag", "path");

    /**
     * @throws RegistryException INVALID_INPUT on an unknown placeholder
     */
    public static void validate(String template) {
        if (template == null || template.isEmpty()) {
            return;
        }
        Matcher matcher = PLACEHOLDER.matcher(template);
        while (matcher.find()) {
            if (!PLACEHOLDERS.contains(matcher.group(1))) {
                throw RegistryException.invalidInput("Unknown placeholder in URL template: {" + matcher.group(1) + "}");
            }
        }
    }

    public static String render(String template, String namespace, String module, String provider,
                                String tag, String path) {
        if (template == null || template.isEmpty()) {
            return null;
        }
        return template
            .replace("{namespace}", namespace)
            .replace("{module}", module)
            .replace("{provider}", provider)
            .replace("{tag}", tag == null ? "" : tag)
            .replace("{path}", path == null ? "" : path);
    }

    private GitUrlTemplate() {
        // Utility class
    }
}
