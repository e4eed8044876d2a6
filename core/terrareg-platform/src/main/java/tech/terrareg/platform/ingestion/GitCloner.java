package tech.terrareg.platform.ingestion;

import org.jboss.logging.Logger;
import tech.terrareg.platform.error.ExternalToolException;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Shallow clones of module repositories through {@link SystemCommandService}.
 */
public class GitCloner {

    private static final Logger LOG = Logger.getLogger(GitCloner.class);

    private static final Map<String, String> GIT_ENVIRONMENT = Map.of(
        "GIT_TERMINAL_PROMPT", "0",
        "GIT_SSH_COMMAND", "ssh -o StrictHostKeyChecking=accept-new -o BatchMode=yes");

    private final SystemCommandService commands;
    private final Duration cloneTimeout;

    public GitCloner(SystemCommandService commands, Duration cloneTimeout) {
        this.commands = commands;
        this.cloneTimeout = cloneTimeout;
    }

    /**
     * Clone {@code tag} of {@code url} into {@code target} (which must not exist yet).
     *
     * @return the commit sha that was checked out
     * @throws ExternalToolException if git fails or times out
     */
    public String cloneTag(String url, String tag, Path target) {
        LOG.infof("Cloning %s at %s", redact(url), tag);
        CommandResult clone = commands.run(
            List.of("git", "clone", "--depth=1", "--single-branch", "--branch", tag, url, target.toString()),
            target.getParent(), GIT_ENVIRONMENT, cloneTimeout);
        if (!clone.succeeded()) {
            throw new ExternalToolException("git clone of tag " + tag + " failed: " + firstLine(clone.stderr()));
        }
        CommandResult head = commands.run(List.of("git", "rev-parse", "HEAD"), target, GIT_ENVIRONMENT, cloneTimeout);
        if (!head.succeeded()) {
            throw new ExternalToolException("git rev-parse failed: " + firstLine(head.stderr()));
        }
        return head.stdout().trim();
    }

    /**
     * Render a git tag from a tag format such as {@code v{version}}.
     */
    public static String renderTag(String tagFormat, String version, int major, int minor, int patch) {
        return tagFormat
            .replace("{version}", version)
            .replace("{major}", Integer.toString(major))
            .replace("{minor}", Integer.toString(minor))
            .replace("{patch}", Integer.toString(patch));
    }

    /**
     * Strip credentials from a URL before logging it.
     */
    static String redact(String url) {
        return url.replaceAll("//[^/@]+@", "//***@");
    }

    private static String firstLine(String output) {
        String trimmed = output == null ? "" : output.trim();
        int newline = trimmed.indexOf('\n');
        return newline < 0 ? trimmed : trimmed.substring(0, newline);
    }
}
