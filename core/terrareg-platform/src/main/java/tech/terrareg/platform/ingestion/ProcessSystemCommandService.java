package tech.terrareg.platform.ingestion;

import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;
import tech.terrareg.platform.error.ExternalToolException;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Runs commands with {@link ProcessBuilder}. Output goes to temporary files so a
 * chatty tool cannot block on a full pipe.
 */
@ApplicationScoped
public class ProcessSystemCommandService implements SystemCommandService {

    private static final Logger LOG = Logger.getLogger(ProcessSystemCommandService.class);

    private static final File NULL_INPUT = new File(System.getProperty("os.name").startsWith("Windows") ? "NUL" : "/dev/null");

    @Override
    public CommandResult run(List<String> command, Path workingDirectory, Map<String, String> environment,
                             Duration timeout) {
        String tool = command.get(0);
        Path stdoutFile = null;
        Path stderrFile = null;
        try {
            stdoutFile = Files.createTempFile("terrareg-cmd", ".out");
            stderrFile = Files.createTempFile("terrareg-cmd", ".err");

            ProcessBuilder builder = new ProcessBuilder(command)
                .directory(workingDirectory.toFile())
                .redirectInput(ProcessBuilder.Redirect.from(NULL_INPUT))
                .redirectOutput(stdoutFile.toFile())
                .redirectError(stderrFile.toFile());
            builder.environment().putAll(environment);

            LOG.debugf("Running %s in %s", tool, workingDirectory);
            Process process = builder.start();
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                throw new ExternalToolException(tool + " did not finish within " + timeout.toSeconds() + "s");
            }
            CommandResult result = new CommandResult(process.exitValue(),
                Files.readString(stdoutFile, StandardCharsets.UTF_8),
                Files.readString(stderrFile, StandardCharsets.UTF_8));
            if (!result.succeeded()) {
                LOG.debugf("%s exited with %d: %s", tool, result.exitCode(), result.stderr());
            }
            return result;
        } catch (IOException e) {
            throw new ExternalToolException("Unable to run " + tool, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExternalToolException(tool + " was interrupted", e);
        } finally {
            deleteQuietly(stdoutFile);
            deleteQuietly(stderrFile);
        }
    }

    private static void deleteQuietly(Path file) {
        if (file == null) {
            return;
        }
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            LOG.warnf("Unable to delete temporary file %s: %s", file, e.getMessage());
        }
    }
}
