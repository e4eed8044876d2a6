package tech.terrareg.platform.ingestion;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Seam for every external tool the ingestion pipeline runs (git, terraform,
 * terraform-docs, tfsec, infracost). Tests replace it with a mock.
 */
public interface SystemCommandService {

    /**
     * Run {@code command} in {@code workingDirectory} and wait for it to finish.
     *
     * A non-zero exit code is returned, not thrown.
     *
     * @param environment extra environment variables, merged over the server's own
     * @throws tech.terrareg.platform.error.ExternalToolException if the tool cannot be
     *         started or does not finish within {@code timeout}
     */
    CommandResult run(List<String> command, Path workingDirectory, Map<String, String> environment, Duration timeout);
}
