package tech.terrareg.platform.ingestion.analysis;

import com.fasterxml.jackson.databind.ObjectMapper;
import tech.terrareg.platform.ingestion.SystemCommandService;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * Security scan with tfsec. Findings make tfsec exit non-zero, so any exit code
 * with JSON output counts as a result.
 */
public class TfsecAnalyzer extends CommandAnalyzer {

    public TfsecAnalyzer(SystemCommandService commands, ObjectMapper objectMapper, Duration timeout) {
        super(commands, objectMapper, timeout);
    }

    @Override
    public String name() {
        return "tfsec";
    }

    @Override
    protected List<String> command(Path directory) {
        return List.of("tfsec", "--ignore-hcl-errors", "--format", "json", "--no-module-downloads",
            "--soft-fail", "--no-colour", "--include-ignored", "--include-passed", "--disable-grouping", ".");
    }

    @Override
    protected boolean acceptsNonZeroExit() {
        return true;
    }
}
