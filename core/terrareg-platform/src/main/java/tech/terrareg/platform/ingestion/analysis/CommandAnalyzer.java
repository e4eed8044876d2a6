package tech.terrareg.platform.ingestion.analysis;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jboss.logging.Logger;
import tech.terrareg.platform.error.ExternalToolException;
import tech.terrareg.platform.ingestion.CommandResult;
import tech.terrareg.platform.ingestion.SystemCommandService;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Analyzer whose output is the JSON printed by a single command.
 */
abstract class CommandAnalyzer implements ModuleAnalyzer {

    private static final Logger LOG = Logger.getLogger(CommandAnalyzer.class);

    protected final SystemCommandService commands;
    protected final ObjectMapper objectMapper;
    protected final Duration timeout;

    protected CommandAnalyzer(SystemCommandService commands, ObjectMapper objectMapper, Duration timeout) {
        this.commands = commands;
        this.objectMapper = objectMapper;
        this.timeout = timeout;
    }

    protected abstract List<String> command(Path directory);

    protected Map<String, String> environment() {
        return Map.of();
    }

    /**
     * Whether a non-zero exit still carries usable output.
     */
    protected boolean acceptsNonZeroExit() {
        return false;
    }

    @Override
    public AnalysisOutcome analyze(Path directory) {
        CommandResult result;
        try {
            result = commands.run(command(directory), directory, environment(), timeout);
        } catch (ExternalToolException e) {
            LOG.warnf("%s did not run in %s: %s", name(), directory, e.getMessage());
            return AnalysisOutcome.failed(e.getMessage());
        }
        if (!result.succeeded() && (!acceptsNonZeroExit() || result.stdout().isBlank())) {
            LOG.warnf("%s exited with %d in %s", name(), result.exitCode(), directory);
            return AnalysisOutcome.failed(name() + " exited with " + result.exitCode());
        }
        try {
            return new AnalysisOutcome.Success(objectMapper.readTree(result.stdout()).toString());
        } catch (JsonProcessingException e) {
            LOG.warnf("%s produced invalid JSON in %s", name(), directory);
            return AnalysisOutcome.failed(name() + " produced invalid JSON");
        }
    }
}
