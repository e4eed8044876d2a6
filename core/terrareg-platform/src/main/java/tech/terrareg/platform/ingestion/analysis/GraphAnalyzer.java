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
 * Initializes the directory without a backend and parses {@code terraform graph}.
 */
public class GraphAnalyzer implements ModuleAnalyzer {

    private static final Logger LOG = Logger.getLogger(GraphAnalyzer.class);

    private static final Map<String, String> ENVIRONMENT = Map.of("TF_IN_AUTOMATION", "1", "CHECKPOINT_DISABLE", "1");

    private final SystemCommandService commands;
    private final ObjectMapper objectMapper;
    private final Duration initTimeout;
    private final Duration graphTimeout;

    public GraphAnalyzer(SystemCommandService commands, ObjectMapper objectMapper,
                         Duration initTimeout, Duration graphTimeout) {
        this.commands = commands;
        this.objectMapper = objectMapper;
        this.initTimeout = initTimeout;
        this.graphTimeout = graphTimeout;
    }

    @Override
    public String name() {
        return "terraform graph";
    }

    @Override
    public AnalysisOutcome analyze(Path directory) {
        try {
            CommandResult init = commands.run(
                List.of("terraform", "init", "-input=false", "-no-color", "-backend=false"),
                directory, ENVIRONMENT, initTimeout);
            if (!init.succeeded()) {
                LOG.warnf("terraform init failed in %s with %d", directory, init.exitCode());
                return AnalysisOutcome.failed("terraform init exited with " + init.exitCode());
            }
            CommandResult graph = commands.run(List.of("terraform", "graph"), directory, ENVIRONMENT, graphTimeout);
            if (!graph.succeeded()) {
                LOG.warnf("terraform graph failed in %s with %d", directory, graph.exitCode());
                return AnalysisOutcome.failed("terraform graph exited with " + graph.exitCode());
            }
            return new AnalysisOutcome.Success(objectMapper.writeValueAsString(GraphParser.parse(graph.stdout())));
        } catch (ExternalToolException e) {
            LOG.warnf("terraform did not run in %s: %s", directory, e.getMessage());
            return AnalysisOutcome.failed(e.getMessage());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize resource graph", e);
        }
    }
}
