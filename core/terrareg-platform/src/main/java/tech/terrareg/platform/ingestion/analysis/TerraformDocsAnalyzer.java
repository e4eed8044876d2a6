package tech.terrareg.platform.ingestion.analysis;

import com.fasterxml.jackson.databind.ObjectMapper;
import tech.terrareg.platform.ingestion.SystemCommandService;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * {@code terraform-docs json}: inputs, outputs, providers, requirements and resources.
 */
public class TerraformDocsAnalyzer extends CommandAnalyzer {

    public TerraformDocsAnalyzer(SystemCommandService commands, ObjectMapper objectMapper, Duration timeout) {
        super(commands, objectMapper, timeout);
    }

    @Override
    public String name() {
        return "terraform-docs";
    }

    @Override
    protected List<String> command(Path directory) {
        return List.of("terraform-docs", "json", "--sort=false", ".");
    }
}
