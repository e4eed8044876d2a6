package tech.terrareg.platform.ingestion.analysis;

import com.fasterxml.jackson.databind.ObjectMapper;
import tech.terrareg.platform.ingestion.SystemCommandService;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Cost estimate of an example with {@code infracost breakdown}.
 */
public class InfracostAnalyzer extends CommandAnalyzer {

    private final String apiKey;

    public InfracostAnalyzer(SystemCommandService commands, ObjectMapper objectMapper, Duration timeout, String apiKey) {
        super(commands, objectMapper, timeout);
        this.apiKey = apiKey;
    }

    @Override
    public String name() {
        return "infracost";
    }

    @Override
    protected List<String> command(Path directory) {
        return List.of("infracost", "breakdown", "--path", ".", "--format", "json", "--no-color");
    }

    @Override
    protected Map<String, String> environment() {
        return Map.of("INFRACOST_API_KEY", apiKey, "INFRACOST_SKIP_UPDATE_CHECK", "true");
    }
}
