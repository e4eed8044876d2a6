package tech.terrareg.platform.ingestion.analysis;

import java.nio.file.Path;

/**
 * An external tool run against one module directory.
 */
public interface ModuleAnalyzer {

    String name();

    /**
     * Never throws for tool failures; they come back as {@link AnalysisOutcome.Failed}.
     */
    AnalysisOutcome analyze(Path directory);
}
