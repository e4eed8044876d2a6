package tech.terrareg.platform.ingestion.analysis;

import java.util.Optional;

/**
 * Result of one optional analyzer run. Ingestion keeps going on {@link Skipped}
 * and {@link Failed} and stores whatever succeeded.
 */
public sealed interface AnalysisOutcome permits AnalysisOutcome.Success, AnalysisOutcome.Skipped, AnalysisOutcome.Failed {

    record Success(String value) implements AnalysisOutcome {}

    record Skipped(String reason) implements AnalysisOutcome {}

    record Failed(String reason) implements AnalysisOutcome {}

    default Optional<String> json() {
        return this instanceof Success success ? Optional.of(success.value()) : Optional.empty();
    }

    static AnalysisOutcome skipped(String reason) {
        return new Skipped(reason);
    }

    static AnalysisOutcome failed(String reason) {
        return new Failed(reason);
    }
}
