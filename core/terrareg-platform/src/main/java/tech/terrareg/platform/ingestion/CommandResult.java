package tech.terrareg.platform.ingestion;

/**
 * Exit status and captured output of an external command.
 */
public record CommandResult(int exitCode, String stdout, String stderr) {

    public boolean succeeded() {
        return exitCode == 0;
    }
}
