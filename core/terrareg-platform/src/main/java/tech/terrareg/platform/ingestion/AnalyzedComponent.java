package tech.terrareg.platform.ingestion;

import tech.terrareg.platform.module.ComponentKind;

import java.util.List;

/**
 * Analysis results for the module root, one submodule or one example, ready to persist.
 *
 * @param path  module-relative directory, empty for the root
 * @param files example files to store (example components only)
 */
public record AnalyzedComponent(
    ComponentKind kind,
    String path,
    String readmeText,
    String terraformDocsJson,
    String tfsecJson,
    String infracostJson,
    String graphJson,
    List<StagedFile> files
) {

    /**
     * A file read from the extracted tree.
     */
    public record StagedFile(String path, byte[] content, String contentType) {}
}
