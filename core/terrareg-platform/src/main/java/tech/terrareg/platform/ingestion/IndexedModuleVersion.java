package tech.terrareg.platform.ingestion;

import org.semver4j.Semver;

import java.util.List;

/**
 * Everything extracted and analyzed from one module version, before it is persisted.
 */
public record IndexedModuleVersion(
    Semver version,
    AnalyzedComponent root,
    List<AnalyzedComponent> submodules,
    List<AnalyzedComponent> examples,
    List<AnalyzedComponent.StagedFile> rootFiles,
    ModuleMetadata metadata,
    String description,
    String repoSnapshotSha
) {}
