package tech.terrareg.platform.ingestion;

import java.nio.file.Path;
import java.util.List;

/**
 * Catalog of an extracted module: root, submodule and example directories and
 * every file that is not excluded by {@code .terraformignore}.
 *
 * Directory and file paths are module-relative with POSIX separators.
 */
public record ModuleTree(
    Path root,
    boolean rootHasTerraform,
    List<String> submodules,
    List<String> examples,
    List<String> files
) {

    public ModuleTree {
        submodules = List.copyOf(submodules);
        examples = List.copyOf(examples);
        files = List.copyOf(files);
    }

    /**
     * Files directly or transitively under {@code directory}.
     */
    public List<String> filesUnder(String directory) {
        String prefix = directory.isEmpty() ? "" : directory + "/";
        return files.stream().filter(f -> f.startsWith(prefix)).toList();
    }
}
