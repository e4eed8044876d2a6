package tech.terrareg.platform.ingestion;

import tech.terrareg.platform.error.StorageUnavailableException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Stream;

/**
 * Walks an extracted module and finds its submodules and examples.
 *
 * A submodule is any directory below the modules directory, and an example any
 * directory below the examples directory, that directly contains a {@code .tf} file.
 */
public class ModuleTreeScanner {

    private final String modulesDirectory;
    private final String examplesDirectory;

    public ModuleTreeScanner(String modulesDirectory, String examplesDirectory) {
        this.modulesDirectory = trimSlashes(modulesDirectory);
        this.examplesDirectory = trimSlashes(examplesDirectory);
    }

    public ModuleTree scan(Path root) {
        TerraformIgnore ignore = loadIgnore(root);
        List<String> files = new ArrayList<>();
        Set<String> terraformDirectories = new TreeSet<>();

        try (Stream<Path> paths = Files.walk(root)) {
            paths.filter(Files::isRegularFile).forEach(file -> {
                String relative = relativize(root, file);
                if (ignore.isIgnored(relative, false)) {
                    return;
                }
                files.add(relative);
                if (relative.endsWith(".tf")) {
                    int slash = relative.lastIndexOf('/');
                    terraformDirectories.add(slash < 0 ? "" : relative.substring(0, slash));
                }
            });
        } catch (IOException e) {
            throw new StorageUnavailableException("Unable to scan module directory " + root, e);
        }
        files.sort(String::compareTo);

        List<String> submodules = new ArrayList<>();
        List<String> examples = new ArrayList<>();
        for (String directory : terraformDirectories) {
            if (isBelow(directory, modulesDirectory)) {
                submodules.add(directory);
            } else if (isBelow(directory, examplesDirectory)) {
                examples.add(directory);
            }
        }
        return new ModuleTree(root, terraformDirectories.contains(""), submodules, examples, files);
    }

    private static TerraformIgnore loadIgnore(Path root) {
        Path ignoreFile = root.resolve(TerraformIgnore.FILE_NAME);
        if (!Files.isRegularFile(ignoreFile)) {
            return TerraformIgnore.defaults();
        }
        try {
            return TerraformIgnore.parse(Files.readString(ignoreFile, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new StorageUnavailableException("Unable to read " + TerraformIgnore.FILE_NAME, e);
        }
    }

    private static boolean isBelow(String directory, String parent) {
        return !parent.isEmpty() && directory.startsWith(parent + "/");
    }

    static String relativize(Path root, Path file) {
        return root.relativize(file).toString().replace('\\', '/');
    }

    private static String trimSlashes(String value) {
        String result = value;
        while (result.startsWith("/")) {
            result = result.substring(1);
        }
        while (result.endsWith("/")) {
            result = result.substring(0, result.length() - 1);
        }
        return result;
    }
}
