package tech.terrareg.platform.ingestion;

import org.jboss.logging.Logger;
import tech.terrareg.platform.error.ErrorKind;
import tech.terrareg.platform.error.PathTraversalException;
import tech.terrareg.platform.error.RegistryException;
import tech.terrareg.platform.error.StorageUnavailableException;
import tech.terrareg.platform.storage.ArchiveReader;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Unpacks uploaded tar.gz or zip archives into a working directory.
 *
 * Entries are normalized before writing; an entry that would land outside the
 * target directory fails the whole extraction. Links are rejected.
 */
public class ArchiveExtractor {

    private static final Logger LOG = Logger.getLogger(ArchiveExtractor.class);

    private final long maxExtractedBytes;

    public ArchiveExtractor(long maxExtractedBytes) {
        this.maxExtractedBytes = maxExtractedBytes;
    }

    /**
     * @return number of files written
     * @throws PathTraversalException if an entry escapes {@code target}
     * @throws RegistryException INVALID_INPUT for corrupt, oversized or non-archive input
     */
    public int extract(InputStream archive, Path target) {
        Path root = target.toAbsolutePath().normalize();
        int files = 0;
        long total = 0;
        try (ArchiveReader reader = ArchiveReader.open(archive)) {
            for (ArchiveReader.Entry entry : reader) {
                Path destination = resolveEntry(root, entry.name());
                if (entry.symbolicLink()) {
                    throw RegistryException.invalidInput("Archive contains a link: " + entry.name());
                }
                if (entry.directory()) {
                    Files.createDirectories(destination);
                    continue;
                }
                Files.createDirectories(destination.getParent());
                total += copyBounded(entry.content(), destination, maxExtractedBytes - total);
                files++;
            }
        } catch (UncheckedIOException e) {
            throw new RegistryException(ErrorKind.INVALID_INPUT,
                "Archive is corrupt", e.getCause());
        } catch (IOException e) {
            throw new StorageUnavailableException("Unable to extract archive into " + root, e);
        }
        LOG.debugf("Extracted %d files (%d bytes) into %s", files, total, root);
        return files;
    }

    static Path resolveEntry(Path root, String name) {
        String cleaned = name.replace('\\', '/');
        while (cleaned.startsWith("/")) {
            cleaned = cleaned.substring(1);
        }
        Path resolved = root.resolve(cleaned).normalize();
        for (String segment : cleaned.split("/")) {
            if ("..".equals(segment)) {
                throw new PathTraversalException("Archive entry contains '..': " + name);
            }
        }
        if (!resolved.startsWith(root)) {
            throw new PathTraversalException("Archive entry escapes the extraction directory: " + name);
        }
        return resolved;
    }

    private static long copyBounded(InputStream in, Path destination, long remaining) throws IOException {
        long written = 0;
        byte[] buffer = new byte[8192];
        try (OutputStream out = Files.newOutputStream(destination)) {
            int read;
            while ((read = in.read(buffer)) != -1) {
                written += read;
                if (written > remaining) {
                    throw RegistryException.invalidInput("Archive exceeds the maximum extracted size");
                }
                out.write(buffer, 0, read);
            }
        }
        return written;
    }
}
