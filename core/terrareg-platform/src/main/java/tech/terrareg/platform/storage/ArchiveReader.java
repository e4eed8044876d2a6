package tech.terrareg.platform.storage;

import org.apache.commons.compress.archivers.ArchiveEntry;
import org.apache.commons.compress.archivers.ArchiveInputStream;
import org.apache.commons.compress.archivers.tar.TarArchiveEntry;
import org.apache.commons.compress.archivers.tar.TarArchiveInputStream;
import org.apache.commons.compress.archivers.zip.ZipArchiveInputStream;
import org.apache.commons.compress.compressors.gzip.GzipCompressorInputStream;
import tech.terrareg.platform.error.RegistryException;
import tech.terrareg.platform.error.StorageUnavailableException;

import java.io.BufferedInputStream;
import java.io.Closeable;
import java.io.FilterInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Sequential reader over a tar.gz or zip stream.
 *
 * Each {@link Entry#content()} stream is only valid until the iterator advances.
 */
public final class ArchiveReader implements Iterable<ArchiveReader.Entry>, Closeable {

    /**
     * One archive member. {@code name} is the raw, unnormalized member name.
     */
    public record Entry(String name, boolean directory, boolean symbolicLink, long size, InputStream content) {}

    private final ArchiveInputStream<? extends ArchiveEntry> archive;
    private final ArchiveFormat format;
    private boolean iterated;

    private ArchiveReader(ArchiveInputStream<? extends ArchiveEntry> archive, ArchiveFormat format) {
        this.archive = archive;
        this.format = format;
    }

    /**
     * Open an archive, detecting its format from magic bytes.
     *
     * @throws RegistryException INVALID_INPUT if the stream is neither gzip-tar nor zip
     */
    public static ArchiveReader open(InputStream raw) {
        BufferedInputStream in = new BufferedInputStream(raw);
        try {
            ArchiveFormat format = ArchiveFormat.detect(in);
            if (format == null) {
                in.close();
                throw RegistryException.invalidInput("Archive must be a gzip-compressed tar or a zip file");
            }
            return switch (format) {
                case TAR_GZ -> new ArchiveReader(new TarArchiveInputStream(new GzipCompressorInputStream(in)), format);
                case ZIP -> new ArchiveReader(new ZipArchiveInputStream(in), format);
            };
        } catch (IOException e) {
            throw new StorageUnavailableException("Unable to read archive", e);
        }
    }

    public ArchiveFormat format() {
        return format;
    }

    @Override
    public Iterator<Entry> iterator() {
        if (iterated) {
            throw new IllegalStateException("Archive can only be iterated once");
        }
        iterated = true;
        return new Iterator<>() {
            private ArchiveEntry next;
            private boolean fetched;

            @Override
            public boolean hasNext() {
                if (!fetched) {
                    try {
                        next = archive.getNextEntry();
                    } catch (IOException e) {
                        throw new UncheckedIOException("Corrupt archive", e);
                    }
                    fetched = true;
                }
                return next != null;
            }

            @Override
            public Entry next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                fetched = false;
                boolean symlink = next instanceof TarArchiveEntry tar && (tar.isSymbolicLink() || tar.isLink());
                return new Entry(next.getName(), next.isDirectory(), symlink, next.getSize(), new NonClosingInputStream(archive));
            }
        };
    }

    /**
     * Entry streams share the archive stream, so closing one must not close the archive.
     */
    private static final class NonClosingInputStream extends FilterInputStream {

        NonClosingInputStream(InputStream in) {
            super(in);
        }

        @Override
        public void close() {
            // archive stays open for the next entry
        }
    }

    @Override
    public void close() throws IOException {
        archive.close();
    }
}
