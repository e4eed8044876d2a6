package tech.terrareg.platform.ingestion;

import org.apache.commons.compress.archivers.tar.TarArchiveEntry;
import org.apache.commons.compress.archivers.tar.TarArchiveOutputStream;
import org.apache.commons.compress.compressors.gzip.GzipCompressorOutputStream;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import tech.terrareg.platform.error.ErrorKind;
import tech.terrareg.platform.error.PathTraversalException;
import tech.terrareg.platform.error.RegistryException;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

import static org.assertj.core.api.Assertions.*;

class ArchiveExtractorTest {

    private static final long LIMIT = 1024 * 1024;

    @TempDir
    Path workDir;

    private static byte[] zip(Map<String, String> files) throws IOException {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (ZipOutputStream out = new ZipOutputStream(bytes)) {
            for (Map.Entry<String, String> file : files.entrySet()) {
                out.putNextEntry(new ZipEntry(file.getKey()));
                out.write(file.getValue().getBytes(StandardCharsets.UTF_8));
                out.closeEntry();
            }
        }
        return bytes.toByteArray();
    }

    private static byte[] tarGz(Map<String, String> files) throws IOException {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (TarArchiveOutputStream out = new TarArchiveOutputStream(new GzipCompressorOutputStream(bytes))) {
            for (Map.Entry<String, String> file : files.entrySet()) {
                byte[] content = file.getValue().getBytes(StandardCharsets.UTF_8);
                TarArchiveEntry entry = new TarArchiveEntry(file.getKey());
                entry.setSize(content.length);
                out.putArchiveEntry(entry);
                out.write(content);
                out.closeArchiveEntry();
            }
        }
        return bytes.toByteArray();
    }

    @Test
    @DisplayName("A zip upload is extracted with its directory layout")
    void extract_shouldWriteZipEntries() throws IOException {
        Map<String, String> files = new LinkedHashMap<>();
        files.put("main.tf", "resource \"null_resource\" \"this\" {}");
        files.put("modules/child/main.tf", "variable \"name\" {}");

        int count = new ArchiveExtractor(LIMIT).extract(new ByteArrayInputStream(zip(files)), workDir);

        assertThat(count).isEqualTo(2);
        assertThat(workDir.resolve("modules/child/main.tf")).hasContent("variable \"name\" {}");
    }

    @Test
    @DisplayName("A tar.gz upload is extracted")
    void extract_shouldWriteTarGzEntries() throws IOException {
        int count = new ArchiveExtractor(LIMIT)
            .extract(new ByteArrayInputStream(tarGz(Map.of("README.md", "# Example"))), workDir);

        assertThat(count).isEqualTo(1);
        assertThat(workDir.resolve("README.md")).hasContent("# Example");
    }

    @Test
    @DisplayName("An entry escaping the target directory fails the extraction and writes nothing outside")
    void extract_shouldRejectZipSlip() throws IOException {
        Path target = Files.createDirectories(workDir.resolve("target"));
        byte[] archive = zip(Map.of("../evil.tf", "pwned"));

        assertThatThrownBy(() -> new ArchiveExtractor(LIMIT).extract(new ByteArrayInputStream(archive), target))
            .isInstanceOf(PathTraversalException.class);
        assertThat(workDir.resolve("evil.tf")).doesNotExist();
    }

    @Test
    @DisplayName("Absolute entry names are re-rooted under the target")
    void resolveEntry_shouldStripLeadingSlash() {
        Path root = workDir.toAbsolutePath().normalize();

        assertThat(ArchiveExtractor.resolveEntry(root, "/etc/passwd")).isEqualTo(root.resolve("etc/passwd"));
        assertThatThrownBy(() -> ArchiveExtractor.resolveEntry(root, "a\\..\\..\\b"))
            .isInstanceOf(PathTraversalException.class);
    }

    @Test
    @DisplayName("Archives expanding past the size limit are rejected as invalid input")
    void extract_shouldReject_whenTooLarge() throws IOException {
        byte[] archive = zip(Map.of("big.txt", "x".repeat(4096)));

        assertThatThrownBy(() -> new ArchiveExtractor(1024).extract(new ByteArrayInputStream(archive), workDir))
            .isInstanceOf(RegistryException.class)
            .extracting(e -> ((RegistryException) e).kind())
            .isEqualTo(ErrorKind.INVALID_INPUT);
    }

    @Test
    @DisplayName("Input that is not an archive is rejected as invalid input")
    void extract_shouldReject_whenNotArchive() {
        byte[] notArchive = "just some text".getBytes(StandardCharsets.UTF_8);

        assertThatThrownBy(() -> new ArchiveExtractor(LIMIT).extract(new ByteArrayInputStream(notArchive), workDir))
            .isInstanceOf(RegistryException.class)
            .extracting(e -> ((RegistryException) e).kind())
            .isEqualTo(ErrorKind.INVALID_INPUT);
    }
}
