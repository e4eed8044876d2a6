package tech.terrareg.platform.ingestion;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import tech.terrareg.platform.config.DomainConfig;
import tech.terrareg.platform.config.InfraConfig;
import tech.terrareg.platform.config.ModuleHostingMode;
import tech.terrareg.platform.error.ErrorKind;
import tech.terrareg.platform.error.ExternalToolException;
import tech.terrareg.platform.error.RegistryException;
import tech.terrareg.platform.module.ModuleProvider;
import tech.terrareg.platform.module.ModuleProviderService;
import tech.terrareg.platform.module.ModuleVersion;
import tech.terrareg.platform.namespace.Namespace;
import tech.terrareg.platform.storage.LocalBlobStorage;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("ModuleIngestionService")
class ModuleIngestionServiceTest {

    private static final String ARCHIVE_REF = "modules/acme/vpc/aws/1.0.0/source.tar.gz";
    private static final String ZIP_REF = "modules/acme/vpc/aws/1.0.0/source.zip";

    @Mock
    private SystemCommandService systemCommandService;

    @Mock
    private ModuleProviderService moduleProviderService;

    @Mock
    private ModuleVersionWriter moduleVersionWriter;

    @TempDir
    Path uploadDirectory;

    @TempDir
    Path dataDirectory;

    private LocalBlobStorage storage;
    private ModuleIngestionService service;
    private ModuleProviderService.IngestionTarget existing;

    @BeforeEach
    void setUp() {
        storage = new LocalBlobStorage(dataDirectory);
        existing = target(false);
        service = service(DomainConfig.builder().build(), Duration.ofSeconds(30));
    }

    private ModuleIngestionService service(DomainConfig domainConfig, Duration indexingTimeout) {
        ModuleIngestionService ingestion = new ModuleIngestionService();
        ingestion.moduleProviderService = moduleProviderService;
        ingestion.moduleVersionWriter = moduleVersionWriter;
        ingestion.blobStorage = storage;
        ingestion.systemCommandService = systemCommandService;
        ingestion.objectMapper = new ObjectMapper();
        ingestion.domainConfig = domainConfig;
        ingestion.infraConfig = InfraConfig.builder()
            .uploadDirectory(uploadDirectory.toString())
            .moduleIndexingTimeout(indexingTimeout)
            .build();
        ingestion.init();
        return ingestion;
    }

    private static ModuleProviderService.IngestionTarget target(boolean created) {
        Namespace namespace = new Namespace();
        namespace.id = 1L;
        namespace.name = "acme";
        ModuleProvider moduleProvider = new ModuleProvider();
        moduleProvider.id = 10L;
        moduleProvider.namespaceId = 1L;
        moduleProvider.moduleName = "vpc";
        moduleProvider.providerName = "aws";
        return new ModuleProviderService.IngestionTarget(
            new ModuleProviderService.ResolvedModuleProvider(namespace, moduleProvider), created, created);
    }

    private static InputStream zip(Map<String, String> files) throws IOException {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (ZipOutputStream out = new ZipOutputStream(bytes)) {
            for (Map.Entry<String, String> file : files.entrySet()) {
                out.putNextEntry(new ZipEntry(file.getKey()));
                out.write(file.getValue().getBytes(StandardCharsets.UTF_8));
                out.closeEntry();
            }
        }
        return new ByteArrayInputStream(bytes.toByteArray());
    }

    private static InputStream module() throws IOException {
        Map<String, String> files = new LinkedHashMap<>();
        files.put("main.tf", "variable \"cidr\" {}");
        files.put("README.md", "# VPC\n\nCreates a VPC.");
        files.put("examples/basic/main.tf", "module \"vpc\" { source = \"../../\" }");
        return zip(files);
    }

    private void givenTools(CommandResult result) {
        lenient().when(systemCommandService.run(anyList(), any(), anyMap(), any())).thenReturn(result);
    }

    private static ModuleVersion row() {
        ModuleVersion row = new ModuleVersion();
        row.id = 99L;
        row.version = "1.0.0";
        return row;
    }

    private String read(String key) throws IOException {
        try (InputStream in = storage.getBlob(key)) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    // ==================== Analysis ====================

    @Nested
    @DisplayName("analysis")
    class AnalysisTests {

        @Test
        @DisplayName("Failing analyzers leave their fields null and the version is still indexed")
        void ingestUpload_shouldStoreNullAnalysis_whenToolsFail() throws IOException {
            // Arrange
            givenTools(new CommandResult(1, "", "terraform-docs: not configured"));
            when(moduleProviderService.resolveForIngestion("acme", "vpc", "aws")).thenReturn(existing);
            when(moduleVersionWriter.persist(any(), any(), any(), any(), anyBoolean(), any())).thenReturn(row());

            // Act
            service.ingestUpload("acme", "vpc", "aws", "1.0.0", module(), null);

            // Assert
            ArgumentCaptor<IndexedModuleVersion> indexed = ArgumentCaptor.forClass(IndexedModuleVersion.class);
            verify(moduleVersionWriter).persist(eq(existing), indexed.capture(), eq(ARCHIVE_REF), eq(ZIP_REF),
                eq(false), any());
            AnalyzedComponent root = indexed.getValue().root();
            assertThat(root.terraformDocsJson()).isNull();
            assertThat(root.tfsecJson()).isNull();
            assertThat(root.graphJson()).isNull();
            assertThat(root.readmeText()).startsWith("# VPC");
            assertThat(indexed.getValue().examples()).hasSize(1);
        }

        @Test
        @DisplayName("A tool that cannot start is treated as a failed analyzer")
        void ingestUpload_shouldStoreNullAnalysis_whenToolMissing() throws IOException {
            // Arrange
            when(systemCommandService.run(anyList(), any(), anyMap(), any()))
                .thenThrow(new ExternalToolException("tfsec: command not found"));
            when(moduleProviderService.resolveForIngestion("acme", "vpc", "aws")).thenReturn(existing);
            when(moduleVersionWriter.persist(any(), any(), any(), any(), anyBoolean(), any())).thenReturn(row());

            // Act
            service.ingestUpload("acme", "vpc", "aws", "1.0.0", module(), true);

            // Assert
            ArgumentCaptor<IndexedModuleVersion> indexed = ArgumentCaptor.forClass(IndexedModuleVersion.class);
            verify(moduleVersionWriter).persist(any(), indexed.capture(), any(), any(), eq(true), any());
            assertThat(indexed.getValue().root().tfsecJson()).isNull();
            assertThat(indexed.getValue().examples().get(0).graphJson()).isNull();
        }

        @Test
        @DisplayName("A tree without Terraform files in its root is rejected before anything is written")
        void ingestUpload_shouldReject_whenRootHasNoTerraform() throws IOException {
            // Arrange
            when(moduleProviderService.resolveForIngestion("acme", "vpc", "aws")).thenReturn(existing);

            // Act & Assert
            assertThatThrownBy(() -> service.ingestUpload("acme", "vpc", "aws", "1.0.0",
                zip(Map.of("README.md", "# Nothing here")), null))
                .isInstanceOf(RegistryException.class)
                .extracting(e -> ((RegistryException) e).kind())
                .isEqualTo(ErrorKind.INVALID_INPUT);
            verifyNoInteractions(moduleVersionWriter);
            assertThat(uploadDirectory).isEmptyDirectory();
        }
    }

    // ==================== Hosting mode ====================

    @Nested
    @DisplayName("hosting mode")
    class HostingModeTests {

        @Test
        @DisplayName("DISALLOW rejects uploads without resolving the module provider")
        void ingestUpload_shouldReject_whenHostingDisallowed() {
            // Arrange
            ModuleIngestionService disallowed = service(
                DomainConfig.builder().allowModuleHosting(ModuleHostingMode.DISALLOW).build(), Duration.ofSeconds(30));

            // Act & Assert
            assertThatThrownBy(() -> disallowed.ingestUpload("acme", "vpc", "aws", "1.0.0", module(), null))
                .isInstanceOf(RegistryException.class)
                .extracting(e -> ((RegistryException) e).kind())
                .isEqualTo(ErrorKind.INVALID_INPUT);
            verifyNoInteractions(moduleProviderService, moduleVersionWriter);
        }

        @Test
        @DisplayName("ENFORCE rejects git imports without resolving the module provider")
        void ingestFromGit_shouldReject_whenHostingEnforced() {
            // Arrange
            ModuleIngestionService enforced = service(
                DomainConfig.builder().allowModuleHosting(ModuleHostingMode.ENFORCE).build(), Duration.ofSeconds(30));

            // Act & Assert
            assertThatThrownBy(() -> enforced.ingestFromGit("acme", "vpc", "aws", "1.0.0", null))
                .isInstanceOf(RegistryException.class)
                .extracting(e -> ((RegistryException) e).kind())
                .isEqualTo(ErrorKind.INVALID_INPUT);
            verifyNoInteractions(moduleProviderService, moduleVersionWriter, systemCommandService);
        }

        @Test
        @DisplayName("Git import without a clone URL is rejected before cloning")
        void ingestFromGit_shouldReject_whenNoCloneUrl() {
            // Arrange
            when(moduleProviderService.resolveForIngestion("acme", "vpc", "aws")).thenReturn(existing);

            // Act & Assert
            assertThatThrownBy(() -> service.ingestFromGit("acme", "vpc", "aws", "1.0.0", null))
                .isInstanceOf(RegistryException.class)
                .hasMessageContaining("clone URL");
            verifyNoInteractions(systemCommandService, moduleVersionWriter);
        }
    }

    // ==================== Failure cleanup ====================

    @Nested
    @DisplayName("failure cleanup")
    class FailureTests {

        @Test
        @DisplayName("A failed write restores the archives it replaced and removes the staging prefix")
        void ingestUpload_shouldRestoreArchives_whenWriteFails() throws IOException {
            // Arrange
            givenTools(new CommandResult(1, "", ""));
            storage.putBlob(ARCHIVE_REF, new ByteArrayInputStream("published".getBytes(StandardCharsets.UTF_8)));
            when(moduleProviderService.resolveForIngestion("acme", "vpc", "aws")).thenReturn(existing);
            when(moduleVersionWriter.persist(any(), any(), any(), any(), anyBoolean(), any())).thenAnswer(invocation -> {
                StagedBlobs blobs = invocation.getArgument(5);
                blobs.promote();
                throw new IllegalStateException("transaction rolled back");
            });

            // Act & Assert
            assertThatThrownBy(() -> service.ingestUpload("acme", "vpc", "aws", "1.0.0", module(), null))
                .isInstanceOf(IllegalStateException.class);
            assertThat(read(ARCHIVE_REF)).isEqualTo("published");
            assertThat(storage.exists(ZIP_REF)).isFalse();
            assertThat(dataDirectory.resolve("upload")).isEmptyDirectory();
            assertThat(uploadDirectory).isEmptyDirectory();
        }

        @Test
        @DisplayName("A corrupt upload for a new module provider stores nothing")
        void ingestUpload_shouldNotCreateProvider_whenArchiveCorrupt() {
            // Arrange
            when(moduleProviderService.resolveForIngestion("acme", "vpc", "aws")).thenReturn(target(true));

            // Act & Assert
            assertThatThrownBy(() -> service.ingestUpload("acme", "vpc", "aws", "1.0.0",
                new ByteArrayInputStream("not an archive".getBytes(StandardCharsets.UTF_8)), null))
                .isInstanceOf(RegistryException.class)
                .extracting(e -> ((RegistryException) e).kind())
                .isEqualTo(ErrorKind.INVALID_INPUT);
            verify(moduleProviderService, never()).saveNew(any());
            verifyNoInteractions(moduleVersionWriter);
            assertThat(service.heldProviderLocks()).isZero();
        }
    }

    // ==================== Provider lock ====================

    @Nested
    @DisplayName("provider lock")
    class LockTests {

        @Test
        @DisplayName("A second ingestion of the same module provider gets CONFLICT while the first holds the lock")
        void ingestUpload_shouldConflict_whenProviderLockBusy() throws Exception {
            // Arrange
            ModuleIngestionService shortWait = service(DomainConfig.builder().build(), Duration.ofMillis(200));
            givenTools(new CommandResult(1, "", ""));
            when(moduleProviderService.resolveForIngestion("acme", "vpc", "aws")).thenReturn(existing);
            CountDownLatch writing = new CountDownLatch(1);
            CountDownLatch release = new CountDownLatch(1);
            when(moduleVersionWriter.persist(any(), any(), any(), any(), anyBoolean(), any())).thenAnswer(invocation -> {
                writing.countDown();
                assertThat(release.await(10, TimeUnit.SECONDS)).isTrue();
                return row();
            });
            ExecutorService executor = Executors.newSingleThreadExecutor();

            try {
                Future<ModuleVersion> first = executor.submit(
                    () -> shortWait.ingestUpload("acme", "vpc", "aws", "1.0.0", module(), null));
                assertThat(writing.await(10, TimeUnit.SECONDS)).isTrue();

                // Act & Assert
                assertThatThrownBy(() -> shortWait.ingestUpload("acme", "vpc", "aws", "1.1.0", module(), null))
                    .isInstanceOf(RegistryException.class)
                    .extracting(e -> ((RegistryException) e).kind())
                    .isEqualTo(ErrorKind.CONFLICT);

                release.countDown();
                assertThat(first.get(10, TimeUnit.SECONDS).id).isEqualTo(99L);
            } finally {
                release.countDown();
                executor.shutdownNow();
            }
            assertThat(shortWait.heldProviderLocks()).isZero();
        }

        @Test
        @DisplayName("Lock entries are released once no ingestion uses them")
        void ingestUpload_shouldReleaseLockEntry() throws IOException {
            // Arrange
            givenTools(new CommandResult(1, "", ""));
            when(moduleProviderService.resolveForIngestion("acme", "vpc", "aws")).thenReturn(existing);
            when(moduleVersionWriter.persist(any(), any(), any(), any(), anyBoolean(), any())).thenReturn(row());

            // Act
            service.ingestUpload("acme", "vpc", "aws", "1.0.0", module(), null);

            // Assert
            assertThat(service.heldProviderLocks()).isZero();
        }
    }

    @Test
    @DisplayName("Successful analysis output is kept as JSON")
    void ingestUpload_shouldKeepAnalysisJson_whenToolsSucceed() throws IOException {
        // Arrange
        when(systemCommandService.run(anyList(), any(), anyMap(), any())).thenAnswer(invocation -> {
            List<String> command = invocation.getArgument(0);
            if (command.get(0).equals("terraform-docs")) {
                return new CommandResult(0, "{\"inputs\": []}", "");
            }
            return new CommandResult(1, "", "");
        });
        when(moduleProviderService.resolveForIngestion("acme", "vpc", "aws")).thenReturn(existing);
        when(moduleVersionWriter.persist(any(), any(), any(), any(), anyBoolean(), any())).thenReturn(row());

        // Act
        service.ingestUpload("acme", "vpc", "aws", "1.0.0", module(), null);

        // Assert
        ArgumentCaptor<IndexedModuleVersion> indexed = ArgumentCaptor.forClass(IndexedModuleVersion.class);
        verify(moduleVersionWriter).persist(any(), indexed.capture(), any(), any(), anyBoolean(), any());
        assertThat(indexed.getValue().root().terraformDocsJson()).isEqualTo("{\"inputs\":[]}");
    }
}
