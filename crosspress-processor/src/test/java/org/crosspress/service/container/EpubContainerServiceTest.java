package org.crosspress.service.container;

import org.crosspress.config.AppProperties;
import org.crosspress.exception.EpubError;
import org.crosspress.exception.EpubProcessingException;
import org.crosspress.exception.ProcessingWarning;
import org.crosspress.exception.WarningType;
import org.crosspress.testutil.EpubFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;
import java.util.zip.ZipEntry;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EpubContainerServiceTest {

    @TempDir
    Path tempDir;

    private EpubContainerService service;

    @BeforeEach
    void setUp() {
        service = new EpubContainerService(new AppProperties());
    }

    private static EpubError errorOf(Throwable e) {
        return ((EpubProcessingException) e).getError();
    }

    @Nested
    @DisplayName("Input validation")
    class Validation {

        @Test
        void acceptsWellFormedEpub() throws IOException {
            Path epub = EpubFixtures.createDigestEpub(tempDir, "digest.epub");

            assertThat(service.validate(epub)).isEmpty();
        }

        @Test
        void rejectsMissingFile() {
            Path missing = tempDir.resolve("missing.epub");

            assertThatThrownBy(() -> service.validate(missing))
                    .isInstanceOf(EpubProcessingException.class)
                    .hasMessageContaining("file not found")
                    .extracting(EpubContainerServiceTest::errorOf)
                    .isEqualTo(EpubError.INVALID_INPUT);
        }

        @Test
        void rejectsDirectory() throws IOException {
            Path dir = Files.createDirectories(tempDir.resolve("folder.epub"));

            assertThatThrownBy(() -> service.validate(dir))
                    .isInstanceOf(EpubProcessingException.class)
                    .hasMessageContaining("not a regular file");
        }

        @Test
        void rejectsWrongExtension() throws IOException {
            Path zip = EpubFixtures.writeEpub(tempDir.resolve("digest.zip"), EpubFixtures.digestEntries());

            assertThatThrownBy(() -> service.validate(zip))
                    .isInstanceOf(EpubProcessingException.class)
                    .hasMessageContaining(".epub extension");
        }

        @Test
        void rejectsTinyFile() throws IOException {
            Path tiny = Files.write(tempDir.resolve("tiny.epub"), new byte[500]);

            assertThatThrownBy(() -> service.validate(tiny))
                    .isInstanceOf(EpubProcessingException.class)
                    .hasMessageContaining("too small")
                    .extracting(EpubContainerServiceTest::errorOf)
                    .isEqualTo(EpubError.INVALID_INPUT);
        }

        @Test
        void rejectsNonZipContent() throws IOException {
            Path fake = Files.write(tempDir.resolve("fake.epub"), EpubFixtures.randomBytes(4096, 7));

            assertThatThrownBy(() -> service.validate(fake))
                    .isInstanceOf(EpubProcessingException.class)
                    .extracting(EpubContainerServiceTest::errorOf)
                    .isEqualTo(EpubError.INVALID_INPUT);
        }

        @Test
        void rejectsTruncatedZip() throws IOException {
            byte[] full = Files.readAllBytes(EpubFixtures.createDigestEpub(tempDir, "full.epub"));
            byte[] truncated = new byte[full.length / 2];
            System.arraycopy(full, 0, truncated, 0, truncated.length);
            Path broken = Files.write(tempDir.resolve("broken.epub"), truncated);

            assertThatThrownBy(() -> service.validate(broken))
                    .isInstanceOf(EpubProcessingException.class)
                    .extracting(EpubContainerServiceTest::errorOf)
                    .isEqualTo(EpubError.INVALID_INPUT);
        }

        @Test
        void missingMimetypeIsOnlyAWarning() throws IOException {
            Map<String, byte[]> entries = EpubFixtures.digestEntries();
            entries.remove("mimetype");
            Path epub = EpubFixtures.writeEpub(tempDir.resolve("nomime.epub"), entries);

            List<ProcessingWarning> warnings = service.validate(epub);

            assertThat(warnings).singleElement()
                    .extracting(ProcessingWarning::getType)
                    .isEqualTo(WarningType.CONTAINER);
        }

        @Test
        void misplacedMimetypeIsOnlyAWarning() throws IOException {
            Map<String, byte[]> entries = new LinkedHashMap<>(EpubFixtures.digestEntries());
            byte[] mimetype = entries.remove("mimetype");
            entries.put("mimetype", mimetype);
            Path epub = EpubFixtures.writeEpub(tempDir.resolve("late.epub"), entries);

            assertThat(service.validate(epub))
                    .extracting(ProcessingWarning::getMessage)
                    .containsExactly("mimetype is not the first entry");
        }

        @Test
        void minimumSizeIsConfigurable() throws IOException {
            AppProperties properties = new AppProperties();
            properties.getProcessor().setMinEpubSize(100_000);
            EpubContainerService strict = new EpubContainerService(properties);
            Path epub = EpubFixtures.createDigestEpub(tempDir, "digest.epub");

            assertThatThrownBy(() -> strict.validate(epub))
                    .isInstanceOf(EpubProcessingException.class)
                    .hasMessageContaining("too small");
        }
    }

    @Nested
    @DisplayName("Extraction")
    class Extraction {

        @Test
        void extractsEveryEntryAndCleansUpOnClose() throws IOException {
            Path epub = EpubFixtures.createDigestEpub(tempDir, "digest.epub");

            Path root;
            try (WorkingDirectory workDir = service.extract(epub)) {
                root = workDir.getRoot();
                assertThat(root.resolve("mimetype")).hasContent("application/epub+zip");
                assertThat(root.resolve("OEBPS/content.opf")).exists();
                assertThat(root.resolve("OEBPS/images/cover.jpg")).hasBinaryContent(EpubFixtures.randomBytes(2048, 1));
                assertThat(workDir.getWarnings()).isEmpty();
            }

            assertThat(root).doesNotExist();
        }

        @Test
        void skipsTraversalEntries() throws IOException {
            Map<String, byte[]> entries = EpubFixtures.digestEntries();
            entries.put("../escape.txt", EpubFixtures.bytes("outside"));
            Path epub = EpubFixtures.writeEpub(tempDir.resolve("evil.epub"), entries);

            try (WorkingDirectory workDir = service.extract(epub)) {
                assertThat(workDir.getWarnings())
                        .extracting(ProcessingWarning::getPath)
                        .containsExactly("../escape.txt");
                assertThat(workDir.getRoot().getParent().resolve("escape.txt")).doesNotExist();
                assertThat(workDir.getRoot().resolve("OEBPS/content.opf")).exists();
            }
        }

        @Test
        void closeIsIdempotent() throws IOException {
            WorkingDirectory workDir = service.extract(EpubFixtures.createDigestEpub(tempDir, "digest.epub"));

            workDir.close();
            workDir.close();

            assertThat(workDir.isClosed()).isTrue();
            assertThat(workDir.getRoot()).doesNotExist();
        }

        @Test
        void invalidInputCreatesNoWorkingDirectory() throws IOException {
            Path tiny = Files.write(tempDir.resolve("tiny.epub"), new byte[10]);
            Path systemTemp = Path.of(System.getProperty("java.io.tmpdir"));
            long before = countWorkDirs(systemTemp);

            assertThatThrownBy(() -> service.extract(tiny)).isInstanceOf(EpubProcessingException.class);

            assertThat(countWorkDirs(systemTemp)).isEqualTo(before);
        }

        private long countWorkDirs(Path dir) throws IOException {
            try (Stream<Path> list = Files.list(dir)) {
                return list.filter(p -> p.getFileName().toString().startsWith("crosspress_epub_")).count();
            }
        }
    }

    @Nested
    @DisplayName("Packing")
    class Packing {

        @Test
        void writesMimetypeFirstAndStored() throws IOException {
            Path source = tempDir.resolve("tree");
            EpubFixtures.writeTree(source, EpubFixtures.digestEntries());
            Path output = tempDir.resolve("out/digest.epub");

            long size = service.pack(source, output);

            assertThat(size).isEqualTo(Files.size(output));
            List<ZipEntry> entries = EpubFixtures.listEntries(output);
            assertThat(entries.get(0).getName()).isEqualTo("mimetype");
            assertThat(entries.get(0).getMethod()).isEqualTo(ZipEntry.STORED);
            assertThat(entries.get(1).getName()).isEqualTo("META-INF/container.xml");
            assertThat(entries.subList(1, entries.size()))
                    .allSatisfy(entry -> assertThat(entry.getMethod()).isEqualTo(ZipEntry.DEFLATED));
            assertThat(entries).extracting(ZipEntry::getName)
                    .containsOnlyOnce("mimetype")
                    .contains("OEBPS/content.opf", "OEBPS/images/cover.jpg", "OEBPS/toc.ncx");
            assertThat(EpubFixtures.readEntry(output, "mimetype")).isEqualTo("application/epub+zip");
        }

        @Test
        void writesCanonicalMimetypeWhenMissingFromTree() throws IOException {
            Map<String, byte[]> tree = EpubFixtures.digestEntries();
            tree.remove("mimetype");
            Path source = tempDir.resolve("tree");
            EpubFixtures.writeTree(source, tree);
            Path output = tempDir.resolve("digest.epub");

            service.pack(source, output);

            assertThat(EpubFixtures.listEntries(output).get(0).getName()).isEqualTo("mimetype");
            assertThat(EpubFixtures.readEntry(output, "mimetype")).isEqualTo("application/epub+zip");
        }

        @Test
        void replacesExistingOutputAndLeavesNoTempFiles() throws IOException {
            Path source = tempDir.resolve("tree");
            EpubFixtures.writeTree(source, EpubFixtures.digestEntries());
            Path outDir = Files.createDirectories(tempDir.resolve("out"));
            Path output = Files.writeString(outDir.resolve("digest.epub"), "stale");

            service.pack(source, output);

            assertThat(EpubFixtures.readEntry(output, "OEBPS/content.opf")).contains("<package");
            try (Stream<Path> files = Files.list(outDir)) {
                assertThat(files).containsExactly(output);
            }
        }

        @Test
        void packedOutputValidatesAndExtractsAgain() throws IOException {
            Path source = tempDir.resolve("tree");
            EpubFixtures.writeTree(source, EpubFixtures.digestEntries());
            Path output = tempDir.resolve("again.epub");
            service.pack(source, output);

            assertThat(service.validate(output)).isEmpty();
            try (WorkingDirectory workDir = service.extract(output)) {
                assertThat(workDir.getRoot().resolve("OEBPS/article1.xhtml")).hasSameTextualContentAs(source.resolve("OEBPS/article1.xhtml"));
            }
        }

        @Test
        void archiveBelowMinimumSizeIsDiscarded() throws IOException {
            Path source = tempDir.resolve("tree");
            EpubFixtures.writeTree(source, EpubFixtures.digestEntries());
            Path outDir = Files.createDirectories(tempDir.resolve("out"));
            Path output = outDir.resolve("digest.epub");

            assertThatThrownBy(() -> service.pack(source, output, 10_000_000))
                    .isInstanceOf(EpubProcessingException.class)
                    .extracting(EpubContainerServiceTest::errorOf)
                    .isEqualTo(EpubError.CONTAINER_IO_ERROR);
            assertThat(output).doesNotExist();
            try (Stream<Path> files = Files.list(outDir)) {
                assertThat(files).isEmpty();
            }
        }

        @Test
        void missingSourceDirectoryIsContainerFailure() {
            assertThatThrownBy(() -> service.pack(tempDir.resolve("absent"), tempDir.resolve("x.epub")))
                    .isInstanceOf(EpubProcessingException.class)
                    .extracting(EpubContainerServiceTest::errorOf)
                    .isEqualTo(EpubError.CONTAINER_IO_ERROR);
            assertThat(tempDir.resolve("x.epub")).doesNotExist();
        }
    }
}
