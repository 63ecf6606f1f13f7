package org.crosspress.service.container;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.compress.archivers.zip.ZipArchiveEntry;
import org.apache.commons.compress.archivers.zip.ZipArchiveOutputStream;
import org.apache.commons.compress.archivers.zip.ZipFile;
import org.crosspress.config.AppProperties;
import org.crosspress.exception.EpubError;
import org.crosspress.exception.ProcessingWarning;
import org.crosspress.exception.WarningType;
import org.crosspress.util.ArchiveUtils;
import org.crosspress.util.FileUtils;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.zip.CRC32;
import java.util.zip.Deflater;
import java.util.stream.Stream;

@Slf4j
@Service
@RequiredArgsConstructor
public class EpubContainerService {

    private static final byte[] MIMETYPE_CONTENT = ArchiveUtils.EPUB_MIMETYPE.getBytes(StandardCharsets.US_ASCII);
    private static final String WORK_DIR_PREFIX = "crosspress_epub_";

    private final AppProperties appProperties;

    /**
     * Checks that the input looks like a plausible EPUB: an existing .epub file of at least
     * the configured minimum size that opens as a ZIP archive. A missing or wrong mimetype
     * entry only produces a warning.
     */
    public List<ProcessingWarning> validate(Path input) {
        log.info("Validating input: {}", input);

        if (input == null || !Files.exists(input)) {
            throw EpubError.INVALID_INPUT.createException(input, "file not found");
        }
        if (!Files.isRegularFile(input)) {
            throw EpubError.INVALID_INPUT.createException(input, "not a regular file");
        }
        if (!ArchiveUtils.hasEpubExtension(input)) {
            throw EpubError.INVALID_INPUT.createException(input, "file must have the .epub extension");
        }

        long size = sizeOf(input);
        log.info("Input file size: {}", FileUtils.formatSize(size));
        long minSize = appProperties.getProcessor().getMinEpubSize();
        if (size < minSize) {
            throw EpubError.INVALID_INPUT.createException(input,
                    "file is too small (" + size + " bytes), possibly empty or corrupt");
        }
        if (!ArchiveUtils.isZip(input)) {
            throw EpubError.INVALID_INPUT.createException(input, "not a ZIP archive");
        }

        List<ProcessingWarning> warnings = new ArrayList<>();
        try (ZipFile zip = ZipFile.builder().setPath(input).get()) {
            List<ZipArchiveEntry> entries = Collections.list(zip.getEntries());
            log.debug("EPUB contains {} entries", entries.size());

            ZipArchiveEntry mimetype = zip.getEntry(ArchiveUtils.MIMETYPE_ENTRY);
            if (mimetype == null) {
                log.warn("EPUB missing 'mimetype' file - may be malformed");
                warnings.add(ProcessingWarning.of(WarningType.CONTAINER, "missing mimetype entry", input));
            } else {
                String content;
                try (InputStream in = zip.getInputStream(mimetype)) {
                    content = new String(in.readNBytes(256), StandardCharsets.US_ASCII).trim();
                }
                if (!ArchiveUtils.EPUB_MIMETYPE.equals(content)) {
                    log.warn("Unexpected mimetype content '{}'", content);
                    warnings.add(ProcessingWarning.of(WarningType.CONTAINER, "unexpected mimetype content: " + content, input));
                } else if (!entries.isEmpty() && !ArchiveUtils.MIMETYPE_ENTRY.equals(entries.get(0).getName())) {
                    log.warn("'mimetype' is not the first archive entry");
                    warnings.add(ProcessingWarning.of(WarningType.CONTAINER, "mimetype is not the first entry", input));
                }
            }
        } catch (IOException e) {
            throw EpubError.INVALID_INPUT.createException(e, input, "not a valid ZIP/EPUB: " + e.getMessage());
        }

        log.info("Input validation passed");
        return warnings;
    }

    /**
     * Validates the input and extracts it into a fresh temporary directory. The caller owns the
     * returned directory and must close it.
     */
    public WorkingDirectory extract(Path input) {
        List<ProcessingWarning> warnings = new ArrayList<>(validate(input));

        Path root;
        try {
            root = Files.createTempDirectory(WORK_DIR_PREFIX);
        } catch (IOException e) {
            throw EpubError.CONTAINER_IO_ERROR.createException(e, input, "cannot create working directory: " + e.getMessage());
        }

        try {
            int extracted = extractEntries(input, root, warnings);
            log.debug("Extracted {} files to: {}", extracted, root);
            return new WorkingDirectory(root, warnings);
        } catch (IOException e) {
            FileUtils.deleteDirectoryRecursively(root);
            throw EpubError.CONTAINER_IO_ERROR.createException(e, input, "extraction failed: " + e.getMessage());
        } catch (RuntimeException e) {
            FileUtils.deleteDirectoryRecursively(root);
            throw e;
        }
    }

    /**
     * Packs a directory tree into an EPUB. The mimetype entry is written first and stored,
     * every other file is deflated. The archive is assembled next to the output path and
     * moved into place, replacing any existing file.
     *
     * @return the size in bytes of the written EPUB
     */
    public long pack(Path sourceDirectory, Path outputPath) {
        return pack(sourceDirectory, outputPath, 0);
    }

    /**
     * Packs into a temp file next to the target and only moves it into place when it
     * reaches {@code minimumSize}, so an implausibly small archive never replaces anything.
     */
    public long pack(Path sourceDirectory, Path outputPath, long minimumSize) {
        log.debug("Creating EPUB: {}", outputPath);
        Path target = outputPath.toAbsolutePath();
        Path tempArchive = null;
        boolean moved = false;
        try {
            Files.createDirectories(target.getParent());
            tempArchive = Files.createTempFile(target.getParent(), ".epub_pack_", ".tmp");
            int fileCount = writeArchive(sourceDirectory, tempArchive);
            long packedSize = Files.size(tempArchive);
            if (packedSize < minimumSize) {
                throw EpubError.CONTAINER_IO_ERROR.createException(outputPath,
                        "output is only " + packedSize + " bytes, below the minimum plausible EPUB size");
            }
            FileUtils.replaceFileAtomic(tempArchive, target);
            moved = true;
            long size = Files.size(target);
            log.debug("Packed {} files into {} ({} bytes)", fileCount + 1, target, size);
            return size;
        } catch (IOException e) {
            throw EpubError.CONTAINER_IO_ERROR.createException(e, outputPath, "failed to create EPUB: " + e.getMessage());
        } finally {
            if (!moved && tempArchive != null) {
                try {
                    Files.deleteIfExists(tempArchive);
                } catch (IOException e) {
                    log.warn("Failed to delete temp file: {}", tempArchive, e);
                }
            }
        }
    }

    private int extractEntries(Path input, Path root, List<ProcessingWarning> warnings) throws IOException {
        int count = 0;
        try (ZipFile zip = ZipFile.builder().setPath(input).get()) {
            for (ZipArchiveEntry entry : Collections.list(zip.getEntries())) {
                String entryName = entry.getName();
                if (!ArchiveUtils.isPathSafe(entryName)) {
                    log.warn("Skipping unsafe ZIP entry name: {}", entryName);
                    warnings.add(ProcessingWarning.of(WarningType.CONTAINER, "skipped unsafe entry", entryName));
                    continue;
                }
                Path outputPath = root.resolve(entryName).normalize();
                if (!outputPath.startsWith(root)) {
                    log.warn("Skipping traversal entry outside working directory: {}", entryName);
                    warnings.add(ProcessingWarning.of(WarningType.CONTAINER, "skipped unsafe entry", entryName));
                    continue;
                }
                if (entry.isDirectory()) {
                    Files.createDirectories(outputPath);
                    continue;
                }
                if (!zip.canReadEntryData(entry)) {
                    throw new IOException("unsupported compression for entry " + entryName);
                }
                Files.createDirectories(outputPath.getParent());
                try (InputStream in = zip.getInputStream(entry);
                     OutputStream out = Files.newOutputStream(outputPath, StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING)) {
                    in.transferTo(out);
                }
                count++;
            }
        }
        return count;
    }

    private int writeArchive(Path sourceDirectory, Path archive) throws IOException {
        Path mimetypePath = sourceDirectory.resolve(ArchiveUtils.MIMETYPE_ENTRY);
        if (Files.isRegularFile(mimetypePath)
                && !ArchiveUtils.EPUB_MIMETYPE.equals(Files.readString(mimetypePath, StandardCharsets.US_ASCII).trim())) {
            log.warn("Replacing non-standard mimetype content in {}", mimetypePath);
        }

        List<Path> files;
        try (Stream<Path> walk = Files.walk(sourceDirectory)) {
            files = walk.filter(Files::isRegularFile)
                    .filter(p -> !p.equals(mimetypePath))
                    .sorted(Comparator.comparing((Path p) -> !FileUtils.toArchivePath(sourceDirectory, p).startsWith("META-INF/"))
                            .thenComparing(p -> FileUtils.toArchivePath(sourceDirectory, p)))
                    .toList();
        }

        try (ZipArchiveOutputStream zos = new ZipArchiveOutputStream(archive)) {
            zos.setLevel(Deflater.BEST_COMPRESSION);

            ZipArchiveEntry mimetype = new ZipArchiveEntry(ArchiveUtils.MIMETYPE_ENTRY);
            mimetype.setMethod(ZipArchiveEntry.STORED);
            mimetype.setSize(MIMETYPE_CONTENT.length);
            mimetype.setCompressedSize(MIMETYPE_CONTENT.length);
            CRC32 crc = new CRC32();
            crc.update(MIMETYPE_CONTENT);
            mimetype.setCrc(crc.getValue());
            zos.putArchiveEntry(mimetype);
            zos.write(MIMETYPE_CONTENT);
            zos.closeArchiveEntry();

            for (Path file : files) {
                ZipArchiveEntry entry = new ZipArchiveEntry(FileUtils.toArchivePath(sourceDirectory, file));
                entry.setMethod(ZipArchiveEntry.DEFLATED);
                entry.setTime(Files.getLastModifiedTime(file).toMillis());
                zos.putArchiveEntry(entry);
                try (InputStream in = Files.newInputStream(file)) {
                    in.transferTo(zos);
                }
                zos.closeArchiveEntry();
            }
            zos.finish();
        }
        return files.size();
    }

    private static long sizeOf(Path input) {
        try {
            return Files.size(input);
        } catch (IOException e) {
            throw EpubError.INVALID_INPUT.createException(e, input, "cannot read file size: " + e.getMessage());
        }
    }
}
