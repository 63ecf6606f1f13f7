package org.crosspress.util;

import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

@Slf4j
@UtilityClass
public class ArchiveUtils {

    public static final String MIMETYPE_ENTRY = "mimetype";
    public static final String EPUB_MIMETYPE = "application/epub+zip";
    public static final String CONTAINER_ENTRY = "META-INF/container.xml";

    private static final byte[] ZIP_MAGIC = {0x50, 0x4B, 0x03, 0x04};
    // Empty archive: end of central directory record only
    private static final byte[] ZIP_EMPTY_MAGIC = {0x50, 0x4B, 0x05, 0x06};

    public static boolean isZip(Path file) {
        if (file == null || !Files.isRegularFile(file)) {
            return false;
        }

        try (InputStream is = new BufferedInputStream(Files.newInputStream(file))) {
            byte[] buffer = new byte[4];
            int bytesRead = is.readNBytes(buffer, 0, buffer.length);
            if (bytesRead < 4) {
                return false;
            }
            return startsWith(buffer, ZIP_MAGIC) || startsWith(buffer, ZIP_EMPTY_MAGIC);
        } catch (IOException e) {
            log.warn("Failed to detect archive type by content for file: {}", file.toAbsolutePath());
            return false;
        }
    }

    public static boolean hasEpubExtension(Path file) {
        if (file == null || file.getFileName() == null) {
            return false;
        }
        return file.getFileName().toString().toLowerCase().endsWith(".epub");
    }

    public static boolean isPathSafe(String entryName) {
        if (entryName == null || entryName.isBlank()) return false;
        String normalized = entryName.replace('\\', '/');
        if (normalized.startsWith("/")) return false;
        if (normalized.contains("../") || normalized.equals("..") || normalized.endsWith("/..")) return false;
        if (normalized.contains("\0")) return false;
        return true;
    }

    private static boolean startsWith(byte[] buffer, byte[] magic) {
        if (buffer.length < magic.length) {
            return false;
        }
        for (int i = 0; i < magic.length; i++) {
            if (buffer[i] != magic[i]) {
                return false;
            }
        }
        return true;
    }
}
