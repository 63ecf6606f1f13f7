package org.crosspress.util;

import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Comparator;
import java.util.Locale;
import java.util.stream.Stream;

@UtilityClass
@Slf4j
public class FileUtils {

    public String toArchivePath(Path root, Path file) {
        return root.relativize(file).toString().replace("\\", "/");
    }

    public String formatSize(long bytes) {
        return String.format(Locale.US, "%,d bytes (%.2f MB)", bytes, bytes / 1024.0 / 1024.0);
    }

    public void replaceFileAtomic(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.debug("Atomic move not supported for {}, falling back to a replacing move", target);
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    /**
     * Deletes a directory tree. Failures are logged per path so that a single locked
     * file does not keep the rest of the tree on disk.
     *
     * @return true if the directory no longer exists
     */
    public boolean deleteDirectoryRecursively(Path directory) {
        if (directory == null || !Files.exists(directory)) {
            return true;
        }
        try (Stream<Path> pathStream = Files.walk(directory)) {
            pathStream
                    .sorted(Comparator.reverseOrder())
                    .forEach(path -> {
                        try {
                            Files.delete(path);
                        } catch (IOException e) {
                            log.warn("Failed to delete temp file/directory: {}", path, e);
                        }
                    });
        } catch (IOException e) {
            log.warn("Failed to clean up temporary directory: {}", directory, e);
        }
        return !Files.exists(directory);
    }
}
