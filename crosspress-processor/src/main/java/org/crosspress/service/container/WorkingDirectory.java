package org.crosspress.service.container;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.crosspress.exception.ProcessingWarning;
import org.crosspress.util.FileUtils;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Temporary directory holding one extracted EPUB. Closing it removes the whole tree.
 */
@Slf4j
public class WorkingDirectory implements AutoCloseable {

    @Getter
    private final Path root;
    private final List<ProcessingWarning> warnings;
    private boolean closed;

    public WorkingDirectory(Path root, List<ProcessingWarning> warnings) {
        this.root = root;
        this.warnings = new ArrayList<>(warnings);
    }

    public List<ProcessingWarning> getWarnings() {
        return Collections.unmodifiableList(warnings);
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        if (FileUtils.deleteDirectoryRecursively(root)) {
            log.debug("Removed working directory {}", root);
        } else {
            log.warn("Working directory {} could not be fully removed", root);
        }
    }
}
