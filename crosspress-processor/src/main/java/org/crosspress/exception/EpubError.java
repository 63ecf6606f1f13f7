package org.crosspress.exception;

import lombok.Getter;

@Getter
public enum EpubError {
    INVALID_INPUT(2, "Invalid input EPUB %s: %s"),
    MALFORMED_PACKAGE(3, "Malformed package document %s: %s"),
    CONTAINER_IO_ERROR(4, "Container I/O failure for %s: %s");

    private final int exitCode;
    private final String message;

    EpubError(int exitCode, String message) {
        this.exitCode = exitCode;
        this.message = message;
    }

    public EpubProcessingException createException(Object... details) {
        return new EpubProcessingException(this, String.format(message, details), null);
    }

    public EpubProcessingException createException(Throwable cause, Object... details) {
        return new EpubProcessingException(this, String.format(message, details), cause);
    }
}
