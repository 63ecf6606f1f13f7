package org.crosspress.exception;

import lombok.Getter;

@Getter
public class EpubProcessingException extends RuntimeException {

    private final EpubError error;

    public EpubProcessingException(EpubError error, String message, Throwable cause) {
        super(message, cause);
        this.error = error;
    }

    public int getExitCode() {
        return error.getExitCode();
    }
}
