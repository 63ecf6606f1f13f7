package org.crosspress.exception;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A non-fatal condition met during processing. Warnings never abort the pipeline,
 * they are collected into the result and logged by the orchestrator.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProcessingWarning {
    private WarningType type;
    private String message;
    private String path;

    public static ProcessingWarning of(WarningType type, String message, Object path) {
        return new ProcessingWarning(type, message, path == null ? null : path.toString());
    }

    @Override
    public String toString() {
        return path == null ? type + ": " + message : type + ": " + message + " [" + path + "]";
    }
}
