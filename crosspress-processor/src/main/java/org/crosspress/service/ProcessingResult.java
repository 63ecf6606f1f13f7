package org.crosspress.service;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.crosspress.exception.ProcessingWarning;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProcessingResult {
    private Path outputPath;
    private long inputSize;
    private long outputSize;
    private Duration duration;
    private int spineEntriesRemoved;
    private int articleCount;
    private int imagesRemoved;
    private int manifestItemsRemoved;
    private int labelsRewritten;
    private boolean stylesheetReplaced;

    @Builder.Default
    private List<ProcessingWarning> warnings = new ArrayList<>();

    public boolean hasWarnings() {
        return warnings != null && !warnings.isEmpty();
    }
}
