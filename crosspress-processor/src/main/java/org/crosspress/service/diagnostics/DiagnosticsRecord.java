package org.crosspress.service.diagnostics;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class DiagnosticsRecord {
    private String buildTime;
    private String workflowRunId;
    private String gitSha;
    private String inputFile;
    private String outputFile;
    private long rawSizeBytes;
    private long processingTimeMs;
    private boolean debugMode;
    private String runtimeVersion;
    @Builder.Default
    private List<String> sectionsFound = new ArrayList<>();
    private int articleCount;
}
