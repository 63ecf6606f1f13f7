package org.crosspress.service.diagnostics;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.crosspress.config.AppProperties;
import org.crosspress.exception.EpubError;
import org.crosspress.service.opf.ManifestItem;
import org.crosspress.service.opf.PackageDocument;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class DiagnosticsService {

    public static final String DIAGNOSTICS_FILE = "_diagnostics.json";
    public static final String DIAGNOSTICS_ID = "diagnostics";
    static final String JSON_MEDIA_TYPE = "application/json";

    private static final DateTimeFormatter BUILD_TIME_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss'Z'").withZone(ZoneOffset.UTC);

    private final ObjectMapper objectMapper;
    private final AppProperties appProperties;
    private final Clock clock;

    public DiagnosticsRecord create(Path input, Path output, Instant startedAt, int articleCount, List<String> sections) {
        AppProperties.Diagnostics settings = appProperties.getDiagnostics();
        Instant now = clock.instant();
        return DiagnosticsRecord.builder()
                .buildTime(BUILD_TIME_FORMAT.format(now))
                .workflowRunId(settings.getWorkflowRunId())
                .gitSha(settings.getGitSha())
                .inputFile(input.getFileName().toString())
                .outputFile(output.getFileName().toString())
                .rawSizeBytes(sizeOf(input))
                .processingTimeMs(Math.max(0, Duration.between(startedAt, now).toMillis()))
                .debugMode(settings.isDebug())
                .runtimeVersion("Java " + Runtime.version())
                .sectionsFound(List.copyOf(sections))
                .articleCount(articleCount)
                .build();
    }

    /**
     * Writes the record next to the package document and registers it in the manifest.
     * The resource is never added to the spine.
     */
    public Path embed(PackageDocument pkg, DiagnosticsRecord diagnostics) {
        Path target = pkg.getDirectory().resolve(DIAGNOSTICS_FILE);
        try {
            String json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(diagnostics);
            log.debug("Diagnostic manifest: {}", json);
            Files.writeString(target, json, StandardCharsets.UTF_8);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Diagnostics record is not serializable", e);
        } catch (IOException e) {
            throw EpubError.CONTAINER_IO_ERROR.createException(e, target, "cannot write diagnostics: " + e.getMessage());
        }

        pkg.removeManifestItemsIf(item -> DIAGNOSTICS_FILE.equals(item.getHref()));
        String id = pkg.uniqueId(DIAGNOSTICS_ID);
        pkg.addManifestItem(ManifestItem.builder()
                .id(id)
                .href(DIAGNOSTICS_FILE)
                .mediaType(JSON_MEDIA_TYPE)
                .build());
        return target;
    }

    private static long sizeOf(Path file) {
        try {
            return Files.exists(file) ? Files.size(file) : 0L;
        } catch (IOException e) {
            log.debug("Cannot read size of {}: {}", file, e.getMessage());
            return 0L;
        }
    }
}
