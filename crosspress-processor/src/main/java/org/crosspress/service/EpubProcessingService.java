package org.crosspress.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.crosspress.config.AppProperties;
import org.crosspress.exception.EpubError;
import org.crosspress.exception.ProcessingWarning;
import org.crosspress.exception.WarningType;
import org.crosspress.service.container.EpubContainerService;
import org.crosspress.service.container.WorkingDirectory;
import org.crosspress.service.diagnostics.DiagnosticsRecord;
import org.crosspress.service.diagnostics.DiagnosticsService;
import org.crosspress.service.media.MediaStripResult;
import org.crosspress.service.media.MediaStripper;
import org.crosspress.service.navigation.NavigationRewriteService;
import org.crosspress.service.opf.PackageDocument;
import org.crosspress.service.opf.PackageDocumentService;
import org.crosspress.service.stylesheet.StylesheetService;
import org.crosspress.util.FileUtils;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Rewrites one EPUB for the e-ink reader: validate, extract, parse the package, trim the
 * spine, strip images, replace the stylesheet, shorten navigation titles, embed
 * diagnostics, then write the package back and repack.
 * <p>
 * Input, extraction and package failures abort with an {@link org.crosspress.exception.EpubProcessingException}
 * and no output is written. Everything else degrades to a warning on the result. The
 * working directory is removed on every path out.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EpubProcessingService {

    private static final String RULE = "=".repeat(60);

    private final AppProperties appProperties;
    private final EpubContainerService containerService;
    private final PackageDocumentService packageDocumentService;
    private final MediaStripper mediaStripper;
    private final StylesheetService stylesheetService;
    private final NavigationRewriteService navigationRewriteService;
    private final DiagnosticsService diagnosticsService;
    private final Clock clock;

    public ProcessingResult process(Path input, Path output) {
        Instant startedAt = clock.instant();
        log.info(RULE);
        log.info("EPUB post-processor");
        log.info(RULE);

        AppProperties.Processor settings = appProperties.getProcessor();
        List<ProcessingWarning> warnings = new ArrayList<>();
        ProcessingResult.ProcessingResultBuilder result = ProcessingResult.builder();

        try (WorkingDirectory workDir = containerService.extract(input)) {
            warnings.addAll(workDir.getWarnings());
            Path target = prepareOutput(output);
            result.outputPath(target);
            log.info("Processing: {}", input);
            log.info("Output: {}", target);
            log.info("Extracted EPUB to {}", workDir.getRoot());
            long inputSize = Files.size(input);
            result.inputSize(inputSize);

            Path opfPath = packageDocumentService.locatePackageDocument(workDir.getRoot());
            log.info("Parsing {}...", opfPath.getFileName());
            PackageDocument pkg = packageDocumentService.parse(opfPath);

            int spineSize = pkg.getSpine().size();
            log.info("Found {} spine items", spineSize);
            int trimCount = settings.getLeadingSpineEntries();
            int articleCount = Math.max(0, spineSize - trimCount);
            result.articleCount(articleCount);

            log.info("Removing first {} pages from spine...", trimCount);
            List<String> removed = pkg.removeLeadingSpineEntries(trimCount);
            for (int i = 0; i < removed.size(); i++) {
                log.debug("  Removing spine item {}: {}", i, removed.get(i));
            }
            if (trimCount > 0 && spineSize <= trimCount) {
                log.warn("Spine has only {} entries, expected more than {}; reading order is now empty", spineSize, trimCount);
                warnings.add(ProcessingWarning.of(WarningType.SPINE,
                        "spine had " + spineSize + " entries, " + trimCount + " leading entries requested", opfPath));
            }
            result.spineEntriesRemoved(removed.size());

            log.info("Stripping images...");
            MediaStripResult media = mediaStripper.stripImages(workDir.getRoot(), pkg);
            warnings.addAll(media.getWarnings());
            log.info("  Removed {} images", media.getFilesRemoved());
            result.imagesRemoved(media.getFilesRemoved());
            result.manifestItemsRemoved(media.getManifestItemsRemoved());

            result.stylesheetReplaced(stylesheetService.replaceStylesheet(pkg, warnings));

            log.info("Processing TOC titles...");
            NavigationRewriteService.NavigationOutcome navigation =
                    navigationRewriteService.rewriteLabels(pkg, settings.getMaxTitleLength(), warnings);
            result.labelsRewritten(navigation.labelsRewritten());

            log.info("Adding diagnostic manifest...");
            DiagnosticsRecord diagnostics = diagnosticsService.create(input, target, startedAt, articleCount, navigation.sections());
            diagnosticsService.embed(pkg, diagnostics);

            log.info("Saving modified {}...", opfPath.getFileName());
            packageDocumentService.write(pkg);

            log.info("Repackaging EPUB...");
            long outputSize = containerService.pack(workDir.getRoot(), target, settings.getMinEpubSize());
            result.outputSize(outputSize);
        } catch (IOException e) {
            throw EpubError.CONTAINER_IO_ERROR.createException(e, input, e.getMessage());
        }

        Duration duration = Duration.between(startedAt, clock.instant());
        ProcessingResult processingResult = result.duration(duration).warnings(List.copyOf(warnings)).build();
        logSummary(processingResult);
        return processingResult;
    }

    /**
     * Creates missing parent directories and checks that the output directory accepts new files.
     */
    Path prepareOutput(Path output) {
        Path target = output.toAbsolutePath().normalize();
        Path parent = target.getParent();
        log.info("Validating output path: {}", target);
        try {
            if (!Files.exists(parent)) {
                log.info("Creating output directory: {}", parent);
                Files.createDirectories(parent);
            }
            Path probe = Files.createTempFile(parent, ".write_test_", ".tmp");
            Files.delete(probe);
        } catch (IOException e) {
            throw EpubError.CONTAINER_IO_ERROR.createException(e, parent, "cannot write to output directory: " + e.getMessage());
        }
        log.info("Output path validation passed");
        return target;
    }

    private void logSummary(ProcessingResult result) {
        log.info(RULE);
        log.info("Processing complete!");
        log.info(RULE);
        log.info("Output: {}", result.getOutputPath());
        log.info("Size: {}", FileUtils.formatSize(result.getOutputSize()));
        log.info("Processing time: {} ms", result.getDuration().toMillis());
        if (result.hasWarnings()) {
            log.warn("Completed with {} warning(s):", result.getWarnings().size());
            result.getWarnings().forEach(warning -> log.warn("  {}", warning));
        }
    }
}
