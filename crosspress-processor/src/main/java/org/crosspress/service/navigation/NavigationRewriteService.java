package org.crosspress.service.navigation;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.crosspress.exception.ProcessingWarning;
import org.crosspress.exception.WarningType;
import org.crosspress.service.opf.PackageDocument;
import org.crosspress.service.title.TitleShortener;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Runs every navigation rewriter whose document is present. A document that cannot be
 * processed is left as it was and reported as a warning; the other documents are still
 * rewritten.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class NavigationRewriteService {

    private final List<NavigationLabelRewriter> rewriters;
    private final TitleShortener titleShortener;

    public NavigationOutcome rewriteLabels(PackageDocument pkg, int maxTitleLength, List<ProcessingWarning> warnings) {
        int rewritten = 0;
        int processed = 0;
        Set<String> sections = new LinkedHashSet<>();

        for (NavigationLabelRewriter rewriter : rewriters) {
            Optional<Path> document = rewriter.locate(pkg);
            if (document.isEmpty()) {
                log.debug("No {} document in package, skipping", rewriter.getName());
                continue;
            }
            try {
                NavigationRewriteResult result = rewriter.rewrite(document.get(), title -> titleShortener.shorten(title, maxTitleLength));
                rewritten += result.getLabelsRewritten();
                sections.addAll(result.getSections());
                processed++;
            } catch (NavigationRewriteException e) {
                log.error("Failed to process {} document: {}", rewriter.getName(), e.getMessage());
                log.warn("Continuing without {} modifications", rewriter.getName());
                warnings.add(ProcessingWarning.of(WarningType.NAVIGATION, e.getMessage(), document.get()));
            }
        }

        return new NavigationOutcome(processed, rewritten, List.copyOf(sections));
    }

    public record NavigationOutcome(int documentsProcessed, int labelsRewritten, List<String> sections) {
    }
}
