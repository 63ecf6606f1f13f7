package org.crosspress.service.navigation;

import lombok.extern.slf4j.Slf4j;
import org.crosspress.service.opf.PackageDocument;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.parser.Parser;
import org.jsoup.select.Elements;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * EPUB 3 navigation document. Parsed with jsoup's XML parser so the rewritten file stays
 * well-formed XHTML.
 */
@Slf4j
@Component
@Order(2)
public class NavDocumentLabelRewriter implements NavigationLabelRewriter {

    static final String DEFAULT_FILE_NAME = "nav.xhtml";

    @Override
    public String getName() {
        return "NAV";
    }

    @Override
    public Optional<Path> locate(PackageDocument pkg) {
        Path candidate = pkg.findFirstByProperty("nav")
                .map(pkg::resolve)
                .orElse(pkg.getDirectory().resolve(DEFAULT_FILE_NAME));
        return Files.isRegularFile(candidate) ? Optional.of(candidate) : Optional.empty();
    }

    @Override
    public NavigationRewriteResult rewrite(Path document, UnaryOperator<String> labelRewriter) throws NavigationRewriteException {
        log.debug("Processing NAV XHTML: {}", document);
        Document doc;
        try {
            doc = Jsoup.parse(Files.readString(document, StandardCharsets.UTF_8), "", Parser.xmlParser());
        } catch (IOException e) {
            throw new NavigationRewriteException(document, "unreadable nav document: " + e.getMessage(), e);
        }
        doc.outputSettings().prettyPrint(false);

        Elements navs = doc.select("nav");
        if (navs.isEmpty()) {
            throw new NavigationRewriteException(document, "no nav element found", null);
        }

        NavigationRewriteResult result = new NavigationRewriteResult();
        for (Element anchor : navs.select("a")) {
            if (!anchor.children().isEmpty()) {
                continue;
            }
            String original = anchor.wholeText();
            if (original.isBlank()) {
                continue;
            }
            result.setLabelsSeen(result.getLabelsSeen() + 1);
            String shortened = labelRewriter.apply(original);
            if (!original.equals(shortened)) {
                anchor.text(shortened);
                result.setLabelsRewritten(result.getLabelsRewritten() + 1);
                log.debug("  '{}' -> '{}'", original, shortened);
            }
        }

        Element toc = navs.select("nav[epub:type=toc]").first();
        Element tocList = (toc != null ? toc : navs.first()).selectFirst("ol");
        if (tocList != null) {
            for (Element item : tocList.children()) {
                if ("li".equals(item.normalName()) && item.selectFirst("ol") != null) {
                    Element label = item.children().stream()
                            .filter(child -> "a".equals(child.normalName()) || "span".equals(child.normalName()))
                            .findFirst()
                            .orElse(null);
                    if (label != null && !label.text().isBlank()) {
                        result.getSections().add(label.text().trim());
                    }
                }
            }
        }

        if (result.getLabelsRewritten() > 0) {
            try {
                Files.writeString(document, doc.outerHtml(), StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw new NavigationRewriteException(document, "cannot write nav document: " + e.getMessage(), e);
            }
        }
        log.info("  NAV XHTML processed, {} entries modified", result.getLabelsRewritten());
        return result;
    }
}
