package org.crosspress.service.media;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FilenameUtils;
import org.apache.commons.lang3.StringUtils;
import org.crosspress.exception.EpubError;
import org.crosspress.exception.ProcessingWarning;
import org.crosspress.exception.WarningType;
import org.crosspress.service.opf.ManifestItem;
import org.crosspress.service.opf.PackageDocument;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.parser.Parser;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Removes images the target device cannot render: the files themselves, their manifest
 * entries and the markup that references them. Anything named like a cover is kept so
 * the book still shows a cover in other readers.
 */
@Slf4j
@Service
public class MediaStripper {

    static final Set<String> IMAGE_EXTENSIONS = Set.of("jpg", "jpeg", "png", "gif", "svg", "webp");
    private static final Set<String> MARKUP_EXTENSIONS = Set.of("html", "xhtml");
    private static final String COVER_MARKER = "cover";
    private static final String IMAGE_REFERENCES = "img, image, svg|image";
    private static final String XHTML_NS = "http://www.w3.org/1999/xhtml";
    private static final Pattern HTML_ROOT = Pattern.compile("<html\\b[^>]*>", Pattern.CASE_INSENSITIVE);

    public MediaStripResult stripImages(Path rootDir, PackageDocument pkg) {
        MediaStripResult result = new MediaStripResult();

        List<Path> files = listFiles(rootDir);
        for (Path file : files) {
            if (isStrippableImage(file)) {
                try {
                    Files.delete(file);
                    result.setFilesRemoved(result.getFilesRemoved() + 1);
                    log.debug("  Removed: {}", file.getFileName());
                } catch (IOException e) {
                    log.warn("  Failed to remove {}: {}", file, e.getMessage());
                    result.setFailedDeletions(result.getFailedDeletions() + 1);
                    result.getWarnings().add(ProcessingWarning.of(WarningType.MEDIA, "could not delete image: " + e.getMessage(), file));
                }
            }
        }

        List<ManifestItem> removed = pkg.removeManifestItemsIf(item -> item.isImage() && !isCover(item.getHref()));
        removed.forEach(item -> log.debug("  Dropped manifest item {} ({})", item.getId(), item.getHref()));
        result.setManifestItemsRemoved(removed.size());

        for (Path file : files) {
            if (isMarkup(file) && Files.isRegularFile(file)) {
                try {
                    int elementsRemoved = stripImageReferences(file);
                    if (elementsRemoved > 0) {
                        result.setMarkupFilesRewritten(result.getMarkupFilesRewritten() + 1);
                        result.setMarkupElementsRemoved(result.getMarkupElementsRemoved() + elementsRemoved);
                    }
                } catch (IOException e) {
                    log.warn("Failed to process {}: {}", file, e.getMessage());
                    result.getWarnings().add(ProcessingWarning.of(WarningType.MEDIA, "could not strip image markup: " + e.getMessage(), file));
                }
            }
        }

        log.debug("Media strip: {} files removed, {} manifest items dropped, {} markup files rewritten",
                result.getFilesRemoved(), result.getManifestItemsRemoved(), result.getMarkupFilesRewritten());
        return result;
    }

    /**
     * Removes image references and the wrappers they leave empty from one markup file.
     * The file is only rewritten when something was removed.
     *
     * @return number of elements removed
     */
    int stripImageReferences(Path file) throws IOException {
        String content = Files.readString(file, StandardCharsets.UTF_8);
        Document doc;
        if (isXmlMarkup(file, content)) {
            doc = Jsoup.parse(content, "", Parser.xmlParser());
        } else {
            doc = Jsoup.parse(content);
            doc.outputSettings().syntax(Document.OutputSettings.Syntax.xml);
        }
        doc.outputSettings().prettyPrint(false);

        int removed = 0;
        for (Element image : doc.select(IMAGE_REFERENCES)) {
            if (!isCover(imageSource(image))) {
                image.remove();
                removed++;
            }
        }
        if (removed == 0) {
            return 0;
        }

        int wrappersRemoved;
        do {
            wrappersRemoved = 0;
            for (Element wrapper : doc.select("svg, figure, [class*=img]")) {
                if (wrapper.parent() != null && isEmpty(wrapper)) {
                    wrapper.remove();
                    wrappersRemoved++;
                }
            }
            removed += wrappersRemoved;
        } while (wrappersRemoved > 0);

        Files.writeString(file, doc.outerHtml(), StandardCharsets.UTF_8);
        log.debug("  Stripped {} image elements from {}", removed, file.getFileName());
        return removed;
    }

    private static List<Path> listFiles(Path rootDir) {
        try (Stream<Path> walk = Files.walk(rootDir)) {
            return walk.filter(Files::isRegularFile).sorted().toList();
        } catch (IOException e) {
            throw EpubError.CONTAINER_IO_ERROR.createException(e, rootDir, "cannot list working directory: " + e.getMessage());
        }
    }

    static boolean isStrippableImage(Path file) {
        String name = file.getFileName().toString();
        String extension = FilenameUtils.getExtension(name).toLowerCase(Locale.ROOT);
        return IMAGE_EXTENSIONS.contains(extension) && !isCover(name);
    }

    /**
     * XHTML is often shipped under an .html name, so an XML declaration or the XHTML
     * namespace on the root element selects the XML parser regardless of extension.
     */
    static boolean isXmlMarkup(Path file, String content) {
        if ("xhtml".equalsIgnoreCase(FilenameUtils.getExtension(file.getFileName().toString()))) {
            return true;
        }
        String head = StringUtils.stripStart(StringUtils.removeStart(content, "\uFEFF"), null);
        if (head.startsWith("<?xml")) {
            return true;
        }
        Matcher root = HTML_ROOT.matcher(head);
        return root.find() && root.group().contains(XHTML_NS);
    }

    private static boolean isMarkup(Path file) {
        String extension = FilenameUtils.getExtension(file.getFileName().toString()).toLowerCase(Locale.ROOT);
        return MARKUP_EXTENSIONS.contains(extension);
    }

    private static boolean isCover(String reference) {
        return reference != null && reference.toLowerCase(Locale.ROOT).contains(COVER_MARKER);
    }

    private static String imageSource(Element image) {
        if (image.hasAttr("src")) return image.attr("src");
        if (image.hasAttr("xlink:href")) return image.attr("xlink:href");
        if (image.hasAttr("href")) return image.attr("href");
        return null;
    }

    private static boolean isEmpty(Element element) {
        return element.children().isEmpty() && element.text().isBlank();
    }
}
