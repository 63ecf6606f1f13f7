package org.crosspress.service.navigation;

import lombok.extern.slf4j.Slf4j;
import org.crosspress.service.opf.ManifestItem;
import org.crosspress.service.opf.PackageDocument;
import org.crosspress.util.SecureXmlUtils;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

@Slf4j
@Component
@Order(1)
public class NcxLabelRewriter implements NavigationLabelRewriter {

    static final String NCX_NS = "http://www.daisy.org/z3986/2005/ncx/";
    static final String NCX_MEDIA_TYPE = "application/x-dtbncx+xml";
    static final String DEFAULT_FILE_NAME = "toc.ncx";

    @Override
    public String getName() {
        return "NCX";
    }

    @Override
    public Optional<Path> locate(PackageDocument pkg) {
        Optional<ManifestItem> item = pkg.getTocId()
                .flatMap(pkg::getManifestItem)
                .or(() -> pkg.findFirstByMediaType(NCX_MEDIA_TYPE));
        Path candidate = item.map(pkg::resolve).orElse(pkg.getDirectory().resolve(DEFAULT_FILE_NAME));
        return Files.isRegularFile(candidate) ? Optional.of(candidate) : Optional.empty();
    }

    @Override
    public NavigationRewriteResult rewrite(Path document, UnaryOperator<String> labelRewriter) throws NavigationRewriteException {
        log.debug("Processing TOC NCX: {}", document);
        Document doc;
        try (InputStream in = Files.newInputStream(document)) {
            doc = SecureXmlUtils.createDoctypeTolerantDocumentBuilder(true).parse(in);
        } catch (Exception e) {
            throw new NavigationRewriteException(document, "unparsable NCX: " + e.getMessage(), e);
        }

        NavigationRewriteResult result = new NavigationRewriteResult();
        for (Element text : elements(doc, "text")) {
            Node parent = text.getParentNode();
            if (!(parent instanceof Element label) || !"navLabel".equals(label.getLocalName())) {
                continue;
            }
            String original = text.getTextContent();
            if (original == null || original.isEmpty()) {
                continue;
            }
            result.setLabelsSeen(result.getLabelsSeen() + 1);
            String shortened = labelRewriter.apply(original);
            if (!original.equals(shortened)) {
                text.setTextContent(shortened);
                result.setLabelsRewritten(result.getLabelsRewritten() + 1);
                log.debug("  '{}' -> '{}'", original, shortened);
            }
        }
        result.setSections(findSections(doc));

        if (result.getLabelsRewritten() > 0) {
            try {
                Files.write(document, SecureXmlUtils.serialize(doc));
            } catch (Exception e) {
                throw new NavigationRewriteException(document, "cannot write NCX: " + e.getMessage(), e);
            }
        }
        log.info("  Modified {} TOC entries", result.getLabelsRewritten());
        return result;
    }

    private static List<String> findSections(Document doc) {
        List<String> sections = new ArrayList<>();
        for (Element navMap : elements(doc, "navMap")) {
            for (Element navPoint : children(navMap, "navPoint")) {
                if (children(navPoint, "navPoint").isEmpty()) {
                    continue;
                }
                children(navPoint, "navLabel").stream()
                        .flatMap(label -> children(label, "text").stream())
                        .map(Element::getTextContent)
                        .filter(text -> text != null && !text.isBlank())
                        .findFirst()
                        .ifPresent(text -> sections.add(text.trim()));
            }
        }
        return sections;
    }

    private static List<Element> elements(Document doc, String localName) {
        NodeList nodes = doc.getElementsByTagNameNS(NCX_NS, localName);
        if (nodes.getLength() == 0) {
            nodes = doc.getElementsByTagNameNS("*", localName);
        }
        List<Element> result = new ArrayList<>(nodes.getLength());
        for (int i = 0; i < nodes.getLength(); i++) {
            result.add((Element) nodes.item(i));
        }
        return result;
    }

    private static List<Element> children(Element parent, String localName) {
        List<Element> result = new ArrayList<>();
        NodeList nodes = parent.getChildNodes();
        for (int i = 0; i < nodes.getLength(); i++) {
            if (nodes.item(i) instanceof Element el && localName.equals(el.getLocalName())) {
                result.add(el);
            }
        }
        return result;
    }
}
