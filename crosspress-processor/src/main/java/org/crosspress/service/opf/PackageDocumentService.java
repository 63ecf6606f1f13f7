package org.crosspress.service.opf;

import lombok.extern.slf4j.Slf4j;
import org.crosspress.exception.EpubError;
import org.crosspress.util.ArchiveUtils;
import org.crosspress.util.SecureXmlUtils;
import org.springframework.stereotype.Service;
import org.w3c.dom.Attr;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NamedNodeMap;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

import javax.xml.parsers.DocumentBuilder;
import javax.xml.transform.TransformerException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

@Slf4j
@Service
public class PackageDocumentService {

    public static final String OPF_NS = "http://www.idpf.org/2007/opf";
    private static final String CONTAINER_NS = "urn:oasis:names:tc:opendocument:xmlns:container";

    private static final String DEFAULT_CHILD_INDENT = "\n    ";
    private static final String DEFAULT_CLOSING_INDENT = "\n  ";

    /**
     * Finds the package document of an extracted EPUB. The rootfile declared in
     * META-INF/container.xml wins; without a usable container document the first
     * .opf file in the tree is taken.
     */
    public Path locatePackageDocument(Path root) {
        Optional<Path> declared = readContainerRootfile(root);
        if (declared.isPresent()) {
            log.debug("Found OPF via container.xml at: {}", declared.get());
            return declared.get();
        }

        try (Stream<Path> files = Files.walk(root)) {
            return files
                    .filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().toLowerCase().endsWith(".opf"))
                    .min(Comparator.comparingInt(Path::getNameCount).thenComparing(Path::toString))
                    .orElseThrow(() -> EpubError.MALFORMED_PACKAGE.createException(root, "no .opf file found in EPUB"));
        } catch (IOException e) {
            throw EpubError.CONTAINER_IO_ERROR.createException(e, root, e.getMessage());
        }
    }

    public PackageDocument parse(Path opfPath) {
        log.debug("Parsing package document: {}", opfPath);
        Document doc;
        try (InputStream in = Files.newInputStream(opfPath)) {
            DocumentBuilder builder = SecureXmlUtils.createDoctypeTolerantDocumentBuilder(true);
            doc = builder.parse(in);
        } catch (IOException e) {
            throw EpubError.CONTAINER_IO_ERROR.createException(e, opfPath, e.getMessage());
        } catch (Exception e) {
            throw EpubError.MALFORMED_PACKAGE.createException(e, opfPath, e.getMessage());
        }

        Element manifestElement = firstElement(doc, "manifest")
                .orElseThrow(() -> EpubError.MALFORMED_PACKAGE.createException(opfPath, "no manifest element"));
        Element spineElement = firstElement(doc, "spine")
                .orElseThrow(() -> EpubError.MALFORMED_PACKAGE.createException(opfPath, "no spine element"));

        PackageDocument pkg = new PackageDocument(opfPath, doc, manifestElement, spineElement);

        for (Element item : childElements(manifestElement, "item")) {
            String id = item.getAttribute("id");
            if (id.isEmpty()) {
                log.warn("Skipping manifest item without id (href={})", item.getAttribute("href"));
                continue;
            }
            pkg.addManifestItem(ManifestItem.builder()
                    .id(id)
                    .href(item.getAttribute("href"))
                    .mediaType(item.getAttribute("media-type"))
                    .properties(item.hasAttribute("properties") ? item.getAttribute("properties") : null)
                    .attributes(remainingAttributes(item, "id", "href", "media-type", "properties"))
                    .build());
        }

        for (Element itemref : childElements(spineElement, "itemref")) {
            String idref = itemref.getAttribute("idref");
            if (pkg.getManifestItem(idref).isEmpty()) {
                throw EpubError.MALFORMED_PACKAGE.createException(opfPath,
                        "spine entry '" + idref + "' does not resolve in the manifest");
            }
            pkg.appendSpineEntry(SpineEntry.builder()
                    .idref(idref)
                    .attributes(remainingAttributes(itemref, "idref"))
                    .build());
        }

        log.debug("Parsed {} manifest items and {} spine entries", pkg.getManifestItems().size(), pkg.getSpine().size());
        return pkg;
    }

    public byte[] serialize(PackageDocument pkg) {
        Document doc = pkg.getDocument();
        Element manifestElement = pkg.getManifestElement();
        Element spineElement = pkg.getSpineElement();

        String manifestIndent = childIndent(manifestElement);
        String manifestClosing = closingIndent(manifestElement);
        String spineIndent = childIndent(spineElement);
        String spineClosing = closingIndent(spineElement);

        clearChildren(manifestElement);
        for (ManifestItem item : pkg.getManifestItems()) {
            Element element = createSibling(doc, manifestElement, "item");
            element.setAttribute("id", item.getId());
            element.setAttribute("href", item.getHref());
            element.setAttribute("media-type", item.getMediaType());
            if (item.getProperties() != null) {
                element.setAttribute("properties", item.getProperties());
            }
            item.getAttributes().forEach(element::setAttribute);
            manifestElement.appendChild(doc.createTextNode(manifestIndent));
            manifestElement.appendChild(element);
        }
        manifestElement.appendChild(doc.createTextNode(manifestClosing));

        clearChildren(spineElement);
        for (SpineEntry entry : pkg.getSpine()) {
            Element element = createSibling(doc, spineElement, "itemref");
            element.setAttribute("idref", entry.getIdref());
            entry.getAttributes().forEach(element::setAttribute);
            spineElement.appendChild(doc.createTextNode(spineIndent));
            spineElement.appendChild(element);
        }
        if (!pkg.getSpine().isEmpty()) {
            spineElement.appendChild(doc.createTextNode(spineClosing));
        }

        try {
            return SecureXmlUtils.serialize(doc);
        } catch (TransformerException e) {
            throw EpubError.MALFORMED_PACKAGE.createException(e, pkg.getPath(), "serialization failed: " + e.getMessage());
        }
    }

    public void write(PackageDocument pkg) {
        byte[] content = serialize(pkg);
        try {
            Files.write(pkg.getPath(), content);
            log.debug("Wrote package document {} ({} bytes)", pkg.getPath(), content.length);
        } catch (IOException e) {
            throw EpubError.CONTAINER_IO_ERROR.createException(e, pkg.getPath(), e.getMessage());
        }
    }

    private Optional<Path> readContainerRootfile(Path root) {
        Path containerPath = root.resolve(ArchiveUtils.CONTAINER_ENTRY);
        if (!Files.isRegularFile(containerPath)) {
            log.debug("No container.xml in {}", root);
            return Optional.empty();
        }
        try (InputStream in = Files.newInputStream(containerPath)) {
            Document containerDoc = SecureXmlUtils.createSecureDocumentBuilder(true).parse(in);
            NodeList rootfiles = containerDoc.getElementsByTagNameNS(CONTAINER_NS, "rootfile");
            if (rootfiles.getLength() == 0) {
                rootfiles = containerDoc.getElementsByTagName("rootfile");
            }
            if (rootfiles.getLength() == 0) {
                log.warn("No rootfile found in container.xml");
                return Optional.empty();
            }
            String fullPath = ((Element) rootfiles.item(0)).getAttribute("full-path");
            if (fullPath.isBlank() || !ArchiveUtils.isPathSafe(fullPath)) {
                log.warn("Unusable rootfile full-path in container.xml: '{}'", fullPath);
                return Optional.empty();
            }
            Path opfPath = root.resolve(fullPath).normalize();
            if (!Files.isRegularFile(opfPath)) {
                log.warn("container.xml names a missing package document: {}", fullPath);
                return Optional.empty();
            }
            return Optional.of(opfPath);
        } catch (Exception e) {
            log.warn("Failed to read container.xml, falling back to a directory scan: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private static Optional<Element> firstElement(Document doc, String localName) {
        NodeList nodes = doc.getElementsByTagNameNS(OPF_NS, localName);
        if (nodes.getLength() == 0) {
            nodes = doc.getElementsByTagNameNS("*", localName);
        }
        return nodes.getLength() == 0 ? Optional.empty() : Optional.of((Element) nodes.item(0));
    }

    private static List<Element> childElements(Element parent, String localName) {
        List<Element> result = new ArrayList<>();
        NodeList children = parent.getChildNodes();
        for (int i = 0; i < children.getLength(); i++) {
            if (children.item(i) instanceof Element el && localName.equals(el.getLocalName())) {
                result.add(el);
            }
        }
        return result;
    }

    private static Map<String, String> remainingAttributes(Element element, String... known) {
        Map<String, String> attributes = new LinkedHashMap<>();
        NamedNodeMap map = element.getAttributes();
        outer:
        for (int i = 0; i < map.getLength(); i++) {
            Attr attr = (Attr) map.item(i);
            String name = attr.getName();
            if (name.startsWith("xmlns")) {
                continue;
            }
            for (String k : known) {
                if (k.equals(name)) {
                    continue outer;
                }
            }
            attributes.put(name, attr.getValue());
        }
        return attributes;
    }

    private static Element createSibling(Document doc, Element parent, String localName) {
        String prefix = parent.getPrefix();
        String qualifiedName = prefix == null || prefix.isEmpty() ? localName : prefix + ":" + localName;
        return doc.createElementNS(parent.getNamespaceURI(), qualifiedName);
    }

    private static String childIndent(Element parent) {
        Node first = parent.getFirstChild();
        if (first != null && first.getNodeType() == Node.TEXT_NODE && first.getNodeValue().isBlank()
                && first.getNodeValue().contains("\n")) {
            return first.getNodeValue();
        }
        return DEFAULT_CHILD_INDENT;
    }

    private static String closingIndent(Element parent) {
        Node last = parent.getLastChild();
        if (last != null && last.getNodeType() == Node.TEXT_NODE && last.getNodeValue().isBlank()
                && last.getNodeValue().contains("\n")) {
            return last.getNodeValue();
        }
        return DEFAULT_CLOSING_INDENT;
    }

    private static void clearChildren(Element element) {
        while (element.getFirstChild() != null) {
            element.removeChild(element.getFirstChild());
        }
    }
}
