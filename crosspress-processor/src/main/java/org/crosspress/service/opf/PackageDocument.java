package org.crosspress.service.opf;

import lombok.Getter;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * In-memory model of an OPF package document.
 * <p>
 * The manifest is indexed by item id and the spine is an ordered list of entries, both
 * mutated in place while a file is processed. The parsed DOM is retained so that
 * metadata, namespace declarations and unknown markup survive serialization; the
 * manifest and spine elements are rebuilt from this model when the document is written.
 */
public class PackageDocument {

    @Getter
    private final Path path;
    private final Document document;
    private final Element manifestElement;
    private final Element spineElement;
    private final Map<String, ManifestItem> manifest = new LinkedHashMap<>();
    private final List<SpineEntry> spine = new ArrayList<>();

    PackageDocument(Path path, Document document, Element manifestElement, Element spineElement) {
        this.path = path;
        this.document = document;
        this.manifestElement = manifestElement;
        this.spineElement = spineElement;
    }

    public Path getDirectory() {
        Path parent = path.toAbsolutePath().getParent();
        return parent != null ? parent : path.toAbsolutePath();
    }

    public String getVersion() {
        return document.getDocumentElement().getAttribute("version");
    }

    public Optional<ManifestItem> getManifestItem(String id) {
        return Optional.ofNullable(manifest.get(id));
    }

    public Collection<ManifestItem> getManifestItems() {
        return Collections.unmodifiableCollection(manifest.values());
    }

    public List<SpineEntry> getSpine() {
        return Collections.unmodifiableList(spine);
    }

    public List<String> getSpineIdrefs() {
        return spine.stream().map(SpineEntry::getIdref).toList();
    }

    /**
     * Id of the NCX item named by the spine's toc attribute, if any.
     */
    public Optional<String> getTocId() {
        String toc = spineElement.getAttribute("toc");
        return toc == null || toc.isBlank() ? Optional.empty() : Optional.of(toc);
    }

    public void addManifestItem(ManifestItem item) {
        manifest.put(item.getId(), item);
    }

    public boolean removeManifestItem(String id) {
        return manifest.remove(id) != null;
    }

    public List<ManifestItem> removeManifestItemsIf(Predicate<ManifestItem> filter) {
        List<ManifestItem> removed = new ArrayList<>();
        Iterator<ManifestItem> iterator = manifest.values().iterator();
        while (iterator.hasNext()) {
            ManifestItem item = iterator.next();
            if (filter.test(item)) {
                iterator.remove();
                removed.add(item);
            }
        }
        return removed;
    }

    public Optional<ManifestItem> findFirstByMediaType(String mediaType) {
        return manifest.values().stream()
                .filter(item -> mediaType.equalsIgnoreCase(item.getMediaType()))
                .findFirst();
    }

    public Optional<ManifestItem> findFirstByProperty(String property) {
        return manifest.values().stream()
                .filter(item -> item.hasProperty(property))
                .findFirst();
    }

    public Optional<ManifestItem> findByHref(String href) {
        return manifest.values().stream()
                .filter(item -> href.equals(item.getHref()))
                .findFirst();
    }

    /**
     * Removes the first {@code count} spine entries. Manifest items are kept since the
     * documents may still be linked from navigation.
     *
     * @return the idrefs removed, in spine order; fewer than {@code count} when the spine is shorter
     */
    public List<String> removeLeadingSpineEntries(int count) {
        if (count < 0) {
            throw new IllegalArgumentException("count must not be negative: " + count);
        }
        int toRemove = Math.min(count, spine.size());
        List<SpineEntry> head = spine.subList(0, toRemove);
        List<String> removed = head.stream().map(SpineEntry::getIdref).toList();
        head.clear();
        return removed;
    }

    public String uniqueId(String base) {
        if (!manifest.containsKey(base)) {
            return base;
        }
        int suffix = 2;
        while (manifest.containsKey(base + "-" + suffix)) {
            suffix++;
        }
        return base + "-" + suffix;
    }

    public Path resolve(ManifestItem item) {
        String href = item.getHref();
        int fragment = href.indexOf('#');
        if (fragment >= 0) {
            href = href.substring(0, fragment);
        }
        String decoded = URLDecoder.decode(href.replace("+", "%2B"), StandardCharsets.UTF_8);
        return getDirectory().resolve(decoded).normalize();
    }

    Document getDocument() {
        return document;
    }

    Element getManifestElement() {
        return manifestElement;
    }

    Element getSpineElement() {
        return spineElement;
    }

    void appendSpineEntry(SpineEntry entry) {
        spine.add(entry);
    }
}
