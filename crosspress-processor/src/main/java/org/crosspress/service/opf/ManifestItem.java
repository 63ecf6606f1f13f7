package org.crosspress.service.opf;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ManifestItem {

    private static final Pattern WHITESPACE_PATTERN = Pattern.compile("\\s+");

    private String id;
    private String href;
    private String mediaType;
    private String properties;

    /**
     * Remaining attributes (fallback, media-overlay, ...) in document order.
     */
    @Builder.Default
    private Map<String, String> attributes = new LinkedHashMap<>();

    public boolean hasProperty(String property) {
        if (properties == null || properties.isBlank()) {
            return false;
        }
        return Arrays.asList(WHITESPACE_PATTERN.split(properties.trim())).contains(property);
    }

    public boolean isImage() {
        return mediaType != null && mediaType.toLowerCase().startsWith("image/");
    }
}
