package org.crosspress.service.stylesheet;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.crosspress.config.AppProperties;
import org.crosspress.exception.EpubError;
import org.crosspress.exception.ProcessingWarning;
import org.crosspress.exception.WarningType;
import org.crosspress.service.opf.ManifestItem;
import org.crosspress.service.opf.PackageDocument;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class StylesheetService {

    static final String STYLESHEET_FILE = "stylesheet.css";
    static final String CSS_MEDIA_TYPE = "text/css";

    private final AppProperties appProperties;

    /**
     * Copies the configured device stylesheet over the package's stylesheet.css.
     *
     * @return true if a stylesheet was written
     */
    public boolean replaceStylesheet(PackageDocument pkg, List<ProcessingWarning> warnings) {
        String configured = appProperties.getProcessor().getStylesheet();
        if (StringUtils.isBlank(configured)) {
            log.debug("No replacement stylesheet configured, skipping");
            return false;
        }

        Path source = Path.of(configured.trim());
        if (!Files.isRegularFile(source) || !Files.isReadable(source)) {
            log.warn("CSS file not found: {}", source);
            warnings.add(ProcessingWarning.of(WarningType.STYLESHEET, "replacement stylesheet not found", source));
            return false;
        }

        log.info("Updating stylesheet...");
        Path target = pkg.getDirectory().resolve(STYLESHEET_FILE);
        try {
            Files.copy(source, target, StandardCopyOption.REPLACE_EXISTING);
            log.debug("  CSS size: {} bytes", Files.size(target));
        } catch (IOException e) {
            throw EpubError.CONTAINER_IO_ERROR.createException(e, target, "cannot write stylesheet: " + e.getMessage());
        }

        if (pkg.findByHref(STYLESHEET_FILE).isEmpty()) {
            String id = pkg.uniqueId("stylesheet");
            pkg.addManifestItem(ManifestItem.builder()
                    .id(id)
                    .href(STYLESHEET_FILE)
                    .mediaType(CSS_MEDIA_TYPE)
                    .build());
            log.debug("  Registered {} in the manifest as '{}'", STYLESHEET_FILE, id);
        }
        return true;
    }
}
