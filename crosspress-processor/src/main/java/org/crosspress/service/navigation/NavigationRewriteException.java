package org.crosspress.service.navigation;

import java.nio.file.Path;

public class NavigationRewriteException extends Exception {

    public NavigationRewriteException(Path document, String message, Throwable cause) {
        super("Failed to rewrite " + document + ": " + message, cause);
    }
}
