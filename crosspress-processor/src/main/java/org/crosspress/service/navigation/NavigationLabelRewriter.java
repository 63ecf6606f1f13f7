package org.crosspress.service.navigation;

import org.crosspress.service.opf.PackageDocument;

import java.nio.file.Path;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Rewrites the human-readable labels of one kind of navigation document in place.
 * Hierarchy, hrefs and ordering are left untouched.
 */
public interface NavigationLabelRewriter {

    String getName();

    /**
     * Finds this rewriter's navigation document in the package, if the package has one.
     */
    Optional<Path> locate(PackageDocument pkg);

    NavigationRewriteResult rewrite(Path document, UnaryOperator<String> labelRewriter) throws NavigationRewriteException;
}
