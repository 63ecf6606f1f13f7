package org.crosspress.service.navigation;

import org.crosspress.service.opf.PackageDocument;
import org.crosspress.service.opf.PackageDocumentService;
import org.crosspress.service.title.TitleShortener;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.function.UnaryOperator;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class NavDocumentLabelRewriterTest {

    private static final String NAV = """
            <?xml version="1.0" encoding="UTF-8"?>
            <html xmlns="http://www.w3.org/1999/xhtml" xmlns:epub="http://www.idpf.org/2007/ops">
            <head><title>Contents</title></head>
            <body>
              <nav epub:type="toc" id="toc">
                <ol>
                  <li><a href="index.xhtml">Index</a></li>
                  <li><a href="markets.xhtml">Markets</a>
                    <ol>
                      <li><a href="a1.xhtml">Fed Hikes Rates - Bloomberg Markets Wrap</a></li>
                      <li><a href="a2.xhtml">A Very Long Article Title That Exceeds The Fifty Character Limit For Display</a></li>
                    </ol>
                  </li>
                  <li><span>Opinion</span>
                    <ol><li><a href="a3.xhtml">Short Title</a></li></ol>
                  </li>
                </ol>
              </nav>
              <nav epub:type="landmarks" hidden="">
                <ol><li><a epub:type="bodymatter" href="a1.xhtml">Start - Bloomberg</a></li></ol>
              </nav>
            </body>
            </html>
            """;

    @TempDir
    Path tempDir;

    private final NavDocumentLabelRewriter rewriter = new NavDocumentLabelRewriter();
    private final UnaryOperator<String> shorten = new TitleShortener(List.of("Bloomberg"), 50)::shorten;

    @Test
    void rewritesAnchorLabelsAndKeepsHrefs() throws Exception {
        Path nav = Files.writeString(tempDir.resolve("nav.xhtml"), NAV, StandardCharsets.UTF_8);

        NavigationRewriteResult result = rewriter.rewrite(nav, shorten);

        String xhtml = Files.readString(nav, StandardCharsets.UTF_8);
        assertThat(result.getLabelsRewritten()).isEqualTo(3);
        assertThat(xhtml)
                .contains("<a href=\"a1.xhtml\">Fed Hikes Rates</a>")
                .contains("<a href=\"a2.xhtml\">A Very Long Article Title That Exceeds The...</a>")
                .contains("<a href=\"a3.xhtml\">Short Title</a>")
                .contains(">Start</a>")
                .contains("epub:type=\"toc\"")
                .contains("xmlns:epub=\"http://www.idpf.org/2007/ops\"");
    }

    @Test
    void reportsSectionsFromTocNav() throws Exception {
        Path nav = Files.writeString(tempDir.resolve("nav.xhtml"), NAV, StandardCharsets.UTF_8);

        NavigationRewriteResult result = rewriter.rewrite(nav, shorten);

        assertThat(result.getSections()).containsExactly("Markets", "Opinion");
    }

    @Test
    void unchangedDocumentIsNotRewritten() throws Exception {
        String plain = """
                <html xmlns="http://www.w3.org/1999/xhtml"><body>
                <nav><ol><li><a href="a.xhtml">Short Title</a></li></ol></nav>
                </body></html>
                """;
        Path nav = Files.writeString(tempDir.resolve("nav.xhtml"), plain, StandardCharsets.UTF_8);

        NavigationRewriteResult result = rewriter.rewrite(nav, shorten);

        assertThat(result.getLabelsSeen()).isEqualTo(1);
        assertThat(result.getLabelsRewritten()).isZero();
        assertThat(nav).hasContent(plain);
    }

    @Test
    void documentWithoutNavFails() throws IOException {
        Path nav = Files.writeString(tempDir.resolve("nav.xhtml"), "<html><body><p>nothing</p></body></html>");

        assertThatThrownBy(() -> rewriter.rewrite(nav, shorten))
                .isInstanceOf(NavigationRewriteException.class)
                .hasMessageContaining("no nav element");
    }

    @Test
    void locatesNavThroughManifestProperty() throws IOException {
        Path opf = tempDir.resolve("OPS/package.opf");
        Files.createDirectories(opf.getParent().resolve("xhtml"));
        Files.writeString(opf.getParent().resolve("xhtml/toc.xhtml"), NAV, StandardCharsets.UTF_8);
        Files.writeString(opf, """
                <package xmlns="http://www.idpf.org/2007/opf" version="3.0">
                  <manifest>
                    <item id="toc" href="xhtml/toc.xhtml" media-type="application/xhtml+xml" properties="nav"/>
                  </manifest>
                  <spine><itemref idref="toc"/></spine>
                </package>
                """, StandardCharsets.UTF_8);
        PackageDocument pkg = new PackageDocumentService().parse(opf);

        assertThat(rewriter.locate(pkg)).contains(opf.getParent().resolve("xhtml/toc.xhtml").toAbsolutePath().normalize());
    }

    @Test
    void fallsBackToConventionalFileName() throws IOException {
        Path opf = tempDir.resolve("content.opf");
        Files.writeString(tempDir.resolve("nav.xhtml"), NAV, StandardCharsets.UTF_8);
        Files.writeString(opf, """
                <package xmlns="http://www.idpf.org/2007/opf" version="3.0">
                  <manifest><item id="a" href="a.xhtml" media-type="application/xhtml+xml"/></manifest>
                  <spine><itemref idref="a"/></spine>
                </package>
                """, StandardCharsets.UTF_8);
        PackageDocument pkg = new PackageDocumentService().parse(opf);

        assertThat(rewriter.locate(pkg)).contains(tempDir.resolve("nav.xhtml").toAbsolutePath());
    }
}
