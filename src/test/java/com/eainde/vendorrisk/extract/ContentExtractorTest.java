package com.eainde.vendorrisk.extract;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDDocumentInformation;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class ContentExtractorTest {

    private final ContentExtractor extractor = new ContentExtractor();

    @Nested
    @DisplayName("HTML")
    class Html {

        @Test
        @DisplayName("should take the title and drop navigation chrome")
        void titleAndBody() {
            String html = """
                    <html><head><title> Acme Security </title><style>.x{}</style></head>
                    <body><nav>Home | Products</nav>
                    <main><p>All data is encrypted at rest.</p></main>
                    <footer>Copyright Acme</footer><script>track()</script></body></html>""";

            ExtractedContent content = extractor.fromHtml(html, "https://acme.com/security");

            assertThat(content.title()).isEqualTo("Acme Security");
            assertThat(content.text()).contains("All data is encrypted at rest.");
            assertThat(content.text()).doesNotContain("Products", "Copyright", "track()");
            assertThat(content.contentType()).isEqualTo(ContentExtractor.HTML);
        }

        @Test
        @DisplayName("should fall back to the first heading when there is no title")
        void headingAsTitle() {
            ExtractedContent content = extractor.fromHtml(
                    "<html><body><h1>Privacy Notice</h1><p>We respect your privacy.</p></body></html>", "");

            assertThat(content.title()).isEqualTo("Privacy Notice");
        }

        @Test
        @DisplayName("should resolve relative links and ignore non-http ones")
        void links() {
            String html = """
                    <a href="/privacy">Privacy</a>
                    <a href="mailto:security@acme.com">Mail</a>
                    <a href="https://cdn.acme.com/soc2.pdf">SOC 2</a>""";

            List<PageLink> links = extractor.links(html, "https://acme.com/trust");

            assertThat(links).extracting(PageLink::url)
                    .containsExactly("https://acme.com/privacy", "https://cdn.acme.com/soc2.pdf");
        }

        @Test
        @DisplayName("should keep paragraphs and list items on their own lines")
        void blockStructure() {
            String html = """
                    <html><body>
                    <h2>Data Security</h2>
                    <p>All data is   encrypted
                    at rest.</p>
                    <p>Access is reviewed <b>quarterly</b>.<br>Reviews are logged.</p>
                    <ul><li>SOC 2 Type II</li><li>ISO 27001</li></ul>
                    </body></html>""";

            ExtractedContent content = extractor.fromHtml(html, "https://acme.com/security");

            assertThat(content.text()).isEqualTo("""
                    Data Security

                    All data is encrypted at rest.

                    Access is reviewed quarterly.
                    Reviews are logged.

                    SOC 2 Type II
                    ISO 27001""");
        }
    }

    @Nested
    @DisplayName("Character sets")
    class Charsets {

        private static final String LATIN_PAGE =
                "<html><head><title>Sécurité</title></head><body><p>Données chiffrées.</p></body></html>";

        @Test
        @DisplayName("should decode HTML with the charset the server declares")
        void declaredCharset() {
            byte[] body = LATIN_PAGE.getBytes(StandardCharsets.ISO_8859_1);

            Optional<ExtractedContent> content = extractor.extract(body, "text/html", "ISO-8859-1",
                    "https://acme.fr/securite");

            assertThat(content).get().satisfies(c -> {
                assertThat(c.title()).isEqualTo("Sécurité");
                assertThat(c.text()).isEqualTo("Données chiffrées.");
            });
        }

        @Test
        @DisplayName("should detect the charset from a meta tag when the server declares none")
        void metaCharset() {
            byte[] body = ("<html><head><meta charset=\"ISO-8859-1\"><title>Sécurité</title></head>"
                    + "<body><p>Données chiffrées.</p></body></html>").getBytes(StandardCharsets.ISO_8859_1);

            Optional<ExtractedContent> content = extractor.extract(body, "text/html", null,
                    "https://acme.fr/securite");

            assertThat(content).get().satisfies(c -> assertThat(c.text()).isEqualTo("Données chiffrées."));
        }

        @Test
        @DisplayName("should fall back to UTF-8 for an unknown declared charset")
        void unknownCharset() {
            byte[] body = LATIN_PAGE.getBytes(StandardCharsets.UTF_8);

            Optional<ExtractedContent> content = extractor.extract(body, "text/html", "x-no-such-charset",
                    "https://acme.fr/securite");

            assertThat(content).get().satisfies(c -> assertThat(c.title()).isEqualTo("Sécurité"));
        }
    }

    @Nested
    @DisplayName("Type detection")
    class TypeDetection {

        @Test
        @DisplayName("should detect HTML from the body when the server sends no content type")
        void sniffHtml() {
            byte[] body = "<!DOCTYPE html><html><body>x</body></html>".getBytes(StandardCharsets.UTF_8);

            assertThat(ContentExtractor.detectType(body, "", "https://acme.com/page"))
                    .isEqualTo(ContentExtractor.HTML);
        }

        @Test
        @DisplayName("should reject unsupported media types")
        void unsupported() {
            Optional<ExtractedContent> content = extractor.extract(new byte[]{1, 2, 3}, "image/png",
                    "https://acme.com/logo.png");

            assertThat(content).isEmpty();
        }

        @Test
        @DisplayName("should decode plain text and name it after the file")
        void plainText() {
            Optional<ExtractedContent> content = extractor.extract(
                    "Incident   response\tplan".getBytes(StandardCharsets.UTF_8), "text/plain",
                    "https://acme.com/ir-plan.txt");

            assertThat(content).get().satisfies(c -> {
                assertThat(c.text()).isEqualTo("Incident response plan");
                assertThat(c.title()).isEqualTo("ir-plan.txt");
            });
        }
    }

    @Nested
    @DisplayName("PDF")
    class Pdf {

        @Test
        @DisplayName("should extract text and the document title")
        void extractsPdf() throws IOException {
            byte[] pdf = pdf("Acme SOC 2 Report", "The auditor issued an unqualified opinion.");

            Optional<ExtractedContent> content = extractor.extract(pdf, "application/octet-stream",
                    "https://acme.com/download?id=7");

            assertThat(content).get().satisfies(c -> {
                assertThat(c.contentType()).isEqualTo(ContentExtractor.PDF);
                assertThat(c.title()).isEqualTo("Acme SOC 2 Report");
                assertThat(c.text()).contains("unqualified opinion");
            });
        }

        @Test
        @DisplayName("should return nothing for a corrupt PDF")
        void corrupt() {
            byte[] body = "%PDF-1.7 not really a pdf".getBytes(StandardCharsets.UTF_8);

            assertThat(extractor.extract(body, "application/pdf", "https://acme.com/broken.pdf")).isEmpty();
        }

        private byte[] pdf(String title, String line) throws IOException {
            try (PDDocument doc = new PDDocument(); ByteArrayOutputStream out = new ByteArrayOutputStream()) {
                PDPage page = new PDPage();
                doc.addPage(page);
                try (PDPageContentStream stream = new PDPageContentStream(doc, page)) {
                    stream.beginText();
                    stream.setFont(new PDType1Font(Standard14Fonts.FontName.HELVETICA), 12);
                    stream.newLineAtOffset(72, 700);
                    stream.showText(line);
                    stream.endText();
                }
                PDDocumentInformation info = new PDDocumentInformation();
                info.setTitle(title);
                doc.setDocumentInformation(info);
                doc.save(out);
                return out.toByteArray();
            }
        }
    }
}
