package com.eainde.vendorrisk.extract;

import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDDocumentInformation;
import org.apache.pdfbox.text.PDFTextStripper;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.jsoup.select.NodeTraversor;
import org.jsoup.select.NodeVisitor;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Converts fetched bytes into plain text and a title.
 * <p>
 * HTML goes through jsoup with navigation chrome removed, PDF through PDFBox, plain text is decoded
 * with the declared charset or UTF-8. Anything else is unsupported and yields {@link Optional#empty()}.
 * Extracted text keeps one line per block element and a blank line after paragraphs, headings,
 * lists and tables.
 */
@Slf4j
public class ContentExtractor {

    public static final String HTML = "text/html";
    public static final String PDF = "application/pdf";
    public static final String TEXT = "text/plain";

    private static final String BOILERPLATE = "script,noscript,style,header,footer,nav,aside";

    private static final Set<String> PARAGRAPHS = Set.of("p", "h1", "h2", "h3", "h4", "h5", "h6",
            "ul", "ol", "dl", "table", "blockquote", "pre", "section", "article");

    public Optional<ExtractedContent> extract(byte[] body, String contentType, String url) {
        return extract(body, contentType, null, url);
    }

    /**
     * @param charset charset declared by the server, {@code null} if none; HTML without one is
     *                sniffed from its byte order mark and meta tags
     */
    public Optional<ExtractedContent> extract(byte[] body, String contentType, String charset, String url) {
        if (body == null || body.length == 0) {
            return Optional.empty();
        }
        String type = detectType(body, contentType, url);
        if (type == null) {
            log.debug("Unsupported content type '{}' for {}", contentType, url);
            return Optional.empty();
        }
        try {
            switch (type) {
                case HTML:
                    return Optional.of(fromHtml(parseHtml(body, charset, url)));
                case PDF:
                    return Optional.of(fromPdf(body, url));
                default:
                    String text = collapse(new String(body, charsetOrUtf8(charset)));
                    return Optional.of(new ExtractedContent(fileName(url), text, TEXT));
            }
        } catch (IOException | RuntimeException e) {
            log.warn("Extraction failed for {}: {}", url, e.toString());
            return Optional.empty();
        }
    }

    /**
     * Parses raw HTML bytes. A {@code null} charset lets jsoup detect it, falling back to UTF-8.
     */
    public Document parseHtml(byte[] body, String charset, String baseUrl) throws IOException {
        return Jsoup.parse(new ByteArrayInputStream(body), supported(charset), baseUrl == null ? "" : baseUrl);
    }

    public ExtractedContent fromHtml(String html, String baseUrl) {
        return fromHtml(Jsoup.parse(html, baseUrl == null ? "" : baseUrl));
    }

    public ExtractedContent fromHtml(Document source) {
        Document doc = source.clone();
        String title = doc.title().strip();
        if (title.isEmpty()) {
            Element h1 = doc.selectFirst("h1");
            title = h1 != null ? h1.text().strip() : "";
        }
        doc.select(BOILERPLATE).remove();
        String text = blockText(doc.body() != null ? doc.body() : doc);
        return new ExtractedContent(title, collapse(text), HTML);
    }

    /**
     * Absolute http(s) links of an HTML page with their anchor text, in document order.
     */
    public List<PageLink> links(String html, String baseUrl) {
        return links(Jsoup.parse(html, baseUrl));
    }

    public List<PageLink> links(Document doc) {
        List<PageLink> links = new ArrayList<>();
        for (Element a : doc.select("a[href]")) {
            String href = a.absUrl("href");
            if (href.isEmpty()) continue;
            String lower = href.toLowerCase(Locale.ROOT);
            if (!lower.startsWith("http://") && !lower.startsWith("https://")) continue;
            links.add(new PageLink(href, a.text().strip()));
        }
        return links;
    }

    private ExtractedContent fromPdf(byte[] body, String url) throws IOException {
        try (PDDocument doc = Loader.loadPDF(body)) {
            PDFTextStripper stripper = new PDFTextStripper();
            String text = stripper.getText(doc);
            PDDocumentInformation info = doc.getDocumentInformation();
            String title = info != null && info.getTitle() != null ? info.getTitle().strip() : "";
            if (title.isEmpty()) {
                title = fileName(url);
            }
            return new ExtractedContent(title, collapse(text), PDF);
        }
    }

    /**
     * Content-type header first, then URL extension, then magic bytes.
     */
    static String detectType(byte[] body, String contentType, String url) {
        String ct = contentType == null ? "" : contentType.toLowerCase(Locale.ROOT);
        if (ct.contains("pdf")) return PDF;
        if (ct.contains("html") || ct.contains("xhtml")) return HTML;
        if (ct.startsWith("text/plain")) return TEXT;

        String path = url == null ? "" : url.toLowerCase(Locale.ROOT);
        int query = path.indexOf('?');
        if (query >= 0) path = path.substring(0, query);
        if (path.endsWith(".pdf")) return PDF;
        if (path.endsWith(".html") || path.endsWith(".htm")) return HTML;
        if (path.endsWith(".txt")) return TEXT;

        if (body.length >= 4 && body[0] == '%' && body[1] == 'P' && body[2] == 'D' && body[3] == 'F') {
            return PDF;
        }
        if (ct.isEmpty() || ct.equals("application/octet-stream")) {
            String head = new String(body, 0, Math.min(body.length, 512), StandardCharsets.UTF_8)
                    .strip().toLowerCase(Locale.ROOT);
            if (head.startsWith("<!doctype html") || head.startsWith("<html")) return HTML;
        }
        return null;
    }

    static String blockText(Element root) {
        StringBuilder out = new StringBuilder();
        NodeTraversor.traverse(new NodeVisitor() {
            @Override
            public void head(Node node, int depth) {
                if (node instanceof TextNode) {
                    String text = ((TextNode) node).text();
                    if (!text.isBlank() || (out.length() > 0 && out.charAt(out.length() - 1) != '\n')) {
                        out.append(text);
                    }
                } else if (node instanceof Element) {
                    Element element = (Element) node;
                    if ("br".equals(element.normalName())) {
                        out.append('\n');
                    } else if (element.isBlock()) {
                        lineBreaks(out, 1);
                    }
                }
            }

            @Override
            public void tail(Node node, int depth) {
                if (node instanceof Element && ((Element) node).isBlock()) {
                    lineBreaks(out, PARAGRAPHS.contains(((Element) node).normalName()) ? 2 : 1);
                }
            }
        }, root);
        return out.toString();
    }

    private static void lineBreaks(StringBuilder out, int count) {
        if (out.length() == 0) return;
        int trailing = 0;
        for (int i = out.length() - 1; i >= 0 && out.charAt(i) == '\n'; i--) {
            trailing++;
        }
        for (; trailing < count; trailing++) {
            out.append('\n');
        }
    }

    private static String collapse(String text) {
        return text.replace('\u00A0', ' ')
                .replaceAll("[ \\t\\x0B\\f\\r]+", " ")
                .replaceAll(" *\n *", "\n")
                .replaceAll("\n{3,}", "\n\n")
                .strip();
    }

    private static Charset charsetOrUtf8(String charset) {
        String name = supported(charset);
        return name == null ? StandardCharsets.UTF_8 : Charset.forName(name);
    }

    /** The charset name if the JVM knows it, otherwise {@code null}. */
    static String supported(String charset) {
        if (charset == null || charset.isBlank()) {
            return null;
        }
        try {
            return Charset.isSupported(charset.strip()) ? charset.strip() : null;
        } catch (IllegalArgumentException e) {
            log.debug("Ignoring malformed charset '{}': {}", charset, e.getMessage());
            return null;
        }
    }

    private static String fileName(String url) {
        if (url == null) return "";
        String path = url;
        int query = path.indexOf('?');
        if (query >= 0) path = path.substring(0, query);
        int slash = path.lastIndexOf('/');
        return slash >= 0 ? path.substring(slash + 1) : path;
    }
}
