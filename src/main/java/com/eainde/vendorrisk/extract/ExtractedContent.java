package com.eainde.vendorrisk.extract;

/**
 * @param title       page or document title, empty when none was found
 * @param text        plain text with whitespace collapsed
 * @param contentType detected media type ({@code text/html}, {@code application/pdf}, {@code text/plain})
 */
public record ExtractedContent(String title, String text, String contentType) {

    public boolean isBlank() {
        return text == null || text.isBlank();
    }
}
