package com.eainde.vendorrisk.extract;

/**
 * An outbound link scraped from a page.
 *
 * @param url  absolute URL
 * @param text anchor text, trimmed
 */
public record PageLink(String url, String text) {
}
