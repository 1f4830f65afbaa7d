package com.eainde.vendorrisk.fetch;

import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Map;

/**
 * @param url         final URL after redirects
 * @param status      HTTP status code
 * @param headers     response headers, names lower-cased, first value only
 * @param contentType media type without parameters, lower-cased, may be empty
 * @param body        raw body bytes
 */
public record FetchResponse(String url, int status, Map<String, String> headers, String contentType, byte[] body) {

    public FetchResponse {
        headers = headers == null ? Map.of() : Map.copyOf(headers);
        contentType = contentType == null ? "" : contentType.toLowerCase(Locale.ROOT);
        body = body == null ? new byte[0] : body;
    }

    public boolean isSuccessful() {
        return status >= 200 && status < 300;
    }

    public boolean isHtml() {
        return contentType.contains("html");
    }

    /**
     * @return the {@code charset} parameter of the {@code Content-Type} header, or {@code null}
     */
    public String charset() {
        String header = headers.get("content-type");
        if (header == null) {
            return null;
        }
        for (String param : header.split(";")) {
            String[] pair = param.strip().split("=", 2);
            if (pair.length == 2 && pair[0].strip().equalsIgnoreCase("charset")) {
                String value = pair[1].strip().replace("\"", "").replace("'", "");
                return value.isEmpty() ? null : value;
            }
        }
        return null;
    }

    public static FetchResponse ok(String url, String contentType, String body) {
        return new FetchResponse(url, 200, Map.of("content-type", contentType), contentType,
                body.getBytes(StandardCharsets.UTF_8));
    }
}
