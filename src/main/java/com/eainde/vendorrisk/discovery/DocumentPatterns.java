package com.eainde.vendorrisk.discovery;

import com.eainde.vendorrisk.model.DocumentType;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Per-document-type regex table used to classify link text, URLs and page titles.
 * Types are tested in declaration order; the first type with a matching pattern wins.
 */
public final class DocumentPatterns {

    private static final Map<DocumentType, List<Pattern>> TABLE = new LinkedHashMap<>();

    static {
        TABLE.put(DocumentType.ATTESTATION_REPORT, compile(
                "soc\\s*-?\\s*2", "soc\\s*ii\\b", "service\\s+organi[sz]ation\\s+control",
                "ssae\\s*-?\\s*18", "type\\s*ii\\b", "iso\\s*/?\\s*(iec\\s*)?27001"));
        TABLE.put(DocumentType.DATA_PROCESSING_AGREEMENT, compile(
                "data\\s*-?\\s*processing\\s*-?\\s*(agreement|addendum)", "\\bdpa\\b"));
        TABLE.put(DocumentType.PRIVACY_POLICY, compile(
                "privacy\\s*-?\\s*polic(y|ies)", "privacy\\s*-?\\s*statement", "privacy\\s*-?\\s*notice",
                "data\\s*-?\\s*protection\\s*-?\\s*policy"));
        TABLE.put(DocumentType.INCIDENT_RESPONSE, compile(
                "incident\\s*-?\\s*response", "breach\\s*-?\\s*notification", "security\\s*-?\\s*incident"));
        TABLE.put(DocumentType.SECURITY_POLICY, compile(
                "security\\s*-?\\s*polic(y|ies)", "information\\s*-?\\s*security", "cybersecurity",
                "security\\s*-?\\s*overview"));
    }

    private DocumentPatterns() {
    }

    /**
     * Classifies free text such as {@code "<link text> <url>"}.
     */
    public static Optional<DocumentType> classify(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        String lower = text.toLowerCase(Locale.ROOT);
        for (Map.Entry<DocumentType, List<Pattern>> entry : TABLE.entrySet()) {
            for (Pattern p : entry.getValue()) {
                if (p.matcher(lower).find()) {
                    return Optional.of(entry.getKey());
                }
            }
        }
        return Optional.empty();
    }

    /**
     * Like {@link #classify(String)} but falls back to {@link DocumentType#OTHER} for PDF links,
     * which are usually worth reading even when their name says little.
     */
    public static Optional<DocumentType> classifyLink(String linkText, String url) {
        Optional<DocumentType> type = classify(linkText + " " + url);
        if (type.isPresent()) {
            return type;
        }
        String path = url.toLowerCase(Locale.ROOT);
        int query = path.indexOf('?');
        if (query >= 0) path = path.substring(0, query);
        return path.endsWith(".pdf") ? Optional.of(DocumentType.OTHER) : Optional.empty();
    }

    private static List<Pattern> compile(String... regexes) {
        return Arrays.stream(regexes)
                .map(r -> Pattern.compile(r, Pattern.CASE_INSENSITIVE))
                .toList();
    }
}
