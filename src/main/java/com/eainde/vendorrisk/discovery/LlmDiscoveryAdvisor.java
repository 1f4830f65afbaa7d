package com.eainde.vendorrisk.discovery;

import com.eainde.vendorrisk.llm.CompletionClient;
import com.eainde.vendorrisk.llm.CompletionException;
import com.eainde.vendorrisk.llm.JsonResponses;
import com.eainde.vendorrisk.model.DiscoveryMethod;
import com.eainde.vendorrisk.model.DocumentCandidate;
import com.eainde.vendorrisk.model.DocumentType;
import com.eainde.vendorrisk.model.VendorProfile;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Asks the language model where a vendor usually publishes its compliance material.
 * Suggestions are unconfirmed: the engine probes each one before keeping it, and anything
 * outside the vendor's own domain is discarded here.
 */
@Slf4j
@RequiredArgsConstructor
public class LlmDiscoveryAdvisor {

    static final String SYSTEM_PROMPT = """
            You are a vendor security research assistant. Given a company domain, list the public URLs \
            where the company most likely publishes its compliance material: trust center, SOC 2 or ISO \
            27001 attestation pages, privacy policy, data processing agreement, security policy and \
            incident response or breach notification pages.
            Answer ONLY with a JSON array of objects with the fields "url", "title" and "type", where \
            "type" is one of attestation_report, privacy_policy, data_processing_agreement, \
            security_policy, incident_response, other. Only include URLs on the company's own domain.""";

    private static final int MAX_SUGGESTIONS = 10;

    private final ObjectMapper objectMapper;

    public List<DocumentCandidate> suggest(VendorProfile vendor, CompletionClient completion) {
        String userPrompt = "Company: " + vendor.displayName() + "\nDomain: " + vendor.domain();
        String response;
        try {
            response = completion.complete(SYSTEM_PROMPT, userPrompt);
        } catch (CompletionException e) {
            log.warn("LLM discovery unavailable for {}: {}", vendor.domain(), e.getMessage());
            return List.of();
        }

        List<DocumentCandidate> suggestions = new ArrayList<>();
        try {
            Optional<JsonNode> array = JsonResponses.array(objectMapper, response, "urls");
            if (array.isEmpty()) {
                log.warn("LLM discovery returned no JSON array for {}", vendor.domain());
                return List.of();
            }
            for (JsonNode node : array.get()) {
                String url = node.path("url").asText("");
                if (!isOnVendorDomain(url, vendor.domain())) {
                    log.debug("Ignoring off-domain suggestion {}", url);
                    continue;
                }
                DocumentType type = DocumentType.parse(node.path("type").asText(null));
                if (type == DocumentType.OTHER) {
                    type = DocumentPatterns.classify(node.path("title").asText("") + " " + url)
                            .orElse(DocumentType.OTHER);
                }
                suggestions.add(new DocumentCandidate(type, node.path("title").asText(""), url, DiscoveryMethod.LLM));
                if (suggestions.size() >= MAX_SUGGESTIONS) break;
            }
        } catch (JsonProcessingException e) {
            log.warn("Failed to parse LLM discovery response for {}", vendor.domain(), e);
            return List.of();
        }
        log.info("LLM suggested {} on-domain URLs for {}", suggestions.size(), vendor.domain());
        return suggestions;
    }

    static boolean isOnVendorDomain(String url, String domain) {
        if (url == null || url.isBlank()) return false;
        try {
            URI uri = new URI(url.strip());
            String scheme = uri.getScheme();
            String host = uri.getHost();
            if (host == null || scheme == null) return false;
            if (!scheme.equalsIgnoreCase("https") && !scheme.equalsIgnoreCase("http")) return false;
            host = host.toLowerCase(Locale.ROOT);
            return host.equals(domain) || host.endsWith("." + domain);
        } catch (URISyntaxException e) {
            return false;
        }
    }
}
