package com.eainde.vendorrisk.analysis;

import com.eainde.vendorrisk.llm.CompletionClient;
import com.eainde.vendorrisk.llm.CompletionException;
import com.eainde.vendorrisk.llm.JsonResponses;
import com.eainde.vendorrisk.model.DocumentType;
import com.eainde.vendorrisk.model.Finding;
import com.eainde.vendorrisk.model.FindingCategory;
import com.eainde.vendorrisk.model.FindingType;
import com.eainde.vendorrisk.model.RiskLevel;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.BooleanSupplier;

/**
 * LLM-assisted pass. Long documents are chunked; each chunk is sent with a prompt specialised for
 * the document type and the reply is turned into findings.
 * <p>
 * A structured JSON reply yields one finding per element. A free-text reply yields a single
 * {@code ai_analysis} / {@code unclear} finding quoting the reply. A failed call yields nothing.
 */
@Slf4j
public class NarrativeAnalyzer {

    static final String OUTPUT_FORMAT = """

            Respond ONLY with a JSON array. Each element must have these fields:
              "category": one of encryption, access_control, network_security, data_protection, \
            incident_response, compliance_frameworks, privacy_compliance, data_subject_rights, \
            consent_management, soc2_compliance, iso27001, business_continuity, vendor_management
              "finding_type": one of compliant, non_compliant, missing, unclear
              "risk_level": one of low, medium, high, critical
              "confidence": number between 0 and 1
              "impact_score": integer between 1 and 10
              "description": one sentence
              "evidence": a short quote from the text
            Return [] if the text contains nothing relevant.""";

    static final String GENERAL_PROMPT = """
            You are a third-party risk analyst reviewing vendor documentation. Identify statements \
            about security controls, data protection, privacy practices, incident response and \
            compliance certifications. Flag vague or missing commitments as well as strong ones.""" + OUTPUT_FORMAT;

    static final String ATTESTATION_PROMPT = """
            You are an auditor reviewing a SOC 2 or similar attestation report. Identify the report \
            type and period, the trust services criteria in scope, control exceptions or deviations, \
            qualified opinions and complementary user entity controls. Exceptions and qualified \
            opinions are non_compliant findings.""" + OUTPUT_FORMAT;

    static final String PRIVACY_PROMPT = """
            You are a privacy counsel reviewing a privacy notice or data processing agreement. Assess \
            the legal basis for processing, data subject rights, retention periods, international \
            transfer safeguards, sub-processor disclosure and breach notification commitments \
            under GDPR and CCPA.""" + OUTPUT_FORMAT;

    private static final int FALLBACK_EVIDENCE_CHARS = 500;

    private final TextChunker chunker;
    private final ObjectMapper objectMapper;

    public NarrativeAnalyzer(TextChunker chunker, ObjectMapper objectMapper) {
        this.chunker = chunker;
        this.objectMapper = objectMapper;
    }

    public List<Finding> analyze(String text, DocumentType type, CompletionClient completion, BooleanSupplier cancelled) {
        List<TextChunk> chunks = chunker.chunk(text);
        String systemPrompt = systemPrompt(type);
        List<Finding> findings = new ArrayList<>();
        for (TextChunk chunk : chunks) {
            if (cancelled.getAsBoolean()) {
                log.info("Narrative analysis cancelled before {}", chunk);
                break;
            }
            String response;
            try {
                response = completion.complete(systemPrompt, userPrompt(type, chunk));
            } catch (CompletionException e) {
                log.warn("Completion failed for {} of {}: {}", chunk, type.label(), e.getMessage());
                continue;
            }
            findings.addAll(parse(response, type));
        }
        return findings;
    }

    static String systemPrompt(DocumentType type) {
        switch (type) {
            case ATTESTATION_REPORT:
                return ATTESTATION_PROMPT;
            case PRIVACY_POLICY:
            case DATA_PROCESSING_AGREEMENT:
                return PRIVACY_PROMPT;
            default:
                return GENERAL_PROMPT;
        }
    }

    static String userPrompt(DocumentType type, TextChunk chunk) {
        StringBuilder sb = new StringBuilder();
        sb.append("Document type: ").append(type.label()).append('\n');
        if (chunk.totalChunks() > 1) {
            sb.append("Part ").append(chunk.chunkIndex() + 1).append(" of ").append(chunk.totalChunks()).append('\n');
        }
        sb.append("\n---\n").append(chunk.text()).append("\n---");
        return sb.toString();
    }

    List<Finding> parse(String response, DocumentType type) {
        if (response == null || response.isBlank()) {
            return List.of();
        }
        try {
            Optional<JsonNode> array = JsonResponses.array(objectMapper, response, "findings");
            if (array.isPresent()) {
                List<Finding> findings = new ArrayList<>();
                for (JsonNode node : array.get()) {
                    if (node.isObject()) {
                        findings.add(toFinding(node));
                    }
                }
                if (!findings.isEmpty() || array.get().isEmpty()) {
                    return findings;
                }
            }
        } catch (JsonProcessingException e) {
            log.debug("Reply is not JSON, keeping it as free text: {}", e.getOriginalMessage());
        }
        return List.of(freeText(response, type));
    }

    private Finding toFinding(JsonNode node) {
        return Finding.builder()
                .category(FindingCategory.normalize(node.path("category").asText(null)))
                .type(FindingType.parse(node.path("finding_type").asText(node.path("type").asText(null))))
                .riskLevel(RiskLevel.parse(node.path("risk_level").asText(null), RiskLevel.MEDIUM))
                .confidence(node.path("confidence").asDouble(0.7))
                .impact(node.path("impact_score").asInt(node.path("impact").asInt(5)))
                .description(node.path("description").asText(""))
                .evidence(node.path("evidence").asText(""))
                .build();
    }

    private Finding freeText(String response, DocumentType type) {
        String trimmed = response.strip();
        return Finding.builder()
                .category(FindingCategory.AI_ANALYSIS)
                .type(FindingType.UNCLEAR)
                .riskLevel(RiskLevel.MEDIUM)
                .confidence(0.7)
                .impact(5)
                .description("AI analysis of " + type.label())
                .evidence(trimmed.length() > FALLBACK_EVIDENCE_CHARS
                        ? trimmed.substring(0, FALLBACK_EVIDENCE_CHARS) : trimmed)
                .build();
    }
}
