package com.eainde.vendorrisk.analysis;

import com.eainde.vendorrisk.config.VendorRiskProperties;
import com.eainde.vendorrisk.llm.CompletionClient;
import com.eainde.vendorrisk.model.DocumentType;
import com.eainde.vendorrisk.model.Finding;
import com.eainde.vendorrisk.model.FindingCategory;
import com.eainde.vendorrisk.model.FindingType;
import com.eainde.vendorrisk.model.RetrievedDocument;
import com.eainde.vendorrisk.model.RiskLevel;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.BooleanSupplier;
import java.util.function.Supplier;

/**
 * Turns document text into findings.
 *
 * <h3>Passes, all executed and merged:</h3>
 * <ol>
 *   <li>pattern pass over the indicator table (deterministic)</li>
 *   <li>narrative pass through the language model (best effort)</li>
 *   <li>attestation-report or privacy-notice specialisation, by document type</li>
 *   <li>missing expected elements checklist, by document type</li>
 * </ol>
 * Each pass is isolated: if one throws, it is logged and the others still contribute. The engine
 * never throws for bad input; blank text produces one {@code unclear} finding.
 */
public class ComplianceAnalysisEngine {

    private static final Logger log = LoggerFactory.getLogger(ComplianceAnalysisEngine.class);

    private static final Map<RiskLevel, Double> LEVEL_SCORES = Map.of(
            RiskLevel.LOW, 25.0, RiskLevel.MEDIUM, 50.0, RiskLevel.HIGH, 75.0, RiskLevel.CRITICAL, 100.0);

    private static final Map<FindingType, Double> TYPE_WEIGHTS = Map.of(
            FindingType.COMPLIANT, 0.2, FindingType.UNCLEAR, 0.6,
            FindingType.NON_COMPLIANT, 0.9, FindingType.MISSING, 1.0);

    private final VendorRiskProperties.Analysis settings;
    private final PatternAnalyzer patternAnalyzer = new PatternAnalyzer();
    private final AttestationReportAnalyzer attestationAnalyzer = new AttestationReportAnalyzer();
    private final PrivacyNoticeAnalyzer privacyAnalyzer = new PrivacyNoticeAnalyzer();
    private final ExpectedElementsChecker elementsChecker = new ExpectedElementsChecker();
    private final NarrativeAnalyzer narrativeAnalyzer;

    public ComplianceAnalysisEngine(VendorRiskProperties.Analysis settings, ObjectMapper objectMapper) {
        this.settings = settings;
        TextChunker chunker = TextChunker.builder()
                .threshold(settings.getChunkingThreshold())
                .chunkSize(settings.getChunkSize())
                .overlap(settings.getChunkOverlap())
                .build();
        this.narrativeAnalyzer = new NarrativeAnalyzer(chunker, objectMapper);
    }

    /**
     * Deterministic passes only.
     */
    public List<Finding> analyze(String text, DocumentType type) {
        return analyze(text, type, null, () -> false);
    }

    /**
     * @param completion model for the narrative pass; {@code null} skips it
     * @param cancelled  stops the narrative pass from issuing further completions
     */
    public List<Finding> analyze(String text, DocumentType type, CompletionClient completion, BooleanSupplier cancelled) {
        DocumentType docType = type == null ? DocumentType.OTHER : type;
        if (text == null || text.isBlank()) {
            return List.of(Finding.builder()
                    .category(FindingCategory.DOCUMENT_CONTENT)
                    .type(FindingType.UNCLEAR)
                    .riskLevel(RiskLevel.MEDIUM)
                    .confidence(0.3)
                    .impact(3)
                    .description("Document contained no analyzable text")
                    .build());
        }

        List<Finding> findings = new ArrayList<>();
        run("pattern", docType, findings, () -> patternAnalyzer.analyze(text));

        if (completion != null && settings.isNarrativeEnabled()) {
            run("narrative", docType, findings, () -> narrativeAnalyzer.analyze(text, docType, completion, cancelled));
        }

        if (docType == DocumentType.ATTESTATION_REPORT) {
            run("attestation", docType, findings, () -> attestationAnalyzer.analyze(text));
        } else if (docType == DocumentType.PRIVACY_POLICY) {
            run("privacy notice", docType, findings, () -> privacyAnalyzer.analyze(text));
        }

        run("expected elements", docType, findings, () -> elementsChecker.check(text, docType));

        log.debug("{} findings for {} ({} chars)", findings.size(), docType.label(), text.length());
        return findings;
    }

    /**
     * Analyzes a retrieved document and tags every finding with its source URL.
     */
    public List<Finding> analyze(RetrievedDocument document, CompletionClient completion, BooleanSupplier cancelled) {
        List<Finding> findings = analyze(document.text(), document.type(), completion, cancelled);
        List<Finding> tagged = new ArrayList<>(findings.size());
        for (Finding f : findings) {
            tagged.add(f.withSourceUrl(document.url()));
        }
        log.info("Analyzed {} ({}): {} findings", document.url(), document.type().label(), tagged.size());
        return tagged;
    }

    /**
     * Per-document risk indicator, 0-100: the confidence-weighted mean of
     * {@code levelScore × typeWeight}. 50 when there are no findings.
     */
    public double documentRiskScore(List<Finding> findings) {
        double weighted = 0.0;
        double totalWeight = 0.0;
        for (Finding f : findings) {
            double value = LEVEL_SCORES.get(f.riskLevel()) * TYPE_WEIGHTS.get(f.type());
            weighted += value * f.confidence();
            totalWeight += f.confidence();
        }
        if (totalWeight == 0.0) {
            return 50.0;
        }
        return Math.max(0.0, Math.min(100.0, weighted / totalWeight));
    }

    private void run(String pass, DocumentType type, List<Finding> sink, Supplier<List<Finding>> body) {
        try {
            sink.addAll(body.get());
        } catch (RuntimeException e) {
            log.warn("The {} pass failed for {}: {}", pass, type.label(), e.toString(), e);
        }
    }
}
